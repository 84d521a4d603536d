package com.nnstudio.orchestrator.client.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.nnstudio.orchestrator.model.PromptRow;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record BatchRow(String prompt, String sourceImage, Integer seed, List<String> tags) {

    public static BatchRow from(PromptRow row, String prompt) {
        return new BatchRow(prompt, row.sourceImage(), row.seed(), List.copyOf(row.tags()));
    }
}
