package com.nnstudio.orchestrator.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.nnstudio.orchestrator.model.JobStatus;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record PollResponse(JobStatus status, Integer completed, Integer total, List<JsonNode> errors) {

    public PollResponse {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }
}
