package com.nnstudio.orchestrator.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ResultsResponse(List<ResultItem> results, List<JsonNode> problems) {

    public ResultsResponse {
        results  = results  == null ? List.of() : List.copyOf(results);
        problems = problems == null ? List.of() : List.copyOf(problems);
    }
}
