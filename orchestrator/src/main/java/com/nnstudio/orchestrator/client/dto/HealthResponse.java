package com.nnstudio.orchestrator.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record HealthResponse(boolean ok, String timestamp, boolean apiKeyConfigured) {}
