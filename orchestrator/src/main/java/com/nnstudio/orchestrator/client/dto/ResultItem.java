package com.nnstudio.orchestrator.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/** One generated image; {@code outUrl} is a data: URL, a remote URL, or absent. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ResultItem(String id, String prompt, String outUrl) {}
