package com.nnstudio.orchestrator.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/** {@code status} is "canceled" or "not_found". */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CancelResponse(String status) {

    public static final String CANCELED  = "canceled";
    public static final String NOT_FOUND = "not_found";

    public boolean isCanceled() {
        return CANCELED.equals(status);
    }
}
