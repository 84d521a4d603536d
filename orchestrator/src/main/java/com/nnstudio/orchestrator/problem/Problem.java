package com.nnstudio.orchestrator.problem;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.UUID;

/**
 * RFC 7807-shaped error value.
 *
 * This is the only error shape handed to callers of the orchestrator
 * (CLI and HTTP front ends render it as application/problem+json).
 * A fresh {@code instance} UUID is minted for every occurrence.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Problem(
        String type,
        String title,
        String detail,
        int    status,
        String instance
) {
    public static final String ABOUT_BLANK = "about:blank";

    public Problem {
        if (status < 400 || status > 599) {
            throw new IllegalArgumentException("Problem status must be in [400,599], got " + status);
        }
        if (type == null || type.isBlank()) type = ABOUT_BLANK;
        if (instance == null || instance.isBlank()) instance = UUID.randomUUID().toString();
    }

    public static Problem of(String type, String title, String detail, int status) {
        return new Problem(type, title, detail, status, UUID.randomUUID().toString());
    }

    public static Problem of(String title, String detail, int status) {
        return of(ABOUT_BLANK, title, detail, status);
    }
}
