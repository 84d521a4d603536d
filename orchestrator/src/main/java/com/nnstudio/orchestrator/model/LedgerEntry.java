package com.nnstudio.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Map;

/**
 * One line of the append-only operations ledger (manifest.jsonl).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LedgerEntry(
        String              id,
        Instant             timestamp,
        String              operation,
        String              input,
        String              output,
        String              status,
        Map<String, Object> metadata
) {
    public static final String SUCCESS = "success";
    public static final String FAILED  = "failed";
}
