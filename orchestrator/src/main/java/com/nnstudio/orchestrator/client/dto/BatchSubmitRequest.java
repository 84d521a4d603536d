package com.nnstudio.orchestrator.client.dto;

import java.util.List;

/** POST /batch/submit body. {@code styleOnly} is always true for this orchestrator. */
public record BatchSubmitRequest(
        List<BatchRow> rows,
        int            variants,
        boolean        styleOnly,
        List<String>   styleRefs
) {}
