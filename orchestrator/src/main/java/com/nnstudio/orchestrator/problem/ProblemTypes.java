package com.nnstudio.orchestrator.problem;

/**
 * Problem {@code type} identifiers used across the orchestrator.
 */
public final class ProblemTypes {

    private ProblemTypes() {}

    public static final String PREFLIGHT_BUDGET_EXCEEDED = "preflight/budget-exceeded";
    public static final String PREFLIGHT_ITEM_TOO_LARGE  = "preflight/item-too-large";
    public static final String PREFLIGHT_JOB_TOO_LARGE   = "preflight/job-too-large";
    public static final String PREFLIGHT_ERROR           = "preflight/error";

    public static final String REFS_LOAD_ERROR           = "refs/load-error";
    public static final String PROMPT_INVALID            = "prompt/invalid";
    public static final String REQUEST_INVALID           = "request/invalid";
    public static final String REQUEST_IN_FLIGHT         = "request/in-flight";

    public static final String PROVIDER_CONFIG_MISSING   = "provider/config-missing";
    public static final String PROVIDER_MODEL_UNHEALTHY  = "provider/model-unhealthy";
    public static final String PROVIDER_UNAVAILABLE      = "provider/unavailable";
    public static final String PROVIDER_UNKNOWN          = "provider/unknown";

    public static final String BATCH_REMOTE_ERROR        = "batch/remote-error";
    public static final String BATCH_POLL_LIMIT          = "batch/poll-limit-exceeded";
    public static final String BATCH_ITEM_MISSING        = "batch/item-missing-image";
    public static final String BATCH_ITEM_REMOTE_URL     = "batch/item-remote-url";
    public static final String BATCH_ITEM_INVALID_ID     = "batch/item-invalid-id";
    public static final String BATCH_ITEM_FAILED         = "batch/item-failed";

    public static final String RENDER_ITEM_FAILED        = "render/item-failed";

    public static final String STYLE_GUARD_REJECTED      = "style-guard/rejected";
    public static final String PROBE_ERROR               = "probe/error";
    public static final String INTERNAL                  = "internal/error";
}
