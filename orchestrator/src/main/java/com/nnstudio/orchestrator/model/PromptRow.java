package com.nnstudio.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * One prompt produced by the upstream remix step (one line of prompts.jsonl).
 * Read-only to the orchestrator.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PromptRow(
        String      prompt,
        String      sourceImage,
        Set<String> tags,
        Integer     seed,
        @JsonProperty("_meta") Meta meta
) {
    public static final int MAX_PROMPT_LENGTH = 2000;

    public PromptRow {
        // ordered set: keep the remix order, drop duplicates
        tags = tags == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(tags));
    }

    public static PromptRow of(String prompt) {
        return new PromptRow(prompt, null, Set.of(), null, null);
    }

    /** True when the prompt is non-blank and at most 2000 characters. */
    public boolean isValid() {
        return prompt != null && !prompt.isBlank() && prompt.length() <= MAX_PROMPT_LENGTH;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Meta(String idempotencyKey, Double hashDistance, Boolean flagged) {}
}
