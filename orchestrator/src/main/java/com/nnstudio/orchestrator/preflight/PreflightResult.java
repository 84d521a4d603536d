package com.nnstudio.orchestrator.preflight;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.nnstudio.orchestrator.problem.Problem;

import java.util.List;

/**
 * Outcome of a preflight pass.
 *
 * A rejected result always has {@code chunks == 0} and at least one problem.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record PreflightResult(
        boolean       ok,
        int           chunks,
        int           uniqueRefs,
        ByteCounts    bytes,
        @JsonIgnore RefRegistry registry,
        List<Problem> problems
) {
    public PreflightResult {
        problems = problems == null ? List.of() : List.copyOf(problems);
        if (!ok && (chunks != 0 || problems.isEmpty())) {
            throw new IllegalArgumentException("rejected preflight needs chunks=0 and a problem");
        }
        if (ok && chunks < 1) {
            throw new IllegalArgumentException("accepted preflight needs at least one chunk");
        }
    }

    public static PreflightResult accepted(int chunks, RefRegistry registry) {
        return new PreflightResult(true, chunks, registry.uniqueCount(),
                new ByteCounts(registry.totalSize(), registry.compressedSize()), registry, List.of());
    }

    public static PreflightResult rejected(List<Problem> problems, RefRegistry registry) {
        return new PreflightResult(false, 0, registry.uniqueCount(),
                new ByteCounts(registry.totalSize(), registry.compressedSize()), registry, problems);
    }

    public record ByteCounts(long before, long after) {}
}
