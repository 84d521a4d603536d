package com.nnstudio.orchestrator.preflight;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of deduplicating a reference pack: one entry per distinct content hash.
 */
public record RefRegistry(
        Map<String, RefRegistryEntry> entries,
        long totalSize,
        long compressedSize
) {
    public RefRegistry {
        entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    public static RefRegistry empty() {
        return new RefRegistry(Map.of(), 0, 0);
    }

    public int uniqueCount() {
        return entries.size();
    }

    public long averageCompressedSize() {
        return entries.isEmpty() ? 0 : compressedSize / entries.size();
    }
}
