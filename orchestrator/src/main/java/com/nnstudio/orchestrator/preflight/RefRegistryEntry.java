package com.nnstudio.orchestrator.preflight;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Locale;

/** One distinct reference image, keyed by the SHA-256 of its content. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RefRegistryEntry(
        String  id,
        String  hash,
        String  path,
        long    size,
        boolean compressed,
        Long    compressedSize,
        String  mimeType
) {
    /** Bytes this reference contributes after optional compression. */
    public long effectiveSize() {
        return compressed && compressedSize != null ? compressedSize : size;
    }

    static String idFor(String hash) {
        return "ref_" + hash.substring(0, 12);
    }

    static String mimeTypeFor(String path) {
        return path.toLowerCase(Locale.ROOT).endsWith(".png") ? "image/png" : "image/jpeg";
    }
}
