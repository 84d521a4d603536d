package com.nnstudio.orchestrator.preflight;

/**
 * Size and count limits applied before a job leaves the process.
 * Loaded once from {@code nn.preflight.*}; per-request overrides go
 * through {@link #withOverrides}.
 */
public record PreflightBudgets(
        long    jobMaxBytes,
        long    itemMaxBytes,
        int     maxRefsPerItem,
        int     maxImagesPerJob,
        boolean compress,
        boolean split
) {
    public static final long MIB = 1024L * 1024L;

    /** Images generated per prompt row when checking the image budget. */
    public static final int IMAGES_PER_ROW = 3;

    public static PreflightBudgets defaults() {
        return new PreflightBudgets(200 * MIB, 8 * MIB, 8, 2000, true, true);
    }

    public PreflightBudgets withOverrides(Boolean compressOverride, Boolean splitOverride) {
        return new PreflightBudgets(jobMaxBytes, itemMaxBytes, maxRefsPerItem, maxImagesPerJob,
                compressOverride != null ? compressOverride : compress,
                splitOverride    != null ? splitOverride    : split);
    }
}
