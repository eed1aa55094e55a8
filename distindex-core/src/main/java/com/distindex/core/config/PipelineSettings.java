package com.distindex.core.config;

import java.util.List;

/**
 * Validated runtime settings for one pipeline run.
 *
 * @param batchSize rows per committed batch; must be positive
 * @param cacheSize SQLite page cache size; must be positive
 * @param excludedPrefixes umbrella distribution name prefixes, matched case-insensitively
 * @param keepStagingTables keep the {@code t_*} staging tables
 * @param vacuum run {@code VACUUM} after loading
 * @param analyze run {@code ANALYZE} after loading
 */
public record PipelineSettings(
    int batchSize,
    int cacheSize,
    List<String> excludedPrefixes,
    boolean keepStagingTables,
    boolean vacuum,
    boolean analyze
) {
    public static final int DEFAULT_BATCH_SIZE = 100;
    public static final int DEFAULT_CACHE_SIZE = 100_000;
    public static final List<String> DEFAULT_EXCLUDED_PREFIXES = List.of("Task-", "Acme-");

    /**
     * Compact constructor with validation.
     */
    public PipelineSettings {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0");
        }
        if (cacheSize <= 0) {
            throw new IllegalArgumentException("cacheSize must be > 0");
        }
        excludedPrefixes = excludedPrefixes == null ? List.of() : List.copyOf(excludedPrefixes);
    }

    /**
     * Returns the default settings.
     *
     * @return defaults
     */
    public static PipelineSettings defaults() {
        return new PipelineSettings(DEFAULT_BATCH_SIZE, DEFAULT_CACHE_SIZE, DEFAULT_EXCLUDED_PREFIXES,
            false, true, true);
    }

    public PipelineSettings withBatchSize(int newBatchSize) {
        return new PipelineSettings(newBatchSize, cacheSize, excludedPrefixes, keepStagingTables, vacuum, analyze);
    }

    public PipelineSettings withKeepStagingTables(boolean keep) {
        return new PipelineSettings(batchSize, cacheSize, excludedPrefixes, keep, vacuum, analyze);
    }
}
