package com.distindex.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Root configuration for an index generation run.
 *
 * <p>Loaded from {@code distindex.yaml}. Every section and every value is
 * optional; missing values fall back to {@link PipelineSettings#defaults()}.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * store:
 *   path: "./cpandb.sqlite"
 *   batchSize: 100
 *   cacheSize: 100000
 *
 * extracts:
 *   index: "./sources/cpandb.sql"
 *   meta: "./sources/cpanmeta.sqlite"
 *   uploads: "./sources/uploads.sqlite"
 *   testers: "./sources/release.sqlite"
 *   rt: "./sources/rt.sqlite"
 *   ratings: "./sources/all_ratings.csv"
 *
 * metrics:
 *   excludedPrefixes:
 *     - "Task-"
 *     - "Acme-"
 *
 * output:
 *   keepStagingTables: false
 *   vacuum: true
 *   analyze: true
 * }</pre>
 *
 * @param store store configuration
 * @param extracts source extract locations
 * @param metrics graph metric configuration
 * @param output post-load configuration
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record IndexConfig(
    @JsonProperty("store") StoreConfig store,
    @JsonProperty("extracts") ExtractsConfig extracts,
    @JsonProperty("metrics") MetricsConfig metrics,
    @JsonProperty("output") OutputConfig output
) {
    /**
     * Default store file name.
     */
    public static final String DEFAULT_STORE_PATH = "cpandb.sqlite";

    /**
     * Creates a default configuration with no extracts configured.
     *
     * @return default configuration
     */
    public static IndexConfig defaults() {
        PipelineSettings settings = PipelineSettings.defaults();
        return new IndexConfig(
            new StoreConfig(DEFAULT_STORE_PATH, settings.batchSize(), settings.cacheSize()),
            new ExtractsConfig(null, null, null, null, null, null),
            new MetricsConfig(settings.excludedPrefixes()),
            new OutputConfig(settings.keepStagingTables(), settings.vacuum(), settings.analyze())
        );
    }

    /**
     * Returns the store path, or the default when none is configured.
     *
     * @return store file path
     */
    public String storePath() {
        if (store == null || store.path() == null || store.path().isBlank()) {
            return DEFAULT_STORE_PATH;
        }
        return store.path();
    }

    /**
     * Returns the extract locations, never null.
     *
     * @return extract configuration
     */
    public ExtractsConfig extractsOrEmpty() {
        return extracts != null ? extracts : new ExtractsConfig(null, null, null, null, null, null);
    }

    /**
     * Resolves the runtime settings, filling gaps with defaults.
     *
     * @return validated pipeline settings
     * @throws IllegalArgumentException if a configured value is out of range
     */
    public PipelineSettings settings() {
        PipelineSettings defaults = PipelineSettings.defaults();
        return new PipelineSettings(
            store != null && store.batchSize() != null ? store.batchSize() : defaults.batchSize(),
            store != null && store.cacheSize() != null ? store.cacheSize() : defaults.cacheSize(),
            metrics != null && metrics.excludedPrefixes() != null
                ? metrics.excludedPrefixes()
                : defaults.excludedPrefixes(),
            output != null && output.keepStagingTables() != null
                ? output.keepStagingTables()
                : defaults.keepStagingTables(),
            output != null && output.vacuum() != null ? output.vacuum() : defaults.vacuum(),
            output != null && output.analyze() != null ? output.analyze() : defaults.analyze()
        );
    }

    /**
     * Store configuration.
     *
     * @param path database file to generate, relative to the configuration file's directory
     * @param batchSize rows per committed batch in backfill passes
     * @param cacheSize SQLite page cache size
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record StoreConfig(
        @JsonProperty("path") String path,
        @JsonProperty("batchSize") Integer batchSize,
        @JsonProperty("cacheSize") Integer cacheSize
    ) {}

    /**
     * Source extract locations. Relative paths resolve against the configuration
     * file's directory.
     *
     * @param index package index database (authors, releases, modules); required
     * @param meta package metadata database (dependency declarations, meta flags); required
     * @param uploads uploads database; optional
     * @param testers testers summary database; optional
     * @param rt bug tracker database; optional
     * @param ratings ratings CSV file; optional
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ExtractsConfig(
        @JsonProperty("index") String index,
        @JsonProperty("meta") String meta,
        @JsonProperty("uploads") String uploads,
        @JsonProperty("testers") String testers,
        @JsonProperty("rt") String rt,
        @JsonProperty("ratings") String ratings
    ) {}

    /**
     * Graph metric configuration.
     *
     * @param excludedPrefixes distribution name prefixes treated as umbrella packages
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record MetricsConfig(
        @JsonProperty("excludedPrefixes") List<String> excludedPrefixes
    ) {}

    /**
     * Post-load configuration.
     *
     * @param keepStagingTables keep the {@code t_*} tables for debugging
     * @param vacuum rebuild the database file after loading
     * @param analyze gather planner statistics after loading
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputConfig(
        @JsonProperty("keepStagingTables") Boolean keepStagingTables,
        @JsonProperty("vacuum") Boolean vacuum,
        @JsonProperty("analyze") Boolean analyze
    ) {}
}
