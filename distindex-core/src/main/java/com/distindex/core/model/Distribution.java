package com.distindex.core.model;

import java.util.Objects;

/**
 * The latest known release of a distribution, decorated with data merged from the
 * secondary sources.
 *
 * <p>Secondary columns ({@code uploaded}, tester counts, {@code license},
 * {@code rating}) are null when the corresponding source had no matching row.
 *
 * @param distribution distribution name
 * @param version release version, may be null
 * @param author author id
 * @param meta true if the release shipped package metadata
 * @param license declared license, may be null
 * @param release release path ({@code AUTHOR/file})
 * @param uploaded upload date ({@code YYYY-MM-DD}), may be null
 * @param pass passing test reports, may be null
 * @param fail failing test reports, may be null
 * @param unknown unknown test reports, may be null
 * @param na not-applicable test reports, may be null
 * @param rating community rating, may be null
 * @param ratings number of reviews behind {@code rating}
 * @param weight number of distributions that transitively depend on this one
 * @param volatility number of distributions this one transitively depends on
 */
public record Distribution(
    String distribution,
    String version,
    String author,
    boolean meta,
    String license,
    String release,
    String uploaded,
    Integer pass,
    Integer fail,
    Integer unknown,
    Integer na,
    String rating,
    int ratings,
    int weight,
    int volatility
) {
    /**
     * Compact constructor with validation.
     */
    public Distribution {
        Objects.requireNonNull(distribution, "distribution must not be null");
        Objects.requireNonNull(author, "author must not be null");
        Objects.requireNonNull(release, "release must not be null");
        if (weight < 0) {
            throw new IllegalArgumentException("weight must be >= 0");
        }
        if (volatility < 0) {
            throw new IllegalArgumentException("volatility must be >= 0");
        }
    }

    /**
     * Returns true if any tester summary was merged for this release.
     *
     * @return true if tester counts are present
     */
    public boolean hasTestResults() {
        return pass != null || fail != null || unknown != null || na != null;
    }
}
