package com.distindex.core.extract;

import java.util.Objects;

/**
 * Community test-result summary for one release.
 *
 * @param distribution distribution name
 * @param version release version
 * @param pass passing reports, may be null
 * @param fail failing reports, may be null
 * @param na not-applicable reports, may be null
 * @param unknown unknown reports, may be null
 */
public record TesterRow(
    String distribution,
    String version,
    Integer pass,
    Integer fail,
    Integer na,
    Integer unknown
) {

    public TesterRow {
        Objects.requireNonNull(distribution, "distribution must not be null");
    }
}
