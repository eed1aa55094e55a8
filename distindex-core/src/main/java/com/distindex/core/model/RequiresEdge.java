package com.distindex.core.model;

import java.util.Objects;

/**
 * A module-level dependency declaration of a distribution.
 *
 * <p>The published {@code requires} table does not carry the core-since
 * indicator, so rows read from it have a null {@code core}.
 *
 * @param distribution declaring distribution
 * @param module required module name
 * @param version required version, {@code "0"} when unspecified
 * @param phase lifecycle phase
 * @param core core-since indicator, may be null
 */
public record RequiresEdge(
    String distribution,
    String module,
    String version,
    String phase,
    Double core
) {
    /**
     * Compact constructor with validation.
     */
    public RequiresEdge {
        Objects.requireNonNull(distribution, "distribution must not be null");
        Objects.requireNonNull(module, "module must not be null");
        Objects.requireNonNull(phase, "phase must not be null");
    }
}
