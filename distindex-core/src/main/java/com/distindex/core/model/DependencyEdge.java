package com.distindex.core.model;

import java.util.Objects;

/**
 * A distribution-level dependency: {@code distribution} depends on {@code dependency}
 * during {@code phase}.
 *
 * <p>Unique per (distribution, dependency, phase).
 *
 * @param distribution depending distribution
 * @param dependency distribution depended upon
 * @param phase lifecycle phase (runtime, build, test, configure, develop)
 * @param core core-since indicator of the winning module declaration, may be null
 */
public record DependencyEdge(
    String distribution,
    String dependency,
    String phase,
    Double core
) {
    /**
     * Compact constructor with validation.
     */
    public DependencyEdge {
        Objects.requireNonNull(distribution, "distribution must not be null");
        Objects.requireNonNull(dependency, "dependency must not be null");
        Objects.requireNonNull(phase, "phase must not be null");
    }

    /**
     * Returns true if the edge points back at its own distribution.
     *
     * @return true for a self-edge
     */
    public boolean isSelfEdge() {
        return distribution.equals(dependency);
    }
}
