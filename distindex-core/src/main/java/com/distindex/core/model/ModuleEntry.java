package com.distindex.core.model;

import java.util.Objects;

/**
 * A module contained in a distribution.
 *
 * <p>Dependency declarations name modules; the module table maps them back to
 * the distribution that ships them.
 *
 * @param module module name, e.g. {@code File::Spec}
 * @param version module version, may be null
 * @param distribution owning distribution name
 */
public record ModuleEntry(
    String module,
    String version,
    String distribution
) {
    /**
     * Compact constructor with validation.
     */
    public ModuleEntry {
        Objects.requireNonNull(module, "module must not be null");
        Objects.requireNonNull(distribution, "distribution must not be null");
    }
}
