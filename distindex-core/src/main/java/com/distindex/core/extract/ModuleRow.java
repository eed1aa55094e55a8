package com.distindex.core.extract;

import java.util.Objects;

/**
 * A module as listed in the package index.
 *
 * @param module module name
 * @param version module version, may be null
 * @param distribution owning distribution name
 */
public record ModuleRow(String module, String version, String distribution) {

    public ModuleRow {
        Objects.requireNonNull(module, "module must not be null");
        Objects.requireNonNull(distribution, "distribution must not be null");
    }
}
