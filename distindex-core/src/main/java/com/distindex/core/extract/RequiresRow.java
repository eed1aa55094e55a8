package com.distindex.core.extract;

import java.util.Objects;

/**
 * A raw module-level dependency declaration.
 *
 * <p>{@code version} and {@code core} are carried verbatim; they are repaired
 * later by the field cleaning stage.
 *
 * @param release declaring release path ({@code AUTHOR/file})
 * @param module required module
 * @param version required version as declared, may be null or malformed
 * @param phase lifecycle phase
 * @param core core-since indicator as declared, may be null or malformed
 */
public record RequiresRow(String release, String module, String version, String phase, String core) {

    public RequiresRow {
        Objects.requireNonNull(release, "release must not be null");
        Objects.requireNonNull(module, "module must not be null");
        if (phase == null) {
            phase = "runtime";
        }
    }
}
