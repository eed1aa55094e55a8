package com.distindex.core.extract;

import java.util.Objects;

/**
 * Package-metadata facts for one release.
 *
 * @param release release path ({@code AUTHOR/file})
 * @param meta true if the release shipped a metadata file
 * @param license declared license, may be null
 */
public record MetaRow(String release, boolean meta, String license) {

    public MetaRow {
        Objects.requireNonNull(release, "release must not be null");
    }
}
