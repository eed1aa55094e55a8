package com.distindex.core.extract;

import java.util.Objects;

/**
 * A distribution release as listed in the package index.
 *
 * @param author uploading author id
 * @param distribution distribution name
 * @param version release version, may be null
 * @param file archive file name, relative to the author directory
 */
public record ReleaseRow(String author, String distribution, String version, String file) {

    public ReleaseRow {
        Objects.requireNonNull(author, "author must not be null");
        Objects.requireNonNull(distribution, "distribution must not be null");
        Objects.requireNonNull(file, "file must not be null");
    }

    /**
     * Returns the release path, {@code AUTHOR/file}.
     *
     * @return release identity shared with the metadata and upload sources
     */
    public String release() {
        return author + "/" + file;
    }
}
