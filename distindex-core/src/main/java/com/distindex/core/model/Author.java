package com.distindex.core.model;

import java.util.Objects;

/**
 * An uploader of distributions.
 *
 * @param author author id, e.g. {@code ADAMK}
 * @param name display name
 */
public record Author(
    String author,
    String name
) {
    /**
     * Compact constructor with validation.
     */
    public Author {
        Objects.requireNonNull(author, "author must not be null");
        Objects.requireNonNull(name, "name must not be null");
    }
}
