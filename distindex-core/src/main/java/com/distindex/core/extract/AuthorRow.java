package com.distindex.core.extract;

import java.util.Objects;

/**
 * An author as listed in the package index.
 *
 * @param author author id
 * @param name full name, may be null
 */
public record AuthorRow(String author, String name) {

    public AuthorRow {
        Objects.requireNonNull(author, "author must not be null");
    }
}
