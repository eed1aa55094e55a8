package com.distindex.core.extract;

import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * An extract over a list of rows held in memory.
 *
 * @param <R> row type
 */
final class InMemoryExtract<R> implements Extract<R> {

    private final String name;
    private final List<R> rows;

    InMemoryExtract(String name, List<R> rows) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.rows = List.copyOf(rows);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public void read(Consumer<? super R> sink) {
        rows.forEach(sink);
    }
}
