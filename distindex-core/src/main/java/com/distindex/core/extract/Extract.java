package com.distindex.core.extract;

import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Read-only tabular access to one source dataset.
 *
 * <p>Extracts are produced by collaborators outside the pipeline (downloaders,
 * mirrors, other generators). The pipeline only reads them, once, in full.
 *
 * <p>An extract may be unavailable, for example when an optional source was not
 * fetched. Callers decide whether that is fatal: the normalizer aborts for the
 * primary index and degrades to empty staging tables for secondary sources.
 *
 * @param <R> row type
 */
public interface Extract<R> {

    /**
     * Returns the extract's name, used in logs and error messages.
     *
     * @return extract name
     */
    String name();

    /**
     * Checks whether the extract can be read.
     *
     * @return true if {@link #read(Consumer)} will produce rows
     */
    boolean isAvailable();

    /**
     * Streams every row of the extract to {@code sink}, in source order.
     *
     * @param sink row consumer
     * @throws ExtractException if the extract is unavailable or cannot be read
     */
    void read(Consumer<? super R> sink);

    /**
     * Returns the freshness capability of this extract.
     *
     * @return freshness, {@link Freshness#unknown()} by default
     */
    default Freshness freshness() {
        return Freshness.unknown();
    }

    /**
     * Creates an extract over rows already in memory.
     *
     * @param name extract name
     * @param rows rows in source order
     * @param <R> row type
     * @return available extract
     */
    static <R> Extract<R> of(String name, List<R> rows) {
        return new InMemoryExtract<>(name, rows);
    }

    /**
     * Creates an extract that is not available.
     *
     * @param name extract name
     * @param <R> row type
     * @return unavailable extract
     */
    static <R> Extract<R> missing(String name) {
        Objects.requireNonNull(name, "name must not be null");
        return new Extract<>() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public boolean isAvailable() {
                return false;
            }

            @Override
            public void read(Consumer<? super R> sink) {
                throw new ExtractException(name, "not available");
            }
        };
    }
}
