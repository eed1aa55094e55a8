package com.distindex.core.store;

import com.distindex.core.model.Author;
import com.distindex.core.model.DependencyEdge;
import com.distindex.core.model.Distribution;
import com.distindex.core.model.ModuleEntry;
import com.distindex.core.model.RequiresEdge;
import com.distindex.core.model.Ticket;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Typed read access to a finished index.
 */
public final class IndexQueries {

    private static final RowMapper<Distribution> DISTRIBUTION = rs -> new Distribution(
        rs.getString("distribution"),
        rs.getString("version"),
        rs.getString("author"),
        rs.getInt("meta") != 0,
        rs.getString("license"),
        rs.getString("release"),
        rs.getString("uploaded"),
        RowMapper.nullableInt(rs, "pass"),
        RowMapper.nullableInt(rs, "fail"),
        RowMapper.nullableInt(rs, "unknown"),
        RowMapper.nullableInt(rs, "na"),
        rs.getString("rating"),
        rs.getInt("ratings"),
        rs.getInt("weight"),
        rs.getInt("volatility")
    );

    private static final RowMapper<DependencyEdge> DEPENDENCY = rs -> new DependencyEdge(
        rs.getString("distribution"),
        rs.getString("dependency"),
        rs.getString("phase"),
        RowMapper.nullableDouble(rs, "core")
    );

    private static final RowMapper<Ticket> TICKET = rs -> new Ticket(
        rs.getLong("id"),
        rs.getString("distribution"),
        rs.getString("subject"),
        rs.getString("status"),
        rs.getString("severity"),
        rs.getString("created"),
        rs.getString("updated")
    );

    private final IndexStore store;

    public IndexQueries(IndexStore store) {
        this.store = Objects.requireNonNull(store, "store must not be null");
    }

    public Optional<Distribution> distribution(String name) {
        return store.queryFirst("SELECT * FROM distribution WHERE distribution = ?", DISTRIBUTION, name);
    }

    public List<Distribution> distributionsByAuthor(String author) {
        return store.query("SELECT * FROM distribution WHERE author = ? ORDER BY distribution", DISTRIBUTION, author);
    }

    /**
     * Returns the distributions with the highest weight.
     *
     * @param limit maximum number of rows
     * @return distributions, heaviest first, ties by name
     */
    public List<Distribution> heaviest(int limit) {
        return store.query(
            "SELECT * FROM distribution ORDER BY weight DESC, distribution ASC LIMIT ?", DISTRIBUTION, limit);
    }

    public Optional<Author> author(String id) {
        return store.queryFirst("SELECT author, name FROM author WHERE author = ?",
            rs -> new Author(rs.getString("author"), rs.getString("name")), id);
    }

    public List<ModuleEntry> modules(String distribution) {
        return store.query("SELECT module, version, distribution FROM module WHERE distribution = ? ORDER BY module",
            rs -> new ModuleEntry(rs.getString("module"), rs.getString("version"), rs.getString("distribution")),
            distribution);
    }

    /**
     * Returns the distributions {@code distribution} directly depends on.
     *
     * @param distribution depending distribution
     * @return edges ordered by phase, then dependency
     */
    public List<DependencyEdge> dependencies(String distribution) {
        return store.query(
            "SELECT * FROM dependency WHERE distribution = ? ORDER BY phase, dependency", DEPENDENCY, distribution);
    }

    /**
     * Returns the distributions directly depending on {@code distribution}.
     *
     * @param distribution distribution depended upon
     * @return edges ordered by phase, then depending distribution
     */
    public List<DependencyEdge> dependents(String distribution) {
        return store.query(
            "SELECT * FROM dependency WHERE dependency = ? ORDER BY phase, distribution", DEPENDENCY, distribution);
    }

    public List<RequiresEdge> requires(String distribution) {
        return store.query(
            "SELECT distribution, module, version, phase FROM requires WHERE distribution = ? ORDER BY phase, module",
            rs -> new RequiresEdge(
                rs.getString("distribution"),
                rs.getString("module"),
                rs.getString("version"),
                rs.getString("phase"),
                null),
            distribution);
    }

    public List<Ticket> tickets(String distribution) {
        return store.query("SELECT * FROM ticket WHERE distribution = ? ORDER BY id", TICKET, distribution);
    }
}
