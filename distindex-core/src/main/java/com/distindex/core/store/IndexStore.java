package com.distindex.core.store;

import com.distindex.core.util.SqlResources;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * The relational store the index is built in.
 *
 * <p>Wraps a single SQLite connection and provides the primitives every pipeline
 * stage builds on: statement execution, resource scripts, queries, index creation
 * and batched writers. The store is passed explicitly through the pipeline; there
 * is no process-wide handle.
 *
 * <p>Values are always bound as prepared-statement parameters. Table and column
 * names passed to {@link #createIndex(String, String...)}, {@link #count(String)}
 * and {@link #dropTable(String)} are checked against a strict identifier pattern
 * before they reach a statement.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * try (IndexStore store = IndexStore.open(Path.of("cpan.db"))) {
 *     store.executeScript("schema/author.sql");
 *     store.update("INSERT INTO author VALUES (?, ?)", "ADAMK", "Adam Kennedy");
 *     store.createIndex("author", "name");
 * }
 * }</pre>
 */
public final class IndexStore implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(IndexStore.class);
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final Connection connection;
    private final String location;

    private IndexStore(Connection connection, String location) {
        this.connection = connection;
        this.location = location;
    }

    /**
     * Opens (creating if necessary) a file-backed store.
     *
     * @param file database file
     * @return open store
     * @throws StoreException if the database cannot be opened
     */
    public static IndexStore open(Path file) {
        Objects.requireNonNull(file, "file must not be null");
        String location = file.toAbsolutePath().toString();
        return connect("jdbc:sqlite:" + location, location);
    }

    /**
     * Opens a private in-memory store.
     *
     * @return open store
     * @throws StoreException if the database cannot be opened
     */
    public static IndexStore inMemory() {
        return connect("jdbc:sqlite::memory:", ":memory:");
    }

    private static IndexStore connect(String url, String location) {
        SQLiteConfig config = new SQLiteConfig();
        config.enforceForeignKeys(true);
        try {
            Connection connection = DriverManager.getConnection(url, config.toProperties());
            log.debug("Opened index store at {}", location);
            return new IndexStore(connection, location);
        } catch (SQLException e) {
            throw new StoreException("Failed to open index store at " + location, e);
        }
    }

    /**
     * Returns where the store lives, a file path or {@code :memory:}.
     *
     * @return store location
     */
    public String location() {
        return location;
    }

    /**
     * Executes a statement that returns no rows.
     *
     * @param sql statement with {@code ?} placeholders
     * @param params positional parameters
     * @return number of rows changed
     * @throws StoreException if the statement fails
     */
    public int update(String sql, Object... params) {
        try (PreparedStatement ps = connection.prepareStatement(sql)) {
            bind(ps, params);
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new StoreException("Database error", sql, e);
        }
    }

    /**
     * Executes a parameterless statement such as DDL or a pragma.
     *
     * @param sql statement text
     * @throws StoreException if the statement fails
     */
    public void execute(String sql) {
        try (Statement statement = connection.createStatement()) {
            statement.execute(sql);
        } catch (SQLException e) {
            throw new StoreException("Database error", sql, e);
        }
    }

    /**
     * Executes every statement of a classpath SQL script, in order.
     *
     * @param resourceName script name relative to {@code sql/}
     * @throws StoreException if any statement fails
     */
    public void executeScript(String resourceName) {
        for (String statement : SqlResources.statements(resourceName)) {
            log.trace("Executing {}: {}", resourceName, statement);
            execute(statement);
        }
    }

    /**
     * Runs a query and maps every row.
     *
     * @param sql query with {@code ?} placeholders
     * @param mapper row mapper
     * @param params positional parameters
     * @param <T> mapped type
     * @return mapped rows in result order
     * @throws StoreException if the query fails
     */
    public <T> List<T> query(String sql, RowMapper<T> mapper, Object... params) {
        try (PreparedStatement ps = connection.prepareStatement(sql)) {
            bind(ps, params);
            try (ResultSet rs = ps.executeQuery()) {
                List<T> rows = new ArrayList<>();
                while (rs.next()) {
                    rows.add(mapper.map(rs));
                }
                return rows;
            }
        } catch (SQLException e) {
            throw new StoreException("Query failed", sql, e);
        }
    }

    /**
     * Runs a query and maps the first row, if any.
     *
     * @param sql query with {@code ?} placeholders
     * @param mapper row mapper
     * @param params positional parameters
     * @param <T> mapped type
     * @return first mapped row, or empty
     * @throws StoreException if the query fails
     */
    public <T> Optional<T> queryFirst(String sql, RowMapper<T> mapper, Object... params) {
        try (PreparedStatement ps = connection.prepareStatement(sql)) {
            bind(ps, params);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.ofNullable(mapper.map(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new StoreException("Query failed", sql, e);
        }
    }

    /**
     * Counts the rows of a table.
     *
     * @param table table name
     * @return row count
     */
    public long count(String table) {
        requireIdentifier(table);
        return queryFirst("SELECT COUNT(*) FROM " + table, rs -> rs.getLong(1)).orElse(0L);
    }

    /**
     * Counts the rows of a table where a column is not null.
     *
     * @param table table name
     * @param column column name
     * @return number of rows with a value in {@code column}
     */
    public long countNotNull(String table, String column) {
        requireIdentifier(table);
        requireIdentifier(column);
        return queryFirst("SELECT COUNT(" + column + ") FROM " + table, rs -> rs.getLong(1)).orElse(0L);
    }

    /**
     * Checks whether a table exists.
     *
     * @param table table name
     * @return true if the table exists
     */
    public boolean tableExists(String table) {
        return queryFirst(
            "SELECT 1 FROM sqlite_master WHERE type = 'table' AND name = ?",
            rs -> Boolean.TRUE,
            table
        ).isPresent();
    }

    /**
     * Creates one single-column index per column, named {@code <table>__<column>}.
     *
     * @param table table name
     * @param columns columns to index
     * @throws StoreException if an index cannot be created
     */
    public void createIndex(String table, String... columns) {
        long rows = count(table);
        log.info("Indexing   table {} ({} rows)", table, rows);
        for (String column : columns) {
            requireIdentifier(column);
            execute("CREATE INDEX " + table + "__" + column + " ON " + table + " ( " + column + " )");
        }
    }

    /**
     * Drops a table if it exists.
     *
     * @param table table name
     */
    public void dropTable(String table) {
        requireIdentifier(table);
        execute("DROP TABLE IF EXISTS " + table);
    }

    /**
     * Sets the page cache size for the connection.
     *
     * @param pages number of pages to cache
     */
    public void setCacheSize(int pages) {
        execute("PRAGMA cache_size = " + pages);
    }

    /**
     * Rebuilds the database file to reclaim free pages.
     */
    public void vacuum() {
        execute("VACUUM");
    }

    /**
     * Gathers statistics for the query planner.
     */
    public void analyze() {
        execute("ANALYZE main");
    }

    /**
     * Opens a writer that commits every {@code batchSize} rows.
     *
     * @param sql statement executed once per row
     * @param batchSize rows per transaction
     * @return batch writer, to be closed by the caller
     */
    public BatchWriter batchWriter(String sql, int batchSize) {
        return new BatchWriter(connection, sql, batchSize);
    }

    /**
     * Runs work inside a single transaction, rolling back on failure.
     *
     * @param work statements to run
     * @throws StoreException if the work or the commit fails
     */
    public void inTransaction(Runnable work) {
        try {
            boolean previous = connection.getAutoCommit();
            connection.setAutoCommit(false);
            try {
                work.run();
                connection.commit();
            } catch (RuntimeException e) {
                connection.rollback();
                throw e;
            } finally {
                connection.setAutoCommit(previous);
            }
        } catch (SQLException e) {
            throw new StoreException("Transaction failed", e);
        }
    }

    @Override
    public void close() {
        try {
            connection.close();
            log.debug("Closed index store at {}", location);
        } catch (SQLException e) {
            throw new StoreException("Failed to close index store at " + location, e);
        }
    }

    static void bind(PreparedStatement ps, Object[] params) throws SQLException {
        for (int i = 0; i < params.length; i++) {
            ps.setObject(i + 1, params[i]);
        }
    }

    private static void requireIdentifier(String name) {
        if (name == null || !IDENTIFIER.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid SQL identifier: " + name);
        }
    }
}
