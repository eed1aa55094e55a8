package com.distindex.core.extract;

import com.distindex.core.store.RowMapper;
import com.distindex.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * An extract read from a SQLite database file with a fixed query.
 *
 * <p>The file is opened read-only for the duration of {@link #read(Consumer)}.
 * Freshness is the file's modification age. Rows the mapper maps to null
 * are skipped and counted.
 *
 * @param <R> row type
 */
public final class SqliteExtract<R> implements Extract<R> {

    private static final Logger log = LoggerFactory.getLogger(SqliteExtract.class);

    private final String name;
    private final Path file;
    private final String query;
    private final RowMapper<R> mapper;
    private final Freshness freshness;

    /**
     * Creates a SQLite-backed extract.
     *
     * @param name extract name
     * @param file database file
     * @param query query selecting the rows, in source order
     * @param mapper maps each row
     * @param clock clock used for freshness
     */
    public SqliteExtract(String name, Path file, String query, RowMapper<R> mapper, Clock clock) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.file = Objects.requireNonNull(file, "file must not be null");
        this.query = Objects.requireNonNull(query, "query must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
        this.freshness = Freshness.ofFile(file, clock);
    }

    @Override
    public String name() {
        return name;
    }

    /**
     * Returns the backing database file.
     *
     * @return database file
     */
    public Path file() {
        return file;
    }

    @Override
    public boolean isAvailable() {
        return FileUtils.isReadableFile(file);
    }

    @Override
    public Freshness freshness() {
        return freshness;
    }

    @Override
    public void read(Consumer<? super R> sink) {
        if (!isAvailable()) {
            throw new ExtractException(name, "database file not found: " + file);
        }
        SQLiteConfig config = new SQLiteConfig();
        config.setReadOnly(true);
        String url = "jdbc:sqlite:" + file.toAbsolutePath();
        long rows = 0;
        long skipped = 0;
        try (Connection connection = DriverManager.getConnection(url, config.toProperties());
             PreparedStatement ps = connection.prepareStatement(query);
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                R row = mapper.map(rs);
                if (row == null) {
                    skipped++;
                    continue;
                }
                sink.accept(row);
                rows++;
            }
        } catch (SQLException e) {
            throw new ExtractException(name, "failed to read " + file + ": " + e.getMessage(), e);
        }
        if (skipped > 0) {
            log.warn("Skipped {} rows with missing key columns in {}", skipped, name);
        }
        log.debug("Read {} rows from extract {} ({})", rows, name, file);
    }
}
