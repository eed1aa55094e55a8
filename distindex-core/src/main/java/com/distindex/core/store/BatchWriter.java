package com.distindex.core.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Executes one prepared statement for many rows, committing every {@code batchSize} rows.
 *
 * <p>Used for staging inserts and for the row-level backfill passes (ratings,
 * meta, weight, volatility). Committing in fixed-size batches bounds the size of
 * each transaction while still amortizing commit cost; a failure loses at most
 * the batch in flight and never touches batches already committed.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * try (BatchWriter writer = store.batchWriter(
 *         "UPDATE distribution SET weight = ? WHERE distribution = ?", 100)) {
 *     weights.forEach((name, weight) -> writer.add(weight, name));
 * }
 * }</pre>
 *
 * <p>Instances are not thread-safe.
 */
public final class BatchWriter implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BatchWriter.class);

    private final Connection connection;
    private final PreparedStatement statement;
    private final String sql;
    private final int batchSize;
    private final boolean previousAutoCommit;

    private int pending;
    private long rowsWritten;
    private long rowsAffected;
    private int batchesCommitted;

    BatchWriter(Connection connection, String sql, int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0");
        }
        this.connection = connection;
        this.sql = sql;
        this.batchSize = batchSize;
        boolean autoCommit;
        try {
            autoCommit = connection.getAutoCommit();
        } catch (SQLException e) {
            throw new StoreException("Failed to prepare batch statement", sql, e);
        }
        this.previousAutoCommit = autoCommit;
        try {
            connection.setAutoCommit(false);
            this.statement = connection.prepareStatement(sql);
        } catch (SQLException e) {
            restoreAutoCommit(e);
            throw new StoreException("Failed to prepare batch statement", sql, e);
        }
    }

    private void restoreAutoCommit(SQLException failure) {
        try {
            connection.setAutoCommit(previousAutoCommit);
        } catch (SQLException e) {
            failure.addSuppressed(e);
        }
    }

    /**
     * Queues one row, committing the current batch once it is full.
     *
     * @param params positional parameters for the statement
     * @throws StoreException if binding or committing fails
     */
    public void add(Object... params) {
        try {
            IndexStore.bind(statement, params);
            statement.addBatch();
        } catch (SQLException e) {
            throw failure("Failed to queue row", e);
        }
        pending++;
        rowsWritten++;
        if (pending >= batchSize) {
            flush();
        }
    }

    /**
     * Executes and commits any queued rows.
     *
     * @throws StoreException if the batch fails; the batch is rolled back
     */
    public void flush() {
        if (pending == 0) {
            return;
        }
        try {
            for (int count : statement.executeBatch()) {
                if (count > 0) {
                    rowsAffected += count;
                } else if (count == Statement.SUCCESS_NO_INFO) {
                    rowsAffected++;
                }
            }
            connection.commit();
            batchesCommitted++;
            pending = 0;
        } catch (SQLException e) {
            throw failure("Failed to commit batch " + (batchesCommitted + 1), e);
        }
    }

    /**
     * Returns the number of rows queued so far, committed or not.
     *
     * @return rows written
     */
    public long rowsWritten() {
        return rowsWritten;
    }

    /**
     * Returns the number of rows the committed batches reported as changed.
     *
     * <p>For keyed {@code UPDATE} passes this is the number of matched rows.
     *
     * @return rows affected
     */
    public long rowsAffected() {
        return rowsAffected;
    }

    /**
     * Returns the number of committed batches.
     *
     * @return committed batch count
     */
    public int batchesCommitted() {
        return batchesCommitted;
    }

    /**
     * Flushes remaining rows and restores the connection's auto-commit mode.
     */
    @Override
    public void close() {
        try {
            flush();
        } finally {
            try {
                statement.close();
                connection.setAutoCommit(previousAutoCommit);
            } catch (SQLException e) {
                log.warn("Failed to release batch statement: {}", e.getMessage());
            }
        }
        log.debug("Batch writer finished: {} rows, {} batches", rowsWritten, batchesCommitted);
    }

    private StoreException failure(String message, SQLException cause) {
        pending = 0;
        try {
            statement.clearBatch();
            connection.rollback();
        } catch (SQLException rollbackFailure) {
            cause.addSuppressed(rollbackFailure);
        }
        return new StoreException(message, sql, cause);
    }
}
