package com.distindex.core.stage.base;

import com.distindex.core.extract.Extract;
import com.distindex.core.extract.ExtractException;
import com.distindex.core.stage.Stage;
import com.distindex.core.stage.StageContext;
import com.distindex.core.stage.StageException;
import com.distindex.core.stage.StageResult;
import com.distindex.core.store.BatchWriter;
import com.distindex.core.store.IndexStore;
import com.distindex.core.store.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;

/**
 * Abstract base class for stage implementations providing common functionality.
 *
 * <p>This class reduces code duplication across stages by providing:
 * <ul>
 *   <li>Logger initialization (one logger per stage class)</li>
 *   <li>Timing and result assembly around {@link #run(StageContext, StageResult.Builder)}</li>
 *   <li>Translation of any runtime failure into a {@link StageException}
 *       that names the stage</li>
 *   <li>Warning helpers for recoverable conditions</li>
 * </ul>
 *
 * @see Stage
 * @see StageContext
 * @see StageResult
 */
public abstract class AbstractStage implements Stage {

    /**
     * Logger instance for this stage.
     * Automatically initialized with the concrete stage class name.
     */
    protected final Logger log;

    protected AbstractStage() {
        this.log = LoggerFactory.getLogger(getClass());
    }

    @Override
    public final StageResult execute(StageContext context) {
        long start = System.nanoTime();
        StageResult.Builder result = StageResult.builder(getId());
        try {
            run(context, result);
        } catch (StageException e) {
            throw e;
        } catch (StoreException | ExtractException e) {
            throw new StageException(getId(), e.getMessage(), e);
        } catch (RuntimeException e) {
            log.error("Unexpected failure in stage {}", getId(), e);
            throw new StageException(getId(), String.valueOf(e.getMessage()), e);
        }
        return result.elapsed(Duration.ofNanos(System.nanoTime() - start)).build();
    }

    /**
     * Performs the stage's work.
     *
     * @param context stage context
     * @param result builder collecting row counts and warnings
     */
    protected abstract void run(StageContext context, StageResult.Builder result);

    // ==================== Helpers ====================

    /**
     * Logs a warning and records it on the result.
     *
     * @param result result builder
     * @param message warning message
     */
    protected void warn(StageResult.Builder result, String message) {
        log.warn(message);
        result.warning(message);
    }

    /**
     * Executes a keyed statement once per row in batches of {@code batchSize}.
     *
     * @param store target store
     * @param sql statement with {@code ?} placeholders
     * @param batchSize rows per committed batch
     * @param rows parameter rows
     * @return number of rows the statement reported as changed
     */
    protected long writeBatched(IndexStore store, String sql, int batchSize, List<Object[]> rows) {
        try (BatchWriter writer = store.batchWriter(sql, batchSize)) {
            for (Object[] row : rows) {
                writer.add(row);
            }
            writer.flush();
            return writer.rowsAffected();
        }
    }

    /**
     * Creates a stage failure carrying this stage's ID.
     *
     * @param message failure description
     * @return exception to throw
     */
    protected StageException failure(String message) {
        return new StageException(getId(), message);
    }

    /**
     * Fails the stage if a required extract is unavailable.
     *
     * @param extract required extract
     * @throws StageException if the extract is unavailable
     */
    protected void requireAvailable(Extract<?> extract) {
        if (!extract.isAvailable()) {
            throw failure("Required extract '" + extract.name() + "' is not available");
        }
    }
}
