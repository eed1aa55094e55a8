package com.distindex.core.store;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link BatchWriter}.
 */
class BatchWriterTest {

    private static final String INSERT = "INSERT INTO rating (distribution, ratings) VALUES (?, ?)";

    private IndexStore store;

    @BeforeEach
    void setUp() {
        store = IndexStore.inMemory();
        store.execute("CREATE TABLE rating (distribution TEXT PRIMARY KEY, ratings INTEGER)");
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    @Test
    void add_commitsEveryBatchSizeRows() {
        // Given
        BatchWriter writer = store.batchWriter(INSERT, 2);

        // When
        writer.add("Foo", 1);
        writer.add("Bar", 2);
        writer.add("Baz", 3);

        // Then: one full batch committed, one row pending
        assertThat(writer.batchesCommitted()).isEqualTo(1);
        assertThat(writer.rowsWritten()).isEqualTo(3);
        assertThat(writer.rowsAffected()).isEqualTo(2);

        writer.close();
        assertThat(writer.batchesCommitted()).isEqualTo(2);
        assertThat(store.count("rating")).isEqualTo(3);
    }

    @Test
    void rowsAffected_keyedUpdate_countsMatchedRowsOnly() {
        // Given
        store.update(INSERT, "Foo", 0);

        // When
        long affected;
        try (BatchWriter writer = store.batchWriter("UPDATE rating SET ratings = ? WHERE distribution = ?", 10)) {
            writer.add(5, "Foo");
            writer.add(7, "Missing");
            writer.flush();
            affected = writer.rowsAffected();
        }

        // Then
        assertThat(affected).isEqualTo(1);
    }

    @Test
    void flush_failingBatch_rollsBackOnlyThatBatch() {
        // Given
        BatchWriter writer = store.batchWriter(INSERT, 2);
        writer.add("Foo", 1);
        writer.add("Bar", 2);

        // When: the second batch violates the primary key
        writer.add("Baz", 3);
        assertThatThrownBy(() -> writer.add("Baz", 4))
            .isInstanceOf(StoreException.class)
            .hasMessageContaining("batch 2");
        writer.close();

        // Then
        assertThat(store.query("SELECT distribution FROM rating ORDER BY distribution", rs -> rs.getString(1)))
            .containsExactly("Bar", "Foo");
    }

    @Test
    void close_restoresAutoCommit() {
        try (BatchWriter writer = store.batchWriter(INSERT, 5)) {
            writer.add("Foo", 1);
        }

        // A plain update after the writer must be committed on its own
        store.update(INSERT, "Bar", 2);
        assertThat(store.count("rating")).isEqualTo(2);
    }

    @Test
    void batchWriter_invalidStatement_leavesAutoCommitOn(@TempDir Path tempDir) {
        // Given
        Path file = tempDir.resolve("ratings.sqlite");
        try (IndexStore fileStore = IndexStore.open(file)) {
            fileStore.execute("CREATE TABLE rating (distribution TEXT PRIMARY KEY, ratings INTEGER)");

            // When
            assertThatThrownBy(() -> fileStore.batchWriter("INSERT INTO missing_table VALUES (?)", 2))
                .isInstanceOf(StoreException.class);
            fileStore.update(INSERT, "Foo", 1);

            // Then: the update is visible to a second connection
            try (IndexStore reader = IndexStore.open(file)) {
                assertThat(reader.count("rating")).isEqualTo(1);
            }
        }
    }

    @Test
    void batchWriter_withInvalidBatchSize_throwsException() {
        assertThatThrownBy(() -> store.batchWriter(INSERT, 0))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
