package com.distindex.core.extract;

import com.distindex.core.util.FileUtils;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Reads community ratings from the published ratings CSV.
 *
 * <p>Expected header: {@code distribution,rating,review_count}. Rows without a
 * distribution name or with a non-numeric review count are skipped.
 */
public final class CsvRatingsExtract implements Extract<RatingRow> {

    private static final Logger log = LoggerFactory.getLogger(CsvRatingsExtract.class);
    private static final CsvMapper CSV_MAPPER = new CsvMapper();
    private static final CsvSchema SCHEMA = CsvSchema.emptySchema().withHeader();

    private final Path file;
    private final Freshness freshness;

    public CsvRatingsExtract(Path file, Clock clock) {
        this.file = Objects.requireNonNull(file, "file must not be null");
        this.freshness = Freshness.ofFile(file, clock);
    }

    @Override
    public String name() {
        return "ratings";
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
    public void read(Consumer<? super RatingRow> sink) {
        if (!isAvailable()) {
            throw new ExtractException(name(), "ratings file not found: " + file);
        }
        int skipped = 0;
        try (MappingIterator<Map<String, String>> rows = CSV_MAPPER
                .readerForMapOf(String.class)
                .with(SCHEMA)
                .readValues(file.toFile())) {
            while (rows.hasNextValue()) {
                RatingRow row = toRow(rows.nextValue());
                if (row == null) {
                    skipped++;
                } else {
                    sink.accept(row);
                }
            }
        } catch (IOException e) {
            throw new ExtractException(name(), "failed to parse " + file + ": " + e.getMessage(), e);
        }
        if (skipped > 0) {
            log.warn("Skipped {} malformed rows in {}", skipped, file);
        }
    }

    private static RatingRow toRow(Map<String, String> values) {
        String distribution = values.get("distribution");
        if (distribution == null || distribution.isBlank()) {
            return null;
        }
        String count = values.get("review_count");
        try {
            int reviewCount = count == null || count.isBlank() ? 0 : Integer.parseInt(count.trim());
            if (reviewCount < 0) {
                return null;
            }
            return new RatingRow(distribution.trim(), emptyToNull(values.get("rating")), reviewCount);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String emptyToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
