package com.distindex.core.model;

/**
 * How many distributions received data from each optional source.
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * CoverageReport coverage = new CoverageReport(25000, 24100, 21000, 3100, 22500);
 * coverage.getFormattedCoverage("uploaded", coverage.uploaded()); // "uploaded = 24100/25000 (96%)"
 * }</pre>
 *
 * @param distributions total distributions
 * @param uploaded distributions with an upload date
 * @param meta distributions with package metadata
 * @param rated distributions with a rating
 * @param tested distributions with tester results
 */
public record CoverageReport(
    long distributions,
    long uploaded,
    long meta,
    long rated,
    long tested
) {
    /**
     * Compact constructor with validation.
     */
    public CoverageReport {
        if (distributions < 0 || uploaded < 0 || meta < 0 || rated < 0 || tested < 0) {
            throw new IllegalArgumentException("coverage counts must be >= 0");
        }
    }

    /**
     * Returns an empty report.
     *
     * @return report with all counts zero
     */
    public static CoverageReport empty() {
        return new CoverageReport(0, 0, 0, 0, 0);
    }

    /**
     * Calculates a count as a percentage of all distributions.
     *
     * @param count covered distributions
     * @return percentage (0-100), or 0 when there are no distributions
     */
    public double percentage(long count) {
        if (distributions == 0) {
            return 0.0;
        }
        return (count * 100.0) / distributions;
    }

    /**
     * Formats one column's coverage, e.g. {@code "uploaded = 45/47 (96%)"}.
     *
     * @param column column label
     * @param count covered distributions
     * @return formatted coverage string
     */
    public String getFormattedCoverage(String column, long count) {
        return String.format("%s = %d/%d (%.0f%%)", column, count, distributions, percentage(count));
    }
}
