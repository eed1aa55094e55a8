package com.distindex.core.store;

import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * Maps the current row of a {@link ResultSet} to a value.
 *
 * @param <T> mapped type
 */
@FunctionalInterface
public interface RowMapper<T> {

    /**
     * Maps the current row. Implementations must not advance the cursor.
     *
     * @param rs result set positioned on a row
     * @return mapped value
     * @throws SQLException if a column cannot be read
     */
    T map(ResultSet rs) throws SQLException;

    /**
     * Reads a nullable integer column.
     *
     * @param rs result set positioned on a row
     * @param column column label
     * @return column value, or null for SQL NULL
     * @throws SQLException if the column cannot be read
     */
    static Integer nullableInt(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }

    /**
     * Reads a nullable floating point column.
     *
     * @param rs result set positioned on a row
     * @param column column label
     * @return column value, or null for SQL NULL
     * @throws SQLException if the column cannot be read
     */
    static Double nullableDouble(ResultSet rs, String column) throws SQLException {
        double value = rs.getDouble(column);
        return rs.wasNull() ? null : value;
    }

    /**
     * Reads a nullable long column.
     *
     * @param rs result set positioned on a row
     * @param column column label
     * @return column value, or null for SQL NULL
     * @throws SQLException if the column cannot be read
     */
    static Long nullableLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }
}
