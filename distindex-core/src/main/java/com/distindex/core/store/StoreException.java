package com.distindex.core.store;

/**
 * Thrown when the index store cannot be opened or a statement fails.
 *
 * <p>Store failures are always fatal to a generation run: continuing would
 * produce a silently incomplete index.
 */
public class StoreException extends RuntimeException {

    private final String statement;

    /**
     * Creates a store exception.
     *
     * @param message description of the failure
     * @param statement failing statement or table name, may be null
     * @param cause underlying cause, may be null
     */
    public StoreException(String message, String statement, Throwable cause) {
        super(statement == null ? message : message + " [" + abbreviate(statement) + "]", cause);
        this.statement = statement;
    }

    /**
     * Creates a store exception without statement context.
     *
     * @param message description of the failure
     * @param cause underlying cause
     */
    public StoreException(String message, Throwable cause) {
        this(message, null, cause);
    }

    /**
     * Returns the failing statement or table name.
     *
     * @return statement text, or null if the failure was not statement specific
     */
    public String getStatement() {
        return statement;
    }

    private static String abbreviate(String statement) {
        String flat = statement.replaceAll("\\s+", " ").trim();
        return flat.length() > 120 ? flat.substring(0, 117) + "..." : flat;
    }
}
