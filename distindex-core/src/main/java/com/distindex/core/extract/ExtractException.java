package com.distindex.core.extract;

/**
 * Thrown when an available extract cannot be read.
 */
public class ExtractException extends RuntimeException {

    private final String extractName;

    public ExtractException(String extractName, String message, Throwable cause) {
        super("Extract '" + extractName + "': " + message, cause);
        this.extractName = extractName;
    }

    public ExtractException(String extractName, String message) {
        this(extractName, message, null);
    }

    /**
     * Returns the name of the extract that failed.
     *
     * @return extract name
     */
    public String getExtractName() {
        return extractName;
    }
}
