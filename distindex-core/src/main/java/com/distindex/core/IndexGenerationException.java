package com.distindex.core;

/**
 * Thrown when an index generation run fails.
 *
 * <p>Carries the ID of the stage that failed; {@link #getCause()} holds the
 * underlying stage or store failure, including the failing statement where
 * there is one.
 */
public class IndexGenerationException extends RuntimeException {

    private final String stageId;

    public IndexGenerationException(String stageId, String message, Throwable cause) {
        super("Stage '" + stageId + "' failed: " + message, cause);
        this.stageId = stageId;
    }

    public String getStageId() {
        return stageId;
    }
}
