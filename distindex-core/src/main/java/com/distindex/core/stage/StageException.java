package com.distindex.core.stage;

/**
 * Thrown when a stage hits a condition that would leave the index incomplete.
 */
public class StageException extends RuntimeException {

    private final String stageId;

    public StageException(String stageId, String message, Throwable cause) {
        super(message, cause);
        this.stageId = stageId;
    }

    public StageException(String stageId, String message) {
        this(stageId, message, null);
    }

    /**
     * Returns the ID of the failing stage.
     *
     * @return stage ID
     */
    public String getStageId() {
        return stageId;
    }
}
