package com.catalogsync.worldcat.job;

/**
 * Carries a batch failure out of a stage, tagged with the stage it happened in.
 */
public class BatchStageException extends RuntimeException {

    private final Stage stage;

    public BatchStageException(Stage stage, RuntimeException cause) {
        super(stage.getLabel() + " failed: " + cause.getMessage(), cause);
        this.stage = stage;
    }

    public Stage getStage() {
        return stage;
    }

    @Override
    public synchronized RuntimeException getCause() {
        return (RuntimeException) super.getCause();
    }
}
