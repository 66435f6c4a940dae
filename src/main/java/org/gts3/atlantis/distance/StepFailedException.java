package org.gts3.atlantis.distance;

/**
 * Signals that a pipeline step did not meet its success criterion. The pipeline can be resumed
 * from this step.
 */
public class StepFailedException extends Exception {
    private final PipelineStep step;

    public StepFailedException(PipelineStep step, String message) {
        super(message);
        this.step = step;
    }

    public StepFailedException(PipelineStep step, String message, Throwable cause) {
        super(message, cause);
        this.step = step;
    }

    public PipelineStep getStep() {
        return step;
    }
}
