package org.gts3.atlantis.distance;

/**
 * The resumable steps of the distance pipeline, in execution order.
 */
public enum PipelineStep {
    CALL_GRAPH_DISTANCE(1, "call-graph-distance"),
    CFG_DISTANCE(2, "cfg-distance");

    private final int number;
    private final String stepName;

    PipelineStep(int number, String stepName) {
        this.number = number;
        this.stepName = stepName;
    }

    public int getNumber() {
        return number;
    }

    public String getStepName() {
        return stepName;
    }
}
