package org.gts3.atlantis.distance;

/**
 * A single call-graph extraction attempt failed. The attempt may be retried.
 */
public class CallGraphExtractionException extends Exception {
    public CallGraphExtractionException(String message) {
        super(message);
    }

    public CallGraphExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
