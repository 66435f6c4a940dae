package org.gts3.atlantis.distance.graph;

/**
 * Thrown when a graph dump cannot be parsed as DOT.
 */
public class GraphFormatException extends Exception {
    public GraphFormatException(String message) {
        super(message);
    }

    public GraphFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
