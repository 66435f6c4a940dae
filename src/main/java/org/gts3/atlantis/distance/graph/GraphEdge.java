package org.gts3.atlantis.distance.graph;

import java.util.Objects;

/**
 * A directed, unweighted edge between two node identities of the same graph.
 */
public class GraphEdge {
    private final String source;
    private final String destination;

    public GraphEdge(String source, String destination) {
        this.source = Objects.requireNonNull(source, "source");
        this.destination = Objects.requireNonNull(destination, "destination");
    }

    public String getSource() {
        return source;
    }

    public String getDestination() {
        return destination;
    }

    public boolean isSelfLoop() {
        return source.equals(destination);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof GraphEdge other)) {
            return false;
        }
        return source.equals(other.source) && destination.equals(other.destination);
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, destination);
    }

    @Override
    public String toString() {
        return "GraphEdge{" +
                "source='" + source + '\'' +
                ", destination='" + destination + '\'' +
                '}';
    }
}
