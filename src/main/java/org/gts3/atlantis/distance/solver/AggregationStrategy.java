package org.gts3.atlantis.distance.solver;

import java.util.List;

/**
 * Combines the distances from one node to each of the targets it can reach into a single value.
 */
public interface AggregationStrategy {
    /**
     * Aggregates per-target distances.
     *
     * @param distances The distance to each reachable target, never empty, every value positive
     * @return The aggregated distance
     */
    double aggregate(List<Double> distances);

    /**
     * @return The name used on the command line and in the checkpoint fingerprint
     */
    String getName();
}
