package org.gts3.atlantis.distance.solver;

import java.util.List;

/**
 * The built-in aggregation strategies.
 *
 * HARMONIC_MEAN: {@code |R| / sum(1/d)}, dominated by the nearest targets (default)
 * MINIMUM: distance to the nearest target only
 * ARITHMETIC_MEAN: plain average over all reachable targets
 */
public enum Aggregation implements AggregationStrategy {
    HARMONIC_MEAN("harmonic") {
        @Override
        public double aggregate(List<Double> distances) {
            double inverseSum = 0.0;
            for (double distance : distances) {
                inverseSum += 1.0 / distance;
            }
            return distances.size() / inverseSum;
        }
    },
    MINIMUM("minimum") {
        @Override
        public double aggregate(List<Double> distances) {
            double minimum = Double.POSITIVE_INFINITY;
            for (double distance : distances) {
                minimum = Math.min(minimum, distance);
            }
            return minimum;
        }
    },
    ARITHMETIC_MEAN("arithmetic") {
        @Override
        public double aggregate(List<Double> distances) {
            double sum = 0.0;
            for (double distance : distances) {
                sum += distance;
            }
            return sum / distances.size();
        }
    };

    private final String name;

    Aggregation(String name) {
        this.name = name;
    }

    @Override
    public String getName() {
        return name;
    }

    /**
     * Looks up a strategy by its name.
     *
     * @param name The strategy name, case-insensitive
     * @return The strategy
     * @throws IllegalArgumentException If no strategy has that name
     */
    public static Aggregation fromName(String name) {
        for (Aggregation aggregation : values()) {
            if (aggregation.name.equalsIgnoreCase(name.trim())) {
                return aggregation;
            }
        }
        throw new IllegalArgumentException("Invalid aggregation: " + name + ". Expected 'harmonic', 'minimum' or 'arithmetic'");
    }

    @Override
    public String toString() {
        return name;
    }
}
