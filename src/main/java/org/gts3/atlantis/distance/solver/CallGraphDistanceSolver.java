package org.gts3.atlantis.distance.solver;

import java.util.LinkedHashMap;
import java.util.Map;

import org.gts3.atlantis.distance.graph.CanonicalGraph;
import org.gts3.atlantis.distance.utils.NameList;

import static org.gts3.atlantis.distance.utils.LogLabel.LOG_WARN;

/**
 * Computes the function-level distance of every known function to the target functions.
 *
 * Call edges are followed in both directions: a function is close to a target both when it
 * calls towards it and when it is called from a path that leads to it.
 */
public class CallGraphDistanceSolver {
    private final TargetDistanceSolver solver;

    public CallGraphDistanceSolver(AggregationStrategy aggregation) {
        this.solver = new TargetDistanceSolver(aggregation, EdgeTraversal.UNDIRECTED);
    }

    /**
     * Computes function distances.
     *
     * @param callGraph The program-wide canonical call graph
     * @param functionNames The function universe; output rows follow its order
     * @param targetFunctions The target functions
     * @return The distance of every function in the universe that reaches a target
     */
    public DistanceMap solve(CanonicalGraph callGraph, NameList functionNames, NameList targetFunctions) {
        Map<String, Double> seeds = new LinkedHashMap<>();
        for (String target : targetFunctions.asList()) {
            if (!callGraph.containsNode(target)) {
                System.out.println(LOG_WARN + "Target function " + target + " is not part of the call graph");
            }
            if (!functionNames.contains(target)) {
                System.out.println(LOG_WARN + "Target function " + target + " is not listed in the function names");
            }
            seeds.put(target, 0.0);
        }

        Map<String, Double> nodeDistances = solver.solve(callGraph, seeds);

        DistanceMap distances = new DistanceMap();
        for (String function : functionNames.asList()) {
            if (targetFunctions.contains(function)) {
                distances.put(function, 0.0);
            } else if (nodeDistances.containsKey(function)) {
                distances.put(function, nodeDistances.get(function));
            }
        }
        return distances;
    }
}
