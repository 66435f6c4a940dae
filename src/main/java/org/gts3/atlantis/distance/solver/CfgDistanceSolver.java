package org.gts3.atlantis.distance.solver;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalDouble;

import org.gts3.atlantis.distance.graph.CanonicalGraph;
import org.gts3.atlantis.distance.utils.NameList;

/**
 * Computes basic-block distances inside one function.
 *
 * Blocks listed as targets are seeds with distance 0. A block that calls a function with a
 * function-level distance {@code d} is a virtual target with base {@code d + 1}, one step behind
 * the call site; when it calls several such functions, the closest one counts. Every other
 * block aggregates its forward path length to each reachable seed plus the seed's base.
 */
public class CfgDistanceSolver {
    private final TargetDistanceSolver solver;

    public CfgDistanceSolver(AggregationStrategy aggregation) {
        this(aggregation, EdgeTraversal.FORWARD);
    }

    public CfgDistanceSolver(AggregationStrategy aggregation, EdgeTraversal traversal) {
        this.solver = new TargetDistanceSolver(aggregation, traversal);
    }

    /**
     * Computes the block distances of one function.
     *
     * @param cfg The canonical control-flow graph of the function
     * @param blockNames The block universe; only these blocks are emitted
     * @param blockTargets The target blocks
     * @param blockCalls The call sites of the program
     * @param functionDistances The function-level distances
     * @return The block distances, in the block order of the CFG
     */
    public DistanceMap solve(CanonicalGraph cfg, NameList blockNames, NameList blockTargets,
                             BlockCalls blockCalls, DistanceMap functionDistances) {
        Map<String, Double> seeds = new LinkedHashMap<>();
        for (String block : cfg.getNodes()) {
            if (blockTargets.contains(block)) {
                seeds.put(block, 0.0);
            }
        }
        for (String block : cfg.getNodes()) {
            if (seeds.containsKey(block)) {
                continue;
            }
            OptionalDouble calleeDistance = blockCalls.calleesOf(block).stream()
                    .map(functionDistances::getDistance)
                    .filter(OptionalDouble::isPresent)
                    .mapToDouble(OptionalDouble::getAsDouble)
                    .min();
            if (calleeDistance.isPresent()) {
                seeds.put(block, calleeDistance.getAsDouble() + 1);
            }
        }

        Map<String, Double> nodeDistances = solver.solve(cfg, seeds);

        DistanceMap distances = new DistanceMap();
        for (Map.Entry<String, Double> entry : nodeDistances.entrySet()) {
            if (blockNames.contains(entry.getKey())) {
                distances.put(entry.getKey(), entry.getValue());
            }
        }
        return distances;
    }
}
