package org.gts3.atlantis.distance.solver;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.gts3.atlantis.distance.graph.CanonicalGraph;
import org.jgrapht.Graph;
import org.jgrapht.alg.interfaces.ShortestPathAlgorithm.SingleSourcePaths;
import org.jgrapht.alg.shortestpath.BFSShortestPath;
import org.jgrapht.graph.AsUndirectedGraph;
import org.jgrapht.graph.DefaultEdge;
import org.jgrapht.graph.EdgeReversedGraph;

/**
 * Shortest-path distance from every node of a graph to a set of seed nodes, aggregated over the
 * seeds each node can reach.
 *
 * A seed is a node with a base distance: 0 for a real target, or the remaining distance behind
 * the node for a virtual target such as a call site. The contribution of seed {@code s} to node
 * {@code n} is {@code hops(n, s) + base(s)}. Seeds with base 0 are targets and always have
 * distance 0 themselves.
 */
public class TargetDistanceSolver {
    private final AggregationStrategy aggregation;
    private final EdgeTraversal traversal;

    public TargetDistanceSolver(AggregationStrategy aggregation, EdgeTraversal traversal) {
        this.aggregation = aggregation;
        this.traversal = traversal;
    }

    /**
     * Computes the aggregated distance of every node that reaches at least one seed.
     *
     * One breadth-first search runs per seed, over the reversed graph for forward traversal so
     * that the search starts at the seed.
     *
     * @param graph The graph
     * @param seeds Seed nodes with their base distances, in a deterministic order; seeds that
     *              are not part of the graph are ignored
     * @return Distances by node in graph order; nodes that reach no seed are absent
     */
    public Map<String, Double> solve(CanonicalGraph graph, Map<String, Double> seeds) {
        Graph<String, DefaultEdge> directed = graph.toJGraphT();
        Graph<String, DefaultEdge> view = traversal == EdgeTraversal.FORWARD
                ? new EdgeReversedGraph<>(directed)
                : new AsUndirectedGraph<>(directed);
        BFSShortestPath<String, DefaultEdge> bfs = new BFSShortestPath<>(view);

        List<String> nodes = graph.getNodes();
        Map<String, List<Double>> seedDistances = new LinkedHashMap<>();
        for (String node : nodes) {
            seedDistances.put(node, new ArrayList<>());
        }

        for (Map.Entry<String, Double> seed : seeds.entrySet()) {
            if (!directed.containsVertex(seed.getKey())) {
                continue;
            }

            SingleSourcePaths<String, DefaultEdge> paths = bfs.getPaths(seed.getKey());
            for (String node : nodes) {
                double hops = paths.getWeight(node);
                if (!Double.isInfinite(hops)) {
                    seedDistances.get(node).add(hops + seed.getValue());
                }
            }
        }

        Map<String, Double> result = new LinkedHashMap<>();
        for (String node : nodes) {
            Double base = seeds.get(node);
            if (base != null && base == 0.0) {
                result.put(node, 0.0);
                continue;
            }

            List<Double> distances = seedDistances.get(node);
            if (!distances.isEmpty()) {
                result.put(node, aggregation.aggregate(distances));
            }
        }
        return result;
    }
}
