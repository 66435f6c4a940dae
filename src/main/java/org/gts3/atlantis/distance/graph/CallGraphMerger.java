package org.gts3.atlantis.distance.graph;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Combines per-module call graphs into the program-wide call graph.
 */
public class CallGraphMerger {

    /**
     * Builds the program-wide call graph for a graph source.
     *
     * @param name The name of the resulting graph
     * @param source Whole program, or a single fuzzer
     * @param moduleGraphs Canonical call graphs by module name, in processing order
     * @return The merged call graph
     * @throws IllegalArgumentException If the single fuzzer's module is missing
     */
    public CanonicalGraph build(String name, GraphSource source, Map<String, CanonicalGraph> moduleGraphs) {
        if (source instanceof GraphSource.SingleFuzzer singleFuzzer) {
            CanonicalGraph fuzzerGraph = moduleGraphs.get(singleFuzzer.getFuzzerName());
            if (fuzzerGraph == null) {
                throw new IllegalArgumentException("No call graph for fuzzer " + singleFuzzer.getFuzzerName());
            }
            return merge(name, List.of(fuzzerGraph));
        }
        return merge(name, moduleGraphs.values());
    }

    /**
     * Unites canonical graphs. Nodes with the same identity are one node, and an edge that
     * occurs in several inputs occurs once in the result.
     *
     * @param name The name of the resulting graph
     * @param graphs The graphs to merge, in order
     * @return The merged graph
     */
    public CanonicalGraph merge(String name, Collection<CanonicalGraph> graphs) {
        CanonicalGraph merged = new CanonicalGraph(name);
        for (CanonicalGraph graph : graphs) {
            for (String node : graph.getNodes()) {
                merged.addNode(node);
            }
            for (GraphEdge edge : graph.getEdges()) {
                merged.addEdge(edge.getSource(), edge.getDestination());
            }
        }
        return merged;
    }
}
