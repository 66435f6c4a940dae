package org.gts3.atlantis.distance.graph;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

import org.gts3.atlantis.distance.utils.FileUtils;
import org.jgrapht.Graph;
import org.jgrapht.graph.DefaultDirectedGraph;
import org.jgrapht.graph.DefaultEdge;

/**
 * A call graph or control-flow graph in canonical form.
 *
 * Node identities are plain names without quoting or record decoration, every (source,
 * destination) pair occurs at most once, and nodes and edges keep the order in which they were
 * first added. The canonical DOT rendering of this class parses back into an equal graph.
 */
public class CanonicalGraph {
    private final String name;
    private final LinkedHashSet<String> nodes = new LinkedHashSet<>();
    private final LinkedHashSet<GraphEdge> edges = new LinkedHashSet<>();

    /**
     * Constructs a new empty graph.
     *
     * @param name The graph name, used in the DOT header and in log messages
     */
    public CanonicalGraph(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    /**
     * Adds a node if it is not already present.
     *
     * @param node The node identity
     * @return true if the node was new
     */
    public boolean addNode(String node) {
        return nodes.add(node);
    }

    /**
     * Adds an edge and its endpoints. A parallel edge is ignored.
     *
     * @param source The source identity
     * @param destination The destination identity
     * @return true if the edge was new
     */
    public boolean addEdge(String source, String destination) {
        nodes.add(source);
        nodes.add(destination);
        return edges.add(new GraphEdge(source, destination));
    }

    public boolean containsNode(String node) {
        return nodes.contains(node);
    }

    /**
     * @return The node identities in first-seen order
     */
    public List<String> getNodes() {
        return new ArrayList<>(nodes);
    }

    /**
     * @return The edges in first-seen order
     */
    public List<GraphEdge> getEdges() {
        return new ArrayList<>(edges);
    }

    public int getNodeCount() {
        return nodes.size();
    }

    public int getEdgeCount() {
        return edges.size();
    }

    /**
     * Builds a JGraphT view of this graph for the path algorithms.
     *
     * @return A new directed graph containing all nodes and edges of this graph
     */
    public Graph<String, DefaultEdge> toJGraphT() {
        Graph<String, DefaultEdge> graph = new DefaultDirectedGraph<>(DefaultEdge.class);
        for (String node : nodes) {
            graph.addVertex(node);
        }
        for (GraphEdge edge : edges) {
            graph.addEdge(edge.getSource(), edge.getDestination());
        }
        return graph;
    }

    /**
     * Renders the graph as DOT with every identifier quoted.
     *
     * @return The canonical DOT text
     */
    public String toDot() {
        StringBuilder dot = new StringBuilder();
        dot.append("digraph ").append(quote(name)).append(" {\n");
        for (String node : nodes) {
            dot.append("  ").append(quote(node)).append(";\n");
        }
        for (GraphEdge edge : edges) {
            dot.append("  ").append(quote(edge.getSource()))
                    .append(" -> ").append(quote(edge.getDestination())).append(";\n");
        }
        dot.append("}\n");
        return dot.toString();
    }

    /**
     * Saves the canonical DOT rendering atomically.
     *
     * @param outputPath The file to write
     * @throws IOException If an I/O error occurs
     */
    public void saveToFile(Path outputPath) throws IOException {
        String content = toDot();
        FileUtils.writeFileAtomically(outputPath, tempPath -> {
            try {
                Files.writeString(tempPath, content, StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        });
    }

    private static String quote(String id) {
        return "\"" + id.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }

    @Override
    public String toString() {
        return "CanonicalGraph{" +
                "name='" + name + '\'' +
                ", nodes=" + nodes.size() +
                ", edges=" + edges.size() +
                '}';
    }
}
