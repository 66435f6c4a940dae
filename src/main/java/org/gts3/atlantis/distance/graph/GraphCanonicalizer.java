package org.gts3.atlantis.distance.graph;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.jgrapht.alg.util.Pair;
import org.jgrapht.nio.ImportException;
import org.jgrapht.nio.dot.DOTEventDrivenImporter;

/**
 * Normalizes DOT graph dumps into {@link CanonicalGraph}s.
 *
 * The dumps come from LLVM ({@code opt -dot-callgraph}, {@code -dot-cfg}) and from the
 * instrumentation pass. They identify nodes by pointer-like ids ({@code Node0x55d0...}) and
 * carry the real name in a record label such as {@code "{main}"} or
 * {@code "{entry:\l  %1 = alloca i32\l|{<s0>T|<s1>F}}"}. Edges may address a record port
 * ({@code Node0x1:s0 -> Node0x2}). The canonical identity of a node is the first field of its
 * label without quotes, braces and trailing {@code :} qualifiers, or its DOT id if it has no
 * label.
 */
public class GraphCanonicalizer {
    /** LLVM call graph pseudo-nodes that link every externally visible function. */
    public static final Set<String> LLVM_PSEUDO_NODES = Set.of("external node", "external calling node");

    /** Stands in for a backslash inside quoted strings while the input is parsed. */
    private static final char ESCAPE = '\uE000';
    /** Stands in for an escaped double quote. */
    private static final char ESCAPED_QUOTE = '\uE001';
    /** Escape letters that end a line in a DOT label. */
    private static final String LINE_BREAKS = "lnr";

    private final Set<String> ignoredNodes;

    /**
     * Constructs a canonicalizer that keeps every node.
     */
    public GraphCanonicalizer() {
        this(Set.of());
    }

    /**
     * Constructs a canonicalizer that drops the given node identities and their edges.
     *
     * @param ignoredNodes Canonical identities to drop
     */
    public GraphCanonicalizer(Set<String> ignoredNodes) {
        this.ignoredNodes = Set.copyOf(ignoredNodes);
    }

    /**
     * Canonicalizes a DOT file. The graph is named after the file.
     *
     * @param dotFile The DOT file
     * @return The canonical graph
     * @throws IOException If the file cannot be read
     * @throws GraphFormatException If the file is not valid DOT
     */
    public CanonicalGraph canonicalize(Path dotFile) throws IOException, GraphFormatException {
        String content = Files.readString(dotFile, StandardCharsets.UTF_8);
        return canonicalize(dotFile.getFileName().toString(), content);
    }

    /**
     * Canonicalizes a DOT blob.
     *
     * @param name The name of the resulting graph
     * @param reader The DOT input
     * @return The canonical graph
     * @throws GraphFormatException If the input cannot be read or is not valid DOT
     */
    public CanonicalGraph canonicalize(String name, Reader reader) throws GraphFormatException {
        StringBuilder content = new StringBuilder();
        char[] buffer = new char[8192];
        try {
            int read;
            while ((read = reader.read(buffer)) != -1) {
                content.append(buffer, 0, read);
            }
        } catch (IOException e) {
            throw new GraphFormatException("Failed to read graph " + name + ": " + e.getMessage(), e);
        }
        return canonicalize(name, content.toString());
    }

    /**
     * Canonicalizes DOT source text.
     *
     * @param name The name of the resulting graph
     * @param dot The DOT source
     * @return The canonical graph
     * @throws GraphFormatException If the input is not valid DOT
     */
    public CanonicalGraph canonicalize(String name, String dot) throws GraphFormatException {
        // Ids in document order; edge endpoints are recorded too since a node may only occur in edges
        List<String> seenIds = new ArrayList<>();
        Map<String, String> labels = new HashMap<>();
        List<Pair<String, String>> rawEdges = new ArrayList<>();

        DOTEventDrivenImporter importer = new DOTEventDrivenImporter();
        importer.addVertexConsumer(seenIds::add);
        importer.addVertexAttributeConsumer((vertexAndKey, attribute) -> {
            if ("label".equals(vertexAndKey.getSecond()) && attribute != null) {
                labels.put(vertexAndKey.getFirst(), attribute.getValue());
            }
        });
        importer.addEdgeConsumer(edge -> {
            seenIds.add(edge.getFirst());
            seenIds.add(edge.getSecond());
            rawEdges.add(edge);
        });

        try {
            importer.importInput(new StringReader(maskEscapes(dot)));
        } catch (ImportException e) {
            throw new GraphFormatException("Failed to parse graph " + name + ": " + e.getMessage(), e);
        } catch (RuntimeException e) {
            // The generated parser reports some syntax errors as plain runtime exceptions
            throw new GraphFormatException("Failed to parse graph " + name + ": " + e, e);
        }

        // Ports are already stripped from edge endpoints by the importer
        Map<String, String> identities = new HashMap<>();
        for (String rawId : seenIds) {
            identities.computeIfAbsent(rawId, id -> identityOf(id, labels));
        }

        CanonicalGraph graph = new CanonicalGraph(name);
        LinkedHashSet<String> orderedIds = new LinkedHashSet<>(seenIds);
        for (String rawId : orderedIds) {
            String identity = identities.get(rawId);
            if (!ignoredNodes.contains(identity)) {
                graph.addNode(identity);
            }
        }
        for (Pair<String, String> rawEdge : rawEdges) {
            String source = identities.get(rawEdge.getFirst());
            String destination = identities.get(rawEdge.getSecond());
            if (ignoredNodes.contains(source) || ignoredNodes.contains(destination)) {
                continue;
            }
            graph.addEdge(source, destination);
        }
        return graph;
    }

    /**
     * Resolves the canonical identity of a raw DOT id.
     */
    private static String identityOf(String rawId, Map<String, String> labels) {
        String label = labels.get(rawId);
        if (label != null) {
            String identity = nodeIdentity(label);
            if (!identity.isEmpty()) {
                return identity;
            }
        }
        // Plain ids are taken verbatim so canonical output reads back unchanged
        return unmask(rawId);
    }

    /**
     * Replaces every backslash escape inside a quoted string with {@link #ESCAPE} followed by the
     * escaped character. The DOT lexer rejects escapes such as {@code \l} and {@code \{} that
     * LLVM writes into record labels. A backslash before a line break is a line continuation
     * and is removed.
     *
     * @param dot The DOT source
     * @return The source without backslashes inside quoted strings
     */
    static String maskEscapes(String dot) {
        StringBuilder masked = new StringBuilder(dot.length());
        boolean quoted = false;
        for (int i = 0; i < dot.length(); i++) {
            char c = dot.charAt(i);
            if (quoted && c == '\\' && i + 1 < dot.length()) {
                char escaped = dot.charAt(++i);
                if (escaped == '\n') {
                    continue;
                }
                if (escaped == '\r') {
                    if (i + 1 < dot.length() && dot.charAt(i + 1) == '\n') {
                        i++;
                    }
                    continue;
                }
                masked.append(ESCAPE).append(escaped == '"' ? ESCAPED_QUOTE : escaped);
                continue;
            }
            if (c == '"') {
                quoted = !quoted;
            }
            masked.append(c);
        }
        return masked.toString();
    }

    /**
     * Strips the decoration from a label or id: surrounding quotes, record braces, every field
     * after the first one, everything after the first line break and trailing {@code :}
     * qualifiers. Masked escapes are resolved to the character they stand for.
     *
     * @param label The raw label
     * @return The canonical identity, possibly empty
     */
    static String nodeIdentity(String label) {
        String identity = label.trim();
        if (identity.length() >= 2 && identity.startsWith("\"") && identity.endsWith("\"")) {
            identity = identity.substring(1, identity.length() - 1);
        }
        if (identity.startsWith("{")) {
            identity = identity.substring(1);
        }
        if (identity.endsWith("}") && !isMasked(identity, identity.length() - 1)) {
            identity = identity.substring(0, identity.length() - 1);
        }

        identity = identity.substring(0, firstFieldEnd(identity)).trim();
        while (identity.endsWith(":") && !isMasked(identity, identity.length() - 1)) {
            identity = identity.substring(0, identity.length() - 1).trim();
        }
        return unmask(identity);
    }

    /**
     * Finds the end of the first line of the first record field.
     */
    private static int firstFieldEnd(String label) {
        for (int i = 0; i < label.length(); i++) {
            char c = label.charAt(i);
            boolean escape = c == ESCAPE || c == '\\';
            if (escape && i + 1 < label.length()) {
                if (LINE_BREAKS.indexOf(label.charAt(i + 1)) >= 0) {
                    return i;
                }
                // An escaped character never ends the field
                i++;
                continue;
            }
            if (c == '\n' || c == '|') {
                return i;
            }
        }
        return label.length();
    }

    private static boolean isMasked(String label, int index) {
        return index > 0 && label.charAt(index - 1) == ESCAPE;
    }

    private static String unmask(String identity) {
        if (identity.indexOf(ESCAPE) < 0) {
            return identity;
        }
        StringBuilder result = new StringBuilder(identity.length());
        for (int i = 0; i < identity.length(); i++) {
            char c = identity.charAt(i);
            if (c == ESCAPE) {
                if (i + 1 < identity.length()) {
                    char escaped = identity.charAt(++i);
                    result.append(escaped == ESCAPED_QUOTE ? '"' : escaped);
                }
            } else {
                result.append(c);
            }
        }
        return result.toString();
    }
}
