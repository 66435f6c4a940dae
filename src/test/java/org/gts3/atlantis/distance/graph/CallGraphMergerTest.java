package org.gts3.atlantis.distance.graph;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.lessThanOrEqualTo;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class CallGraphMergerTest {

    private static CanonicalGraph graph(String name, String... edges) {
        CanonicalGraph graph = new CanonicalGraph(name);
        for (String edge : edges) {
            String[] endpoints = edge.split("->");
            graph.addEdge(endpoints[0], endpoints[1]);
        }
        return graph;
    }

    @Test
    public void testMergeUnitesNodesAndCollapsesSharedEdges() {
        CanonicalGraph first = graph("first", "main->parse", "parse->lex");
        CanonicalGraph second = graph("second", "fuzz->parse", "parse->lex");

        CanonicalGraph merged = new CallGraphMerger().merge("callgraph", List.of(first, second));

        assertThat(merged.getNodes(), contains("main", "parse", "lex", "fuzz"));
        assertEquals(3, merged.getEdgeCount());
        assertThat(merged.getEdgeCount(), lessThanOrEqualTo(first.getEdgeCount() + second.getEdgeCount()));
    }

    @Test
    public void testWholeProgramMergesEveryModule() {
        Map<String, CanonicalGraph> modules = new LinkedHashMap<>();
        modules.put("a", graph("a", "x->y"));
        modules.put("b", graph("b", "p->q"));

        CanonicalGraph merged = new CallGraphMerger().build("callgraph", GraphSource.wholeProgram(), modules);

        assertThat(merged.getNodes(), contains("x", "y", "p", "q"));
        assertEquals("callgraph", merged.getName());
    }

    @Test
    public void testSingleFuzzerUsesOnlyItsModule() {
        Map<String, CanonicalGraph> modules = new LinkedHashMap<>();
        modules.put("a", graph("a", "x->y"));
        modules.put("b", graph("b", "p->q"));

        CanonicalGraph merged = new CallGraphMerger().build("callgraph", GraphSource.singleFuzzer("b"), modules);

        assertThat(merged.getNodes(), contains("p", "q"));
    }

    @Test
    public void testSingleFuzzerWithoutGraphThrows() {
        Map<String, CanonicalGraph> modules = Map.of("a", graph("a", "x->y"));

        assertThrows(IllegalArgumentException.class,
                () -> new CallGraphMerger().build("callgraph", GraphSource.singleFuzzer("c"), modules));
    }
}
