package org.gts3.atlantis.distance.instrument;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class InstrumentationAnalyzerTest {
    private static final List<String> CALL_GRAPH = List.of(
            "main,init:3",
            "main,parse:5",
            "main,process:7",
            "parse,lex:4",
            "process,helper:8",
            "process,target:10",
            "process,cleanup:12",
            "helper,util:2");

    private static InstrumentationAnalyzer analyzer(Map<String, Set<String>> internalCalls) {
        return new InstrumentationAnalyzer(CallSiteGraph.parse(CALL_GRAPH), internalCalls);
    }

    @Test
    public void testFirstDepthFirstCallPath() {
        assertThat(analyzer(Map.of()).callPath("main", "target"), contains("main", "process", "target"));
        assertThat(analyzer(Map.of()).callPath("main", "lex"), contains("main", "parse", "lex"));
        assertThat(analyzer(Map.of()).callPath("main", "main"), contains("main"));
        assertThat(analyzer(Map.of()).callPath("lex", "main"), empty());
    }

    @Test
    public void testCallPathSurvivesCycles() {
        CallSiteGraph graph = CallSiteGraph.parse(List.of("a,b:1", "b,a:1", "b,c:2", "c,d:1"));

        assertThat(new InstrumentationAnalyzer(graph, Map.of()).callPath("a", "d"), contains("a", "b", "c", "d"));
    }

    @Test
    public void testPrecedingDependentsAndTheirCallees() {
        InstrumentationAnalyzer analyzer = analyzer(Map.of());

        assertThat(analyzer.precedingDependents("target"), contains("helper"));
        assertThat(analyzer.computeInstrumentationSet("main", List.of("target")),
                contains("helper", "main", "process", "target", "util"));
    }

    @Test
    public void testInternalCallsExpandDependents() {
        InstrumentationAnalyzer analyzer = analyzer(Map.of("util", Set.of("memcpy_wrapper")));

        assertThat(analyzer.computeInstrumentationSet("main", List.of("target")),
                contains("helper", "main", "memcpy_wrapper", "process", "target", "util"));
    }

    @Test
    public void testUnreachableTargetKeepsOnlyDependents() {
        CallSiteGraph graph = CallSiteGraph.parse(List.of("other,setup:1", "other,sink:2"));

        assertThat(new InstrumentationAnalyzer(graph, Map.of()).computeInstrumentationSet("main", List.of("sink")),
                contains("setup"));
    }

    @Test
    public void testMalformedRowsAreSkipped() {
        CallSiteGraph graph = CallSiteGraph.parse(List.of("a,b:x", "a,b,c:1", "a,b:1:2", "no-separators", "a,c:9"));

        assertEquals(List.of("c"), graph.calleesOf("a"));
    }

    @Test
    public void testRunWritesSortedList(@TempDir Path tempDir) throws Exception {
        Files.write(tempDir.resolve("call_graph.txt"), CALL_GRAPH);
        Files.write(tempDir.resolve("target_funcs.txt"), List.of("target", "", "lex"));
        Files.write(tempDir.resolve("entry_func.txt"), List.of("main", "ignored"));

        Path output = InstrumentationAnalyzer.run(tempDir);

        assertEquals(tempDir.resolve("instrumented_funcs.txt"), output);
        assertEquals(List.of("helper", "lex", "main", "parse", "process", "target", "util"),
                Files.readAllLines(output));
    }

    @Test
    public void testRunWithoutEntryFunctionFails(@TempDir Path tempDir) throws Exception {
        Files.write(tempDir.resolve("call_graph.txt"), CALL_GRAPH);
        Files.write(tempDir.resolve("target_funcs.txt"), List.of("target"));
        Files.writeString(tempDir.resolve("entry_func.txt"), "");

        assertThrows(IllegalArgumentException.class, () -> InstrumentationAnalyzer.run(tempDir));
    }
}
