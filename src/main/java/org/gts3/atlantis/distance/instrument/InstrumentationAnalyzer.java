package org.gts3.atlantis.distance.instrument;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

import org.gts3.atlantis.distance.utils.FileUtils;
import org.gts3.atlantis.distance.utils.NameList;

import static org.gts3.atlantis.distance.utils.LogLabel.LOG_ERROR;

/**
 * Selects the functions worth instrumenting for a set of target functions.
 *
 * For every target the set contains:
 * <ul>
 *     <li>the first call path found by depth-first search from the entry function to the target</li>
 *     <li>the functions a caller of the target calls on an earlier line than the target
 *     (preceding dependents), since they prepare the state the target sees</li>
 *     <li>every function transitively called by a preceding dependent</li>
 *     <li>the callees reached through the basic blocks of those functions, when block-level call
 *     data is available</li>
 * </ul>
 *
 * The result is written sorted to {@code instrumented_funcs.txt}, which restricts the CFG step
 * of the distance pipeline.
 */
public class InstrumentationAnalyzer {
    public static final String CALL_GRAPH_FILE = "call_graph.txt";
    public static final String TARGET_FUNCS_FILE = "target_funcs.txt";
    public static final String ENTRY_FUNC_FILE = "entry_func.txt";
    public static final String OUTPUT_FILE = "instrumented_funcs.txt";

    private final CallSiteGraph callGraph;
    private final Map<String, Set<String>> internalCalls;

    /**
     * @param callGraph The source-level call graph
     * @param internalCalls Callees reached from each function's basic blocks; may be empty
     */
    public InstrumentationAnalyzer(CallSiteGraph callGraph, Map<String, Set<String>> internalCalls) {
        this.callGraph = callGraph;
        this.internalCalls = internalCalls;
    }

    /**
     * Computes the instrumentation set.
     *
     * @param entryFunction The entry function of the program
     * @param targetFunctions The target functions
     * @return The functions to instrument, sorted
     */
    public SortedSet<String> computeInstrumentationSet(String entryFunction, Collection<String> targetFunctions) {
        SortedSet<String> result = new TreeSet<>();
        for (String target : targetFunctions) {
            result.addAll(callPath(entryFunction, target));

            Set<String> dependents = transitiveCallees(precedingDependents(target));
            result.addAll(dependents);
            result.addAll(expandByInternalCalls(dependents));
        }
        return result;
    }

    /**
     * Finds the first call path from {@code start} to {@code target} in depth-first order.
     * A function is visited at most once per search.
     *
     * @return The functions on the path, starting with {@code start}, or empty if there is none
     */
    List<String> callPath(String start, String target) {
        Set<String> visited = new HashSet<>();
        List<String> path = new ArrayList<>();
        // Index of the next callee to try, per function on the current path
        Deque<Integer> nextCallee = new ArrayDeque<>();

        visited.add(start);
        path.add(start);
        nextCallee.push(0);
        if (start.equals(target)) {
            return path;
        }

        while (!nextCallee.isEmpty()) {
            String current = path.get(path.size() - 1);
            List<String> callees = callGraph.calleesOf(current);
            int index = nextCallee.pop();
            if (index >= callees.size()) {
                path.remove(path.size() - 1);
                continue;
            }
            nextCallee.push(index + 1);

            String callee = callees.get(index);
            if (!visited.add(callee)) {
                continue;
            }
            path.add(callee);
            if (callee.equals(target)) {
                return path;
            }
            nextCallee.push(0);
        }
        return path;
    }

    /**
     * Finds the functions that some caller of {@code target} calls on a line before one of its
     * calls to {@code target}.
     */
    Set<String> precedingDependents(String target) {
        Set<String> dependents = new LinkedHashSet<>();
        for (String caller : callGraph.getCallers()) {
            List<CallSiteGraph.CallSite> callSites = callGraph.callSitesOf(caller);
            int lastTargetLine = Integer.MIN_VALUE;
            for (CallSiteGraph.CallSite callSite : callSites) {
                if (callSite.getCallee().equals(target)) {
                    lastTargetLine = Math.max(lastTargetLine, callSite.getLine());
                }
            }
            if (lastTargetLine == Integer.MIN_VALUE) {
                continue;
            }
            for (CallSiteGraph.CallSite callSite : callSites) {
                if (callSite.getLine() < lastTargetLine && !callSite.getCallee().equals(target)) {
                    dependents.add(callSite.getCallee());
                }
            }
        }
        return dependents;
    }

    /**
     * @return The given functions and everything they call, directly or indirectly
     */
    Set<String> transitiveCallees(Set<String> functions) {
        Set<String> closure = new LinkedHashSet<>(functions);
        Deque<String> queue = new ArrayDeque<>(functions);
        while (!queue.isEmpty()) {
            for (String callee : callGraph.calleesOf(queue.poll())) {
                if (closure.add(callee)) {
                    queue.add(callee);
                }
            }
        }
        return closure;
    }

    private Set<String> expandByInternalCalls(Set<String> functions) {
        Set<String> expanded = new LinkedHashSet<>(functions);
        Deque<String> queue = new ArrayDeque<>(functions);
        while (!queue.isEmpty()) {
            for (String callee : internalCalls.getOrDefault(queue.poll(), Set.of())) {
                if (expanded.add(callee)) {
                    queue.add(callee);
                }
            }
        }
        return expanded;
    }

    /**
     * Computes {@code instrumented_funcs.txt} for a temp directory.
     *
     * @param tempDir The directory holding the call graph, target and entry files
     * @return The output file
     * @throws IOException If an input cannot be read or the output cannot be written
     * @throws IllegalArgumentException If the entry file names no function
     */
    public static Path run(Path tempDir) throws IOException {
        List<String> entryLines = Files.readAllLines(tempDir.resolve(ENTRY_FUNC_FILE), StandardCharsets.UTF_8);
        String entryFunction = entryLines.isEmpty() ? "" : entryLines.get(0).strip();
        if (entryFunction.isEmpty()) {
            throw new IllegalArgumentException(ENTRY_FUNC_FILE + " does not name an entry function");
        }

        CallSiteGraph callGraph = CallSiteGraph.read(tempDir.resolve(CALL_GRAPH_FILE));
        NameList targets = NameList.read(tempDir.resolve(TARGET_FUNCS_FILE));

        SortedSet<String> functions = new InstrumentationAnalyzer(callGraph, Map.of())
                .computeInstrumentationSet(entryFunction, targets.asList());

        Path outputFile = tempDir.resolve(OUTPUT_FILE);
        FileUtils.writeLinesAtomically(outputFile, new ArrayList<>(functions));
        System.out.println("Instrumentation function list written to: " + outputFile);
        return outputFile;
    }

    public static void main(String[] args) {
        if (args.length != 1) {
            System.err.println("Usage: instrumented-funcs <temp-dir>");
            System.exit(2);
        }
        try {
            run(Path.of(args[0]));
        } catch (IOException | IllegalArgumentException e) {
            System.err.println(LOG_ERROR + "Failed to compute the instrumented functions: " + e.getMessage());
            System.exit(1);
        }
    }
}
