package org.gts3.atlantis.distance.instrument;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.gts3.atlantis.distance.utils.LogLabel.LOG_WARN;

/**
 * A source-level call graph with the line of every call ({@code call_graph.txt}).
 *
 * Each row is {@code caller,callee:line}. A caller keeps its calls in file order, including
 * repeated calls to the same callee.
 */
public class CallSiteGraph {

    /**
     * One call inside a caller.
     */
    public static class CallSite {
        private final String callee;
        private final int line;

        public CallSite(String callee, int line) {
            this.callee = callee;
            this.line = line;
        }

        public String getCallee() {
            return callee;
        }

        public int getLine() {
            return line;
        }

        @Override
        public String toString() {
            return callee + ":" + line;
        }
    }

    private final Map<String, List<CallSite>> callSites = new LinkedHashMap<>();

    public void addCall(String caller, String callee, int line) {
        callSites.computeIfAbsent(caller, k -> new ArrayList<>()).add(new CallSite(callee, line));
    }

    /**
     * @param caller The calling function
     * @return The calls of the caller in file order
     */
    public List<CallSite> callSitesOf(String caller) {
        return Collections.unmodifiableList(callSites.getOrDefault(caller, Collections.emptyList()));
    }

    /**
     * @param caller The calling function
     * @return The callees of the caller in call order, with repetitions
     */
    public List<String> calleesOf(String caller) {
        return callSitesOf(caller).stream().map(CallSite::getCallee).toList();
    }

    /**
     * @return Every function that calls something, in first-seen order
     */
    public List<String> getCallers() {
        return new ArrayList<>(callSites.keySet());
    }

    public static CallSiteGraph read(Path path) throws IOException {
        return parse(Files.readAllLines(path, StandardCharsets.UTF_8));
    }

    /**
     * Parses call rows. Lines without a comma or a colon are ignored; rows that have both but
     * do not split into caller, callee and a numeric line are skipped with a message.
     *
     * @param lines The rows
     * @return The call graph
     */
    public static CallSiteGraph parse(List<String> lines) {
        CallSiteGraph graph = new CallSiteGraph();
        for (String rawLine : lines) {
            String line = rawLine.strip();
            if (line.isEmpty() || line.indexOf(',') < 0 || line.indexOf(':') < 0) {
                continue;
            }

            String[] callerAndCallee = line.split(",", -1);
            String[] calleeAndLine = callerAndCallee.length == 2 ? callerAndCallee[1].split(":", -1) : new String[0];
            if (calleeAndLine.length != 2) {
                System.out.println(LOG_WARN + "Skipping malformed line: " + line);
                continue;
            }
            try {
                graph.addCall(callerAndCallee[0], calleeAndLine[0], Integer.parseInt(calleeAndLine[1].strip()));
            } catch (NumberFormatException e) {
                System.out.println(LOG_WARN + "Skipping malformed line: " + line);
            }
        }
        return graph;
    }
}
