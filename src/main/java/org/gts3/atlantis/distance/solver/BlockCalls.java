package org.gts3.atlantis.distance.solver;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The call sites of the program: which basic block calls which function ({@code BBcalls.txt}).
 *
 * Each row is {@code block,callee} or {@code block,callee,extra}. Rows with a different field
 * count or an empty block or callee are discarded.
 */
public class BlockCalls {
    private final Map<String, Set<String>> calleesByBlock;
    private final int discardedRows;

    private BlockCalls(Map<String, Set<String>> calleesByBlock, int discardedRows) {
        this.calleesByBlock = calleesByBlock;
        this.discardedRows = discardedRows;
    }

    public static BlockCalls empty() {
        return new BlockCalls(new HashMap<>(), 0);
    }

    /**
     * Reads a call-site file if it exists.
     *
     * @param path The {@code BBcalls.txt} file
     * @return The call sites, empty if the file does not exist
     * @throws IOException If the file exists but cannot be read
     */
    public static BlockCalls readIfExists(Path path) throws IOException {
        if (!Files.exists(path)) {
            return empty();
        }
        return parse(Files.readAllLines(path, StandardCharsets.UTF_8));
    }

    public static BlockCalls parse(List<String> lines) {
        Map<String, Set<String>> calleesByBlock = new HashMap<>();
        int discarded = 0;
        for (String line : lines) {
            if (line.isBlank()) {
                continue;
            }
            String[] fields = line.split(",", -1);
            if (fields.length < 2 || fields.length > 3) {
                discarded++;
                continue;
            }
            String block = fields[0].trim();
            String callee = fields[1].trim();
            if (block.isEmpty() || callee.isEmpty()) {
                discarded++;
                continue;
            }
            calleesByBlock.computeIfAbsent(block, k -> new LinkedHashSet<>()).add(callee);
        }
        return new BlockCalls(calleesByBlock, discarded);
    }

    /**
     * @param block The calling block
     * @return The functions called from the block, in first-seen order
     */
    public Set<String> calleesOf(String block) {
        return Collections.unmodifiableSet(calleesByBlock.getOrDefault(block, Collections.emptySet()));
    }

    public int getCallSiteCount() {
        return calleesByBlock.size();
    }

    public int getDiscardedRows() {
        return discardedRows;
    }
}
