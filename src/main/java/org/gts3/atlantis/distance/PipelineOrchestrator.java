package org.gts3.atlantis.distance;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.gts3.atlantis.distance.graph.BitcodeModule;
import org.gts3.atlantis.distance.graph.CallGraphMerger;
import org.gts3.atlantis.distance.graph.CanonicalGraph;
import org.gts3.atlantis.distance.graph.GraphCanonicalizer;
import org.gts3.atlantis.distance.graph.GraphFormatException;
import org.gts3.atlantis.distance.graph.GraphSource;
import org.gts3.atlantis.distance.graph.ModuleResolver;
import org.gts3.atlantis.distance.solver.BlockCalls;
import org.gts3.atlantis.distance.solver.CallGraphDistanceSolver;
import org.gts3.atlantis.distance.solver.CfgDistanceSolver;
import org.gts3.atlantis.distance.solver.DistanceMap;
import org.gts3.atlantis.distance.utils.FileUtils;
import org.gts3.atlantis.distance.utils.HashUtils;
import org.gts3.atlantis.distance.utils.NameList;

import static org.gts3.atlantis.distance.utils.LogLabel.LOG_WARN;

/**
 * Runs the two resumable steps that turn a build's call graphs and CFG dumps into the basic-block
 * distance map consumed by the fuzzer.
 *
 * <ol>
 *     <li>{@code call-graph-distance}: extract, canonicalize and merge the module call graphs, then
 *     compute {@code distance.callgraph.txt}</li>
 *     <li>{@code cfg-distance}: compute the distances of every function's CFG and concatenate them
 *     into {@code distance.cfg.txt}</li>
 * </ol>
 *
 * After each successful step a {@link Checkpoint} is written. A later run with the same inputs
 * skips the completed steps.
 */
public class PipelineOrchestrator {
    public static final String DOT_FILES_DIR = "dot-files";
    public static final String FUNCTION_NAMES_FILE = "Fnames.txt";
    public static final String FUNCTION_TARGETS_FILE = "Ftargets.txt";
    public static final String BLOCK_NAMES_FILE = "BBnames.txt";
    public static final String BLOCK_TARGETS_FILE = "BBtargets.txt";
    public static final String BLOCK_CALLS_FILE = "BBcalls.txt";
    public static final String INSTRUMENTED_FUNCS_FILE = "instrumented_funcs.txt";
    public static final String CALLGRAPH_DISTANCE_FILE = "distance.callgraph.txt";
    public static final String CFG_DISTANCE_FILE = "distance.cfg.txt";
    public static final String MERGED_CALLGRAPH_FILE = "callgraph.dot";

    private static final String CFG_PREFIX = "cfg.";
    private static final String DOT_SUFFIX = ".dot";
    private static final String DISTANCES_SUFFIX = ".distances.txt";

    private final Path binariesDir;
    private final Path tempDir;
    private final Path dotDir;
    private final GraphSource source;
    private final PipelineConfig config;
    private final CallGraphExtractor extractor;
    private final RetryPolicy retryPolicy;

    public PipelineOrchestrator(Path binariesDir, Path tempDir, GraphSource source, PipelineConfig config,
                                CallGraphExtractor extractor, RetryPolicy retryPolicy) {
        this.binariesDir = binariesDir;
        this.tempDir = tempDir;
        this.dotDir = tempDir.resolve(DOT_FILES_DIR);
        this.source = source;
        this.config = config;
        this.extractor = extractor;
        this.retryPolicy = retryPolicy;
    }

    /**
     * Runs the pipeline from the last valid checkpoint.
     *
     * @return The final distance map file
     * @throws StepFailedException If a step fails; the checkpoint names the last completed step
     * @throws IOException If the inputs cannot be fingerprinted or the checkpoint cannot be written
     * @throws IllegalArgumentException If the binaries directory holds no usable bitcode
     * @throws ToolNotFoundException If {@code opt} is needed but not installed
     */
    public Path run() throws StepFailedException, IOException {
        List<BitcodeModule> modules = new ModuleResolver(binariesDir).resolve(source);
        System.out.println("Found " + modules.size() + " modules for " + source + ": "
                + modules.stream().map(BitcodeModule::getName).collect(Collectors.joining(", ")));

        String inputHash = computeInputHash(modules);
        int resumePoint = resumePoint(inputHash);

        if (resumePoint < PipelineStep.CALL_GRAPH_DISTANCE.getNumber()) {
            StepLog log = StepLog.start(tempDir, PipelineStep.CALL_GRAPH_DISTANCE);
            runStep(log, () -> computeCallGraphDistances(log, modules));
            new Checkpoint(PipelineStep.CALL_GRAPH_DISTANCE, inputHash).save(tempDir);
        } else {
            System.out.println("(1) Resuming: " + CALLGRAPH_DISTANCE_FILE + " is up to date");
        }

        if (resumePoint < PipelineStep.CFG_DISTANCE.getNumber()) {
            StepLog log = StepLog.start(tempDir, PipelineStep.CFG_DISTANCE);
            runStep(log, () -> computeCfgDistances(log));
            new Checkpoint(PipelineStep.CFG_DISTANCE, inputHash).save(tempDir);
        } else {
            System.out.println("(2) Resuming: " + CFG_DISTANCE_FILE + " is up to date");
        }

        return tempDir.resolve(CFG_DISTANCE_FILE);
    }

    @FunctionalInterface
    private interface StepBody {
        void run() throws StepFailedException, IOException;
    }

    /**
     * Runs a step body and shows the tail of its log when it fails.
     */
    private void runStep(StepLog log, StepBody body) throws StepFailedException {
        try {
            body.run();
        } catch (IOException e) {
            log.error(e.toString());
            reportFailure(log);
            throw new StepFailedException(log.getStep(), e.getMessage(), e);
        } catch (StepFailedException e) {
            log.error(e.getMessage());
            reportFailure(log);
            throw e;
        }
    }

    private void reportFailure(StepLog log) {
        for (String line : log.tail(config.getLogTailLines())) {
            System.out.println(line);
        }
        System.out.println("-- Problem in Step " + log.getStep().getNumber() + " of generating distance info!");
    }

    /**
     * Step 1: program-wide call graph and function distances.
     */
    private void computeCallGraphDistances(StepLog log, List<BitcodeModule> modules)
            throws StepFailedException, IOException {
        PipelineStep step = PipelineStep.CALL_GRAPH_DISTANCE;
        Files.createDirectories(dotDir);
        GraphCanonicalizer canonicalizer = new GraphCanonicalizer(config.getIgnoredCallGraphNodes());

        Map<String, CanonicalGraph> moduleGraphs = new LinkedHashMap<>();
        for (BitcodeModule module : modules) {
            log.info("Constructing CG for " + module + "..");
            Path rawDot;
            try {
                rawDot = retryPolicy.execute("Call graph extraction for " + module.getName(),
                        () -> extractor.extract(module, dotDir.resolve(module.getName()), log), log);
            } catch (CallGraphExtractionException e) {
                throw new StepFailedException(step, "Could not generate the call graph of " + module.getName(), e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new StepFailedException(step, "Interrupted while generating call graphs", e);
            }

            CanonicalGraph moduleGraph;
            try {
                moduleGraph = canonicalizer.canonicalize(rawDot);
            } catch (GraphFormatException e) {
                throw new StepFailedException(step, e.getMessage(), e);
            }
            moduleGraph.saveToFile(dotDir.resolve("callgraph." + module.getName() + DOT_SUFFIX));
            Files.deleteIfExists(rawDot);
            moduleGraphs.put(module.getName(), moduleGraph);
        }

        if (moduleGraphs.size() > 1) {
            log.info("Integrating " + moduleGraphs.size() + " call graphs into one.");
        }
        CanonicalGraph callGraph = new CallGraphMerger().build("callgraph", source, moduleGraphs);
        callGraph.saveToFile(dotDir.resolve(MERGED_CALLGRAPH_FILE));
        log.info("Call graph has " + callGraph.getNodeCount() + " functions and " + callGraph.getEdgeCount()
                + " calls");

        log.info("Computing distance for call graph ..");
        NameList functionNames = NameList.read(tempDir.resolve(FUNCTION_NAMES_FILE));
        NameList targetFunctions = NameList.read(tempDir.resolve(FUNCTION_TARGETS_FILE));
        if (targetFunctions.isEmpty()) {
            log.warn(FUNCTION_TARGETS_FILE + " lists no target functions");
        }

        DistanceMap functionDistances = new CallGraphDistanceSolver(config.getAggregation())
                .solve(callGraph, functionNames, targetFunctions);
        functionDistances.saveToFile(tempDir.resolve(CALLGRAPH_DISTANCE_FILE));
        if (functionDistances.isEmpty()) {
            throw new StepFailedException(step, "No function reaches a target; " + CALLGRAPH_DISTANCE_FILE
                    + " is empty");
        }
        log.info("Computed distances for " + functionDistances.size() + " of " + functionNames.size()
                + " functions");
    }

    /**
     * Step 2: per-function CFG distances and the final distance map.
     */
    private void computeCfgDistances(StepLog log) throws IOException {
        Files.createDirectories(dotDir);
        DistanceMap functionDistances = DistanceMap.read(tempDir.resolve(CALLGRAPH_DISTANCE_FILE));
        NameList blockNames = NameList.read(tempDir.resolve(BLOCK_NAMES_FILE));
        NameList blockTargets = NameList.readIfExists(tempDir.resolve(BLOCK_TARGETS_FILE));
        BlockCalls blockCalls = BlockCalls.readIfExists(tempDir.resolve(BLOCK_CALLS_FILE));
        if (blockCalls.getDiscardedRows() > 0) {
            log.warn("Discarded " + blockCalls.getDiscardedRows() + " malformed rows of " + BLOCK_CALLS_FILE);
        }

        Path whitelistFile = tempDir.resolve(INSTRUMENTED_FUNCS_FILE);
        Optional<NameList> whitelist = Files.exists(whitelistFile)
                ? Optional.of(NameList.read(whitelistFile))
                : Optional.empty();

        GraphCanonicalizer canonicalizer = new GraphCanonicalizer();
        CfgDistanceSolver solver = new CfgDistanceSolver(config.getAggregation());

        log.info("Computing distance for control-flow graphs");
        List<Path> distanceFiles = new ArrayList<>();
        int failed = 0;
        for (Path cfgFile : listCfgFiles()) {
            String function = functionOf(cfgFile);
            if (whitelist.isPresent() && !whitelist.get().contains(function)) {
                log.info("Skipping " + function + " (not in " + INSTRUMENTED_FUNCS_FILE + ")");
                continue;
            }

            Path distanceFile = dotDir.resolve(CFG_PREFIX + function + DISTANCES_SUFFIX);
            try {
                CanonicalGraph cfg = canonicalizer.canonicalize(cfgFile);
                DistanceMap blockDistances = solver.solve(cfg, blockNames, blockTargets, blockCalls,
                        functionDistances);
                blockDistances.saveToFile(distanceFile);
                distanceFiles.add(distanceFile);
            } catch (GraphFormatException | IOException e) {
                failed++;
                log.warn("Could not calculate distance for " + cfgFile.getFileName() + ": " + e.getMessage());
            }
        }

        Path cfgDistanceFile = tempDir.resolve(CFG_DISTANCE_FILE);
        FileUtils.concatenate(cfgDistanceFile, distanceFiles);
        log.info("Computed distances for " + distanceFiles.size() + " functions (" + failed + " failed)");
        if (!FileUtils.hasContent(cfgDistanceFile)) {
            log.warn(CFG_DISTANCE_FILE + " is empty; no basic block reaches a target");
        }
    }

    /**
     * Lists the CFG dumps of the instrumentation pass, sorted by file name.
     */
    private List<Path> listCfgFiles() throws IOException {
        try (Stream<Path> entries = Files.list(dotDir)) {
            return entries
                    .filter(Files::isRegularFile)
                    .filter(path -> {
                        String fileName = path.getFileName().toString();
                        return fileName.startsWith(CFG_PREFIX) && fileName.endsWith(DOT_SUFFIX)
                                && fileName.length() > CFG_PREFIX.length() + DOT_SUFFIX.length();
                    })
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    /**
     * {@code cfg.<function>.dot -> <function>}
     */
    static String functionOf(Path cfgFile) {
        String fileName = cfgFile.getFileName().toString();
        return fileName.substring(CFG_PREFIX.length(), fileName.length() - DOT_SUFFIX.length());
    }

    /**
     * Fingerprints everything the distance maps depend on: the bitcode modules, the CFG dumps,
     * the name files and the settings that change the result. Bitcode files contribute their
     * size and modification time, every other file its content.
     */
    String computeInputHash(List<BitcodeModule> modules) throws IOException {
        HashUtils hash = new HashUtils();
        hash.update(source.describe());
        for (BitcodeModule module : modules) {
            hash.update(module.getName());
            hash.updateMetadata(module.getBitcodeFile());
        }
        if (Files.isDirectory(dotDir)) {
            for (Path cfgFile : listCfgFiles()) {
                hash.update(cfgFile);
            }
        }
        for (String fileName : List.of(FUNCTION_NAMES_FILE, FUNCTION_TARGETS_FILE, BLOCK_NAMES_FILE,
                BLOCK_TARGETS_FILE, BLOCK_CALLS_FILE, INSTRUMENTED_FUNCS_FILE)) {
            hash.update(tempDir.resolve(fileName));
        }
        hash.update(config.getAggregation().getName());
        hash.update(config.getIgnoredCallGraphNodes().stream().sorted().collect(Collectors.joining(",")));
        return hash.toHex();
    }

    /**
     * Determines the last completed step that can be trusted.
     *
     * @return The step number to resume after, 0 to start over
     */
    int resumePoint(String inputHash) {
        Optional<Checkpoint> checkpoint = Checkpoint.load(tempDir);
        if (checkpoint.isEmpty()) {
            return 0;
        }

        Checkpoint state = checkpoint.get();
        if (!inputHash.equals(state.getInputHash())) {
            System.out.println(LOG_WARN + "Inputs changed since the last run, starting over");
            return 0;
        }
        if (!FileUtils.hasContent(tempDir.resolve(CALLGRAPH_DISTANCE_FILE))) {
            System.out.println(LOG_WARN + CALLGRAPH_DISTANCE_FILE + " is missing, starting over");
            return 0;
        }
        if (state.getStep() >= PipelineStep.CFG_DISTANCE.getNumber()
                && !Files.isRegularFile(tempDir.resolve(CFG_DISTANCE_FILE))) {
            System.out.println(LOG_WARN + CFG_DISTANCE_FILE + " is missing, starting over");
            return 0;
        }
        System.out.println("Resuming after step " + state.getStep() + " (" + state.getStepName() + ")");
        return state.getStep();
    }
}
