package org.gts3.atlantis.distance;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.gts3.atlantis.distance.graph.BitcodeModule;

/**
 * Extracts call graphs with LLVM's {@code opt -dot-callgraph}.
 *
 * {@code opt} writes the graph to {@code <prefix>.callgraph.dot}. Its stdout is discarded and its
 * stderr is appended to the step log.
 */
public class OptCallGraphExtractor implements CallGraphExtractor {
    private static final String CALLGRAPH_SUFFIX = ".callgraph.dot";

    private final String optBinary;
    private Path resolvedOpt;

    /**
     * @param optBinary The {@code opt} executable, either a path or a name looked up on the PATH
     */
    public OptCallGraphExtractor(String optBinary) {
        this.optBinary = optBinary;
    }

    @Override
    public Path extract(BitcodeModule module, Path outputPrefix, StepLog log) throws CallGraphExtractionException {
        Path opt = resolveOpt();
        Path dotFile = Path.of(outputPrefix.toString() + CALLGRAPH_SUFFIX);

        List<String> command = List.of(
                opt.toString(),
                "-dot-callgraph", module.getBitcodeFile().toString(),
                "-callgraph-dot-filename-prefix", outputPrefix.toString());

        ProcessBuilder processBuilder = new ProcessBuilder(command)
                .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                .redirectError(ProcessBuilder.Redirect.appendTo(log.getLogFile().toFile()));

        int exitCode;
        try {
            Files.deleteIfExists(dotFile);
            Process process = processBuilder.start();
            exitCode = process.waitFor();
        } catch (IOException e) {
            throw new CallGraphExtractionException("Failed to run " + opt + " on " + module.getBitcodeFile(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CallGraphExtractionException("Interrupted while extracting the call graph of " + module.getName(), e);
        }

        if (exitCode != 0) {
            throw new CallGraphExtractionException("opt exited with code " + exitCode + " for " + module.getBitcodeFile());
        }
        if (!Files.isRegularFile(dotFile)) {
            throw new CallGraphExtractionException("opt did not produce " + dotFile);
        }
        return dotFile;
    }

    /**
     * Locates the {@code opt} executable once.
     *
     * @throws ToolNotFoundException If it is neither an executable path nor found on the PATH
     */
    private synchronized Path resolveOpt() {
        if (resolvedOpt != null) {
            return resolvedOpt;
        }

        if (optBinary.contains(File.separator)) {
            Path candidate = Path.of(optBinary);
            if (Files.isExecutable(candidate)) {
                resolvedOpt = candidate;
                return resolvedOpt;
            }
        } else {
            String pathVariable = System.getenv("PATH");
            if (pathVariable != null) {
                for (String directory : pathVariable.split(File.pathSeparator)) {
                    if (directory.isEmpty()) {
                        continue;
                    }
                    Path candidate = Path.of(directory, optBinary);
                    if (Files.isRegularFile(candidate) && Files.isExecutable(candidate)) {
                        resolvedOpt = candidate;
                        return resolvedOpt;
                    }
                }
            }
        }
        throw new ToolNotFoundException("Could not find the opt executable '" + optBinary
                + "'. Install LLVM or pass --opt <path>");
    }
}
