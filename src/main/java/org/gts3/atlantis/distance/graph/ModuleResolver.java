package org.gts3.atlantis.distance.graph;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.gts3.atlantis.distance.utils.LogLabel.LOG_WARN;

/**
 * Finds the bitcode modules of a build.
 *
 * The link step of the instrumented build leaves one {@code <name>.0.0.<stage>.bc} file per
 * binary in the binaries directory. The module name is the file name without its last four
 * dot-separated fields.
 */
public class ModuleResolver {
    private static final String BITCODE_MARKER = ".0.0.";
    private static final String BITCODE_SUFFIX = ".bc";

    private final Path binariesDir;

    public ModuleResolver(Path binariesDir) {
        this.binariesDir = binariesDir;
    }

    /**
     * Resolves the modules whose call graphs make up the program-wide call graph.
     *
     * @param source The graph source
     * @return The modules, sorted by name
     * @throws IOException If the binaries directory cannot be listed
     * @throws IllegalArgumentException If no module exists, or a single fuzzer does not resolve
     *                                  to exactly one bitcode file
     */
    public List<BitcodeModule> resolve(GraphSource source) throws IOException {
        List<Path> bitcodeFiles = listBitcodeFiles();

        if (source instanceof GraphSource.SingleFuzzer singleFuzzer) {
            String prefix = singleFuzzer.getFuzzerName() + BITCODE_MARKER;
            List<Path> matches = bitcodeFiles.stream()
                    .filter(path -> path.getFileName().toString().startsWith(prefix))
                    .toList();
            if (matches.size() != 1) {
                throw new IllegalArgumentException("Couldn't find bytecode for fuzzer " + singleFuzzer.getFuzzerName()
                        + " in folder " + binariesDir + " (" + matches.size() + " matches)");
            }
            // The module is named after the fuzzer so the merger can pick its graph
            return List.of(new BitcodeModule(singleFuzzer.getFuzzerName(), matches.get(0)));
        }

        if (bitcodeFiles.isEmpty()) {
            throw new IllegalArgumentException("Couldn't find any binaries in folder " + binariesDir);
        }

        Map<String, Path> modules = new LinkedHashMap<>();
        for (Path bitcodeFile : bitcodeFiles) {
            String name = moduleName(bitcodeFile);
            Path previous = modules.putIfAbsent(name, bitcodeFile);
            if (previous != null) {
                System.out.println(LOG_WARN + "Multiple bitcode files for module " + name + ", using "
                        + previous.getFileName() + " and ignoring " + bitcodeFile.getFileName());
            }
        }

        List<BitcodeModule> result = new ArrayList<>();
        for (Map.Entry<String, Path> entry : modules.entrySet()) {
            result.add(new BitcodeModule(entry.getKey(), entry.getValue()));
        }
        return result;
    }

    /**
     * Lists the bitcode files directly inside the binaries directory, sorted by file name.
     */
    private List<Path> listBitcodeFiles() throws IOException {
        try (Stream<Path> entries = Files.list(binariesDir)) {
            return entries
                    .filter(Files::isRegularFile)
                    .filter(path -> isBitcodeFile(path.getFileName().toString()))
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    static boolean isBitcodeFile(String fileName) {
        return fileName.endsWith(BITCODE_SUFFIX) && fileName.contains(BITCODE_MARKER)
                && fileName.split("\\.").length >= 5;
    }

    /**
     * Strips the last four dot-separated fields, e.g. {@code fuzzer.0.0.preopt.bc -> fuzzer}.
     */
    static String moduleName(Path bitcodeFile) {
        String[] fields = bitcodeFile.getFileName().toString().split("\\.");
        return String.join(".", Arrays.copyOf(fields, fields.length - 4));
    }
}
