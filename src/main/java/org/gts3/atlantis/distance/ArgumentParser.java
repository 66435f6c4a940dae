package org.gts3.atlantis.distance;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

import org.gts3.atlantis.distance.graph.GraphSource;
import org.gts3.atlantis.distance.solver.Aggregation;

import static org.gts3.atlantis.distance.utils.LogLabel.LOG_ERROR;

/**
 * Parses the command line of the distance calculator.
 *
 * <pre>
 * java -jar distance-calculator.jar [options] &lt;binaries-dir&gt; &lt;temp-dir&gt; [fuzzer-name]
 * </pre>
 *
 * Options given on the command line override the values of the JSON config file.
 */
public class ArgumentParser {
    private static final String USAGE = "java -jar distance-calculator.jar [options] <binaries-dir> <temp-dir> [fuzzer-name]";

    private final Options options;
    private boolean helpRequested;
    private Path binariesDir;
    private Path tempDir;
    private String fuzzerName;
    private PipelineConfig config;

    /**
     * Constructs a new ArgumentParser and processes the provided command-line arguments.
     *
     * @param args Command-line arguments to parse
     * @throws IOException If the config file cannot be read
     * @throws IllegalArgumentException If the arguments are invalid or incomplete
     */
    public ArgumentParser(String[] args) throws IOException {
        this.options = buildOptions();

        CommandLineParser parser = new DefaultParser();
        CommandLine cmd;
        try {
            cmd = parser.parse(options, args);
        } catch (ParseException e) {
            System.err.println(LOG_ERROR + "Failed to parse arguments: " + e.getMessage());
            printHelp();
            throw new IllegalArgumentException("Failed to parse command line arguments", e);
        }

        if (cmd.hasOption("help")) {
            this.helpRequested = true;
            printHelp();
            return;
        }

        List<String> positional = cmd.getArgList();
        if (positional.size() < 2 || positional.size() > 3) {
            printHelp();
            throw new IllegalArgumentException("Expected <binaries-dir> <temp-dir> [fuzzer-name], got "
                    + positional.size() + " arguments");
        }

        this.binariesDir = Path.of(positional.get(0)).toAbsolutePath().normalize();
        this.tempDir = Path.of(positional.get(1)).toAbsolutePath().normalize();
        this.fuzzerName = positional.size() == 3 ? positional.get(2) : null;

        if (!Files.isDirectory(binariesDir)) {
            throw new IllegalArgumentException("No directory: " + binariesDir);
        }
        if (!Files.isDirectory(tempDir)) {
            throw new IllegalArgumentException("Couldn't find temporary directory " + tempDir);
        }

        // The config file
        this.config = cmd.hasOption("config")
                ? PipelineConfig.load(Path.of(cmd.getOptionValue("config")))
                : PipelineConfig.defaults();

        // Overrides
        if (cmd.hasOption("aggregation")) {
            config.setAggregation(Aggregation.fromName(cmd.getOptionValue("aggregation")));
        }
        if (cmd.hasOption("max-attempts")) {
            try {
                config.setMaxAttempts(Integer.parseInt(cmd.getOptionValue("max-attempts")));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid value for --max-attempts: "
                        + cmd.getOptionValue("max-attempts"), e);
            }
        }
        if (cmd.hasOption("opt")) {
            config.setOptBinary(cmd.getOptionValue("opt"));
        }
        config.validate();
    }

    private static Options buildOptions() {
        Options options = new Options();

        options.addOption(Option.builder("c")
                .longOpt("config")
                .desc("JSON configuration file")
                .hasArg(true)
                .argName("file")
                .build());

        options.addOption(Option.builder("a")
                .longOpt("aggregation")
                .desc("How distances to several targets are combined: harmonic, minimum or arithmetic (default: harmonic)")
                .hasArg(true)
                .argName("name")
                .build());

        options.addOption(Option.builder()
                .longOpt("max-attempts")
                .desc("Maximum number of call graph extraction attempts per module")
                .hasArg(true)
                .argName("n")
                .build());

        options.addOption(Option.builder()
                .longOpt("opt")
                .desc("The LLVM opt executable (default: opt on the PATH)")
                .hasArg(true)
                .argName("path")
                .build());

        options.addOption(Option.builder("h")
                .longOpt("help")
                .desc("Print this help")
                .build());

        return options;
    }

    public void printHelp() {
        new HelpFormatter().printHelp(USAGE, options);
    }

    public boolean isHelpRequested() {
        return helpRequested;
    }

    public Path getBinariesDir() {
        return binariesDir;
    }

    public Path getTempDir() {
        return tempDir;
    }

    /**
     * @return The fuzzer name, or null in whole-program mode
     */
    public String getFuzzerName() {
        return fuzzerName;
    }

    public GraphSource getGraphSource() {
        return fuzzerName == null ? GraphSource.wholeProgram() : GraphSource.singleFuzzer(fuzzerName);
    }

    public PipelineConfig getConfig() {
        return config;
    }
}
