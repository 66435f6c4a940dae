package org.gts3.atlantis.distance;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.CodeSource;

import static org.gts3.atlantis.distance.utils.LogLabel.LOG_ERROR;

/**
 * Main entry point of the distance calculator. Computes the basic-block distance map of a build
 * for a directed fuzzer.
 */
public class Main {
    public static final int EXIT_SUCCESS = 0;
    public static final int EXIT_STEP_FAILED = 1;
    public static final int EXIT_USAGE = 2;
    public static final int EXIT_ENVIRONMENT = 3;

    /**
     * The main entry point of the application.
     *
     * @param args {@code [options] <binaries-dir> <temp-dir> [fuzzer-name]}
     */
    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        ArgumentParser argumentParser;
        try {
            argumentParser = new ArgumentParser(args);
        } catch (IOException e) {
            System.err.println(LOG_ERROR + "Error reading config file: " + e.getMessage());
            return EXIT_USAGE;
        } catch (IllegalArgumentException e) {
            System.err.println(LOG_ERROR + "Argument error: " + e.getMessage());
            return EXIT_USAGE;
        }
        if (argumentParser.isHelpRequested()) {
            return EXIT_SUCCESS;
        }

        PipelineConfig config = argumentParser.getConfig();
        PipelineOrchestrator orchestrator = new PipelineOrchestrator(
                argumentParser.getBinariesDir(),
                argumentParser.getTempDir(),
                argumentParser.getGraphSource(),
                config,
                new OptCallGraphExtractor(config.getOptBinary()),
                RetryPolicy.fromConfig(config));
        return run(orchestrator, args);
    }

    /**
     * Runs a configured pipeline and maps its outcome to an exit code.
     */
    static int run(PipelineOrchestrator orchestrator, String[] args) {
        try {
            Path distanceFile = orchestrator.run();
            printDone(distanceFile);
            return EXIT_SUCCESS;
        } catch (StepFailedException e) {
            System.out.println("-- You can resume by executing:");
            System.out.println("$ " + resumeCommand(args));
            return EXIT_STEP_FAILED;
        } catch (ToolNotFoundException e) {
            System.err.println(LOG_ERROR + e.getMessage());
            return EXIT_ENVIRONMENT;
        } catch (IllegalArgumentException e) {
            System.err.println(LOG_ERROR + e.getMessage());
            return EXIT_USAGE;
        } catch (IOException e) {
            System.err.println(LOG_ERROR + "I/O error: " + e.getMessage());
            return EXIT_STEP_FAILED;
        }
    }

    static String resumeCommand(String[] args) {
        return resumeCommand(launcher(), args);
    }

    static String resumeCommand(String launcher, String[] args) {
        StringBuilder command = new StringBuilder(launcher);
        for (String arg : args) {
            command.append(' ').append(shellQuote(arg));
        }
        return command.toString();
    }

    /**
     * Returns the command that starts this program: {@code java -jar <jar>} when running from
     * the packaged jar, {@code java -cp <classes> <main class>} otherwise.
     */
    static String launcher() {
        CodeSource codeSource = Main.class.getProtectionDomain().getCodeSource();
        if (codeSource == null || codeSource.getLocation() == null) {
            return "java " + Main.class.getName();
        }

        Path location;
        try {
            location = Path.of(codeSource.getLocation().toURI());
        } catch (URISyntaxException | IllegalArgumentException e) {
            return "java " + Main.class.getName();
        }
        if (Files.isRegularFile(location)) {
            return "java -jar " + shellQuote(location.toString());
        }
        return "java -cp " + shellQuote(location.toString()) + " " + Main.class.getName();
    }

    private static String shellQuote(String arg) {
        if (arg.isEmpty() || arg.chars().anyMatch(c -> Character.isWhitespace(c) || c == '\'' || c == '"')) {
            return "'" + arg.replace("'", "'\\''") + "'";
        }
        return arg;
    }

    private static void printDone(Path distanceFile) {
        String distanceFlag = "-distance=" + distanceFile.toAbsolutePath();
        System.out.println();
        System.out.println("----------[DONE]----------");
        System.out.println();
        System.out.println("Now, you may wish to compile your sources with ");
        System.out.println("CFLAGS=\"$CFLAGS " + distanceFlag + "\"");
        System.out.println("CXXFLAGS=\"$CXXFLAGS " + distanceFlag + "\"");
        System.out.println();
        System.out.println("--------------------------");
    }
}
