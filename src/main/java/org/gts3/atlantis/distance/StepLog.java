package org.gts3.atlantis.distance;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;

import org.gts3.atlantis.distance.utils.FileUtils;

import static org.gts3.atlantis.distance.utils.LogLabel.LOG_ERROR;
import static org.gts3.atlantis.distance.utils.LogLabel.LOG_WARN;

/**
 * Console and file log of one pipeline step ({@code step<N>.log}).
 *
 * Console lines carry the {@code (N) } step prefix. The log file also receives the stderr of
 * external tools, and its tail is shown when the step fails.
 */
public class StepLog {
    private final PipelineStep step;
    private final Path logFile;

    /**
     * Starts a fresh log for a step, truncating the log of an earlier attempt.
     *
     * @param tempDir The pipeline temp directory
     * @param step The step
     * @return The log
     * @throws IOException If the log file cannot be created
     */
    public static StepLog start(Path tempDir, PipelineStep step) throws IOException {
        Path logFile = logFileOf(tempDir, step);
        Files.writeString(logFile, "", StandardCharsets.UTF_8);
        return new StepLog(step, logFile);
    }

    public static Path logFileOf(Path tempDir, PipelineStep step) {
        return tempDir.resolve("step" + step.getNumber() + ".log");
    }

    private StepLog(PipelineStep step, Path logFile) {
        this.step = step;
        this.logFile = logFile;
    }

    public PipelineStep getStep() {
        return step;
    }

    public Path getLogFile() {
        return logFile;
    }

    public void info(String message) {
        System.out.println("(" + step.getNumber() + ") " + message);
        append(message);
    }

    public void warn(String message) {
        System.out.println(LOG_WARN + "(" + step.getNumber() + ") " + message);
        append("WARNING: " + message);
    }

    public void error(String message) {
        System.err.println(LOG_ERROR + "(" + step.getNumber() + ") " + message);
        append("ERROR: " + message);
    }

    /**
     * @param maxLines The maximum number of lines
     * @return The last lines of the log file
     */
    public List<String> tail(int maxLines) {
        return FileUtils.tail(logFile, maxLines);
    }

    private void append(String message) {
        try {
            Files.writeString(logFile, message + System.lineSeparator(), StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            System.err.println(LOG_ERROR + "Error writing to " + logFile + ": " + e.getMessage());
        }
    }
}
