package org.gts3.atlantis.distance;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;

import org.gts3.atlantis.distance.utils.FileUtils;

import static org.gts3.atlantis.distance.utils.LogLabel.LOG_WARN;

/**
 * The persisted progress of the pipeline ({@code <tempDir>/state}).
 *
 * A checkpoint names the last completed step and the fingerprint of the inputs it was computed
 * from. It is written only after a step has succeeded.
 */
public class Checkpoint {
    public static final String STATE_FILE = "state";

    private static final Gson gson = new GsonBuilder().setPrettyPrinting().create();

    @SerializedName("step")
    private int step;

    @SerializedName("step_name")
    private String stepName;

    @SerializedName("input_hash")
    private String inputHash;

    public Checkpoint(PipelineStep completedStep, String inputHash) {
        this.step = completedStep.getNumber();
        this.stepName = completedStep.getStepName();
        this.inputHash = inputHash;
    }

    /**
     * @return The number of the last completed step
     */
    public int getStep() {
        return step;
    }

    public String getStepName() {
        return stepName;
    }

    public String getInputHash() {
        return inputHash;
    }

    /**
     * Loads the checkpoint of a temp directory.
     *
     * @param tempDir The pipeline temp directory
     * @return The checkpoint, or empty if there is none or it cannot be used
     */
    public static Optional<Checkpoint> load(Path tempDir) {
        Path stateFile = tempDir.resolve(STATE_FILE);
        if (!Files.exists(stateFile)) {
            return Optional.empty();
        }

        Checkpoint checkpoint;
        try (Reader reader = Files.newBufferedReader(stateFile, StandardCharsets.UTF_8)) {
            checkpoint = gson.fromJson(reader, Checkpoint.class);
        } catch (IOException | JsonParseException e) {
            System.out.println(LOG_WARN + "Ignoring unreadable checkpoint " + stateFile + ": " + e.getMessage());
            return Optional.empty();
        }

        if (checkpoint == null || checkpoint.inputHash == null
                || checkpoint.step < 1 || checkpoint.step > PipelineStep.values().length) {
            System.out.println(LOG_WARN + "Ignoring invalid checkpoint " + stateFile);
            return Optional.empty();
        }
        return Optional.of(checkpoint);
    }

    /**
     * Persists this checkpoint atomically.
     *
     * @param tempDir The pipeline temp directory
     * @throws IOException If the state file cannot be written
     */
    public void save(Path tempDir) throws IOException {
        String json = gson.toJson(this);
        FileUtils.writeLinesAtomically(tempDir.resolve(STATE_FILE), List.of(json));
    }

    @Override
    public String toString() {
        return "Checkpoint{" +
                "step=" + step +
                ", stepName='" + stepName + '\'' +
                ", inputHash='" + inputHash + '\'' +
                '}';
    }
}
