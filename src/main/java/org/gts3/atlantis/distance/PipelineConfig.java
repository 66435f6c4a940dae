package org.gts3.atlantis.distance;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;

import org.gts3.atlantis.distance.solver.Aggregation;

/**
 * Tunables of the distance pipeline, read from an optional JSON file.
 *
 * Keys that are absent from the file keep their defaults.
 */
public class PipelineConfig {
    @SerializedName("max_attempts")
    private int maxAttempts = 5;

    @SerializedName("initial_backoff_ms")
    private long initialBackoffMillis = 500;

    @SerializedName("backoff_multiplier")
    private double backoffMultiplier = 2.0;

    @SerializedName("max_backoff_ms")
    private long maxBackoffMillis = 30_000;

    @SerializedName("aggregation")
    private String aggregation = Aggregation.HARMONIC_MEAN.getName();

    @SerializedName("opt_binary")
    private String optBinary = "opt";

    @SerializedName("ignored_call_graph_nodes")
    private List<String> ignoredCallGraphNodes = new ArrayList<>(List.of("external node", "external calling node"));

    @SerializedName("log_tail_lines")
    private int logTailLines = 30;

    /**
     * @return A configuration with every key at its default
     */
    public static PipelineConfig defaults() {
        return new PipelineConfig();
    }

    /**
     * Reads a JSON configuration file.
     *
     * @param configFile The file to read
     * @return The configuration
     * @throws IOException If the file cannot be read
     * @throws IllegalArgumentException If the file is not valid JSON or holds invalid values
     */
    public static PipelineConfig load(Path configFile) throws IOException {
        Gson gson = new Gson();
        PipelineConfig config;
        try (Reader reader = Files.newBufferedReader(configFile, StandardCharsets.UTF_8)) {
            config = gson.fromJson(reader, PipelineConfig.class);
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Invalid config file " + configFile + ": " + e.getMessage(), e);
        }
        if (config == null) {
            // Empty file
            config = new PipelineConfig();
        }
        config.validate();
        return config;
    }

    /**
     * Checks the value ranges.
     *
     * @throws IllegalArgumentException If a value is out of range
     */
    public void validate() {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("max_attempts must be at least 1, got " + maxAttempts);
        }
        if (initialBackoffMillis < 0 || maxBackoffMillis < 0) {
            throw new IllegalArgumentException("Backoff durations must not be negative");
        }
        if (backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("backoff_multiplier must be at least 1.0, got " + backoffMultiplier);
        }
        if (logTailLines < 0) {
            throw new IllegalArgumentException("log_tail_lines must not be negative, got " + logTailLines);
        }
        if (optBinary == null || optBinary.isBlank()) {
            throw new IllegalArgumentException("opt_binary must not be empty");
        }
        Aggregation.fromName(aggregation);
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public long getInitialBackoffMillis() {
        return initialBackoffMillis;
    }

    public double getBackoffMultiplier() {
        return backoffMultiplier;
    }

    public long getMaxBackoffMillis() {
        return maxBackoffMillis;
    }

    public Aggregation getAggregation() {
        return Aggregation.fromName(aggregation);
    }

    public void setAggregation(Aggregation aggregation) {
        this.aggregation = aggregation.getName();
    }

    public String getOptBinary() {
        return optBinary;
    }

    public void setOptBinary(String optBinary) {
        this.optBinary = optBinary;
    }

    public Set<String> getIgnoredCallGraphNodes() {
        return ignoredCallGraphNodes == null ? Set.of() : new LinkedHashSet<>(ignoredCallGraphNodes);
    }

    public int getLogTailLines() {
        return logTailLines;
    }

    @Override
    public String toString() {
        return "PipelineConfig{" +
                "maxAttempts=" + maxAttempts +
                ", initialBackoffMillis=" + initialBackoffMillis +
                ", backoffMultiplier=" + backoffMultiplier +
                ", maxBackoffMillis=" + maxBackoffMillis +
                ", aggregation='" + aggregation + '\'' +
                ", optBinary='" + optBinary + '\'' +
                ", ignoredCallGraphNodes=" + ignoredCallGraphNodes +
                ", logTailLines=" + logTailLines +
                '}';
    }
}
