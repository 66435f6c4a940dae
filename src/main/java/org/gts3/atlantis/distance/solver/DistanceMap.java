package org.gts3.atlantis.distance.solver;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

import org.gts3.atlantis.distance.utils.FileUtils;

import static org.gts3.atlantis.distance.utils.LogLabel.LOG_WARN;

/**
 * An ordered mapping from node names to distances, stored as {@code name,distance} rows.
 *
 * Distances are written with {@link Double#toString(double)}, which reads back to the identical
 * value, so a resumed pipeline reproduces the output of an uninterrupted run byte for byte.
 */
public class DistanceMap {
    private final LinkedHashMap<String, Double> distances = new LinkedHashMap<>();

    /**
     * Sets the distance of a node. A node keeps its first position when it is updated.
     *
     * @param name The node name
     * @param distance The distance, non-negative
     */
    public void put(String name, double distance) {
        if (distance < 0 || Double.isNaN(distance) || Double.isInfinite(distance)) {
            throw new IllegalArgumentException("Invalid distance for " + name + ": " + distance);
        }
        distances.put(name, distance);
    }

    public boolean hasDistance(String name) {
        return distances.containsKey(name);
    }

    /**
     * @param name The node name
     * @return The distance, or empty if the node has no distance
     */
    public OptionalDouble getDistance(String name) {
        Double distance = distances.get(name);
        return distance == null ? OptionalDouble.empty() : OptionalDouble.of(distance);
    }

    public int size() {
        return distances.size();
    }

    public boolean isEmpty() {
        return distances.isEmpty();
    }

    /**
     * @return The node names in insertion order
     */
    public List<String> getNames() {
        return new ArrayList<>(distances.keySet());
    }

    /**
     * @return One {@code name,distance} row per node
     */
    public List<String> toLines() {
        List<String> lines = new ArrayList<>(distances.size());
        for (Map.Entry<String, Double> entry : distances.entrySet()) {
            lines.add(entry.getKey() + "," + entry.getValue());
        }
        return lines;
    }

    /**
     * Writes the rows atomically.
     *
     * @param path The output file
     * @throws IOException If an I/O error occurs
     */
    public void saveToFile(Path path) throws IOException {
        FileUtils.writeLinesAtomically(path, toLines());
    }

    /**
     * Reads a distance file. Rows without a parsable distance after the last comma are skipped.
     *
     * @param path The distance file
     * @return The distance map
     * @throws IOException If the file cannot be read
     */
    public static DistanceMap read(Path path) throws IOException {
        DistanceMap distanceMap = new DistanceMap();
        int skipped = 0;
        for (String line : Files.readAllLines(path, StandardCharsets.UTF_8)) {
            if (line.isBlank()) {
                continue;
            }
            int comma = line.lastIndexOf(',');
            if (comma <= 0) {
                skipped++;
                continue;
            }
            try {
                distanceMap.put(line.substring(0, comma).trim(), Double.parseDouble(line.substring(comma + 1).trim()));
            } catch (IllegalArgumentException e) {
                skipped++;
            }
        }
        if (skipped > 0) {
            System.out.println(LOG_WARN + "Skipped " + skipped + " malformed rows in " + path);
        }
        return distanceMap;
    }

    @Override
    public String toString() {
        return distances.toString();
    }
}
