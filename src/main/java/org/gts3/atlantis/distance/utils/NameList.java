package org.gts3.atlantis.distance.utils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Reader for the one-entry-per-line files produced by the instrumentation pass
 * ({@code Fnames.txt}, {@code Ftargets.txt}, {@code BBnames.txt}, ...).
 */
public class NameList {
    private final LinkedHashSet<String> names;

    private NameList(LinkedHashSet<String> names) {
        this.names = names;
    }

    /**
     * Reads a name list. Lines are trimmed, blank lines are skipped, anything from the first
     * comma on is dropped and duplicates keep their first position.
     *
     * @param path The file to read
     * @return The name list
     * @throws IOException If the file cannot be read
     */
    public static NameList read(Path path) throws IOException {
        return parse(Files.readAllLines(path, StandardCharsets.UTF_8));
    }

    /**
     * Reads a name list if the file exists.
     *
     * @param path The file to read
     * @return The name list, or an empty list if the file does not exist
     * @throws IOException If the file exists but cannot be read
     */
    public static NameList readIfExists(Path path) throws IOException {
        if (!Files.exists(path)) {
            return new NameList(new LinkedHashSet<>());
        }
        return read(path);
    }

    static NameList parse(List<String> lines) {
        LinkedHashSet<String> names = new LinkedHashSet<>();
        for (String line : lines) {
            String name = line;
            int comma = name.indexOf(',');
            if (comma >= 0) {
                name = name.substring(0, comma);
            }
            name = name.trim();
            if (!name.isEmpty()) {
                names.add(name);
            }
        }
        return new NameList(names);
    }

    public static NameList of(String... names) {
        List<String> lines = new ArrayList<>();
        Collections.addAll(lines, names);
        return parse(lines);
    }

    public boolean contains(String name) {
        return names.contains(name);
    }

    public boolean isEmpty() {
        return names.isEmpty();
    }

    public int size() {
        return names.size();
    }

    /**
     * @return The names in first-seen order
     */
    public List<String> asList() {
        return new ArrayList<>(names);
    }
}
