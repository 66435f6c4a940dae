package org.gts3.atlantis.distance.utils;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.Consumer;
import java.util.stream.Stream;

import static org.gts3.atlantis.distance.utils.LogLabel.LOG_ERROR;

/**
 * Utility class for file operations.
 *
 * Every artifact of the pipeline is written through {@link #writeFileAtomically(Path, Consumer)}
 * so that an interrupted run never leaves a half-written distance file behind for the resume.
 */
public class FileUtils {

    /**
     * Writes content to a file atomically using a temporary file approach.
     * This method creates a temporary file, writes the content to it, and then
     * atomically moves it to the target location.
     *
     * @param targetPath The path where the file should be created
     * @param contentWriter A consumer that writes the content to the provided path; it reports
     *                      I/O problems as {@link UncheckedIOException}
     * @throws IOException If an I/O error occurs during the operation
     */
    public static void writeFileAtomically(Path targetPath, Consumer<Path> contentWriter) throws IOException {
        ensureParentDirectoryExists(targetPath);

        Path tempFile = null;
        try {
            tempFile = Files.createTempFile(targetPath.toAbsolutePath().getParent(),
                    ".hidden." + targetPath.getFileName().toString(), "");

            try {
                contentWriter.accept(tempFile);
            } catch (UncheckedIOException e) {
                throw e.getCause();
            }

            Files.move(tempFile, targetPath, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            tempFile = null; // Mark as successfully moved
        } finally {
            if (tempFile != null) {
                try {
                    Files.deleteIfExists(tempFile);
                } catch (IOException cleanupException) {
                    System.err.println(LOG_ERROR + "Error cleaning up temporary file: " + cleanupException.getMessage());
                }
            }
        }
    }

    /**
     * Writes the given lines, each terminated by a newline, atomically to a file.
     *
     * @param targetPath The file to write
     * @param lines The lines to write
     * @throws IOException If an I/O error occurs
     */
    public static void writeLinesAtomically(Path targetPath, List<String> lines) throws IOException {
        writeFileAtomically(targetPath, tempPath -> {
            try {
                Files.write(tempPath, lines, StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        });
    }

    /**
     * Concatenates the given files into one target file, in the given order.
     *
     * @param targetPath The file to write
     * @param parts The files to concatenate; missing files are skipped
     * @throws IOException If an I/O error occurs
     */
    public static void concatenate(Path targetPath, List<Path> parts) throws IOException {
        writeFileAtomically(targetPath, tempPath -> {
            try {
                for (Path part : parts) {
                    if (Files.exists(part)) {
                        Files.write(tempPath, Files.readAllBytes(part), StandardOpenOption.APPEND);
                    }
                }
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        });
    }

    /**
     * Returns the last lines of a text file.
     *
     * @param path The file to read
     * @param maxLines The maximum number of lines to return
     * @return The trailing lines, or an empty list if the file does not exist or cannot be read
     */
    public static List<String> tail(Path path, int maxLines) {
        Deque<String> window = new ArrayDeque<>();
        if (!Files.exists(path) || maxLines <= 0) {
            return new ArrayList<>();
        }

        try (Stream<String> lines = Files.lines(path, StandardCharsets.UTF_8)) {
            lines.forEach(line -> {
                window.addLast(line);
                if (window.size() > maxLines) {
                    window.removeFirst();
                }
            });
        } catch (IOException | UncheckedIOException e) {
            System.err.println(LOG_ERROR + "Error reading " + path + ": " + e.getMessage());
        }
        return new ArrayList<>(window);
    }

    /**
     * Checks if a file exists and contains at least one non-blank line.
     *
     * @param path The file to check
     * @return true if the file has content
     */
    public static boolean hasContent(Path path) {
        if (!Files.isRegularFile(path)) {
            return false;
        }
        try (Stream<String> lines = Files.lines(path, StandardCharsets.UTF_8)) {
            return lines.anyMatch(line -> !line.isBlank());
        } catch (IOException | UncheckedIOException e) {
            return false;
        }
    }

    /**
     * Ensures the parent directory of a file exists, creating it if necessary.
     *
     * @param path The file whose parent directory should exist
     * @throws IOException If the parent directory cannot be created
     */
    private static void ensureParentDirectoryExists(Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null && !Files.exists(parent)) {
            Files.createDirectories(parent);
        }
    }
}
