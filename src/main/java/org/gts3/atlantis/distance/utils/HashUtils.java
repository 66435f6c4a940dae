package org.gts3.atlantis.distance.utils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Incremental SHA-256 fingerprint over strings and files.
 *
 * Used to tie a persisted checkpoint to the inputs it was computed from.
 */
public class HashUtils {
    private final MessageDigest digest;

    public HashUtils() {
        try {
            this.digest = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            // Every JDK ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Adds a string to the fingerprint. Each value is terminated so that ("ab", "c") and
     * ("a", "bc") hash differently.
     *
     * @param value The value to add
     * @return this
     */
    public HashUtils update(String value) {
        digest.update(value.getBytes(StandardCharsets.UTF_8));
        digest.update((byte) 0);
        return this;
    }

    /**
     * Adds a file's name and content to the fingerprint. A missing file contributes a marker,
     * so creating an optional input later also changes the hash.
     *
     * @param file The file to add
     * @return this
     * @throws IOException If the file exists but cannot be read
     */
    public HashUtils update(Path file) throws IOException {
        update(file.getFileName().toString());
        if (Files.exists(file)) {
            digest.update(Files.readAllBytes(file));
        } else {
            update("<missing>");
        }
        digest.update((byte) 0);
        return this;
    }

    /**
     * Adds a file's name, size and modification time to the fingerprint. Used for inputs too
     * large to read on every run.
     *
     * @param file The file to add
     * @return this
     * @throws IOException If the file exists but its attributes cannot be read
     */
    public HashUtils updateMetadata(Path file) throws IOException {
        update(file.getFileName().toString());
        if (Files.exists(file)) {
            update(Long.toString(Files.size(file)));
            update(Long.toString(Files.getLastModifiedTime(file).toMillis()));
        } else {
            update("<missing>");
        }
        return this;
    }

    /**
     * Returns the hexadecimal representation of the fingerprint.
     *
     * @return The hash in lower-case hex
     */
    public String toHex() {
        byte[] hashBytes = digest.digest();

        StringBuilder hexString = new StringBuilder();
        for (byte b : hashBytes) {
            String hex = Integer.toHexString(0xff & b);
            if (hex.length() == 1) {
                hexString.append('0');
            }
            hexString.append(hex);
        }
        return hexString.toString();
    }
}
