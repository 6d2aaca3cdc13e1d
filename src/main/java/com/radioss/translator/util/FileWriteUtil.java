package com.radioss.translator.util;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * File operations for deck output with automatic directory creation.
 */
public class FileWriteUtil {

    private FileWriteUtil() {
        // Utility class
    }

    /**
     * Writes content as UTF-8, creating parent directories if needed.
     * The writer is closed on every exit path.
     */
    public static void safeWriteString(Path filePath, String content) throws IOException {
        Path parentDir = filePath.toAbsolutePath().getParent();
        if (parentDir != null) {
            Files.createDirectories(parentDir);
        }
        try (BufferedWriter writer = Files.newBufferedWriter(filePath, StandardCharsets.UTF_8)) {
            writer.write(content);
        }
    }

    /**
     * Fails when any of the given files already exists.
     */
    public static void requireAbsent(Path... files) throws IOException {
        for (Path file : files) {
            if (Files.exists(file)) {
                throw new IOException("Output file already exists: " + file + ". Use --force to overwrite.");
            }
        }
    }
}
