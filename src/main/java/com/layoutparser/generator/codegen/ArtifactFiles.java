package com.layoutparser.generator.codegen;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import com.layoutparser.generator.exception.LayoutGeneratorException;

/**
 * Utility for writing generated artifacts.
 */
public final class ArtifactFiles {

    private ArtifactFiles() {
        // Utility class
    }

    /**
     * Writes content as UTF-8, creating parent directories. An existing file is replaced
     * only when {@code force} is set.
     */
    public static Path write(Path file, String content, boolean force) {
        if (Files.exists(file) && !force) {
            throw new LayoutGeneratorException("Output file already exists: " + file + ". Use --force to overwrite.");
        }
        try {
            Path parentDir = file.getParent();
            if (parentDir != null) {
                Files.createDirectories(parentDir);
            }
            Files.writeString(file, content, StandardCharsets.UTF_8);
            return file;
        } catch (IOException e) {
            throw new LayoutGeneratorException("Failed to write " + file + ": " + e.getMessage(), e);
        }
    }

    public static String fileStem(String name) {
        return name == null || name.isBlank() ? "output" : name.replaceAll("[^A-Za-z0-9._-]", "_");
    }
}
