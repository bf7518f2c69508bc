package com.archlint.core;

import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Base class for tests that work on a throwaway project directory.
 *
 * <p>Provides a temporary project root and helpers for creating source files and an
 * invariants configuration inside it.
 */
public abstract class ProjectTestBase {

    @TempDir
    protected Path tempDir;

    /**
     * Creates a file in the temp directory with the given content.
     *
     * @param relativePath path relative to tempDir (e.g., "src/db/client.ts")
     * @param content file content
     * @return the created file path
     * @throws IOException if file cannot be created
     */
    protected Path createFile(String relativePath, String content) throws IOException {
        Path filePath = tempDir.resolve(relativePath);
        Files.createDirectories(filePath.getParent());
        Files.writeString(filePath, content);
        return filePath;
    }

    /**
     * Creates multiple files from a map of relative paths to content.
     */
    protected void createFiles(Map<String, String> files) throws IOException {
        for (Map.Entry<String, String> entry : files.entrySet()) {
            createFile(entry.getKey(), entry.getValue());
        }
    }

    /**
     * Writes the invariants file at its default location.
     *
     * @param yaml YAML content
     * @return the invariants file path
     */
    protected Path createInvariants(String yaml) throws IOException {
        return createFile(".archlint/invariants.yml", yaml);
    }
}
