package com.archlint.core.rules;

import com.archlint.core.extractor.ImportExtractors;
import com.archlint.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A project file under evaluation.
 *
 * <p>Content, lines and imports are loaded lazily on first use and then reused by every
 * invariant evaluated against the file, so out-of-scope invariants never cause file I/O.
 * Instances are confined to one worker thread.
 */
public final class SourceFile {

    private static final Logger log = LoggerFactory.getLogger(SourceFile.class);

    private final Path projectRoot;
    private final String relativePath;
    private final Path path;

    private String content;
    private List<String> lines;
    private List<String> imports;

    private SourceFile(Path projectRoot, String relativePath) {
        this.projectRoot = Objects.requireNonNull(projectRoot, "projectRoot must not be null");
        this.relativePath = Objects.requireNonNull(relativePath, "relativePath must not be null");
        this.path = projectRoot.resolve(relativePath);
    }

    /**
     * Creates a source file for a project-relative path.
     *
     * @param projectRoot project root directory
     * @param relativePath {@code /}-separated path relative to the root
     * @return new source file
     */
    public static SourceFile of(Path projectRoot, String relativePath) {
        return new SourceFile(projectRoot, relativePath);
    }

    public Path projectRoot() {
        return projectRoot;
    }

    public String relativePath() {
        return relativePath;
    }

    public Path path() {
        return path;
    }

    public boolean exists() {
        return Files.isRegularFile(path);
    }

    /**
     * Returns the file content, or an empty string if it cannot be read.
     */
    public String content() {
        if (content == null) {
            try {
                content = FileUtils.readLenient(path);
            } catch (IOException e) {
                log.debug("Cannot read {}: {}", path, e.getMessage());
                content = "";
            }
        }
        return content;
    }

    /**
     * Returns the file's lines without terminators.
     */
    public List<String> lines() {
        if (lines == null) {
            List<String> result = new ArrayList<>();
            String text = content();
            if (!text.isEmpty()) {
                for (String line : text.split("\n", -1)) {
                    result.add(line.endsWith("\r") ? line.substring(0, line.length() - 1) : line);
                }
                if (text.endsWith("\n")) {
                    result.remove(result.size() - 1);
                }
            }
            lines = List.copyOf(result);
        }
        return lines;
    }

    /**
     * Returns the import specifiers of the file.
     */
    public List<String> imports() {
        if (imports == null) {
            imports = ImportExtractors.extract(relativePath, content());
        }
        return imports;
    }

    @Override
    public String toString() {
        return relativePath;
    }
}
