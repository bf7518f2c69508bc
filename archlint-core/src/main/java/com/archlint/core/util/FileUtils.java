package com.archlint.core.util;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Utility class for file operations.
 */
public final class FileUtils {

    private FileUtils() {
        // Utility class
    }

    /**
     * Finds source files below a root directory, pruning ignored directories.
     *
     * <p>Returned paths are relative to {@code root}, use {@code /} as separator and are sorted.
     *
     * @param root directory to walk
     * @param ignoredDirectories directory names whose subtrees are skipped
     * @param accept predicate deciding which regular files are returned
     * @return sorted relative paths
     * @throws IOException if directory traversal fails
     */
    public static List<String> findSourceFiles(Path root, Set<String> ignoredDirectories,
                                               Predicate<Path> accept) throws IOException {
        if (!Files.isDirectory(root)) {
            return List.of();
        }
        List<String> files = new ArrayList<>();
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (!dir.equals(root) && ignoredDirectories.contains(dir.getFileName().toString())) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (attrs.isRegularFile() && accept.test(file)) {
                    files.add(toUnixPath(root.relativize(file)));
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) {
                return FileVisitResult.CONTINUE;
            }
        });
        Collections.sort(files);
        return files;
    }

    /**
     * Finds the directories below a root directory, pruning ignored directories.
     *
     * <p>The root itself is not returned. Paths are relative, {@code /}-separated and sorted.
     *
     * @param root directory to walk
     * @param ignoredDirectories directory names whose subtrees are skipped
     * @return sorted relative directory paths
     * @throws IOException if directory traversal fails
     */
    public static List<String> findDirectories(Path root, Set<String> ignoredDirectories) throws IOException {
        if (!Files.isDirectory(root)) {
            return List.of();
        }
        List<String> directories = new ArrayList<>();
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (dir.equals(root)) {
                    return FileVisitResult.CONTINUE;
                }
                if (ignoredDirectories.contains(dir.getFileName().toString())) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                directories.add(toUnixPath(root.relativize(dir)));
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) {
                return FileVisitResult.CONTINUE;
            }
        });
        Collections.sort(directories);
        return directories;
    }

    /**
     * Reads a file as UTF-8, replacing malformed byte sequences instead of failing.
     *
     * @param path path to file
     * @return file content
     * @throws IOException if reading fails
     */
    public static String readLenient(Path path) throws IOException {
        return new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
    }

    /**
     * Converts a relative path to its {@code /}-separated string form.
     *
     * @param path relative path
     * @return path string using forward slashes
     */
    public static String toUnixPath(Path path) {
        return path.toString().replace('\\', '/');
    }

    /**
     * Gets the lower-cased extension of a file name, without the dot.
     *
     * @param fileName file name or path
     * @return extension, or empty string if there is none
     */
    public static String getExtension(String fileName) {
        String name = getFileName(fileName);
        int dot = name.lastIndexOf('.');
        if (dot <= 0 || dot == name.length() - 1) {
            return "";
        }
        return name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    /**
     * Gets the last component of a {@code /}-separated path.
     *
     * @param path path string
     * @return file name
     */
    public static String getFileName(String path) {
        String normalized = path.replace('\\', '/');
        int slash = normalized.lastIndexOf('/');
        return slash >= 0 ? normalized.substring(slash + 1) : normalized;
    }

    /**
     * Resolves a relative import specifier against the directory of the importing file.
     *
     * <p>Specifiers not starting with {@code .} are returned unchanged. Resolution follows POSIX
     * path normalization: {@code src/routes/users.ts} importing {@code ../db/client} resolves
     * to {@code src/db/client}.
     *
     * @param sourceFile {@code /}-separated path of the importing file
     * @param specifier import specifier
     * @return resolved specifier
     */
    public static String resolveImport(String sourceFile, String specifier) {
        if (!specifier.startsWith(".")) {
            return specifier;
        }
        String directory = getParent(sourceFile);
        return normalize(directory.isEmpty() ? specifier : directory + "/" + specifier);
    }

    /**
     * Gets the parent of a {@code /}-separated path.
     *
     * @param path path string
     * @return parent path, or empty string for a bare file name
     */
    public static String getParent(String path) {
        int slash = path.lastIndexOf('/');
        return slash >= 0 ? path.substring(0, slash) : "";
    }

    /**
     * Normalizes a {@code /}-separated path, collapsing {@code .} and {@code ..} segments.
     *
     * <p>Leading {@code ..} segments of a relative path are kept; an empty result is {@code .}.
     *
     * @param path path string
     * @return normalized path
     */
    public static String normalize(String path) {
        if (path.isEmpty()) {
            return ".";
        }
        boolean absolute = path.startsWith("/");
        List<String> segments = new ArrayList<>();
        for (String segment : path.split("/")) {
            if (segment.isEmpty() || segment.equals(".")) {
                continue;
            }
            if (segment.equals("..")) {
                if (!segments.isEmpty() && !segments.get(segments.size() - 1).equals("..")) {
                    segments.remove(segments.size() - 1);
                } else if (!absolute) {
                    segments.add(segment);
                }
                continue;
            }
            segments.add(segment);
        }
        String joined = String.join("/", segments);
        if (absolute) {
            return "/" + joined;
        }
        return joined.isEmpty() ? "." : joined;
    }

    /**
     * Removes the last extension from a file name.
     *
     * @param fileName file name
     * @return file name without its extension
     */
    public static String stripExtension(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
