package com.archlint.core.rules.impl;

import com.archlint.core.rules.SourceFile;
import com.archlint.core.util.FileUtils;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Looks for a test accompanying a source file, following each language's conventions.
 *
 * <table>
 *   <caption>Accepted test locations</caption>
 *   <tr><th>Language</th><th>Sibling</th><th>Mirror</th></tr>
 *   <tr><td>any</td><td>{@code foo.test.ext}, {@code foo.spec.ext}</td><td></td></tr>
 *   <tr><td>Java</td><td>{@code FooTest}, {@code FooTests}, {@code FooIT}</td><td>{@code src/main/java} to {@code src/test/java}</td></tr>
 *   <tr><td>Go</td><td>{@code foo_test.go}</td><td></td></tr>
 *   <tr><td>Rust</td><td>{@code #[cfg(test)]} in the file</td><td>{@code tests/foo.rs}, {@code tests/test_foo.rs} at the project root</td></tr>
 *   <tr><td>Dart</td><td>{@code foo_test.dart}</td><td>{@code lib/} to {@code test/}</td></tr>
 *   <tr><td>Kotlin</td><td>{@code FooTest.kt}, {@code FooTests.kt}</td><td>{@code src/main/kotlin|java} to {@code src/test/kotlin|java}</td></tr>
 *   <tr><td>Swift</td><td>{@code FooTests.swift}</td><td>{@code Sources/} to {@code Tests/}</td></tr>
 *   <tr><td>C#</td><td>{@code FooTests.cs}, {@code FooTest.cs}</td><td></td></tr>
 *   <tr><td>PHP</td><td>{@code FooTest.php}</td><td>{@code src/} to {@code tests/}</td></tr>
 *   <tr><td>Ruby</td><td>{@code foo_test.rb}, {@code foo_spec.rb}</td><td>{@code app/} to {@code test/} and {@code spec/}</td></tr>
 * </table>
 *
 * <p>Files with other extensions, and files that are themselves tests, always count as tested.
 */
public class TestColocationChecker {

    private static final List<Pattern> TEST_FILE_PATTERNS = List.of(
        Pattern.compile("\\.(test|spec)\\."),
        Pattern.compile("\\.d\\.ts$"),
        Pattern.compile("(Test|Tests|IT|Spec)\\.java$"),
        Pattern.compile("_test\\.(go|dart|rb)$"),
        Pattern.compile("_spec\\.rb$"),
        Pattern.compile("(Test|Tests)\\.kt$"),
        Pattern.compile("Tests\\.swift$"),
        Pattern.compile("(Tests|Test)\\.cs$"),
        Pattern.compile("Test\\.php$")
    );

    private static final Pattern SOURCE_EXTENSION =
        Pattern.compile("\\.(ts|js|py|java|go|rs|dart|kt|kts|swift|cs|php|rb)$");

    /**
     * Checks whether a file has a colocated test.
     *
     * @param file source file
     * @return true if a test was found or the file needs none
     */
    public boolean hasTest(SourceFile file) {
        String relativePath = file.relativePath();
        if (!SOURCE_EXTENSION.matcher(relativePath).find() || isTestFile(relativePath)) {
            return true;
        }

        Path root = file.projectRoot();
        String extension = FileUtils.getExtension(relativePath);
        String base = FileUtils.stripExtension(relativePath);
        if (exists(root, base + ".test." + extension) || exists(root, base + ".spec." + extension)) {
            return true;
        }

        String rooted = "/" + base;
        return switch (extension) {
            case "java" -> anyExists(root, base, "Test.java", "Tests.java", "IT.java")
                || (rooted.contains("/src/main/java/")
                    && anyExists(root, mirror(rooted, "/src/main/java/", "/src/test/java/"), "Test.java", "Tests.java", "IT.java"));
            case "go" -> exists(root, base + "_test.go");
            case "rs" -> file.content().contains("#[cfg(test)]")
                || exists(root, "tests/" + FileUtils.getFileName(base) + ".rs")
                || exists(root, "tests/test_" + FileUtils.getFileName(base) + ".rs");
            case "dart" -> exists(root, base + "_test.dart")
                || (rooted.contains("/lib/") && exists(root, mirror(rooted, "/lib/", "/test/") + "_test.dart"));
            case "kt", "kts" -> anyExists(root, base, "Test.kt", "Tests.kt")
                || (rooted.contains("/src/main/") && anyExists(root, kotlinMirror(rooted), "Test.kt", "Tests.kt"));
            case "swift" -> exists(root, base + "Tests.swift")
                || (rooted.contains("/Sources/") && exists(root, mirror(rooted, "/Sources/", "/Tests/") + "Tests.swift"));
            case "cs" -> anyExists(root, base, "Tests.cs", "Test.cs");
            case "php" -> exists(root, base + "Test.php")
                || (rooted.contains("/src/") && exists(root, mirror(rooted, "/src/", "/tests/") + "Test.php"));
            case "rb" -> anyExists(root, base, "_test.rb", "_spec.rb")
                || (rooted.contains("/app/")
                    && (exists(root, mirror(rooted, "/app/", "/test/") + "_test.rb")
                        || exists(root, mirror(rooted, "/app/", "/spec/") + "_spec.rb")));
            default -> false;
        };
    }

    /**
     * Checks whether a path names a test file.
     *
     * @param relativePath project-relative path
     * @return true for test and type-definition files
     */
    public static boolean isTestFile(String relativePath) {
        for (Pattern pattern : TEST_FILE_PATTERNS) {
            if (pattern.matcher(relativePath).find()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Replaces every occurrence of {@code from} in a {@code /}-rooted path and drops the root.
     */
    private static String mirror(String rooted, String from, String to) {
        String replaced = rooted.replace(from, to);
        return replaced.startsWith("/") ? replaced.substring(1) : replaced;
    }

    private static String kotlinMirror(String rooted) {
        return mirror(rooted.replace("/src/main/kotlin/", "/src/test/kotlin/"), "/src/main/java/", "/src/test/java/");
    }

    private static boolean anyExists(Path root, String base, String... suffixes) {
        for (String suffix : suffixes) {
            if (exists(root, base + suffix)) {
                return true;
            }
        }
        return false;
    }

    private static boolean exists(Path root, String relativePath) {
        return Files.isRegularFile(root.resolve(relativePath));
    }
}
