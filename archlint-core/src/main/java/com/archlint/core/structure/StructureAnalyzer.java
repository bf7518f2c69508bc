package com.archlint.core.structure;

import com.archlint.core.config.ScanOptions;
import com.archlint.core.extractor.SourceLanguage;
import com.archlint.core.model.DirectoryCount;
import com.archlint.core.model.StructureReport;
import com.archlint.core.rules.SourceFile;
import com.archlint.core.rules.impl.TestColocationChecker;
import com.archlint.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Summarizes the layout of a project.
 *
 * <p>One pass over the tree, with the scan's ignored directories pruned, yields:
 * <ul>
 *   <li>the directory skeleton to a depth of three</li>
 *   <li>which conventional layer directories ({@code routes}, {@code services}, ...) exist</li>
 *   <li>the most common multi-part source extensions, most frequent first</li>
 *   <li>source files lacking a colocated test, judged by {@link TestColocationChecker}</li>
 *   <li>file counts per top-level directory</li>
 * </ul>
 */
public class StructureAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(StructureAnalyzer.class);

    static final int MAX_DEPTH = 3;
    static final int MAX_NAMING_PATTERNS = 20;

    /** Layer directory names in reporting order. */
    static final List<String> KNOWN_LAYERS = List.of(
        "routes", "controllers", "controller", "services", "service",
        "repositories", "repository", "models", "model", "middleware",
        "utils", "util", "lib", "helpers", "types", "handlers", "resolvers",
        "stores", "hooks", "components", "pages", "app", "api", "db",
        "database", "config", "auth", "tests", "test", "__tests__",
        "entity", "entities", "dto", "converter", "mapper", "filter",
        "interceptor", "domain", "infrastructure", "adapter", "port",
        "presenter", "exception", "exceptions"
    );

    private static final Pattern MULTI_PART_EXTENSION = Pattern.compile("\\.[a-zA-Z]+\\.[a-z]+$");

    private final TestColocationChecker testChecker;

    public StructureAnalyzer() {
        this(new TestColocationChecker());
    }

    StructureAnalyzer(TestColocationChecker testChecker) {
        this.testChecker = testChecker;
    }

    /**
     * Analyzes a project tree.
     *
     * @param projectRoot project root directory
     * @param options supplies the ignored directory names
     * @return structure report; empty if the root is not a directory
     * @throws IOException if the tree cannot be walked
     */
    public StructureReport analyze(Path projectRoot, ScanOptions options) throws IOException {
        Path root = projectRoot.toAbsolutePath().normalize();
        Set<String> ignored = options.ignoredDirectories();

        List<String> directories = FileUtils.findDirectories(root, ignored);
        List<String> files = FileUtils.findSourceFiles(root, ignored, path -> true);
        log.debug("Analyzing structure of {}: {} directories, {} files", root, directories.size(), files.size());

        return new StructureReport(
            rawStructure(directories),
            detectedLayers(directories),
            namingPatterns(files),
            testGaps(root, files),
            fileCounts(files)
        );
    }

    private static List<String> rawStructure(List<String> directories) {
        return directories.stream()
            .filter(dir -> depth(dir) <= MAX_DEPTH)
            .toList();
    }

    private static List<String> detectedLayers(List<String> directories) {
        Set<String> names = new HashSet<>();
        for (String dir : directories) {
            names.add(FileUtils.getFileName(dir));
        }
        return KNOWN_LAYERS.stream().filter(names::contains).toList();
    }

    private static List<String> namingPatterns(List<String> files) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (String file : files) {
            if (SourceLanguage.fromPath(file).isEmpty()) {
                continue;
            }
            Matcher matcher = MULTI_PART_EXTENSION.matcher(FileUtils.getFileName(file));
            if (matcher.find()) {
                counts.merge(matcher.group(), 1, Integer::sum);
            }
        }
        // stable sort keeps first-seen order among equal counts
        List<Map.Entry<String, Integer>> entries = new ArrayList<>(counts.entrySet());
        entries.sort(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder()));
        return entries.stream()
            .limit(MAX_NAMING_PATTERNS)
            .map(Map.Entry::getKey)
            .toList();
    }

    private List<String> testGaps(Path root, List<String> files) {
        List<String> gaps = new ArrayList<>();
        for (String file : files) {
            if (SourceLanguage.fromPath(file).isPresent() && !testChecker.hasTest(SourceFile.of(root, file))) {
                gaps.add(file);
            }
        }
        return gaps;
    }

    private static List<DirectoryCount> fileCounts(List<String> files) {
        Map<String, Integer> counts = new TreeMap<>();
        for (String file : files) {
            int slash = file.indexOf('/');
            if (slash > 0) {
                counts.merge(file.substring(0, slash), 1, Integer::sum);
            }
        }
        return counts.entrySet().stream()
            .map(entry -> new DirectoryCount(entry.getKey(), entry.getValue()))
            .toList();
    }

    private static int depth(String dir) {
        int depth = 1;
        for (int i = 0; i < dir.length(); i++) {
            if (dir.charAt(i) == '/') {
                depth++;
            }
        }
        return depth;
    }
}
