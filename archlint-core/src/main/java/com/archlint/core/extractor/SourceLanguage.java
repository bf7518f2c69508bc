package com.archlint.core.extractor;

import com.archlint.core.extractor.impl.dart.DartImportExtractor;
import com.archlint.core.extractor.impl.dotnet.CSharpImportExtractor;
import com.archlint.core.extractor.impl.go.GoImportExtractor;
import com.archlint.core.extractor.impl.java.JavaImportExtractor;
import com.archlint.core.extractor.impl.javascript.JavaScriptImportExtractor;
import com.archlint.core.extractor.impl.kotlin.KotlinImportExtractor;
import com.archlint.core.extractor.impl.php.PhpImportExtractor;
import com.archlint.core.extractor.impl.python.PythonImportExtractor;
import com.archlint.core.extractor.impl.ruby.RubyImportExtractor;
import com.archlint.core.extractor.impl.rust.RustImportExtractor;
import com.archlint.core.extractor.impl.swift.SwiftImportExtractor;
import com.archlint.core.util.FileUtils;

import java.nio.file.Path;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Languages with import extraction support, selected by file extension.
 *
 * <p>Each language owns exactly one stateless {@link ImportExtractor}.
 */
public enum SourceLanguage {
    JAVASCRIPT("JavaScript/TypeScript", List.of("ts", "tsx", "js", "jsx", "mjs", "cjs"), JavaScriptImportExtractor::new),
    PYTHON("Python", List.of("py"), PythonImportExtractor::new),
    GO("Go", List.of("go"), GoImportExtractor::new),
    RUST("Rust", List.of("rs"), RustImportExtractor::new),
    JAVA("Java", List.of("java"), JavaImportExtractor::new),
    DART("Dart", List.of("dart"), DartImportExtractor::new),
    KOTLIN("Kotlin", List.of("kt", "kts"), KotlinImportExtractor::new),
    SWIFT("Swift", List.of("swift"), SwiftImportExtractor::new),
    CSHARP("C#", List.of("cs"), CSharpImportExtractor::new),
    PHP("PHP", List.of("php"), PhpImportExtractor::new),
    RUBY("Ruby", List.of("rb"), RubyImportExtractor::new);

    private static final Map<String, SourceLanguage> BY_EXTENSION;

    static {
        Map<String, SourceLanguage> byExtension = new HashMap<>();
        for (SourceLanguage language : values()) {
            for (String extension : language.extensions) {
                byExtension.put(extension, language);
            }
        }
        BY_EXTENSION = Collections.unmodifiableMap(byExtension);
    }

    private final String displayName;
    private final List<String> extensions;
    private final ImportExtractor extractor;

    SourceLanguage(String displayName, List<String> extensions, Supplier<ImportExtractor> factory) {
        this.displayName = displayName;
        this.extensions = extensions;
        this.extractor = factory.get();
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Returns the file extensions of this language, without dots.
     */
    public List<String> getExtensions() {
        return extensions;
    }

    public ImportExtractor getExtractor() {
        return extractor;
    }

    /**
     * Resolves the language of a file from its extension, ignoring case.
     *
     * @param path file path or name
     * @return language, or empty if the extension is not supported
     */
    public static Optional<SourceLanguage> fromPath(String path) {
        return Optional.ofNullable(BY_EXTENSION.get(FileUtils.getExtension(path)));
    }

    public static Optional<SourceLanguage> fromPath(Path path) {
        Path fileName = path.getFileName();
        return fileName == null ? Optional.empty() : fromPath(fileName.toString());
    }

    /**
     * Checks whether a file has a supported extension.
     */
    public static boolean isSupported(Path path) {
        return fromPath(path).isPresent();
    }

    /**
     * Returns every supported extension.
     */
    public static Set<String> allExtensions() {
        return BY_EXTENSION.keySet();
    }
}
