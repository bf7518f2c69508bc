package com.archlint.core.extractor.impl.java;

import com.archlint.core.extractor.ExtractorTestBase;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Functional tests for {@link JavaImportExtractor}.
 */
class JavaImportExtractorTest extends ExtractorTestBase {

    @Test
    void extract_withImports_returnsQualifiedNames() {
        // Given: Single-type, static and on-demand imports
        String source = """
            package com.example;

            import java.util.List;
            import static java.util.Objects.requireNonNull;
            import com.example.service.*;
            // import commented.Thing;

            public class Foo {
                private final String text = "import not.an.Import;";
            }
            """;

        // Then: Names are returned as declared, with .* for on-demand imports
        assertThat(extract("Foo.java", source)).containsExactly(
            "java.util.List", "java.util.Objects.requireNonNull", "com.example.service.*");
    }

    @Test
    void extract_withModernSyntax_parses() {
        String source = """
            import java.util.Map;

            record Point(int x, int y) {
                String describe(String o) {
                    return switch (o) {
                        case "a" -> "letter";
                        default -> \"""
                            text block
                            \""";
                    };
                }
            }
            """;

        assertThat(extract("Point.java", source)).containsExactly("java.util.Map");
    }

    @Test
    void extract_withRecordAndTypePatterns_parses() {
        // Given: Record deconstruction in instanceof and switch patterns
        String source = """
            import java.util.List;

            class Shapes {
                record P(int x, int y) {}

                int sum(Object o) {
                    if (o instanceof P(int x, int y)) {
                        return x + y;
                    }
                    return switch (o) {
                        case P(var x, var y) when x > 0 -> x;
                        case List<?> list -> list.size();
                        default -> 0;
                    };
                }
            }
            """;

        assertThat(extract("Shapes.java", source)).containsExactly("java.util.List");
    }

    @Test
    void extract_withSyntaxError_returnsEmptyList() {
        assertThat(extract("Broken.java", "import java.util.List;\npublic class {")).isEmpty();
    }
}
