package com.archlint.core.inference;

import com.archlint.core.ProjectTestBase;
import com.archlint.core.config.InvariantConfigException;
import com.archlint.core.config.InvariantLoader;
import com.archlint.core.model.InferredRule;
import com.archlint.core.model.Invariant;
import com.archlint.core.model.InvariantType;
import com.archlint.core.model.Severity;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link InferredRuleWriter}.
 */
class InferredRuleWriterTest extends ProjectTestBase {

    private final InferredRuleWriter writer = new InferredRuleWriter();

    @Test
    void toYaml_withNoRules_writesCommentAndEmptyList() {
        String yaml = writer.toYaml(List.of(), 90.0);

        assertThat(yaml).startsWith("""
            # Auto-inferred rules (archlint infer)
            # Min confidence: 90%
            # Review before applying
            # No rules inferred at this confidence level
            """);
        assertThat(yaml).contains("invariants: []");
    }

    @Test
    void toYaml_withRules_writesInferredFlagAndConfidence() {
        String yaml = writer.toYaml(List.of(gatewayRule()), 85.5);

        assertThat(yaml)
            .contains("# Min confidence: 85.5%")
            .contains("id: inferred-src-lib-gateway")
            .contains("type: boundary")
            .contains("severity: warning")
            .contains("inferred: true")
            .contains("confidence: 90")
            .doesNotContain("confidence: 90.0")
            .doesNotContain("No rules inferred");
    }

    @Test
    void write_outputCanBeLoadedAsInvariants() throws IOException {
        // Given: Rendered rules written to the invariants file
        StringWriter out = new StringWriter();
        writer.write(List.of(gatewayRule()), 90.0, out);
        Path config = createInvariants(out.toString());

        // When: The file is loaded back
        List<Invariant> invariants = new InvariantLoader().load(config);

        // Then: The rule survives unchanged
        assertThat(invariants).containsExactly(gatewayRule().rule());
    }

    @Test
    void append_toExistingList_keepsCommentsAndAddsRule() throws IOException {
        // Given: A hand-written invariants file with a comment
        Path config = createInvariants("""
            # Team rules
            invariants:
              - id: no-console
                type: pattern
                severity: warning
                description: Use the logger
                source_glob: "src/**"
                forbidden_pattern: "console\\\\.log"
            """);

        // When: An inferred rule is appended
        List<InferredRule> appended = writer.append(config, List.of(gatewayRule()));

        // Then: The comment survives and both rules load
        assertThat(appended).containsExactly(gatewayRule());
        assertThat(Files.readString(config)).startsWith("# Team rules\ninvariants:\n  - id: no-console");
        assertThat(new InvariantLoader().load(config))
            .extracting(Invariant::id)
            .containsExactly("no-console", "inferred-src-lib-gateway");
    }

    @Test
    void append_toEmptyFlowList_opensListAndAddsRule() throws IOException {
        // Given: A file declaring no invariants yet
        Path config = createInvariants("invariants: []\n");

        // When: An inferred rule is appended
        writer.append(config, List.of(gatewayRule()));

        // Then: The rule is the only invariant
        assertThat(Files.readString(config)).doesNotContain("[]");
        assertThat(new InvariantLoader().load(config)).containsExactly(gatewayRule().rule());
    }

    @Test
    void append_withDeclaredId_skipsRule() throws IOException {
        // Given: A file already holding the rule
        StringWriter out = new StringWriter();
        writer.write(List.of(gatewayRule()), 90.0, out);
        Path config = createInvariants(out.toString());
        String before = Files.readString(config);

        // When: The same rule is appended again
        List<InferredRule> appended = writer.append(config, List.of(gatewayRule()));

        // Then: Nothing is written
        assertThat(appended).isEmpty();
        assertThat(Files.readString(config)).isEqualTo(before);
    }

    @Test
    void append_withDeeperIndentedEntries_matchesIndentation() throws IOException {
        // Given: Entries indented by four spaces
        Path config = createInvariants("""
            invariants:
                - id: no-console
                  type: pattern
                  source_glob: "src/**"
                  forbidden_pattern: "console"
            """);

        // When: An inferred rule is appended
        writer.append(config, List.of(gatewayRule()));

        // Then: The new entry uses the same indentation and loads
        assertThat(Files.readString(config)).contains("\n    - id: inferred-src-lib-gateway\n      type: boundary\n");
        assertThat(new InvariantLoader().load(config)).hasSize(2);
    }

    @Test
    void append_withKeyAfterList_restoresFileAndThrows() throws IOException {
        // Given: Another top-level key follows the invariants list
        String original = """
            invariants:
              - id: no-console
                type: pattern
                source_glob: "src/**"
                forbidden_pattern: "console"
            settings:
              cache: true
            """;
        Path config = createInvariants(original);

        // When / Then: Appending fails and leaves the file as it was
        assertThatThrownBy(() -> writer.append(config, List.of(gatewayRule())))
            .isInstanceOf(InvariantConfigException.class)
            .hasMessageContaining("must be the last top-level key");
        assertThat(Files.readString(config)).isEqualTo(original);
    }

    @Test
    void append_withMissingFile_throws() {
        Path config = tempDir.resolve(".archlint/invariants.yml");

        assertThatThrownBy(() -> writer.append(config, List.of(gatewayRule())))
            .isInstanceOf(InvariantConfigException.class)
            .hasMessageContaining("not found");
    }

    private static InferredRule gatewayRule() {
        return new InferredRule(
            Invariant.builder("inferred-src-lib-gateway", InvariantType.BOUNDARY)
                .severity(Severity.WARNING)
                .description("90% of imports into src/lib go through index; enforce gateway pattern")
                .sourceGlob("**")
                .forbiddenImports("src/lib/**")
                .allowedImports("src/lib/index")
                .build(),
            90.0);
    }
}
