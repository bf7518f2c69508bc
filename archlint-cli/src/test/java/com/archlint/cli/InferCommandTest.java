package com.archlint.cli;

import com.archlint.core.config.InvariantLoader;
import com.archlint.core.model.Invariant;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Functional tests for {@link InferCommand}.
 */
class InferCommandTest extends CommandTestBase {

    @Test
    void infer_printsReviewableYaml() throws Exception {
        createSampleProject();

        int exitCode = run("infer", root());

        assertThat(exitCode).isZero();
        assertThat(out.toString())
            .startsWith("# Auto-inferred rules (archlint infer)")
            .contains("# Min confidence: 90%")
            .contains("id: inferred-src-db-no-import-src-routes")
            .contains("inferred: true");
    }

    @Test
    void infer_withJsonFormat_printsRuleObjects() throws Exception {
        createSampleProject();

        int exitCode = run("infer", root(), "--format", "json");

        assertThat(exitCode).isZero();
        JsonNode rules = outputJson();
        assertThat(rules).hasSize(1);
        assertThat(rules.get(0).get("source_glob").asText()).isEqualTo("src/db/**");
        assertThat(rules.get(0).get("forbidden_imports").get(0).asText()).isEqualTo("src/routes/**");
        assertThat(rules.get(0).get("confidence").asInt()).isEqualTo(100);
    }

    @Test
    void infer_withGraphFile_readsSavedGraph() throws Exception {
        // Given: A graph saved by the graph command
        createSampleProject();
        run("graph", root());
        Path graph = tempDir.resolve("graph.json");
        Files.writeString(graph, out.toString());

        // When: Rules are inferred from the saved graph
        int exitCode = run("infer", "--graph", graph.toString(), "--format", "json");

        // Then: The same rule is proposed
        assertThat(exitCode).isZero();
        assertThat(outputJson()).extracting(node -> node.get("id").asText())
            .containsExactly("inferred-src-db-no-import-src-routes");
    }

    @Test
    void infer_withSingleFileModules_reportsNoRules() throws Exception {
        createFile("src/a/one.ts", "import x from '../b/two';\n");
        createFile("src/b/two.ts", "");

        int exitCode = run("infer", root());

        assertThat(exitCode).isZero();
        assertThat(out.toString())
            .contains("# No rules inferred at this confidence level")
            .contains("invariants: []");
    }

    @Test
    void infer_withApply_appendsRulesToInvariantsFile() throws Exception {
        // Given: A project with a hand-written invariants file
        createSampleProject();

        // When: Inferred rules are applied
        int exitCode = run("infer", root(), "--apply");

        // Then: The file keeps its rules and gains the inferred one
        assertThat(exitCode).isZero();
        assertThat(err.toString()).contains("✓ Appended 1 rules to");
        Path config = tempDir.resolve(".archlint/invariants.yml");
        assertThat(new InvariantLoader().load(config))
            .extracting(Invariant::id)
            .containsExactly("routes-no-db", "no-console", "inferred-src-db-no-import-src-routes");
    }

    @Test
    void infer_withApplyTwice_appendsNothingNew() throws Exception {
        // Given: Rules already applied once
        createSampleProject();
        run("infer", root(), "--apply");
        String applied = Files.readString(tempDir.resolve(".archlint/invariants.yml"));

        // When: The same rules are applied again
        int exitCode = run("infer", root(), "--apply");

        // Then: The file is unchanged
        assertThat(exitCode).isZero();
        assertThat(err.toString()).contains("No new rules to apply");
        assertThat(Files.readString(tempDir.resolve(".archlint/invariants.yml"))).isEqualTo(applied);
    }

    @Test
    void infer_withApplyAndNoInvariantsFile_fails() throws Exception {
        // Given: A project without an invariants file
        createFile("src/db/client.ts", "export const db = {};\n");

        // When: Rules are applied
        int exitCode = run("infer", root(), "--apply");

        // Then: The command refuses before inferring
        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("✗ --apply requires an existing invariants file");
        assertThat(out.toString()).isEmpty();
    }
}
