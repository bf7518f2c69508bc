package com.archlint.cli;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Functional tests for {@link StructureCommand}.
 */
class StructureCommandTest extends CommandTestBase {

    @Test
    void structure_reportsLayersTestGapsAndCounts() throws Exception {
        // Given: The sample project plus one tested route
        createSampleProject();
        createFile("src/routes/users.test.ts", "import { list } from './users';\n");

        // When: The structure is summarized
        int exitCode = run("structure", root());

        // Then: The ignored .archlint directory is left out and untested files are listed
        assertThat(exitCode).isZero();
        JsonNode report = outputJson();
        assertThat(report.get("raw_structure")).extracting(JsonNode::asText)
            .containsExactly("src", "src/db", "src/routes");
        assertThat(report.get("detected_layers")).extracting(JsonNode::asText)
            .containsExactly("routes", "db");
        assertThat(report.get("test_gaps")).extracting(JsonNode::asText)
            .containsExactly("src/db/client.ts", "src/db/pool.ts", "src/routes/orders.ts");
        assertThat(report.get("file_counts").get(0).get("dir").asText()).isEqualTo("src");
        assertThat(report.get("file_counts").get(0).get("count").asInt()).isEqualTo(5);
    }

    @Test
    void structure_withYamlFormat_printsYaml() throws Exception {
        createSampleProject();

        int exitCode = run("structure", root(), "--format", "yaml");

        assertThat(exitCode).isZero();
        assertThat(out.toString())
            .contains("raw_structure:")
            .contains("test_gaps:");
    }

    @Test
    void structure_withMissingDirectory_fails() {
        int exitCode = run("structure", tempDir.resolve("missing").toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("✗ Not a directory");
    }
}
