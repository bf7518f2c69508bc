package com.archlint.cli;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Functional tests for {@link ScanCommand}.
 */
class ScanCommandTest extends CommandTestBase {

    @Test
    void scan_withViolations_printsReportAndExitsZero() throws Exception {
        // Given: A project with two boundary and one pattern violation
        createSampleProject();

        // When: The project is scanned
        int exitCode = run("scan", root());

        // Then: The JSON report lists all violations
        assertThat(exitCode).isZero();
        JsonNode report = outputJson();
        assertThat(report.get("files_checked").asInt()).isEqualTo(4);
        assertThat(report.get("violations")).hasSize(3);
        assertThat(report.get("violations").get(0).get("file").asText()).isEqualTo("src/routes/orders.ts");
        assertThat(report.get("violations").get(0).get("import").asText()).isEqualTo("../db/client");
        assertThat(report.get("violations").get(1).get("line").asInt()).isEqualTo(2);
        assertThat(report.get("stats").get("errors").asInt()).isEqualTo(2);
        assertThat(report.get("stats").get("warnings").asInt()).isEqualTo(1);
        assertThat(report.has("error")).isFalse();
    }

    @Test
    void scan_withFailOnError_exitsWithViolationCode() throws Exception {
        createSampleProject();

        assertThat(run("scan", root(), "--fail-on-error")).isEqualTo(ScanCommand.EXIT_VIOLATIONS);
    }

    @Test
    void scan_withFailOnErrorAndOnlyWarnings_exitsZero() throws Exception {
        // Given: A configuration with a warning-level rule only
        createSampleProject();
        createFile(".archlint/warnings.yml", """
            invariants:
              - id: no-console
                type: pattern
                severity: warning
                forbidden_pattern: console
            """);

        // When: The project is scanned with the alternative configuration
        int exitCode = run("scan", root(), "--fail-on-error", "--config", ".archlint/warnings.yml");

        // Then: Warnings do not fail the scan
        assertThat(exitCode).isZero();
        assertThat(outputJson().get("stats").get("warnings").asInt()).isEqualTo(1);
    }

    @Test
    void scan_withFiles_checksOnlyListedExistingFiles() throws Exception {
        createSampleProject();

        int exitCode = run("scan", root(), "--files", "src/routes/users.ts,src/routes/removed.ts");

        assertThat(exitCode).isZero();
        JsonNode report = outputJson();
        assertThat(report.get("files_checked").asInt()).isEqualTo(2);
        assertThat(report.get("violations")).hasSize(1);
        assertThat(report.get("violations").get(0).get("rule").asText()).isEqualTo("routes-no-db");
    }

    @Test
    void scan_withScope_limitsDiscovery() throws Exception {
        createSampleProject();

        run("scan", root(), "--scope", "src/db");

        JsonNode report = outputJson();
        assertThat(report.get("scope").asText()).isEqualTo("src/db");
        assertThat(report.get("files_checked").asInt()).isEqualTo(2);
        assertThat(report.get("violations")).isEmpty();
    }

    @Test
    void scan_withMissingConfig_printsFailedReportAndExitsZero() throws Exception {
        createSampleProject();
        Files.delete(tempDir.resolve(".archlint/invariants.yml"));

        int exitCode = run("scan", root(), "--fail-on-error");

        assertThat(exitCode).isZero();
        JsonNode report = outputJson();
        assertThat(report.get("error").asText()).contains("not found");
        assertThat(report.get("violations")).isEmpty();
    }

    @Test
    void scan_withYamlFormat_printsYaml() throws Exception {
        createSampleProject();

        int exitCode = run("scan", root(), "--format", "yaml", "--threads", "2");

        assertThat(exitCode).isZero();
        assertThat(out.toString())
            .contains("files_checked: 4")
            .contains("rule: no-console")
            .doesNotStartWith("---");
    }
}
