package com.archlint.core.scan;

import com.archlint.core.ProjectTestBase;
import com.archlint.core.config.ScanOptions;
import com.archlint.core.model.ScanReport;
import com.archlint.core.model.Severity;
import com.archlint.core.model.Violation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Functional tests for {@link BatchScanner}.
 */
class BatchScannerTest extends ProjectTestBase {

    private static final String INVARIANTS = """
        invariants:
          - id: routes-no-db
            type: boundary
            severity: error
            description: Routes must not import the database layer
            source_glob: "src/routes/**"
            forbidden_imports: ["src/db/**"]
          - id: no-console
            type: pattern
            severity: warning
            description: Use the logger
            source_glob: "src/**"
            forbidden_pattern: "console\\\\.log"
        """;

    private Path config;

    @BeforeEach
    void setUpProject() throws IOException {
        config = createInvariants(INVARIANTS);
        createFiles(Map.of(
            "src/routes/users.ts", "import { db } from '../db/client';\nexport const list = () => db.all();\n",
            "src/routes/orders.ts", "import { log } from '../util/log';\nconsole.log('orders');\n",
            "src/db/client.ts", "export const db = {};\n",
            "src/util/log.ts", "export const log = () => {};\n",
            "node_modules/lib/index.js", "console.log('ignored');\n",
            "docs/readme.md", "console.log('not source');\n"
        ));
    }

    @Test
    void scanProject_reportsViolationsInFileOrder() {
        // When: The whole project is scanned
        ScanReport report = new BatchScanner().scanProject(tempDir, "", config);

        // Then: Both violations are reported with stats
        assertThat(report.isFailed()).isFalse();
        assertThat(report.filesChecked()).isEqualTo(4);
        assertThat(report.violations()).extracting(Violation::file, Violation::rule)
            .containsExactly(
                tuple("src/routes/orders.ts", "no-console"),
                tuple("src/routes/users.ts", "routes-no-db"));
        assertThat(report.stats().total()).isEqualTo(2);
        assertThat(report.stats().errors()).isEqualTo(1);
        assertThat(report.stats().warnings()).isEqualTo(1);
        assertThat(report.hasErrors()).isTrue();
    }

    @Test
    void scanProject_isDeterministicAcrossParallelism() {
        ScanReport sequential = new BatchScanner(ScanOptions.defaults().withParallelism(1))
            .scanProject(tempDir, "", config);
        ScanReport parallel = new BatchScanner(ScanOptions.defaults().withParallelism(8))
            .scanProject(tempDir, "", config);

        assertThat(parallel).isEqualTo(sequential);
    }

    @Test
    void scanProject_withScope_checksOnlyScopedFiles() {
        ScanReport report = new BatchScanner().scanProject(tempDir, "./src/db/", config);

        assertThat(report.scope()).isEqualTo("src/db");
        assertThat(report.filesChecked()).isEqualTo(1);
        assertThat(report.violations()).isEmpty();
    }

    @Test
    void scanProject_withMissingConfig_returnsFailedReport() {
        ScanReport report = new BatchScanner().scanProject(tempDir, "", tempDir.resolve("missing.yml"));

        assertThat(report.isFailed()).isTrue();
        assertThat(report.error()).contains("missing.yml");
        assertThat(report.violations()).isEmpty();
        assertThat(report.filesChecked()).isZero();
    }

    @Test
    void scanFiles_withDeletedFile_skipsIt() {
        // Given: One existing and one deleted file
        List<String> files = List.of("src/routes/users.ts", "src/routes/deleted.ts");

        // When: The explicit list is scanned
        ScanReport report = new BatchScanner().scanFiles(tempDir, files, config);

        // Then: Only the existing file reports, but both count as checked
        assertThat(report.filesChecked()).isEqualTo(2);
        assertThat(report.violations()).singleElement().satisfies(violation -> {
            assertThat(violation.rule()).isEqualTo("routes-no-db");
            assertThat(violation.severity()).isEqualTo(Severity.ERROR);
            assertThat(violation.importSpecifier()).isEqualTo("../db/client");
        });
    }

    @Test
    void scanFiles_withOversizedFile_skipsIt() {
        BatchScanner scanner = new BatchScanner(ScanOptions.defaults().withMaxFileSizeBytes(10));

        ScanReport report = scanner.scanFiles(tempDir, List.of("src/routes/users.ts"), config);

        assertThat(report.violations()).isEmpty();
    }

    @Test
    void discoverFiles_skipsIgnoredDirectoriesAndUnsupportedFiles() throws IOException {
        List<String> files = new BatchScanner().discoverFiles(tempDir, "");

        assertThat(files).containsExactly(
            "src/db/client.ts", "src/routes/orders.ts", "src/routes/users.ts", "src/util/log.ts");
    }

    @Test
    void discoverFiles_withMissingScope_returnsEmptyList() throws IOException {
        assertThat(new BatchScanner().discoverFiles(tempDir, "nowhere")).isEmpty();
    }
}
