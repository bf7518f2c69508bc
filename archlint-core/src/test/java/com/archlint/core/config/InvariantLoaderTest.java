package com.archlint.core.config;

import com.archlint.core.ProjectTestBase;
import com.archlint.core.model.Invariant;
import com.archlint.core.model.InvariantType;
import com.archlint.core.model.Severity;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link InvariantLoader}.
 */
class InvariantLoaderTest extends ProjectTestBase {

    @Test
    void load_withAllRuleTypes_mapsEveryField() throws IOException {
        // Given: One invariant of every type
        Path config = createInvariants("""
            invariants:
              - id: routes-no-db
                type: boundary
                severity: error
                description: Routes must not import the database layer
                source_glob: "src/routes/**"
                forbidden_imports: ["src/db/**"]
                allowed_imports: ["src/db/types"]
              - id: no-console
                type: pattern
                severity: warning
                scope_glob: "src/**"
                scope_glob_exclude: ["src/**/*.test.ts"]
                forbidden_pattern: "console\\\\.log"
              - id: tests-required
                type: convention
                rule: every module has a test
              - id: axios-in-api
                type: dependency
                severity: info
                package: axios
                allowed_in: ["src/api/**"]
            """);

        // When: The file is loaded
        List<Invariant> invariants = new InvariantLoader().load(config);

        // Then: All invariants are mapped in file order
        assertThat(invariants).extracting(Invariant::id)
            .containsExactly("routes-no-db", "no-console", "tests-required", "axios-in-api");

        Invariant boundary = invariants.get(0);
        assertThat(boundary.type()).isEqualTo(InvariantType.BOUNDARY);
        assertThat(boundary.sourceGlob()).isEqualTo("src/routes/**");
        assertThat(boundary.forbiddenImports()).containsExactly("src/db/**");
        assertThat(boundary.allowedImports()).containsExactly("src/db/types");

        Invariant pattern = invariants.get(1);
        assertThat(pattern.severity()).isEqualTo(Severity.WARNING);
        assertThat(pattern.effectiveScopeGlob()).isEqualTo("src/**");
        assertThat(pattern.scopeGlobExclude()).containsExactly("src/**/*.test.ts");
        assertThat(pattern.forbiddenPattern()).isEqualTo("console\\.log");

        assertThat(invariants.get(2).rule()).isEqualTo("every module has a test");

        Invariant dependency = invariants.get(3);
        assertThat(dependency.severity()).isEqualTo(Severity.INFO);
        assertThat(dependency.packageName()).isEqualTo("axios");
        assertThat(dependency.allowedIn()).containsExactly("src/api/**");
    }

    @Test
    void load_withUnknownValues_keepsRuleWithDefaults() throws IOException {
        Path config = createInvariants("""
            invariants:
              - id: odd
                type: layering
                severity: fatal
                unknown_key: ignored
            """);

        List<Invariant> invariants = new InvariantLoader().load(config);

        assertThat(invariants).singleElement().satisfies(invariant -> {
            assertThat(invariant.type()).isNull();
            assertThat(invariant.severity()).isEqualTo(Severity.ERROR);
            assertThat(invariant.description()).isEmpty();
        });
    }

    @Test
    void load_withEmptyFile_returnsNoInvariants() throws IOException {
        Path config = createInvariants("");

        assertThat(new InvariantLoader().load(config)).isEmpty();
    }

    @Test
    void load_withMissingFile_throwsConfigException() {
        Path config = tempDir.resolve(InvariantLoader.DEFAULT_CONFIG_PATH);

        assertThatThrownBy(() -> new InvariantLoader().load(config))
            .isInstanceOf(InvariantConfigException.class)
            .hasMessageContaining("not found");
    }

    @Test
    void load_withMalformedYaml_throwsConfigException() throws IOException {
        Path config = createInvariants("invariants: [unclosed\n");

        assertThatThrownBy(() -> new InvariantLoader().load(config))
            .isInstanceOf(InvariantConfigException.class)
            .hasMessageContaining("Failed to parse");
    }

    @Test
    void load_calledTwice_reusesParsedInvariants() throws IOException {
        Path config = createInvariants("""
            invariants:
              - id: a
                type: pattern
                forbidden_pattern: x
            """);
        InvariantLoader loader = new InvariantLoader();

        List<Invariant> first = loader.load(config);
        List<Invariant> second = loader.load(config);

        assertThat(second).isSameAs(first);
    }

    @Test
    void load_withCacheDirectory_writesCacheFile() throws IOException {
        // Given: A loader with a file cache
        Path config = createInvariants("""
            invariants:
              - id: a
                type: pattern
                forbidden_pattern: x
            """);
        Path cacheDirectory = tempDir.resolve("cache");

        // When: Invariants are loaded
        new InvariantLoader(cacheDirectory).load(config);

        // Then: The parsed invariants are persisted with their source
        Path cacheFile = cacheDirectory.resolve(InvariantLoader.CACHE_FILE_NAME);
        assertThat(cacheFile).isRegularFile();
        assertThat(Files.readString(cacheFile))
            .contains(config.toAbsolutePath().normalize().toString().replace("\\", "\\\\"))
            .contains("\"forbidden_pattern\":\"x\"");
    }

    @Test
    void load_withSourceEditedAfterCacheWrite_reparsesSource() throws IOException {
        // Given: A cache written for the first version of the file
        Path config = createInvariants("""
            invariants:
              - id: old-rule
                type: pattern
                forbidden_pattern: x
            """);
        Path cacheDirectory = tempDir.resolve("cache");
        new InvariantLoader(cacheDirectory).load(config);
        Path cacheFile = cacheDirectory.resolve(InvariantLoader.CACHE_FILE_NAME);
        FileTime cacheWritten = Files.getLastModifiedTime(cacheFile);

        // When: The source changes but its timestamp stays older than the cache file
        Files.writeString(config, """
            invariants:
              - id: new-rule
                type: pattern
                forbidden_pattern: y
            """);
        Files.setLastModifiedTime(config, FileTime.fromMillis(cacheWritten.toMillis() - 60_000));
        List<Invariant> invariants = new InvariantLoader(cacheDirectory).load(config);

        // Then: The edited file is parsed again
        assertThat(invariants).extracting(Invariant::id).containsExactly("new-rule");
    }

    @Test
    void load_withUnchangedSource_reusesCacheFile() throws IOException {
        // Given: A cache file whose contents differ from the YAML but whose timestamp and size match
        Path config = createInvariants("""
            invariants:
              - id: rule-a
                type: pattern
                forbidden_pattern: x
            """);
        Path cacheDirectory = tempDir.resolve("cache");
        new InvariantLoader(cacheDirectory).load(config);
        Path cacheFile = cacheDirectory.resolve(InvariantLoader.CACHE_FILE_NAME);
        Files.writeString(cacheFile, Files.readString(cacheFile).replace("rule-a", "rule-b"));

        // When: A fresh loader reads the same file
        List<Invariant> invariants = new InvariantLoader(cacheDirectory).load(config);

        // Then: The persisted invariants are used without parsing the YAML
        assertThat(invariants).extracting(Invariant::id).containsExactly("rule-b");
    }
}
