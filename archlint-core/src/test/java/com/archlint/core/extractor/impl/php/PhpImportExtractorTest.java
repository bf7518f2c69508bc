package com.archlint.core.extractor.impl.php;

import com.archlint.core.extractor.ExtractorTestBase;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Functional tests for {@link PhpImportExtractor}.
 */
class PhpImportExtractorTest extends ExtractorTestBase {

    @Test
    void extract_withUseAndIncludeStatements_returnsTargets() {
        // Given: Simple, grouped, function and comma-separated use clauses plus includes
        String source = """
            <?php
            namespace App\\Http;

            use App\\Models\\User;
            use App\\Services\\{Mailer, Logger as Log};
            use function App\\Helpers\\format_date;
            use Foo\\A, Foo\\B;
            require_once 'config.php';
            include('helpers.php');
            // use Commented\\Thing;
            # require 'hash-comment.php';
            """;

        assertThat(extract("src/Controller.php", source)).containsExactly(
            "App\\Models\\User",
            "App\\Services\\Mailer",
            "App\\Services\\Logger",
            "App\\Helpers\\format_date",
            "Foo\\A",
            "Foo\\B",
            "config.php",
            "helpers.php");
    }

    @Test
    void extract_withHeredoc_ignoresItsBody() {
        String source = """
            <?php
            $sql = <<<EOT
            use Fake\\Thing;
            EOT;
            use Real\\Thing;
            """;

        assertThat(extract("a.php", source)).containsExactly("Real\\Thing");
    }

    @Test
    void extract_withLeadingBackslash_dropsIt() {
        assertThat(extract("a.php", "<?php\nuse \\Vendor\\Package;\n")).containsExactly("Vendor\\Package");
    }

    @Test
    void extract_withIncludeKeywordInsideString_ignoresIt() {
        // Given: Include-like text inside an echoed string literal
        String source = """
            <?php
            echo "You must require 'setup.php' first";
            $msg = 'then include "extra.php"';
            """;

        // When / Then: Only statements starting with the keyword count
        assertThat(extract("a.php", source)).isEmpty();
    }

    @Test
    void extract_withIncludeOnOpeningTagLine_returnsPath() {
        assertThat(extract("a.php", "<?php require 'bootstrap.php';\n")).containsExactly("bootstrap.php");
    }
}
