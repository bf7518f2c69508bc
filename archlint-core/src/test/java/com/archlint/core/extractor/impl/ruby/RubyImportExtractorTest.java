package com.archlint.core.extractor.impl.ruby;

import com.archlint.core.extractor.ExtractorTestBase;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Functional tests for {@link RubyImportExtractor}.
 */
class RubyImportExtractorTest extends ExtractorTestBase {

    @Test
    void extract_withRequireForms_returnsPaths() {
        String source = """
            require 'json'
            require_relative "../lib/helper"
            load('tasks.rb')
            autoload :Parser, 'my_gem/parser'
            # require 'commented'
            """;

        assertThat(extract("app/models/user.rb", source)).containsExactly(
            "json", "../lib/helper", "tasks.rb", "my_gem/parser");
    }

    @Test
    void extract_withEmbeddedDocumentAndHeredoc_ignoresTheirContent() {
        // Given: require lines inside =begin/=end and inside a squiggly heredoc
        String source = """
            =begin
            require 'in_doc'
            =end
            sql = <<~SQL
              require 'in_heredoc'
            SQL
            require "after_heredoc"
            """;

        assertThat(extract("a.rb", source)).containsExactly("after_heredoc");
    }
}
