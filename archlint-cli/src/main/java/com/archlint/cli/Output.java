package com.archlint.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;

import java.io.IOException;
import java.io.PrintWriter;

/**
 * Writes command results to the command's output stream.
 */
final class Output {

    static final ObjectMapper JSON_MAPPER = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT);

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(
        new YAMLFactory()
            .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
            .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES));

    private Output() {
        // Utility class
    }

    static void write(PrintWriter out, Object value, OutputFormat format) throws IOException {
        ObjectMapper mapper = format == OutputFormat.YAML ? YAML_MAPPER : JSON_MAPPER;
        String text = mapper.writeValueAsString(value);
        out.print(text);
        if (!text.endsWith("\n")) {
            out.println();
        }
        out.flush();
    }

    static void json(PrintWriter out, Object value) throws IOException {
        write(out, value, OutputFormat.JSON);
    }
}
