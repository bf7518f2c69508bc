package com.archlint.core.inference;

import com.archlint.core.config.InvariantConfigException;
import com.archlint.core.config.InvariantLoader;
import com.archlint.core.model.InferredRule;
import com.archlint.core.model.Invariant;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Renders inferred rules as an invariants YAML document.
 *
 * <p>The document starts with comment lines recording the confidence threshold, followed by an
 * {@code invariants:} list that {@link com.archlint.core.config.InvariantLoader} can read back.
 * Each rule carries {@code inferred: true} and its confidence.
 *
 * <p>{@link #append(Path, List)} adds accepted rules to an existing invariants file in place,
 * leaving its other content and comments untouched.
 */
public class InferredRuleWriter {

    private static final Logger log = LoggerFactory.getLogger(InferredRuleWriter.class);

    private static final String ENTRY_INDENT = "  ";
    private static final Pattern EMPTY_LIST = Pattern.compile("(?m)^invariants:[ \\t]*\\[[ \\t]*\\][ \\t]*$");
    private static final Pattern LIST_KEY = Pattern.compile("(?m)^invariants:[ \\t]*$");
    private static final Pattern FIRST_ITEM = Pattern.compile(
        "(?m)^invariants:[ \\t]*\\r?\\n(?:[ \\t]*(?:#.*)?\\r?\\n)*([ \\t]*)- ");

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(
        new YAMLFactory()
            .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
            .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
            .enable(YAMLGenerator.Feature.INDENT_ARRAYS_WITH_INDICATOR));

    /**
     * Renders rules to a string.
     *
     * @param rules rules to render
     * @param minConfidence threshold the rules were inferred with
     * @return YAML document
     */
    public String toYaml(List<InferredRule> rules, double minConfidence) {
        StringBuilder out = new StringBuilder();
        out.append("# Auto-inferred rules (archlint infer)\n");
        out.append("# Min confidence: ").append(formatConfidence(minConfidence)).append("%\n");
        out.append("# Review before applying\n");
        if (rules.isEmpty()) {
            out.append("# No rules inferred at this confidence level\n");
        }

        List<Map<String, Object>> entries = rules.stream().map(InferredRule::toConfigMap).toList();
        try {
            out.append(YAML_MAPPER.writeValueAsString(Map.of("invariants", entries)));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to render inferred rules", e);
        }
        return out.toString();
    }

    /**
     * Renders rules to a writer.
     *
     * @param rules rules to render
     * @param minConfidence threshold the rules were inferred with
     * @param writer destination, not closed
     * @throws IOException if writing fails
     */
    public void write(List<InferredRule> rules, double minConfidence, Writer writer) throws IOException {
        writer.write(toYaml(rules, minConfidence));
        writer.flush();
    }

    /**
     * Appends rules to an existing invariants file.
     *
     * <p>Rules whose id is already declared in the file are skipped. An empty
     * {@code invariants: []} list is opened up, and appended entries use the indentation of the
     * existing entries. The file is re-read after writing; if the result does not contain every
     * previous and appended invariant (for instance because another top-level key follows the
     * list) the original content is restored and an exception is thrown.
     *
     * @param invariantsFile invariants YAML file, which must exist
     * @param rules rules to append
     * @return the rules actually appended, in input order
     * @throws IOException if the file cannot be read or written
     * @throws InvariantConfigException if the file is missing, invalid, or cannot take the rules
     */
    public List<InferredRule> append(Path invariantsFile, List<InferredRule> rules) throws IOException {
        List<Invariant> existing = new InvariantLoader().load(invariantsFile);
        Set<String> declared = existing.stream()
            .map(Invariant::id)
            .filter(Objects::nonNull)
            .collect(Collectors.toSet());
        List<InferredRule> added = rules.stream()
            .filter(rule -> !declared.contains(rule.id()))
            .toList();
        if (added.isEmpty()) {
            log.info("No new rules to append to {}", invariantsFile);
            return List.of();
        }

        String original = Files.readString(invariantsFile);
        String updated = withOpenList(original);
        if (!updated.isEmpty() && !updated.endsWith("\n")) {
            updated += "\n";
        }
        updated += "\n" + renderEntries(added, entryIndent(updated));
        Files.writeString(invariantsFile, updated);

        int expected = existing.size() + added.size();
        int actual = reloadCount(invariantsFile);
        if (actual != expected) {
            Files.writeString(invariantsFile, original);
            throw new InvariantConfigException("Cannot append rules to " + invariantsFile
                + ": the invariants list must be the last top-level key");
        }
        log.info("Appended {} inferred rules to {}", added.size(), invariantsFile);
        return added;
    }

    private static String withOpenList(String content) {
        Matcher emptyList = EMPTY_LIST.matcher(content);
        if (emptyList.find()) {
            return emptyList.replaceFirst("invariants:");
        }
        if (LIST_KEY.matcher(content).find()) {
            return content;
        }
        String prefix = content.isEmpty() || content.endsWith("\n") ? content : content + "\n";
        return prefix + "invariants:\n";
    }

    private static String entryIndent(String content) {
        Matcher item = FIRST_ITEM.matcher(content);
        return item.find() ? item.group(1) : ENTRY_INDENT;
    }

    private static String renderEntries(List<InferredRule> rules, String indent) throws IOException {
        List<Map<String, Object>> entries = rules.stream().map(InferredRule::toConfigMap).toList();
        String document = YAML_MAPPER.writeValueAsString(Map.of("invariants", entries));
        StringBuilder out = new StringBuilder();
        for (String line : document.split("\n")) {
            if (line.isBlank() || !line.startsWith(ENTRY_INDENT)) {
                continue;
            }
            out.append(indent).append(line.substring(ENTRY_INDENT.length())).append('\n');
        }
        return out.toString();
    }

    private static int reloadCount(Path invariantsFile) {
        try {
            return new InvariantLoader().load(invariantsFile).size();
        } catch (InvariantConfigException e) {
            log.debug("Appended invariants file no longer parses: {}", e.getMessage());
            return -1;
        }
    }

    private static String formatConfidence(double confidence) {
        return confidence == Math.rint(confidence)
            ? Long.toString((long) confidence)
            : Double.toString(confidence);
    }
}
