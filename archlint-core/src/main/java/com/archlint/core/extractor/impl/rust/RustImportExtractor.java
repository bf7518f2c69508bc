package com.archlint.core.extractor.impl.rust;

import com.archlint.core.extractor.base.AbstractLexicalImportExtractor;
import com.archlint.core.extractor.impl.rust.util.RustCommentStripper;

import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts paths from Rust {@code use} declarations and {@code extern crate} items.
 *
 * <p>Use trees are expanded into one path per leaf: {@code use std::{io, fs::File as F};}
 * yields {@code std::io} and {@code std::fs::File}. Aliases are dropped, {@code self} inside a
 * group stands for the group prefix and glob imports keep their {@code ::*} suffix. A
 * declaration may span several lines and may carry a visibility modifier.
 */
public class RustImportExtractor extends AbstractLexicalImportExtractor {

    private static final Pattern USE_START = Pattern.compile("^(?:pub(?:\\s*\\([^)]*\\))?\\s+)?use\\s+");
    private static final Pattern EXTERN_CRATE = Pattern.compile("^extern\\s+crate\\s+(\\w+)");
    private static final Pattern ALIAS = Pattern.compile("\\s+as\\s+\\w+$");
    private static final Pattern PATH = Pattern.compile("^(?:::)?[\\w]+(?:::[\\w]+)*(?:::\\*)?$|^\\*$");

    @Override
    protected String strip(String content) {
        return new RustCommentStripper(content).strip();
    }

    @Override
    protected void collectImports(String stripped, Set<String> imports) {
        List<String> lines = lines(stripped);
        for (int i = 0; i < lines.size(); i++) {
            String trimmed = lines.get(i).trim();

            String crate = firstMatch(EXTERN_CRATE, trimmed);
            if (crate != null) {
                imports.add(crate);
                continue;
            }

            Matcher use = USE_START.matcher(trimmed);
            if (!use.find()) {
                continue;
            }
            StringBuilder declaration = new StringBuilder(trimmed.substring(use.end()));
            while (declaration.indexOf(";") < 0 && i + 1 < lines.size()) {
                declaration.append(' ').append(lines.get(++i).trim());
            }
            int end = declaration.indexOf(";");
            if (end < 0) {
                continue;
            }
            expandUseTree("", declaration.substring(0, end).trim(), imports);
        }
    }

    private void expandUseTree(String prefix, String tree, Set<String> imports) {
        int brace = tree.indexOf('{');
        if (brace >= 0 && tree.endsWith("}")) {
            String head = tree.substring(0, brace).trim();
            if (head.endsWith("::")) {
                head = head.substring(0, head.length() - 2);
            }
            String groupPrefix = join(prefix, head.replaceAll("\\s+", ""));
            for (String item : splitTopLevel(tree.substring(brace + 1, tree.length() - 1))) {
                expandUseTree(groupPrefix, item, imports);
            }
            return;
        }

        String leaf = ALIAS.matcher(tree.trim()).replaceFirst("").replaceAll("\\s+", "");
        if ("self".equals(leaf)) {
            if (!prefix.isEmpty()) {
                imports.add(prefix);
            }
            return;
        }
        String path = join(prefix, leaf);
        if (PATH.matcher(path).matches()) {
            imports.add(path);
        } else {
            log.debug("Ignoring unrecognized use path: {}", path);
        }
    }

    private static String join(String prefix, String segment) {
        if (prefix.isEmpty()) {
            return segment;
        }
        if (segment.isEmpty()) {
            return prefix;
        }
        return prefix + "::" + segment;
    }
}
