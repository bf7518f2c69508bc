package com.archlint.core.rules.impl;

import com.archlint.core.model.Invariant;
import com.archlint.core.model.InvariantType;
import com.archlint.core.model.Violation;
import com.archlint.core.rules.RuleEvaluator;
import com.archlint.core.rules.SourceFile;
import org.slf4j.Logger;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Reports the first line of a file matching an invariant's forbidden pattern.
 *
 * <p>POSIX bracket classes such as {@code [[:space:]]} are translated before compilation.
 * An invalid expression disables the invariant and is logged once.
 */
public class PatternRuleEvaluator implements RuleEvaluator {

    private static final Map<String, String> POSIX_CLASSES = new LinkedHashMap<>();

    static {
        POSIX_CLASSES.put("[[:space:]]", "\\s");
        POSIX_CLASSES.put("[[:alpha:]]", "[a-zA-Z]");
        POSIX_CLASSES.put("[[:digit:]]", "\\d");
        POSIX_CLASSES.put("[[:alnum:]]", "[a-zA-Z0-9]");
        POSIX_CLASSES.put("[[:upper:]]", "[A-Z]");
        POSIX_CLASSES.put("[[:lower:]]", "[a-z]");
        POSIX_CLASSES.put("[[:punct:]]", "[^\\w\\s]");
        POSIX_CLASSES.put("[[:blank:]]", "[ \\t]");
    }

    private final Logger log;
    private final Map<String, Optional<Pattern>> compiled = new ConcurrentHashMap<>();

    public PatternRuleEvaluator(Logger log) {
        this.log = log;
    }

    @Override
    public InvariantType getType() {
        return InvariantType.PATTERN;
    }

    @Override
    public List<Violation> evaluate(SourceFile file, Invariant invariant) {
        String expression = invariant.forbiddenPattern();
        if (expression == null || expression.isEmpty()) {
            return List.of();
        }
        Optional<Pattern> pattern = compiled.computeIfAbsent(expression, key -> compile(invariant));
        if (pattern.isEmpty()) {
            return List.of();
        }

        List<String> lines = file.lines();
        for (int i = 0; i < lines.size(); i++) {
            if (pattern.get().matcher(lines.get(i)).find()) {
                return List.of(Violation.atLine(invariant, file.relativePath(), i + 1));
            }
        }
        return List.of();
    }

    /**
     * Replaces POSIX bracket classes with their Java equivalents.
     *
     * @param expression expression in extended POSIX syntax
     * @return expression in Java syntax
     */
    public static String translatePosixClasses(String expression) {
        String translated = expression;
        for (Map.Entry<String, String> entry : POSIX_CLASSES.entrySet()) {
            translated = translated.replace(entry.getKey(), entry.getValue());
        }
        return translated;
    }

    private Optional<Pattern> compile(Invariant invariant) {
        try {
            return Optional.of(Pattern.compile(translatePosixClasses(invariant.forbiddenPattern())));
        } catch (PatternSyntaxException e) {
            log.warn("Invalid regex in pattern rule {}: {}", invariant.id(), invariant.forbiddenPattern());
            return Optional.empty();
        }
    }
}
