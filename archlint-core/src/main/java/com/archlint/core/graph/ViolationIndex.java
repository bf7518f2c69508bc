package com.archlint.core.graph;

import com.archlint.core.model.Violation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Index of import-level rule violations keyed by importing file and resolved import.
 *
 * <p>Only violations that carry a rule id, a file and an import specifier are indexed. Rule ids
 * under one key are distinct and kept in first-seen order.
 */
public final class ViolationIndex {

    private static final ViolationIndex EMPTY = new ViolationIndex(Map.of());

    private final Map<Key, List<String>> ruleIds;

    private ViolationIndex(Map<Key, List<String>> ruleIds) {
        this.ruleIds = ruleIds;
    }

    public static ViolationIndex empty() {
        return EMPTY;
    }

    /**
     * Builds an index from scan violations.
     *
     * @param violations violations, typically from a scan report
     * @return index of boundary violations
     */
    public static ViolationIndex of(List<Violation> violations) {
        Map<Key, List<String>> index = new LinkedHashMap<>();
        for (Violation violation : violations) {
            if (isBlank(violation.importSpecifier()) || isBlank(violation.file()) || isBlank(violation.rule())) {
                continue;
            }
            Key key = new Key(violation.file(), ModuleIds.resolve(violation.file(), violation.importSpecifier()));
            List<String> ids = index.computeIfAbsent(key, k -> new ArrayList<>());
            if (!ids.contains(violation.rule())) {
                ids.add(violation.rule());
            }
        }
        return new ViolationIndex(index);
    }

    /**
     * Gets the rules violated by one import.
     *
     * @param file importing file
     * @param resolvedImport import resolved with {@link ModuleIds#resolve(String, String)}
     * @return rule ids, empty if the import violated nothing
     */
    public List<String> ruleIds(String file, String resolvedImport) {
        List<String> ids = ruleIds.get(new Key(file, resolvedImport));
        return ids != null ? Collections.unmodifiableList(ids) : List.of();
    }

    /**
     * Counts violations whose importing file belongs to each module.
     *
     * @return module id to number of rule ids over all of its indexed imports
     */
    public Map<String, Integer> countsByModule() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        ruleIds.forEach((key, ids) -> counts.merge(ModuleIds.moduleOf(key.file()), ids.size(), Integer::sum));
        return counts;
    }

    public boolean isEmpty() {
        return ruleIds.isEmpty();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isEmpty();
    }

    private record Key(String file, String resolvedImport) {}
}
