package com.archlint.core.rules;

import com.archlint.core.model.Invariant;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Matches project-relative paths against invariant globs.
 *
 * <p>Glob syntax: {@code **} matches any sequence of characters including {@code /},
 * {@code *} matches any sequence without {@code /}, {@code .} is literal. Other characters are
 * used as regular-expression syntax; a glob that does not form a valid expression only matches
 * itself literally. Globs are anchored at both ends.
 */
public final class ScopeMatcher {

    private static final Map<String, Pattern> PATTERN_CACHE = new ConcurrentHashMap<>();

    private ScopeMatcher() {
        // Utility class
    }

    /**
     * Converts a glob to an anchored regular expression.
     *
     * @param glob glob pattern
     * @return regular expression source
     */
    public static String globToRegex(String glob) {
        String regex = glob
            .replace(".", "\\.")
            .replace("**", "\u0000")
            .replace("*", "[^/]*")
            .replace("\u0000", ".*");
        return "^" + regex + "$";
    }

    /**
     * Compiles a glob, caching the result.
     *
     * @param glob glob pattern
     * @return compiled pattern
     */
    public static Pattern globToPattern(String glob) {
        return PATTERN_CACHE.computeIfAbsent(glob, ScopeMatcher::compile);
    }

    /**
     * Checks whether a path matches a glob.
     *
     * @param path {@code /}-separated path
     * @param glob glob pattern
     * @return true if the whole path matches
     */
    public static boolean matches(String path, String glob) {
        if (path == null || glob == null || glob.isEmpty()) {
            return false;
        }
        return globToPattern(glob).matcher(path).matches();
    }

    /**
     * Checks whether a file is in scope for an invariant.
     *
     * <p>A file is in scope when the invariant has no source or scope glob, or when the file
     * matches that glob and none of the exclusion globs.
     *
     * @param path project-relative path
     * @param invariant invariant to check
     * @return true if the invariant applies to the file
     */
    public static boolean fileInScope(String path, Invariant invariant) {
        String glob = invariant.effectiveScopeGlob();
        if (glob == null) {
            return true;
        }
        if (!matches(path, glob)) {
            return false;
        }
        for (String exclude : invariant.scopeGlobExclude()) {
            if (matches(path, exclude)) {
                return false;
            }
        }
        return true;
    }

    private static Pattern compile(String glob) {
        try {
            return Pattern.compile(globToRegex(glob));
        } catch (PatternSyntaxException e) {
            return Pattern.compile(Pattern.quote(glob));
        }
    }
}
