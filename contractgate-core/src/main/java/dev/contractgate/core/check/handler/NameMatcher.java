package dev.contractgate.core.check.handler;

import dev.contractgate.core.util.GlobMatcher;

/**
 * Matches identifiers and dotted call targets against configured names.
 */
final class NameMatcher {

    private NameMatcher() {
    }

    /**
     * Glob match against the full dotted name or its last segment.
     */
    static boolean matchesName(String pattern, String name) {
        if (name == null) {
            return false;
        }
        String simple = name.substring(name.lastIndexOf('.') + 1);
        return GlobMatcher.matches(pattern, name) || GlobMatcher.matches(pattern, simple);
    }

    /**
     * Match a call target against a forbidden-call entry.
     * <ul>
     *   <li>{@code open(} matches a call to {@code open} or {@code x.open}</li>
     *   <li>{@code shutil.} matches any call starting with {@code shutil.}</li>
     *   <li>{@code os.path} matches {@code os.path} and anything below it</li>
     * </ul>
     */
    static boolean matchesCall(String pattern, String callee) {
        if (callee == null) {
            return false;
        }
        if (pattern.endsWith("(")) {
            String base = pattern.substring(0, pattern.length() - 1);
            return callee.equals(base) || callee.endsWith("." + base);
        }
        if (pattern.endsWith(".")) {
            return callee.startsWith(pattern);
        }
        return callee.equals(pattern) || callee.startsWith(pattern);
    }

    /**
     * Module equality or package containment.
     */
    static boolean matchesModule(String forbidden, String module) {
        return module.equals(forbidden) || module.startsWith(forbidden + ".");
    }
}
