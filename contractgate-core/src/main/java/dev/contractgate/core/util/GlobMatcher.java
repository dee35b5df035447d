package dev.contractgate.core.util;

import org.springframework.util.AntPathMatcher;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Ant-style matching over repository-relative paths using forward slashes.
 * <p>
 * {@code **} spans any number of directories, {@code *} and {@code ?} stay within one.
 * {@code {a,b}} alternatives are expanded before matching. A pattern without a slash is also
 * tried against the file name alone, so {@code *.pem} finds keys anywhere.
 */
public final class GlobMatcher {

    private static final AntPathMatcher PATHS = new AntPathMatcher("/");

    private static final Map<String, List<String>> ALTERNATIVES = new ConcurrentHashMap<>();

    private GlobMatcher() {
    }

    public static boolean matches(String glob, String path) {
        String normalized = normalize(path);
        int slash = normalized.lastIndexOf('/');
        for (String pattern : ALTERNATIVES.computeIfAbsent(normalize(glob), GlobMatcher::expand)) {
            if (PATHS.match(pattern, normalized)) {
                return true;
            }
            if (slash >= 0 && !pattern.contains("/") && PATHS.match(pattern, normalized.substring(slash + 1))) {
                return true;
            }
        }
        return false;
    }

    public static boolean matchesAny(Collection<String> globs, String path) {
        for (String glob : globs) {
            if (matches(glob, path)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Normalize a path to forward slashes without a leading "./".
     */
    public static String normalize(String path) {
        String result = path.replace('\\', '/');
        while (result.startsWith("./")) {
            result = result.substring(2);
        }
        return result;
    }

    // AntPathMatcher reads braces as URI template variables
    static List<String> expand(String glob) {
        int open = glob.indexOf('{');
        int close = open < 0 ? -1 : glob.indexOf('}', open);
        if (close < 0) {
            return List.of(glob);
        }
        String head = glob.substring(0, open);
        List<String> tails = expand(glob.substring(close + 1));
        List<String> expanded = new ArrayList<>();
        for (String option : glob.substring(open + 1, close).split(",", -1)) {
            for (String tail : tails) {
                expanded.add(head + option + tail);
            }
        }
        return List.copyOf(expanded);
    }
}
