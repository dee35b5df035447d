package dev.contractgate.core.contract;

import dev.contractgate.core.util.GlobMatcher;

import java.util.List;

/**
 * File scope of a check: include globs minus exclude globs.
 *
 * @param paths include globs, {@code **}{@code /*} when none are declared
 * @param excludePaths exclude globs
 */
public record PathScope(List<String> paths, List<String> excludePaths) {

    public static final List<String> DEFAULT_PATHS = List.of("**/*");

    public PathScope {
        paths = paths == null || paths.isEmpty() ? DEFAULT_PATHS : List.copyOf(paths);
        excludePaths = excludePaths == null ? List.of() : List.copyOf(excludePaths);
    }

    public static PathScope all() {
        return new PathScope(DEFAULT_PATHS, List.of());
    }

    /**
     * Check whether a repository-relative path is in scope.
     */
    public boolean includes(String path) {
        return GlobMatcher.matchesAny(paths, path) && !GlobMatcher.matchesAny(excludePaths, path);
    }
}
