package dev.contractgate.core.check.handler;

import com.fasterxml.jackson.databind.JsonNode;
import dev.contractgate.core.check.CheckHandler;
import dev.contractgate.core.check.CheckResult;
import dev.contractgate.core.contract.CheckDefinition;
import dev.contractgate.core.contract.CheckTypes;
import dev.contractgate.core.util.GlobMatcher;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Requires listed files or directories to exist and, optionally, forbids others.
 * <p>
 * Entries of {@code required_files} (alias {@code files}) are either a path or
 * {@code {path, message}}. Entries of {@code forbidden_files} are globs matched against
 * the files in the check's scope.
 */
public class FileExistsCheckHandler implements CheckHandler {

    @Override
    public String type() {
        return CheckTypes.FILE_EXISTS;
    }

    @Override
    public List<CheckResult> execute(CheckDefinition check, Path repoRoot, List<String> files) {
        JsonNode config = check.config();
        List<CheckResult> results = new ArrayList<>();

        List<JsonNode> required = new ArrayList<>();
        config.path("required_files").forEach(required::add);
        config.path("files").forEach(required::add);
        for (JsonNode entry : required) {
            String path = entry.isObject() ? entry.path("path").asText() : entry.asText();
            if (!Files.exists(repoRoot.resolve(path))) {
                String message = entry.isObject() && entry.hasNonNull("message")
                        ? entry.get("message").asText()
                        : "Required file not found: " + path;
                results.add(CheckResult.failure(check, GlobMatcher.normalize(path), null, message));
            }
        }

        List<String> forbidden = CheckDefinition.stringList(config.get("forbidden_files"));
        if (!forbidden.isEmpty()) {
            for (String file : files) {
                for (String glob : forbidden) {
                    if (GlobMatcher.matches(glob, file)) {
                        results.add(CheckResult.failure(check, file, null, "Forbidden file present: " + file, glob));
                        break;
                    }
                }
            }
        }
        return results;
    }
}
