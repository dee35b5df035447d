package dev.contractgate.core.check.handler;

import com.fasterxml.jackson.databind.JsonNode;
import dev.contractgate.core.check.CheckHandler;
import dev.contractgate.core.check.CheckResult;
import dev.contractgate.core.contract.CheckDefinition;
import dev.contractgate.core.contract.CheckTypes;
import dev.contractgate.core.exception.CheckExecutionException;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Regular-expression check over file contents.
 * <p>
 * In {@code forbid} mode (the default, or {@code negative_match: true}) every match is a
 * violation. In {@code require} mode ({@code negative_match: false}) a file without a match is
 * a violation.
 */
public class PatternCheckHandler implements CheckHandler {

    @Override
    public String type() {
        return CheckTypes.PATTERN;
    }

    @Override
    public List<CheckResult> execute(CheckDefinition check, Path repoRoot, List<String> files) {
        JsonNode config = check.config();
        boolean forbid = forbidMode(config);
        String message = config.hasNonNull("message") ? config.get("message").asText() : null;
        List<NamedPattern> patterns = compile(check);

        List<CheckResult> results = new ArrayList<>();
        for (String file : files) {
            Optional<String> content = TextFiles.read(repoRoot, file);
            if (content.isEmpty()) {
                continue;
            }
            for (NamedPattern named : patterns) {
                Matcher matcher = named.pattern().matcher(content.get());
                if (forbid) {
                    int scanned = 0;
                    int line = 1;
                    while (matcher.find()) {
                        line += TextFiles.countNewlines(content.get(), scanned, matcher.start());
                        scanned = matcher.start();
                        String text = message != null ? message
                                : "Forbidden pattern found: '" + TextFiles.truncate(matcher.group(), 100) + "'";
                        results.add(CheckResult.failure(check, file, line, text, named.name()));
                    }
                } else if (!matcher.find()) {
                    String text = message != null ? message
                            : "Required pattern not found: '" + named.pattern().pattern() + "'";
                    results.add(CheckResult.failure(check, file, null, text, named.name()));
                }
            }
        }
        return results;
    }

    private static boolean forbidMode(JsonNode config) {
        if (config.has("negative_match")) {
            return config.get("negative_match").asBoolean();
        }
        return !"require".equalsIgnoreCase(config.path("mode").asText("forbid"));
    }

    private static List<NamedPattern> compile(CheckDefinition check) {
        JsonNode config = check.config();
        int flags = 0;
        if (config.path("multiline").asBoolean(false)) {
            flags |= Pattern.MULTILINE;
        }
        if (config.path("case_insensitive").asBoolean(false)) {
            flags |= Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;
        }

        List<NamedPattern> patterns = new ArrayList<>();
        if (config.hasNonNull("pattern")) {
            patterns.add(new NamedPattern(null, compile(check, config.get("pattern").asText(), flags)));
        }
        for (JsonNode entry : config.path("patterns")) {
            if (entry.isTextual()) {
                patterns.add(new NamedPattern(null, compile(check, entry.asText(), flags)));
            } else {
                patterns.add(new NamedPattern(entry.path("name").asText(null),
                        compile(check, entry.path("pattern").asText(), flags)));
            }
        }
        if (patterns.isEmpty()) {
            throw new CheckExecutionException(check.id(), "Pattern check declares no pattern");
        }
        return patterns;
    }

    private static Pattern compile(CheckDefinition check, String regex, int flags) {
        try {
            return Pattern.compile(regex, flags);
        } catch (PatternSyntaxException e) {
            throw new CheckExecutionException(check.id(), "Invalid pattern '" + regex + "': " + e.getDescription(), e);
        }
    }

    private record NamedPattern(String name, Pattern pattern) {
    }
}
