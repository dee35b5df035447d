package dev.contractgate.core.ci;

import com.fasterxml.jackson.core.type.TypeReference;
import dev.contractgate.core.contract.CheckSeverity;
import dev.contractgate.core.exception.ConfigException;
import dev.contractgate.core.util.Mappers;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Settings of a CI run: mode, parallelism, gating policy, outputs and cache.
 * <p>
 * Files use nested sections:
 * <pre>
 * mode: pr
 * parallel: {enabled: true, max_workers: 4}
 * fail_on: {new_errors: true, new_warnings: false, total_errors_exceed: 10, min_severity: error}
 * ratchet_enabled: false
 * baseline_path: .contractgate/baseline.json
 * output:
 *   sarif: {enabled: true, path: .contractgate/results.sarif}
 * cache: {enabled: true, path: .contractgate/cache/, ttl_hours: 24}
 * </pre>
 * The same keys may also sit under a top-level {@code ci} section.
 */
public class CIConfig {

    private CIMode mode = CIMode.FULL;
    private boolean parallelEnabled = true;
    private int maxWorkers = 4;
    private boolean failOnNewErrors = true;
    private boolean failOnNewWarnings = false;
    private Integer totalErrorsThreshold;
    private boolean ratchetEnabled = false;
    private CheckSeverity minSeverity = CheckSeverity.ERROR;
    private String baselinePath = ".contractgate/baseline.json";
    private boolean outputSarif = true;
    private boolean outputJunit = false;
    private boolean outputMarkdown = true;
    private String sarifPath = ".contractgate/results.sarif";
    private String junitPath = ".contractgate/results.xml";
    private String markdownPath = ".contractgate/results.md";
    private boolean cacheEnabled = true;
    private String cachePath = ".contractgate/cache/";
    private int cacheTtlHours = 24;
    private List<String> incrementalPaths;
    private String baseRef;
    private String headRef;

    /**
     * Read a YAML config file; a missing file yields the defaults.
     *
     * @throws ConfigException when the file is not a valid config document
     */
    public static CIConfig load(Path file) {
        if (!Files.isRegularFile(file)) {
            return new CIConfig();
        }
        try {
            Map<String, Object> data = Mappers.yaml().readValue(file.toFile(), new TypeReference<Map<String, Object>>() {
            });
            return fromMap(data == null ? Map.of() : data);
        } catch (IOException e) {
            throw new ConfigException("Cannot read CI config: " + e.getMessage(), file, e);
        } catch (ConfigException e) {
            throw new ConfigException(e.getMessage(), file, e);
        }
    }

    public static CIConfig fromMap(Map<String, ?> data) {
        Map<String, ?> root = data.get("ci") instanceof Map<?, ?> ? section(data, "ci") : data;
        Map<String, ?> parallel = section(root, "parallel");
        Map<String, ?> failOn = section(root, "fail_on");
        Map<String, ?> output = section(root, "output");
        Map<String, ?> cache = section(root, "cache");

        CIConfig config = new CIConfig();
        config.mode = CIMode.fromValue(string(root, "mode", "full"));
        config.parallelEnabled = bool(parallel, "enabled", config.parallelEnabled);
        config.maxWorkers = integer(parallel, "max_workers", config.maxWorkers);
        config.failOnNewErrors = bool(failOn, "new_errors", config.failOnNewErrors);
        config.failOnNewWarnings = bool(failOn, "new_warnings", config.failOnNewWarnings);
        config.totalErrorsThreshold = failOn.get("total_errors_exceed") == null
                ? null : integer(failOn, "total_errors_exceed", 0);
        String minSeverity = string(failOn, "min_severity", string(root, "min_severity", null));
        if (minSeverity != null) {
            config.minSeverity = CheckSeverity.fromValue(minSeverity);
        }
        config.ratchetEnabled = bool(root, "ratchet_enabled", config.ratchetEnabled);
        config.baselinePath = string(root, "baseline_path", config.baselinePath);

        Map<String, ?> sarif = section(output, "sarif");
        Map<String, ?> junit = section(output, "junit");
        Map<String, ?> markdown = section(output, "markdown");
        config.outputSarif = bool(sarif, "enabled", config.outputSarif);
        config.sarifPath = string(sarif, "path", config.sarifPath);
        config.outputJunit = bool(junit, "enabled", config.outputJunit);
        config.junitPath = string(junit, "path", config.junitPath);
        config.outputMarkdown = bool(markdown, "enabled", config.outputMarkdown);
        config.markdownPath = string(markdown, "path", config.markdownPath);

        config.cacheEnabled = bool(cache, "enabled", config.cacheEnabled);
        config.cachePath = string(cache, "path", config.cachePath);
        config.cacheTtlHours = integer(cache, "ttl_hours", config.cacheTtlHours);

        if (root.get("incremental_paths") instanceof List<?> paths) {
            config.incrementalPaths = paths.stream().map(String::valueOf).toList();
        }
        config.baseRef = string(root, "base_ref", null);
        config.headRef = string(root, "head_ref", null);
        config.validate();
        return config;
    }

    /**
     * PR mode with SARIF for code scanning and a Markdown summary.
     */
    public static CIConfig forGithubActions() {
        CIConfig config = new CIConfig();
        config.mode = CIMode.PR;
        config.outputSarif = true;
        config.outputJunit = false;
        config.outputMarkdown = true;
        return config;
    }

    /**
     * PR mode with JUnit results and a Markdown summary.
     */
    public static CIConfig forAzureDevOps() {
        CIConfig config = new CIConfig();
        config.mode = CIMode.PR;
        config.outputSarif = false;
        config.outputJunit = true;
        config.outputMarkdown = true;
        return config;
    }

    /**
     * @throws ConfigException when a value is out of range
     */
    public void validate() {
        if (maxWorkers < 1) {
            throw new ConfigException("parallel.max_workers must be at least 1, got " + maxWorkers);
        }
        if (cacheTtlHours < 0) {
            throw new ConfigException("cache.ttl_hours must not be negative, got " + cacheTtlHours);
        }
        if (totalErrorsThreshold != null && totalErrorsThreshold < 0) {
            throw new ConfigException("fail_on.total_errors_exceed must not be negative, got " + totalErrorsThreshold);
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, ?> section(Map<String, ?> data, String key) {
        Object value = data.get(key);
        if (value == null) {
            return Map.of();
        }
        if (!(value instanceof Map<?, ?>)) {
            throw new ConfigException("'" + key + "' must be a mapping");
        }
        return (Map<String, ?>) value;
    }

    private static String string(Map<String, ?> data, String key, String defaultValue) {
        Object value = data.get(key);
        return value == null ? defaultValue : String.valueOf(value);
    }

    private static boolean bool(Map<String, ?> data, String key, boolean defaultValue) {
        Object value = data.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        String text = String.valueOf(value).trim();
        if (text.equalsIgnoreCase("true") || text.equalsIgnoreCase("false")) {
            return Boolean.parseBoolean(text);
        }
        throw new ConfigException("'" + key + "' must be a boolean, got '" + value + "'");
    }

    private static int integer(Map<String, ?> data, String key, int defaultValue) {
        Object value = data.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number n) {
            return n.intValue();
        }
        try {
            return Integer.parseInt(String.valueOf(value).trim());
        } catch (NumberFormatException e) {
            throw new ConfigException("'" + key + "' must be an integer, got '" + value + "'");
        }
    }

    public CIMode getMode() {
        return mode;
    }

    public void setMode(CIMode mode) {
        this.mode = mode;
    }

    public boolean isParallelEnabled() {
        return parallelEnabled;
    }

    public void setParallelEnabled(boolean parallelEnabled) {
        this.parallelEnabled = parallelEnabled;
    }

    public int getMaxWorkers() {
        return maxWorkers;
    }

    public void setMaxWorkers(int maxWorkers) {
        this.maxWorkers = maxWorkers;
    }

    public boolean isFailOnNewErrors() {
        return failOnNewErrors;
    }

    public void setFailOnNewErrors(boolean failOnNewErrors) {
        this.failOnNewErrors = failOnNewErrors;
    }

    public boolean isFailOnNewWarnings() {
        return failOnNewWarnings;
    }

    public void setFailOnNewWarnings(boolean failOnNewWarnings) {
        this.failOnNewWarnings = failOnNewWarnings;
    }

    public Integer getTotalErrorsThreshold() {
        return totalErrorsThreshold;
    }

    public void setTotalErrorsThreshold(Integer totalErrorsThreshold) {
        this.totalErrorsThreshold = totalErrorsThreshold;
    }

    public boolean isRatchetEnabled() {
        return ratchetEnabled;
    }

    public void setRatchetEnabled(boolean ratchetEnabled) {
        this.ratchetEnabled = ratchetEnabled;
    }

    public CheckSeverity getMinSeverity() {
        return minSeverity;
    }

    public void setMinSeverity(CheckSeverity minSeverity) {
        this.minSeverity = minSeverity;
    }

    public String getBaselinePath() {
        return baselinePath;
    }

    public void setBaselinePath(String baselinePath) {
        this.baselinePath = baselinePath;
    }

    public boolean isOutputSarif() {
        return outputSarif;
    }

    public void setOutputSarif(boolean outputSarif) {
        this.outputSarif = outputSarif;
    }

    public boolean isOutputJunit() {
        return outputJunit;
    }

    public void setOutputJunit(boolean outputJunit) {
        this.outputJunit = outputJunit;
    }

    public boolean isOutputMarkdown() {
        return outputMarkdown;
    }

    public void setOutputMarkdown(boolean outputMarkdown) {
        this.outputMarkdown = outputMarkdown;
    }

    public String getSarifPath() {
        return sarifPath;
    }

    public void setSarifPath(String sarifPath) {
        this.sarifPath = sarifPath;
    }

    public String getJunitPath() {
        return junitPath;
    }

    public void setJunitPath(String junitPath) {
        this.junitPath = junitPath;
    }

    public String getMarkdownPath() {
        return markdownPath;
    }

    public void setMarkdownPath(String markdownPath) {
        this.markdownPath = markdownPath;
    }

    public boolean isCacheEnabled() {
        return cacheEnabled;
    }

    public void setCacheEnabled(boolean cacheEnabled) {
        this.cacheEnabled = cacheEnabled;
    }

    public String getCachePath() {
        return cachePath;
    }

    public void setCachePath(String cachePath) {
        this.cachePath = cachePath;
    }

    public int getCacheTtlHours() {
        return cacheTtlHours;
    }

    public void setCacheTtlHours(int cacheTtlHours) {
        this.cacheTtlHours = cacheTtlHours;
    }

    public List<String> getIncrementalPaths() {
        return incrementalPaths;
    }

    public void setIncrementalPaths(List<String> incrementalPaths) {
        this.incrementalPaths = incrementalPaths == null ? null : new ArrayList<>(incrementalPaths);
    }

    public String getBaseRef() {
        return baseRef;
    }

    public void setBaseRef(String baseRef) {
        this.baseRef = baseRef;
    }

    public String getHeadRef() {
        return headRef;
    }

    public void setHeadRef(String headRef) {
        this.headRef = headRef;
    }
}
