package dev.contractgate.spring;

import dev.contractgate.core.ci.CIConfig;
import dev.contractgate.core.ci.CIMode;
import dev.contractgate.core.contract.CheckSeverity;
import dev.contractgate.core.history.HistoryStore;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for ContractGate.
 */
@ConfigurationProperties(prefix = "contractgate")
public class ContractGateProperties {

    /**
     * Enable/disable the ContractGate beans.
     */
    private boolean enabled = true;

    /**
     * Repository to check.
     */
    private String repoRoot = ".";

    /**
     * User-wide contract directory (global tier).
     */
    private String globalContractsDir;

    /**
     * Workspace contract directory (workspace tier).
     */
    private String workspaceContractsDir;

    /**
     * Load the bundled contracts as the lowest tier.
     */
    private boolean builtinContracts = true;

    /**
     * Conformance history configuration.
     */
    private HistoryProperties history = new HistoryProperties();

    /**
     * CI run configuration.
     */
    private CiProperties ci = new CiProperties();

    // Getters and setters

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getRepoRoot() {
        return repoRoot;
    }

    public void setRepoRoot(String repoRoot) {
        this.repoRoot = repoRoot;
    }

    public String getGlobalContractsDir() {
        return globalContractsDir;
    }

    public void setGlobalContractsDir(String globalContractsDir) {
        this.globalContractsDir = globalContractsDir;
    }

    public String getWorkspaceContractsDir() {
        return workspaceContractsDir;
    }

    public void setWorkspaceContractsDir(String workspaceContractsDir) {
        this.workspaceContractsDir = workspaceContractsDir;
    }

    public boolean isBuiltinContracts() {
        return builtinContracts;
    }

    public void setBuiltinContracts(boolean builtinContracts) {
        this.builtinContracts = builtinContracts;
    }

    public HistoryProperties getHistory() {
        return history;
    }

    public void setHistory(HistoryProperties history) {
        this.history = history;
    }

    public CiProperties getCi() {
        return ci;
    }

    public void setCi(CiProperties ci) {
        this.ci = ci;
    }

    /**
     * Conformance history properties.
     */
    public static class HistoryProperties {

        /**
         * Days of daily snapshots to keep (7-365).
         */
        private int retentionDays = HistoryStore.DEFAULT_RETENTION_DAYS;

        public int getRetentionDays() {
            return retentionDays;
        }

        public void setRetentionDays(int retentionDays) {
            this.retentionDays = retentionDays;
        }
    }

    /**
     * CI run properties.
     */
    public static class CiProperties {

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
        private List<String> incrementalPaths = new ArrayList<>();
        private String baseRef;
        private String headRef;

        /**
         * Convert to the core CI configuration.
         */
        public CIConfig toConfig() {
            CIConfig config = new CIConfig();
            config.setMode(mode);
            config.setParallelEnabled(parallelEnabled);
            config.setMaxWorkers(maxWorkers);
            config.setFailOnNewErrors(failOnNewErrors);
            config.setFailOnNewWarnings(failOnNewWarnings);
            config.setTotalErrorsThreshold(totalErrorsThreshold);
            config.setRatchetEnabled(ratchetEnabled);
            config.setMinSeverity(minSeverity);
            config.setBaselinePath(baselinePath);
            config.setOutputSarif(outputSarif);
            config.setOutputJunit(outputJunit);
            config.setOutputMarkdown(outputMarkdown);
            config.setSarifPath(sarifPath);
            config.setJunitPath(junitPath);
            config.setMarkdownPath(markdownPath);
            config.setCacheEnabled(cacheEnabled);
            config.setCachePath(cachePath);
            config.setCacheTtlHours(cacheTtlHours);
            config.setIncrementalPaths(incrementalPaths.isEmpty() ? null : incrementalPaths);
            config.setBaseRef(baseRef);
            config.setHeadRef(headRef);
            config.validate();
            return config;
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
            this.incrementalPaths = incrementalPaths;
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
}
