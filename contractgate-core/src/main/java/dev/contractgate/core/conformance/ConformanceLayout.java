package dev.contractgate.core.conformance;

import dev.contractgate.core.contract.RegistryLocations;

import java.nio.file.Path;

/**
 * On-disk layout of the conformance state under {@code <repo>/.contractgate/}.
 */
public record ConformanceLayout(Path repoRoot) {

    public static final String REPORT_FILE = "conformance_report.yaml";
    public static final String LOCAL_FILE = "local.yaml";

    public Path stateDir() {
        return repoRoot.resolve(RegistryLocations.STATE_DIR);
    }

    public Path violationsDir() {
        return stateDir().resolve("violations");
    }

    public Path exemptionsDir() {
        return stateDir().resolve("exemptions");
    }

    public Path historyDir() {
        return stateDir().resolve("history");
    }

    public Path reportFile() {
        return stateDir().resolve(REPORT_FILE);
    }

    public Path localFile() {
        return stateDir().resolve(LOCAL_FILE);
    }

    public Path gitignore() {
        return repoRoot.resolve(".gitignore");
    }
}
