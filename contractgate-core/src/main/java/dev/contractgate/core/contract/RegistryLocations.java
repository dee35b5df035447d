package dev.contractgate.core.contract;

import java.nio.file.Path;
import java.util.List;

/**
 * Directories the registry loads contracts and exemptions from.
 *
 * @param repoRoot repository root; the repo tier is {@code contracts/} and {@code .contractgate/contracts/}
 * @param globalDir optional user-wide contract directory
 * @param workspaceDir optional workspace contract directory
 * @param includeBuiltin whether the bundled contracts are loaded first
 */
public record RegistryLocations(Path repoRoot, Path globalDir, Path workspaceDir, boolean includeBuiltin) {

    public static final String STATE_DIR = ".contractgate";

    /**
     * Locations for a repository with no global or workspace tier.
     */
    public static RegistryLocations forRepo(Path repoRoot) {
        return new RegistryLocations(repoRoot, null, null, true);
    }

    /**
     * Locations for a repository plus the user-wide tier under {@code ~/.contractgate/contracts}.
     */
    public static RegistryLocations withUserHome(Path repoRoot) {
        Path global = Path.of(System.getProperty("user.home"), STATE_DIR, "contracts");
        return new RegistryLocations(repoRoot, global, null, true);
    }

    public List<Path> repoContractDirs() {
        return List.of(repoRoot.resolve("contracts"), repoRoot.resolve(STATE_DIR).resolve("contracts"));
    }

    public List<Path> exemptionDirs() {
        return List.of(
                repoRoot.resolve("exemptions"),
                repoRoot.resolve(STATE_DIR).resolve("exemptions"),
                repoRoot.resolve("contracts").resolve("exemptions"));
    }
}
