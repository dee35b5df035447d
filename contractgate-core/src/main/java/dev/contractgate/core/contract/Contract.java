package dev.contractgate.core.contract;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * A named, versioned bundle of checks, optionally inheriting from other contracts.
 *
 * @param name unique name; a leading underscore marks an abstract contract
 * @param type free-form contract type
 * @param description optional description
 * @param version contract version
 * @param enabled whether the contract runs
 * @param extendsNames parent contract names, in declaration order
 * @param appliesTo language and repository-type filters
 * @param tags free-form tags
 * @param checks checks; the contract's own until resolved, the full inherited list afterwards
 * @param tier the tier the contract was loaded from
 * @param source the file it was loaded from, null for classpath contracts
 */
public record Contract(
        String name,
        String type,
        String description,
        String version,
        boolean enabled,
        List<String> extendsNames,
        ContractAppliesTo appliesTo,
        List<String> tags,
        List<CheckDefinition> checks,
        ContractTier tier,
        Path source
) {

    public Contract {
        extendsNames = extendsNames == null ? List.of() : List.copyOf(extendsNames);
        tags = tags == null ? List.of() : List.copyOf(tags);
        checks = checks == null ? List.of() : List.copyOf(checks);
        appliesTo = appliesTo == null ? ContractAppliesTo.any() : appliesTo;
    }

    public boolean isAbstract() {
        return name.startsWith("_");
    }

    public Optional<CheckDefinition> findCheck(String checkId) {
        return checks.stream().filter(c -> c.id().equals(checkId)).findFirst();
    }

    public List<CheckDefinition> enabledChecks() {
        return checks.stream().filter(CheckDefinition::enabled).toList();
    }

    /**
     * Copy of this contract carrying a different check list.
     */
    public Contract withChecks(List<CheckDefinition> newChecks) {
        return new Contract(name, type, description, version, enabled, extendsNames, appliesTo, tags,
                newChecks, tier, source);
    }
}
