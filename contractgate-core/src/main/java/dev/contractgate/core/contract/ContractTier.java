package dev.contractgate.core.contract;

/**
 * Contract loading scopes, in load order. Later tiers override earlier ones by name.
 */
public enum ContractTier {
    BUILTIN,
    GLOBAL,
    WORKSPACE,
    REPO
}
