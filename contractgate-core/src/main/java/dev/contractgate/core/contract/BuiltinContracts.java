package dev.contractgate.core.contract;

import java.util.List;

/**
 * Contracts bundled on the classpath, loaded as the lowest tier.
 */
final class BuiltinContracts {

    static final String BASE_PATH = "/contractgate/builtin/";

    static final List<String> RESOURCES = List.of(
            "_base.contract.yaml",
            "_clean-architecture.contract.yaml",
            "python-quality.contract.yaml",
            "java-quality.contract.yaml"
    );

    private BuiltinContracts() {
    }
}
