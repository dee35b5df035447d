package dev.contractgate.core;

import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.contractgate.core.check.CheckResult;
import dev.contractgate.core.contract.CheckDefinition;
import dev.contractgate.core.contract.CheckSeverity;
import dev.contractgate.core.contract.Contract;
import dev.contractgate.core.contract.ContractTier;
import dev.contractgate.core.util.Mappers;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Builders shared by the test suite.
 */
public final class Fixtures {

    private Fixtures() {
    }

    /**
     * Parse a check definition written the way it appears in a contract file, one line per argument.
     */
    public static CheckDefinition check(String... lines) {
        try {
            return CheckDefinition.fromNode((ObjectNode) Mappers.yaml().readTree(String.join("\n", lines)));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static Contract contract(String name, CheckDefinition... checks) {
        return new Contract(name, "custom", "", "1.0.0", true, List.of(), null, List.of(),
                List.of(checks), ContractTier.REPO, null);
    }

    public static Contract contract(String name, List<String> parents, CheckDefinition... checks) {
        return new Contract(name, "custom", "", "1.0.0", true, parents, null, List.of(),
                List.of(checks), ContractTier.REPO, null);
    }

    public static CheckResult failure(String contract, String check, String file, Integer line, CheckSeverity severity,
                                      String message) {
        return new CheckResult(contract, check, file, line, severity, false, message, null, null);
    }

    public static CheckResult pass(String contract, String check) {
        return new CheckResult(contract, check, null, null, CheckSeverity.ERROR, true, "Check passed", null, null);
    }

    public static Path write(Path root, String relative, String content) {
        Path file = root.resolve(relative);
        try {
            Files.createDirectories(file.getParent());
            Files.writeString(file, content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return file;
    }
}
