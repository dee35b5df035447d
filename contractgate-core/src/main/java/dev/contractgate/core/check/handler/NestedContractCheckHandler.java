package dev.contractgate.core.check.handler;

import dev.contractgate.core.check.CheckExecutor;
import dev.contractgate.core.check.CheckHandler;
import dev.contractgate.core.check.CheckResult;
import dev.contractgate.core.check.FileIndex;
import dev.contractgate.core.contract.CheckDefinition;
import dev.contractgate.core.contract.CheckSeverity;
import dev.contractgate.core.contract.CheckTypes;
import dev.contractgate.core.contract.Contract;

import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Runs the checks of other contracts and reports their failures under this check.
 * <p>
 * Re-entering a contract that is already being run further up the same nesting chain yields
 * an ERROR result instead of recursing.
 */
public class NestedContractCheckHandler implements CheckHandler {

    private static final ThreadLocal<Deque<String>> ACTIVE = ThreadLocal.withInitial(ArrayDeque::new);

    private final Function<String, Optional<Contract>> contracts;
    private final CheckExecutor executor;

    public NestedContractCheckHandler(Function<String, Optional<Contract>> contracts, CheckExecutor executor) {
        this.contracts = contracts;
        this.executor = executor;
    }

    @Override
    public String type() {
        return CheckTypes.NESTED_CONTRACT;
    }

    @Override
    public List<CheckResult> execute(CheckDefinition check, Path repoRoot, List<String> files) {
        List<String> names = CheckDefinition.stringList(check.config().get("contracts"));
        names.addAll(CheckDefinition.stringList(check.config().get("contract")));

        Deque<String> active = ACTIVE.get();
        List<CheckResult> results = new ArrayList<>();
        for (String name : names) {
            if (active.contains(name)) {
                results.add(error(check, "Nested contract cycle: " + String.join(" -> ", active) + " -> " + name));
                continue;
            }
            Optional<Contract> contract = contracts.apply(name);
            if (contract.isEmpty()) {
                results.add(error(check, "Unknown nested contract '" + name + "'"));
                continue;
            }
            active.addLast(name);
            try {
                for (CheckResult inner : executor.executeContract(contract.get(), FileIndex.of(repoRoot, files))) {
                    if (inner.failed()) {
                        results.add(new CheckResult(null, check.id(), inner.file(), inner.line(), inner.severity(), false,
                                "[" + name + "/" + inner.checkId() + "] " + inner.message(),
                                inner.fixHint() != null ? inner.fixHint() : check.fixHint(),
                                name + "/" + inner.checkId()));
                    }
                }
            } finally {
                active.removeLast();
            }
        }
        return results;
    }

    private static CheckResult error(CheckDefinition check, String message) {
        return new CheckResult(null, check.id(), null, null, CheckSeverity.ERROR, false, message, check.fixHint(), null);
    }
}
