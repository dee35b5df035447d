package dev.contractgate.core.check;

import dev.contractgate.core.check.handler.CircularImportCheckHandler;
import dev.contractgate.core.check.handler.CommandCheckHandler;
import dev.contractgate.core.check.handler.ConstructorInjectionCheckHandler;
import dev.contractgate.core.check.handler.CustomCheckHandler;
import dev.contractgate.core.check.handler.DomainPurityCheckHandler;
import dev.contractgate.core.check.handler.FileExistsCheckHandler;
import dev.contractgate.core.check.handler.LayerImportCheckHandler;
import dev.contractgate.core.check.handler.NestedContractCheckHandler;
import dev.contractgate.core.check.handler.PatternCheckHandler;
import dev.contractgate.core.check.handler.StructuralMetricCheckHandler;
import dev.contractgate.core.check.source.SourceAdapters;
import dev.contractgate.core.contract.CheckDefinition;
import dev.contractgate.core.contract.CheckTypes;
import dev.contractgate.core.contract.Contract;
import dev.contractgate.core.contract.ContractRegistry;
import dev.contractgate.core.exception.CheckExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Dispatches check definitions to the handler registered for their type.
 * <p>
 * The executor never lets a single check abort a run: an unknown type, a
 * {@link CheckExecutionException} or any other runtime fault becomes one ERROR result
 * for that check.
 */
public class CheckExecutor {

    private static final Logger logger = LoggerFactory.getLogger(CheckExecutor.class);

    private final Map<String, CheckHandler> handlers = new ConcurrentHashMap<>();

    /**
     * Create an executor with the built-in handlers.
     *
     * @param registry source of contracts for {@code nested-contract} checks, may be null
     */
    public static CheckExecutor withDefaultHandlers(ContractRegistry registry) {
        SourceAdapters adapters = SourceAdapters.defaults();
        CheckExecutor executor = new CheckExecutor()
                .register(new PatternCheckHandler())
                .register(new CommandCheckHandler())
                .register(new FileExistsCheckHandler())
                .register(new CustomCheckHandler())
                .register(new StructuralMetricCheckHandler(adapters))
                .register(new LayerImportCheckHandler(adapters))
                .register(new ConstructorInjectionCheckHandler(adapters))
                .register(new DomainPurityCheckHandler(adapters))
                .register(new CircularImportCheckHandler(adapters));
        if (registry != null) {
            executor.register(new NestedContractCheckHandler(registry::resolve, executor));
        }
        return executor;
    }

    public static CheckExecutor withDefaultHandlers() {
        return withDefaultHandlers(null);
    }

    /**
     * Register a handler, replacing any handler of the same type.
     */
    public CheckExecutor register(CheckHandler handler) {
        String type = CheckTypes.normalize(handler.type());
        CheckHandler previous = handlers.put(type, handler);
        if (previous != null) {
            logger.debug("Handler for '{}' replaced by {}", type, handler.getClass().getName());
        }
        return this;
    }

    public Optional<CheckHandler> handlerFor(String type) {
        return Optional.ofNullable(handlers.get(CheckTypes.normalize(type)));
    }

    public Set<String> supportedTypes() {
        return new TreeSet<>(handlers.keySet());
    }

    /**
     * Run one check over the files of the index that fall within its scope.
     *
     * @return the failures found, or a single passing result when there are none
     */
    public List<CheckResult> execute(Contract contract, CheckDefinition check, FileIndex index) {
        String contractId = contract.name();
        CheckHandler handler = handlers.get(check.type());
        if (handler == null) {
            logger.warn("Unknown check type '{}' in {}/{}", check.declaredType(), contractId, check.id());
            return List.of(CheckResult.error(contractId, check.id(), "Unknown check type: '" + check.declaredType() + "'"));
        }

        List<String> files = index.select(check.scope());
        logger.debug("Running {}/{} ({}) over {} files", contractId, check.id(), check.type(), files.size());

        List<CheckResult> raw;
        try {
            raw = handler.execute(check, index.root(), files);
        } catch (CheckExecutionException e) {
            logger.warn("Check {}/{} failed: {}", contractId, check.id(), e.getMessage());
            return List.of(CheckResult.error(contractId, check.id(), "Check execution failed: " + e.getMessage()));
        } catch (RuntimeException e) {
            logger.warn("Check {}/{} raised an unexpected error", contractId, check.id(), e);
            return List.of(CheckResult.error(contractId, check.id(), "Check execution failed: " + e));
        } catch (Error e) {
            // a deeply nested source overflows the tree walk; other VM errors are not ours to absorb
            if (e instanceof VirtualMachineError && !(e instanceof StackOverflowError)) {
                throw e;
            }
            logger.warn("Check {}/{} raised {}", contractId, check.id(), e.toString());
            return List.of(CheckResult.error(contractId, check.id(), "Check execution failed: " + e));
        }

        List<CheckResult> results = new ArrayList<>(raw.size());
        for (CheckResult result : raw) {
            CheckResult owned = result.withContract(contractId);
            results.add(owned.checkId() == null ? owned.withCheck(check.id()) : owned);
        }
        if (results.isEmpty()) {
            results.add(CheckResult.passed(contractId, check));
        }
        return results;
    }

    /**
     * Run one check against a repository.
     *
     * @param candidates explicit file list, or null to scan the whole repository
     */
    public List<CheckResult> execute(Contract contract, CheckDefinition check, Path repoRoot, List<String> candidates) {
        FileIndex index = candidates == null ? FileIndex.scan(repoRoot) : FileIndex.of(repoRoot, candidates);
        return execute(contract, check, index);
    }

    /**
     * Run every enabled check of a contract.
     */
    public List<CheckResult> executeContract(Contract contract, FileIndex index) {
        List<CheckResult> results = new ArrayList<>();
        for (CheckDefinition check : contract.enabledChecks()) {
            results.addAll(execute(contract, check, index));
        }
        return results;
    }

    /**
     * Run every enabled check of every contract, sorted in report order.
     */
    public List<CheckResult> executeAll(List<Contract> contracts, FileIndex index) {
        List<CheckResult> results = new ArrayList<>();
        for (Contract contract : contracts) {
            results.addAll(executeContract(contract, index));
        }
        results.sort(CheckResult.REPORT_ORDER);
        return results;
    }
}
