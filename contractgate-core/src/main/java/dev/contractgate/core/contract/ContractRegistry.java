package dev.contractgate.core.contract;

import dev.contractgate.core.exception.ConfigException;
import dev.contractgate.core.exemption.Exemption;
import dev.contractgate.core.exemption.ExemptionLoader;
import dev.contractgate.core.exemption.ExemptionResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/**
 * Loads tiered contract definitions and resolves their inheritance.
 * <p>
 * Tiers are loaded builtin, global, workspace, repo; a contract loaded later replaces an
 * earlier one with the same name. Inheritance is resolved on first use and cached until the
 * next {@link #discover()}.
 */
public class ContractRegistry {

    private static final Logger logger = LoggerFactory.getLogger(ContractRegistry.class);

    private static final String WORKSPACE_PREFIX = "workspace:";

    private final RegistryLocations locations;
    private final ContractLoader loader;
    private final ExemptionLoader exemptionLoader;
    private final Clock clock;
    private final Map<String, Contract> contracts = new LinkedHashMap<>();
    private final Map<String, Contract> resolved = new ConcurrentHashMap<>();
    private volatile ExemptionResolver exemptions = ExemptionResolver.empty();

    public ContractRegistry(RegistryLocations locations) {
        this(locations, new ContractLoader(), new ExemptionLoader(), Clock.systemDefaultZone());
    }

    public ContractRegistry(RegistryLocations locations, ContractLoader loader, ExemptionLoader exemptionLoader, Clock clock) {
        this.locations = locations;
        this.loader = loader;
        this.exemptionLoader = exemptionLoader;
        this.clock = clock;
    }

    /**
     * Load all tiers, replacing anything loaded before.
     *
     * @return the number of distinct contracts known after loading
     */
    public synchronized int discover() {
        contracts.clear();
        resolved.clear();

        if (locations.includeBuiltin()) {
            loadBuiltin();
        }
        loadDirectory(locations.globalDir(), ContractTier.GLOBAL);
        loadDirectory(locations.workspaceDir(), ContractTier.WORKSPACE);
        for (Path dir : locations.repoContractDirs()) {
            loadDirectory(dir, ContractTier.REPO);
        }

        logger.info("Discovered {} contracts for {}", contracts.size(), locations.repoRoot());
        return contracts.size();
    }

    /**
     * Register a contract programmatically, as the highest tier.
     */
    public synchronized void register(Contract contract) {
        put(contract);
        resolved.clear();
    }

    public synchronized Optional<Contract> get(String name) {
        return Optional.ofNullable(contracts.get(stripPrefix(name)));
    }

    /**
     * List unresolved contracts in load order.
     *
     * @param includeAbstract whether contracts named with a leading underscore are included
     */
    public synchronized List<Contract> list(boolean includeAbstract) {
        return contracts.values().stream()
                .filter(c -> includeAbstract || !c.isAbstract())
                .toList();
    }

    /**
     * Resolve a contract's inheritance chain.
     * <p>
     * Parents are walked depth first. A parent already on the current path is a cycle and
     * is skipped with a warning, as is a parent that was never loaded. A check declared by
     * the contract itself overrides an inherited check with the same id.
     *
     * @param contract the contract to resolve
     * @return a copy carrying the full inherited check list
     */
    public Contract resolve(Contract contract) {
        Contract cached = resolved.get(contract.name());
        if (cached != null && Objects.equals(cached.source(), contract.source()) && cached.tier() == contract.tier()) {
            return cached;
        }
        List<CheckDefinition> checks;
        synchronized (this) {
            checks = collectChecks(contract, new ArrayDeque<>());
        }
        Contract result = contract.withChecks(checks);
        resolved.put(contract.name(), result);
        return result;
    }

    public Optional<Contract> resolve(String name) {
        return get(name).map(this::resolve);
    }

    /**
     * Enabled, non-abstract, resolved contracts.
     */
    public List<Contract> getEnabled() {
        return list(false).stream()
                .filter(Contract::enabled)
                .map(this::resolve)
                .toList();
    }

    /**
     * Enabled, non-abstract, resolved contracts whose filters match.
     *
     * @param language source language, null for any
     * @param repoType repository type, null for any
     */
    public List<Contract> getApplicable(String language, String repoType) {
        return getEnabled().stream()
                .filter(c -> c.appliesTo().matches(language, repoType))
                .toList();
    }

    /**
     * Load exemption files from the repository's exemption directories.
     *
     * @return the resolver over the loaded exemptions
     */
    public ExemptionResolver loadExemptions() {
        List<Exemption> loaded = exemptionLoader.loadAll(locations.exemptionDirs());
        ExemptionResolver resolver = new ExemptionResolver(loaded, exemptionLoader, clock);
        this.exemptions = resolver;
        logger.info("Loaded {} exemptions", loaded.size());
        return resolver;
    }

    public ExemptionResolver getExemptions() {
        return exemptions;
    }

    /**
     * First active exemption covering a violation location.
     */
    public Optional<Exemption> findExemption(String contractId, String checkId, String file, Integer line) {
        return exemptions.find(contractId, checkId, file, line);
    }

    public RegistryLocations getLocations() {
        return locations;
    }

    private List<CheckDefinition> collectChecks(Contract contract, Deque<String> path) {
        path.push(contract.name());

        Map<String, CheckDefinition> inherited = new LinkedHashMap<>();
        for (String rawParent : contract.extendsNames()) {
            String parentName = stripPrefix(rawParent);
            if (path.contains(parentName)) {
                logger.warn("Contract '{}' has a cyclic extends on '{}', skipping", contract.name(), parentName);
                continue;
            }
            Contract parent = contracts.get(parentName);
            if (parent == null) {
                logger.warn("Contract '{}' extends unknown contract '{}', skipping", contract.name(), parentName);
                continue;
            }
            for (CheckDefinition check : collectChecks(parent, path)) {
                inherited.putIfAbsent(check.id(), check);
            }
        }

        List<CheckDefinition> result = new ArrayList<>();
        Map<String, CheckDefinition> own = new LinkedHashMap<>();
        contract.checks().forEach(c -> own.put(c.id(), c));
        for (CheckDefinition parentCheck : inherited.values()) {
            CheckDefinition override = own.remove(parentCheck.id());
            result.add(override == null ? parentCheck : parentCheck.overriddenBy(override));
        }
        result.addAll(own.values());

        path.pop();
        return result;
    }

    private void loadBuiltin() {
        for (String resource : BuiltinContracts.RESOURCES) {
            String location = BuiltinContracts.BASE_PATH + resource;
            try (InputStream in = ContractRegistry.class.getResourceAsStream(location)) {
                if (in == null) {
                    logger.warn("Builtin contract {} not found on classpath", location);
                    continue;
                }
                put(loader.parse(in, ContractTier.BUILTIN, null));
            } catch (ConfigException | IOException e) {
                logger.warn("Skipping builtin contract {}: {}", location, e.getMessage());
            }
        }
    }

    private void loadDirectory(Path dir, ContractTier tier) {
        if (dir == null || !Files.isDirectory(dir)) {
            return;
        }
        List<Path> files;
        try (Stream<Path> stream = Files.walk(dir)) {
            files = stream
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(ContractLoader.FILE_SUFFIX))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            logger.warn("Cannot list contract directory {}: {}", dir, e.getMessage());
            return;
        }
        for (Path file : files) {
            try {
                put(loader.load(file, tier));
            } catch (ConfigException e) {
                logger.warn("Skipping malformed contract file: {}", e.getMessage());
            }
        }
    }

    private void put(Contract contract) {
        Contract previous = contracts.put(contract.name(), contract);
        if (previous != null) {
            logger.debug("Contract '{}' from {} overrides the {} definition", contract.name(),
                    contract.tier(), previous.tier());
        }
    }

    private static String stripPrefix(String name) {
        return name.startsWith(WORKSPACE_PREFIX) ? name.substring(WORKSPACE_PREFIX.length()) : name;
    }
}
