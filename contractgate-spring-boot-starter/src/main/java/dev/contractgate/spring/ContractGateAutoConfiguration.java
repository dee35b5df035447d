package dev.contractgate.spring;

import dev.contractgate.core.baseline.BaselineManager;
import dev.contractgate.core.check.CheckExecutor;
import dev.contractgate.core.ci.CIConfig;
import dev.contractgate.core.ci.CIRunner;
import dev.contractgate.core.ci.CheckCache;
import dev.contractgate.core.ci.GitHelper;
import dev.contractgate.core.conformance.ConformanceManager;
import dev.contractgate.core.contract.ContractRegistry;
import dev.contractgate.core.contract.RegistryLocations;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;

/**
 * Auto-configuration for ContractGate.
 */
@AutoConfiguration
@EnableConfigurationProperties(ContractGateProperties.class)
@ConditionalOnProperty(prefix = "contractgate", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ContractGateAutoConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(ContractGateAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public CIConfig contractGateCiConfig(ContractGateProperties properties) {
        return properties.getCi().toConfig();
    }

    @Bean
    @ConditionalOnMissingBean
    public ContractRegistry contractRegistry(ContractGateProperties properties) {
        RegistryLocations locations = new RegistryLocations(
                repoRoot(properties),
                optionalPath(properties.getGlobalContractsDir()),
                optionalPath(properties.getWorkspaceContractsDir()),
                properties.isBuiltinContracts());
        logger.info("Creating ContractRegistry for {} (builtin={}, global={}, workspace={})",
                locations.repoRoot(), locations.includeBuiltin(), locations.globalDir(), locations.workspaceDir());
        ContractRegistry registry = new ContractRegistry(locations);
        registry.discover();
        registry.loadExemptions();
        return registry;
    }

    @Bean
    @ConditionalOnMissingBean
    public CheckExecutor checkExecutor(ContractRegistry registry) {
        CheckExecutor executor = CheckExecutor.withDefaultHandlers(registry);
        logger.info("Creating CheckExecutor with check types: {}", executor.supportedTypes());
        return executor;
    }

    @Bean
    @ConditionalOnMissingBean
    public ConformanceManager conformanceManager(ContractGateProperties properties, ContractRegistry registry) {
        logger.info("Creating ConformanceManager with history retention of {} days",
                properties.getHistory().getRetentionDays());
        return new ConformanceManager(repoRoot(properties), registry::getExemptions,
                properties.getHistory().getRetentionDays(), Clock.systemDefaultZone());
    }

    @Bean
    @ConditionalOnMissingBean
    public BaselineManager baselineManager(ContractGateProperties properties, CIConfig ciConfig) {
        return new BaselineManager(repoRoot(properties).resolve(ciConfig.getBaselinePath()));
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "contractgate.ci", name = "cache-enabled", havingValue = "true", matchIfMissing = true)
    public CheckCache checkCache(ContractGateProperties properties, CIConfig ciConfig) {
        return new CheckCache(repoRoot(properties).resolve(ciConfig.getCachePath()),
                Duration.ofHours(ciConfig.getCacheTtlHours()));
    }

    @Bean
    @ConditionalOnMissingBean
    public GitHelper gitHelper(ContractGateProperties properties) {
        return new GitHelper(repoRoot(properties));
    }

    @Bean
    @ConditionalOnMissingBean
    public CIRunner ciRunner(ContractGateProperties properties, CIConfig ciConfig, CheckExecutor executor,
                             BaselineManager baselineManager, ObjectProvider<CheckCache> cache, GitHelper gitHelper,
                             ContractRegistry registry) {
        logger.info("Creating CIRunner in {} mode (parallel={}, workers={})",
                ciConfig.getMode().value(), ciConfig.isParallelEnabled(), ciConfig.getMaxWorkers());
        return new CIRunner(repoRoot(properties), ciConfig, executor, baselineManager, cache.getIfAvailable(),
                gitHelper, Clock.systemUTC())
                .withExemptions(registry.getExemptions());
    }

    private static Path repoRoot(ContractGateProperties properties) {
        return Path.of(properties.getRepoRoot()).toAbsolutePath().normalize();
    }

    private static Path optionalPath(String value) {
        return value == null || value.isBlank() ? null : Path.of(value);
    }
}
