package dev.contractgate.spring;

import dev.contractgate.core.baseline.BaselineManager;
import dev.contractgate.core.check.CheckExecutor;
import dev.contractgate.core.ci.CIConfig;
import dev.contractgate.core.ci.CIMode;
import dev.contractgate.core.ci.CIRunner;
import dev.contractgate.core.ci.CheckCache;
import dev.contractgate.core.ci.GitHelper;
import dev.contractgate.core.conformance.ConformanceManager;
import dev.contractgate.core.contract.CheckSeverity;
import dev.contractgate.core.contract.ContractRegistry;
import dev.contractgate.core.exception.ConfigException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class ContractGateAutoConfigurationTest {

    @TempDir
    Path repo;

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(ContractGateAutoConfiguration.class));

    private ApplicationContextRunner forRepo() {
        return contextRunner.withPropertyValues(
                "contractgate.repo-root=" + repo,
                "contractgate.global-contracts-dir=" + repo.resolve("no-global"));
    }

    @Test
    void createsTheEngineBeans() {
        forRepo().run(context -> {
            assertThat(context).hasSingleBean(CIConfig.class);
            assertThat(context).hasSingleBean(ContractRegistry.class);
            assertThat(context).hasSingleBean(CheckExecutor.class);
            assertThat(context).hasSingleBean(ConformanceManager.class);
            assertThat(context).hasSingleBean(BaselineManager.class);
            assertThat(context).hasSingleBean(CheckCache.class);
            assertThat(context).hasSingleBean(GitHelper.class);
            assertThat(context).hasSingleBean(CIRunner.class);

            assertThat(context.getBean(ContractRegistry.class).resolve("python-quality")).isPresent();
            assertThat(context.getBean(CheckExecutor.class).supportedTypes()).contains("nested-contract");
            assertThat(context.getBean(CIRunner.class).getRepoRoot()).isEqualTo(repo.toAbsolutePath().normalize());
            assertThat(context.getBean(CheckCache.class).getDirectory())
                    .isEqualTo(repo.toAbsolutePath().normalize().resolve(".contractgate/cache/"));
        });
    }

    @Test
    void ciPropertiesAreBound() {
        forRepo().withPropertyValues(
                "contractgate.ci.mode=pr",
                "contractgate.ci.total-errors-threshold=5",
                "contractgate.ci.min-severity=warning",
                "contractgate.ci.incremental-paths=src/a.py,src/b.py",
                "contractgate.ci.base-ref=origin/main"
        ).run(context -> {
            CIConfig config = context.getBean(CIConfig.class);
            assertThat(config.getMode()).isEqualTo(CIMode.PR);
            assertThat(config.getTotalErrorsThreshold()).isEqualTo(5);
            assertThat(config.getMinSeverity()).isEqualTo(CheckSeverity.WARNING);
            assertThat(config.getIncrementalPaths()).containsExactly("src/a.py", "src/b.py");
            assertThat(config.getBaseRef()).isEqualTo("origin/main");
        });
    }

    @Test
    void invalidCiPropertiesFailStartup() {
        forRepo().withPropertyValues("contractgate.ci.max-workers=0").run(context -> {
            assertThat(context).hasFailed();
            assertThat(context.getStartupFailure()).hasRootCauseInstanceOf(ConfigException.class);
        });
    }

    @Test
    void cacheCanBeDisabled() {
        forRepo().withPropertyValues("contractgate.ci.cache-enabled=false").run(context -> {
            assertThat(context).doesNotHaveBean(CheckCache.class);
            assertThat(context).hasSingleBean(CIRunner.class);
        });
    }

    @Test
    void disabledPropertyTurnsEverythingOff() {
        forRepo().withPropertyValues("contractgate.enabled=false").run(context -> {
            assertThat(context).doesNotHaveBean(ContractRegistry.class);
            assertThat(context).doesNotHaveBean(CIRunner.class);
        });
    }

    @Test
    void userBeansTakePrecedence() {
        forRepo().withUserConfiguration(CustomConfigConfiguration.class).run(context -> {
            assertThat(context).hasSingleBean(CIConfig.class);
            assertThat(context.getBean(CIConfig.class).getMode()).isEqualTo(CIMode.INCREMENTAL);
            assertThat(context.getBean(CIRunner.class).getConfig().getMode()).isEqualTo(CIMode.INCREMENTAL);
        });
    }

    @Configuration(proxyBeanMethods = false)
    static class CustomConfigConfiguration {

        @Bean
        CIConfig customCiConfig() {
            CIConfig config = new CIConfig();
            config.setMode(CIMode.INCREMENTAL);
            return config;
        }
    }
}
