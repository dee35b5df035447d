package dev.contractgate.core.check.handler;

import com.fasterxml.jackson.databind.JsonNode;
import dev.contractgate.core.check.CheckHandler;
import dev.contractgate.core.check.CheckResult;
import dev.contractgate.core.check.CustomCheck;
import dev.contractgate.core.contract.CheckDefinition;
import dev.contractgate.core.contract.CheckTypes;
import dev.contractgate.core.exception.CheckExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Dispatches {@code custom} checks to a named {@link CustomCheck}.
 */
public class CustomCheckHandler implements CheckHandler {

    private static final Logger logger = LoggerFactory.getLogger(CustomCheckHandler.class);

    private final Map<String, CustomCheck> checks = new ConcurrentHashMap<>();

    /**
     * Create a handler preloaded with the implementations found by {@link ServiceLoader}.
     */
    public CustomCheckHandler() {
        for (CustomCheck check : ServiceLoader.load(CustomCheck.class)) {
            register(check);
        }
    }

    public CustomCheckHandler register(CustomCheck check) {
        CustomCheck previous = checks.put(check.name(), check);
        if (previous != null) {
            logger.warn("Custom check '{}' replaced {} with {}", check.name(),
                    previous.getClass().getName(), check.getClass().getName());
        }
        return this;
    }

    @Override
    public String type() {
        return CheckTypes.CUSTOM;
    }

    @Override
    public List<CheckResult> execute(CheckDefinition check, Path repoRoot, List<String> files) {
        return resolve(check).run(check, repoRoot, files);
    }

    private CustomCheck resolve(CheckDefinition check) {
        JsonNode config = check.config();
        if (config.hasNonNull("class")) {
            return instantiate(check, config.get("class").asText());
        }
        String name = config.hasNonNull("check") ? config.get("check").asText() : config.path("function").asText(null);
        if (name == null) {
            throw new CheckExecutionException(check.id(), "Custom check declares neither 'check' nor 'class'");
        }
        CustomCheck custom = checks.get(name);
        if (custom == null) {
            throw new CheckExecutionException(check.id(), "Unknown custom check '" + name + "'");
        }
        return custom;
    }

    private static CustomCheck instantiate(CheckDefinition check, String className) {
        try {
            ClassLoader loader = Thread.currentThread().getContextClassLoader();
            Class<?> type = Class.forName(className, true, loader != null ? loader : CustomCheckHandler.class.getClassLoader());
            return type.asSubclass(CustomCheck.class).getDeclaredConstructor().newInstance();
        } catch (ReflectiveOperationException | ClassCastException e) {
            throw new CheckExecutionException(check.id(), "Cannot instantiate custom check " + className + ": " + e, e);
        }
    }
}
