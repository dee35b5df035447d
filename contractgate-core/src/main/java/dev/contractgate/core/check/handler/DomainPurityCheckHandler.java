package dev.contractgate.core.check.handler;

import com.fasterxml.jackson.databind.JsonNode;
import dev.contractgate.core.check.CheckResult;
import dev.contractgate.core.check.source.ImportRef;
import dev.contractgate.core.check.source.NodeKind;
import dev.contractgate.core.check.source.SourceAdapters;
import dev.contractgate.core.check.source.SourceLanguage;
import dev.contractgate.core.check.source.SourceUnit;
import dev.contractgate.core.contract.CheckDefinition;
import dev.contractgate.core.contract.CheckTypes;
import dev.contractgate.core.util.GlobMatcher;

import java.util.ArrayList;
import java.util.List;

/**
 * Keeps the domain layer free of I/O: no imports of network, filesystem, database or cloud
 * modules and no calls to I/O functions.
 */
public class DomainPurityCheckHandler extends SourceCheckHandler {

    static final List<String> DEFAULT_DOMAIN_PATHS = List.of("**/domain/**");

    static final List<String> PYTHON_FORBIDDEN_IMPORTS = List.of(
            "requests", "httpx", "aiohttp", "urllib.request", "sqlite3", "psycopg2", "pymongo", "redis",
            "sqlalchemy", "django.db", "flask_sqlalchemy", "boto3", "azure", "google.cloud");

    static final List<String> PYTHON_FORBIDDEN_CALLS = List.of(
            "open(", "Path.read", "Path.write", "os.path", "shutil.", "subprocess.", "os.system(", "os.popen(");

    static final List<String> JAVA_FORBIDDEN_IMPORTS = List.of(
            "java.net", "java.sql", "javax.sql", "java.nio.file", "java.io.File", "java.net.http",
            "org.springframework.jdbc", "org.springframework.web", "jakarta.persistence", "javax.persistence",
            "software.amazon.awssdk", "com.azure", "com.google.cloud");

    static final List<String> JAVA_FORBIDDEN_CALLS = List.of(
            "Files.", "Paths.get", "DriverManager.", "Runtime.getRuntime", "System.getenv",
            "FileInputStream(", "FileOutputStream(", "FileReader(", "FileWriter(", "ProcessBuilder(", "Socket(");

    public DomainPurityCheckHandler(SourceAdapters adapters) {
        super(adapters);
    }

    @Override
    public String type() {
        return CheckTypes.DOMAIN_PURITY;
    }

    @Override
    protected List<CheckResult> analyze(CheckDefinition check, List<SourceUnit> units) {
        JsonNode config = check.config();
        List<String> domainPaths = CheckDefinition.stringList(config.get("domain_paths"));
        if (domainPaths.isEmpty()) {
            domainPaths = DEFAULT_DOMAIN_PATHS;
        }

        List<CheckResult> results = new ArrayList<>();
        for (SourceUnit unit : units) {
            if (!GlobMatcher.matchesAny(domainPaths, unit.path())) {
                continue;
            }
            boolean java = unit.language() == SourceLanguage.JAVA;
            List<String> forbiddenImports = configured(config, "forbidden_imports", java ? JAVA_FORBIDDEN_IMPORTS : PYTHON_FORBIDDEN_IMPORTS);
            List<String> forbiddenCalls = configured(config, "forbidden_calls", java ? JAVA_FORBIDDEN_CALLS : PYTHON_FORBIDDEN_CALLS);

            for (ImportRef ref : unit.imports()) {
                forbiddenImports.stream()
                        .filter(f -> NameMatcher.matchesModule(f, ref.module()))
                        .findFirst()
                        .ifPresent(f -> results.add(CheckResult.failure(check, unit.path(), ref.line(),
                                "Domain code imports I/O module '" + ref.module() + "'", "import:" + f)));
            }
            unit.root().descendants()
                    .filter(n -> n.getKind() == NodeKind.CALL || n.getKind() == NodeKind.INSTANTIATION)
                    .forEach(node -> forbiddenCalls.stream()
                            .filter(f -> NameMatcher.matchesCall(f, node.getName()))
                            .findFirst()
                            .ifPresent(f -> results.add(CheckResult.failure(check, unit.path(), node.getStartLine(),
                                    "Domain code performs I/O via '" + node.getName() + "'", "call:" + f))));
        }
        return results;
    }

    private static List<String> configured(JsonNode config, String key, List<String> defaults) {
        List<String> values = CheckDefinition.stringList(config.get(key));
        return values.isEmpty() ? defaults : values;
    }
}
