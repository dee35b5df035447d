package dev.contractgate.core.ci.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.contractgate.core.ci.CIResult;
import dev.contractgate.core.ci.CIViolation;
import dev.contractgate.core.ci.ExitCode;
import dev.contractgate.core.contract.CheckSeverity;
import dev.contractgate.core.util.Mappers;

import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * SARIF 2.1.0 output for code scanning integrations.
 */
public class SarifReportWriter implements ReportWriter {

    public static final String SARIF_VERSION = "2.1.0";
    public static final String SARIF_SCHEMA =
            "https://raw.githubusercontent.com/oasis-tcs/sarif-spec/master/Schemata/sarif-schema-2.1.0.json";

    private static final String INFORMATION_URI = "https://github.com/contractgate/contractgate";

    private final ObjectMapper mapper = Mappers.json();
    private final String toolName;
    private final String toolVersion;

    public SarifReportWriter() {
        this("contractgate", "1.0.0");
    }

    public SarifReportWriter(String toolName, String toolVersion) {
        this.toolName = toolName;
        this.toolVersion = toolVersion;
    }

    @Override
    public String format() {
        return "sarif";
    }

    @Override
    public String render(CIResult result) {
        try {
            return mapper.writeValueAsString(toDocument(result));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Cannot render SARIF", e);
        }
    }

    public ObjectNode toDocument(CIResult result) {
        ObjectNode document = mapper.createObjectNode();
        document.put("$schema", SARIF_SCHEMA);
        document.put("version", SARIF_VERSION);

        ObjectNode run = document.putArray("runs").addObject();
        ObjectNode driver = run.putObject("tool").putObject("driver");
        driver.put("name", toolName);
        driver.put("version", toolVersion);
        driver.put("informationUri", INFORMATION_URI);

        Map<String, ObjectNode> rules = new LinkedHashMap<>();
        ArrayNode results = mapper.createArrayNode();
        for (CIViolation violation : result.violations()) {
            rules.computeIfAbsent(ruleId(violation), id -> rule(id, violation));
            results.add(result(violation));
        }
        driver.putArray("rules").addAll(rules.values());
        run.set("results", results);

        ObjectNode invocation = run.putArray("invocations").addObject();
        invocation.put("executionSuccessful", result.exitCode() == ExitCode.SUCCESS);
        invocation.put("startTimeUtc", result.startedAt().toString());
        invocation.put("endTimeUtc", result.completedAt().toString());

        if (result.commitSha() != null) {
            ObjectNode provenance = run.putArray("versionControlProvenance").addObject();
            provenance.put("repositoryUri", "");
            provenance.put("revisionId", result.commitSha());
        }
        return document;
    }

    private ObjectNode rule(String id, CIViolation violation) {
        ObjectNode rule = mapper.createObjectNode();
        rule.put("id", id);
        rule.put("name", id);
        rule.putObject("shortDescription").put("text", "Check: " + violation.checkId());
        rule.putObject("defaultConfiguration").put("level", level(violation.severity()));
        if (violation.fixHint() != null) {
            rule.putObject("help").put("text", violation.fixHint());
        }
        return rule;
    }

    private ObjectNode result(CIViolation violation) {
        ObjectNode result = mapper.createObjectNode();
        result.put("ruleId", ruleId(violation));
        result.put("level", level(violation.severity()));
        result.putObject("message").put("text", violation.message());

        ObjectNode physical = result.putArray("locations").addObject().putObject("physicalLocation");
        ObjectNode artifact = physical.putObject("artifactLocation");
        artifact.put("uri", violation.filePath());
        artifact.put("uriBaseId", "%SRCROOT%");
        if (violation.line() != null && violation.line() > 0) {
            physical.putObject("region").put("startLine", violation.line());
        }

        if (violation.fixHint() != null) {
            result.putArray("fixes").addObject().putObject("description").put("text", violation.fixHint());
        }
        result.putObject("partialFingerprints").put("primaryLocationLineHash", violation.hash());
        return result;
    }

    private static String ruleId(CIViolation violation) {
        return violation.ruleId() != null ? violation.ruleId() : violation.checkId();
    }

    static String level(CheckSeverity severity) {
        return switch (severity) {
            case ERROR -> "error";
            case WARNING -> "warning";
            case INFO -> "note";
        };
    }
}
