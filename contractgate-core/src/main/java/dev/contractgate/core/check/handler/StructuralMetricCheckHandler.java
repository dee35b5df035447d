package dev.contractgate.core.check.handler;

import com.fasterxml.jackson.databind.JsonNode;
import dev.contractgate.core.check.CheckResult;
import dev.contractgate.core.check.metric.MetricCalculator;
import dev.contractgate.core.check.metric.StructuralMetric;
import dev.contractgate.core.check.source.SourceAdapters;
import dev.contractgate.core.check.source.SourceUnit;
import dev.contractgate.core.check.source.SyntaxNode;
import dev.contractgate.core.contract.CheckDefinition;
import dev.contractgate.core.contract.CheckTypes;
import dev.contractgate.core.exception.CheckExecutionException;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Flags functions, classes or files whose structural metric exceeds {@code max}.
 */
public class StructuralMetricCheckHandler extends SourceCheckHandler {

    public StructuralMetricCheckHandler(SourceAdapters adapters) {
        super(adapters);
    }

    @Override
    public String type() {
        return CheckTypes.STRUCTURAL_METRIC;
    }

    @Override
    protected List<CheckResult> analyze(CheckDefinition check, List<SourceUnit> units) {
        JsonNode config = check.config();
        StructuralMetric metric = StructuralMetric.fromName(config.path("metric").asText(null))
                .orElseThrow(() -> new CheckExecutionException(check.id(),
                        "Unknown structural metric: '" + config.path("metric").asText() + "'"));
        JsonNode maxNode = config.has("max") ? config.get("max") : config.get("threshold");
        if (maxNode == null || !maxNode.canConvertToInt()) {
            throw new CheckExecutionException(check.id(), "Structural metric check requires an integer 'max'");
        }
        int max = maxNode.asInt();

        List<CheckResult> results = new ArrayList<>();
        for (SourceUnit unit : units) {
            if (metric.target() == StructuralMetric.Target.FILE) {
                int value = MetricCalculator.measure(metric, unit.root(), unit);
                if (value > max) {
                    results.add(CheckResult.failure(check, unit.path(), 1,
                            metric.message(unit.path(), value, max), metric.key()));
                }
                continue;
            }
            Stream<SyntaxNode> nodes = metric.target() == StructuralMetric.Target.CLASS ? unit.classes() : unit.functions();
            nodes.forEach(node -> {
                int value = MetricCalculator.measure(metric, node, unit);
                if (value > max) {
                    results.add(CheckResult.failure(check, unit.path(), node.getStartLine(),
                            metric.message(node.getName(), value, max), metric.key()));
                }
            });
        }
        return results;
    }
}
