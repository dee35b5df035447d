package dev.contractgate.core.check.metric;

import dev.contractgate.core.check.source.ImportRef;
import dev.contractgate.core.check.source.NodeKind;
import dev.contractgate.core.check.source.SourceUnit;
import dev.contractgate.core.check.source.SyntaxNode;

import java.util.List;

/**
 * Language-neutral metric algorithms over the syntax tree.
 */
public final class MetricCalculator {

    private MetricCalculator() {
    }

    /**
     * Measure a metric on a function, class or file node.
     *
     * @param metric the metric
     * @param node the measured node; ignored for file metrics
     * @param unit the source unit the node belongs to
     * @return the measured value
     */
    public static int measure(StructuralMetric metric, SyntaxNode node, SourceUnit unit) {
        return switch (metric) {
            case CYCLOMATIC_COMPLEXITY -> cyclomaticComplexity(node);
            case FUNCTION_LENGTH -> functionLength(node, unit);
            case NESTING_DEPTH -> nestingDepth(node);
            case PARAMETER_COUNT -> node.getParameters().size();
            case CLASS_SIZE -> node.childrenOfKind(NodeKind.FUNCTION).size();
            case IMPORT_COUNT -> importCount(unit.imports());
        };
    }

    /**
     * 1, plus one per branch, conditional expression, loop, exception handler, context scope
     * and assert, plus (n - 1) per n-operand boolean combinator, plus one per comprehension clause.
     */
    public static int cyclomaticComplexity(SyntaxNode function) {
        return 1 + function.descendants().mapToInt(MetricCalculator::decisionPoints).sum();
    }

    /**
     * Non-blank, non-comment-only lines of the function's source range.
     */
    public static int functionLength(SyntaxNode function, SourceUnit unit) {
        List<String> lines = unit.lines();
        int count = 0;
        int last = Math.min(function.getEndLine(), lines.size());
        for (int i = Math.max(1, function.getStartLine()); i <= last; i++) {
            String line = lines.get(i - 1);
            if (!line.isBlank() && !unit.language().isCommentOnly(line)) {
                count++;
            }
        }
        return count;
    }

    /**
     * Deepest chain of nested branch, loop, try, handler and context nodes below the function.
     */
    public static int nestingDepth(SyntaxNode function) {
        return depth(function, 0);
    }

    public static int importCount(List<ImportRef> imports) {
        return imports.stream().mapToInt(ImportRef::bindingCount).sum();
    }

    private static int depth(SyntaxNode node, int current) {
        int max = current;
        for (SyntaxNode child : node.getChildren()) {
            int childDepth = child.getKind().isNesting() ? current + 1 : current;
            max = Math.max(max, depth(child, childDepth));
        }
        return max;
    }

    private static int decisionPoints(SyntaxNode node) {
        return switch (node.getKind()) {
            case BRANCH, CONDITIONAL_EXPRESSION, LOOP, EXCEPTION_HANDLER, CONTEXT, ASSERT -> 1;
            case BOOLEAN_OPERATION -> node.getWeight() - 1;
            case COMPREHENSION -> node.getWeight();
            default -> 0;
        };
    }
}
