package dev.contractgate.core.check.handler;

import com.fasterxml.jackson.databind.JsonNode;
import dev.contractgate.core.check.CheckResult;
import dev.contractgate.core.check.source.NodeKind;
import dev.contractgate.core.check.source.SourceAdapters;
import dev.contractgate.core.check.source.SourceUnit;
import dev.contractgate.core.check.source.SyntaxNode;
import dev.contractgate.core.contract.CheckDefinition;
import dev.contractgate.core.contract.CheckTypes;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Requires selected classes to receive their dependencies through a constructor.
 * <p>
 * Classes whose name matches {@code class_patterns} must declare a constructor, with at
 * least one parameter when {@code check_for_init_params} is set (the default). Constructing
 * any type listed in {@code forbidden_instantiations} inside the constructor is a violation.
 */
public class ConstructorInjectionCheckHandler extends SourceCheckHandler {

    static final List<String> DEFAULT_CLASS_PATTERNS = List.of("*Service", "*UseCase", "*Handler");

    public ConstructorInjectionCheckHandler(SourceAdapters adapters) {
        super(adapters);
    }

    @Override
    public String type() {
        return CheckTypes.CONSTRUCTOR_INJECTION;
    }

    @Override
    protected List<CheckResult> analyze(CheckDefinition check, List<SourceUnit> units) {
        JsonNode config = check.config();
        List<String> classPatterns = CheckDefinition.stringList(config.get("class_patterns"));
        if (classPatterns.isEmpty()) {
            classPatterns = DEFAULT_CLASS_PATTERNS;
        }
        List<String> forbidden = CheckDefinition.stringList(config.get("forbidden_instantiations"));
        boolean requireParams = config.path("check_for_init_params").asBoolean(true);

        List<CheckResult> results = new ArrayList<>();
        for (SourceUnit unit : units) {
            for (SyntaxNode type : unit.classes().toList()) {
                String className = type.getName();
                if (classPatterns.stream().noneMatch(p -> NameMatcher.matchesName(p, className))) {
                    continue;
                }
                List<SyntaxNode> constructors = type.childrenOfKind(NodeKind.FUNCTION).stream()
                        .filter(SyntaxNode::isConstructor)
                        .toList();
                if (constructors.isEmpty()) {
                    results.add(CheckResult.failure(check, unit.path(), type.getStartLine(),
                            "Class '" + className + "' has no constructor; dependencies should be injected", "missing-constructor"));
                    continue;
                }
                if (requireParams && constructors.stream().allMatch(c -> c.getParameters().isEmpty())) {
                    results.add(CheckResult.failure(check, unit.path(), constructors.get(0).getStartLine(),
                            "Class '" + className + "' constructor takes no parameters; dependencies should be injected", "no-parameters"));
                }
                for (SyntaxNode constructor : constructors) {
                    constructionsIn(constructor).forEach(node -> {
                        if (forbidden.stream().anyMatch(f -> NameMatcher.matchesName(f, node.getName()))) {
                            results.add(CheckResult.failure(check, unit.path(), node.getStartLine(),
                                    "Class '" + className + "' instantiates '" + node.getName()
                                            + "' in its constructor; inject it instead", "direct-instantiation"));
                        }
                    });
                }
            }
        }
        return results;
    }

    private static Stream<SyntaxNode> constructionsIn(SyntaxNode constructor) {
        return constructor.descendants()
                .filter(n -> n.getKind() == NodeKind.INSTANTIATION || n.getKind() == NodeKind.CALL);
    }
}
