package dev.contractgate.core.check.source;

import dev.contractgate.core.check.metric.MetricCalculator;
import dev.contractgate.core.exception.SourceParseException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.assertj.core.api.Assertions.tuple;

class PythonSourceAdapterTest {

    private static final String SERVICE = String.join("\n",
            "import os",
            "from .models import User",
            "",
            "def simple(a, b):",
            "    return a + b",
            "",
            "def complex_one(x, items):",
            "    if x > 0 and x < 10:",
            "        for item in items:",
            "            if item:",
            "                print(item)",
            "    elif x < 0:",
            "        return -1",
            "    else:",
            "        return 0",
            "    try:",
            "        os.remove(\"f\")",
            "    except OSError:",
            "        pass",
            "    return [i for i in items if i]",
            "");

    private final PythonSourceAdapter adapter = new PythonSourceAdapter();

    @Test
    void moduleNameDropsSrcPrefixAndInitSuffix() {
        assertThat(PythonSourceAdapter.moduleName("src/pkg/service.py")).isEqualTo("pkg.service");
        assertThat(PythonSourceAdapter.moduleName("pkg/sub/__init__.py")).isEqualTo("pkg.sub");
        assertThat(PythonSourceAdapter.moduleName("tool.py")).isEqualTo("tool");
    }

    @Test
    void functionsCarryParametersAndLineSpans() {
        SourceUnit unit = adapter.parse("src/pkg/service.py", SERVICE);
        Map<String, SyntaxNode> functions = byName(unit);

        assertThat(functions).containsOnlyKeys("simple", "complex_one");
        assertThat(functions.get("simple").getParameters()).containsExactly("a", "b");
        assertThat(functions.get("simple").getStartLine()).isEqualTo(4);
        assertThat(functions.get("simple").getEndLine()).isEqualTo(5);
        assertThat(functions.get("complex_one").getStartLine()).isEqualTo(7);
        assertThat(functions.get("complex_one").getEndLine()).isEqualTo(20);
    }

    @Test
    void metricsFollowTheBlockStructure() {
        SourceUnit unit = adapter.parse("src/pkg/service.py", SERVICE);
        SyntaxNode complex = byName(unit).get("complex_one");

        // if, and, for, nested if, elif, except, comprehension
        assertThat(MetricCalculator.cyclomaticComplexity(complex)).isEqualTo(8);
        assertThat(MetricCalculator.nestingDepth(complex)).isEqualTo(3);
        assertThat(MetricCalculator.functionLength(complex, unit)).isEqualTo(14);
        assertThat(MetricCalculator.cyclomaticComplexity(byName(unit).get("simple"))).isEqualTo(1);
    }

    @Test
    void elifNestsInsidePrecedingBranchAndHandlerInsideTry() {
        SourceUnit unit = adapter.parse("src/pkg/service.py", SERVICE);
        SyntaxNode complex = byName(unit).get("complex_one");

        SyntaxNode ifBranch = complex.childrenOfKind(NodeKind.BRANCH).get(0);
        assertThat(complex.childrenOfKind(NodeKind.BRANCH)).hasSize(1);
        assertThat(ifBranch.childrenOfKind(NodeKind.BRANCH)).hasSize(1);
        assertThat(ifBranch.childrenOfKind(NodeKind.BOOLEAN_OPERATION)).singleElement()
                .extracting(SyntaxNode::getWeight).isEqualTo(2);

        SyntaxNode tryNode = complex.childrenOfKind(NodeKind.TRY).get(0);
        assertThat(tryNode.childrenOfKind(NodeKind.EXCEPTION_HANDLER)).hasSize(1);
        assertThat(complex.childrenOfKind(NodeKind.COMPREHENSION)).singleElement()
                .extracting(SyntaxNode::getWeight).isEqualTo(1);
    }

    @Test
    void callsAreRecordedWithDottedNames() {
        SourceUnit unit = adapter.parse("src/pkg/service.py", SERVICE);

        List<String> calls = unit.root().descendantsOfKind(NodeKind.CALL).map(SyntaxNode::getName).toList();
        assertThat(calls).containsExactlyInAnyOrder("print", "os.remove");
    }

    @Test
    void importsResolveRelativeModules() {
        SourceUnit unit = adapter.parse("src/pkg/service.py", SERVICE);

        assertThat(unit.imports()).extracting(ImportRef::module).containsExactly("os", "pkg.models");
        assertThat(unit.imports().get(1).names()).containsExactly("User");
        assertThat(MetricCalculator.importCount(unit.imports())).isEqualTo(2);
    }

    @Test
    void parentRelativeImportsClimbPackages() {
        String source = String.join("\n",
                "from ..shared import util, helpers as h",
                "from . import sibling",
                "import json, re as regex");
        SourceUnit unit = adapter.parse("app/domain/orders.py", source);

        assertThat(unit.imports()).extracting(ImportRef::module)
                .containsExactly("app.shared", "app.domain", "json", "re");
        assertThat(unit.imports().get(0).names()).containsExactly("util", "helpers");
        assertThat(unit.imports().get(1).candidates()).containsExactly("app.domain", "app.domain.sibling");
    }

    @Test
    void typeCheckingImportsAreFlagged() {
        String source = String.join("\n",
                "from typing import TYPE_CHECKING",
                "if TYPE_CHECKING:",
                "    from app.infra.db import Session",
                "import logging");
        SourceUnit unit = adapter.parse("app/domain/model.py", source);

        assertThat(unit.imports()).extracting(ImportRef::module, ImportRef::typeCheckingOnly)
                .containsExactly(
                        tuple("typing", false),
                        tuple("app.infra.db", true),
                        tuple("logging", false));
    }

    @Test
    void initInsideClassIsConstructorAndSelfIsDropped() {
        String source = String.join("\n",
                "class UserService:",
                "    def __init__(self, repo, clock=None):",
                "        self.repo = repo",
                "",
                "    def find(self, user_id):",
                "        return self.repo.get(user_id)",
                "",
                "def __init__(config):",
                "    return config");
        SourceUnit unit = adapter.parse("app/service.py", source);

        SyntaxNode service = unit.classes().findFirst().orElseThrow();
        assertThat(service.getName()).isEqualTo("UserService");
        assertThat(service.childrenOfKind(NodeKind.FUNCTION)).extracting(SyntaxNode::getName)
                .containsExactly("__init__", "find");

        SyntaxNode init = service.childrenOfKind(NodeKind.FUNCTION).get(0);
        assertThat(init.isConstructor()).isTrue();
        assertThat(init.getParameters()).containsExactly("repo", "clock");

        SyntaxNode moduleLevel = unit.root().childrenOfKind(NodeKind.FUNCTION).get(0);
        assertThat(moduleLevel.isConstructor()).isFalse();
    }

    @Test
    void stringsAndCommentsDoNotProduceNodes() {
        String source = String.join("\n",
                "def quiet():",
                "    text = \"if a and b: call()\"  # or maybe for x in y",
                "    doc = '''",
                "    while True: run()",
                "    '''",
                "    return text");
        SourceUnit unit = adapter.parse("quiet.py", source);

        SyntaxNode quiet = unit.functions().findFirst().orElseThrow();
        assertThat(MetricCalculator.cyclomaticComplexity(quiet)).isEqualTo(1);
        assertThat(quiet.descendantsOfKind(NodeKind.CALL)).isEmpty();
        assertThat(quiet.getEndLine()).isEqualTo(6);
    }

    @Test
    void bracketContinuationFormsOneLogicalLine() {
        String source = String.join("\n",
                "def build(",
                "        first,",
                "        second,",
                "        *args,",
                "        **kwargs):",
                "    return first if second else None");
        SourceUnit unit = adapter.parse("build.py", source);

        SyntaxNode build = unit.functions().findFirst().orElseThrow();
        assertThat(build.getParameters()).containsExactly("first", "second", "args", "kwargs");
        assertThat(build.childrenOfKind(NodeKind.CONDITIONAL_EXPRESSION)).hasSize(1);
        assertThat(MetricCalculator.cyclomaticComplexity(build)).isEqualTo(2);
    }

    @Test
    void unterminatedStringIsAParseError() {
        SourceParseException error = catchThrowableOfType(
                () -> adapter.parse("bad.py", "x = 1\ny = \"open\nz = 2\n"), SourceParseException.class);

        assertThat(error).hasMessageContaining("Unterminated string");
        assertThat(error.getLine()).isEqualTo(2);
    }

    @Test
    void unclosedBracketIsAParseError() {
        assertThatThrownBy(() -> adapter.parse("bad.py", "values = [1, 2,\n"))
                .isInstanceOf(SourceParseException.class)
                .hasMessageContaining("Unclosed bracket");
    }

    @Test
    void strayClauseIsAParseError() {
        assertThatThrownBy(() -> adapter.parse("bad.py", "x = 1\nelse:\n    y = 2\n"))
                .isInstanceOf(SourceParseException.class)
                .hasMessageContaining("Unexpected 'else' clause");
    }

    private static Map<String, SyntaxNode> byName(SourceUnit unit) {
        return unit.functions().collect(Collectors.toMap(SyntaxNode::getName, Function.identity()));
    }
}
