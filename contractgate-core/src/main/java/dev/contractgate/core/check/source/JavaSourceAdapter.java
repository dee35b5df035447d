package dev.contractgate.core.check.source;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Problem;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.ImportDeclaration;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.ConditionalExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.stmt.AssertStmt;
import com.github.javaparser.ast.stmt.CatchClause;
import com.github.javaparser.ast.stmt.DoStmt;
import com.github.javaparser.ast.stmt.ForEachStmt;
import com.github.javaparser.ast.stmt.ForStmt;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.SwitchEntry;
import com.github.javaparser.ast.stmt.TryStmt;
import com.github.javaparser.ast.stmt.WhileStmt;
import dev.contractgate.core.exception.SourceParseException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Java adapter backed by JavaParser.
 * <p>
 * Methods and constructors become functions; type declarations of any kind become classes.
 * A try-with-resources is a context node, a plain try a try node, and each non-default
 * switch label a branch.
 */
public class JavaSourceAdapter implements SourceAdapter {

    @Override
    public SourceLanguage language() {
        return SourceLanguage.JAVA;
    }

    @Override
    public SourceUnit parse(String path, String content) {
        JavaParser parser = new JavaParser(new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17));
        ParseResult<CompilationUnit> result = parser.parse(content);
        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            Problem problem = result.getProblems().isEmpty() ? null : result.getProblems().get(0);
            String message = problem == null ? "Unparsable Java source" : problem.getMessage();
            int line = problem == null ? 0 : problem.getLocation()
                    .flatMap(location -> location.getBegin().getRange())
                    .map(range -> range.begin.line)
                    .orElse(0);
            throw new SourceParseException(message, line);
        }
        CompilationUnit unit = result.getResult().get();

        String moduleName = moduleName(path, unit);
        SyntaxNode root = SyntaxNode.named(NodeKind.MODULE, moduleName, 1);
        for (Node child : unit.getChildNodes()) {
            if (!(child instanceof ImportDeclaration)) {
                walk(child, root);
            }
        }
        root.extendTo(unit.getRange().map(r -> r.end.line).orElse(1));

        List<ImportRef> imports = new ArrayList<>();
        for (ImportDeclaration declaration : unit.getImports()) {
            imports.add(toImport(declaration));
        }

        List<String> lines = Arrays.asList(content.replace("\r\n", "\n").split("\n", -1));
        return new SourceUnit(path, SourceLanguage.JAVA, moduleName, root, imports, lines);
    }

    private void walk(Node node, SyntaxNode parent) {
        SyntaxNode mapped = map(node);
        SyntaxNode next = parent;
        if (mapped != null) {
            parent.addChild(mapped);
            next = mapped;
        }
        for (Node child : node.getChildNodes()) {
            walk(child, next);
        }
    }

    private SyntaxNode map(Node node) {
        int begin = node.getRange().map(r -> r.begin.line).orElse(0);
        int end = node.getRange().map(r -> r.end.line).orElse(begin);

        if (node instanceof TypeDeclaration<?> type) {
            return new SyntaxNode(NodeKind.CLASS, type.getNameAsString(), begin, end, 1, null, false);
        }
        if (node instanceof MethodDeclaration method) {
            return SyntaxNode.function(method.getNameAsString(), begin, end, parameterNames(method.getParameters()), false);
        }
        if (node instanceof ConstructorDeclaration constructor) {
            return SyntaxNode.function(constructor.getNameAsString(), begin, end, parameterNames(constructor.getParameters()), true);
        }
        if (node instanceof IfStmt) {
            return span(NodeKind.BRANCH, begin, end);
        }
        if (node instanceof SwitchEntry entry && entry.getLabels().isNonEmpty()) {
            return span(NodeKind.BRANCH, begin, end);
        }
        if (node instanceof ConditionalExpr) {
            return span(NodeKind.CONDITIONAL_EXPRESSION, begin, end);
        }
        if (node instanceof ForStmt || node instanceof ForEachStmt || node instanceof WhileStmt || node instanceof DoStmt) {
            return span(NodeKind.LOOP, begin, end);
        }
        if (node instanceof TryStmt tryStmt) {
            return span(tryStmt.getResources().isNonEmpty() ? NodeKind.CONTEXT : NodeKind.TRY, begin, end);
        }
        if (node instanceof CatchClause) {
            return span(NodeKind.EXCEPTION_HANDLER, begin, end);
        }
        if (node instanceof AssertStmt) {
            return span(NodeKind.ASSERT, begin, end);
        }
        if (node instanceof BinaryExpr binary
                && (binary.getOperator() == BinaryExpr.Operator.AND || binary.getOperator() == BinaryExpr.Operator.OR)) {
            return new SyntaxNode(NodeKind.BOOLEAN_OPERATION, null, begin, end, 2, null, false);
        }
        if (node instanceof MethodCallExpr call) {
            String name = call.getScope().map(scope -> scope + "." + call.getNameAsString()).orElse(call.getNameAsString());
            return new SyntaxNode(NodeKind.CALL, name, begin, end, 1, null, false);
        }
        if (node instanceof ObjectCreationExpr creation) {
            return new SyntaxNode(NodeKind.INSTANTIATION, creation.getType().getNameAsString(), begin, end, 1, null, false);
        }
        return null;
    }

    private static SyntaxNode span(NodeKind kind, int begin, int end) {
        return new SyntaxNode(kind, null, begin, end, 1, null, false);
    }

    private static List<String> parameterNames(List<Parameter> parameters) {
        return parameters.stream().map(Parameter::getNameAsString).toList();
    }

    private static ImportRef toImport(ImportDeclaration declaration) {
        String name = declaration.getNameAsString();
        int line = declaration.getRange().map(r -> r.begin.line).orElse(0);
        if (declaration.isStatic() && !declaration.isAsterisk()) {
            int dot = name.lastIndexOf('.');
            return new ImportRef(dot < 0 ? name : name.substring(0, dot), List.of(name.substring(dot + 1)), line, false);
        }
        if (declaration.isAsterisk()) {
            return new ImportRef(name, List.of("*"), line, false);
        }
        return new ImportRef(name, List.of(), line, false);
    }

    private static String moduleName(String path, CompilationUnit unit) {
        String fileName = path.substring(path.lastIndexOf('/') + 1);
        String stem = fileName.endsWith(".java") ? fileName.substring(0, fileName.length() - 5) : fileName;
        return unit.getPackageDeclaration()
                .map(p -> p.getNameAsString() + "." + stem)
                .orElse(stem);
    }
}
