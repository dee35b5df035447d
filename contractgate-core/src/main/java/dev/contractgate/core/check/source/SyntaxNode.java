package dev.contractgate.core.check.source;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Stream;

/**
 * Node of the language-neutral syntax tree produced by a {@link SourceAdapter}.
 */
public class SyntaxNode {

    private final NodeKind kind;
    private final String name;
    private final int startLine;
    private int endLine;
    private final int weight;
    private final List<String> parameters;
    private final boolean constructor;
    private final List<SyntaxNode> children = new ArrayList<>();

    public SyntaxNode(NodeKind kind, String name, int startLine, int endLine, int weight,
                      List<String> parameters, boolean constructor) {
        this.kind = kind;
        this.name = name;
        this.startLine = startLine;
        this.endLine = endLine;
        this.weight = weight;
        this.parameters = parameters == null ? List.of() : List.copyOf(parameters);
        this.constructor = constructor;
    }

    public static SyntaxNode of(NodeKind kind, int line) {
        return new SyntaxNode(kind, null, line, line, 1, null, false);
    }

    public static SyntaxNode named(NodeKind kind, String name, int line) {
        return new SyntaxNode(kind, name, line, line, 1, null, false);
    }

    public static SyntaxNode weighted(NodeKind kind, int line, int weight) {
        return new SyntaxNode(kind, null, line, line, weight, null, false);
    }

    public static SyntaxNode function(String name, int startLine, int endLine, List<String> parameters, boolean constructor) {
        return new SyntaxNode(NodeKind.FUNCTION, name, startLine, endLine, 1, parameters, constructor);
    }

    public SyntaxNode addChild(SyntaxNode child) {
        children.add(child);
        return child;
    }

    /**
     * All nodes below this one, depth first, not including this node.
     */
    public Stream<SyntaxNode> descendants() {
        return children.stream().flatMap(child -> Stream.concat(Stream.of(child), child.descendants()));
    }

    public Stream<SyntaxNode> descendantsOfKind(NodeKind wanted) {
        return descendants().filter(n -> n.kind == wanted);
    }

    public List<SyntaxNode> childrenOfKind(NodeKind wanted) {
        return children.stream().filter(n -> n.kind == wanted).toList();
    }

    public void extendTo(int line) {
        if (line > endLine) {
            endLine = line;
        }
    }

    public NodeKind getKind() {
        return kind;
    }

    public String getName() {
        return name;
    }

    public int getStartLine() {
        return startLine;
    }

    public int getEndLine() {
        return endLine;
    }

    public int getWeight() {
        return weight;
    }

    public List<String> getParameters() {
        return parameters;
    }

    public boolean isConstructor() {
        return constructor;
    }

    public List<SyntaxNode> getChildren() {
        return Collections.unmodifiableList(children);
    }

    @Override
    public String toString() {
        return kind + (name == null ? "" : "(" + name + ")") + "@" + startLine + "-" + endLine;
    }
}
