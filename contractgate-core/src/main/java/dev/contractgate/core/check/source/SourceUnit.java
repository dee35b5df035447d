package dev.contractgate.core.check.source;

import java.util.List;
import java.util.stream.Stream;

/**
 * A parsed source file.
 *
 * @param path repository-relative path
 * @param language source language
 * @param moduleName dotted module name used for import resolution
 * @param root the module node
 * @param imports import statements in source order
 * @param lines raw source lines
 */
public record SourceUnit(
        String path,
        SourceLanguage language,
        String moduleName,
        SyntaxNode root,
        List<ImportRef> imports,
        List<String> lines
) {

    public Stream<SyntaxNode> functions() {
        return root.descendantsOfKind(NodeKind.FUNCTION);
    }

    public Stream<SyntaxNode> classes() {
        return root.descendantsOfKind(NodeKind.CLASS);
    }
}
