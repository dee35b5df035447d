package dev.contractgate.core.check.source;

/**
 * Kinds of nodes in the language-neutral syntax tree.
 */
public enum NodeKind {
    MODULE,
    CLASS,
    FUNCTION,
    /**
     * Conditional statement or case label.
     */
    BRANCH,
    CONDITIONAL_EXPRESSION,
    LOOP,
    TRY,
    EXCEPTION_HANDLER,
    /**
     * Resource scope such as a Python {@code with} block or a Java try-with-resources.
     */
    CONTEXT,
    ASSERT,
    /**
     * Boolean combinator; {@link SyntaxNode#getWeight()} holds the operand count.
     */
    BOOLEAN_OPERATION,
    /**
     * Comprehension or generator; {@link SyntaxNode#getWeight()} holds the clause count.
     */
    COMPREHENSION,
    CALL,
    INSTANTIATION;

    /**
     * Whether the kind opens a nesting level inside a function.
     */
    public boolean isNesting() {
        return this == BRANCH || this == LOOP || this == TRY || this == EXCEPTION_HANDLER || this == CONTEXT;
    }
}
