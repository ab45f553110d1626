package me.christianrobert.pystyle.transformer.ast;

/**
 * Tag of every syntax node variant.
 *
 * <p>The set is closed: {@link SyntaxNode} cannot be subclassed outside this package,
 * and {@link SyntaxVisitor} has one method per tag.</p>
 */
public enum NodeKind {
    MODULE(Category.ROOT),
    CLASS_DEF(Category.STATEMENT),
    FUNCTION_DEF(Category.STATEMENT),
    PARAMETER(Category.PARAMETER),
    DECORATOR(Category.DECORATOR),
    ASSIGN(Category.STATEMENT),
    AUG_ASSIGN(Category.STATEMENT),
    IF(Category.STATEMENT),
    FOR(Category.STATEMENT),
    WHILE(Category.STATEMENT),
    RETURN(Category.STATEMENT),
    EXPR_STMT(Category.STATEMENT),
    CALL(Category.EXPRESSION),
    BINARY_OP(Category.EXPRESSION),
    UNARY_OP(Category.EXPRESSION),
    COMPARE(Category.EXPRESSION),
    CONSTANT(Category.EXPRESSION),
    IDENTIFIER(Category.EXPRESSION),
    ATTRIBUTE(Category.EXPRESSION),
    LIST_LITERAL(Category.EXPRESSION),
    DICT_LITERAL(Category.EXPRESSION),
    COMPREHENSION(Category.EXPRESSION),
    FSTRING(Category.EXPRESSION);

    /**
     * Slot category a node of this kind may occupy.
     */
    public enum Category {
        ROOT,
        STATEMENT,
        EXPRESSION,
        PARAMETER,
        DECORATOR
    }

    private final Category category;

    NodeKind(Category category) {
        this.category = category;
    }

    public Category getCategory() {
        return category;
    }

    public boolean isStatement() {
        return category == Category.STATEMENT;
    }

    public boolean isExpression() {
        return category == Category.EXPRESSION;
    }
}
