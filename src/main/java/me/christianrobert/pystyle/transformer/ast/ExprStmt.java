package me.christianrobert.pystyle.transformer.ast;

import java.util.List;

/**
 * Expression evaluated for its side effect (usually a call), or a bare string used as documentation.
 */
public class ExprStmt extends SyntaxNode {

    private final SyntaxNode expression;

    public ExprStmt(SyntaxNode expression, SourceSpan span) {
        super(NodeKind.EXPR_STMT, span);
        this.expression = expression;
    }

    public SyntaxNode getExpression() {
        return expression;
    }

    @Override
    public <R> R accept(SyntaxVisitor<R> visitor) {
        return visitor.visitExprStmt(this);
    }

    @Override
    public List<SyntaxNode> getChildren() {
        return children(expression);
    }
}
