package me.christianrobert.pystyle.transformer.ast;

import java.util.List;

/**
 * Decorator attached to a class or function: {@code @expression}.
 */
public class Decorator extends SyntaxNode {

    private final SyntaxNode expression;

    public Decorator(SyntaxNode expression, SourceSpan span) {
        super(NodeKind.DECORATOR, span);
        this.expression = expression;
    }

    public SyntaxNode getExpression() {
        return expression;
    }

    /**
     * Plain name of the decorator when it is an identifier or a call to one, else {@code null}.
     */
    public String getSimpleName() {
        SyntaxNode target = expression;
        if (target instanceof Call) {
            target = ((Call) target).getFunction();
        }
        if (target instanceof Identifier) {
            return ((Identifier) target).getName();
        }
        if (target instanceof Attribute) {
            return ((Attribute) target).getAttributeName();
        }
        return null;
    }

    @Override
    public <R> R accept(SyntaxVisitor<R> visitor) {
        return visitor.visitDecorator(this);
    }

    @Override
    public List<SyntaxNode> getChildren() {
        return children(expression);
    }

    @Override
    public String describe() {
        return "Decorator " + getSimpleName();
    }
}
