package me.christianrobert.pystyle.transformer.ast;

import java.util.List;

/**
 * Augmented assignment {@code target op= value}.
 */
public class AugAssign extends SyntaxNode {

    private final SyntaxNode target;
    private final BinaryOp.Operator operator;
    private final SyntaxNode value;

    public AugAssign(SyntaxNode target, BinaryOp.Operator operator, SyntaxNode value, SourceSpan span) {
        super(NodeKind.AUG_ASSIGN, span);
        this.target = target;
        this.operator = operator;
        this.value = value;
    }

    public SyntaxNode getTarget() {
        return target;
    }

    public BinaryOp.Operator getOperator() {
        return operator;
    }

    public SyntaxNode getValue() {
        return value;
    }

    @Override
    public <R> R accept(SyntaxVisitor<R> visitor) {
        return visitor.visitAugAssign(this);
    }

    @Override
    public List<SyntaxNode> getChildren() {
        return children(target, value);
    }

    @Override
    public String describe() {
        return "AugAssign " + (operator != null ? operator.getSymbol() + "=" : "?");
    }
}
