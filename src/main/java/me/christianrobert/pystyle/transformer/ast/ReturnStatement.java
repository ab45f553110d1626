package me.christianrobert.pystyle.transformer.ast;

import java.util.List;

/**
 * Return statement; {@code value} is {@code null} for a bare {@code return}.
 */
public class ReturnStatement extends SyntaxNode {

    private final SyntaxNode value;

    public ReturnStatement(SyntaxNode value, SourceSpan span) {
        super(NodeKind.RETURN, span);
        this.value = value;
    }

    public SyntaxNode getValue() {
        return value;
    }

    public boolean hasValue() {
        return value != null;
    }

    @Override
    public <R> R accept(SyntaxVisitor<R> visitor) {
        return visitor.visitReturn(this);
    }

    @Override
    public List<SyntaxNode> getChildren() {
        return children(value);
    }
}
