package me.christianrobert.pystyle.transformer.ast;

import java.util.List;

/**
 * Loop over an iterable: {@code for target in iterable: body}.
 */
public class ForStatement extends SyntaxNode {

    private final SyntaxNode target;
    private final SyntaxNode iterable;
    private final List<SyntaxNode> body;

    public ForStatement(SyntaxNode target, SyntaxNode iterable, List<SyntaxNode> body, SourceSpan span) {
        super(NodeKind.FOR, span);
        this.target = target;
        this.iterable = iterable;
        this.body = immutableCopy(body);
    }

    public SyntaxNode getTarget() {
        return target;
    }

    public SyntaxNode getIterable() {
        return iterable;
    }

    public List<SyntaxNode> getBody() {
        return body;
    }

    @Override
    public <R> R accept(SyntaxVisitor<R> visitor) {
        return visitor.visitFor(this);
    }

    @Override
    public List<SyntaxNode> getChildren() {
        return children(target, iterable, body);
    }
}
