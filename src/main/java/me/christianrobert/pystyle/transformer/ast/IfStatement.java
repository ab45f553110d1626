package me.christianrobert.pystyle.transformer.ast;

import java.util.List;

/**
 * Conditional statement. An {@code elif} chain arrives as an {@code orElse}
 * holding exactly one nested {@link IfStatement}.
 */
public class IfStatement extends SyntaxNode {

    private final SyntaxNode test;
    private final List<SyntaxNode> body;
    private final List<SyntaxNode> orElse;

    public IfStatement(SyntaxNode test, List<SyntaxNode> body, List<SyntaxNode> orElse, SourceSpan span) {
        super(NodeKind.IF, span);
        this.test = test;
        this.body = immutableCopy(body);
        this.orElse = immutableCopy(orElse);
    }

    public SyntaxNode getTest() {
        return test;
    }

    public List<SyntaxNode> getBody() {
        return body;
    }

    public List<SyntaxNode> getOrElse() {
        return orElse;
    }

    /**
     * True when the else branch is a single nested if, i.e. an {@code elif}.
     */
    public boolean hasElifBranch() {
        return orElse.size() == 1 && orElse.get(0) instanceof IfStatement;
    }

    @Override
    public <R> R accept(SyntaxVisitor<R> visitor) {
        return visitor.visitIf(this);
    }

    @Override
    public List<SyntaxNode> getChildren() {
        return children(test, body, orElse);
    }
}
