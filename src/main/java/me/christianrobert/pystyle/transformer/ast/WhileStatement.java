package me.christianrobert.pystyle.transformer.ast;

import java.util.List;

public class WhileStatement extends SyntaxNode {

    private final SyntaxNode test;
    private final List<SyntaxNode> body;

    public WhileStatement(SyntaxNode test, List<SyntaxNode> body, SourceSpan span) {
        super(NodeKind.WHILE, span);
        this.test = test;
        this.body = immutableCopy(body);
    }

    public SyntaxNode getTest() {
        return test;
    }

    public List<SyntaxNode> getBody() {
        return body;
    }

    @Override
    public <R> R accept(SyntaxVisitor<R> visitor) {
        return visitor.visitWhile(this);
    }

    @Override
    public List<SyntaxNode> getChildren() {
        return children(test, body);
    }
}
