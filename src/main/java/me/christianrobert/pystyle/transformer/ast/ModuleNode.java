package me.christianrobert.pystyle.transformer.ast;

import java.util.List;

/**
 * Root of a parsed program: the top-level statements in source order.
 */
public class ModuleNode extends SyntaxNode {

    private final List<SyntaxNode> body;

    public ModuleNode(List<SyntaxNode> body, SourceSpan span) {
        super(NodeKind.MODULE, span);
        this.body = immutableCopy(body);
    }

    public ModuleNode(List<SyntaxNode> body) {
        this(body, SourceSpan.UNKNOWN);
    }

    public List<SyntaxNode> getBody() {
        return body;
    }

    @Override
    public <R> R accept(SyntaxVisitor<R> visitor) {
        return visitor.visitModule(this);
    }

    @Override
    public List<SyntaxNode> getChildren() {
        return children(body);
    }
}
