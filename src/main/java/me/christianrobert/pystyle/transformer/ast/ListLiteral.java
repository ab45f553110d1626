package me.christianrobert.pystyle.transformer.ast;

import java.util.List;

public class ListLiteral extends SyntaxNode {

    private final List<SyntaxNode> elements;

    public ListLiteral(List<SyntaxNode> elements, SourceSpan span) {
        super(NodeKind.LIST_LITERAL, span);
        this.elements = immutableCopy(elements);
    }

    public List<SyntaxNode> getElements() {
        return elements;
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    @Override
    public <R> R accept(SyntaxVisitor<R> visitor) {
        return visitor.visitListLiteral(this);
    }

    @Override
    public List<SyntaxNode> getChildren() {
        return children(elements);
    }
}
