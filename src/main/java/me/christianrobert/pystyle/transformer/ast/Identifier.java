package me.christianrobert.pystyle.transformer.ast;

import java.util.Collections;
import java.util.List;

public class Identifier extends SyntaxNode {

    private final String name;

    public Identifier(String name, SourceSpan span) {
        super(NodeKind.IDENTIFIER, span);
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public <R> R accept(SyntaxVisitor<R> visitor) {
        return visitor.visitIdentifier(this);
    }

    @Override
    public List<SyntaxNode> getChildren() {
        return Collections.emptyList();
    }

    @Override
    public String describe() {
        return "Identifier " + name;
    }
}
