package me.christianrobert.pystyle.transformer.ast;

import java.util.Collections;
import java.util.List;

/**
 * Assignment statement {@code a = b = value}. Targets are identifiers or attributes.
 */
public class Assign extends SyntaxNode {

    private final List<SyntaxNode> targets;
    private final SyntaxNode value;

    public Assign(List<SyntaxNode> targets, SyntaxNode value, SourceSpan span) {
        super(NodeKind.ASSIGN, span);
        this.targets = immutableCopy(targets);
        this.value = value;
    }

    public Assign(SyntaxNode target, SyntaxNode value, SourceSpan span) {
        this(Collections.singletonList(target), value, span);
    }

    public List<SyntaxNode> getTargets() {
        return targets;
    }

    public SyntaxNode getValue() {
        return value;
    }

    @Override
    public <R> R accept(SyntaxVisitor<R> visitor) {
        return visitor.visitAssign(this);
    }

    @Override
    public List<SyntaxNode> getChildren() {
        return children(targets, value);
    }
}
