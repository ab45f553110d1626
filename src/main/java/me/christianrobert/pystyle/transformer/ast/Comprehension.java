package me.christianrobert.pystyle.transformer.ast;

import java.util.List;

/**
 * List, dict or generator comprehension with a single {@code for} clause:
 * {@code [element for target in iterable if c1 if c2]} or
 * {@code {key: element for target in iterable}}.
 */
public class Comprehension extends SyntaxNode {

    public enum ComprehensionKind {
        LIST,
        DICT,
        GENERATOR
    }

    private final ComprehensionKind comprehensionKind;
    private final SyntaxNode key;
    private final SyntaxNode element;
    private final SyntaxNode target;
    private final SyntaxNode iterable;
    private final List<SyntaxNode> conditions;

    public Comprehension(ComprehensionKind comprehensionKind, SyntaxNode key, SyntaxNode element,
                         SyntaxNode target, SyntaxNode iterable, List<SyntaxNode> conditions,
                         SourceSpan span) {
        super(NodeKind.COMPREHENSION, span);
        this.comprehensionKind = comprehensionKind;
        this.key = key;
        this.element = element;
        this.target = target;
        this.iterable = iterable;
        this.conditions = immutableCopy(conditions);
    }

    public ComprehensionKind getComprehensionKind() {
        return comprehensionKind;
    }

    /**
     * Key expression for DICT comprehensions, {@code null} otherwise.
     */
    public SyntaxNode getKey() {
        return key;
    }

    public SyntaxNode getElement() {
        return element;
    }

    public SyntaxNode getTarget() {
        return target;
    }

    public SyntaxNode getIterable() {
        return iterable;
    }

    public List<SyntaxNode> getConditions() {
        return conditions;
    }

    @Override
    public <R> R accept(SyntaxVisitor<R> visitor) {
        return visitor.visitComprehension(this);
    }

    @Override
    public List<SyntaxNode> getChildren() {
        return children(key, element, target, iterable, conditions);
    }

    @Override
    public String describe() {
        return "Comprehension " + comprehensionKind;
    }
}
