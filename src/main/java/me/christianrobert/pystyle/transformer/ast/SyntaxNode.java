package me.christianrobert.pystyle.transformer.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Base class of the node model produced by the external front-end parser.
 *
 * <p>Nodes are immutable and own their children exclusively, so a well-formed
 * program is a single rooted tree under a {@link ModuleNode}. The constructor is
 * package-private: the variant set is closed and every walk is an exhaustive
 * {@link SyntaxVisitor}.</p>
 *
 * <p>Constructors do not reject {@code null} children. A front-end that hands over
 * a broken tree gets a {@code MalformedInput} failure from {@link TreeValidator}
 * instead of a {@link NullPointerException} deep inside a later stage.</p>
 */
public abstract class SyntaxNode {

    private final NodeKind kind;
    private final SourceSpan span;

    SyntaxNode(NodeKind kind, SourceSpan span) {
        this.kind = kind;
        this.span = span != null ? span : SourceSpan.UNKNOWN;
    }

    public NodeKind getKind() {
        return kind;
    }

    public SourceSpan getSpan() {
        return span;
    }

    /**
     * Dispatches to the visitor method for this variant.
     */
    public abstract <R> R accept(SyntaxVisitor<R> visitor);

    /**
     * Direct children in source order. May contain {@code null} entries for a malformed tree.
     */
    public abstract List<SyntaxNode> getChildren();

    /**
     * Short label used in diagnostics and tree dumps (e.g. {@code Call print}).
     */
    public String describe() {
        return kind.name();
    }

    static <T> List<T> immutableCopy(List<T> source) {
        if (source == null || source.isEmpty()) {
            return Collections.emptyList();
        }
        return Collections.unmodifiableList(new ArrayList<>(source));
    }

    static List<SyntaxNode> children(Object... parts) {
        List<SyntaxNode> result = new ArrayList<>();
        for (Object part : parts) {
            if (part instanceof List) {
                for (Object element : (List<?>) part) {
                    result.add((SyntaxNode) element);
                }
            } else if (part instanceof SyntaxNode) {
                result.add((SyntaxNode) part);
            }
        }
        return Collections.unmodifiableList(result);
    }

    @Override
    public String toString() {
        return describe() + " @ " + span;
    }
}
