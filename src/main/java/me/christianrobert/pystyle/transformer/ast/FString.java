package me.christianrobert.pystyle.transformer.ast;

import java.util.List;

/**
 * Interpolated string. Text {@link Constant} parts are literal segments,
 * every other part is an interpolated sub-expression, in source order.
 */
public class FString extends SyntaxNode {

    private final List<SyntaxNode> parts;

    public FString(List<SyntaxNode> parts, SourceSpan span) {
        super(NodeKind.FSTRING, span);
        this.parts = immutableCopy(parts);
    }

    public List<SyntaxNode> getParts() {
        return parts;
    }

    /**
     * True when the part is a literal text segment rather than an interpolation.
     */
    public static boolean isLiteralSegment(SyntaxNode part) {
        return part instanceof Constant && ((Constant) part).isText();
    }

    @Override
    public <R> R accept(SyntaxVisitor<R> visitor) {
        return visitor.visitFString(this);
    }

    @Override
    public List<SyntaxNode> getChildren() {
        return children(parts);
    }
}
