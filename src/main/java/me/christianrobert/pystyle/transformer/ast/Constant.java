package me.christianrobert.pystyle.transformer.ast;

import java.util.Collections;
import java.util.List;

/**
 * Literal value. The value object matches the literal kind:
 * {@link Long} for INTEGER, {@link Double} for FLOAT, {@link String} for TEXT,
 * {@link Boolean} for BOOLEAN and {@code null} for NONE.
 */
public class Constant extends SyntaxNode {

    public enum LiteralKind {
        INTEGER,
        FLOAT,
        TEXT,
        BOOLEAN,
        NONE
    }

    private final LiteralKind literalKind;
    private final Object value;

    public Constant(LiteralKind literalKind, Object value, SourceSpan span) {
        super(NodeKind.CONSTANT, span);
        this.literalKind = literalKind;
        this.value = value;
    }

    public static Constant ofInteger(long value, SourceSpan span) {
        return new Constant(LiteralKind.INTEGER, value, span);
    }

    public static Constant ofFloat(double value, SourceSpan span) {
        return new Constant(LiteralKind.FLOAT, value, span);
    }

    public static Constant ofText(String value, SourceSpan span) {
        return new Constant(LiteralKind.TEXT, value, span);
    }

    public static Constant ofBoolean(boolean value, SourceSpan span) {
        return new Constant(LiteralKind.BOOLEAN, value, span);
    }

    public static Constant ofNone(SourceSpan span) {
        return new Constant(LiteralKind.NONE, null, span);
    }

    public LiteralKind getLiteralKind() {
        return literalKind;
    }

    public Object getValue() {
        return value;
    }

    public boolean isText() {
        return literalKind == LiteralKind.TEXT;
    }

    @Override
    public <R> R accept(SyntaxVisitor<R> visitor) {
        return visitor.visitConstant(this);
    }

    @Override
    public List<SyntaxNode> getChildren() {
        return Collections.emptyList();
    }

    @Override
    public String describe() {
        return "Constant " + literalKind + " " + value;
    }
}
