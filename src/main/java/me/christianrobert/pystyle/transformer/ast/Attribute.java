package me.christianrobert.pystyle.transformer.ast;

import java.util.List;

/**
 * Member access {@code value.attributeName}.
 */
public class Attribute extends SyntaxNode {

    private final SyntaxNode value;
    private final String attributeName;

    public Attribute(SyntaxNode value, String attributeName, SourceSpan span) {
        super(NodeKind.ATTRIBUTE, span);
        this.value = value;
        this.attributeName = attributeName;
    }

    public SyntaxNode getValue() {
        return value;
    }

    public String getAttributeName() {
        return attributeName;
    }

    /**
     * True for {@code <receiverName>.attr}, e.g. {@code self.name}.
     */
    public boolean isAccessOn(String receiverName) {
        return receiverName != null
                && value instanceof Identifier
                && receiverName.equals(((Identifier) value).getName());
    }

    @Override
    public <R> R accept(SyntaxVisitor<R> visitor) {
        return visitor.visitAttribute(this);
    }

    @Override
    public List<SyntaxNode> getChildren() {
        return children(value);
    }

    @Override
    public String describe() {
        return "Attribute ." + attributeName;
    }
}
