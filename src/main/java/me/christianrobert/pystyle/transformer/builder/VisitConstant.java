package me.christianrobert.pystyle.transformer.builder;

import me.christianrobert.pystyle.transformer.ast.Constant;
import me.christianrobert.pystyle.transformer.mapping.ConstructKind;
import me.christianrobert.pystyle.transformer.mapping.MappingEntry;

import java.util.Collections;

/**
 * Static helper for rendering literals.
 *
 * <p>{@code True}, {@code False} and {@code None} go through the literal rows of the mapping
 * table. Whole numbers outside the int range get an {@code L} suffix.</p>
 */
public class VisitConstant {

    public static String v(Constant node, JavaStyleCodeBuilder b) {
        switch (node.getLiteralKind()) {
            case INTEGER:
                long value = ((Number) node.getValue()).longValue();
                boolean fitsInt = value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE;
                return fitsInt ? Long.toString(value) : value + "L";
            case FLOAT:
                return Double.toString(((Number) node.getValue()).doubleValue());
            case TEXT:
                return TextLiterals.quote((String) node.getValue());
            case BOOLEAN:
                return literal(Boolean.TRUE.equals(node.getValue()) ? "TRUE" : "FALSE", node, b);
            default:
                return literal("NONE", node, b);
        }
    }

    private static String literal(String name, Constant node, JavaStyleCodeBuilder b) {
        MappingEntry entry = b.mappingTable().lookup(ConstructKind.LITERAL, name);
        if (entry == null) {
            b.reportUnmapped(node, "Literal " + name + " has no mapping");
            return name.toLowerCase() + " /* unmapped */";
        }
        return b.use(entry).render(Collections.<String>emptyList());
    }
}
