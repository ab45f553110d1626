package me.christianrobert.pystyle.transformer.builder;

import me.christianrobert.pystyle.transformer.ast.BinaryOp;
import me.christianrobert.pystyle.transformer.mapping.ConstructKind;
import me.christianrobert.pystyle.transformer.mapping.MappingEntry;
import me.christianrobert.pystyle.transformer.mapping.OperandVariant;

import java.util.Arrays;

/**
 * Static helper for rendering binary operations through the operator rows of the mapping table.
 * The row is selected by the left operand's type ({@code "a" * 3} is a text repeat).
 * Operators without a row ({@code @}) keep their symbol and report an unmapped construct.
 */
public class VisitBinaryOp {

    public static String v(BinaryOp node, JavaStyleCodeBuilder b) {
        String left = b.visit(node.getLeft());
        String right = b.visit(node.getRight());

        MappingEntry entry = b.mappingTable().lookup(ConstructKind.BINARY_OPERATOR, node.getOperator().name(), 2,
                OperandVariant.of(b.typeOf(node.getLeft())));
        if (entry == null) {
            b.reportUnmapped(node, "Operator '" + node.getOperator().getSymbol() + "' has no mapping");
            return "(" + left + " " + node.getOperator().getSymbol() + " " + right + ") /* unmapped */";
        }
        return b.use(entry).render(Arrays.asList(left, right));
    }
}
