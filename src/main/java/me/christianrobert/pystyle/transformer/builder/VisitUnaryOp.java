package me.christianrobert.pystyle.transformer.builder;

import me.christianrobert.pystyle.transformer.ast.UnaryOp;
import me.christianrobert.pystyle.transformer.mapping.ConstructKind;
import me.christianrobert.pystyle.transformer.mapping.MappingEntry;
import me.christianrobert.pystyle.transformer.mapping.OperandVariant;

import java.util.Collections;

public class VisitUnaryOp {

    public static String v(UnaryOp node, JavaStyleCodeBuilder b) {
        String operand = b.visit(node.getOperand());

        MappingEntry entry = b.mappingTable().lookup(ConstructKind.UNARY_OPERATOR, node.getOperator().name(), 1,
                OperandVariant.of(b.typeOf(node.getOperand())));
        if (entry == null) {
            b.reportUnmapped(node, "Operator '" + node.getOperator().getSymbol() + "' has no mapping");
            return "(" + node.getOperator().getSymbol() + " " + operand + ") /* unmapped */";
        }
        return b.use(entry).render(Collections.singletonList(operand));
    }
}
