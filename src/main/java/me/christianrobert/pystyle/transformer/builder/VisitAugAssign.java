package me.christianrobert.pystyle.transformer.builder;

import me.christianrobert.pystyle.transformer.ast.AugAssign;
import me.christianrobert.pystyle.transformer.ast.BinaryOp;
import me.christianrobert.pystyle.transformer.mapping.ConstructKind;
import me.christianrobert.pystyle.transformer.mapping.MappingEntry;
import me.christianrobert.pystyle.transformer.mapping.OperandVariant;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;

/**
 * Static helper for rendering augmented assignments ({@code x += 1}).
 *
 * <p>When the operator maps to plain infix the compound form is kept ({@code x += 1;}).
 * Otherwise the mapped operation is spelled out: {@code x **= 2} becomes
 * {@code x = Math.pow(x, 2);}, {@code s *= 3} on text becomes {@code s = s.repeat(3);}.</p>
 */
public class VisitAugAssign {

    private static final Set<BinaryOp.Operator> COMPOUND_OPERATORS = EnumSet.of(
            BinaryOp.Operator.ADD, BinaryOp.Operator.SUB, BinaryOp.Operator.MULT, BinaryOp.Operator.DIV,
            BinaryOp.Operator.MOD, BinaryOp.Operator.LSHIFT, BinaryOp.Operator.RSHIFT,
            BinaryOp.Operator.BIT_OR, BinaryOp.Operator.BIT_XOR, BinaryOp.Operator.BIT_AND);

    public static String v(AugAssign node, JavaStyleCodeBuilder b) {
        String target = b.visit(node.getTarget());
        String value = b.visit(node.getValue());
        BinaryOp.Operator operator = node.getOperator();

        MappingEntry entry = b.mappingTable().lookup(ConstructKind.BINARY_OPERATOR, operator.name(), 2,
                OperandVariant.of(b.typeOf(node.getTarget())));
        if (entry == null) {
            b.reportUnmapped(node, "Augmented operator '" + operator.getSymbol() + "=' has no mapping");
            return b.indent() + target + " " + operator.getSymbol() + "= " + value + "; /* unmapped */\n";
        }
        b.use(entry);

        String infix = "({0} " + operator.getSymbol() + " {1})";
        if (COMPOUND_OPERATORS.contains(operator) && infix.equals(entry.getTemplate().getPattern())) {
            return b.indent() + target + " " + operator.getSymbol() + "= " + value + ";\n";
        }
        return b.indent() + target + " = " + entry.render(Arrays.asList(target, value)) + ";\n";
    }
}
