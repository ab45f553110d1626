package me.christianrobert.pystyle.transformer.builder;

import me.christianrobert.pystyle.transformer.ast.Compare;
import me.christianrobert.pystyle.transformer.ast.Constant;
import me.christianrobert.pystyle.transformer.ast.SyntaxNode;
import me.christianrobert.pystyle.transformer.mapping.ConstructKind;
import me.christianrobert.pystyle.transformer.mapping.MappingEntry;
import me.christianrobert.pystyle.transformer.mapping.OperandVariant;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Static helper for rendering comparisons.
 *
 * <h3>Row selection:</h3>
 * <ul>
 *   <li>membership ({@code in}, {@code not in}): by the container, the right operand</li>
 *   <li>comparison against {@code None}: the identity row ({@code == null})</li>
 *   <li>everything else: by the left operand ({@code name == "x"} on text is {@code .equals})</li>
 * </ul>
 *
 * <p>A chain {@code a < b < c} renders as {@code ((a < b) && (b < c))}; the middle operand is
 * rendered once and its text repeated.</p>
 */
public class VisitCompare {

    public static String v(Compare node, JavaStyleCodeBuilder b) {
        List<String> parts = new ArrayList<>();
        SyntaxNode leftNode = node.getLeft();
        String left = b.visit(leftNode);

        for (int i = 0; i < node.getOperators().size(); i++) {
            Compare.Operator operator = node.getOperators().get(i);
            SyntaxNode rightNode = node.getComparators().get(i);
            String right = b.visit(rightNode);

            MappingEntry entry = b.mappingTable().lookup(ConstructKind.COMPARISON_OPERATOR, operator.name(), 2,
                    variantOf(operator, leftNode, rightNode, b));
            if (entry == null) {
                b.reportUnmapped(node, "Comparison '" + operator.getSymbol() + "' has no mapping");
                parts.add("(" + left + " " + operator.getSymbol() + " " + right + ") /* unmapped */");
            } else {
                parts.add(b.use(entry).render(Arrays.asList(left, right)));
            }

            leftNode = rightNode;
            left = right;
        }

        if (parts.size() == 1) {
            return parts.get(0);
        }
        return "(" + String.join(" && ", parts) + ")";
    }

    private static OperandVariant variantOf(Compare.Operator operator, SyntaxNode left, SyntaxNode right,
                                            JavaStyleCodeBuilder b) {
        if (operator == Compare.Operator.IN || operator == Compare.Operator.NOT_IN) {
            return OperandVariant.of(b.typeOf(right));
        }
        if (isNone(left) || isNone(right)) {
            return OperandVariant.ANY;
        }
        return OperandVariant.of(b.typeOf(left));
    }

    private static boolean isNone(SyntaxNode node) {
        return node instanceof Constant && ((Constant) node).getLiteralKind() == Constant.LiteralKind.NONE;
    }
}
