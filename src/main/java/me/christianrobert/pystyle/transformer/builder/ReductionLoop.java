package me.christianrobert.pystyle.transformer.builder;

import me.christianrobert.pystyle.transformer.ast.SyntaxNode;
import me.christianrobert.pystyle.transformer.type.InferredType;

import java.util.ArrayList;
import java.util.List;

/**
 * Accumulation loops for the reductions {@code sum}, {@code any} and {@code all}.
 *
 * <p>The loop is hoisted before the statement and the call renders as the accumulator:</p>
 * <pre>
 * int _sum0 = 0;
 * for (int _item0 : values) {
 *     _sum0 += _item0;
 * }
 * </pre>
 */
final class ReductionLoop {

    private ReductionLoop() {
    }

    static String render(String reduction, SyntaxNode iterable, String iterableText, JavaStyleCodeBuilder b) {
        InferredType elementType = b.iterationTypeOf(iterable);
        String source = b.typeOf(iterable).isMap() ? iterableText + ".keySet()" : iterableText;
        String item = b.newTemp("_item");
        String accumulator = b.newTemp("_" + reduction);
        String unit = b.indentUnit();

        List<String> lines = new ArrayList<>();
        if ("sum".equals(reduction)) {
            boolean integral = elementType.getKind() == InferredType.Kind.INTEGER;
            lines.add((integral ? "int " : "double ") + accumulator + (integral ? " = 0;" : " = 0.0;"));
            lines.add("for (" + b.javaType(elementType) + " " + item + " : " + source + ") {");
            String addend = elementType.isNumeric() ? item : "((Number) " + item + ").doubleValue()";
            lines.add(unit + accumulator + " += " + addend + ";");
            lines.add("}");
        } else {
            boolean any = "any".equals(reduction);
            String truth = elementType.isBoolean() ? item : "Boolean.TRUE.equals(" + item + ")";
            lines.add("boolean " + accumulator + " = " + !any + ";");
            lines.add("for (" + b.javaType(elementType) + " " + item + " : " + source + ") {");
            lines.add(unit + "if (" + (any ? truth : "!" + truth) + ") {");
            lines.add(unit + unit + accumulator + " = " + any + ";");
            lines.add(unit + unit + "break;");
            lines.add(unit + "}");
            lines.add("}");
        }
        b.hoist(lines);
        return accumulator;
    }
}
