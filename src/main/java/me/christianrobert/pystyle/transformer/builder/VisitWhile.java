package me.christianrobert.pystyle.transformer.builder;

import me.christianrobert.pystyle.transformer.ast.WhileStatement;

import java.util.List;

/**
 * Static helper for rendering while loops: {@code while (condition) { ... }}.
 *
 * <p>A condition that needs hoisted lines (a reduction loop, a comprehension) is recomputed
 * on every iteration:</p>
 * <pre>
 * while (true) {
 *     boolean _any0 = false;
 *     ...
 *     if (!(_any0)) {
 *         break;
 *     }
 *     ...
 * }
 * </pre>
 */
public class VisitWhile {

    public static String v(WhileStatement node, JavaStyleCodeBuilder b) {
        String indent = b.indent();

        // STEP 1: Condition, with its own hoisted lines
        b.pushPrelude();
        String condition = JavaStyleCodeBuilder.unwrap(b.visit(node.getTest()));
        List<String> conditionLines = b.popPrelude();

        if (conditionLines.isEmpty()) {
            return indent + "while (" + condition + ") {\n"
                    + b.renderBlock(node.getBody())
                    + indent + "}\n";
        }

        // STEP 2: Condition evaluated at the top of every iteration
        String unit = b.indentUnit();
        StringBuilder result = new StringBuilder();
        result.append(indent).append("while (true) {\n");
        result.append(b.deeper(() -> b.indentLines(conditionLines)));
        result.append(indent).append(unit).append("if (!(").append(condition).append(")) {\n");
        result.append(indent).append(unit).append(unit).append("break;\n");
        result.append(indent).append(unit).append("}\n");
        result.append(b.renderBlock(node.getBody()));
        result.append(indent).append("}\n");
        return result.toString();
    }
}
