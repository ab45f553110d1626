package me.christianrobert.pystyle.transformer.builder;

import me.christianrobert.pystyle.transformer.ast.IfStatement;

import java.util.List;

/**
 * Static helper for rendering if/elif/else chains.
 *
 * <h3>Origin structure:</h3>
 * <pre>
 * if a:
 *     ...
 * elif b:
 *     ...
 * else:
 *     ...
 * </pre>
 *
 * <h3>Target dialect:</h3>
 * <pre>
 * if (a) {
 *     ...
 * } else if (b) {
 *     ...
 * } else {
 *     ...
 * }
 * </pre>
 *
 * <p>An {@code elif} arrives as an else branch holding exactly one if statement.
 * Temporaries hoisted by the first condition land before the {@code if}. An {@code elif}
 * whose condition hoists lines becomes an {@code else} block holding those lines and a nested
 * {@code if}, so they only run when the earlier conditions failed.</p>
 */
public class VisitIf {

    public static String v(IfStatement node, JavaStyleCodeBuilder b) {
        return chain(node, JavaStyleCodeBuilder.unwrap(b.visit(node.getTest())), b);
    }

    private static String chain(IfStatement node, String condition, JavaStyleCodeBuilder b) {
        StringBuilder result = new StringBuilder();
        String indent = b.indent();

        // STEP 1: if (condition) {
        result.append(indent).append("if (").append(condition).append(") {\n");
        result.append(b.renderBlock(node.getBody()));

        // STEP 2: else if branches
        IfStatement current = node;
        while (current.hasElifBranch()) {
            IfStatement elif = (IfStatement) current.getOrElse().get(0);
            b.pushPrelude();
            String elifCondition = JavaStyleCodeBuilder.unwrap(b.visit(elif.getTest()));
            List<String> conditionLines = b.popPrelude();

            if (!conditionLines.isEmpty()) {
                // STEP 2a: the rest of the chain nests under else, after its hoisted lines
                result.append(indent).append("} else {\n");
                result.append(b.deeper(() -> b.indentLines(conditionLines) + chain(elif, elifCondition, b)));
                result.append(indent).append("}\n");
                return result.toString();
            }
            result.append(indent).append("} else if (").append(elifCondition).append(") {\n");
            result.append(b.renderBlock(elif.getBody()));
            current = elif;
        }

        // STEP 3: else branch (optional)
        if (!current.getOrElse().isEmpty()) {
            result.append(indent).append("} else {\n");
            result.append(b.renderBlock(current.getOrElse()));
        }

        result.append(indent).append("}\n");
        return result.toString();
    }
}
