package me.christianrobert.pystyle.transformer.builder;

import me.christianrobert.pystyle.transformer.ast.Constant;
import me.christianrobert.pystyle.transformer.ast.ExprStmt;

/**
 * Static helper for rendering expression statements.
 *
 * <p>A bare text literal (a docstring) becomes a line comment per line of text;
 * any other expression becomes {@code expression;}.</p>
 */
public class VisitExprStmt {

    public static String v(ExprStmt node, JavaStyleCodeBuilder b) {
        String indent = b.indent();
        if (node.getExpression() instanceof Constant && ((Constant) node.getExpression()).isText()) {
            String text = ((String) ((Constant) node.getExpression()).getValue()).trim();
            StringBuilder result = new StringBuilder();
            for (String line : text.split("\n", -1)) {
                String trimmed = line.trim();
                result.append(indent).append(trimmed.isEmpty() ? "//" : "// " + trimmed).append("\n");
            }
            return result.toString();
        }
        return indent + b.visit(node.getExpression()) + ";\n";
    }
}
