package me.christianrobert.pystyle.transformer.util;

import me.christianrobert.pystyle.transformer.ast.NodeKind;
import me.christianrobert.pystyle.transformer.ast.SourceSpan;
import me.christianrobert.pystyle.transformer.ast.SyntaxNode;
import me.christianrobert.pystyle.transformer.type.InferredType;
import me.christianrobert.pystyle.transformer.type.Scope;
import me.christianrobert.pystyle.transformer.type.TypeEnvironment;

/**
 * Formats syntax trees into human-readable, indented text representation.
 *
 * <p>Useful for debugging what the front-end handed over and what inference made of it.</p>
 *
 * <p>Example output (with type information):</p>
 * <pre>
 * MODULE (line 1, col 0 to line 3, col 12)
 *   ASSIGN (line 1, col 0-6)
 *     Identifier x (line 1, col 0-1) [TYPE: Integer]
 *     Constant INTEGER 1 (line 1, col 4-5) [TYPE: Integer]
 * </pre>
 */
public class AstTreeFormatter {

    private static final String INDENT = "  ";
    private static final int MAX_TEXT_LENGTH = 50;

    private AstTreeFormatter() {
    }

    /**
     * Formats a syntax tree into human-readable text.
     */
    public static String format(SyntaxNode tree) {
        return format(tree, null);
    }

    /**
     * Formats a syntax tree with optional type information.
     *
     * <p>If an environment is provided, every expression node gets its inferred type
     * appended in the format {@code [TYPE: name]}.</p>
     *
     * @param tree Root of the tree
     * @param environment Result of type inference, may be null
     * @return Formatted string representation
     */
    public static String format(SyntaxNode tree, TypeEnvironment environment) {
        if (tree == null) {
            return "(null tree)";
        }
        StringBuilder sb = new StringBuilder();
        Scope scope = environment != null ? environment.getModuleScope() : null;
        formatNode(tree, 0, sb, environment, scope);
        return sb.toString();
    }

    private static void formatNode(SyntaxNode node, int depth, StringBuilder sb,
                                   TypeEnvironment environment, Scope scope) {
        for (int i = 0; i < depth; i++) {
            sb.append(INDENT);
        }
        if (node == null) {
            sb.append("(missing)\n");
            return;
        }

        sb.append(escapeAndTruncate(node.describe()));
        SourceSpan span = node.getSpan();
        if (span != SourceSpan.UNKNOWN) {
            sb.append(" (").append(span).append(")");
        }

        if (environment != null && scope != null && node.getKind().isExpression()) {
            InferredType type = environment.typeOf(node, scope);
            sb.append(" [TYPE: ").append(type.getDisplayName()).append("]");
        }
        sb.append("\n");

        Scope childScope = scope;
        if (environment != null
                && (node.getKind() == NodeKind.CLASS_DEF || node.getKind() == NodeKind.FUNCTION_DEF)) {
            Scope opened = environment.scopeOf(node);
            if (opened != null) {
                childScope = opened;
            }
        }
        for (SyntaxNode child : node.getChildren()) {
            formatNode(child, depth + 1, sb, environment, childScope);
        }
    }

    private static String escapeAndTruncate(String text) {
        if (text == null) {
            return "";
        }
        text = text.replace("\n", "\\n")
                .replace("\r", "\\r")
                .replace("\t", "\\t");
        if (text.length() > MAX_TEXT_LENGTH) {
            text = text.substring(0, MAX_TEXT_LENGTH) + "...";
        }
        return text;
    }
}
