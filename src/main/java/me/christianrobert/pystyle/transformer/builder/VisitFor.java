package me.christianrobert.pystyle.transformer.builder;

import me.christianrobert.pystyle.transformer.ast.Call;
import me.christianrobert.pystyle.transformer.ast.ForStatement;
import me.christianrobert.pystyle.transformer.ast.Identifier;
import me.christianrobert.pystyle.transformer.ast.SyntaxNode;
import me.christianrobert.pystyle.transformer.type.Binding;
import me.christianrobert.pystyle.transformer.type.InferredType;

import java.util.List;

/**
 * Static helper for rendering for loops.
 *
 * <h3>Forms:</h3>
 * <pre>
 * for i in range(n):        -&gt;  for (int i = 0; i &lt; n; i++) {
 * for i in range(a, b):     -&gt;  for (int i = a; i &lt; b; i++) {
 * for w in words:           -&gt;  for (String w : words) {
 * for k in mapping:         -&gt;  for (String k : mapping.keySet()) {
 * </pre>
 *
 * <h3>Notes:</h3>
 * <ul>
 *   <li>Only the builtin {@code range} with one or two arguments becomes a counted loop;
 *       a stepped range goes through the call fallback</li>
 *   <li>The loop variable type is the binding's type, else the iterable's element type</li>
 *   <li>Iterating a map iterates its keys</li>
 * </ul>
 */
public class VisitFor {

    public static String v(ForStatement node, JavaStyleCodeBuilder b) {
        String indent = b.indent();
        String name = ((Identifier) node.getTarget()).getName();
        StringBuilder result = new StringBuilder();

        // STEP 1: Loop header
        SyntaxNode iterable = node.getIterable();
        if (isCountedRange(iterable, b)) {
            List<SyntaxNode> arguments = ((Call) iterable).getArguments();
            String start = arguments.size() == 2 ? b.visit(arguments.get(0)) : "0";
            String end = b.visit(arguments.get(arguments.size() - 1));
            result.append(indent).append("for (int ").append(name).append(" = ").append(start).append("; ")
                    .append(name).append(" < ").append(end).append("; ").append(name).append("++) {\n");
        } else {
            Binding binding = b.localBinding(name);
            InferredType type = binding != null ? binding.getType() : b.iterationTypeOf(iterable);
            result.append(indent).append("for (").append(b.javaType(type)).append(" ").append(name).append(" : ")
                    .append(iterableText(iterable, b)).append(") {\n");
        }

        // STEP 2: Body, with the loop variable declared inside the block
        result.append(b.renderBlock(node.getBody(), name));

        result.append(indent).append("}\n");
        return result.toString();
    }

    /**
     * Renders an iterable for a for-each header; maps iterate their key set.
     */
    static String iterableText(SyntaxNode iterable, JavaStyleCodeBuilder b) {
        String text = b.visit(iterable);
        return b.typeOf(iterable).isMap() ? text + ".keySet()" : text;
    }

    private static boolean isCountedRange(SyntaxNode iterable, JavaStyleCodeBuilder b) {
        if (!b.environment().getResolver().isBuiltinCall(iterable, "range")) {
            return false;
        }
        int arity = ((Call) iterable).getArguments().size();
        return arity == 1 || arity == 2;
    }
}
