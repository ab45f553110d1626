package me.christianrobert.pystyle.transformer.builder;

import me.christianrobert.pystyle.transformer.ast.Comprehension;
import me.christianrobert.pystyle.transformer.ast.Identifier;
import me.christianrobert.pystyle.transformer.ast.SyntaxNode;
import me.christianrobert.pystyle.transformer.type.InferredType;
import me.christianrobert.pystyle.transformer.type.Scope;

import java.util.ArrayList;
import java.util.List;

/**
 * Static helper for rendering comprehensions as an explicit collection loop.
 *
 * <h3>Origin:</h3>
 * <pre>
 * squares = [x * x for x in values if x &gt; 0]
 * </pre>
 *
 * <h3>Target dialect:</h3>
 * <pre>
 * List&lt;Integer&gt; squares = new ArrayList&lt;&gt;();
 * for (int x : values) {
 *     if (x &gt; 0) {
 *         squares.add((x * x));
 *     }
 * }
 * </pre>
 *
 * <h3>Notes:</h3>
 * <ul>
 *   <li>Dict comprehensions populate a {@code HashMap} with {@code put}</li>
 *   <li>Generator expressions are rendered as the same eager list loop and reported as unmapped</li>
 *   <li>The loop target is local to the comprehension and typed from the iterable</li>
 *   <li>Temporaries hoisted by the element or the conditions stay inside the loop body</li>
 * </ul>
 */
public class VisitComprehension {

    public static String v(Comprehension node, JavaStyleCodeBuilder b) {
        String target = b.takePopulationTarget(node);
        boolean dict = node.getComprehensionKind() == Comprehension.ComprehensionKind.DICT;
        String unit = b.indentUnit();

        // STEP 1: Iterable, in the enclosing scope
        String iterable = VisitFor.iterableText(node.getIterable(), b);
        Scope local = b.environment().getResolver().comprehensionScope(node, b.frame().getScope());
        String variable = ((Identifier) node.getTarget()).getName();
        InferredType variableType = local.resolveLocal(variable).getType();

        // STEP 2: Element, key and conditions, in the comprehension scope
        RenderFrame loopFrame = b.frame().block(local);
        loopFrame.declare(variable);
        b.enterFrame(loopFrame);
        b.pushPrelude();
        List<String> conditions = new ArrayList<>();
        for (SyntaxNode condition : node.getConditions()) {
            conditions.add(JavaStyleCodeBuilder.unwrap(b.visit(condition)));
        }
        String key = dict ? b.visit(node.getKey()) : null;
        String element = b.visit(node.getElement());
        InferredType elementType = b.typeOf(node.getElement());
        List<String> inner = b.popPrelude();
        b.exitFrame();

        // STEP 3: Loop
        String collection = target != null ? target : b.newTemp("_comp");
        String add = dict
                ? collection + ".put(" + key + ", " + element + ");"
                : collection + ".add(" + element + ");";
        List<String> loop = new ArrayList<>();
        loop.add("for (" + b.javaType(variableType) + " " + variable + " : " + iterable + ") {");
        String bodyIndent = unit;
        if (!conditions.isEmpty()) {
            loop.add(unit + "if (" + String.join(" && ", conditions) + ") {");
            bodyIndent = unit + unit;
        }
        for (String line : inner) {
            loop.add(bodyIndent + line);
        }
        loop.add(bodyIndent + add);
        if (!conditions.isEmpty()) {
            loop.add(unit + "}");
        }
        loop.add("}");

        // STEP 4: Collection
        String construction;
        if (dict) {
            b.addImport("java.util.HashMap");
            construction = "new HashMap<>()";
        } else {
            b.addImport("java.util.ArrayList");
            construction = "new ArrayList<>()";
        }
        if (node.getComprehensionKind() == Comprehension.ComprehensionKind.GENERATOR) {
            b.reportUnmapped(node, "Generator expression has no lazy counterpart; rendered as an eager list");
        }
        if (target != null) {
            b.appendAfterStatement(loop);
            return construction;
        }
        InferredType collectionType = dict
                ? b.typeOf(node)
                : InferredType.listOf(elementType);
        List<String> lines = new ArrayList<>();
        lines.add(b.javaType(collectionType) + " " + collection + " = " + construction + ";");
        lines.addAll(loop);
        b.hoist(lines);
        return collection;
    }
}
