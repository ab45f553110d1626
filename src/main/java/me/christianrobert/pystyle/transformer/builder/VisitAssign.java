package me.christianrobert.pystyle.transformer.builder;

import me.christianrobert.pystyle.transformer.ast.Assign;
import me.christianrobert.pystyle.transformer.ast.Attribute;
import me.christianrobert.pystyle.transformer.ast.Identifier;
import me.christianrobert.pystyle.transformer.ast.SyntaxNode;
import me.christianrobert.pystyle.transformer.context.RenderState;
import me.christianrobert.pystyle.transformer.type.Binding;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Static helper for rendering assignments.
 *
 * <h3>Forms:</h3>
 * <pre>
 * x = 5            -&gt;  int x = 5;          (first assignment in the block)
 * x = 6            -&gt;  x = 6;              (name already declared)
 * self.name = n    -&gt;  this.name = n;      (field, declared by the class)
 * count = 0        -&gt;  public static int count = 0;   (directly in a class body)
 * a = b = 0        -&gt;  int a = 0; int b = a;
 * xs = [1, 2]      -&gt;  List&lt;Integer&gt; xs = new ArrayList&lt;&gt;(); xs.add(1); xs.add(2);
 * xs = [len(xs)]   -&gt;  List&lt;Integer&gt; _list0 = new ArrayList&lt;&gt;(); _list0.add(xs.size()); xs = _list0;
 * </pre>
 *
 * <p>The declared type is the binding's type after inference, so a name whose assignments
 * disagree is declared as {@code Object}.</p>
 */
public class VisitAssign {

    public static String v(Assign node, JavaStyleCodeBuilder b) {
        List<SyntaxNode> targets = node.getTargets();
        SyntaxNode value = node.getValue();

        // STEP 1: Targets
        List<String> targetTexts = new ArrayList<>();
        for (SyntaxNode target : targets) {
            targetTexts.add(b.visit(target));
        }

        // STEP 2: Value; a collection literal populates the first target directly unless
        // it reads one of the targets, which must keep its old value until the new one is built
        if (!readsAnyTarget(value, targets)) {
            b.offerPopulationTarget(value, targetTexts.get(0));
        }
        String rendered = b.visit(value);
        b.clearPopulationTarget();

        // STEP 3: One statement per target, later targets copy the first
        StringBuilder result = new StringBuilder();
        String rightHandSide = rendered;
        for (int i = 0; i < targets.size(); i++) {
            result.append(b.indent())
                    .append(declarationPrefix(targets.get(i), value, b))
                    .append(targetTexts.get(i))
                    .append(" = ")
                    .append(rightHandSide)
                    .append(";\n");
            rightHandSide = targetTexts.get(i);
        }
        return result.toString();
    }

    /**
     * True when {@code node} or any node below it names one of the assignment targets,
     * e.g. {@code xs = [x * 2 for x in xs]} or {@code self.items = [len(self.items)]}.
     */
    private static boolean readsAnyTarget(SyntaxNode node, List<SyntaxNode> targets) {
        Set<String> targetPaths = new HashSet<>();
        for (SyntaxNode target : targets) {
            String path = accessPath(target);
            if (path != null) {
                targetPaths.add(path);
            }
        }
        return !targetPaths.isEmpty() && reads(node, targetPaths);
    }

    private static boolean reads(SyntaxNode node, Set<String> targetPaths) {
        if (node == null) {
            return false;
        }
        String path = accessPath(node);
        if (path != null && targetPaths.contains(path)) {
            return true;
        }
        for (SyntaxNode child : node.getChildren()) {
            if (reads(child, targetPaths)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Dotted path of a name or member access ({@code xs}, {@code self.items}), else null.
     */
    private static String accessPath(SyntaxNode node) {
        if (node instanceof Identifier) {
            return ((Identifier) node).getName();
        }
        if (node instanceof Attribute) {
            String receiver = accessPath(((Attribute) node).getValue());
            return receiver != null ? receiver + "." + ((Attribute) node).getAttributeName() : null;
        }
        return null;
    }

    /**
     * Type (and static modifiers in a class body) for the first assignment of a plain name
     * in the current block, else nothing.
     */
    private static String declarationPrefix(SyntaxNode target, SyntaxNode value, JavaStyleCodeBuilder b) {
        if (!(target instanceof Identifier)) {
            return "";
        }
        String name = ((Identifier) target).getName();
        RenderFrame frame = b.frame();
        if (!frame.declare(name)) {
            return "";
        }

        Binding binding = b.localBinding(name);
        String type = binding != null ? b.javaType(binding.getType()) : b.javaType(b.typeOf(value));
        if (frame.getState() == RenderState.CLASS_BODY) {
            return (b.addAccessModifiers() ? "public static " : "static ") + type + " ";
        }
        return type + " ";
    }
}
