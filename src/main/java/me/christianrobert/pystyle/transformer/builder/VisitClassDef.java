package me.christianrobert.pystyle.transformer.builder;

import me.christianrobert.pystyle.transformer.ast.ClassDef;
import me.christianrobert.pystyle.transformer.ast.Decorator;
import me.christianrobert.pystyle.transformer.ast.SyntaxNode;
import me.christianrobert.pystyle.transformer.type.Binding;
import me.christianrobert.pystyle.transformer.type.Scope;

import java.util.ArrayList;
import java.util.List;

/**
 * Static helper for rendering class definitions.
 *
 * <h3>Origin structure:</h3>
 * <pre>
 * class Dog(Animal, Comparable):
 *     count = 0
 *     def __init__(self, name):
 *         self.name = name
 * </pre>
 *
 * <h3>Target dialect:</h3>
 * <pre>
 * public class Dog extends Animal implements Comparable {
 *     private Object name;
 *
 *     public static int count = 0;
 *
 *     public Dog(Object name) {
 *         this.name = name;
 *     }
 * }
 * </pre>
 *
 * <h3>Notes:</h3>
 * <ul>
 *   <li>Instance fields come from {@code self.x = ...} bindings of the class scope</li>
 *   <li>Assignments directly in the class body are static fields (rendered by {@link VisitAssign})</li>
 *   <li>The first base class is extended, further bases are implemented; {@code object} is dropped</li>
 *   <li>Decorators become annotations</li>
 * </ul>
 */
public class VisitClassDef {

    private static final String ROOT_CLASS = "object";

    public static String v(ClassDef node, JavaStyleCodeBuilder b) {
        StringBuilder result = new StringBuilder();
        String indent = b.indent();

        // STEP 1: Decorators as annotations
        for (Decorator decorator : node.getDecorators()) {
            result.append(indent).append(b.visit(decorator)).append("\n");
        }

        // STEP 2: Header with base classes
        result.append(indent);
        if (b.addAccessModifiers()) {
            result.append("public ");
        }
        result.append("class ").append(node.getName());
        List<String> bases = new ArrayList<>();
        for (String base : node.getBases()) {
            if (!ROOT_CLASS.equals(base)) {
                bases.add(base);
            }
        }
        if (!bases.isEmpty()) {
            result.append(" extends ").append(bases.get(0));
        }
        if (bases.size() > 1) {
            result.append(" implements ").append(String.join(", ", bases.subList(1, bases.size())));
        }
        result.append(" {\n");

        Scope scope = b.scopeFor(node, Scope.ScopeKind.CLASS, node.getName(), null);
        b.enterFrame(RenderFrame.classBody(scope, node.getName()));

        // STEP 3: Instance fields, declared at the top of the class body
        String fieldIndent = indent + b.indentUnit();
        boolean hasFields = false;
        for (Binding binding : scope.getBindings()) {
            if (isClassBodyStatement(binding.getFirstAssignment(), node)) {
                continue;
            }
            result.append(fieldIndent);
            if (b.addAccessModifiers()) {
                result.append("private ");
            }
            result.append(b.javaType(binding.getType())).append(" ").append(binding.getName()).append(";\n");
            hasFields = true;
        }
        if (hasFields && !node.getBody().isEmpty()) {
            result.append("\n");
        }

        // STEP 4: Members
        result.append(b.renderBody(node.getBody()));
        b.exitFrame();

        // STEP 5: Close
        result.append(indent).append("}\n");
        return result.toString();
    }

    private static boolean isClassBodyStatement(SyntaxNode assignment, ClassDef node) {
        for (SyntaxNode statement : node.getBody()) {
            if (statement == assignment) {
                return true;
            }
        }
        return false;
    }
}
