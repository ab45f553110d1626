package me.christianrobert.pystyle.transformer.builder;

import me.christianrobert.pystyle.transformer.ast.Decorator;

/**
 * Static helper for rendering a decorator as an annotation: {@code @name} or {@code @name(args)}.
 * The caller places it on its own line above the definition.
 */
public class VisitDecorator {

    public static String v(Decorator node, JavaStyleCodeBuilder b) {
        return "@" + b.visit(node.getExpression());
    }
}
