package me.christianrobert.pystyle.transformer.builder;

import me.christianrobert.pystyle.transformer.ast.Identifier;

/**
 * Static helper for rendering names. The receiver of a method renders as {@code this}
 * (as the class name in a class method); every other name is kept.
 */
public class VisitIdentifier {

    public static String v(Identifier node, JavaStyleCodeBuilder b) {
        if (b.hasFrame()) {
            RenderFrame frame = b.frame();
            if (node.getName().equals(frame.getReceiverName())) {
                return frame.getReceiverText();
            }
        }
        return node.getName();
    }
}
