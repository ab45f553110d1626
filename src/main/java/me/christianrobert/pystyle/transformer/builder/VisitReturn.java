package me.christianrobert.pystyle.transformer.builder;

import me.christianrobert.pystyle.transformer.ast.ReturnStatement;

public class VisitReturn {

    public static String v(ReturnStatement node, JavaStyleCodeBuilder b) {
        if (!node.hasValue()) {
            return b.indent() + "return;\n";
        }
        return b.indent() + "return " + b.visit(node.getValue()) + ";\n";
    }
}
