package me.christianrobert.pystyle.transformer.builder;

import me.christianrobert.pystyle.transformer.ast.Parameter;
import me.christianrobert.pystyle.transformer.mapping.ConstructKind;
import me.christianrobert.pystyle.transformer.type.Binding;
import me.christianrobert.pystyle.transformer.type.InferredType;

/**
 * Static helper for rendering one formal parameter as {@code Type name}.
 *
 * <p>{@code *args} becomes a varargs {@code Object...}, {@code **kwargs} a
 * {@code Map<String, Object>}. Default values have no counterpart and are dropped.
 * An annotation naming a class of the module is used as the type when inference
 * has nothing better.</p>
 */
public class VisitParameter {

    public static String v(Parameter node, JavaStyleCodeBuilder b) {
        b.frame().declare(node.getName());

        switch (node.getParameterKind()) {
            case VARIADIC:
                return "Object... " + node.getName();
            case KEYWORD_VARIADIC:
                return b.javaType(InferredType.mapOf(InferredType.TEXT, InferredType.UNKNOWN)) + " " + node.getName();
            default:
                break;
        }

        Binding binding = b.localBinding(node.getName());
        InferredType type = binding != null ? binding.getType() : InferredType.UNKNOWN;
        String annotation = node.getAnnotation();
        if (type.isUnknown() && annotation != null
                && b.mappingTable().lookup(ConstructKind.TYPE_NAME, annotation) == null) {
            return annotation + " " + node.getName();
        }
        return b.javaType(type) + " " + node.getName();
    }
}
