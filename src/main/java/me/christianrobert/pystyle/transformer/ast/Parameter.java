package me.christianrobert.pystyle.transformer.ast;

import java.util.List;

/**
 * Formal parameter of a {@link FunctionDef}.
 */
public class Parameter extends SyntaxNode {

    /**
     * How the parameter binds call arguments.
     */
    public enum ParameterKind {
        POSITIONAL,
        VARIADIC,          // *args
        KEYWORD_VARIADIC   // **kwargs
    }

    private final String name;
    private final ParameterKind parameterKind;
    private final SyntaxNode defaultValue;
    private final String annotation;

    public Parameter(String name, ParameterKind parameterKind, SyntaxNode defaultValue,
                     String annotation, SourceSpan span) {
        super(NodeKind.PARAMETER, span);
        this.name = name;
        this.parameterKind = parameterKind != null ? parameterKind : ParameterKind.POSITIONAL;
        this.defaultValue = defaultValue;
        this.annotation = annotation;
    }

    public Parameter(String name, SourceSpan span) {
        this(name, ParameterKind.POSITIONAL, null, null, span);
    }

    public String getName() {
        return name;
    }

    public ParameterKind getParameterKind() {
        return parameterKind;
    }

    /**
     * Default value expression, or {@code null}.
     */
    public SyntaxNode getDefaultValue() {
        return defaultValue;
    }

    /**
     * Annotated type name, or {@code null}.
     */
    public String getAnnotation() {
        return annotation;
    }

    @Override
    public <R> R accept(SyntaxVisitor<R> visitor) {
        return visitor.visitParameter(this);
    }

    @Override
    public List<SyntaxNode> getChildren() {
        return children(defaultValue);
    }

    @Override
    public String describe() {
        return "Parameter " + name;
    }
}
