package me.christianrobert.pystyle.transformer.ast;

import java.util.List;

/**
 * Function or method definition.
 *
 * <p>{@code returnAnnotation} is the annotated return type name ({@code int}, {@code str}, ...)
 * or {@code null} when the source carries none.</p>
 */
public class FunctionDef extends SyntaxNode {

    private final String name;
    private final List<Parameter> parameters;
    private final List<Decorator> decorators;
    private final String returnAnnotation;
    private final List<SyntaxNode> body;

    public FunctionDef(String name, List<Parameter> parameters, List<Decorator> decorators,
                       String returnAnnotation, List<SyntaxNode> body, SourceSpan span) {
        super(NodeKind.FUNCTION_DEF, span);
        this.name = name;
        this.parameters = immutableCopy(parameters);
        this.decorators = immutableCopy(decorators);
        this.returnAnnotation = returnAnnotation;
        this.body = immutableCopy(body);
    }

    public String getName() {
        return name;
    }

    public List<Parameter> getParameters() {
        return parameters;
    }

    public List<Decorator> getDecorators() {
        return decorators;
    }

    public String getReturnAnnotation() {
        return returnAnnotation;
    }

    public List<SyntaxNode> getBody() {
        return body;
    }

    /**
     * Checks for a decorator with the given plain name (e.g. {@code staticmethod}).
     */
    public boolean hasDecorator(String decoratorName) {
        for (Decorator decorator : decorators) {
            if (decorator != null && decoratorName.equals(decorator.getSimpleName())) {
                return true;
            }
        }
        return false;
    }

    @Override
    public <R> R accept(SyntaxVisitor<R> visitor) {
        return visitor.visitFunctionDef(this);
    }

    @Override
    public List<SyntaxNode> getChildren() {
        return children(decorators, parameters, body);
    }

    @Override
    public String describe() {
        return "FunctionDef " + name;
    }
}
