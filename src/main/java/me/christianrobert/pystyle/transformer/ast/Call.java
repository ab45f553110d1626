package me.christianrobert.pystyle.transformer.ast;

import java.util.List;

/**
 * Call expression {@code function(arguments...)}. The callee is an identifier
 * (builtin, function or class name) or an attribute (method call).
 */
public class Call extends SyntaxNode {

    private final SyntaxNode function;
    private final List<SyntaxNode> arguments;

    public Call(SyntaxNode function, List<SyntaxNode> arguments, SourceSpan span) {
        super(NodeKind.CALL, span);
        this.function = function;
        this.arguments = immutableCopy(arguments);
    }

    public SyntaxNode getFunction() {
        return function;
    }

    public List<SyntaxNode> getArguments() {
        return arguments;
    }

    /**
     * Name of the callee when it is a plain identifier, else {@code null}.
     */
    public String getFunctionName() {
        if (function instanceof Identifier) {
            return ((Identifier) function).getName();
        }
        return null;
    }

    @Override
    public <R> R accept(SyntaxVisitor<R> visitor) {
        return visitor.visitCall(this);
    }

    @Override
    public List<SyntaxNode> getChildren() {
        return children(function, arguments);
    }

    @Override
    public String describe() {
        String name = getFunctionName();
        return name != null ? "Call " + name : "Call";
    }
}
