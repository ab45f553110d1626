package me.christianrobert.pystyle.transformer.ast;

import java.util.List;

/**
 * Class definition: name, base class names, decorators and body statements.
 */
public class ClassDef extends SyntaxNode {

    private final String name;
    private final List<String> bases;
    private final List<Decorator> decorators;
    private final List<SyntaxNode> body;

    public ClassDef(String name, List<String> bases, List<Decorator> decorators,
                    List<SyntaxNode> body, SourceSpan span) {
        super(NodeKind.CLASS_DEF, span);
        this.name = name;
        this.bases = immutableCopy(bases);
        this.decorators = immutableCopy(decorators);
        this.body = immutableCopy(body);
    }

    public String getName() {
        return name;
    }

    public List<String> getBases() {
        return bases;
    }

    public List<Decorator> getDecorators() {
        return decorators;
    }

    public List<SyntaxNode> getBody() {
        return body;
    }

    @Override
    public <R> R accept(SyntaxVisitor<R> visitor) {
        return visitor.visitClassDef(this);
    }

    @Override
    public List<SyntaxNode> getChildren() {
        return children(decorators, body);
    }

    @Override
    public String describe() {
        return "ClassDef " + name;
    }
}
