package me.christianrobert.pystyle.transformer.ast;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Top-down tree rewrite: the replacer sees every node before its children, and the
 * children of whatever it returns are rewritten next.
 *
 * <p>Nodes are immutable, so a parent is rebuilt only when one of its children changed.
 * An unchanged subtree is returned as the identical instance.</p>
 *
 * <p>The replacer must return a node of the same {@link NodeKind.Category} as the one it
 * received (or the node itself). Callers that accept arbitrary replacements enforce that
 * before returning.</p>
 */
public class NodeRewriter implements SyntaxVisitor<SyntaxNode> {

    /**
     * Replacement function applied to every node.
     */
    public interface Replacer {

        /**
         * @param node Node about to be rewritten
         * @param scopeId Qualified name of the enclosing scope (see {@link ScopeNames})
         * @return the node itself, or a replacement of the same category
         */
        SyntaxNode replace(SyntaxNode node, String scopeId);
    }

    private final Replacer replacer;
    private final Deque<String> scopes = new ArrayDeque<>();

    private NodeRewriter(Replacer replacer) {
        this.replacer = replacer;
        this.scopes.push(ScopeNames.MODULE);
    }

    public static ModuleNode rewrite(ModuleNode module, Replacer replacer) {
        NodeRewriter rewriter = new NodeRewriter(replacer);
        return (ModuleNode) rewriter.rewrite(module);
    }

    private SyntaxNode rewrite(SyntaxNode node) {
        if (node == null) {
            return null;
        }
        SyntaxNode replaced = replacer.replace(node, scopes.peek());
        if (replaced == null) {
            replaced = node;
        }
        return replaced.accept(this);
    }

    @SuppressWarnings("unchecked")
    private <T extends SyntaxNode> List<T> rewriteAll(List<T> nodes) {
        List<T> result = null;
        for (int i = 0; i < nodes.size(); i++) {
            T original = nodes.get(i);
            T rewritten = (T) rewrite(original);
            if (rewritten != original && result == null) {
                result = new ArrayList<>(nodes.subList(0, i));
            }
            if (result != null) {
                result.add(rewritten);
            }
        }
        return result != null ? result : nodes;
    }

    private static boolean same(Object a, Object b) {
        return a == b;
    }

    // ========== Visitor ==========

    @Override
    public SyntaxNode visitModule(ModuleNode node) {
        List<SyntaxNode> body = rewriteAll(node.getBody());
        return same(body, node.getBody()) ? node : new ModuleNode(body, node.getSpan());
    }

    @Override
    public SyntaxNode visitClassDef(ClassDef node) {
        List<Decorator> decorators = rewriteAll(node.getDecorators());
        scopes.push(ScopeNames.child(scopes.peek(), node.getName()));
        List<SyntaxNode> body;
        try {
            body = rewriteAll(node.getBody());
        } finally {
            scopes.pop();
        }
        if (same(decorators, node.getDecorators()) && same(body, node.getBody())) {
            return node;
        }
        return new ClassDef(node.getName(), node.getBases(), decorators, body, node.getSpan());
    }

    @Override
    public SyntaxNode visitFunctionDef(FunctionDef node) {
        List<Decorator> decorators = rewriteAll(node.getDecorators());
        scopes.push(ScopeNames.child(scopes.peek(), node.getName()));
        List<Parameter> parameters;
        List<SyntaxNode> body;
        try {
            parameters = rewriteAll(node.getParameters());
            body = rewriteAll(node.getBody());
        } finally {
            scopes.pop();
        }
        if (same(decorators, node.getDecorators()) && same(parameters, node.getParameters())
                && same(body, node.getBody())) {
            return node;
        }
        return new FunctionDef(node.getName(), parameters, decorators, node.getReturnAnnotation(),
                body, node.getSpan());
    }

    @Override
    public SyntaxNode visitParameter(Parameter node) {
        SyntaxNode defaultValue = rewrite(node.getDefaultValue());
        if (same(defaultValue, node.getDefaultValue())) {
            return node;
        }
        return new Parameter(node.getName(), node.getParameterKind(), defaultValue,
                node.getAnnotation(), node.getSpan());
    }

    @Override
    public SyntaxNode visitDecorator(Decorator node) {
        SyntaxNode expression = rewrite(node.getExpression());
        return same(expression, node.getExpression()) ? node : new Decorator(expression, node.getSpan());
    }

    @Override
    public SyntaxNode visitAssign(Assign node) {
        List<SyntaxNode> targets = rewriteAll(node.getTargets());
        SyntaxNode value = rewrite(node.getValue());
        if (same(targets, node.getTargets()) && same(value, node.getValue())) {
            return node;
        }
        return new Assign(targets, value, node.getSpan());
    }

    @Override
    public SyntaxNode visitAugAssign(AugAssign node) {
        SyntaxNode target = rewrite(node.getTarget());
        SyntaxNode value = rewrite(node.getValue());
        if (same(target, node.getTarget()) && same(value, node.getValue())) {
            return node;
        }
        return new AugAssign(target, node.getOperator(), value, node.getSpan());
    }

    @Override
    public SyntaxNode visitIf(IfStatement node) {
        SyntaxNode test = rewrite(node.getTest());
        List<SyntaxNode> body = rewriteAll(node.getBody());
        List<SyntaxNode> orElse = rewriteAll(node.getOrElse());
        if (same(test, node.getTest()) && same(body, node.getBody()) && same(orElse, node.getOrElse())) {
            return node;
        }
        return new IfStatement(test, body, orElse, node.getSpan());
    }

    @Override
    public SyntaxNode visitFor(ForStatement node) {
        SyntaxNode target = rewrite(node.getTarget());
        SyntaxNode iterable = rewrite(node.getIterable());
        List<SyntaxNode> body = rewriteAll(node.getBody());
        if (same(target, node.getTarget()) && same(iterable, node.getIterable())
                && same(body, node.getBody())) {
            return node;
        }
        return new ForStatement(target, iterable, body, node.getSpan());
    }

    @Override
    public SyntaxNode visitWhile(WhileStatement node) {
        SyntaxNode test = rewrite(node.getTest());
        List<SyntaxNode> body = rewriteAll(node.getBody());
        if (same(test, node.getTest()) && same(body, node.getBody())) {
            return node;
        }
        return new WhileStatement(test, body, node.getSpan());
    }

    @Override
    public SyntaxNode visitReturn(ReturnStatement node) {
        SyntaxNode value = rewrite(node.getValue());
        return same(value, node.getValue()) ? node : new ReturnStatement(value, node.getSpan());
    }

    @Override
    public SyntaxNode visitExprStmt(ExprStmt node) {
        SyntaxNode expression = rewrite(node.getExpression());
        return same(expression, node.getExpression()) ? node : new ExprStmt(expression, node.getSpan());
    }

    @Override
    public SyntaxNode visitCall(Call node) {
        SyntaxNode function = rewrite(node.getFunction());
        List<SyntaxNode> arguments = rewriteAll(node.getArguments());
        if (same(function, node.getFunction()) && same(arguments, node.getArguments())) {
            return node;
        }
        return new Call(function, arguments, node.getSpan());
    }

    @Override
    public SyntaxNode visitBinaryOp(BinaryOp node) {
        SyntaxNode left = rewrite(node.getLeft());
        SyntaxNode right = rewrite(node.getRight());
        if (same(left, node.getLeft()) && same(right, node.getRight())) {
            return node;
        }
        return new BinaryOp(left, node.getOperator(), right, node.getSpan());
    }

    @Override
    public SyntaxNode visitUnaryOp(UnaryOp node) {
        SyntaxNode operand = rewrite(node.getOperand());
        return same(operand, node.getOperand()) ? node : new UnaryOp(node.getOperator(), operand, node.getSpan());
    }

    @Override
    public SyntaxNode visitCompare(Compare node) {
        SyntaxNode left = rewrite(node.getLeft());
        List<SyntaxNode> comparators = rewriteAll(node.getComparators());
        if (same(left, node.getLeft()) && same(comparators, node.getComparators())) {
            return node;
        }
        return new Compare(left, node.getOperators(), comparators, node.getSpan());
    }

    @Override
    public SyntaxNode visitConstant(Constant node) {
        return node;
    }

    @Override
    public SyntaxNode visitIdentifier(Identifier node) {
        return node;
    }

    @Override
    public SyntaxNode visitAttribute(Attribute node) {
        SyntaxNode value = rewrite(node.getValue());
        return same(value, node.getValue()) ? node : new Attribute(value, node.getAttributeName(), node.getSpan());
    }

    @Override
    public SyntaxNode visitListLiteral(ListLiteral node) {
        List<SyntaxNode> elements = rewriteAll(node.getElements());
        return same(elements, node.getElements()) ? node : new ListLiteral(elements, node.getSpan());
    }

    @Override
    public SyntaxNode visitDictLiteral(DictLiteral node) {
        List<SyntaxNode> keys = new ArrayList<>();
        List<SyntaxNode> values = new ArrayList<>();
        boolean changed = false;
        // key before value, source order
        for (int i = 0; i < node.getKeys().size(); i++) {
            SyntaxNode key = rewrite(node.getKeys().get(i));
            SyntaxNode value = rewrite(node.getValues().get(i));
            changed |= key != node.getKeys().get(i) || value != node.getValues().get(i);
            keys.add(key);
            values.add(value);
        }
        return changed ? new DictLiteral(keys, values, node.getSpan()) : node;
    }

    @Override
    public SyntaxNode visitComprehension(Comprehension node) {
        SyntaxNode key = rewrite(node.getKey());
        SyntaxNode element = rewrite(node.getElement());
        SyntaxNode target = rewrite(node.getTarget());
        SyntaxNode iterable = rewrite(node.getIterable());
        List<SyntaxNode> conditions = rewriteAll(node.getConditions());
        if (same(key, node.getKey()) && same(element, node.getElement()) && same(target, node.getTarget())
                && same(iterable, node.getIterable()) && same(conditions, node.getConditions())) {
            return node;
        }
        return new Comprehension(node.getComprehensionKind(), key, element, target, iterable,
                conditions, node.getSpan());
    }

    @Override
    public SyntaxNode visitFString(FString node) {
        List<SyntaxNode> parts = rewriteAll(node.getParts());
        return same(parts, node.getParts()) ? node : new FString(parts, node.getSpan());
    }
}
