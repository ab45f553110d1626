package me.christianrobert.pystyle.transformer.ast;

import me.christianrobert.pystyle.transformer.context.MalformedInputException;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * Checks that a supplied tree is a single rooted tree the later stages can walk safely.
 *
 * <p>Rejected with {@link MalformedInputException}:</p>
 * <ul>
 *   <li>root is missing or not a {@link ModuleNode}</li>
 *   <li>a node reachable twice (shared subtree, repeated entry or cycle)</li>
 *   <li>a {@link ModuleNode} below the root</li>
 *   <li>a missing required child, name or operator</li>
 *   <li>a node in a slot of the wrong category (e.g. a statement used as an expression,
 *       a {@link Parameter} outside a parameter list)</li>
 * </ul>
 *
 * <p>Validation stops at the first violation; no partial result is produced.</p>
 */
public class TreeValidator implements SyntaxVisitor<Void> {

    private final Set<SyntaxNode> visited = Collections.newSetFromMap(new IdentityHashMap<>());

    private TreeValidator() {
    }

    /**
     * Validates the tree rooted at {@code root}.
     *
     * @param root Root node handed over by the front-end parser (or rewritten by plugins)
     * @return the root, typed as module
     * @throws MalformedInputException on the first violation found
     */
    public static ModuleNode validate(SyntaxNode root) {
        if (root == null) {
            throw new MalformedInputException("Syntax tree is missing (null root)", SourceSpan.UNKNOWN);
        }
        if (!(root instanceof ModuleNode)) {
            throw new MalformedInputException(
                    "Root node must be a Module, found " + root.getKind(), root.getSpan());
        }
        TreeValidator validator = new TreeValidator();
        validator.enter(root);
        root.accept(validator);
        return (ModuleNode) root;
    }

    // ========== Visitor ==========

    @Override
    public Void visitModule(ModuleNode node) {
        statements(node, node.getBody(), "body");
        return null;
    }

    @Override
    public Void visitClassDef(ClassDef node) {
        name(node, node.getName(), "class name");
        for (String base : node.getBases()) {
            name(node, base, "base class name");
        }
        decorators(node, node.getDecorators());
        statements(node, node.getBody(), "class body");
        return null;
    }

    @Override
    public Void visitFunctionDef(FunctionDef node) {
        name(node, node.getName(), "function name");
        decorators(node, node.getDecorators());
        for (Parameter parameter : node.getParameters()) {
            child(node, parameter, NodeKind.Category.PARAMETER, "parameter");
        }
        statements(node, node.getBody(), "function body");
        return null;
    }

    @Override
    public Void visitParameter(Parameter node) {
        name(node, node.getName(), "parameter name");
        optionalExpression(node, node.getDefaultValue(), "default value");
        return null;
    }

    @Override
    public Void visitDecorator(Decorator node) {
        expression(node, node.getExpression(), "decorator expression");
        return null;
    }

    @Override
    public Void visitAssign(Assign node) {
        if (node.getTargets().isEmpty()) {
            throw malformed(node, "assignment without target");
        }
        for (SyntaxNode target : node.getTargets()) {
            assignable(node, target);
        }
        expression(node, node.getValue(), "assigned value");
        return null;
    }

    @Override
    public Void visitAugAssign(AugAssign node) {
        if (node.getOperator() == null) {
            throw malformed(node, "missing operator");
        }
        assignable(node, node.getTarget());
        expression(node, node.getValue(), "assigned value");
        return null;
    }

    @Override
    public Void visitIf(IfStatement node) {
        expression(node, node.getTest(), "condition");
        statements(node, node.getBody(), "if body");
        statements(node, node.getOrElse(), "else body");
        return null;
    }

    @Override
    public Void visitFor(ForStatement node) {
        if (!(node.getTarget() instanceof Identifier)) {
            throw malformed(node, "loop target must be an identifier");
        }
        expression(node, node.getTarget(), "loop target");
        expression(node, node.getIterable(), "iterable");
        statements(node, node.getBody(), "loop body");
        return null;
    }

    @Override
    public Void visitWhile(WhileStatement node) {
        expression(node, node.getTest(), "condition");
        statements(node, node.getBody(), "loop body");
        return null;
    }

    @Override
    public Void visitReturn(ReturnStatement node) {
        optionalExpression(node, node.getValue(), "return value");
        return null;
    }

    @Override
    public Void visitExprStmt(ExprStmt node) {
        expression(node, node.getExpression(), "expression");
        return null;
    }

    @Override
    public Void visitCall(Call node) {
        expression(node, node.getFunction(), "callee");
        expressions(node, node.getArguments(), "argument");
        return null;
    }

    @Override
    public Void visitBinaryOp(BinaryOp node) {
        if (node.getOperator() == null) {
            throw malformed(node, "missing operator");
        }
        expression(node, node.getLeft(), "left operand");
        expression(node, node.getRight(), "right operand");
        return null;
    }

    @Override
    public Void visitUnaryOp(UnaryOp node) {
        if (node.getOperator() == null) {
            throw malformed(node, "missing operator");
        }
        expression(node, node.getOperand(), "operand");
        return null;
    }

    @Override
    public Void visitCompare(Compare node) {
        expression(node, node.getLeft(), "left operand");
        if (node.getOperators().isEmpty() || node.getOperators().size() != node.getComparators().size()) {
            throw malformed(node, "comparison needs one operator per comparator, found "
                    + node.getOperators().size() + " operators and "
                    + node.getComparators().size() + " comparators");
        }
        for (Compare.Operator operator : node.getOperators()) {
            if (operator == null) {
                throw malformed(node, "missing comparison operator");
            }
        }
        expressions(node, node.getComparators(), "comparator");
        return null;
    }

    @Override
    public Void visitConstant(Constant node) {
        Constant.LiteralKind literalKind = node.getLiteralKind();
        if (literalKind == null) {
            throw malformed(node, "literal without kind");
        }
        Object value = node.getValue();
        boolean matches;
        switch (literalKind) {
            case INTEGER:
                matches = value instanceof Long;
                break;
            case FLOAT:
                matches = value instanceof Double;
                break;
            case TEXT:
                matches = value instanceof String;
                break;
            case BOOLEAN:
                matches = value instanceof Boolean;
                break;
            case NONE:
            default:
                matches = value == null;
                break;
        }
        if (!matches) {
            throw malformed(node, literalKind + " literal carries incompatible value " + value);
        }
        return null;
    }

    @Override
    public Void visitIdentifier(Identifier node) {
        name(node, node.getName(), "identifier name");
        return null;
    }

    @Override
    public Void visitAttribute(Attribute node) {
        expression(node, node.getValue(), "receiver");
        name(node, node.getAttributeName(), "attribute name");
        return null;
    }

    @Override
    public Void visitListLiteral(ListLiteral node) {
        expressions(node, node.getElements(), "element");
        return null;
    }

    @Override
    public Void visitDictLiteral(DictLiteral node) {
        if (node.getKeys().size() != node.getValues().size()) {
            throw malformed(node, "dictionary has " + node.getKeys().size() + " keys but "
                    + node.getValues().size() + " values");
        }
        for (int i = 0; i < node.getKeys().size(); i++) {
            expression(node, node.getKeys().get(i), "key");
            expression(node, node.getValues().get(i), "value");
        }
        return null;
    }

    @Override
    public Void visitComprehension(Comprehension node) {
        if (node.getComprehensionKind() == null) {
            throw malformed(node, "comprehension without kind");
        }
        if (node.getComprehensionKind() == Comprehension.ComprehensionKind.DICT) {
            expression(node, node.getKey(), "key");
        } else if (node.getKey() != null) {
            throw malformed(node, "only dictionary comprehensions carry a key");
        }
        expression(node, node.getElement(), "element");
        if (!(node.getTarget() instanceof Identifier)) {
            throw malformed(node, "comprehension target must be an identifier");
        }
        expression(node, node.getTarget(), "target");
        expression(node, node.getIterable(), "iterable");
        expressions(node, node.getConditions(), "condition");
        return null;
    }

    @Override
    public Void visitFString(FString node) {
        expressions(node, node.getParts(), "part");
        return null;
    }

    // ========== Slot checks ==========

    private void statements(SyntaxNode parent, List<SyntaxNode> body, String slot) {
        for (SyntaxNode statement : body) {
            child(parent, statement, NodeKind.Category.STATEMENT, slot);
        }
    }

    private void expressions(SyntaxNode parent, List<SyntaxNode> nodes, String slot) {
        for (SyntaxNode node : nodes) {
            expression(parent, node, slot);
        }
    }

    private void decorators(SyntaxNode parent, List<Decorator> decorators) {
        for (Decorator decorator : decorators) {
            child(parent, decorator, NodeKind.Category.DECORATOR, "decorator");
        }
    }

    private void expression(SyntaxNode parent, SyntaxNode node, String slot) {
        child(parent, node, NodeKind.Category.EXPRESSION, slot);
    }

    private void optionalExpression(SyntaxNode parent, SyntaxNode node, String slot) {
        if (node != null) {
            child(parent, node, NodeKind.Category.EXPRESSION, slot);
        }
    }

    private void assignable(SyntaxNode parent, SyntaxNode target) {
        if (!(target instanceof Identifier) && !(target instanceof Attribute)) {
            throw malformed(parent, "assignment target must be an identifier or attribute, found "
                    + (target == null ? "nothing" : target.getKind()));
        }
        expression(parent, target, "assignment target");
    }

    private void child(SyntaxNode parent, SyntaxNode node, NodeKind.Category expected, String slot) {
        if (node == null) {
            throw malformed(parent, "missing " + slot);
        }
        if (node.getKind() == null) {
            throw malformed(node, "node without kind in " + slot + " of " + parent.describe());
        }
        if (node.getKind() == NodeKind.MODULE) {
            throw malformed(node, "nested Module in " + slot + " of " + parent.describe());
        }
        if (node.getKind().getCategory() != expected) {
            throw malformed(node, node.getKind() + " cannot appear as " + slot + " of "
                    + parent.describe() + " (expected " + expected + ")");
        }
        enter(node);
        node.accept(this);
    }

    private void enter(SyntaxNode node) {
        if (!visited.add(node)) {
            throw malformed(node, node.describe() + " is reachable more than once (shared or repeated node)");
        }
    }

    private static void name(SyntaxNode node, String value, String slot) {
        if (value == null || value.isEmpty()) {
            throw malformed(node, "missing " + slot);
        }
    }

    private static MalformedInputException malformed(SyntaxNode node, String message) {
        return new MalformedInputException(message, node.getSpan());
    }
}
