package me.christianrobert.pystyle.transformer.type;

import me.christianrobert.pystyle.transformer.ast.Assign;
import me.christianrobert.pystyle.transformer.ast.Attribute;
import me.christianrobert.pystyle.transformer.ast.AugAssign;
import me.christianrobert.pystyle.transformer.ast.BinaryOp;
import me.christianrobert.pystyle.transformer.ast.Call;
import me.christianrobert.pystyle.transformer.ast.ClassDef;
import me.christianrobert.pystyle.transformer.ast.Compare;
import me.christianrobert.pystyle.transformer.ast.Comprehension;
import me.christianrobert.pystyle.transformer.ast.Constant;
import me.christianrobert.pystyle.transformer.ast.Decorator;
import me.christianrobert.pystyle.transformer.ast.DictLiteral;
import me.christianrobert.pystyle.transformer.ast.ExprStmt;
import me.christianrobert.pystyle.transformer.ast.FString;
import me.christianrobert.pystyle.transformer.ast.ForStatement;
import me.christianrobert.pystyle.transformer.ast.FunctionDef;
import me.christianrobert.pystyle.transformer.ast.Identifier;
import me.christianrobert.pystyle.transformer.ast.IfStatement;
import me.christianrobert.pystyle.transformer.ast.ListLiteral;
import me.christianrobert.pystyle.transformer.ast.ModuleNode;
import me.christianrobert.pystyle.transformer.ast.Parameter;
import me.christianrobert.pystyle.transformer.ast.ReturnStatement;
import me.christianrobert.pystyle.transformer.ast.SyntaxNode;
import me.christianrobert.pystyle.transformer.ast.SyntaxVisitor;
import me.christianrobert.pystyle.transformer.ast.UnaryOp;
import me.christianrobert.pystyle.transformer.ast.WhileStatement;
import me.christianrobert.pystyle.transformer.mapping.ConstructKind;
import me.christianrobert.pystyle.transformer.mapping.MappingEntry;
import me.christianrobert.pystyle.transformer.mapping.MappingTable;
import me.christianrobert.pystyle.transformer.mapping.OperandVariant;

import java.util.Collections;
import java.util.Set;

/**
 * Local, single-expression type guess, shared by inference and rendering.
 *
 * <p>Rules, in order:</p>
 * <ol>
 *   <li>literal: whole number, decimal, text (also interpolated text), boolean; {@code None} is unknown</li>
 *   <li>collection literal: list/map of the first element's type, unknown element when empty</li>
 *   <li>call to a mapped builtin or constructor: the entry's declared return type</li>
 *   <li>identifier bound in the visible scope chain, or {@code self.attr}: the binding's current type</li>
 *   <li>operators: the entry's declared type, else numeric promotion of the operands</li>
 *   <li>anything else: unknown</li>
 * </ol>
 *
 * <p>Never looks into called functions.</p>
 */
public class ExpressionTypeResolver {

    private final MappingTable mappingTable;
    private final Set<String> userDefinedNames;
    private final boolean enabled;

    public ExpressionTypeResolver(MappingTable mappingTable, Set<String> userDefinedNames, boolean enabled) {
        this.mappingTable = mappingTable;
        this.userDefinedNames = userDefinedNames != null ? userDefinedNames : Collections.<String>emptySet();
        this.enabled = enabled;
    }

    /**
     * Guesses the type of an expression evaluated in {@code scope}.
     * Always {@link InferredType#UNKNOWN} when inference is disabled.
     */
    public InferredType resolve(SyntaxNode expression, Scope scope) {
        if (!enabled || expression == null) {
            return InferredType.UNKNOWN;
        }
        return expression.accept(new ScopedVisitor(scope));
    }

    /**
     * Type of the values produced when looping over {@code iterable}; a builtin
     * {@code range} call produces integers.
     */
    public InferredType resolveIterationType(SyntaxNode iterable, Scope scope) {
        if (!enabled) {
            return InferredType.UNKNOWN;
        }
        if (isBuiltinCall(iterable, "range")) {
            return InferredType.INTEGER;
        }
        return resolve(iterable, scope).getIterationType();
    }

    /**
     * Maps an annotation name ({@code int}, {@code str}, ...) through the type-name rows of the
     * mapping table, or {@code null} when the annotation carries no known type.
     */
    public InferredType resolveAnnotation(String annotation) {
        if (annotation == null) {
            return null;
        }
        MappingEntry entry = mappingTable.lookup(ConstructKind.TYPE_NAME, annotation);
        return entry != null ? entry.getReturnType() : null;
    }

    /**
     * Scope holding the loop target of a comprehension, which is local to the comprehension.
     */
    public Scope comprehensionScope(Comprehension comprehension, Scope enclosing) {
        Scope local = new Scope(enclosing != null ? enclosing.getId() + ".<comprehension>" : "<comprehension>",
                Scope.ScopeKind.FUNCTION, enclosing);
        String targetName = ((Identifier) comprehension.getTarget()).getName();
        local.declare(new Binding(targetName, local.getId(),
                resolveIterationType(comprehension.getIterable(), enclosing), comprehension));
        return local;
    }

    public boolean isBuiltinCall(SyntaxNode node, String builtinName) {
        if (!(node instanceof Call)) {
            return false;
        }
        String name = ((Call) node).getFunctionName();
        return builtinName.equals(name) && !userDefinedNames.contains(name);
    }

    public boolean isEnabled() {
        return enabled;
    }

    private class ScopedVisitor implements SyntaxVisitor<InferredType> {

        private final Scope scope;

        ScopedVisitor(Scope scope) {
            this.scope = scope;
        }

        private InferredType typeOf(SyntaxNode node) {
            return node == null ? InferredType.UNKNOWN : node.accept(this);
        }

        @Override
        public InferredType visitConstant(Constant node) {
            switch (node.getLiteralKind()) {
                case INTEGER:
                    return InferredType.INTEGER;
                case FLOAT:
                    return InferredType.FLOAT;
                case TEXT:
                    return InferredType.TEXT;
                case BOOLEAN:
                    return InferredType.BOOLEAN;
                default:
                    return InferredType.UNKNOWN;
            }
        }

        @Override
        public InferredType visitFString(FString node) {
            return InferredType.TEXT;
        }

        @Override
        public InferredType visitListLiteral(ListLiteral node) {
            if (node.isEmpty()) {
                return InferredType.listOf(InferredType.UNKNOWN);
            }
            return InferredType.listOf(typeOf(node.getElements().get(0)));
        }

        @Override
        public InferredType visitDictLiteral(DictLiteral node) {
            if (node.isEmpty()) {
                return InferredType.mapOf(InferredType.UNKNOWN, InferredType.UNKNOWN);
            }
            return InferredType.mapOf(typeOf(node.getKeys().get(0)), typeOf(node.getValues().get(0)));
        }

        @Override
        public InferredType visitComprehension(Comprehension node) {
            ScopedVisitor inner = new ScopedVisitor(comprehensionScope(node, scope));
            switch (node.getComprehensionKind()) {
                case LIST:
                    return InferredType.listOf(inner.typeOf(node.getElement()));
                case DICT:
                    return InferredType.mapOf(inner.typeOf(node.getKey()), inner.typeOf(node.getElement()));
                default:
                    return InferredType.UNKNOWN;
            }
        }

        @Override
        public InferredType visitCall(Call node) {
            String name = node.getFunctionName();
            if (name == null || userDefinedNames.contains(name)) {
                return InferredType.UNKNOWN;
            }
            OperandVariant variant = node.getArguments().isEmpty()
                    ? OperandVariant.ANY
                    : OperandVariant.of(typeOf(node.getArguments().get(0)));
            MappingEntry entry = mappingTable.lookup(ConstructKind.BUILTIN_CALL, name,
                    node.getArguments().size(), variant);
            if (entry != null && entry.getReturnType() != null) {
                return entry.getReturnType();
            }
            return InferredType.UNKNOWN;
        }

        @Override
        public InferredType visitIdentifier(Identifier node) {
            if (scope == null) {
                return InferredType.UNKNOWN;
            }
            Binding binding = scope.lookup(node.getName());
            return binding != null ? binding.getType() : InferredType.UNKNOWN;
        }

        @Override
        public InferredType visitAttribute(Attribute node) {
            if (scope == null || !node.isAccessOn(scope.getReceiverName())) {
                return InferredType.UNKNOWN;
            }
            Scope classScope = scope.getEnclosingClass();
            Binding binding = classScope != null ? classScope.resolveLocal(node.getAttributeName()) : null;
            return binding != null ? binding.getType() : InferredType.UNKNOWN;
        }

        @Override
        public InferredType visitBinaryOp(BinaryOp node) {
            InferredType left = typeOf(node.getLeft());
            InferredType right = typeOf(node.getRight());
            MappingEntry entry = mappingTable.lookup(ConstructKind.BINARY_OPERATOR, node.getOperator().name(), 2,
                    OperandVariant.of(left));
            if (entry == null) {
                return InferredType.UNKNOWN;
            }
            if (entry.getReturnType() != null) {
                return entry.getReturnType();
            }
            return promote(left, right);
        }

        @Override
        public InferredType visitUnaryOp(UnaryOp node) {
            InferredType operand = typeOf(node.getOperand());
            MappingEntry entry = mappingTable.lookup(ConstructKind.UNARY_OPERATOR, node.getOperator().name(), 1,
                    OperandVariant.of(operand));
            if (entry == null) {
                return InferredType.UNKNOWN;
            }
            if (entry.getReturnType() != null) {
                return entry.getReturnType();
            }
            return operand.isNumeric() ? operand : InferredType.UNKNOWN;
        }

        @Override
        public InferredType visitCompare(Compare node) {
            return InferredType.BOOLEAN;
        }

        // Not expressions

        @Override
        public InferredType visitModule(ModuleNode node) {
            return InferredType.UNKNOWN;
        }

        @Override
        public InferredType visitClassDef(ClassDef node) {
            return InferredType.UNKNOWN;
        }

        @Override
        public InferredType visitFunctionDef(FunctionDef node) {
            return InferredType.UNKNOWN;
        }

        @Override
        public InferredType visitParameter(Parameter node) {
            return InferredType.UNKNOWN;
        }

        @Override
        public InferredType visitDecorator(Decorator node) {
            return InferredType.UNKNOWN;
        }

        @Override
        public InferredType visitAssign(Assign node) {
            return InferredType.UNKNOWN;
        }

        @Override
        public InferredType visitAugAssign(AugAssign node) {
            return InferredType.UNKNOWN;
        }

        @Override
        public InferredType visitIf(IfStatement node) {
            return InferredType.UNKNOWN;
        }

        @Override
        public InferredType visitFor(ForStatement node) {
            return InferredType.UNKNOWN;
        }

        @Override
        public InferredType visitWhile(WhileStatement node) {
            return InferredType.UNKNOWN;
        }

        @Override
        public InferredType visitReturn(ReturnStatement node) {
            return InferredType.UNKNOWN;
        }

        @Override
        public InferredType visitExprStmt(ExprStmt node) {
            return InferredType.UNKNOWN;
        }
    }

    private static InferredType promote(InferredType left, InferredType right) {
        if (!left.isNumeric() || !right.isNumeric()) {
            return InferredType.UNKNOWN;
        }
        if (left.getKind() == InferredType.Kind.FLOAT || right.getKind() == InferredType.Kind.FLOAT) {
            return InferredType.FLOAT;
        }
        return InferredType.INTEGER;
    }
}
