package me.christianrobert.pystyle.transformer.type;

import me.christianrobert.pystyle.config.model.ConversionConfig;
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
import me.christianrobert.pystyle.transformer.ast.NodeKind;
import me.christianrobert.pystyle.transformer.ast.Parameter;
import me.christianrobert.pystyle.transformer.ast.ReturnStatement;
import me.christianrobert.pystyle.transformer.ast.ScopeNames;
import me.christianrobert.pystyle.transformer.ast.SyntaxNode;
import me.christianrobert.pystyle.transformer.ast.SyntaxVisitor;
import me.christianrobert.pystyle.transformer.ast.UnaryOp;
import me.christianrobert.pystyle.transformer.ast.WhileStatement;
import me.christianrobert.pystyle.transformer.context.DiagnosticsCollector;
import me.christianrobert.pystyle.transformer.mapping.MappingTable;
import me.christianrobert.pystyle.transformer.plugin.ExtensionPoint;
import me.christianrobert.pystyle.transformer.plugin.HookContext;
import me.christianrobert.pystyle.transformer.plugin.PluginChain;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Heuristic type inference: one forward pass per scope, in declaration order.
 *
 * <p>This is not a type checker. Each assignment's value is typed locally by
 * {@link ExpressionTypeResolver}; a later assignment with a different type widens the binding
 * to {@link InferredType#UNKNOWN} and it never narrows again. Because the lattice only ever
 * moves up, one pass terminates and there is nothing to iterate to a fixed point.</p>
 *
 * <h3>Binding rules</h3>
 * <ul>
 *   <li>{@code x = v}: binds {@code x} in the current scope</li>
 *   <li>{@code self.x = v} in an instance method: binds {@code x} in the enclosing class scope (a field)</li>
 *   <li>{@code x += v}: keeps an existing binding, or creates an unknown one</li>
 *   <li>{@code for x in it}: binds {@code x} to the element type ({@code range} gives integers)</li>
 *   <li>parameters: annotation type, else the type of a literal default, else unknown;
 *       {@code *args} unknown, {@code **kwargs} a text-keyed map; the receiver is not a binding</li>
 * </ul>
 *
 * <p>No inter-procedural inference: argument types at a call site never refine the callee.</p>
 *
 * <p>When a scope is left, each of its bindings goes through the {@code afterInference}
 * hooks (which may override the type) and is then frozen.</p>
 */
public class TypeInferenceEngine {

    private static final Logger log = LoggerFactory.getLogger(TypeInferenceEngine.class);

    private static final String STATICMETHOD = "staticmethod";
    private static final String CLASSMETHOD = "classmethod";

    private final MappingTable mappingTable;
    private final PluginChain pluginChain;
    private final ConversionConfig config;
    private final DiagnosticsCollector diagnostics;

    public TypeInferenceEngine(MappingTable mappingTable, PluginChain pluginChain, ConversionConfig config,
                               DiagnosticsCollector diagnostics) {
        this.mappingTable = mappingTable;
        this.pluginChain = pluginChain != null ? pluginChain : PluginChain.EMPTY;
        this.config = config;
        this.diagnostics = diagnostics;
    }

    /**
     * Infers bindings for a validated module.
     */
    public TypeEnvironment infer(ModuleNode module) {
        Set<String> classNames = new HashSet<>();
        Set<String> functionNames = new HashSet<>();
        collectDefinitions(module, classNames, functionNames);

        ExpressionTypeResolver resolver = new ExpressionTypeResolver(mappingTable,
                unionOf(classNames, functionNames), config.isEnableTypeInference());

        InferenceWalker walker = new InferenceWalker(resolver);
        module.accept(walker);

        TypeEnvironment environment = new TypeEnvironment(walker.moduleScope, walker.scopesById,
                walker.scopesByDefinition, classNames, functionNames, resolver);
        log.debug("Type inference complete: {} scopes, {} bindings (inference {})",
                walker.scopesById.size(), environment.getBindingCount(),
                config.isEnableTypeInference() ? "enabled" : "disabled");
        return environment;
    }

    /**
     * Name of the receiver parameter of a function, or {@code null}.
     *
     * <p>Methods directly inside a class body take their receiver ({@code self}, or
     * {@code cls} for class methods) as the first positional parameter; static methods
     * and plain functions have none.</p>
     */
    public static String receiverNameOf(FunctionDef function, boolean directlyInClass) {
        if (!directlyInClass || function.hasDecorator(STATICMETHOD) || function.getParameters().isEmpty()) {
            return null;
        }
        Parameter first = function.getParameters().get(0);
        return first.getParameterKind() == Parameter.ParameterKind.POSITIONAL ? first.getName() : null;
    }

    public static boolean isClassMethod(FunctionDef function) {
        return function.hasDecorator(CLASSMETHOD);
    }

    public static boolean isStaticMethod(FunctionDef function) {
        return function.hasDecorator(STATICMETHOD);
    }

    private static void collectDefinitions(SyntaxNode node, Set<String> classNames, Set<String> functionNames) {
        if (node.getKind() == NodeKind.CLASS_DEF) {
            classNames.add(((ClassDef) node).getName());
        } else if (node.getKind() == NodeKind.FUNCTION_DEF) {
            functionNames.add(((FunctionDef) node).getName());
        }
        for (SyntaxNode child : node.getChildren()) {
            collectDefinitions(child, classNames, functionNames);
        }
    }

    private static Set<String> unionOf(Set<String> a, Set<String> b) {
        Set<String> union = new HashSet<>(a);
        union.addAll(b);
        return union;
    }

    /**
     * Walks statements; expression visits are no-ops because only statements bind names.
     */
    private class InferenceWalker implements SyntaxVisitor<Void> {

        private final ExpressionTypeResolver resolver;
        private final Map<String, Scope> scopesById = new LinkedHashMap<>();
        private final IdentityHashMap<SyntaxNode, Scope> scopesByDefinition = new IdentityHashMap<>();
        private final Deque<Scope> scopes = new ArrayDeque<>();
        private Scope moduleScope;

        InferenceWalker(ExpressionTypeResolver resolver) {
            this.resolver = resolver;
        }

        private Scope current() {
            return scopes.peek();
        }

        private Scope open(SyntaxNode definition, String name, Scope.ScopeKind kind, String receiverName) {
            Scope parent = current();
            String id = parent == null ? ScopeNames.MODULE : uniqueId(ScopeNames.child(parent.getId(), name));
            Scope scope = new Scope(id, kind, parent, receiverName);
            scopesById.put(id, scope);
            scopesByDefinition.put(definition, scope);
            scopes.push(scope);
            return scope;
        }

        private String uniqueId(String id) {
            if (!scopesById.containsKey(id)) {
                return id;
            }
            int suffix = 2;
            while (scopesById.containsKey(id + "#" + suffix)) {
                suffix++;
            }
            return id + "#" + suffix;
        }

        private void close(Scope scope) {
            scopes.pop();
            boolean hooks = pluginChain.hasHooks(ExtensionPoint.AFTER_INFERENCE);
            for (Binding binding : scope.getBindings()) {
                if (hooks) {
                    HookContext context = new HookContext(config, ExtensionPoint.AFTER_INFERENCE, scope.getId(), null);
                    InferredType overriding = pluginChain.afterInference(binding.getFirstAssignment(),
                            binding.getType(), context, diagnostics);
                    if (overriding != null && !overriding.equals(binding.getType())) {
                        log.debug("Binding {} overridden by plugin: {} -> {}", binding.getName(),
                                binding.getType().getDisplayName(), overriding.getDisplayName());
                        binding.override(overriding);
                    }
                }
                binding.freeze();
            }
            scope.markFinalized();
        }

        private void bind(Scope scope, String name, InferredType type, SyntaxNode assignment) {
            InferredType assigned = resolver.isEnabled() ? type : InferredType.UNKNOWN;
            Binding existing = scope.resolveLocal(name);
            if (existing == null) {
                scope.declare(new Binding(name, scope.getId(), assigned, assignment));
            } else if (existing.widen(assigned)) {
                log.debug("Binding {} in {} widened to {} by conflicting assignment of {}",
                        name, scope.getId(), InferredType.UNKNOWN.getDisplayName(), assigned.getDisplayName());
            }
        }

        private void bindTarget(SyntaxNode target, InferredType type, SyntaxNode assignment) {
            Scope scope = current();
            if (target instanceof Identifier) {
                bind(scope, ((Identifier) target).getName(), type, assignment);
            } else if (target instanceof Attribute && ((Attribute) target).isAccessOn(scope.getReceiverName())) {
                Scope classScope = scope.getEnclosingClass();
                if (classScope != null) {
                    bind(classScope, ((Attribute) target).getAttributeName(), type, assignment);
                }
            }
        }

        private void keepOrCreate(SyntaxNode target, SyntaxNode assignment) {
            Scope scope = current();
            String name = null;
            if (target instanceof Identifier) {
                name = ((Identifier) target).getName();
            } else if (target instanceof Attribute && ((Attribute) target).isAccessOn(scope.getReceiverName())) {
                scope = scope.getEnclosingClass();
                name = ((Attribute) target).getAttributeName();
            }
            if (scope != null && name != null && scope.resolveLocal(name) == null) {
                scope.declare(new Binding(name, scope.getId(), InferredType.UNKNOWN, assignment));
            }
        }

        private void walk(List<SyntaxNode> statements) {
            for (SyntaxNode statement : statements) {
                statement.accept(this);
            }
        }

        private InferredType parameterType(Parameter parameter, Scope enclosing) {
            switch (parameter.getParameterKind()) {
                case VARIADIC:
                    return InferredType.UNKNOWN;
                case KEYWORD_VARIADIC:
                    return InferredType.mapOf(InferredType.TEXT, InferredType.UNKNOWN);
                default:
                    break;
            }
            InferredType annotated = resolver.resolveAnnotation(parameter.getAnnotation());
            if (annotated != null) {
                return annotated;
            }
            SyntaxNode defaultValue = parameter.getDefaultValue();
            if (isLiteral(defaultValue)) {
                return resolver.resolve(defaultValue, enclosing);
            }
            return InferredType.UNKNOWN;
        }

        private boolean isLiteral(SyntaxNode node) {
            if (node == null) {
                return false;
            }
            switch (node.getKind()) {
                case CONSTANT:
                case FSTRING:
                case LIST_LITERAL:
                case DICT_LITERAL:
                    return true;
                default:
                    return false;
            }
        }

        // ========== Scopes ==========

        @Override
        public Void visitModule(ModuleNode node) {
            moduleScope = open(node, ScopeNames.MODULE, Scope.ScopeKind.MODULE, null);
            walk(node.getBody());
            close(moduleScope);
            return null;
        }

        @Override
        public Void visitClassDef(ClassDef node) {
            Scope scope = open(node, node.getName(), Scope.ScopeKind.CLASS, null);
            walk(node.getBody());
            close(scope);
            return null;
        }

        @Override
        public Void visitFunctionDef(FunctionDef node) {
            Scope enclosing = current();
            boolean inClass = enclosing.getScopeKind() == Scope.ScopeKind.CLASS;
            String receiver = receiverNameOf(node, inClass);
            // only instance methods bind self.x as fields
            Scope scope = open(node, node.getName(), Scope.ScopeKind.FUNCTION,
                    isClassMethod(node) ? null : receiver);

            for (int i = 0; i < node.getParameters().size(); i++) {
                Parameter parameter = node.getParameters().get(i);
                if (i == 0 && receiver != null) {
                    continue;
                }
                bind(scope, parameter.getName(), parameterType(parameter, enclosing), parameter);
            }
            walk(node.getBody());
            close(scope);
            return null;
        }

        // ========== Binding statements ==========

        @Override
        public Void visitAssign(Assign node) {
            InferredType type = resolver.resolve(node.getValue(), current());
            for (SyntaxNode target : node.getTargets()) {
                bindTarget(target, type, node);
            }
            return null;
        }

        @Override
        public Void visitAugAssign(AugAssign node) {
            keepOrCreate(node.getTarget(), node);
            return null;
        }

        @Override
        public Void visitFor(ForStatement node) {
            InferredType elementType = resolver.resolveIterationType(node.getIterable(), current());
            bindTarget(node.getTarget(), elementType, node);
            walk(node.getBody());
            return null;
        }

        @Override
        public Void visitIf(IfStatement node) {
            walk(node.getBody());
            walk(node.getOrElse());
            return null;
        }

        @Override
        public Void visitWhile(WhileStatement node) {
            walk(node.getBody());
            return null;
        }

        @Override
        public Void visitReturn(ReturnStatement node) {
            return null;
        }

        @Override
        public Void visitExprStmt(ExprStmt node) {
            return null;
        }

        // ========== Not binding anything ==========

        @Override
        public Void visitParameter(Parameter node) {
            return null;
        }

        @Override
        public Void visitDecorator(Decorator node) {
            return null;
        }

        @Override
        public Void visitCall(Call node) {
            return null;
        }

        @Override
        public Void visitBinaryOp(BinaryOp node) {
            return null;
        }

        @Override
        public Void visitUnaryOp(UnaryOp node) {
            return null;
        }

        @Override
        public Void visitCompare(Compare node) {
            return null;
        }

        @Override
        public Void visitConstant(Constant node) {
            return null;
        }

        @Override
        public Void visitIdentifier(Identifier node) {
            return null;
        }

        @Override
        public Void visitAttribute(Attribute node) {
            return null;
        }

        @Override
        public Void visitListLiteral(ListLiteral node) {
            return null;
        }

        @Override
        public Void visitDictLiteral(DictLiteral node) {
            return null;
        }

        @Override
        public Void visitComprehension(Comprehension node) {
            return null;
        }

        @Override
        public Void visitFString(FString node) {
            return null;
        }
    }
}
