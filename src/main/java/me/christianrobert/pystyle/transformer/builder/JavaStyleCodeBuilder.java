package me.christianrobert.pystyle.transformer.builder;

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
import me.christianrobert.pystyle.transformer.context.DiagnosticCode;
import me.christianrobert.pystyle.transformer.context.DiagnosticsCollector;
import me.christianrobert.pystyle.transformer.context.RenderState;
import me.christianrobert.pystyle.transformer.mapping.MappingEntry;
import me.christianrobert.pystyle.transformer.mapping.MappingTable;
import me.christianrobert.pystyle.transformer.plugin.ExtensionPoint;
import me.christianrobert.pystyle.transformer.plugin.HookContext;
import me.christianrobert.pystyle.transformer.plugin.PluginChain;
import me.christianrobert.pystyle.transformer.type.Binding;
import me.christianrobert.pystyle.transformer.type.InferredType;
import me.christianrobert.pystyle.transformer.type.Scope;
import me.christianrobert.pystyle.transformer.type.TypeEnvironment;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Supplier;

/**
 * Renders an inferred module as target-dialect text.
 *
 * <p>Every node goes through {@link #visit(SyntaxNode)}, which wraps the node's own rendering
 * in the {@code beforeRender} and {@code afterRender} hooks. The per-node work lives in the
 * static {@code VisitXxx.v(node, builder)} helpers; this class holds the render state they share:</p>
 * <ul>
 *   <li>the frame stack ({@link RenderFrame}) with the scope and declared names of each open block</li>
 *   <li>the current indentation depth</li>
 *   <li>the prelude and postlude of the statement being rendered (hoisted temporaries and
 *       collection population lines)</li>
 *   <li>the imports required by the mapping entries used so far</li>
 * </ul>
 *
 * <p>A builder renders one module and is then discarded.</p>
 */
public class JavaStyleCodeBuilder implements SyntaxVisitor<String> {

    private final TypeEnvironment environment;
    private final MappingTable mappingTable;
    private final PluginChain pluginChain;
    private final ConversionConfig config;
    private final DiagnosticsCollector diagnostics;

    // Frame stack: module, class, function and block bodies push, pop when done
    private final Deque<RenderFrame> frameStack = new ArrayDeque<>();

    // Lines emitted before / after the statement currently being rendered.
    // Stacks because statements nest (a function body inside a module statement)
    // and comprehension loops capture the prelude of their element expression.
    private final Deque<List<String>> preludeStack = new ArrayDeque<>();
    private final Deque<List<String>> postludeStack = new ArrayDeque<>();

    private final Set<String> imports = new TreeSet<>();
    private final Map<String, Integer> tempCounters = new HashMap<>();
    private int depth;

    // Collection literal that may populate an assignment target directly
    private SyntaxNode populationNode;
    private String populationTarget;

    public JavaStyleCodeBuilder(TypeEnvironment environment, MappingTable mappingTable, PluginChain pluginChain,
                                ConversionConfig config, DiagnosticsCollector diagnostics) {
        this.environment = environment;
        this.mappingTable = mappingTable;
        this.pluginChain = pluginChain != null ? pluginChain : PluginChain.EMPTY;
        this.config = config;
        this.diagnostics = diagnostics;
    }

    /**
     * Renders the whole module: package line, imports, body.
     */
    public String build(ModuleNode module) {
        return visit(module);
    }

    /**
     * Renders one node through the render hooks.
     * Statements come back indented and newline-terminated, expressions inline.
     */
    public String visit(SyntaxNode node) {
        if (node == null) {
            return "";
        }
        SyntaxNode target = node;
        if (pluginChain.hasHooks(ExtensionPoint.BEFORE_RENDER)) {
            target = pluginChain.beforeRender(node, hookContext(ExtensionPoint.BEFORE_RENDER), diagnostics);
        }

        String fragment = target.getKind().isStatement() ? renderStatement(target) : target.accept(this);

        if (pluginChain.hasHooks(ExtensionPoint.AFTER_RENDER)) {
            fragment = pluginChain.afterRender(target, fragment, hookContext(ExtensionPoint.AFTER_RENDER), diagnostics);
        }
        return fragment;
    }

    private String renderStatement(SyntaxNode statement) {
        pushPrelude();
        postludeStack.push(new ArrayList<>());
        String text = statement.accept(this);
        List<String> postlude = postludeStack.pop();
        List<String> prelude = popPrelude();
        return indentLines(prelude) + text + indentLines(postlude);
    }

    private HookContext hookContext(ExtensionPoint point) {
        RenderFrame frame = frameStack.peek();
        String scopeId = frame != null ? frame.getScope().getId() : ScopeNames.MODULE;
        RenderState state = frame != null ? frame.getState() : RenderState.MODULE_LEVEL;
        return new HookContext(config, point, scopeId, state);
    }

    // ========== Statements and blocks ==========

    /**
     * Renders statements at the current depth. At module and class level, definitions
     * are separated from their neighbours by a blank line.
     */
    String renderStatements(List<SyntaxNode> statements) {
        StringBuilder result = new StringBuilder();
        RenderState state = frame().getState();
        boolean separateDefinitions = state == RenderState.MODULE_LEVEL || state == RenderState.CLASS_BODY;
        SyntaxNode previous = null;
        for (SyntaxNode statement : statements) {
            if (separateDefinitions && previous != null && (isDefinition(previous) || isDefinition(statement))) {
                result.append("\n");
            }
            result.append(visit(statement));
            previous = statement;
        }
        return result.toString();
    }

    /**
     * Renders statements one level deeper than the current depth, in the current frame.
     */
    String renderBody(List<SyntaxNode> statements) {
        depth++;
        try {
            return renderStatements(statements);
        } finally {
            depth--;
        }
    }

    /**
     * Renders a nested block (if/for/while body) in its own block frame.
     *
     * @param blockNames names declared by the block header (a for-loop target)
     */
    String renderBlock(List<SyntaxNode> statements, String... blockNames) {
        RenderFrame block = frame().block();
        for (String name : blockNames) {
            block.declare(name);
        }
        enterFrame(block);
        try {
            return renderBody(statements);
        } finally {
            exitFrame();
        }
    }

    private static boolean isDefinition(SyntaxNode node) {
        return node.getKind() == NodeKind.CLASS_DEF || node.getKind() == NodeKind.FUNCTION_DEF;
    }

    // ========== Frames ==========

    void enterFrame(RenderFrame frame) {
        frameStack.push(frame);
    }

    void exitFrame() {
        frameStack.pop();
    }

    RenderFrame frame() {
        RenderFrame frame = frameStack.peek();
        if (frame == null) {
            throw new IllegalStateException("No render frame is open");
        }
        return frame;
    }

    boolean hasFrame() {
        return !frameStack.isEmpty();
    }

    /**
     * Inference scope opened by a definition. A definition substituted by a {@code beforeRender}
     * hook was never seen by inference and gets an empty scope under the current one.
     */
    Scope scopeFor(SyntaxNode definition, Scope.ScopeKind kind, String name, String receiverName) {
        Scope scope = environment.scopeOf(definition);
        if (scope != null) {
            return scope;
        }
        if (!hasFrame()) {
            return new Scope(ScopeNames.MODULE, Scope.ScopeKind.MODULE, null);
        }
        Scope parent = frame().getScope();
        return new Scope(ScopeNames.child(parent.getId(), name), kind, parent, receiverName);
    }

    // ========== Indentation ==========

    String indent() {
        return spaces(config.getIndentSize() * depth);
    }

    /**
     * One indentation step, for lines nested inside hoisted code.
     */
    String indentUnit() {
        return spaces(config.getIndentSize());
    }

    /**
     * Runs {@code renderer} one indentation level deeper without opening a frame.
     */
    String deeper(Supplier<String> renderer) {
        depth++;
        try {
            return renderer.get();
        } finally {
            depth--;
        }
    }

    /**
     * Hoisted lines at the current depth, one per line.
     */
    String indentLines(List<String> lines) {
        if (lines.isEmpty()) {
            return "";
        }
        String prefix = indent();
        StringBuilder result = new StringBuilder();
        for (String line : lines) {
            result.append(prefix).append(line).append("\n");
        }
        return result.toString();
    }

    private static String spaces(int count) {
        StringBuilder result = new StringBuilder(count);
        for (int i = 0; i < count; i++) {
            result.append(' ');
        }
        return result.toString();
    }

    // ========== Hoisting ==========

    /**
     * Emits lines before the current statement (relative indentation, no trailing newline).
     */
    void hoist(List<String> lines) {
        List<String> prelude = preludeStack.peek();
        if (prelude == null) {
            throw new IllegalStateException("Cannot hoist outside of a statement: " + lines);
        }
        prelude.addAll(lines);
    }

    /**
     * Emits lines right after the current statement.
     */
    void appendAfterStatement(List<String> lines) {
        List<String> postlude = postludeStack.peek();
        if (postlude == null) {
            throw new IllegalStateException("Cannot append outside of a statement: " + lines);
        }
        postlude.addAll(lines);
    }

    void pushPrelude() {
        preludeStack.push(new ArrayList<>());
    }

    List<String> popPrelude() {
        return preludeStack.pop();
    }

    /**
     * Fresh temporary name, e.g. {@code _list0}, {@code _list1}, {@code _sum0}.
     */
    String newTemp(String prefix) {
        Integer next = tempCounters.get(prefix);
        int index = next != null ? next : 0;
        tempCounters.put(prefix, index + 1);
        return prefix + index;
    }

    /**
     * Lets the collection literal {@code value} populate {@code targetText} directly
     * instead of through a hoisted temporary.
     */
    void offerPopulationTarget(SyntaxNode value, String targetText) {
        populationNode = value;
        populationTarget = targetText;
    }

    /**
     * Takes the population target offered for exactly this node, or returns {@code null}.
     */
    String takePopulationTarget(SyntaxNode node) {
        if (node != populationNode) {
            return null;
        }
        String target = populationTarget;
        clearPopulationTarget();
        return target;
    }

    void clearPopulationTarget() {
        populationNode = null;
        populationTarget = null;
    }

    // ========== Types, mapping, imports, diagnostics ==========

    TypeEnvironment environment() {
        return environment;
    }

    MappingTable mappingTable() {
        return mappingTable;
    }

    ConversionConfig config() {
        return config;
    }

    boolean addAccessModifiers() {
        return config.isAddAccessModifiers();
    }

    /**
     * Inferred type of an expression in the current frame's scope.
     */
    InferredType typeOf(SyntaxNode expression) {
        return environment.typeOf(expression, frame().getScope());
    }

    /**
     * Element type produced by iterating {@code iterable} in the current scope.
     */
    InferredType iterationTypeOf(SyntaxNode iterable) {
        return environment.getResolver().resolveIterationType(iterable, frame().getScope());
    }

    /**
     * Binding of a name declared in the current frame's own scope, or {@code null}.
     */
    Binding localBinding(String name) {
        return frame().getScope().resolveLocal(name);
    }

    /**
     * Target-dialect spelling of a type; registers the collection imports it needs.
     */
    String javaType(InferredType type) {
        String javaType = type.toJavaType();
        registerTypeImports(javaType);
        return javaType;
    }

    void registerTypeImports(String javaType) {
        if (javaType.contains("List<")) {
            imports.add("java.util.List");
        }
        if (javaType.contains("Map<")) {
            imports.add("java.util.Map");
        }
        if (javaType.contains("Set<")) {
            imports.add("java.util.Set");
        }
    }

    /**
     * Records a mapping entry as used, so that its imports are emitted.
     */
    MappingEntry use(MappingEntry entry) {
        imports.addAll(entry.getRequiredImports());
        return entry;
    }

    void addImport(String qualifiedName) {
        imports.add(qualifiedName);
    }

    Set<String> getImports() {
        return Collections.unmodifiableSet(imports);
    }

    void reportUnmapped(SyntaxNode node, String message) {
        diagnostics.report(DiagnosticCode.UNMAPPED_CONSTRUCT, message, node.getSpan());
    }

    /**
     * Removes one pair of parentheses enclosing the whole expression, for use in
     * {@code if (...)} and {@code while (...)} headers.
     */
    static String unwrap(String expression) {
        if (expression.length() < 2 || expression.charAt(0) != '(' || expression.charAt(expression.length() - 1) != ')') {
            return expression;
        }
        int level = 0;
        boolean inText = false;
        for (int i = 0; i < expression.length(); i++) {
            char c = expression.charAt(i);
            if (inText) {
                if (c == '\\') {
                    i++;
                } else if (c == '"') {
                    inText = false;
                }
                continue;
            }
            if (c == '"') {
                inText = true;
            } else if (c == '(') {
                level++;
            } else if (c == ')') {
                level--;
                if (level == 0 && i < expression.length() - 1) {
                    // the first parenthesis closes before the end: (a) + (b)
                    return expression;
                }
            }
        }
        return expression.substring(1, expression.length() - 1);
    }

    // ========== Visitor: delegates to static helpers ==========

    @Override
    public String visitModule(ModuleNode node) {
        return VisitModule.v(node, this);
    }

    @Override
    public String visitClassDef(ClassDef node) {
        return VisitClassDef.v(node, this);
    }

    @Override
    public String visitFunctionDef(FunctionDef node) {
        return VisitFunctionDef.v(node, this);
    }

    @Override
    public String visitParameter(Parameter node) {
        return VisitParameter.v(node, this);
    }

    @Override
    public String visitDecorator(Decorator node) {
        return VisitDecorator.v(node, this);
    }

    @Override
    public String visitAssign(Assign node) {
        return VisitAssign.v(node, this);
    }

    @Override
    public String visitAugAssign(AugAssign node) {
        return VisitAugAssign.v(node, this);
    }

    @Override
    public String visitIf(IfStatement node) {
        return VisitIf.v(node, this);
    }

    @Override
    public String visitFor(ForStatement node) {
        return VisitFor.v(node, this);
    }

    @Override
    public String visitWhile(WhileStatement node) {
        return VisitWhile.v(node, this);
    }

    @Override
    public String visitReturn(ReturnStatement node) {
        return VisitReturn.v(node, this);
    }

    @Override
    public String visitExprStmt(ExprStmt node) {
        return VisitExprStmt.v(node, this);
    }

    @Override
    public String visitCall(Call node) {
        return VisitCall.v(node, this);
    }

    @Override
    public String visitBinaryOp(BinaryOp node) {
        return VisitBinaryOp.v(node, this);
    }

    @Override
    public String visitUnaryOp(UnaryOp node) {
        return VisitUnaryOp.v(node, this);
    }

    @Override
    public String visitCompare(Compare node) {
        return VisitCompare.v(node, this);
    }

    @Override
    public String visitConstant(Constant node) {
        return VisitConstant.v(node, this);
    }

    @Override
    public String visitIdentifier(Identifier node) {
        return VisitIdentifier.v(node, this);
    }

    @Override
    public String visitAttribute(Attribute node) {
        return visit(node.getValue()) + "." + node.getAttributeName();
    }

    @Override
    public String visitListLiteral(ListLiteral node) {
        return VisitCollectionLiteral.list(node, this);
    }

    @Override
    public String visitDictLiteral(DictLiteral node) {
        return VisitCollectionLiteral.dict(node, this);
    }

    @Override
    public String visitComprehension(Comprehension node) {
        return VisitComprehension.v(node, this);
    }

    @Override
    public String visitFString(FString node) {
        return VisitFString.v(node, this);
    }
}
