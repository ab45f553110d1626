package me.christianrobert.pystyle.transformer.type;

import me.christianrobert.pystyle.config.model.ConversionConfig;
import me.christianrobert.pystyle.transformer.ast.BinaryOp;
import me.christianrobert.pystyle.transformer.ast.ClassDef;
import me.christianrobert.pystyle.transformer.ast.FunctionDef;
import me.christianrobert.pystyle.transformer.ast.ModuleNode;
import me.christianrobert.pystyle.transformer.ast.Parameter;
import me.christianrobert.pystyle.transformer.context.DiagnosticCode;
import me.christianrobert.pystyle.transformer.context.DiagnosticsCollector;
import me.christianrobert.pystyle.transformer.mapping.BuiltinMappings;
import me.christianrobert.pystyle.transformer.plugin.PluginChain;
import me.christianrobert.pystyle.transformer.plugin.PluginRegistry;
import me.christianrobert.pystyle.transformer.plugin.TestPlugin;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Collections;

import static me.christianrobert.pystyle.transformer.Nodes.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for heuristic binding inference.
 */
class TypeInferenceEngineTest {

    private DiagnosticsCollector diagnostics;

    @BeforeEach
    void setUp() {
        diagnostics = new DiagnosticsCollector();
    }

    private TypeEnvironment infer(ModuleNode module) {
        return infer(module, ConversionConfig.defaults(), PluginChain.EMPTY);
    }

    private TypeEnvironment infer(ModuleNode module, ConversionConfig config, PluginChain chain) {
        return new TypeInferenceEngine(BuiltinMappings.defaultTable(), chain, config, diagnostics).infer(module);
    }

    private static InferredType moduleType(TypeEnvironment environment, String name) {
        Binding binding = environment.getModuleScope().resolveLocal(name);
        assertNotNull(binding, "no binding for " + name);
        return binding.getType();
    }

    // ========== LITERALS AND COLLECTIONS ==========

    @Test
    void literalsMapDirectly() {
        TypeEnvironment environment = infer(module(
                assign("i", integer(1)),
                assign("f", decimal(1.5)),
                assign("s", text("a")),
                assign("b", bool(true)),
                assign("n", none()),
                assign("t", fstring(text("x = "), name("i")))));

        assertEquals(InferredType.INTEGER, moduleType(environment, "i"));
        assertEquals(InferredType.FLOAT, moduleType(environment, "f"));
        assertEquals(InferredType.TEXT, moduleType(environment, "s"));
        assertEquals(InferredType.BOOLEAN, moduleType(environment, "b"));
        assertEquals(InferredType.UNKNOWN, moduleType(environment, "n"));
        assertEquals(InferredType.TEXT, moduleType(environment, "t"));
    }

    @Test
    void collectionsTakeTheirFirstElementType() {
        TypeEnvironment environment = infer(module(
                assign("xs", list(integer(1), text("mixed"))),
                assign("m", dict(text("a"), decimal(1.0))),
                assign("empty", list())));

        assertEquals(InferredType.listOf(InferredType.INTEGER), moduleType(environment, "xs"));
        assertEquals(InferredType.mapOf(InferredType.TEXT, InferredType.FLOAT), moduleType(environment, "m"));
        assertEquals(InferredType.listOf(InferredType.UNKNOWN), moduleType(environment, "empty"));
    }

    @Test
    void constructorCallsUseDeclaredReturnType() {
        TypeEnvironment environment = infer(module(
                assign("s", call("str", integer(5))),
                assign("n", call("len", text("abc"))),
                assign("u", call("mystery", integer(1)))));

        assertEquals(InferredType.TEXT, moduleType(environment, "s"));
        assertEquals(InferredType.INTEGER, moduleType(environment, "n"));
        assertEquals(InferredType.UNKNOWN, moduleType(environment, "u"));
    }

    @Test
    void identifiersPropagateTheirBindingType() {
        TypeEnvironment environment = infer(module(
                assign("a", text("x")),
                assign("b", name("a")),
                assign("c", name("undefined"))));

        assertEquals(InferredType.TEXT, moduleType(environment, "b"));
        assertEquals(InferredType.UNKNOWN, moduleType(environment, "c"));
    }

    // ========== WIDENING ==========

    @Test
    void conflictingReassignmentWidensToUnknown() {
        TypeEnvironment environment = infer(module(
                assign("x", integer(1)),
                assign("x", text("now text"))));

        assertEquals(InferredType.UNKNOWN, moduleType(environment, "x"));
    }

    @Test
    void wideningIsMonotonic() {
        // Given: int, text, then int again
        TypeEnvironment environment = infer(module(
                assign("x", integer(1)),
                assign("x", text("a")),
                assign("x", integer(2))));

        // Then: never re-upgraded
        assertEquals(InferredType.UNKNOWN, moduleType(environment, "x"));
    }

    @Test
    void sameTypeReassignmentKeepsTheType() {
        TypeEnvironment environment = infer(module(
                assign("x", integer(1)),
                assign("x", integer(2))));

        assertEquals(InferredType.INTEGER, moduleType(environment, "x"));
    }

    @Test
    void emptyListThenIntegerListWidensToUnknown() {
        TypeEnvironment environment = infer(module(
                assign("xs", list()),
                assign("ys", list())));
        assertEquals(InferredType.listOf(InferredType.UNKNOWN), moduleType(environment, "xs"));

        environment = infer(module(
                assign("xs", list()),
                assign("xs", list(integer(1), integer(2)))));

        assertEquals(InferredType.UNKNOWN, moduleType(environment, "xs"));
    }

    @Test
    void augmentedAssignmentKeepsOrCreatesBinding() {
        TypeEnvironment environment = infer(module(
                assign("total", integer(0)),
                augAssign(name("total"), BinaryOp.Operator.ADD, integer(5)),
                augAssign(name("counter"), BinaryOp.Operator.ADD, integer(1))));

        assertEquals(InferredType.INTEGER, moduleType(environment, "total"));
        assertEquals(InferredType.UNKNOWN, moduleType(environment, "counter"));
    }

    // ========== SCOPES ==========

    @Test
    void forTargetsBindTheElementType() {
        TypeEnvironment environment = infer(module(
                assign("names", list(text("a"))),
                forLoop("i", call("range", integer(10))),
                forLoop("n", name("names"))));

        assertEquals(InferredType.INTEGER, moduleType(environment, "i"));
        assertEquals(InferredType.TEXT, moduleType(environment, "n"));
    }

    @Test
    void parametersUseAnnotationThenLiteralDefault() {
        FunctionDef function = def("f", paramList(
                        param("plain"),
                        param("count", integer(3), null),
                        param("label", integer(3), "str"),
                        param("args", Parameter.ParameterKind.VARIADIC),
                        param("kwargs", Parameter.ParameterKind.KEYWORD_VARIADIC)),
                ret(name("plain")));

        TypeEnvironment environment = infer(module(function));
        Scope scope = environment.scopeOf(function);

        assertEquals("<module>.f", scope.getId());
        assertEquals(InferredType.UNKNOWN, scope.resolveLocal("plain").getType());
        assertEquals(InferredType.INTEGER, scope.resolveLocal("count").getType());
        assertEquals(InferredType.TEXT, scope.resolveLocal("label").getType());
        assertEquals(InferredType.UNKNOWN, scope.resolveLocal("args").getType());
        assertEquals(InferredType.mapOf(InferredType.TEXT, InferredType.UNKNOWN),
                scope.resolveLocal("kwargs").getType());
    }

    @Test
    void selfAttributesBecomeClassBindings() {
        // Given
        FunctionDef init = def("__init__", params("self", "name"),
                assign(attr("self", "name"), name("name")),
                assign(attr("self", "count"), integer(0)));
        FunctionDef increment = def("increment", params("self"),
                augAssign(attr("self", "count"), BinaryOp.Operator.ADD, integer(1)));
        ClassDef counter = classDef("Counter", init, increment);

        // When
        TypeEnvironment environment = infer(module(counter));

        // Then: fields live in the class scope, the receiver is not a binding
        Scope classScope = environment.scopeOf(counter);
        assertEquals(InferredType.UNKNOWN, classScope.resolveLocal("name").getType());
        assertEquals(InferredType.INTEGER, classScope.resolveLocal("count").getType());
        assertNull(environment.scopeOf(init).resolveLocal("self"));
        assertNotNull(environment.scopeOf(init).resolveLocal("name"));
        assertTrue(environment.isModuleClass("Counter"));
    }

    @Test
    void classBodyIsNotVisibleFromMethods() {
        FunctionDef method = def("get", params("self"), ret(name("limit")));
        ClassDef config = classDef("Config", assign("limit", integer(10)), method);

        TypeEnvironment environment = infer(module(config));

        assertEquals(InferredType.INTEGER, environment.scopeOf(config).resolveLocal("limit").getType());
        assertNull(environment.scopeOf(method).lookup("limit"));
    }

    @Test
    void duplicateDefinitionsGetDistinctScopes() {
        FunctionDef first = def("f", Collections.<Parameter>emptyList(), assign("a", integer(1)));
        FunctionDef second = def("f", Collections.<Parameter>emptyList(), assign("a", text("x")));

        TypeEnvironment environment = infer(module(first, second));

        assertEquals("<module>.f", environment.scopeOf(first).getId());
        assertEquals("<module>.f#2", environment.scopeOf(second).getId());
        assertEquals(InferredType.TEXT, environment.scopeOf(second).resolveLocal("a").getType());
    }

    // ========== FINALIZATION, CONFIG, HOOKS ==========

    @Test
    void bindingsAreFrozenAfterInference() {
        TypeEnvironment environment = infer(module(assign("x", integer(1))));
        Binding binding = environment.getModuleScope().resolveLocal("x");

        assertTrue(binding.isFrozen());
        assertTrue(environment.getModuleScope().isFinalized());
        assertThrows(IllegalStateException.class, () -> binding.widen(InferredType.TEXT));
    }

    @Test
    void disabledInferenceMakesEverythingUnknown() {
        ConversionConfig config = ConversionConfig.builder().enableTypeInference(false).build();

        TypeEnvironment environment = infer(module(
                assign("i", integer(1)),
                assign("xs", list(integer(1))),
                forLoop("k", call("range", integer(3)))), config, PluginChain.EMPTY);

        assertEquals(InferredType.UNKNOWN, moduleType(environment, "i"));
        assertEquals(InferredType.UNKNOWN, moduleType(environment, "xs"));
        assertEquals(InferredType.UNKNOWN, moduleType(environment, "k"));
    }

    @Test
    void afterInferenceHookOverridesBindingType() {
        PluginRegistry registry = new PluginRegistry();
        registry.register(TestPlugin.of("decimals", r -> r.afterInference(0, (node, type, ctx) ->
                type.getKind() == InferredType.Kind.INTEGER ? InferredType.FLOAT : type)));

        TypeEnvironment environment = infer(module(
                assign("i", integer(1)),
                assign("s", text("a"))), ConversionConfig.defaults(), registry.getChain());

        assertEquals(InferredType.FLOAT, moduleType(environment, "i"));
        assertEquals(InferredType.TEXT, moduleType(environment, "s"));
        assertFalse(diagnostics.hasDiagnostics());
    }

    @Test
    void faultyAfterInferenceHookKeepsInferredType() {
        PluginRegistry registry = new PluginRegistry();
        registry.register(TestPlugin.of("faulty", r -> r.afterInference(0, (node, type, ctx) -> {
            throw new UnsupportedOperationException("no");
        })));

        TypeEnvironment environment = infer(module(assign("i", integer(1))),
                ConversionConfig.defaults(), registry.getChain());

        assertEquals(InferredType.INTEGER, moduleType(environment, "i"));
        assertEquals(1, diagnostics.count(DiagnosticCode.PLUGIN_FAULT));
    }
}
