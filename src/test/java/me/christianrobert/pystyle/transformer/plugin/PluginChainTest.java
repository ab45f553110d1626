package me.christianrobert.pystyle.transformer.plugin;

import me.christianrobert.pystyle.config.model.ConversionConfig;
import me.christianrobert.pystyle.transformer.ast.Identifier;
import me.christianrobert.pystyle.transformer.ast.ScopeNames;
import me.christianrobert.pystyle.transformer.ast.SyntaxNode;
import me.christianrobert.pystyle.transformer.context.DiagnosticCode;
import me.christianrobert.pystyle.transformer.context.DiagnosticsCollector;
import me.christianrobert.pystyle.transformer.context.RenderState;
import me.christianrobert.pystyle.transformer.type.InferredType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static me.christianrobert.pystyle.transformer.Nodes.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for hook dispatch: ordering, fault isolation and conflict resolution.
 */
class PluginChainTest {

    private PluginRegistry registry;
    private DiagnosticsCollector diagnostics;

    @BeforeEach
    void setUp() {
        registry = new PluginRegistry();
        diagnostics = new DiagnosticsCollector();
    }

    private static HookContext context(ExtensionPoint point) {
        return new HookContext(ConversionConfig.defaults(), point, ScopeNames.MODULE, RenderState.MODULE_LEVEL);
    }

    private String afterRender(SyntaxNode node, String fragment) {
        return registry.getChain().afterRender(node, fragment, context(ExtensionPoint.AFTER_RENDER), diagnostics);
    }

    // ========== ORDERING ==========

    @Test
    void handlersRunInAscendingPriorityAndSeePreviousReplacement() {
        // Given: registered out of priority order
        registry.register(TestPlugin.of("late", r -> r.afterRender(20, (node, value, ctx) -> value + "-late")));
        registry.register(TestPlugin.of("early", r -> r.afterRender(10, (node, value, ctx) -> value + "-early")));

        // When
        String result = afterRender(name("x"), "x");

        // Then
        assertEquals("x-early-late", result);
        assertFalse(diagnostics.hasDiagnostics());
    }

    @Test
    void returningTheValueOrNullMeansNoReplacement() {
        registry.register(TestPlugin.of("same", r -> r.afterRender(0, (node, value, ctx) -> value)));
        registry.register(TestPlugin.of("null", r -> r.afterRender(0, (node, value, ctx) -> null)));

        assertEquals("x", afterRender(name("x"), "x"));
        assertFalse(diagnostics.hasDiagnostics());
    }

    @Test
    void emptyChainPassesValuesThrough() {
        PluginChain chain = PluginChain.EMPTY;
        SyntaxNode node = name("x");

        assertSame(node, chain.beforeRender(node, context(ExtensionPoint.BEFORE_RENDER), diagnostics));
        assertEquals(InferredType.TEXT,
                chain.afterInference(node, InferredType.TEXT, context(ExtensionPoint.AFTER_INFERENCE), diagnostics));
        assertFalse(chain.hasHooks(ExtensionPoint.AFTER_RENDER));
    }

    // ========== FAULT ISOLATION ==========

    @Test
    void throwingHandlerIsIsolated() {
        // Given: a faulty handler between two working ones
        registry.register(TestPlugin.of("first", r -> r.afterRender(1, (node, value, ctx) -> value + "1")));
        registry.register(TestPlugin.of("faulty", r -> r.afterRender(2, (node, value, ctx) -> {
            throw new IllegalStateException("boom");
        })));
        registry.register(TestPlugin.of("third", r -> r.afterRender(3, (node, value, ctx) -> value + "3")));
        Identifier node = name("x");

        // When
        String result = afterRender(node, "x");

        // Then: value passes the faulty handler unchanged, one fault reported with the node's span
        assertEquals("x13", result);
        assertEquals(1, diagnostics.count(DiagnosticCode.PLUGIN_FAULT));
        assertEquals(node.getSpan(), diagnostics.snapshot().get(0).getSpan());
        assertTrue(diagnostics.snapshot().get(0).getMessage().contains("faulty:1.0"));
    }

    @Test
    void handlerThrowingErrorIsIsolated() {
        registry.register(TestPlugin.of("asserting", r -> r.afterRender(0, (node, value, ctx) -> {
            throw new AssertionError("invariant broken");
        })));
        registry.register(TestPlugin.of("suffix", r -> r.afterRender(1, (node, value, ctx) -> value + "!")));

        String result = afterRender(name("x"), "x");

        assertEquals("x!", result);
        assertEquals(1, diagnostics.count(DiagnosticCode.PLUGIN_FAULT));
        assertTrue(diagnostics.snapshot().get(0).getMessage().contains("invariant broken"));
    }

    @Test
    void oneFaultPerFailingInvocation() {
        registry.register(TestPlugin.of("faulty", r -> r.afterRender(0, (node, value, ctx) -> {
            throw new RuntimeException("always");
        })));

        afterRender(name("a"), "a");
        afterRender(name("b"), "b");

        assertEquals(2, diagnostics.count(DiagnosticCode.PLUGIN_FAULT));
    }

    @Test
    void replacementOfWrongCategoryIsRejected() {
        // Given: a beforeInference handler that turns a statement into an expression
        registry.register(TestPlugin.of("bad", r -> r.beforeInference(0, (node, value, ctx) ->
                node.getKind().isStatement() ? integer(1) : value)));
        SyntaxNode statement = assign("x", integer(2));

        // When
        SyntaxNode result = registry.getChain().beforeInference(statement,
                context(ExtensionPoint.BEFORE_INFERENCE), diagnostics);

        // Then
        assertSame(statement, result);
        assertEquals(1, diagnostics.count(DiagnosticCode.PLUGIN_FAULT));
    }

    // ========== CONFLICTS ==========

    @Test
    void samePriorityConflictLaterRegistrationWins() {
        registry.register(TestPlugin.of("alpha", r -> r.afterRender(5, (node, value, ctx) -> "alpha")));
        registry.register(TestPlugin.of("beta", r -> r.afterRender(5, (node, value, ctx) -> "beta")));

        String result = afterRender(name("x"), "x");

        assertEquals("beta", result);
        assertEquals(1, diagnostics.count(DiagnosticCode.PLUGIN_CONFLICT));
        assertTrue(diagnostics.snapshot().get(0).getMessage().contains("beta:1.0"));
    }

    @Test
    void conflictResolutionIsDeterministicAcrossRuns() {
        registry.register(TestPlugin.of("alpha", r -> r.afterRender(5, (node, value, ctx) -> "alpha")));
        registry.register(TestPlugin.of("beta", r -> r.afterRender(5, (node, value, ctx) -> "beta")));

        List<String> results = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            results.add(afterRender(name("x"), "x"));
        }

        for (String result : results) {
            assertEquals("beta", result);
        }
        assertEquals(5, diagnostics.count(DiagnosticCode.PLUGIN_CONFLICT));
    }

    @Test
    void singleReplacementInPriorityGroupIsNoConflict() {
        registry.register(TestPlugin.of("alpha", r -> r.afterRender(5, (node, value, ctx) -> "alpha")));
        registry.register(TestPlugin.of("observer", r -> r.afterRender(5, (node, value, ctx) -> value)));

        assertEquals("alpha", afterRender(name("x"), "x"));
        assertEquals(0, diagnostics.count(DiagnosticCode.PLUGIN_CONFLICT));
    }

    // ========== CONTEXT ==========

    @Test
    void handlersReceiveTheHookContext() {
        List<HookContext> seen = new ArrayList<>();
        registry.register(TestPlugin.of("spy", r -> r.afterInference(0, (node, value, ctx) -> {
            seen.add(ctx);
            return value;
        })));

        registry.getChain().afterInference(name("x"), InferredType.INTEGER,
                context(ExtensionPoint.AFTER_INFERENCE), diagnostics);

        assertEquals(1, seen.size());
        assertEquals(ExtensionPoint.AFTER_INFERENCE, seen.get(0).getExtensionPoint());
        assertEquals(ScopeNames.MODULE, seen.get(0).getScopeId());
        assertEquals(4, seen.get(0).getConfig().getIndentSize());
    }
}
