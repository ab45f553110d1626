package me.christianrobert.pystyle.transformer.plugin;

import me.christianrobert.pystyle.transformer.mapping.ConstructKey;
import me.christianrobert.pystyle.transformer.mapping.ConstructKind;
import me.christianrobert.pystyle.transformer.mapping.MappingEntry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class PluginRegistryTest {

    private PluginRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new PluginRegistry();
    }

    @Test
    void emptyRegistryCompilesToEmptyChain() {
        assertSame(PluginChain.EMPTY, registry.getChain());
        assertTrue(registry.getChain().getFingerprintTokens().isEmpty());
    }

    @Test
    void chainIsCachedUntilRegistrationChanges() {
        registry.register(TestPlugin.of("a", r -> r.afterRender(0, (node, value, ctx) -> value)));
        PluginChain first = registry.getChain();

        assertSame(first, registry.getChain());

        registry.register(TestPlugin.of("b", r -> r.afterRender(0, (node, value, ctx) -> value)));
        assertNotSame(first, registry.getChain());
    }

    @Test
    void fingerprintTokensFollowRegistrationOrder() {
        registry.register(new TestPlugin("zeta", "2.1", r -> { }));
        registry.register(new TestPlugin("alpha", "0.9", r -> { }));

        assertEquals(Arrays.asList("zeta:2.1", "alpha:0.9"), registry.getChain().getFingerprintTokens());
    }

    @Test
    void disabledPluginIsLeftOutOfTheChain() {
        registry.register(TestPlugin.of("a", r -> r.afterRender(0, (node, value, ctx) -> value)));
        registry.register(TestPlugin.of("b", r -> r.afterRender(0, (node, value, ctx) -> value)));

        assertTrue(registry.disable("a"));

        assertFalse(registry.isEnabled("a"));
        assertEquals(Arrays.asList("b:1.0"), registry.getChain().getFingerprintTokens());
        assertEquals(1, registry.getChain().getHooks(ExtensionPoint.AFTER_RENDER).size());

        assertTrue(registry.enable("a"));
        assertEquals(2, registry.getChain().getPlugins().size());
    }

    @Test
    void unknownPluginIdsAreReported() {
        assertFalse(registry.enable("missing"));
        assertFalse(registry.disable("missing"));
        assertFalse(registry.unregister("missing"));
    }

    @Test
    void reRegisteringAnIdReplacesThePlugin() {
        registry.register(new TestPlugin("a", "1.0", r -> { }));
        registry.register(new TestPlugin("a", "2.0", r -> { }));

        assertEquals(1, registry.getPlugins().size());
        assertEquals(Arrays.asList("a:2.0"), registry.getChain().getFingerprintTokens());
    }

    @Test
    void pluginFailingToRegisterIsSkipped() {
        registry.register(TestPlugin.of("broken", r -> {
            throw new IllegalStateException("cannot register");
        }));
        registry.register(TestPlugin.of("fine", r -> r.afterRender(0, (node, value, ctx) -> value)));

        PluginChain chain = registry.getChain();

        assertEquals(Arrays.asList("fine:1.0"), chain.getFingerprintTokens());
    }

    @Test
    void mappingContributionsAreAttributedToThePlugin() {
        MappingEntry entry = MappingEntry.of(ConstructKey.of(ConstructKind.BUILTIN_CALL, "zip", 2), "Zip.of({0}, {1})");
        registry.register(TestPlugin.of("zipper", r -> r.contributeMapping(entry)));

        PluginChain chain = registry.getChain();

        assertEquals(1, chain.getMappingContributions().size());
        assertEquals("zipper", chain.getMappingContributions().get(0).getOrigin());
    }

    @Test
    void nullHandlerIsRejected() {
        registry.register(TestPlugin.of("nulls", r -> r.afterRender(0, null)));

        // the plugin fails while registering and is left out
        assertTrue(registry.getChain().isEmpty());
    }
}
