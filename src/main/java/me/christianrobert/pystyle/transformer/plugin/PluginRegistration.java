package me.christianrobert.pystyle.transformer.plugin;

import me.christianrobert.pystyle.transformer.ast.SyntaxNode;
import me.christianrobert.pystyle.transformer.mapping.MappingEntry;
import me.christianrobert.pystyle.transformer.type.InferredType;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects the hooks and mapping entries of one plugin during chain compilation.
 */
public class PluginRegistration {

    private final PluginDescriptor plugin;
    private final List<PluginHook<?>> hooks = new ArrayList<>();
    private final List<MappingEntry> mappings = new ArrayList<>();
    private int nextOrdinal;

    PluginRegistration(PluginDescriptor plugin, int firstOrdinal) {
        this.plugin = plugin;
        this.nextOrdinal = firstOrdinal;
    }

    public PluginRegistration beforeInference(int priority, PluginHandler<SyntaxNode> handler) {
        return add(ExtensionPoint.BEFORE_INFERENCE, priority, handler);
    }

    public PluginRegistration afterInference(int priority, PluginHandler<InferredType> handler) {
        return add(ExtensionPoint.AFTER_INFERENCE, priority, handler);
    }

    public PluginRegistration beforeRender(int priority, PluginHandler<SyntaxNode> handler) {
        return add(ExtensionPoint.BEFORE_RENDER, priority, handler);
    }

    public PluginRegistration afterRender(int priority, PluginHandler<String> handler) {
        return add(ExtensionPoint.AFTER_RENDER, priority, handler);
    }

    /**
     * Adds or overrides a mapping table row for every run using this chain.
     */
    public PluginRegistration contributeMapping(MappingEntry entry) {
        mappings.add(entry.contributedBy(plugin.getId()));
        return this;
    }

    private <T> PluginRegistration add(ExtensionPoint point, int priority, PluginHandler<T> handler) {
        if (handler == null) {
            throw new IllegalArgumentException("Handler for " + point.getHookName() + " cannot be null");
        }
        hooks.add(new PluginHook<>(point, priority, handler, plugin, nextOrdinal++));
        return this;
    }

    PluginDescriptor getPlugin() {
        return plugin;
    }

    List<PluginHook<?>> getHooks() {
        return hooks;
    }

    List<MappingEntry> getMappings() {
        return mappings;
    }

    int getNextOrdinal() {
        return nextOrdinal;
    }
}
