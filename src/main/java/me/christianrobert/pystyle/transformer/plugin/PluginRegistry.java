package me.christianrobert.pystyle.transformer.plugin;

import jakarta.enterprise.context.ApplicationScoped;
import me.christianrobert.pystyle.transformer.mapping.MappingEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Holds the registered plugins and compiles them into an immutable {@link PluginChain}.
 *
 * <p>The compiled chain is cached until a plugin is registered, removed, enabled or disabled.
 * Conversions already running keep the chain they started with.</p>
 */
@ApplicationScoped
public class PluginRegistry {

    private static final Logger log = LoggerFactory.getLogger(PluginRegistry.class);

    // Registration order is dispatch order for equal priorities
    private final Map<String, Plugin> plugins = new LinkedHashMap<>();
    private final Map<String, Boolean> enabled = new LinkedHashMap<>();

    private PluginChain compiledChain;

    /**
     * Registers a plugin, enabled. A plugin with the same id is replaced.
     */
    public synchronized void register(Plugin plugin) {
        String id = plugin.getDescriptor().getId();
        if (plugins.containsKey(id)) {
            log.warn("Plugin '{}' is already registered and will be replaced", id);
            plugins.remove(id);
        }
        plugins.put(id, plugin);
        enabled.put(id, true);
        compiledChain = null;
        log.info("Registered plugin {}", plugin.getDescriptor());
    }

    public synchronized boolean unregister(String pluginId) {
        if (plugins.remove(pluginId) == null) {
            return false;
        }
        enabled.remove(pluginId);
        compiledChain = null;
        log.info("Unregistered plugin {}", pluginId);
        return true;
    }

    public synchronized boolean enable(String pluginId) {
        return setEnabled(pluginId, true);
    }

    public synchronized boolean disable(String pluginId) {
        return setEnabled(pluginId, false);
    }

    private boolean setEnabled(String pluginId, boolean value) {
        if (!plugins.containsKey(pluginId)) {
            return false;
        }
        Boolean previous = enabled.put(pluginId, value);
        if (previous == null || previous != value) {
            compiledChain = null;
            log.debug("Plugin {} {}", pluginId, value ? "enabled" : "disabled");
        }
        return true;
    }

    public synchronized boolean isEnabled(String pluginId) {
        return Boolean.TRUE.equals(enabled.get(pluginId));
    }

    public synchronized List<PluginDescriptor> getPlugins() {
        List<PluginDescriptor> descriptors = new ArrayList<>();
        for (Plugin plugin : plugins.values()) {
            descriptors.add(plugin.getDescriptor());
        }
        return descriptors;
    }

    public synchronized void clear() {
        plugins.clear();
        enabled.clear();
        compiledChain = null;
    }

    /**
     * Returns the compiled chain of all enabled plugins, compiling it if needed.
     */
    public synchronized PluginChain getChain() {
        if (compiledChain == null) {
            compiledChain = compile();
        }
        return compiledChain;
    }

    private PluginChain compile() {
        List<PluginDescriptor> active = new ArrayList<>();
        List<PluginHook<?>> hooks = new ArrayList<>();
        List<MappingEntry> mappings = new ArrayList<>();
        int ordinal = 0;

        for (Plugin plugin : plugins.values()) {
            PluginDescriptor descriptor = plugin.getDescriptor();
            if (!isEnabled(descriptor.getId())) {
                continue;
            }
            PluginRegistration registration = new PluginRegistration(descriptor, ordinal);
            try {
                plugin.register(registration);
            } catch (RuntimeException e) {
                log.error("Plugin {} failed to register its hooks and is left out of the chain", descriptor, e);
                continue;
            }
            active.add(descriptor);
            hooks.addAll(registration.getHooks());
            mappings.addAll(registration.getMappings());
            ordinal = registration.getNextOrdinal();
        }

        if (active.isEmpty()) {
            return PluginChain.EMPTY;
        }
        log.debug("Compiled plugin chain: {} plugins, {} hooks, {} mapping contributions",
                active.size(), hooks.size(), mappings.size());
        return new PluginChain(active, hooks, mappings);
    }
}
