package me.christianrobert.pystyle.transformer.plugin;

/**
 * A registered handler: extension point, priority and owning plugin.
 * The ordinal is the global registration order, used to break priority ties.
 */
public class PluginHook<T> {

    private final ExtensionPoint extensionPoint;
    private final int priority;
    private final PluginHandler<T> handler;
    private final PluginDescriptor plugin;
    private final int ordinal;

    PluginHook(ExtensionPoint extensionPoint, int priority, PluginHandler<T> handler,
               PluginDescriptor plugin, int ordinal) {
        this.extensionPoint = extensionPoint;
        this.priority = priority;
        this.handler = handler;
        this.plugin = plugin;
        this.ordinal = ordinal;
    }

    public ExtensionPoint getExtensionPoint() {
        return extensionPoint;
    }

    public int getPriority() {
        return priority;
    }

    public PluginHandler<T> getHandler() {
        return handler;
    }

    public PluginDescriptor getPlugin() {
        return plugin;
    }

    public int getOrdinal() {
        return ordinal;
    }

    @Override
    public String toString() {
        return "PluginHook{" + plugin + " " + extensionPoint.getHookName() + " priority=" + priority
                + " #" + ordinal + "}";
    }
}
