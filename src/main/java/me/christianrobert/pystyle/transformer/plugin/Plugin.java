package me.christianrobert.pystyle.transformer.plugin;

/**
 * Third-party extension of the conversion pipeline.
 *
 * <p>A plugin declares its handlers and mapping contributions once, when the
 * {@link PluginRegistry} compiles the chain.</p>
 */
public interface Plugin {

    PluginDescriptor getDescriptor();

    void register(PluginRegistration registration);
}
