package me.christianrobert.pystyle.transformer.plugin;

import java.util.function.Consumer;

/**
 * Plugin whose registration is given as a lambda.
 */
public class TestPlugin implements Plugin {

    private final PluginDescriptor descriptor;
    private final Consumer<PluginRegistration> registrar;

    public TestPlugin(String id, String version, Consumer<PluginRegistration> registrar) {
        this.descriptor = new PluginDescriptor(id, version);
        this.registrar = registrar;
    }

    public static TestPlugin of(String id, Consumer<PluginRegistration> registrar) {
        return new TestPlugin(id, "1.0", registrar);
    }

    @Override
    public PluginDescriptor getDescriptor() {
        return descriptor;
    }

    @Override
    public void register(PluginRegistration registration) {
        registrar.accept(registration);
    }
}
