package me.christianrobert.pystyle.transformer.plugin;

import me.christianrobert.pystyle.config.model.ConversionConfig;
import me.christianrobert.pystyle.transformer.context.RenderState;

/**
 * Read-only information a handler may consult.
 */
public class HookContext {

    private final ConversionConfig config;
    private final ExtensionPoint extensionPoint;
    private final String scopeId;
    private final RenderState renderState;

    public HookContext(ConversionConfig config, ExtensionPoint extensionPoint, String scopeId,
                       RenderState renderState) {
        this.config = config;
        this.extensionPoint = extensionPoint;
        this.scopeId = scopeId;
        this.renderState = renderState;
    }

    public ConversionConfig getConfig() {
        return config;
    }

    public ExtensionPoint getExtensionPoint() {
        return extensionPoint;
    }

    /**
     * Qualified id of the enclosing scope ({@code <module>.Greeter.greet}).
     */
    public String getScopeId() {
        return scopeId;
    }

    /**
     * Renderer state for render hooks, {@code null} for inference hooks.
     */
    public RenderState getRenderState() {
        return renderState;
    }

    @Override
    public String toString() {
        return "HookContext{" + extensionPoint + ", scope=" + scopeId
                + (renderState != null ? ", state=" + renderState : "") + "}";
    }
}
