package me.christianrobert.pystyle.transformer.plugin;

import me.christianrobert.pystyle.transformer.ast.SyntaxNode;
import me.christianrobert.pystyle.transformer.type.InferredType;

/**
 * Points of the pipeline where plugin handlers run, in pipeline order.
 */
public enum ExtensionPoint {

    /** Every node, top-down, before inference. Value: the node; a replacement is walked instead. */
    BEFORE_INFERENCE("beforeInference", SyntaxNode.class),

    /** Every binding when its scope is finalized. Value: the inferred type; a replacement overrides it. */
    AFTER_INFERENCE("afterInference", InferredType.class),

    /** Every node before it is rendered. Value: the node; a replacement is rendered instead. */
    BEFORE_RENDER("beforeRender", SyntaxNode.class),

    /** Every node after it is rendered. Value: the fragment; a replacement is emitted instead. */
    AFTER_RENDER("afterRender", String.class);

    private final String hookName;
    private final Class<?> valueType;

    ExtensionPoint(String hookName, Class<?> valueType) {
        this.hookName = hookName;
        this.valueType = valueType;
    }

    public String getHookName() {
        return hookName;
    }

    public Class<?> getValueType() {
        return valueType;
    }
}
