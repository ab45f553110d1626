package me.christianrobert.pystyle.transformer.plugin;

import me.christianrobert.pystyle.transformer.ast.SyntaxNode;

/**
 * A hook implementation.
 *
 * <p>Handlers must not touch pipeline state. They read the node, the current value and
 * the context, and express a change only by returning a different value. Returning the
 * received value (or {@code null}) means "no replacement".</p>
 *
 * @param <T> value type of the extension point (see {@link ExtensionPoint#getValueType()})
 */
@FunctionalInterface
public interface PluginHandler<T> {

    /**
     * @param node Node the hook runs for (for {@code afterInference}: the binding's first assignment)
     * @param value Current value, already replaced by earlier handlers of the chain
     * @param context Read-only view of configuration, extension point and scope
     * @return the value for the next handler
     */
    T handle(SyntaxNode node, T value, HookContext context);
}
