package me.christianrobert.pystyle.transformer.plugin;

import me.christianrobert.pystyle.transformer.ast.SyntaxNode;
import me.christianrobert.pystyle.transformer.context.DiagnosticCode;
import me.christianrobert.pystyle.transformer.context.DiagnosticsCollector;
import me.christianrobert.pystyle.transformer.mapping.MappingEntry;
import me.christianrobert.pystyle.transformer.type.InferredType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Compiled, immutable set of plugin hooks, shared read-only by concurrent conversions.
 *
 * <h3>Dispatch</h3>
 * <ul>
 *   <li>Handlers run in ascending priority, ties in registration order.</li>
 *   <li>Chain of responsibility: each handler receives the value as replaced by the handlers before it.</li>
 *   <li>If two or more handlers of the same priority replace the value for the same node, the last one
 *       wins (it ran last) and one {@code PLUGIN_CONFLICT} is reported for that priority group.</li>
 *   <li>A handler that throws, an {@link Error} included, is skipped: the value passes through
 *       unmodified and one {@code PLUGIN_FAULT} is reported. The run continues.</li>
 *   <li>A node replacement must have the same slot category as the node it replaces;
 *       anything else is reported as a fault and ignored.</li>
 * </ul>
 */
public class PluginChain {

    private static final Logger log = LoggerFactory.getLogger(PluginChain.class);

    public static final PluginChain EMPTY = new PluginChain(
            Collections.<PluginDescriptor>emptyList(),
            Collections.<PluginHook<?>>emptyList(),
            Collections.<MappingEntry>emptyList());

    private static final Comparator<PluginHook<?>> DISPATCH_ORDER =
            Comparator.<PluginHook<?>>comparingInt(PluginHook::getPriority)
                    .thenComparingInt(PluginHook::getOrdinal);

    private final List<PluginDescriptor> plugins;
    private final Map<ExtensionPoint, List<PluginHook<?>>> hooksByPoint;
    private final List<MappingEntry> mappingContributions;

    PluginChain(List<PluginDescriptor> plugins, List<PluginHook<?>> hooks, List<MappingEntry> mappingContributions) {
        this.plugins = Collections.unmodifiableList(new ArrayList<>(plugins));
        Map<ExtensionPoint, List<PluginHook<?>>> byPoint = new EnumMap<>(ExtensionPoint.class);
        for (ExtensionPoint point : ExtensionPoint.values()) {
            List<PluginHook<?>> forPoint = new ArrayList<>();
            for (PluginHook<?> hook : hooks) {
                if (hook.getExtensionPoint() == point) {
                    forPoint.add(hook);
                }
            }
            forPoint.sort(DISPATCH_ORDER);
            byPoint.put(point, Collections.unmodifiableList(forPoint));
        }
        this.hooksByPoint = Collections.unmodifiableMap(byPoint);
        this.mappingContributions = Collections.unmodifiableList(new ArrayList<>(mappingContributions));
    }

    // ========== Typed entry points ==========

    public SyntaxNode beforeInference(SyntaxNode node, HookContext context, DiagnosticsCollector diagnostics) {
        return dispatch(ExtensionPoint.BEFORE_INFERENCE, node, node, context, diagnostics);
    }

    public InferredType afterInference(SyntaxNode node, InferredType type, HookContext context,
                                       DiagnosticsCollector diagnostics) {
        return dispatch(ExtensionPoint.AFTER_INFERENCE, node, type, context, diagnostics);
    }

    public SyntaxNode beforeRender(SyntaxNode node, HookContext context, DiagnosticsCollector diagnostics) {
        return dispatch(ExtensionPoint.BEFORE_RENDER, node, node, context, diagnostics);
    }

    public String afterRender(SyntaxNode node, String fragment, HookContext context, DiagnosticsCollector diagnostics) {
        return dispatch(ExtensionPoint.AFTER_RENDER, node, fragment, context, diagnostics);
    }

    // ========== Dispatch ==========

    @SuppressWarnings("unchecked")
    private <T> T dispatch(ExtensionPoint point, SyntaxNode node, T value, HookContext context,
                           DiagnosticsCollector diagnostics) {
        List<PluginHook<?>> hooks = hooksByPoint.get(point);
        if (hooks.isEmpty()) {
            return value;
        }

        T current = value;
        int groupStart = 0;
        while (groupStart < hooks.size()) {
            int priority = hooks.get(groupStart).getPriority();
            int replacements = 0;
            PluginHook<?> lastReplacer = null;

            int i = groupStart;
            for (; i < hooks.size() && hooks.get(i).getPriority() == priority; i++) {
                PluginHook<T> hook = (PluginHook<T>) hooks.get(i);
                T result;
                try {
                    result = hook.getHandler().handle(node, current, context);
                } catch (RuntimeException | Error e) {
                    log.warn("Handler {} failed on {}", hook, node.describe(), e);
                    diagnostics.report(DiagnosticCode.PLUGIN_FAULT,
                            "Plugin " + hook.getPlugin() + " failed in " + point.getHookName() + " on "
                                    + node.describe() + ": " + e, node.getSpan());
                    continue;
                }
                if (!isReplacement(current, result)) {
                    continue;
                }
                if (!fitsSlot(current, result)) {
                    diagnostics.report(DiagnosticCode.PLUGIN_FAULT,
                            "Plugin " + hook.getPlugin() + " replaced " + ((SyntaxNode) current).describe()
                                    + " with " + ((SyntaxNode) result).getKind() + " in " + point.getHookName()
                                    + ", which cannot occupy the same slot; replacement ignored", node.getSpan());
                    continue;
                }
                current = result;
                replacements++;
                lastReplacer = hook;
            }

            if (replacements > 1) {
                diagnostics.report(DiagnosticCode.PLUGIN_CONFLICT,
                        replacements + " handlers at priority " + priority + " replaced " + node.describe()
                                + " in " + point.getHookName() + "; " + lastReplacer.getPlugin()
                                + " (registered last) wins", node.getSpan());
            }
            groupStart = i;
        }
        return current;
    }

    private static boolean isReplacement(Object current, Object result) {
        if (result == null || result == current) {
            return false;
        }
        // nodes compare by identity, fragments and types by value
        return current instanceof SyntaxNode || !result.equals(current);
    }

    private static boolean fitsSlot(Object current, Object result) {
        if (!(current instanceof SyntaxNode)) {
            return true;
        }
        return result instanceof SyntaxNode
                && ((SyntaxNode) result).getKind().getCategory() == ((SyntaxNode) current).getKind().getCategory();
    }

    // ========== Introspection ==========

    public boolean isEmpty() {
        return plugins.isEmpty();
    }

    public boolean hasHooks(ExtensionPoint point) {
        return !hooksByPoint.get(point).isEmpty();
    }

    public List<PluginHook<?>> getHooks(ExtensionPoint point) {
        return hooksByPoint.get(point);
    }

    public List<PluginDescriptor> getPlugins() {
        return plugins;
    }

    /**
     * Mapping rows contributed by the plugins, in registration order.
     */
    public List<MappingEntry> getMappingContributions() {
        return mappingContributions;
    }

    /**
     * Ordered {@code id:version} list of the active plugins, for the cache fingerprint.
     */
    public List<String> getFingerprintTokens() {
        List<String> tokens = new ArrayList<>();
        for (PluginDescriptor plugin : plugins) {
            tokens.add(plugin.getFingerprintToken());
        }
        return tokens;
    }

    @Override
    public String toString() {
        return "PluginChain{plugins=" + plugins + "}";
    }
}
