package me.christianrobert.pystyle.transformer.service;

import me.christianrobert.pystyle.config.model.ConversionConfig;
import me.christianrobert.pystyle.transformer.ast.ModuleNode;
import me.christianrobert.pystyle.transformer.ast.NodeRewriter;
import me.christianrobert.pystyle.transformer.ast.TreeValidator;
import me.christianrobert.pystyle.transformer.builder.JavaStyleCodeBuilder;
import me.christianrobert.pystyle.transformer.context.DiagnosticsCollector;
import me.christianrobert.pystyle.transformer.mapping.MappingTable;
import me.christianrobert.pystyle.transformer.plugin.ExtensionPoint;
import me.christianrobert.pystyle.transformer.plugin.HookContext;
import me.christianrobert.pystyle.transformer.plugin.PluginChain;
import me.christianrobert.pystyle.transformer.type.TypeEnvironment;
import me.christianrobert.pystyle.transformer.type.TypeInferenceEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One conversion run over an already parsed module.
 *
 * <p>Stages, in order:</p>
 * <pre>
 * ModuleNode
 *   → TreeValidator              (MalformedInput aborts the run)
 *   → beforeInference hooks      (top-down rewrite, re-validated)
 *   → TypeInferenceEngine        (bindings per scope, afterInference hooks)
 *   → JavaStyleCodeBuilder       (mapping table, beforeRender / afterRender hooks)
 *   → rendered text + diagnostics
 * </pre>
 *
 * <p>A pipeline is immutable and can be reused across runs. Each {@link #run} gets its own
 * {@link DiagnosticsCollector}.</p>
 */
public class ConversionPipeline {

    private static final Logger log = LoggerFactory.getLogger(ConversionPipeline.class);

    private final MappingTable mappingTable;
    private final PluginChain pluginChain;
    private final ConversionConfig config;

    /**
     * @param baseTable Built-in mapping table; plugin contributions are layered on top
     * @param pluginChain Compiled plugin chain, {@link PluginChain#EMPTY} for none
     * @param config Conversion settings
     */
    public ConversionPipeline(MappingTable baseTable, PluginChain pluginChain, ConversionConfig config) {
        this.pluginChain = pluginChain != null ? pluginChain : PluginChain.EMPTY;
        this.mappingTable = baseTable.withContributions(this.pluginChain.getMappingContributions());
        this.config = config;
    }

    public MappingTable getMappingTable() {
        return mappingTable;
    }

    /**
     * Runs all stages over the module.
     *
     * @throws me.christianrobert.pystyle.transformer.context.MalformedInputException if the tree
     *         (before or after the beforeInference hooks) is not a well-formed module
     */
    public ConversionOutput run(ModuleNode module) {
        DiagnosticsCollector diagnostics = new DiagnosticsCollector();

        // STEP 1: Validate tree shape
        log.debug("Step 1: Validating syntax tree");
        ModuleNode tree = TreeValidator.validate(module);

        // STEP 2: beforeInference hooks
        if (pluginChain.hasHooks(ExtensionPoint.BEFORE_INFERENCE)) {
            log.debug("Step 2: Applying beforeInference hooks");
            tree = NodeRewriter.rewrite(tree, (node, scopeId) -> pluginChain.beforeInference(node,
                    new HookContext(config, ExtensionPoint.BEFORE_INFERENCE, scopeId, null), diagnostics));
            tree = TreeValidator.validate(tree);
        }

        // STEP 3: Type inference
        log.debug("Step 3: Inferring binding types");
        TypeEnvironment environment = new TypeInferenceEngine(mappingTable, pluginChain, config, diagnostics)
                .infer(tree);

        // STEP 4: Render
        log.debug("Step 4: Rendering target text");
        String rendered = new JavaStyleCodeBuilder(environment, mappingTable, pluginChain, config, diagnostics)
                .build(tree);
        log.trace("Rendered text: {}", rendered);

        if (diagnostics.hasDiagnostics()) {
            log.debug("Run finished with {} diagnostic(s)", diagnostics.snapshot().size());
        }
        return new ConversionOutput(rendered, diagnostics.snapshot(), tree, environment);
    }
}
