package me.christianrobert.pystyle.transformer.service;

import me.christianrobert.pystyle.transformer.ast.ModuleNode;
import me.christianrobert.pystyle.transformer.context.Diagnostic;
import me.christianrobert.pystyle.transformer.type.TypeEnvironment;

import java.util.Collections;
import java.util.List;

/**
 * What one pipeline run produced: the rendered text, its diagnostics, and the
 * (possibly rewritten) tree with its inferred types for debug output.
 */
public class ConversionOutput {

    private final String renderedText;
    private final List<Diagnostic> diagnostics;
    private final ModuleNode module;
    private final TypeEnvironment environment;

    public ConversionOutput(String renderedText, List<Diagnostic> diagnostics, ModuleNode module,
                            TypeEnvironment environment) {
        this.renderedText = renderedText;
        this.diagnostics = diagnostics != null ? diagnostics : Collections.<Diagnostic>emptyList();
        this.module = module;
        this.environment = environment;
    }

    public String getRenderedText() {
        return renderedText;
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    public ModuleNode getModule() {
        return module;
    }

    public TypeEnvironment getEnvironment() {
        return environment;
    }
}
