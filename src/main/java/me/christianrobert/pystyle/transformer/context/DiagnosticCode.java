package me.christianrobert.pystyle.transformer.context;

/**
 * Classification of everything the pipeline reports back to the caller.
 */
public enum DiagnosticCode {

    /** A construct with no mapping table entry; a structural fallback was emitted. */
    UNMAPPED_CONSTRUCT(DiagnosticSeverity.WARNING, true),

    /** A plugin handler threw; the node or fragment passed through unmodified. */
    PLUGIN_FAULT(DiagnosticSeverity.WARNING, true),

    /** Two handlers of the same priority replaced the same node; the later registration won. */
    PLUGIN_CONFLICT(DiagnosticSeverity.INFO, true),

    /** The supplied tree is not a well-formed rooted tree; the run is aborted. */
    MALFORMED_INPUT(DiagnosticSeverity.ERROR, false);

    private final DiagnosticSeverity defaultSeverity;
    private final boolean recoverable;

    DiagnosticCode(DiagnosticSeverity defaultSeverity, boolean recoverable) {
        this.defaultSeverity = defaultSeverity;
        this.recoverable = recoverable;
    }

    public DiagnosticSeverity getDefaultSeverity() {
        return defaultSeverity;
    }

    public boolean isRecoverable() {
        return recoverable;
    }
}
