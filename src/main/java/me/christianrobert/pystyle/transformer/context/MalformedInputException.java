package me.christianrobert.pystyle.transformer.context;

import me.christianrobert.pystyle.transformer.ast.SourceSpan;

/**
 * The supplied tree violates the rooted-tree invariant or puts a node into a slot
 * it cannot occupy. Fatal: no stage after validation can assume a well-formed tree.
 */
public class MalformedInputException extends TransformationException {

    private final SourceSpan span;

    public MalformedInputException(String message, SourceSpan span) {
        super(message, null, span != null && span.isKnown() ? span.toString() : null);
        this.span = span != null ? span : SourceSpan.UNKNOWN;
    }

    public SourceSpan getSpan() {
        return span;
    }

    public Diagnostic toDiagnostic() {
        return Diagnostic.of(DiagnosticCode.MALFORMED_INPUT, getMessage(), span);
    }
}
