package me.christianrobert.pystyle.transformer.context;

import me.christianrobert.pystyle.transformer.ast.SourceSpan;

import java.util.Objects;

/**
 * One entry of the diagnostics returned alongside the rendered text.
 */
public class Diagnostic {

    private final DiagnosticSeverity severity;
    private final DiagnosticCode code;
    private final String message;
    private final SourceSpan span;

    public Diagnostic(DiagnosticSeverity severity, DiagnosticCode code, String message, SourceSpan span) {
        this.severity = severity;
        this.code = code;
        this.message = message;
        this.span = span != null ? span : SourceSpan.UNKNOWN;
    }

    /**
     * Creates a diagnostic with the code's default severity.
     */
    public static Diagnostic of(DiagnosticCode code, String message, SourceSpan span) {
        return new Diagnostic(code.getDefaultSeverity(), code, message, span);
    }

    public DiagnosticSeverity getSeverity() {
        return severity;
    }

    public DiagnosticCode getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    public SourceSpan getSpan() {
        return span;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Diagnostic that = (Diagnostic) o;
        return severity == that.severity && code == that.code
                && Objects.equals(message, that.message) && Objects.equals(span, that.span);
    }

    @Override
    public int hashCode() {
        return Objects.hash(severity, code, message, span);
    }

    @Override
    public String toString() {
        return severity + " " + code + " (" + span + "): " + message;
    }
}
