package me.christianrobert.pystyle.transformer.context;

import me.christianrobert.pystyle.transformer.ast.SourceSpan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Accumulates recoverable diagnostics of a single conversion run, in the order they occur.
 *
 * <p>One collector per run; it is never shared between threads.</p>
 */
public class DiagnosticsCollector {

    private static final Logger log = LoggerFactory.getLogger(DiagnosticsCollector.class);

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    public void report(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
        if (diagnostic.getSeverity() == DiagnosticSeverity.INFO) {
            log.debug("{}", diagnostic);
        } else {
            log.warn("{}", diagnostic);
        }
    }

    public void report(DiagnosticCode code, String message, SourceSpan span) {
        report(Diagnostic.of(code, message, span));
    }

    public boolean hasDiagnostics() {
        return !diagnostics.isEmpty();
    }

    public int count(DiagnosticCode code) {
        int count = 0;
        for (Diagnostic diagnostic : diagnostics) {
            if (diagnostic.getCode() == code) {
                count++;
            }
        }
        return count;
    }

    /**
     * Immutable copy of the diagnostics collected so far.
     */
    public List<Diagnostic> snapshot() {
        return Collections.unmodifiableList(new ArrayList<>(diagnostics));
    }
}
