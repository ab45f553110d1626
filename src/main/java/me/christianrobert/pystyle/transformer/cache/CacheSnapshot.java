package me.christianrobert.pystyle.transformer.cache;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import me.christianrobert.pystyle.transformer.ast.SourceSpan;
import me.christianrobert.pystyle.transformer.context.Diagnostic;
import me.christianrobert.pystyle.transformer.context.DiagnosticCode;
import me.christianrobert.pystyle.transformer.context.DiagnosticSeverity;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * File form of a {@link ConversionCache}: the environment fingerprint the entries were
 * produced under and the entries from least to most recently used.
 */
@JsonPropertyOrder({"environmentFingerprint", "entries"})
public class CacheSnapshot {

    private final String environmentFingerprint;
    private final List<StoredEntry> entries;

    @JsonCreator
    public CacheSnapshot(@JsonProperty("environmentFingerprint") String environmentFingerprint,
                         @JsonProperty("entries") List<StoredEntry> entries) {
        this.environmentFingerprint = environmentFingerprint;
        this.entries = entries != null ? entries : Collections.<StoredEntry>emptyList();
    }

    static CacheSnapshot of(String environmentFingerprint, List<CacheEntry> cacheEntries) {
        List<StoredEntry> stored = new ArrayList<>();
        for (CacheEntry entry : cacheEntries) {
            stored.add(StoredEntry.from(entry));
        }
        return new CacheSnapshot(environmentFingerprint, stored);
    }

    @JsonProperty("environmentFingerprint")
    public String getEnvironmentFingerprint() {
        return environmentFingerprint;
    }

    @JsonProperty("entries")
    public List<StoredEntry> getEntries() {
        return entries;
    }

    @JsonPropertyOrder({"fingerprint", "renderedText", "creationTime", "diagnostics"})
    public static class StoredEntry {

        private final String fingerprint;
        private final String renderedText;
        private final long creationTime;
        private final List<StoredDiagnostic> diagnostics;

        @JsonCreator
        public StoredEntry(@JsonProperty("fingerprint") String fingerprint,
                           @JsonProperty("renderedText") String renderedText,
                           @JsonProperty("creationTime") long creationTime,
                           @JsonProperty("diagnostics") List<StoredDiagnostic> diagnostics) {
            this.fingerprint = fingerprint;
            this.renderedText = renderedText;
            this.creationTime = creationTime;
            this.diagnostics = diagnostics != null ? diagnostics : Collections.<StoredDiagnostic>emptyList();
        }

        static StoredEntry from(CacheEntry entry) {
            List<StoredDiagnostic> diagnostics = new ArrayList<>();
            for (Diagnostic diagnostic : entry.getDiagnostics()) {
                diagnostics.add(StoredDiagnostic.from(diagnostic));
            }
            return new StoredEntry(entry.getFingerprint(), entry.getRenderedText(),
                    entry.getCreationTime().toEpochMilli(), diagnostics);
        }

        CacheEntry toCacheEntry() {
            if (fingerprint == null || renderedText == null) {
                throw new IllegalArgumentException("Cache file entry without fingerprint or text");
            }
            List<Diagnostic> restored = new ArrayList<>();
            for (StoredDiagnostic diagnostic : diagnostics) {
                restored.add(diagnostic.toDiagnostic());
            }
            return new CacheEntry(fingerprint, renderedText, restored, Instant.ofEpochMilli(creationTime));
        }

        @JsonProperty("fingerprint")
        public String getFingerprint() {
            return fingerprint;
        }

        @JsonProperty("renderedText")
        public String getRenderedText() {
            return renderedText;
        }

        /**
         * Epoch milliseconds.
         */
        @JsonProperty("creationTime")
        public long getCreationTime() {
            return creationTime;
        }

        @JsonProperty("diagnostics")
        public List<StoredDiagnostic> getDiagnostics() {
            return diagnostics;
        }
    }

    @JsonPropertyOrder({"severity", "code", "message", "line", "column", "endLine", "endColumn"})
    public static class StoredDiagnostic {

        private final DiagnosticSeverity severity;
        private final DiagnosticCode code;
        private final String message;
        private final int line;
        private final int column;
        private final int endLine;
        private final int endColumn;

        @JsonCreator
        public StoredDiagnostic(@JsonProperty("severity") DiagnosticSeverity severity,
                                @JsonProperty("code") DiagnosticCode code,
                                @JsonProperty("message") String message,
                                @JsonProperty("line") int line,
                                @JsonProperty("column") int column,
                                @JsonProperty("endLine") int endLine,
                                @JsonProperty("endColumn") int endColumn) {
            this.severity = severity;
            this.code = code;
            this.message = message;
            this.line = line;
            this.column = column;
            this.endLine = endLine;
            this.endColumn = endColumn;
        }

        static StoredDiagnostic from(Diagnostic diagnostic) {
            SourceSpan span = diagnostic.getSpan();
            return new StoredDiagnostic(diagnostic.getSeverity(), diagnostic.getCode(), diagnostic.getMessage(),
                    span.getLine(), span.getColumn(), span.getEndLine(), span.getEndColumn());
        }

        Diagnostic toDiagnostic() {
            if (code == null) {
                throw new IllegalArgumentException("Cache file diagnostic without code: " + message);
            }
            DiagnosticSeverity restoredSeverity = severity != null ? severity : code.getDefaultSeverity();
            return new Diagnostic(restoredSeverity, code, message, new SourceSpan(line, column, endLine, endColumn));
        }

        @JsonProperty("severity")
        public DiagnosticSeverity getSeverity() {
            return severity;
        }

        @JsonProperty("code")
        public DiagnosticCode getCode() {
            return code;
        }

        @JsonProperty("message")
        public String getMessage() {
            return message;
        }

        @JsonProperty("line")
        public int getLine() {
            return line;
        }

        @JsonProperty("column")
        public int getColumn() {
            return column;
        }

        @JsonProperty("endLine")
        public int getEndLine() {
            return endLine;
        }

        @JsonProperty("endColumn")
        public int getEndColumn() {
            return endColumn;
        }
    }
}
