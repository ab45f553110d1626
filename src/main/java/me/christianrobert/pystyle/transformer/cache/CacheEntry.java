package me.christianrobert.pystyle.transformer.cache;

import me.christianrobert.pystyle.transformer.context.Diagnostic;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Cached outcome of one successful conversion: the rendered text and the diagnostics
 * reported while producing it.
 */
public class CacheEntry {

    private final String fingerprint;
    private final String renderedText;
    private final List<Diagnostic> diagnostics;
    private final Instant creationTime;

    public CacheEntry(String fingerprint, String renderedText, List<Diagnostic> diagnostics, Instant creationTime) {
        this.fingerprint = fingerprint;
        this.renderedText = renderedText;
        this.diagnostics = Collections.unmodifiableList(new ArrayList<>(diagnostics));
        this.creationTime = creationTime;
    }

    public CacheEntry(String fingerprint, String renderedText, List<Diagnostic> diagnostics) {
        this(fingerprint, renderedText, diagnostics, Instant.now());
    }

    public String getFingerprint() {
        return fingerprint;
    }

    public String getRenderedText() {
        return renderedText;
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    public Instant getCreationTime() {
        return creationTime;
    }

    @Override
    public String toString() {
        return "CacheEntry{" + fingerprint + ", " + renderedText.length() + " chars, "
                + diagnostics.size() + " diagnostics, created " + creationTime + "}";
    }
}
