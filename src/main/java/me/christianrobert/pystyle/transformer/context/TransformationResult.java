package me.christianrobert.pystyle.transformer.context;

import me.christianrobert.pystyle.transformer.ast.SourceSpan;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result of a conversion run.
 * Contains either the rendered text with its diagnostics, or a single fatal error.
 * Optionally includes an AST tree representation for debugging.
 */
public class TransformationResult {

    private final boolean success;
    private final String renderedText;
    private final List<Diagnostic> diagnostics;
    private final String errorMessage;
    private final SourceSpan errorSpan;
    private final String sourceText;
    private final String astTree;  // Optional AST tree representation (null by default)
    private final boolean fromCache;

    private TransformationResult(boolean success, String renderedText, List<Diagnostic> diagnostics,
                                 String errorMessage, SourceSpan errorSpan, String sourceText,
                                 String astTree, boolean fromCache) {
        this.success = success;
        this.renderedText = renderedText;
        this.diagnostics = diagnostics != null
                ? Collections.unmodifiableList(new ArrayList<>(diagnostics))
                : Collections.emptyList();
        this.errorMessage = errorMessage;
        this.errorSpan = errorSpan;
        this.sourceText = sourceText;
        this.astTree = astTree;
        this.fromCache = fromCache;
    }

    /**
     * Creates a successful result from a fresh render.
     */
    public static TransformationResult success(String sourceText, String renderedText, List<Diagnostic> diagnostics) {
        return new TransformationResult(true, renderedText, diagnostics, null, null, sourceText, null, false);
    }

    /**
     * Creates a successful result with AST tree.
     */
    public static TransformationResult successWithAst(String sourceText, String renderedText,
                                                      List<Diagnostic> diagnostics, String astTree) {
        return new TransformationResult(true, renderedText, diagnostics, null, null, sourceText, astTree, false);
    }

    /**
     * Creates a successful result served from the cache.
     */
    public static TransformationResult cached(String sourceText, String renderedText, List<Diagnostic> diagnostics) {
        return new TransformationResult(true, renderedText, diagnostics, null, null, sourceText, null, true);
    }

    /**
     * Creates a failed result.
     */
    public static TransformationResult failure(String sourceText, String errorMessage) {
        return new TransformationResult(false, null, null, errorMessage, SourceSpan.UNKNOWN, sourceText, null, false);
    }

    /**
     * Creates a failed result from an exception. A malformed tree keeps its source span.
     */
    public static TransformationResult failure(String sourceText, TransformationException exception) {
        SourceSpan span = exception instanceof MalformedInputException
                ? ((MalformedInputException) exception).getSpan()
                : SourceSpan.UNKNOWN;
        return new TransformationResult(false, null, null, exception.getDetailedMessage(), span,
                sourceText, null, false);
    }

    public boolean isSuccess() {
        return success;
    }

    public boolean isFailure() {
        return !success;
    }

    public String getRenderedText() {
        return renderedText;
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    public boolean hasDiagnostics(DiagnosticCode code) {
        return countDiagnostics(code) > 0;
    }

    public int countDiagnostics(DiagnosticCode code) {
        int count = 0;
        for (Diagnostic diagnostic : diagnostics) {
            if (diagnostic.getCode() == code) {
                count++;
            }
        }
        return count;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public SourceSpan getErrorSpan() {
        return errorSpan;
    }

    public String getSourceText() {
        return sourceText;
    }

    public String getAstTree() {
        return astTree;
    }

    public boolean hasAstTree() {
        return astTree != null;
    }

    public boolean isFromCache() {
        return fromCache;
    }

    @Override
    public String toString() {
        if (success) {
            return "TransformationResult{success=true, diagnostics=" + diagnostics.size() +
                   (fromCache ? ", fromCache=true" : "") +
                   (astTree != null ? ", hasAstTree=true" : "") + "}";
        } else {
            return "TransformationResult{success=false, error='" + errorMessage + "'}";
        }
    }
}
