package me.christianrobert.pystyle.transformer.context;

/**
 * Exception thrown when a conversion cannot complete.
 * Captures the source text and a short description of where the pipeline was.
 */
public class TransformationException extends RuntimeException {

    private final String sourceText;
    private final String context;

    public TransformationException(String message) {
        super(message);
        this.sourceText = null;
        this.context = null;
    }

    public TransformationException(String message, Throwable cause) {
        super(message, cause);
        this.sourceText = null;
        this.context = null;
    }

    public TransformationException(String message, String sourceText, String context) {
        super(message);
        this.sourceText = sourceText;
        this.context = context;
    }

    public String getSourceText() {
        return sourceText;
    }

    public String getContext() {
        return context;
    }

    /**
     * Gets a detailed error message including context.
     */
    public String getDetailedMessage() {
        StringBuilder sb = new StringBuilder(getMessage());
        if (context != null) {
            sb.append("\nContext: ").append(context);
        }
        return sb.toString();
    }
}
