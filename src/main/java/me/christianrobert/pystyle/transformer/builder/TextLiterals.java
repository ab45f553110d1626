package me.christianrobert.pystyle.transformer.builder;

/**
 * Quoting of text literals for the target dialect.
 */
public final class TextLiterals {

    private TextLiterals() {
    }

    /**
     * Double-quoted literal with backslash escapes.
     */
    public static String quote(String text) {
        StringBuilder result = new StringBuilder(text.length() + 2);
        result.append('"');
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '"':
                    result.append("\\\"");
                    break;
                case '\\':
                    result.append("\\\\");
                    break;
                case '\n':
                    result.append("\\n");
                    break;
                case '\r':
                    result.append("\\r");
                    break;
                case '\t':
                    result.append("\\t");
                    break;
                default:
                    result.append(c);
            }
        }
        result.append('"');
        return result.toString();
    }

    /**
     * Escapes {@code %} for use inside a {@code String.format} pattern.
     */
    public static String escapeFormat(String text) {
        return text.replace("%", "%%");
    }
}
