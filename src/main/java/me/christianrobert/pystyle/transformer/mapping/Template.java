package me.christianrobert.pystyle.transformer.mapping;

import java.util.List;
import java.util.Objects;

/**
 * Target-dialect rendering pattern with positional placeholders.
 *
 * <ul>
 *   <li>{@code {0}}, {@code {1}}, ... : the rendered argument at that position</li>
 *   <li>{@code {*}} : all arguments joined with {@code ", "}</li>
 *   <li>{@code {+}} : all arguments joined as text concatenation ({@code a + " " + b})</li>
 * </ul>
 *
 * <p>Any other brace content is copied verbatim.</p>
 */
public class Template {

    private static final String CONCAT_SEPARATOR = " + \" \" + ";

    private final String pattern;
    private final int requiredArguments;

    public Template(String pattern) {
        this.pattern = Objects.requireNonNull(pattern, "pattern");
        this.requiredArguments = highestIndex(pattern) + 1;
    }

    public static Template of(String pattern) {
        return new Template(pattern);
    }

    public String getPattern() {
        return pattern;
    }

    /**
     * Number of positional arguments the pattern references ({@code {2}} needs three).
     */
    public int getRequiredArguments() {
        return requiredArguments;
    }

    public boolean accepts(int argumentCount) {
        return argumentCount >= requiredArguments;
    }

    /**
     * Substitutes the rendered arguments into the pattern.
     *
     * @throws IllegalArgumentException if fewer arguments are given than the pattern references
     */
    public String render(List<String> arguments) {
        if (!accepts(arguments.size())) {
            throw new IllegalArgumentException("Template '" + pattern + "' needs " + requiredArguments
                    + " arguments, got " + arguments.size());
        }
        StringBuilder result = new StringBuilder();
        int i = 0;
        while (i < pattern.length()) {
            char c = pattern.charAt(i);
            int close = c == '{' ? pattern.indexOf('}', i) : -1;
            if (close < 0) {
                result.append(c);
                i++;
                continue;
            }
            String token = pattern.substring(i + 1, close);
            if ("*".equals(token)) {
                result.append(String.join(", ", arguments));
            } else if ("+".equals(token)) {
                result.append(String.join(CONCAT_SEPARATOR, arguments));
            } else if (isIndex(token)) {
                result.append(arguments.get(Integer.parseInt(token)));
            } else {
                result.append(pattern, i, close + 1);
            }
            i = close + 1;
        }
        return result.toString();
    }

    private static int highestIndex(String pattern) {
        int highest = -1;
        int open = pattern.indexOf('{');
        while (open >= 0) {
            int close = pattern.indexOf('}', open);
            if (close < 0) {
                break;
            }
            String token = pattern.substring(open + 1, close);
            if (isIndex(token)) {
                highest = Math.max(highest, Integer.parseInt(token));
            }
            open = pattern.indexOf('{', close);
        }
        return highest;
    }

    private static boolean isIndex(String token) {
        if (token.isEmpty() || token.length() > 2) {
            return false;
        }
        for (int i = 0; i < token.length(); i++) {
            if (!Character.isDigit(token.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return pattern.equals(((Template) o).pattern);
    }

    @Override
    public int hashCode() {
        return pattern.hashCode();
    }

    @Override
    public String toString() {
        return pattern;
    }
}
