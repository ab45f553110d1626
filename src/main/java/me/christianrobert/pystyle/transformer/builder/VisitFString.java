package me.christianrobert.pystyle.transformer.builder;

import me.christianrobert.pystyle.transformer.ast.Constant;
import me.christianrobert.pystyle.transformer.ast.FString;
import me.christianrobert.pystyle.transformer.ast.SyntaxNode;
import me.christianrobert.pystyle.transformer.mapping.ConstructKind;
import me.christianrobert.pystyle.transformer.mapping.MappingEntry;

import java.util.ArrayList;
import java.util.List;

/**
 * Static helper for rendering interpolated strings.
 *
 * <pre>
 * f"Hello, {self.name}! 100%"   -&gt;   String.format("Hello, %s! 100%%", this.name)
 * f"plain"                      -&gt;   "plain"
 * </pre>
 *
 * <p>Interpolations become {@code %s} placeholders, left to right; a literal {@code %} is doubled.</p>
 */
public class VisitFString {

    public static String v(FString node, JavaStyleCodeBuilder b) {
        StringBuilder format = new StringBuilder();
        StringBuilder plain = new StringBuilder();
        List<String> arguments = new ArrayList<>();

        // STEP 1: Literal segments and placeholders
        for (SyntaxNode part : node.getParts()) {
            if (FString.isLiteralSegment(part)) {
                String text = (String) ((Constant) part).getValue();
                format.append(TextLiterals.escapeFormat(text));
                plain.append(text);
            } else {
                format.append("%s");
                arguments.add(b.visit(part));
            }
        }

        // STEP 2: No interpolation, no formatting
        if (arguments.isEmpty()) {
            return TextLiterals.quote(plain.toString());
        }

        // STEP 3: Format call through the literal row
        List<String> formatArguments = new ArrayList<>();
        formatArguments.add(TextLiterals.quote(format.toString()));
        formatArguments.addAll(arguments);
        MappingEntry entry = b.mappingTable().lookup(ConstructKind.LITERAL, "FSTRING");
        if (entry == null) {
            b.reportUnmapped(node, "Interpolated string has no mapping");
            return "String.format(" + String.join(", ", formatArguments) + ") /* unmapped */";
        }
        return b.use(entry).render(formatArguments);
    }
}
