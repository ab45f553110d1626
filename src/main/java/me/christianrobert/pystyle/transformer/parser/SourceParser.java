package me.christianrobert.pystyle.transformer.parser;

import me.christianrobert.pystyle.transformer.ast.ModuleNode;

/**
 * Seam to the external front-end that turns source text into the node model.
 *
 * <p>Implementations report syntax errors by throwing
 * {@link me.christianrobert.pystyle.transformer.context.MalformedInputException}.
 * Any other runtime exception is treated as an unexpected failure of the run.</p>
 */
public interface SourceParser {

    /**
     * Parses a complete module.
     *
     * @param source Source text, never null
     * @return Root of the syntax tree
     */
    ModuleNode parse(String source);
}
