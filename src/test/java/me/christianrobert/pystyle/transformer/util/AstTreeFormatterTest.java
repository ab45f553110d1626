package me.christianrobert.pystyle.transformer.util;

import me.christianrobert.pystyle.config.model.ConversionConfig;
import me.christianrobert.pystyle.transformer.ast.Assign;
import me.christianrobert.pystyle.transformer.ast.Constant;
import me.christianrobert.pystyle.transformer.ast.Identifier;
import me.christianrobert.pystyle.transformer.ast.ModuleNode;
import me.christianrobert.pystyle.transformer.ast.SourceSpan;
import me.christianrobert.pystyle.transformer.context.DiagnosticsCollector;
import me.christianrobert.pystyle.transformer.mapping.BuiltinMappings;
import me.christianrobert.pystyle.transformer.plugin.PluginChain;
import me.christianrobert.pystyle.transformer.type.TypeEnvironment;
import me.christianrobert.pystyle.transformer.type.TypeInferenceEngine;
import org.junit.jupiter.api.Test;

import java.util.Collections;

import static me.christianrobert.pystyle.transformer.Nodes.*;
import static org.junit.jupiter.api.Assertions.*;

class AstTreeFormatterTest {

    private static ModuleNode assignment() {
        Assign assign = new Assign(
                new Identifier("x", new SourceSpan(1, 0, 1, 1)),
                Constant.ofInteger(1, new SourceSpan(1, 4, 1, 5)),
                new SourceSpan(1, 0, 1, 5));
        return new ModuleNode(Collections.singletonList(assign));
    }

    private static TypeEnvironment infer(ModuleNode module) {
        return new TypeInferenceEngine(BuiltinMappings.defaultTable(), PluginChain.EMPTY,
                ConversionConfig.defaults(), new DiagnosticsCollector()).infer(module);
    }

    @Test
    void formatsTreeWithSpans() {
        String formatted = AstTreeFormatter.format(assignment());

        assertEquals("MODULE\n"
                + "  ASSIGN (line 1, col 0-5)\n"
                + "    Identifier x (line 1, col 0-1)\n"
                + "    Constant INTEGER 1 (line 1, col 4-5)\n", formatted);
    }

    @Test
    void expressionsCarryInferredTypes() {
        ModuleNode module = assignment();

        String formatted = AstTreeFormatter.format(module, infer(module));

        assertTrue(formatted.contains("    Identifier x (line 1, col 0-1) [TYPE: Integer]\n"));
        assertTrue(formatted.contains("    Constant INTEGER 1 (line 1, col 4-5) [TYPE: Integer]\n"));
        assertFalse(formatted.contains("ASSIGN (line 1, col 0-5) [TYPE"));
    }

    @Test
    void functionBodiesAreTypedInTheirOwnScope() {
        ModuleNode module = module(def("f", paramList(param("n", null, "str")), ret(name("n"))));

        String formatted = AstTreeFormatter.format(module, infer(module));

        assertTrue(formatted.contains("Identifier n"));
        assertTrue(formatted.contains("[TYPE: Text]"));
    }

    @Test
    void longTextIsEscapedAndTruncated() {
        String longText = "first line\nsecond line that goes on and on and on and on and on";
        ModuleNode module = new ModuleNode(Collections.singletonList(
                expr(Constant.ofText(longText, SourceSpan.UNKNOWN))));

        String formatted = AstTreeFormatter.format(module);

        assertTrue(formatted.contains("Constant TEXT first line\\nsecond line"));
        assertTrue(formatted.contains("..."));
        assertFalse(formatted.contains("on and on and on and on and on"));
    }

    @Test
    void nullTree() {
        assertEquals("(null tree)", AstTreeFormatter.format(null));
    }
}
