package me.christianrobert.pystyle.transformer.builder;

import me.christianrobert.pystyle.config.model.ConversionConfig;
import me.christianrobert.pystyle.transformer.ast.BinaryOp;
import me.christianrobert.pystyle.transformer.ast.Compare;
import me.christianrobert.pystyle.transformer.ast.Decorator;
import me.christianrobert.pystyle.transformer.ast.Identifier;
import me.christianrobert.pystyle.transformer.ast.ModuleNode;
import me.christianrobert.pystyle.transformer.ast.NodeKind;
import me.christianrobert.pystyle.transformer.context.DiagnosticCode;
import me.christianrobert.pystyle.transformer.mapping.BuiltinMappings;
import me.christianrobert.pystyle.transformer.plugin.PluginChain;
import me.christianrobert.pystyle.transformer.plugin.PluginRegistry;
import me.christianrobert.pystyle.transformer.plugin.TestPlugin;
import me.christianrobert.pystyle.transformer.service.ConversionOutput;
import me.christianrobert.pystyle.transformer.service.ConversionPipeline;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static me.christianrobert.pystyle.transformer.Nodes.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Rendering tests, run through the full pipeline without a package declaration.
 */
class JavaStyleCodeBuilderTest {

    private static final ConversionConfig NO_PACKAGE = ConversionConfig.builder()
            .addPackageDeclaration(false)
            .build();

    private ConversionOutput render(ModuleNode module) {
        return render(module, NO_PACKAGE, PluginChain.EMPTY);
    }

    private ConversionOutput render(ModuleNode module, ConversionConfig config, PluginChain chain) {
        return new ConversionPipeline(BuiltinMappings.defaultTable(), chain, config).run(module);
    }

    // ========== CLASS TESTS ==========

    @Test
    void classWithConstructorAndMethod() {
        // Given
        ModuleNode module = module(classDef("Person",
                def("__init__", params("self", "name"),
                        assign(attr("self", "name"), name("name"))),
                def("greet", params("self"),
                        ret(fstring(text("Hello "), attr("self", "name"), text("!"))))));

        // When
        ConversionOutput output = render(module);

        // Then
        String expected = "public class Person {\n"
                + "    private Object name;\n"
                + "\n"
                + "    public Person(Object name) {\n"
                + "        this.name = name;\n"
                + "    }\n"
                + "\n"
                + "    public String greet() {\n"
                + "        return String.format(\"Hello %s!\", this.name);\n"
                + "    }\n"
                + "}\n";
        assertEquals(expected, output.getRenderedText());
        assertTrue(output.getDiagnostics().isEmpty());
    }

    @Test
    void moduleClassIsInstantiatedWithNew() {
        ModuleNode module = module(
                classDef("Point"),
                assign("p", call("Point", integer(1), integer(2))));

        String rendered = render(module).getRenderedText();

        assertTrue(rendered.contains("public class Point {\n}\n"));
        assertTrue(rendered.contains("Object p = new Point(1, 2);"));
    }

    @Test
    void staticMethodHasNoReceiver() {
        ModuleNode module = module(classDef("MathUtil",
                def("twice", paramList(param("n", null, "int")),
                        Collections.singletonList(decorator("staticmethod")), "int",
                        ret(binary(name("n"), BinaryOp.Operator.MULT, integer(2))))));

        String rendered = render(module).getRenderedText();

        assertEquals("public class MathUtil {\n"
                + "    public static int twice(int n) {\n"
                + "        return (n * 2);\n"
                + "    }\n"
                + "}\n", rendered);
    }

    @Test
    void accessModifiersCanBeDisabled() {
        ConversionConfig config = NO_PACKAGE.toBuilder().addAccessModifiers(false).build();
        ModuleNode module = module(
                def("add", paramList(param("a", null, "int"), param("b", null, "int")),
                        Collections.<Decorator>emptyList(), "int",
                        ret(binary(name("a"), BinaryOp.Operator.ADD, name("b")))));

        String rendered = render(module, config, PluginChain.EMPTY).getRenderedText();

        assertEquals("static int add(int a, int b) {\n    return (a + b);\n}\n", rendered);
    }

    @Test
    void classBaseListSkipsObject() {
        ModuleNode module = module(classDef("Dog", Arrays.asList("object", "Animal", "Comparable")));

        String rendered = render(module).getRenderedText();

        assertTrue(rendered.startsWith("public class Dog extends Animal implements Comparable {"));
    }

    // ========== BUILTIN CALL TESTS ==========

    @Test
    void lenDependsOnOperandType() {
        ModuleNode module = module(
                assign("s", text("abc")),
                assign("xs", list(integer(1), integer(2))),
                assign("a", call("len", name("s"))),
                assign("b", call("len", name("xs"))));

        String rendered = render(module).getRenderedText();

        assertEquals("import java.util.ArrayList;\n"
                + "import java.util.List;\n"
                + "\n"
                + "String s = \"abc\";\n"
                + "List<Integer> xs = new ArrayList<>();\n"
                + "xs.add(1);\n"
                + "xs.add(2);\n"
                + "int a = s.length();\n"
                + "int b = xs.size();\n", rendered);
    }

    @Test
    void printJoinsArgumentsWithSpaces() {
        ModuleNode module = module(expr(call("print", text("a"), integer(1))));

        assertEquals("System.out.println(\"a\" + \" \" + 1);\n", render(module).getRenderedText());
    }

    @Test
    void printWithoutArgumentsPrintsEmptyLine() {
        ConversionOutput output = render(module(expr(call("print"))));

        assertEquals("System.out.println();\n", output.getRenderedText());
        assertTrue(output.getDiagnostics().isEmpty());
    }

    @Test
    void roundIsNarrowedToDeclaredInt() {
        ModuleNode module = module(
                assign("y", decimal(2.5)),
                assign("r", call("round", name("y"))));

        assertTrue(render(module).getRenderedText().contains("int r = (int) Math.round(y);"));
    }

    @Test
    void sumRendersAnAccumulationLoop() {
        // Given
        ModuleNode module = module(
                assign("items", list(integer(1), integer(2), integer(3))),
                assign("total", call("sum", name("items"))));

        // When
        ConversionOutput output = render(module);

        // Then
        assertTrue(output.getRenderedText().contains("int _sum0 = 0;\n"
                + "for (int _item0 : items) {\n"
                + "    _sum0 += _item0;\n"
                + "}\n"
                + "Object total = _sum0;\n"));
        assertEquals(1, output.getDiagnostics().size());
        assertEquals(DiagnosticCode.UNMAPPED_CONSTRUCT, output.getDiagnostics().get(0).getCode());
    }

    @Test
    void builtinWithoutMappingIsMarkedAndReported() {
        ModuleNode module = module(
                assign("xs", list(integer(3), integer(1))),
                assign("ys", call("sorted", name("xs"))));

        ConversionOutput output = render(module);

        assertTrue(output.getRenderedText().contains("sorted(xs) /* unmapped */"));
        assertEquals(1, output.getDiagnostics().size());
        assertTrue(output.getDiagnostics().get(0).getMessage().contains("sorted"));
    }

    @Test
    void mappingImportsAreCollected() {
        ModuleNode module = module(
                assign("xs", list(integer(3), integer(1))),
                assign("m", call("max", name("xs"))));

        String rendered = render(module).getRenderedText();

        assertTrue(rendered.contains("import java.util.Collections;\n"));
        assertTrue(rendered.contains("Collections.max(xs)"));
    }

    @Test
    void userFunctionShadowingBuiltinIsCalledPlainly() {
        ModuleNode module = module(
                def("len", params("x"), ret(integer(0))),
                expr(call("len", text("abc"))));

        String rendered = render(module).getRenderedText();

        assertTrue(rendered.contains("len(\"abc\");"));
        assertFalse(rendered.contains(".length()"));
    }

    // ========== EXPRESSION TESTS ==========

    @Test
    void formattedStringEscapesPercent() {
        ModuleNode module = module(
                assign("rate", integer(5)),
                assign("msg", fstring(name("rate"), text("% done"))),
                assign("plain", fstring(text("no placeholders"))));

        String rendered = render(module).getRenderedText();

        assertTrue(rendered.contains("String msg = String.format(\"%s%% done\", rate);"));
        assertTrue(rendered.contains("String plain = \"no placeholders\";"));
    }

    @Test
    void textEqualityUsesEquals() {
        ModuleNode module = module(
                assign("s", text("a")),
                assign("same", compare(name("s"), Compare.Operator.EQ, text("a"))));

        assertTrue(render(module).getRenderedText().contains("boolean same = s.equals(\"a\");"));
    }

    @Test
    void literalsComeFromTheMappingTable() {
        ModuleNode module = module(
                assign("flag", bool(true)),
                assign("nothing", none()));

        String rendered = render(module).getRenderedText();

        assertTrue(rendered.contains("boolean flag = true;"));
        assertTrue(rendered.contains("Object nothing = null;"));
    }

    // ========== COMPREHENSION TESTS ==========

    @Test
    void listComprehensionPopulatesTarget() {
        ModuleNode module = module(
                assign("nums", list(integer(1), integer(2))),
                assign("squares", listComp(binary(name("x"), BinaryOp.Operator.MULT, name("x")), "x",
                        name("nums"))));

        String rendered = render(module).getRenderedText();

        assertTrue(rendered.contains("List<Integer> squares = new ArrayList<>();\n"
                + "for (int x : nums) {\n"
                + "    squares.add((x * x));\n"
                + "}\n"));
    }

    @Test
    void comprehensionOverItsOwnTargetFillsTemporary() {
        // Given
        ModuleNode module = module(
                assign("xs", list(integer(1), integer(2))),
                assign("xs", listComp(binary(name("x"), BinaryOp.Operator.MULT, integer(2)), "x", name("xs"))));

        // When
        String rendered = render(module).getRenderedText();

        // Then
        assertTrue(rendered.endsWith("List<Integer> _comp0 = new ArrayList<>();\n"
                + "for (int x : xs) {\n"
                + "    _comp0.add((x * 2));\n"
                + "}\n"
                + "xs = _comp0;\n"));
        assertFalse(rendered.contains("xs = new ArrayList<>();\nfor"));
    }

    @Test
    void listLiteralReadingItsTargetFillsTemporary() {
        ModuleNode module = module(
                assign("xs", list(integer(1), integer(2))),
                assign("xs", list(call("len", name("xs")), integer(9))));

        String rendered = render(module).getRenderedText();

        assertTrue(rendered.endsWith("List<Integer> _list0 = new ArrayList<>();\n"
                + "_list0.add(xs.size());\n"
                + "_list0.add(9);\n"
                + "xs = _list0;\n"));
    }

    @Test
    void memberTargetReadInsideLiteralFillsTemporary() {
        ModuleNode module = module(classDef("Bag",
                def("grow", params("self"),
                        assign(attr("self", "items"), list(attr("self", "items"))))));

        String rendered = render(module).getRenderedText();

        assertTrue(rendered.contains("_list0.add(this.items);\n"));
        assertTrue(rendered.contains("this.items = _list0;\n"));
    }

    @Test
    void comprehensionConditionsBecomeIf() {
        ModuleNode module = module(
                assign("nums", list(integer(1), integer(2))),
                assign("evens", listComp(name("n"), "n", name("nums"),
                        compare(binary(name("n"), BinaryOp.Operator.MOD, integer(2)), Compare.Operator.EQ,
                                integer(0)))));

        String rendered = render(module).getRenderedText();

        assertTrue(rendered.contains("for (int n : nums) {\n"
                + "    if ((n % 2) == 0) {\n"
                + "        evens.add(n);\n"
                + "    }\n"
                + "}\n"));
    }

    @Test
    void generatorIsReportedAsEagerList() {
        ModuleNode module = module(
                assign("nums", list(integer(1))),
                assign("gen", generator(name("x"), "x", name("nums"))));

        ConversionOutput output = render(module);

        assertEquals(1, output.getDiagnostics().size());
        assertEquals(DiagnosticCode.UNMAPPED_CONSTRUCT, output.getDiagnostics().get(0).getCode());
        assertTrue(output.getRenderedText().contains("gen.add(x);"));
    }

    // ========== CONTROL FLOW TESTS ==========

    @Test
    void countedRangeBecomesIndexLoop() {
        ModuleNode module = module(forLoop("i", call("range", integer(3)),
                expr(call("print", name("i")))));

        assertEquals("for (int i = 0; i < 3; i++) {\n    System.out.println(i);\n}\n",
                render(module).getRenderedText());
    }

    @Test
    void indentSizeIsConfigurable() {
        ConversionConfig config = NO_PACKAGE.toBuilder().indentSize(2).build();
        ModuleNode module = module(forLoop("i", call("range", integer(1), integer(3)),
                expr(call("print", name("i")))));

        assertEquals("for (int i = 1; i < 3; i++) {\n  System.out.println(i);\n}\n",
                render(module, config, PluginChain.EMPTY).getRenderedText());
    }

    @Test
    void elifChainIsFlattened() {
        // Given
        ModuleNode module = module(
                assign("x", integer(5)),
                ifThen(compare(name("x"), Compare.Operator.GT, integer(0)),
                        block(expr(call("print", text("pos")))),
                        block(ifThen(compare(name("x"), Compare.Operator.LT, integer(0)),
                                block(expr(call("print", text("neg")))),
                                block(expr(call("print", text("zero"))))))));

        // When
        String rendered = render(module).getRenderedText();

        // Then
        assertEquals("int x = 5;\n"
                + "if (x > 0) {\n"
                + "    System.out.println(\"pos\");\n"
                + "} else if (x < 0) {\n"
                + "    System.out.println(\"neg\");\n"
                + "} else {\n"
                + "    System.out.println(\"zero\");\n"
                + "}\n", rendered);
    }

    @Test
    void whileConditionWithHoistedLoopIsRecomputedEachIteration() {
        // Given
        ModuleNode module = module(
                assign("flags", list(bool(true))),
                whileLoop(call("any", name("flags")),
                        assign("flags", list(bool(false)))));

        // When
        String rendered = render(module).getRenderedText();

        // Then
        assertTrue(rendered.endsWith("while (true) {\n"
                + "    boolean _any0 = false;\n"
                + "    for (boolean _item0 : flags) {\n"
                + "        if (_item0) {\n"
                + "            _any0 = true;\n"
                + "            break;\n"
                + "        }\n"
                + "    }\n"
                + "    if (!(_any0)) {\n"
                + "        break;\n"
                + "    }\n"
                + "    flags = new ArrayList<>();\n"
                + "    flags.add(false);\n"
                + "}\n"));
    }

    @Test
    void plainWhileConditionStaysInHeader() {
        ModuleNode module = module(
                assign("n", integer(3)),
                whileLoop(compare(name("n"), Compare.Operator.GT, integer(0)),
                        augAssign(name("n"), BinaryOp.Operator.SUB, integer(1))));

        assertTrue(render(module).getRenderedText().contains("while (n > 0) {\n"));
    }

    @Test
    void elifConditionWithHoistedLoopNestsUnderElse() {
        // Given
        ModuleNode module = module(
                assign("x", integer(5)),
                assign("flags", list(bool(true))),
                ifThen(compare(name("x"), Compare.Operator.GT, integer(10)),
                        block(expr(call("print", text("big")))),
                        block(ifThen(call("any", name("flags")),
                                block(expr(call("print", text("flagged")))),
                                block(expr(call("print", text("other"))))))));

        // When
        String rendered = render(module).getRenderedText();

        // Then
        assertTrue(rendered.endsWith("if (x > 10) {\n"
                + "    System.out.println(\"big\");\n"
                + "} else {\n"
                + "    boolean _any0 = false;\n"
                + "    for (boolean _item0 : flags) {\n"
                + "        if (_item0) {\n"
                + "            _any0 = true;\n"
                + "            break;\n"
                + "        }\n"
                + "    }\n"
                + "    if (_any0) {\n"
                + "        System.out.println(\"flagged\");\n"
                + "    } else {\n"
                + "        System.out.println(\"other\");\n"
                + "    }\n"
                + "}\n"));
    }

    @Test
    void docstringBecomesLineComments() {
        ModuleNode module = module(expr(text("Module docs\nsecond line")));

        assertEquals("// Module docs\n// second line\n", render(module).getRenderedText());
    }

    // ========== MODULE HEADER TESTS ==========

    @Test
    void packageDeclarationComesFirst() {
        ModuleNode module = module(assign("xs", list(integer(1))));

        String rendered = render(module, ConversionConfig.defaults(), PluginChain.EMPTY).getRenderedText();

        assertTrue(rendered.startsWith("package pythva.generated;\n\nimport java.util.ArrayList;\n"));
    }

    @Test
    void customPackageName() {
        ConversionConfig config = ConversionConfig.builder().packageName("com.example.out").build();

        String rendered = render(module(assign("x", integer(1))), config, PluginChain.EMPTY).getRenderedText();

        assertEquals("package com.example.out;\n\nint x = 1;\n", rendered);
    }

    // ========== RENDER HOOK TESTS ==========

    @Test
    void beforeRenderCanSubstituteNodes() {
        PluginRegistry registry = new PluginRegistry();
        registry.register(TestPlugin.of("renamer", r -> r.beforeRender(0, (node, value, ctx) ->
                node instanceof Identifier && "old".equals(((Identifier) node).getName()) ? name("renamed") : value)));

        String rendered = render(module(expr(call("print", name("old")))), NO_PACKAGE, registry.getChain())
                .getRenderedText();

        assertEquals("System.out.println(renamed);\n", rendered);
    }

    @Test
    void afterRenderCanRewriteFragments() {
        PluginRegistry registry = new PluginRegistry();
        registry.register(TestPlugin.of("shout", r -> r.afterRender(0, (node, text, ctx) ->
                node.getKind() == NodeKind.CONSTANT ? text.toUpperCase() : text)));

        String rendered = render(module(expr(call("print", text("hi")))), NO_PACKAGE, registry.getChain())
                .getRenderedText();

        assertEquals("System.out.println(\"HI\");\n", rendered);
    }

    @Test
    void faultingBeforeRenderLeavesOutputUnchanged() {
        // Given
        ModuleNode module = module(
                assign("nums", list(integer(1), integer(2))),
                assign("squares", listComp(binary(name("x"), BinaryOp.Operator.MULT, name("x")), "x",
                        name("nums"))),
                classDef("Point",
                        def("__init__", params("self", "x"),
                                assign(attr("self", "x"), name("x")))),
                expr(call("print", name("squares"))));
        PluginRegistry registry = new PluginRegistry();
        registry.register(TestPlugin.of("broken", r -> r.beforeRender(0, (node, value, ctx) -> {
            throw new IllegalStateException("broken handler");
        })));

        // When
        String baseline = render(module).getRenderedText();
        ConversionOutput faulted = render(module, NO_PACKAGE, registry.getChain());

        // Then
        assertEquals(baseline, faulted.getRenderedText());
        assertFalse(faulted.getDiagnostics().isEmpty());
        assertTrue(faulted.getDiagnostics().stream()
                .allMatch(d -> d.getCode() == DiagnosticCode.PLUGIN_FAULT));
    }
}
