package me.christianrobert.pystyle.transformer.ast;

import me.christianrobert.pystyle.transformer.context.MalformedInputException;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static me.christianrobert.pystyle.transformer.Nodes.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the rooted-tree checks that run before any other stage.
 */
class TreeValidatorTest {

    @Test
    void wellFormedModulePasses() {
        ModuleNode module = module(
                assign("x", integer(1)),
                def("f", params("a"), ret(binary(name("a"), BinaryOp.Operator.ADD, name("x")))),
                expr(call("f", integer(2))));

        assertSame(module, TreeValidator.validate(module));
    }

    @Test
    void emptyModulePasses() {
        ModuleNode module = new ModuleNode(Collections.<SyntaxNode>emptyList());

        assertSame(module, TreeValidator.validate(module));
    }

    @Test
    void nullRootIsRejected() {
        MalformedInputException e = assertThrows(MalformedInputException.class,
                () -> TreeValidator.validate(null));

        assertTrue(e.getMessage().contains("null root"));
    }

    @Test
    void rootMustBeModule() {
        SyntaxNode notAModule = assign("x", integer(1));

        MalformedInputException e = assertThrows(MalformedInputException.class,
                () -> TreeValidator.validate(notAModule));

        assertTrue(e.getMessage().contains("Root node must be a Module"));
        assertEquals(notAModule.getSpan(), e.getSpan());
    }

    @Test
    void sharedNodeIsRejected() {
        // Given: the same constant instance used by two statements
        Constant shared = integer(42);
        ModuleNode module = module(assign("a", shared), assign("b", shared));

        // When / Then
        MalformedInputException e = assertThrows(MalformedInputException.class,
                () -> TreeValidator.validate(module));
        assertTrue(e.getMessage().contains("reachable more than once"));
        assertEquals(shared.getSpan(), e.getSpan());
    }

    @Test
    void repeatedStatementIsRejected() {
        ExprStmt statement = expr(call("print", text("hi")));
        ModuleNode module = new ModuleNode(Arrays.<SyntaxNode>asList(statement, statement));

        assertThrows(MalformedInputException.class, () -> TreeValidator.validate(module));
    }

    @Test
    void nestedModuleIsRejected() {
        ModuleNode inner = module(assign("x", integer(1)));
        ModuleNode outer = new ModuleNode(Collections.<SyntaxNode>singletonList(inner));

        MalformedInputException e = assertThrows(MalformedInputException.class,
                () -> TreeValidator.validate(outer));

        assertTrue(e.getMessage().contains("nested Module"));
    }

    @Test
    void missingChildIsRejected() {
        Assign broken = new Assign(name("x"), null, span());

        MalformedInputException e = assertThrows(MalformedInputException.class,
                () -> TreeValidator.validate(module(broken)));

        assertTrue(e.getMessage().contains("missing assigned value"));
        assertEquals(broken.getSpan(), e.getSpan());
    }

    @Test
    void expressionInStatementSlotIsRejected() {
        ModuleNode module = new ModuleNode(Collections.<SyntaxNode>singletonList(integer(1)));

        MalformedInputException e = assertThrows(MalformedInputException.class,
                () -> TreeValidator.validate(module));

        assertTrue(e.getMessage().contains("expected STATEMENT"));
    }

    @Test
    void parameterOutsideItsSlotIsRejected() {
        ModuleNode module = module(expr(call("f", param("a"))));

        assertThrows(MalformedInputException.class, () -> TreeValidator.validate(module));
    }

    @Test
    void assignmentToCallIsRejected() {
        ModuleNode module = module(assign(call("f"), integer(1)));

        MalformedInputException e = assertThrows(MalformedInputException.class,
                () -> TreeValidator.validate(module));

        assertTrue(e.getMessage().contains("assignment target"));
    }
}
