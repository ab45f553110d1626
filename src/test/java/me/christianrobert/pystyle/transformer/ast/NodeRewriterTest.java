package me.christianrobert.pystyle.transformer.ast;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static me.christianrobert.pystyle.transformer.Nodes.*;
import static org.junit.jupiter.api.Assertions.*;

class NodeRewriterTest {

    @Test
    void identityReplacerReturnsSameTree() {
        ModuleNode module = module(assign("x", integer(1)), expr(call("print", name("x"))));

        ModuleNode rewritten = NodeRewriter.rewrite(module, (node, scopeId) -> node);

        assertSame(module, rewritten);
    }

    @Test
    void replacedLeafRebuildsOnlyItsAncestors() {
        // Given: two statements, only the second contains the identifier to rename
        Assign untouched = assign("x", integer(1));
        ExprStmt printed = expr(call("print", name("old")));
        ModuleNode module = module(untouched, printed);

        // When
        ModuleNode rewritten = NodeRewriter.rewrite(module, (node, scopeId) ->
                node instanceof Identifier && "old".equals(((Identifier) node).getName())
                        ? new Identifier("renamed", node.getSpan())
                        : node);

        // Then
        assertNotSame(module, rewritten);
        assertSame(untouched, rewritten.getBody().get(0));
        Call call = (Call) ((ExprStmt) rewritten.getBody().get(1)).getExpression();
        assertEquals("renamed", ((Identifier) call.getArguments().get(0)).getName());
    }

    @Test
    void replacerSeesEnclosingScopeIds() {
        ModuleNode module = module(
                classDef("Greeter",
                        def("greet", params("self"), expr(call("print", text("hi"))))));
        List<String> scopesOfCalls = new ArrayList<>();

        NodeRewriter.rewrite(module, (node, scopeId) -> {
            if (node instanceof Call) {
                scopesOfCalls.add(scopeId);
            }
            return node;
        });

        assertEquals(1, scopesOfCalls.size());
        assertEquals("<module>.Greeter.greet", scopesOfCalls.get(0));
    }
}
