package me.christianrobert.pystyle.transformer.builder;

import me.christianrobert.pystyle.transformer.ast.ModuleNode;
import me.christianrobert.pystyle.transformer.type.Scope;

/**
 * Static helper for rendering the module: the root of every conversion.
 *
 * <h3>Output layout:</h3>
 * <pre>
 * package pythva.generated;
 *
 * import java.util.ArrayList;
 * import java.util.List;
 *
 * ...module statements, at depth 0...
 * </pre>
 *
 * <h3>Notes:</h3>
 * <ul>
 *   <li>Module-level statements are emitted as they are, without a wrapper class</li>
 *   <li>The import list is only known after the body has been rendered, so the body goes first</li>
 *   <li>Imports are sorted and deduplicated</li>
 * </ul>
 */
public class VisitModule {

    public static String v(ModuleNode node, JavaStyleCodeBuilder b) {
        // STEP 1: Body (collects the imports of every mapping entry used)
        Scope scope = b.scopeFor(node, Scope.ScopeKind.MODULE, null, null);
        b.enterFrame(RenderFrame.module(scope));
        String body = b.renderStatements(node.getBody());
        b.exitFrame();

        StringBuilder result = new StringBuilder();

        // STEP 2: Package declaration
        if (b.config().isAddPackageDeclaration()) {
            result.append("package ").append(b.config().getPackageName()).append(";\n\n");
        }

        // STEP 3: Imports
        if (!b.getImports().isEmpty()) {
            for (String qualifiedName : b.getImports()) {
                result.append("import ").append(qualifiedName).append(";\n");
            }
            result.append("\n");
        }

        // STEP 4: Body
        result.append(body);
        return result.toString();
    }
}
