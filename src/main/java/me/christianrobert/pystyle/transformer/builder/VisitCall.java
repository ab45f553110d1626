package me.christianrobert.pystyle.transformer.builder;

import me.christianrobert.pystyle.transformer.ast.Call;
import me.christianrobert.pystyle.transformer.ast.SyntaxNode;
import me.christianrobert.pystyle.transformer.mapping.BuiltinMappings;
import me.christianrobert.pystyle.transformer.mapping.ConstructKind;
import me.christianrobert.pystyle.transformer.mapping.MappingEntry;
import me.christianrobert.pystyle.transformer.mapping.OperandVariant;
import me.christianrobert.pystyle.transformer.type.TypeEnvironment;

import java.util.ArrayList;
import java.util.List;

/**
 * Static helper for rendering calls.
 *
 * <h3>Resolution order:</h3>
 * <ol>
 *   <li>class defined in the module: {@code new Name(args)}</li>
 *   <li>builtin with a mapping entry for (name, arity, first argument variant): the entry's template</li>
 *   <li>{@code sum}, {@code any}, {@code all} of one argument: accumulation loop ({@link ReductionLoop})</li>
 *   <li>any other builtin: verbatim call followed by an unmapped marker comment</li>
 *   <li>everything else (module functions, methods, callables): plain call</li>
 * </ol>
 *
 * <p>Names defined by the module shadow builtins of the same name.
 * Cases 3 and 4 report one unmapped-construct diagnostic each.</p>
 */
public class VisitCall {

    public static String v(Call node, JavaStyleCodeBuilder b) {
        String name = node.getFunctionName();
        TypeEnvironment environment = b.environment();

        // STEP 1: Arguments
        List<String> arguments = new ArrayList<>();
        for (SyntaxNode argument : node.getArguments()) {
            arguments.add(b.visit(argument));
        }

        // STEP 2: Constructor call of a module class
        if (name != null && environment.isModuleClass(name)) {
            return "new " + name + "(" + String.join(", ", arguments) + ")";
        }

        // STEP 3: Builtins
        if (name != null && !environment.isUserDefined(name) && BuiltinMappings.isKnownBuiltin(name)) {
            return renderBuiltin(node, name, arguments, b);
        }

        // STEP 4: Plain call
        return b.visit(node.getFunction()) + "(" + String.join(", ", arguments) + ")";
    }

    private static String renderBuiltin(Call node, String name, List<String> arguments, JavaStyleCodeBuilder b) {
        OperandVariant variant = node.getArguments().isEmpty()
                ? OperandVariant.ANY
                : OperandVariant.of(b.typeOf(node.getArguments().get(0)));
        MappingEntry entry = b.mappingTable().lookup(ConstructKind.BUILTIN_CALL, name, arguments.size(), variant);
        if (entry != null) {
            return b.use(entry).render(arguments);
        }

        if (BuiltinMappings.isLoopReduction(name) && arguments.size() == 1) {
            b.reportUnmapped(node, "Builtin '" + name + "' has no mapping; rendered as an accumulation loop");
            return ReductionLoop.render(name, node.getArguments().get(0), arguments.get(0), b);
        }

        b.reportUnmapped(node, "Builtin '" + name + "' with " + arguments.size()
                + " argument(s) has no mapping; rendered verbatim");
        return name + "(" + String.join(", ", arguments) + ") /* unmapped */";
    }
}
