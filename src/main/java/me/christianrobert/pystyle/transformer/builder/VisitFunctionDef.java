package me.christianrobert.pystyle.transformer.builder;

import me.christianrobert.pystyle.transformer.ast.Decorator;
import me.christianrobert.pystyle.transformer.ast.FunctionDef;
import me.christianrobert.pystyle.transformer.ast.NodeKind;
import me.christianrobert.pystyle.transformer.ast.ReturnStatement;
import me.christianrobert.pystyle.transformer.ast.SyntaxNode;
import me.christianrobert.pystyle.transformer.context.RenderState;
import me.christianrobert.pystyle.transformer.mapping.ConstructKind;
import me.christianrobert.pystyle.transformer.mapping.MappingEntry;
import me.christianrobert.pystyle.transformer.type.Scope;
import me.christianrobert.pystyle.transformer.type.TypeInferenceEngine;

import java.util.ArrayList;
import java.util.List;

/**
 * Static helper for rendering function and method definitions.
 *
 * <h3>Kinds of definitions:</h3>
 * <ul>
 *   <li>module function: {@code public static T name(params)}</li>
 *   <li>instance method: {@code public T name(params)}, receiver omitted, receiver renders as {@code this}</li>
 *   <li>{@code @staticmethod}: {@code public static T name(params)}, all parameters kept</li>
 *   <li>{@code @classmethod}: {@code public static T name(params)}, receiver omitted, renders as the class name</li>
 *   <li>{@code __init__}: constructor named after the class, no return type</li>
 *   <li>magic methods ({@code __str__}, {@code __eq__}, ...): renamed through the mapping table</li>
 *   <li>function nested in a function: emitted in place, no modifiers</li>
 * </ul>
 *
 * <h3>Return type, first match wins:</h3>
 * <ol>
 *   <li>return annotation, mapped through the type-name rows</li>
 *   <li>{@code void} when no {@code return} carries a value</li>
 *   <li>declared return type of the magic method mapping</li>
 *   <li>inferred type of the first returned expression</li>
 * </ol>
 */
public class VisitFunctionDef {

    private static final String CONSTRUCTOR_NAME = "__init__";
    private static final String STATICMETHOD = "staticmethod";
    private static final String CLASSMETHOD = "classmethod";

    public static String v(FunctionDef node, JavaStyleCodeBuilder b) {
        RenderFrame enclosing = b.frame();
        boolean inClass = enclosing.getState() == RenderState.CLASS_BODY;
        boolean nested = enclosing.getState() == RenderState.FUNCTION_BODY
                || enclosing.getState() == RenderState.BLOCK_BODY;
        boolean staticMethod = inClass && TypeInferenceEngine.isStaticMethod(node);
        boolean classMethod = inClass && TypeInferenceEngine.isClassMethod(node);
        boolean constructor = inClass && CONSTRUCTOR_NAME.equals(node.getName());
        String receiver = TypeInferenceEngine.receiverNameOf(node, inClass);

        StringBuilder result = new StringBuilder();
        String indent = b.indent();

        // STEP 1: Decorators other than the ones expressed as modifiers
        for (Decorator decorator : node.getDecorators()) {
            String name = decorator.getSimpleName();
            if (inClass && (STATICMETHOD.equals(name) || CLASSMETHOD.equals(name))) {
                continue;
            }
            result.append(indent).append(b.visit(decorator)).append("\n");
        }

        // STEP 2: Modifiers
        result.append(indent);
        if (b.addAccessModifiers() && !nested) {
            result.append("public ");
        }
        if (!nested && (!inClass || staticMethod || classMethod)) {
            result.append("static ");
        }

        // STEP 3: Frame for the body; the receiver renders as this (or the class name)
        Scope scope = b.scopeFor(node, Scope.ScopeKind.FUNCTION, node.getName(), classMethod ? null : receiver);
        RenderFrame frame;
        if (receiver != null) {
            frame = RenderFrame.function(scope, enclosing.getClassName(), receiver,
                    classMethod ? enclosing.getClassName() : "this");
        } else {
            // nested functions see the receiver of the method they are defined in
            frame = RenderFrame.function(scope, enclosing.getClassName(), enclosing.getReceiverName(),
                    enclosing.getReceiverText());
        }

        // STEP 4: Return type and name
        if (constructor) {
            result.append(enclosing.getClassName());
        } else {
            MappingEntry magic = inClass
                    ? b.mappingTable().lookup(ConstructKind.MAGIC_METHOD, node.getName())
                    : null;
            b.enterFrame(frame);
            String returnType = returnTypeOf(node, magic, b);
            b.exitFrame();
            result.append(returnType).append(" ");
            result.append(magic != null ? b.use(magic).getTemplate().getPattern() : node.getName());
        }

        // STEP 5: Parameters (the receiver is not one)
        b.enterFrame(frame);
        List<String> parameters = new ArrayList<>();
        for (int i = 0; i < node.getParameters().size(); i++) {
            if (i == 0 && receiver != null) {
                continue;
            }
            parameters.add(b.visit(node.getParameters().get(i)));
        }
        result.append("(").append(String.join(", ", parameters)).append(") {\n");

        // STEP 6: Body
        result.append(b.renderBody(node.getBody()));
        b.exitFrame();

        result.append(indent).append("}\n");
        return result.toString();
    }

    private static String returnTypeOf(FunctionDef node, MappingEntry magic, JavaStyleCodeBuilder b) {
        String annotation = node.getReturnAnnotation();
        if (annotation != null) {
            MappingEntry typeName = b.mappingTable().lookup(ConstructKind.TYPE_NAME, annotation);
            if (typeName == null) {
                // a class of the module, or a type we know nothing about
                return annotation;
            }
            String javaType = b.use(typeName).getTemplate().getPattern();
            b.registerTypeImports(javaType);
            return javaType;
        }

        ReturnStatement firstReturn = findValueReturn(node.getBody());
        if (firstReturn == null) {
            return "void";
        }
        if (magic != null && magic.getReturnType() != null) {
            return b.javaType(magic.getReturnType());
        }
        return b.javaType(b.typeOf(firstReturn.getValue()));
    }

    /**
     * First {@code return} with a value in the body, not looking into nested definitions.
     */
    private static ReturnStatement findValueReturn(List<SyntaxNode> statements) {
        for (SyntaxNode statement : statements) {
            ReturnStatement found = findValueReturn(statement);
            if (found != null) {
                return found;
            }
        }
        return null;
    }

    private static ReturnStatement findValueReturn(SyntaxNode node) {
        if (node.getKind() == NodeKind.RETURN) {
            ReturnStatement returnStatement = (ReturnStatement) node;
            return returnStatement.hasValue() ? returnStatement : null;
        }
        if (node.getKind() == NodeKind.FUNCTION_DEF || node.getKind() == NodeKind.CLASS_DEF
                || !node.getKind().isStatement()) {
            return null;
        }
        return findValueReturn(node.getChildren());
    }
}
