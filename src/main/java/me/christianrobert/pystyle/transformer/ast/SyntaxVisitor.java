package me.christianrobert.pystyle.transformer.ast;

/**
 * Exhaustive visitor over the closed set of node variants.
 *
 * <p>Every stage that walks the tree (validation, plugin rewriting, inference,
 * rendering, tree dumps) implements this interface, so adding a variant fails
 * to compile until each stage handles it.</p>
 *
 * @param <R> result type of a visit
 */
public interface SyntaxVisitor<R> {

    R visitModule(ModuleNode node);

    R visitClassDef(ClassDef node);

    R visitFunctionDef(FunctionDef node);

    R visitParameter(Parameter node);

    R visitDecorator(Decorator node);

    R visitAssign(Assign node);

    R visitAugAssign(AugAssign node);

    R visitIf(IfStatement node);

    R visitFor(ForStatement node);

    R visitWhile(WhileStatement node);

    R visitReturn(ReturnStatement node);

    R visitExprStmt(ExprStmt node);

    R visitCall(Call node);

    R visitBinaryOp(BinaryOp node);

    R visitUnaryOp(UnaryOp node);

    R visitCompare(Compare node);

    R visitConstant(Constant node);

    R visitIdentifier(Identifier node);

    R visitAttribute(Attribute node);

    R visitListLiteral(ListLiteral node);

    R visitDictLiteral(DictLiteral node);

    R visitComprehension(Comprehension node);

    R visitFString(FString node);
}
