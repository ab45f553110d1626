package me.christianrobert.pystyle.transformer.ast;

import java.util.List;

/**
 * Binary arithmetic, bitwise or boolean operation.
 */
public class BinaryOp extends SyntaxNode {

    public enum Operator {
        ADD("+"),
        SUB("-"),
        MULT("*"),
        DIV("/"),
        MOD("%"),
        POW("**"),
        FLOOR_DIV("//"),
        LSHIFT("<<"),
        RSHIFT(">>"),
        BIT_OR("|"),
        BIT_XOR("^"),
        BIT_AND("&"),
        MAT_MULT("@"),
        AND("and"),
        OR("or");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        /**
         * Operator as written in the origin language.
         */
        public String getSymbol() {
            return symbol;
        }
    }

    private final SyntaxNode left;
    private final Operator operator;
    private final SyntaxNode right;

    public BinaryOp(SyntaxNode left, Operator operator, SyntaxNode right, SourceSpan span) {
        super(NodeKind.BINARY_OP, span);
        this.left = left;
        this.operator = operator;
        this.right = right;
    }

    public SyntaxNode getLeft() {
        return left;
    }

    public Operator getOperator() {
        return operator;
    }

    public SyntaxNode getRight() {
        return right;
    }

    @Override
    public <R> R accept(SyntaxVisitor<R> visitor) {
        return visitor.visitBinaryOp(this);
    }

    @Override
    public List<SyntaxNode> getChildren() {
        return children(left, right);
    }

    @Override
    public String describe() {
        return "BinaryOp " + (operator != null ? operator.getSymbol() : "?");
    }
}
