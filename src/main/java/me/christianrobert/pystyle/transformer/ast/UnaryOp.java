package me.christianrobert.pystyle.transformer.ast;

import java.util.List;

public class UnaryOp extends SyntaxNode {

    public enum Operator {
        NOT("not"),
        NEGATE("-"),
        PLUS("+"),
        INVERT("~");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String getSymbol() {
            return symbol;
        }
    }

    private final Operator operator;
    private final SyntaxNode operand;

    public UnaryOp(Operator operator, SyntaxNode operand, SourceSpan span) {
        super(NodeKind.UNARY_OP, span);
        this.operator = operator;
        this.operand = operand;
    }

    public Operator getOperator() {
        return operator;
    }

    public SyntaxNode getOperand() {
        return operand;
    }

    @Override
    public <R> R accept(SyntaxVisitor<R> visitor) {
        return visitor.visitUnaryOp(this);
    }

    @Override
    public List<SyntaxNode> getChildren() {
        return children(operand);
    }

    @Override
    public String describe() {
        return "UnaryOp " + (operator != null ? operator.getSymbol() : "?");
    }
}
