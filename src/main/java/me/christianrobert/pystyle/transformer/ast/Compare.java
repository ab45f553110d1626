package me.christianrobert.pystyle.transformer.ast;

import java.util.List;

/**
 * Comparison chain {@code left op1 c1 op2 c2 ...}; {@code operators} and
 * {@code comparators} have the same length.
 */
public class Compare extends SyntaxNode {

    public enum Operator {
        EQ("=="),
        NOT_EQ("!="),
        LT("<"),
        LT_E("<="),
        GT(">"),
        GT_E(">="),
        IS("is"),
        IS_NOT("is not"),
        IN("in"),
        NOT_IN("not in");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String getSymbol() {
            return symbol;
        }
    }

    private final SyntaxNode left;
    private final List<Operator> operators;
    private final List<SyntaxNode> comparators;

    public Compare(SyntaxNode left, List<Operator> operators, List<SyntaxNode> comparators, SourceSpan span) {
        super(NodeKind.COMPARE, span);
        this.left = left;
        this.operators = immutableCopy(operators);
        this.comparators = immutableCopy(comparators);
    }

    public SyntaxNode getLeft() {
        return left;
    }

    public List<Operator> getOperators() {
        return operators;
    }

    public List<SyntaxNode> getComparators() {
        return comparators;
    }

    @Override
    public <R> R accept(SyntaxVisitor<R> visitor) {
        return visitor.visitCompare(this);
    }

    @Override
    public List<SyntaxNode> getChildren() {
        return children(left, comparators);
    }
}
