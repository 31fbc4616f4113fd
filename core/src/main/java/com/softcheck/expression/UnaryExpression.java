package com.softcheck.expression;

import java.util.List;
import java.util.Objects;

/**
 * Expression representing a unary operation.
 *
 * <p>Examples:
 * <pre>
 *   -price          -- arithmetic negation
 *   NOT active      -- logical negation
 * </pre>
 */
public final class UnaryExpression implements Expression {

    /**
     * Unary operators.
     */
    public enum Operator {
        NEGATE("-", "negation"),
        NOT("NOT", "logical NOT");

        private final String symbol;
        private final String description;

        Operator(String symbol, String description) {
            this.symbol = symbol;
            this.description = description;
        }

        public String symbol() {
            return symbol;
        }

        public String description() {
            return description;
        }
    }

    private final Operator operator;
    private final Expression operand;
    private final SourcePosition position;

    /**
     * Creates a unary expression.
     *
     * @param operator the operator
     * @param operand the operand
     * @param position the source position
     */
    public UnaryExpression(Operator operator, Expression operand, SourcePosition position) {
        this.operator = Objects.requireNonNull(operator, "operator must not be null");
        this.operand = Objects.requireNonNull(operand, "operand must not be null");
        this.position = Objects.requireNonNull(position, "position must not be null");
    }

    public UnaryExpression(Operator operator, Expression operand) {
        this(operator, operand, SourcePosition.UNKNOWN);
    }

    public Operator operator() {
        return operator;
    }

    public Expression operand() {
        return operand;
    }

    @Override
    public SourcePosition position() {
        return position;
    }

    @Override
    public List<Expression> children() {
        return List.of(operand);
    }

    @Override
    public String toSource() {
        if (operator == Operator.NOT) {
            return "(NOT " + operand.toSource() + ")";
        }
        return "(" + operator.symbol() + operand.toSource() + ")";
    }

    @Override
    public String toString() {
        return toSource();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof UnaryExpression)) return false;
        UnaryExpression that = (UnaryExpression) obj;
        return operator == that.operator &&
               Objects.equals(operand, that.operand);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, operand);
    }

    // ==================== Factory Methods ====================

    public static UnaryExpression negate(Expression operand) {
        return new UnaryExpression(Operator.NEGATE, operand);
    }

    public static UnaryExpression not(Expression operand) {
        return new UnaryExpression(Operator.NOT, operand);
    }
}
