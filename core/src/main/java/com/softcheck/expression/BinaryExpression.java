package com.softcheck.expression;

import java.util.List;
import java.util.Objects;

/**
 * Expression representing a binary operation (operation with two operands).
 *
 * <p>Binary expressions include:
 * <ul>
 *   <li>Logical: a AND b, a OR b</li>
 *   <li>Ordering: a &lt; b, a &lt;= b, a &gt; b, a &gt;= b</li>
 *   <li>Equality: a = b, a != b</li>
 *   <li>Arithmetic: a + b, a - b, a * b, a / b, a ^ b</li>
 * </ul>
 */
public final class BinaryExpression implements Expression {

    /**
     * Binary operators.
     */
    public enum Operator {
        // Logical operators
        AND("AND", "logical AND"),
        OR("OR", "logical OR"),

        // Ordering operators
        LESS_THAN("<", "less than"),
        LESS_THAN_OR_EQUAL("<=", "less than or equal"),
        GREATER_THAN(">", "greater than"),
        GREATER_THAN_OR_EQUAL(">=", "greater than or equal"),

        // Equality operators
        EQUAL("=", "equal"),
        NOT_EQUAL("!=", "not equal"),

        // Arithmetic operators
        ADD("+", "addition"),
        SUBTRACT("-", "subtraction"),
        MULTIPLY("*", "multiplication"),
        DIVIDE("/", "division"),
        POWER("^", "exponentiation");

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

        public boolean isLogical() {
            return this == AND || this == OR;
        }

        public boolean isOrdering() {
            return this == LESS_THAN || this == LESS_THAN_OR_EQUAL ||
                   this == GREATER_THAN || this == GREATER_THAN_OR_EQUAL;
        }

        public boolean isEquality() {
            return this == EQUAL || this == NOT_EQUAL;
        }

        public boolean isArithmetic() {
            return this == ADD || this == SUBTRACT || this == MULTIPLY ||
                   this == DIVIDE || this == POWER;
        }
    }

    private final Expression left;
    private final Operator operator;
    private final Expression right;
    private final SourcePosition position;

    /**
     * Creates a binary expression.
     *
     * @param left the left operand
     * @param operator the operator
     * @param right the right operand
     * @param position the source position of the operator
     */
    public BinaryExpression(Expression left, Operator operator, Expression right, SourcePosition position) {
        this.left = Objects.requireNonNull(left, "left must not be null");
        this.operator = Objects.requireNonNull(operator, "operator must not be null");
        this.right = Objects.requireNonNull(right, "right must not be null");
        this.position = Objects.requireNonNull(position, "position must not be null");
    }

    public BinaryExpression(Expression left, Operator operator, Expression right) {
        this(left, operator, right, SourcePosition.UNKNOWN);
    }

    public Expression left() {
        return left;
    }

    public Operator operator() {
        return operator;
    }

    public Expression right() {
        return right;
    }

    @Override
    public SourcePosition position() {
        return position;
    }

    @Override
    public List<Expression> children() {
        return List.of(left, right);
    }

    @Override
    public String toSource() {
        return String.format("(%s %s %s)", left.toSource(), operator.symbol(), right.toSource());
    }

    @Override
    public String toString() {
        return toSource();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof BinaryExpression)) return false;
        BinaryExpression that = (BinaryExpression) obj;
        return Objects.equals(left, that.left) &&
               operator == that.operator &&
               Objects.equals(right, that.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(left, operator, right);
    }

    // ==================== Factory Methods ====================

    public static BinaryExpression and(Expression left, Expression right) {
        return new BinaryExpression(left, Operator.AND, right);
    }

    public static BinaryExpression or(Expression left, Expression right) {
        return new BinaryExpression(left, Operator.OR, right);
    }

    public static BinaryExpression lessThan(Expression left, Expression right) {
        return new BinaryExpression(left, Operator.LESS_THAN, right);
    }

    public static BinaryExpression greaterThan(Expression left, Expression right) {
        return new BinaryExpression(left, Operator.GREATER_THAN, right);
    }

    public static BinaryExpression equal(Expression left, Expression right) {
        return new BinaryExpression(left, Operator.EQUAL, right);
    }

    public static BinaryExpression notEqual(Expression left, Expression right) {
        return new BinaryExpression(left, Operator.NOT_EQUAL, right);
    }

    public static BinaryExpression add(Expression left, Expression right) {
        return new BinaryExpression(left, Operator.ADD, right);
    }

    public static BinaryExpression multiply(Expression left, Expression right) {
        return new BinaryExpression(left, Operator.MULTIPLY, right);
    }
}
