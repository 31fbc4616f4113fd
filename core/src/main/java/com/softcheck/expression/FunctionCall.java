package com.softcheck.expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Expression representing a function call.
 *
 * <p>Function calls invoke built-in or user-defined functions with zero or more arguments.
 *
 * <p>Examples:
 * <pre>
 *   sums(price)             -- running sum
 *   avgs(3, price)          -- moving average
 *   my_udf(a, b)            -- user-defined function
 * </pre>
 *
 * <p>Which signature applies is decided at analysis time through the
 * {@link com.softcheck.functions.FunctionEnvironment}; an unknown name is not an error.
 */
public final class FunctionCall implements Expression {

    private final String functionName;
    private final List<Expression> arguments;
    private final SourcePosition position;

    /**
     * Creates a function call expression.
     *
     * @param functionName the function name
     * @param arguments the function arguments
     * @param position the source position
     */
    public FunctionCall(String functionName, List<Expression> arguments, SourcePosition position) {
        this.functionName = Objects.requireNonNull(functionName, "functionName must not be null");
        if (this.functionName.trim().isEmpty()) {
            throw new IllegalArgumentException("functionName must not be empty");
        }
        this.arguments = new ArrayList<>(Objects.requireNonNull(arguments, "arguments must not be null"));
        this.position = Objects.requireNonNull(position, "position must not be null");
    }

    public FunctionCall(String functionName, List<Expression> arguments) {
        this(functionName, arguments, SourcePosition.UNKNOWN);
    }

    public String functionName() {
        return functionName;
    }

    /**
     * Returns the function arguments.
     *
     * @return an unmodifiable list of arguments
     */
    public List<Expression> arguments() {
        return Collections.unmodifiableList(arguments);
    }

    @Override
    public SourcePosition position() {
        return position;
    }

    @Override
    public List<Expression> children() {
        return arguments();
    }

    @Override
    public String toSource() {
        List<String> args = new ArrayList<>();
        for (Expression arg : arguments) {
            args.add(arg.toSource());
        }
        return functionName + "(" + String.join(", ", args) + ")";
    }

    @Override
    public String toString() {
        return toSource();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof FunctionCall)) return false;
        FunctionCall that = (FunctionCall) obj;
        return Objects.equals(functionName, that.functionName) &&
               Objects.equals(arguments, that.arguments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(functionName, arguments);
    }

    // ==================== Factory Methods ====================

    public static FunctionCall of(String functionName, Expression... arguments) {
        return new FunctionCall(functionName, List.of(arguments));
    }
}
