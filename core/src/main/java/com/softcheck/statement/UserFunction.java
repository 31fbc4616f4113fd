package com.softcheck.statement;

import com.softcheck.expression.Expression;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A user-defined function declaration.
 *
 * <pre>
 *   FUNCTION spread(bid, ask) {
 *     mid := (bid + ask) / 2;
 *     ask - mid
 *   }
 * </pre>
 *
 * <p>The body is evaluated without a table context.
 */
public final class UserFunction implements Statement {

    /**
     * A statement in a function body.
     */
    public sealed interface BodyStatement permits ExpressionStatement, Assignment {

        /**
         * Returns the expression evaluated by this statement.
         */
        Expression expression();
    }

    /**
     * A plain expression statement.
     *
     * @param expression the expression
     */
    public record ExpressionStatement(Expression expression) implements BodyStatement {
        public ExpressionStatement {
            Objects.requireNonNull(expression, "expression must not be null");
        }
    }

    /**
     * A local assignment {@code name := expression}.
     *
     * @param name the assigned local
     * @param expression the value
     */
    public record Assignment(String name, Expression expression) implements BodyStatement {
        public Assignment {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(expression, "expression must not be null");
        }
    }

    private final String name;
    private final List<String> parameters;
    private final List<BodyStatement> body;

    /**
     * Creates a function declaration.
     *
     * @param name the function name
     * @param parameters the formal parameter names
     * @param body the body statements, in order
     */
    public UserFunction(String name, List<String> parameters, List<BodyStatement> body) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.parameters = new ArrayList<>(Objects.requireNonNull(parameters, "parameters must not be null"));
        this.body = new ArrayList<>(Objects.requireNonNull(body, "body must not be null"));
    }

    public String name() {
        return name;
    }

    public List<String> parameters() {
        return Collections.unmodifiableList(parameters);
    }

    public int arity() {
        return parameters.size();
    }

    public List<BodyStatement> body() {
        return Collections.unmodifiableList(body);
    }

    @Override
    public String toString() {
        return "UserFunction(" + name + "/" + parameters.size() + ")";
    }
}
