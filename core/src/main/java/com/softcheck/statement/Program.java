package com.softcheck.statement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An ordered sequence of top-level statements, as produced by the parser.
 */
public final class Program {

    private final List<Statement> statements;

    public Program(List<Statement> statements) {
        this.statements = new ArrayList<>(Objects.requireNonNull(statements, "statements must not be null"));
    }

    public static Program of(Statement... statements) {
        return new Program(List.of(statements));
    }

    public List<Statement> statements() {
        return Collections.unmodifiableList(statements);
    }

    /**
     * Returns the user-defined functions declared in this program, in declaration order.
     *
     * @return the function declarations
     */
    public List<UserFunction> userFunctions() {
        List<UserFunction> functions = new ArrayList<>();
        for (Statement statement : statements) {
            if (statement instanceof UserFunction function) {
                functions.add(function);
            }
        }
        return functions;
    }

    public int size() {
        return statements.size();
    }

    @Override
    public String toString() {
        return "Program(" + statements.size() + " statements)";
    }
}
