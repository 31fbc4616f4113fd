package com.softcheck.analysis;

import com.softcheck.functions.FunctionEnvironment;
import com.softcheck.functions.FunctionRegistry;
import com.softcheck.functions.UserFunctionSignature;
import com.softcheck.statement.Program;
import com.softcheck.statement.UserFunction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Builds the function environment of a program before analysis starts.
 *
 * <p>Every user-defined function of the program is registered up front with an
 * arity-only signature, so calls can be checked regardless of declaration order,
 * including forward and mutually recursive references.
 */
public final class EnvironmentBuilder {

    private static final Logger logger = LoggerFactory.getLogger(EnvironmentBuilder.class);

    private EnvironmentBuilder() {
        // Utility class - prevent instantiation
    }

    /**
     * Builds the environment of a program on top of the built-in functions.
     *
     * @param program the program
     * @return the immutable environment
     */
    public static FunctionEnvironment build(Program program) {
        return build(program, FunctionRegistry.builtins());
    }

    /**
     * Builds the environment of a program on top of {@code base}.
     *
     * <p>A user function replaces any signature already registered under its name,
     * and a later declaration replaces an earlier one.
     *
     * @param program the program
     * @param base the signatures available before the program's own functions
     * @return the immutable environment
     */
    public static FunctionEnvironment build(Program program, FunctionEnvironment.Builder base) {
        Objects.requireNonNull(program, "program must not be null");
        Objects.requireNonNull(base, "base must not be null");

        int registered = 0;
        for (UserFunction function : program.userFunctions()) {
            if (base.contains(function.name())) {
                logger.debug("User function {} replaces an existing signature", function.name());
            }
            base.register(function.name(), new UserFunctionSignature(function.name(), function.arity()));
            registered++;
        }

        FunctionEnvironment environment = base.build();
        logger.debug("Function environment built: {} user functions, {} signatures total",
            registered, environment.size());
        return environment;
    }
}
