package com.softcheck.functions;

import com.softcheck.functions.BuiltinSignature.Overload;
import com.softcheck.types.TypeTag;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

import static com.softcheck.types.TypeLattice.ANY;
import static com.softcheck.types.TypeLattice.NUM;
import static com.softcheck.types.TypeLattice.NUM_AND_BOOL;
import static com.softcheck.types.TypeLattice.expectation;

/**
 * Registry of built-in function signatures.
 *
 * <p>Function categories:
 * <ul>
 *   <li>Aggregates: sum, avg, count, min, max, prd, stddev, var, first, last</li>
 *   <li>Running/moving aggregates: sums, avgs, mins, maxs, prds, deltas, ratios</li>
 *   <li>Positional: prev, next, fills, reverse, distinct, drop</li>
 *   <li>Math: abs, sqrt, exp, log, mod</li>
 *   <li>Predicates and strings: between, like, concat</li>
 *   <li>Miscellaneous: show, make_null</li>
 * </ul>
 *
 * <p>Running aggregates take an optional leading window size, e.g. {@code avgs(10, price)}.
 * Numeric aggregates accept booleans in their value slot, counted as 0/1.
 * Functions whose result depends on runtime column types return {@link TypeTag#UNKNOWN}.
 *
 * @see FunctionEnvironment
 */
public final class FunctionRegistry {

    private static final Set<TypeTag> STR = expectation(TypeTag.STRING);

    private static final List<BuiltinSignature> BUILTINS = new ArrayList<>();

    static {
        initializeAggregateFunctions();
        initializeRunningFunctions();
        initializePositionalFunctions();
        initializeMathFunctions();
        initializePredicateFunctions();
        initializeMiscFunctions();
    }

    private FunctionRegistry() {
        // Utility class - prevent instantiation
    }

    /**
     * Returns a builder pre-populated with every built-in signature.
     *
     * @return a new builder; callers may register further signatures on it
     */
    public static FunctionEnvironment.Builder builtins() {
        FunctionEnvironment.Builder builder = FunctionEnvironment.builder();
        for (BuiltinSignature signature : BUILTINS) {
            builder.register(signature);
        }
        return builder;
    }

    /**
     * Returns the built-in signatures, in registration order.
     */
    public static List<BuiltinSignature> signatures() {
        return Collections.unmodifiableList(BUILTINS);
    }

    private static void register(String name, Overload... overloads) {
        BUILTINS.add(BuiltinSignature.of(name, overloads));
    }

    // ==================== Aggregate Functions ====================

    private static void initializeAggregateFunctions() {
        // booleans count as 0/1, e.g. sum(price > 10)
        for (String name : List.of("sum", "avg", "min", "max", "prd", "stddev", "var")) {
            register(name, Overload.of(TypeTag.NUMERIC, NUM_AND_BOOL));
        }
        register("count", Overload.of(TypeTag.NUMERIC, ANY));

        // first(x) / first(n, x): leading element(s)
        register("first", Overload.of(TypeTag.UNKNOWN, ANY), Overload.of(TypeTag.UNKNOWN, NUM, ANY));
        register("last", Overload.of(TypeTag.UNKNOWN, ANY), Overload.of(TypeTag.UNKNOWN, NUM, ANY));
    }

    // ==================== Running / Moving Functions ====================

    private static void initializeRunningFunctions() {
        for (String name : List.of("sums", "avgs", "mins", "maxs", "prds")) {
            register(name,
                Overload.of(TypeTag.NUMERIC, NUM_AND_BOOL),
                Overload.of(TypeTag.NUMERIC, NUM, NUM_AND_BOOL));
        }
        register("deltas", Overload.of(TypeTag.NUMERIC, NUM_AND_BOOL));
        register("ratios", Overload.of(TypeTag.NUMERIC, NUM_AND_BOOL));
    }

    // ==================== Positional Functions ====================

    private static void initializePositionalFunctions() {
        register("prev", Overload.of(TypeTag.UNKNOWN, ANY));
        register("next", Overload.of(TypeTag.UNKNOWN, ANY));
        register("fills", Overload.of(TypeTag.UNKNOWN, ANY));
        register("reverse", Overload.of(TypeTag.UNKNOWN, ANY));
        register("distinct", Overload.of(TypeTag.UNKNOWN, ANY));
        register("drop", Overload.of(TypeTag.UNKNOWN, NUM, ANY));
    }

    // ==================== Math Functions ====================

    private static void initializeMathFunctions() {
        for (String name : List.of("abs", "sqrt", "exp", "log")) {
            register(name, Overload.of(TypeTag.NUMERIC, NUM));
        }
        register("mod", Overload.of(TypeTag.NUMERIC, NUM, NUM));
    }

    // ==================== Predicates and Strings ====================

    private static void initializePredicateFunctions() {
        register("between", Overload.of(TypeTag.BOOLEAN, NUM, NUM, NUM));
        register("like", Overload.of(TypeTag.BOOLEAN, STR, STR));
        register("concat", Overload.variadic(TypeTag.STRING, STR, STR, STR));
    }

    // ==================== Miscellaneous ====================

    private static void initializeMiscFunctions() {
        register("show", Overload.of(TypeTag.UNKNOWN, ANY));
        register("make_null", Overload.of(TypeTag.UNKNOWN, ANY));
    }
}
