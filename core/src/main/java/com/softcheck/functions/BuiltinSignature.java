package com.softcheck.functions;

import com.softcheck.types.TypeLattice;
import com.softcheck.types.TypeTag;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Signature of a built-in function, given as an explicit list of overloads.
 *
 * <p>The first overload accepting the argument types decides the return type.
 * An argument of unknown type is accepted by every parameter slot.
 */
public final class BuiltinSignature implements CallSignature {

    /**
     * One accepted combination of argument types.
     *
     * @param parameters expectation per fixed parameter slot
     * @param variadic expectation for each extra trailing argument, or null if none are allowed
     * @param returnType the type returned when this overload matches
     */
    public record Overload(List<Set<TypeTag>> parameters, Set<TypeTag> variadic, TypeTag returnType) {

        public Overload {
            parameters = List.copyOf(Objects.requireNonNull(parameters, "parameters must not be null"));
            Objects.requireNonNull(returnType, "returnType must not be null");
        }

        /**
         * Creates a fixed-arity overload.
         */
        @SafeVarargs
        public static Overload of(TypeTag returnType, Set<TypeTag>... parameters) {
            return new Overload(List.of(parameters), null, returnType);
        }

        /**
         * Creates an overload accepting any number of additional {@code variadic} arguments
         * after the fixed ones.
         */
        @SafeVarargs
        public static Overload variadic(TypeTag returnType, Set<TypeTag> variadic, Set<TypeTag>... parameters) {
            return new Overload(List.of(parameters), Objects.requireNonNull(variadic, "variadic must not be null"),
                returnType);
        }

        /**
         * Returns true if this overload accepts the argument types.
         *
         * @param argumentTypes the argument types, in call order
         * @return true on match
         */
        public boolean accepts(List<TypeTag> argumentTypes) {
            if (variadic == null ? argumentTypes.size() != parameters.size()
                                 : argumentTypes.size() < parameters.size()) {
                return false;
            }
            for (int i = 0; i < argumentTypes.size(); i++) {
                Set<TypeTag> expected = i < parameters.size() ? parameters.get(i) : variadic;
                if (!TypeLattice.tagMatches(expected, argumentTypes.get(i))) {
                    return false;
                }
            }
            return true;
        }
    }

    private final String functionName;
    private final List<Overload> overloads;

    /**
     * Creates a built-in signature.
     *
     * @param functionName the function name
     * @param overloads the accepted overloads, in priority order
     */
    public BuiltinSignature(String functionName, List<Overload> overloads) {
        this.functionName = Objects.requireNonNull(functionName, "functionName must not be null");
        this.overloads = new ArrayList<>(Objects.requireNonNull(overloads, "overloads must not be null"));
        if (this.overloads.isEmpty()) {
            throw new IllegalArgumentException("at least one overload is required for " + functionName);
        }
    }

    public static BuiltinSignature of(String functionName, Overload... overloads) {
        return new BuiltinSignature(functionName, List.of(overloads));
    }

    @Override
    public String functionName() {
        return functionName;
    }

    public List<Overload> overloads() {
        return Collections.unmodifiableList(overloads);
    }

    @Override
    public Optional<TypeTag> apply(List<TypeTag> argumentTypes) {
        Objects.requireNonNull(argumentTypes, "argumentTypes must not be null");
        for (Overload overload : overloads) {
            if (overload.accepts(argumentTypes)) {
                return Optional.of(overload.returnType());
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return "BuiltinSignature(" + functionName + ", " + overloads.size() + " overloads)";
    }
}
