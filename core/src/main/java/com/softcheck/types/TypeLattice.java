package com.softcheck.types;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Compatibility rules and named expectation sets for {@link TypeTag}.
 *
 * <p>An expectation is a set of acceptable tags. {@link TypeTag#UNKNOWN} is
 * compatible in both directions: an unknown actual type satisfies every
 * expectation, and an expectation containing unknown accepts every actual type.
 * This is what keeps the check "soft".
 */
public final class TypeLattice {

    /** Boolean operands: logical connectives, filters, having, join conditions. */
    public static final Set<TypeTag> BOOL = expectation(TypeTag.BOOLEAN);

    /** Numeric operands: ordering comparisons, negation. */
    public static final Set<TypeTag> NUM = expectation(TypeTag.NUMERIC);

    /** Arithmetic operands. Booleans are accepted so that flags can be summed or multiplied. */
    public static final Set<TypeTag> NUM_AND_BOOL = expectation(TypeTag.NUMERIC, TypeTag.BOOLEAN);

    /** Accepts anything. */
    public static final Set<TypeTag> ANY = expectation(TypeTag.UNKNOWN);

    private TypeLattice() {
        // Utility class - prevent instantiation
    }

    /**
     * Returns true if {@code actual} satisfies the {@code expected} set.
     *
     * @param expected the acceptable tags
     * @param actual the inferred tag
     * @return true if compatible
     */
    public static boolean tagMatches(Set<TypeTag> expected, TypeTag actual) {
        Objects.requireNonNull(expected, "expected must not be null");
        Objects.requireNonNull(actual, "actual must not be null");
        return expected.contains(actual)
            || actual == TypeTag.UNKNOWN
            || expected.contains(TypeTag.UNKNOWN);
    }

    /**
     * Builds a singleton expectation requiring exactly {@code tag}.
     *
     * <p>Used where the expected type is itself inferred, e.g. the right operand
     * of an equality or the later branches of a CASE.
     *
     * @param tag the required tag
     * @return an immutable single-element set
     */
    public static Set<TypeTag> exactly(TypeTag tag) {
        return expectation(tag);
    }

    /**
     * Builds an immutable expectation set, iterated in declaration order of {@link TypeTag}.
     *
     * @param first the first tag
     * @param rest additional tags
     * @return the expectation set
     */
    public static Set<TypeTag> expectation(TypeTag first, TypeTag... rest) {
        return Collections.unmodifiableSet(EnumSet.of(first, rest));
    }

    /**
     * Renders an expectation for diagnostics, e.g. {@code "Numeric or Boolean"}.
     *
     * @param expected the expectation
     * @return display text
     */
    public static String describe(Set<TypeTag> expected) {
        return expected.stream()
            .sorted()
            .map(TypeTag::displayName)
            .collect(Collectors.joining(" or "));
    }
}
