package com.softcheck.analysis;

import com.softcheck.expression.SourcePosition;
import com.softcheck.types.TypeLattice;
import com.softcheck.types.TypeTag;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * A statically detected semantic violation.
 *
 * <p>Errors are plain values: checkers accumulate them instead of throwing, so a
 * single pass reports every violation of a program. Each variant carries enough
 * data to render a diagnostic through {@link #message()}.
 */
public sealed interface AnalysisError {

    ErrorKind kind();

    /**
     * Returns the position the diagnostic should point at.
     */
    SourcePosition position();

    /**
     * Returns a human-readable description, without position.
     */
    String message();

    /**
     * An expression whose inferred type does not satisfy its context.
     *
     * @param expected the acceptable types
     * @param found the inferred type
     * @param position position of the offending expression
     */
    record TypeMismatch(Set<TypeTag> expected, TypeTag found, SourcePosition position) implements AnalysisError {
        public TypeMismatch {
            Objects.requireNonNull(expected, "expected must not be null");
            // EnumSet keeps declaration order, so toString() is stable across runs
            expected = Collections.unmodifiableSet(
                expected.isEmpty() ? EnumSet.noneOf(TypeTag.class) : EnumSet.copyOf(expected));
            Objects.requireNonNull(found, "found must not be null");
            Objects.requireNonNull(position, "position must not be null");
        }

        @Override
        public ErrorKind kind() {
            return ErrorKind.TYPE_MISMATCH;
        }

        @Override
        public String message() {
            return "type mismatch: expected " + TypeLattice.describe(expected) + ", found " + found;
        }
    }

    /**
     * A call to a known function with arguments no signature variant accepts.
     *
     * @param functionName the called function
     * @param position position of the call
     */
    record BadCall(String functionName, SourcePosition position) implements AnalysisError {
        public BadCall {
            Objects.requireNonNull(functionName, "functionName must not be null");
            Objects.requireNonNull(position, "position must not be null");
        }

        @Override
        public ErrorKind kind() {
            return ErrorKind.BAD_CALL;
        }

        @Override
        public String message() {
            return "bad call to " + functionName + ": wrong number or types of arguments";
        }
    }

    /**
     * An expression form that is not allowed where it appears.
     *
     * @param fragment the expression rendered one level deep
     * @param position position of the expression
     */
    record IllegalExpression(String fragment, SourcePosition position) implements AnalysisError {
        public IllegalExpression {
            Objects.requireNonNull(fragment, "fragment must not be null");
            Objects.requireNonNull(position, "position must not be null");
        }

        @Override
        public ErrorKind kind() {
            return ErrorKind.ILLEGAL_EXPRESSION;
        }

        @Override
        public String message() {
            return "illegal expression in this context: " + fragment;
        }
    }

    /**
     * A qualified column access whose qualifier matches several table bindings.
     *
     * @param qualifiedName the access, as {@code table.column}
     * @param position position of the first use
     */
    record AmbiguousColumnAccess(String qualifiedName, SourcePosition position) implements AnalysisError {
        public AmbiguousColumnAccess {
            Objects.requireNonNull(qualifiedName, "qualifiedName must not be null");
            Objects.requireNonNull(position, "position must not be null");
        }

        @Override
        public ErrorKind kind() {
            return ErrorKind.AMBIGUOUS_COLUMN_ACCESS;
        }

        @Override
        public String message() {
            return "ambiguous column access: " + qualifiedName;
        }
    }

    /**
     * A qualified column access whose qualifier matches no table binding.
     *
     * @param qualifiedName the access, as {@code table.column}
     * @param position position of the first use
     */
    record UnresolvedCorrelationName(String qualifiedName, SourcePosition position) implements AnalysisError {
        public UnresolvedCorrelationName {
            Objects.requireNonNull(qualifiedName, "qualifiedName must not be null");
            Objects.requireNonNull(position, "position must not be null");
        }

        @Override
        public ErrorKind kind() {
            return ErrorKind.UNRESOLVED_CORRELATION_NAME;
        }

        @Override
        public String message() {
            return "unresolved correlation name in column access: " + qualifiedName;
        }
    }

    /**
     * Two table bindings of one query that collide on alias or on name.
     *
     * @param first the first binding, rendered as {@code name} or {@code name as alias}
     * @param second the second binding, rendered the same way
     * @param firstPosition position of the first binding
     * @param secondPosition position of the second binding
     */
    record DuplicateTableName(String first, String second,
                              SourcePosition firstPosition, SourcePosition secondPosition) implements AnalysisError {
        public DuplicateTableName {
            Objects.requireNonNull(first, "first must not be null");
            Objects.requireNonNull(second, "second must not be null");
            Objects.requireNonNull(firstPosition, "firstPosition must not be null");
            Objects.requireNonNull(secondPosition, "secondPosition must not be null");
        }

        @Override
        public ErrorKind kind() {
            return ErrorKind.DUPLICATE_TABLE_NAME;
        }

        /**
         * Points at the second, colliding binding.
         */
        @Override
        public SourcePosition position() {
            return secondPosition;
        }

        @Override
        public String message() {
            return "duplicate table name: " + second + " collides with " + first + " at " + firstPosition;
        }
    }
}
