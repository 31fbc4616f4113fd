package com.softcheck.expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Expression representing a CASE conditional expression.
 *
 * <p>Two forms are supported:
 * <pre>
 *   CASE WHEN c1 THEN r1 WHEN c2 THEN r2 ELSE e END        -- searched
 *   CASE x WHEN v1 THEN r1 WHEN v2 THEN r2 ELSE e END      -- simple (with discriminant)
 * </pre>
 *
 * <p>In the searched form every WHEN condition is a predicate; in the simple form
 * every WHEN value is compared against the discriminant {@code x}.
 *
 * <p>The parser guarantees at least one branch. The constructor does not enforce
 * it so that analysis can still report a malformed tree instead of failing.
 */
public final class CaseWhenExpression implements Expression {

    /**
     * A single {@code WHEN condition THEN result} branch.
     *
     * @param condition the WHEN condition or compared value
     * @param result the THEN result
     */
    public record WhenBranch(Expression condition, Expression result) {
        public WhenBranch {
            Objects.requireNonNull(condition, "condition must not be null");
            Objects.requireNonNull(result, "result must not be null");
        }
    }

    private final Expression discriminant;
    private final List<WhenBranch> branches;
    private final Expression elseBranch;
    private final SourcePosition position;

    /**
     * Creates a CASE expression.
     *
     * @param discriminant the initial expression of the simple form (may be null)
     * @param branches the WHEN branches, in source order
     * @param elseBranch the ELSE result (may be null)
     * @param position the source position
     */
    public CaseWhenExpression(Expression discriminant, List<WhenBranch> branches,
                              Expression elseBranch, SourcePosition position) {
        this.discriminant = discriminant;
        this.branches = new ArrayList<>(Objects.requireNonNull(branches, "branches must not be null"));
        this.elseBranch = elseBranch;
        this.position = Objects.requireNonNull(position, "position must not be null");
    }

    public CaseWhenExpression(Expression discriminant, List<WhenBranch> branches, Expression elseBranch) {
        this(discriminant, branches, elseBranch, SourcePosition.UNKNOWN);
    }

    public Optional<Expression> discriminant() {
        return Optional.ofNullable(discriminant);
    }

    /**
     * Returns the WHEN branches.
     *
     * @return an unmodifiable list of branches
     */
    public List<WhenBranch> branches() {
        return Collections.unmodifiableList(branches);
    }

    public Optional<Expression> elseBranch() {
        return Optional.ofNullable(elseBranch);
    }

    @Override
    public SourcePosition position() {
        return position;
    }

    @Override
    public List<Expression> children() {
        List<Expression> children = new ArrayList<>();
        if (discriminant != null) {
            children.add(discriminant);
        }
        for (WhenBranch branch : branches) {
            children.add(branch.condition());
            children.add(branch.result());
        }
        if (elseBranch != null) {
            children.add(elseBranch);
        }
        return Collections.unmodifiableList(children);
    }

    @Override
    public String toSource() {
        StringBuilder source = new StringBuilder("CASE ");
        if (discriminant != null) {
            source.append(discriminant.toSource()).append(" ");
        }
        for (WhenBranch branch : branches) {
            source.append("WHEN ").append(branch.condition().toSource());
            source.append(" THEN ").append(branch.result().toSource()).append(" ");
        }
        if (elseBranch != null) {
            source.append("ELSE ").append(elseBranch.toSource()).append(" ");
        }
        source.append("END");
        return source.toString();
    }

    @Override
    public String toString() {
        return "Case(" + branches.size() + " branches" +
               (discriminant != null ? ", with discriminant" : "") +
               (elseBranch != null ? ", with ELSE" : "") + ")";
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof CaseWhenExpression)) return false;
        CaseWhenExpression that = (CaseWhenExpression) obj;
        return Objects.equals(discriminant, that.discriminant) &&
               Objects.equals(branches, that.branches) &&
               Objects.equals(elseBranch, that.elseBranch);
    }

    @Override
    public int hashCode() {
        return Objects.hash(discriminant, branches, elseBranch);
    }
}
