package com.softcheck.analysis;

import com.softcheck.analysis.AnalysisError.BadCall;
import com.softcheck.analysis.AnalysisError.TypeMismatch;
import com.softcheck.expression.ArrayIndex;
import com.softcheck.expression.BinaryExpression;
import com.softcheck.expression.CaseWhenExpression;
import com.softcheck.expression.CaseWhenExpression.WhenBranch;
import com.softcheck.expression.ColumnAccess;
import com.softcheck.expression.EachExpression;
import com.softcheck.expression.Expression;
import com.softcheck.expression.FunctionCall;
import com.softcheck.expression.Identifier;
import com.softcheck.expression.Literal;
import com.softcheck.expression.RowIdExpression;
import com.softcheck.expression.StarExpression;
import com.softcheck.expression.UnaryExpression;
import com.softcheck.functions.CallSignature;
import com.softcheck.functions.FunctionEnvironment;
import com.softcheck.types.TypeLattice;
import com.softcheck.types.TypeTag;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Soft type checker for expressions.
 *
 * <h2>Typing rules</h2>
 * <ul>
 *   <li>AND, OR: both operands boolean; result boolean</li>
 *   <li>&lt;, &lt;=, &gt;, &gt;=: both operands numeric; result boolean</li>
 *   <li>=, !=: the right operand must have the left operand's type; result boolean</li>
 *   <li>+, -, *, /, ^: operands numeric or boolean; result numeric</li>
 *   <li>NOT: boolean operand; negation: numeric operand</li>
 *   <li>Calls: resolved through the {@link FunctionEnvironment}; unknown names are not errors</li>
 *   <li>CASE: conditions boolean, or of the discriminant's type; the first branch
 *       result fixes the type of all other results</li>
 *   <li>Identifiers, wildcards and column accesses are unknown; ROWID is numeric</li>
 * </ul>
 *
 * <p>An unknown type satisfies every expectation, so an ill-typed operand never
 * cascades into further errors for the expressions containing it.
 *
 * <p>Instances are immutable and thread-safe.
 */
public final class ExpressionChecker {

    private final FunctionEnvironment environment;

    public ExpressionChecker(FunctionEnvironment environment) {
        this.environment = Objects.requireNonNull(environment, "environment must not be null");
    }

    public FunctionEnvironment environment() {
        return environment;
    }

    /**
     * Infers the type of an expression and collects the errors inside it.
     *
     * @param expr the expression
     * @return the inferred type and errors
     */
    public TypedResult check(Expression expr) {
        Objects.requireNonNull(expr, "expr must not be null");

        if (expr instanceof BinaryExpression binary) {
            return checkBinary(binary);
        } else if (expr instanceof UnaryExpression unary) {
            return checkUnary(unary);
        } else if (expr instanceof FunctionCall call) {
            return checkCall(call);
        } else if (expr instanceof ArrayIndex index) {
            // the index is never checked
            return TypedResult.of(TypeTag.UNKNOWN, check(index.array()).errors());
        } else if (expr instanceof CaseWhenExpression caseWhen) {
            return checkCase(caseWhen);
        } else if (expr instanceof Literal literal) {
            return TypedResult.of(literalType(literal));
        } else if (expr instanceof RowIdExpression) {
            return TypedResult.of(TypeTag.NUMERIC);
        } else if (expr instanceof Identifier || expr instanceof ColumnAccess || expr instanceof StarExpression) {
            return TypedResult.of(TypeTag.UNKNOWN);
        } else if (expr instanceof EachExpression each) {
            return check(each.inner());
        }
        throw new IllegalStateException("Unhandled expression type: " + expr.getClass().getSimpleName());
    }

    /**
     * Checks that an expression has one of the {@code expected} types.
     *
     * @param expected the acceptable types
     * @param expr the expression
     * @return the errors inside {@code expr}, followed by a mismatch if its type does not match
     */
    public List<AnalysisError> checkTypeTag(Set<TypeTag> expected, Expression expr) {
        TypedResult result = check(expr);
        if (TypeLattice.tagMatches(expected, result.type())) {
            return result.errors();
        }
        List<AnalysisError> errors = new ArrayList<>(result.errors());
        errors.add(new TypeMismatch(expected, result.type(), expr.position()));
        return errors;
    }

    /**
     * Checks each expression against the same expectation.
     *
     * @param expected the acceptable types
     * @param exprs the expressions
     * @return all errors, in expression order
     */
    public List<AnalysisError> checkAll(Set<TypeTag> expected, List<Expression> exprs) {
        List<AnalysisError> errors = new ArrayList<>();
        for (Expression expr : exprs) {
            errors.addAll(checkTypeTag(expected, expr));
        }
        return errors;
    }

    /**
     * Collects the internal errors of each expression, ignoring their types.
     *
     * @param exprs the expressions
     * @return all errors, in expression order
     */
    public List<AnalysisError> errorsOf(List<Expression> exprs) {
        List<AnalysisError> errors = new ArrayList<>();
        for (Expression expr : exprs) {
            errors.addAll(check(expr).errors());
        }
        return errors;
    }

    private TypedResult checkBinary(BinaryExpression expr) {
        BinaryExpression.Operator op = expr.operator();
        if (op.isLogical()) {
            return TypedResult.of(TypeTag.BOOLEAN,
                concat(checkTypeTag(TypeLattice.BOOL, expr.left()), checkTypeTag(TypeLattice.BOOL, expr.right())));
        }
        if (op.isOrdering()) {
            return TypedResult.of(TypeTag.BOOLEAN,
                concat(checkTypeTag(TypeLattice.NUM, expr.left()), checkTypeTag(TypeLattice.NUM, expr.right())));
        }
        if (op.isEquality()) {
            // the left operand decides what the right one must be
            TypedResult left = check(expr.left());
            return TypedResult.of(TypeTag.BOOLEAN,
                concat(left.errors(), checkTypeTag(TypeLattice.exactly(left.type()), expr.right())));
        }
        // arithmetic accepts booleans too, e.g. (price > 10) + 1
        return TypedResult.of(TypeTag.NUMERIC,
            concat(checkTypeTag(TypeLattice.NUM_AND_BOOL, expr.left()),
                   checkTypeTag(TypeLattice.NUM_AND_BOOL, expr.right())));
    }

    private TypedResult checkUnary(UnaryExpression expr) {
        return switch (expr.operator()) {
            case NOT -> TypedResult.of(TypeTag.BOOLEAN, checkTypeTag(TypeLattice.BOOL, expr.operand()));
            case NEGATE -> TypedResult.of(TypeTag.NUMERIC, checkTypeTag(TypeLattice.NUM, expr.operand()));
        };
    }

    /**
     * Checks a call. Built-ins are matched on argument types, user functions on
     * argument count only. A name without signature yields an unknown type and
     * no call error.
     *
     * <p>Errors inside the arguments are reported first, in argument order, and the
     * {@link BadCall} for the call itself last, so diagnostics read left to right.
     */
    private TypedResult checkCall(FunctionCall call) {
        Optional<CallSignature> signature = environment.lookup(call.functionName());
        if (signature.isEmpty()) {
            return TypedResult.of(TypeTag.UNKNOWN, errorsOf(call.arguments()));
        }

        List<TypeTag> argumentTypes = new ArrayList<>();
        List<AnalysisError> errors = new ArrayList<>();
        for (Expression argument : call.arguments()) {
            TypedResult result = check(argument);
            argumentTypes.add(result.type());
            errors.addAll(result.errors());
        }

        Optional<TypeTag> returnType = signature.get().apply(argumentTypes);
        if (returnType.isEmpty()) {
            errors.add(new BadCall(call.functionName(), call.position()));
        }
        return TypedResult.of(returnType.orElse(TypeTag.UNKNOWN), errors);
    }

    private TypedResult checkCase(CaseWhenExpression expr) {
        List<AnalysisError> errors = new ArrayList<>();

        // without a discriminant the conditions are plain predicates
        TypedResult discriminant = expr.discriminant()
            .map(this::check)
            .orElse(TypedResult.of(TypeTag.BOOLEAN));
        errors.addAll(discriminant.errors());

        Set<TypeTag> conditionType = TypeLattice.exactly(discriminant.type());
        for (WhenBranch branch : expr.branches()) {
            errors.addAll(checkTypeTag(conditionType, branch.condition()));
        }

        TypeTag resultType;
        List<WhenBranch> branches = expr.branches();
        if (branches.isEmpty()) {
            // cannot come out of the parser; keep going with an unknown type
            resultType = TypeTag.UNKNOWN;
            errors.add(new TypeMismatch(TypeLattice.BOOL, TypeTag.UNIT, expr.position()));
        } else {
            TypedResult first = check(branches.get(0).result());
            resultType = first.type();
            errors.addAll(first.errors());
            Set<TypeTag> expectedResult = TypeLattice.exactly(resultType);
            for (WhenBranch branch : branches.subList(1, branches.size())) {
                errors.addAll(checkTypeTag(expectedResult, branch.result()));
            }
        }

        Optional<Expression> elseBranch = expr.elseBranch();
        if (elseBranch.isPresent()) {
            errors.addAll(checkTypeTag(TypeLattice.exactly(resultType), elseBranch.get()));
        }
        return TypedResult.of(resultType, errors);
    }

    /**
     * Dates and timestamps are numeric: the target runtime compares them as numbers.
     */
    private static TypeTag literalType(Literal literal) {
        return switch (literal.kind()) {
            case INT, FLOAT, DATE, TIMESTAMP -> TypeTag.NUMERIC;
            case STRING -> TypeTag.STRING;
            case BOOLEAN -> TypeTag.BOOLEAN;
        };
    }

    private static List<AnalysisError> concat(List<AnalysisError> first, List<AnalysisError> second) {
        if (second.isEmpty()) {
            return first;
        }
        if (first.isEmpty()) {
            return second;
        }
        List<AnalysisError> all = new ArrayList<>(first.size() + second.size());
        all.addAll(first);
        all.addAll(second);
        return Collections.unmodifiableList(all);
    }
}
