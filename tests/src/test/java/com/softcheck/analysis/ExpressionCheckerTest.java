package com.softcheck.analysis;

import com.softcheck.analysis.AnalysisError.BadCall;
import com.softcheck.analysis.AnalysisError.TypeMismatch;
import com.softcheck.expression.ArrayIndex;
import com.softcheck.expression.BinaryExpression;
import com.softcheck.expression.BinaryExpression.Operator;
import com.softcheck.expression.CaseWhenExpression;
import com.softcheck.expression.CaseWhenExpression.WhenBranch;
import com.softcheck.expression.ColumnAccess;
import com.softcheck.expression.EachExpression;
import com.softcheck.expression.Expression;
import com.softcheck.expression.FunctionCall;
import com.softcheck.expression.Identifier;
import com.softcheck.expression.Literal;
import com.softcheck.expression.RowIdExpression;
import com.softcheck.expression.SourcePosition;
import com.softcheck.expression.StarExpression;
import com.softcheck.expression.UnaryExpression;
import com.softcheck.functions.FunctionEnvironment;
import com.softcheck.functions.FunctionRegistry;
import com.softcheck.functions.UserFunctionSignature;
import com.softcheck.test.TestBase;
import com.softcheck.test.TestCategories;
import com.softcheck.types.TypeLattice;
import com.softcheck.types.TypeTag;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the soft type rules of ExpressionChecker.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("ExpressionChecker Tests")
public class ExpressionCheckerTest extends TestBase {

    private static final SourcePosition POS = SourcePosition.of(2, 7);

    private ExpressionChecker checker;

    @BeforeEach
    void setUp() {
        FunctionEnvironment environment = FunctionRegistry.builtins()
            .register(new UserFunctionSignature("f", 2))
            .build();
        checker = new ExpressionChecker(environment);
    }

    private static Expression num(long value) {
        return Literal.ofInt(value);
    }

    private static Expression str(String value) {
        return Literal.ofString(value);
    }

    private static Expression bool(boolean value) {
        return Literal.ofBoolean(value);
    }

    private static Expression id(String name) {
        return Identifier.of(name);
    }

    @Nested
    @DisplayName("Leaves")
    class Leaves {

        @Test
        @DisplayName("Literal types")
        void testLiterals() {
            assertThat(checker.check(num(1)).type()).isEqualTo(TypeTag.NUMERIC);
            assertThat(checker.check(Literal.ofFloat(1.5)).type()).isEqualTo(TypeTag.NUMERIC);
            assertThat(checker.check(Literal.ofDate("2024.01.01")).type()).isEqualTo(TypeTag.NUMERIC);
            assertThat(checker.check(Literal.ofTimestamp("2024.01.01D10:00:00")).type()).isEqualTo(TypeTag.NUMERIC);
            assertThat(checker.check(str("a")).type()).isEqualTo(TypeTag.STRING);
            assertThat(checker.check(bool(true)).type()).isEqualTo(TypeTag.BOOLEAN);
        }

        @Test
        @DisplayName("Names and wildcards are unknown, ROWID is numeric")
        void testNames() {
            assertThat(checker.check(id("price")).type()).isEqualTo(TypeTag.UNKNOWN);
            assertThat(checker.check(ColumnAccess.of("t", "c")).type()).isEqualTo(TypeTag.UNKNOWN);
            assertThat(checker.check(new StarExpression()).type()).isEqualTo(TypeTag.UNKNOWN);
            assertThat(checker.check(new RowIdExpression()).type()).isEqualTo(TypeTag.NUMERIC);
        }

        @Test
        @DisplayName("EACH is transparent")
        void testEach() {
            assertThat(checker.check(new EachExpression(str("x"))).type()).isEqualTo(TypeTag.STRING);
        }
    }

    @Nested
    @DisplayName("Operators")
    class Operators {

        @Test
        @DisplayName("Ordering comparison of numbers is boolean")
        void testOrdering() {
            TypedResult result = checker.check(BinaryExpression.lessThan(num(1), num(2)));

            assertThat(result.type()).isEqualTo(TypeTag.BOOLEAN);
            assertThat(result.errors()).isEmpty();
        }

        @Test
        @DisplayName("Ordering comparison with a string reports the string operand")
        void testOrderingWithString() {
            Expression right = new Literal(Literal.Kind.STRING, "a", POS);
            TypedResult result = checker.check(BinaryExpression.lessThan(num(1), right));

            assertThat(result.type()).isEqualTo(TypeTag.BOOLEAN);
            assertThat(result.errors()).containsExactly(
                new TypeMismatch(TypeLattice.NUM, TypeTag.STRING, POS));
        }

        @Test
        @DisplayName("Arithmetic accepts booleans")
        void testArithmeticWithBoolean() {
            TypedResult result = checker.check(BinaryExpression.add(bool(true), num(1)));

            assertThat(result.type()).isEqualTo(TypeTag.NUMERIC);
            assertThat(result.errors()).isEmpty();
        }

        @Test
        @DisplayName("Arithmetic rejects strings on both sides, left first")
        void testArithmeticWithStrings() {
            TypedResult result = checker.check(
                new BinaryExpression(str("a"), Operator.POWER, str("b")));

            assertThat(result.errors()).hasSize(2)
                .allSatisfy(e -> assertThat(e).isInstanceOf(TypeMismatch.class));
            assertThat(((TypeMismatch) result.errors().get(0)).expected())
                .isEqualTo(TypeLattice.NUM_AND_BOOL);
        }

        @Test
        @DisplayName("Equality requires the right operand to have the left operand's type")
        void testEquality() {
            assertThat(checker.check(BinaryExpression.equal(num(1), num(2))).errors()).isEmpty();
            assertThat(checker.check(BinaryExpression.equal(id("x"), str("a"))).errors()).isEmpty();
            assertThat(checker.check(BinaryExpression.equal(str("a"), id("x"))).errors()).isEmpty();

            TypedResult result = checker.check(BinaryExpression.notEqual(num(1), str("a")));
            assertThat(result.type()).isEqualTo(TypeTag.BOOLEAN);
            assertThat(result.errors()).singleElement()
                .isEqualTo(new TypeMismatch(TypeLattice.exactly(TypeTag.NUMERIC), TypeTag.STRING,
                    SourcePosition.UNKNOWN));
        }

        @Test
        @DisplayName("Logical operators require booleans")
        void testLogical() {
            assertThat(checker.check(BinaryExpression.or(bool(true), id("flag"))).errors()).isEmpty();
            assertThat(checker.check(BinaryExpression.and(num(1), bool(true))).errors())
                .singleElement().isInstanceOf(TypeMismatch.class);
        }

        @Test
        @DisplayName("NOT requires a boolean, negation a number")
        void testUnary() {
            TypedResult not = checker.check(UnaryExpression.not(num(1)));
            TypedResult neg = checker.check(UnaryExpression.negate(bool(false)));

            assertThat(not.type()).isEqualTo(TypeTag.BOOLEAN);
            assertThat(not.errors()).containsExactly(
                new TypeMismatch(TypeLattice.BOOL, TypeTag.NUMERIC, SourcePosition.UNKNOWN));
            assertThat(neg.type()).isEqualTo(TypeTag.NUMERIC);
            assertThat(neg.errors()).containsExactly(
                new TypeMismatch(TypeLattice.NUM, TypeTag.BOOLEAN, SourcePosition.UNKNOWN));
        }

        @Test
        @DisplayName("An ill-typed operand does not cascade")
        void testNoCascade() {
            // (1 < "a") AND TRUE: the inner comparison is still boolean
            Expression expr = BinaryExpression.and(BinaryExpression.lessThan(num(1), str("a")), bool(true));

            assertThat(checker.check(expr).errors()).hasSize(1);
        }
    }

    @Nested
    @DisplayName("Function calls")
    class Calls {

        @Test
        @DisplayName("Matching built-in call returns its type")
        void testBuiltinMatch() {
            TypedResult result = checker.check(FunctionCall.of("sum", id("price")));

            assertThat(result.type()).isEqualTo(TypeTag.NUMERIC);
            assertThat(result.errors()).isEmpty();
        }

        @Test
        @DisplayName("Arity mismatch is a bad call at the call position")
        void testArityMismatch() {
            Expression call = new FunctionCall("sum", List.of(id("a"), id("b")), POS);
            TypedResult result = checker.check(call);

            assertThat(result.type()).isEqualTo(TypeTag.UNKNOWN);
            assertThat(result.errors()).containsExactly(new BadCall("sum", POS));
        }

        @Test
        @DisplayName("Argument errors come before the bad call")
        void testArgumentErrorsFirst() {
            Expression call = FunctionCall.of("like", UnaryExpression.not(num(1)), num(2));

            assertThat(checker.check(call).errors())
                .extracting(AnalysisError::kind)
                .containsExactly(ErrorKind.TYPE_MISMATCH, ErrorKind.BAD_CALL);
        }

        @Test
        @DisplayName("Unknown functions are not errors but their arguments are checked")
        void testUnknownFunction() {
            TypedResult ok = checker.check(FunctionCall.of("mystery", num(1), str("x")));
            TypedResult bad = checker.check(FunctionCall.of("mystery", UnaryExpression.negate(str("x"))));

            assertThat(ok.type()).isEqualTo(TypeTag.UNKNOWN);
            assertThat(ok.errors()).isEmpty();
            assertThat(bad.errors()).singleElement().isInstanceOf(TypeMismatch.class);
        }

        @Test
        @DisplayName("User functions are checked by arity only")
        void testUserFunction() {
            assertThat(checker.check(FunctionCall.of("f", str("a"), bool(true))).errors()).isEmpty();
            assertThat(checker.check(FunctionCall.of("f", str("a"))).errors())
                .containsExactly(new BadCall("f", SourcePosition.UNKNOWN));
        }

        @Test
        @DisplayName("Running sum of a comparison counts matching rows")
        void testSumOfComparison() {
            TypedResult result = checker.check(
                FunctionCall.of("sums", BinaryExpression.greaterThan(id("price"), num(10))));

            assertThat(result.type()).isEqualTo(TypeTag.NUMERIC);
            assertThat(result.errors()).isEmpty();
        }

        @Test
        @DisplayName("Predicate call result is accepted by numeric aggregates")
        void testPredicateCallInAggregate() {
            Expression expr = FunctionCall.of("sum", FunctionCall.of("between", id("p"), num(1), num(5)));
            TypedResult result = checker.check(expr);

            assertThat(result.type()).isEqualTo(TypeTag.NUMERIC);
            assertThat(result.errors()).isEmpty();
        }

        @Test
        @DisplayName("String value in a numeric aggregate is a bad call")
        void testStringInAggregate() {
            assertThat(checker.check(FunctionCall.of("avg", str("x"))).errors())
                .containsExactly(new BadCall("avg", SourcePosition.UNKNOWN));
        }
    }

    @Nested
    @DisplayName("Array indexing")
    class Indexing {

        @Test
        @DisplayName("Only the array is checked")
        void testIndexNotChecked() {
            Expression expr = new ArrayIndex(id("xs"), UnaryExpression.not(num(1)));
            TypedResult result = checker.check(expr);

            assertThat(result.type()).isEqualTo(TypeTag.UNKNOWN);
            assertThat(result.errors()).isEmpty();
        }

        @Test
        @DisplayName("Errors inside the array expression are reported")
        void testArrayErrors() {
            Expression expr = new ArrayIndex(UnaryExpression.negate(str("a")), num(0));

            assertThat(checker.check(expr).errors()).hasSize(1);
        }
    }

    @Nested
    @DisplayName("CASE expressions")
    class Cases {

        @Test
        @DisplayName("Searched CASE requires boolean conditions")
        void testSearchedCase() {
            CaseWhenExpression expr = new CaseWhenExpression(null, List.of(
                new WhenBranch(BinaryExpression.greaterThan(id("x"), num(0)), str("pos")),
                new WhenBranch(new Literal(Literal.Kind.INT, 1L, POS), str("one"))),
                str("other"));

            TypedResult result = checker.check(expr);

            assertThat(result.type()).isEqualTo(TypeTag.STRING);
            assertThat(result.errors()).containsExactly(
                new TypeMismatch(TypeLattice.BOOL, TypeTag.NUMERIC, POS));
        }

        @Test
        @DisplayName("Simple CASE compares conditions with the discriminant type")
        void testSimpleCase() {
            CaseWhenExpression expr = new CaseWhenExpression(num(1), List.of(
                new WhenBranch(num(1), str("one")),
                new WhenBranch(str("two"), str("two"))),
                null);

            assertThat(checker.check(expr).errors()).containsExactly(
                new TypeMismatch(TypeLattice.exactly(TypeTag.NUMERIC), TypeTag.STRING, SourcePosition.UNKNOWN));
        }

        @Test
        @DisplayName("First branch result fixes the type of the others and of ELSE")
        void testResultTypes() {
            CaseWhenExpression expr = new CaseWhenExpression(null, List.of(
                new WhenBranch(bool(true), num(1)),
                new WhenBranch(bool(false), str("x"))),
                bool(true));

            TypedResult result = checker.check(expr);

            assertThat(result.type()).isEqualTo(TypeTag.NUMERIC);
            assertThat(result.errors()).containsExactly(
                new TypeMismatch(TypeLattice.exactly(TypeTag.NUMERIC), TypeTag.STRING, SourcePosition.UNKNOWN),
                new TypeMismatch(TypeLattice.exactly(TypeTag.NUMERIC), TypeTag.BOOLEAN, SourcePosition.UNKNOWN));
        }

        @Test
        @DisplayName("Unknown first result accepts anything later")
        void testUnknownFirstResult() {
            CaseWhenExpression expr = new CaseWhenExpression(null, List.of(
                new WhenBranch(bool(true), id("a")),
                new WhenBranch(bool(false), str("x"))),
                num(0));

            assertThat(checker.check(expr).errors()).isEmpty();
        }

        @Test
        @DisplayName("CASE without branches reports a unit mismatch")
        void testEmptyCase() {
            CaseWhenExpression expr = new CaseWhenExpression(null, List.of(), null, POS);
            TypedResult result = checker.check(expr);

            assertThat(result.type()).isEqualTo(TypeTag.UNKNOWN);
            assertThat(result.errors()).containsExactly(new TypeMismatch(TypeLattice.BOOL, TypeTag.UNIT, POS));
        }
    }

    @Nested
    @DisplayName("checkTypeTag")
    class CheckTypeTag {

        @ParameterizedTest
        @EnumSource(value = TypeTag.class, names = {"NUMERIC", "BOOLEAN", "STRING"})
        @DisplayName("Unknown expression satisfies every expectation")
        void testUnknownAlwaysMatches(TypeTag tag) {
            assertThat(checker.checkTypeTag(TypeLattice.exactly(tag), id("x"))).isEmpty();
        }

        @Test
        @DisplayName("Mismatch is appended after internal errors")
        void testMismatchAfterInternalErrors() {
            Expression expr = new BinaryExpression(UnaryExpression.not(num(1)), Operator.ADD, num(2), POS);
            List<AnalysisError> errors = checker.checkTypeTag(TypeLattice.BOOL, expr);

            assertThat(errors).hasSize(2);
            assertThat(errors.get(1)).isEqualTo(new TypeMismatch(TypeLattice.BOOL, TypeTag.NUMERIC, POS));
            assertThat(errors.get(1).message()).isEqualTo("type mismatch: expected Boolean, found Numeric");
        }
    }
}
