package com.softcheck.functions;

import com.softcheck.test.TestBase;
import com.softcheck.test.TestCategories;
import com.softcheck.types.TypeTag;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the built-in function signatures.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("FunctionRegistry Tests")
public class FunctionRegistryTest extends TestBase {

    private FunctionEnvironment environment;

    @BeforeEach
    void setUp() {
        environment = FunctionRegistry.builtins().build();
    }

    private Optional<TypeTag> apply(String name, TypeTag... argumentTypes) {
        CallSignature signature = environment.lookup(name)
            .orElseThrow(() -> new AssertionError("missing built-in " + name));
        return signature.apply(List.of(argumentTypes));
    }

    @Nested
    @DisplayName("Aggregates")
    class Aggregates {

        @ParameterizedTest
        @ValueSource(strings = {"sum", "avg", "min", "max", "prd", "stddev", "var"})
        @DisplayName("Numeric aggregates take one numeric argument")
        void testNumericAggregates(String name) {
            assertThat(apply(name, TypeTag.NUMERIC)).contains(TypeTag.NUMERIC);
            assertThat(apply(name, TypeTag.UNKNOWN)).contains(TypeTag.NUMERIC);
            assertThat(apply(name, TypeTag.BOOLEAN)).contains(TypeTag.NUMERIC);
            assertThat(apply(name, TypeTag.STRING)).isEmpty();
            assertThat(apply(name, TypeTag.NUMERIC, TypeTag.NUMERIC)).isEmpty();
        }

        @Test
        @DisplayName("count accepts any argument")
        void testCount() {
            assertThat(apply("count", TypeTag.STRING)).contains(TypeTag.NUMERIC);
            assertThat(apply("count", TypeTag.BOOLEAN)).contains(TypeTag.NUMERIC);
            assertThat(apply("count")).isEmpty();
        }

        @Test
        @DisplayName("first has a one and a two argument form")
        void testFirst() {
            assertThat(apply("first", TypeTag.STRING)).contains(TypeTag.UNKNOWN);
            assertThat(apply("first", TypeTag.NUMERIC, TypeTag.STRING)).contains(TypeTag.UNKNOWN);
            assertThat(apply("first", TypeTag.STRING, TypeTag.STRING)).isEmpty();
        }
    }

    @Nested
    @DisplayName("Running aggregates")
    class Running {

        @Test
        @DisplayName("Moving form takes a leading window size")
        void testWindowForm() {
            assertThat(apply("avgs", TypeTag.NUMERIC)).contains(TypeTag.NUMERIC);
            assertThat(apply("avgs", TypeTag.NUMERIC, TypeTag.NUMERIC)).contains(TypeTag.NUMERIC);
            assertThat(apply("avgs", TypeTag.STRING, TypeTag.NUMERIC)).isEmpty();
        }

        @Test
        @DisplayName("Boolean values are summed as 0/1")
        void testBooleanValueAccepted() {
            assertThat(apply("sums", TypeTag.BOOLEAN)).contains(TypeTag.NUMERIC);
            assertThat(apply("avgs", TypeTag.NUMERIC, TypeTag.BOOLEAN)).contains(TypeTag.NUMERIC);
            assertThat(apply("deltas", TypeTag.BOOLEAN)).contains(TypeTag.NUMERIC);
        }

        @Test
        @DisplayName("Window size must be numeric")
        void testBooleanWindowRejected() {
            assertThat(apply("avgs", TypeTag.BOOLEAN, TypeTag.NUMERIC)).isEmpty();
            assertThat(apply("sums", TypeTag.STRING)).isEmpty();
        }
    }

    @Nested
    @DisplayName("Predicates and strings")
    class Predicates {

        @Test
        @DisplayName("between returns boolean")
        void testBetween() {
            assertThat(apply("between", TypeTag.NUMERIC, TypeTag.NUMERIC, TypeTag.NUMERIC))
                .contains(TypeTag.BOOLEAN);
            assertThat(apply("between", TypeTag.NUMERIC, TypeTag.NUMERIC)).isEmpty();
        }

        @Test
        @DisplayName("like takes two strings")
        void testLike() {
            assertThat(apply("like", TypeTag.STRING, TypeTag.STRING)).contains(TypeTag.BOOLEAN);
            assertThat(apply("like", TypeTag.NUMERIC, TypeTag.STRING)).isEmpty();
        }

        @Test
        @DisplayName("concat accepts two or more strings")
        void testConcat() {
            assertThat(apply("concat", TypeTag.STRING)).isEmpty();
            assertThat(apply("concat", TypeTag.STRING, TypeTag.STRING)).contains(TypeTag.STRING);
            assertThat(apply("concat", TypeTag.STRING, TypeTag.UNKNOWN, TypeTag.STRING, TypeTag.STRING))
                .contains(TypeTag.STRING);
            assertThat(apply("concat", TypeTag.STRING, TypeTag.STRING, TypeTag.NUMERIC)).isEmpty();
        }
    }

    @Test
    @DisplayName("Registry exposes every category")
    void testSignatures() {
        List<BuiltinSignature> signatures = FunctionRegistry.signatures();
        logData("Built-in signatures", signatures.size());

        assertThat(signatures).extracting(BuiltinSignature::functionName)
            .contains("sum", "count", "sums", "deltas", "prev", "drop", "abs", "mod",
                      "between", "like", "concat", "show", "make_null")
            .doesNotHaveDuplicates();
        assertThatThrownBy(() -> signatures.add(BuiltinSignature.of("x", BuiltinSignature.Overload.of(TypeTag.UNKNOWN))))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("Each call to builtins returns an independent builder")
    void testBuildersAreIndependent() {
        FunctionEnvironment.Builder builder = FunctionRegistry.builtins();
        builder.register(new UserFunctionSignature("extra", 1));

        assertThat(builder.build().contains("extra")).isTrue();
        assertThat(FunctionRegistry.builtins().build().contains("extra")).isFalse();
    }
}
