package com.softcheck.analysis;

import com.softcheck.expression.FunctionCall;
import com.softcheck.expression.Identifier;
import com.softcheck.expression.Literal;
import com.softcheck.functions.BuiltinSignature;
import com.softcheck.functions.FunctionEnvironment;
import com.softcheck.functions.UserFunctionSignature;
import com.softcheck.logical.Project;
import com.softcheck.logical.TableScan;
import com.softcheck.statement.Program;
import com.softcheck.statement.Query;
import com.softcheck.statement.UserFunction;
import com.softcheck.statement.UserFunction.ExpressionStatement;
import com.softcheck.test.TestBase;
import com.softcheck.test.TestCategories;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for EnvironmentBuilder.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("EnvironmentBuilder Tests")
public class EnvironmentBuilderTest extends TestBase {

    private static UserFunction function(String name, String... parameters) {
        return new UserFunction(name, List.of(parameters),
            List.of(new ExpressionStatement(Identifier.of("x"))));
    }

    @Test
    @DisplayName("Built-ins are available to every program")
    void testBuiltins() {
        FunctionEnvironment env = EnvironmentBuilder.build(Program.of());

        assertThat(env.lookup("sum")).get().isInstanceOf(BuiltinSignature.class);
        assertThat(env.contains("f")).isFalse();
    }

    @Test
    @DisplayName("User functions are registered with their arity")
    void testUserFunctions() {
        Program program = Program.of(
            new Query(new Project(new TableScan("T"), List.of(FunctionCall.of("f", Literal.ofInt(1))))),
            function("f", "a"));

        FunctionEnvironment env = EnvironmentBuilder.build(program);

        assertThat(env.lookup("f")).contains(new UserFunctionSignature("f", 1));
    }

    @Test
    @DisplayName("A user function shadows a built-in of the same name")
    void testShadowing() {
        FunctionEnvironment env = EnvironmentBuilder.build(Program.of(function("sum", "a", "b")));

        assertThat(env.lookup("sum")).contains(new UserFunctionSignature("sum", 2));
    }

    @Test
    @DisplayName("The later of two declarations wins")
    void testRedeclaration() {
        FunctionEnvironment env = EnvironmentBuilder.build(Program.of(
            function("g", "a"),
            function("g", "a", "b", "c")));

        assertThat(env.lookup("g")).contains(new UserFunctionSignature("g", 3));
    }

    @Test
    @DisplayName("A custom base replaces the built-ins")
    void testCustomBase() {
        FunctionEnvironment env = EnvironmentBuilder.build(Program.of(function("f")),
            FunctionEnvironment.builder());

        assertThat(env.functionNames()).containsExactly("f");
    }
}
