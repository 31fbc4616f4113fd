package com.softcheck.analysis;

import com.softcheck.analysis.AnalysisError.IllegalExpression;
import com.softcheck.expression.BinaryExpression;
import com.softcheck.expression.ColumnAccess;
import com.softcheck.expression.EachExpression;
import com.softcheck.expression.Expression;
import com.softcheck.expression.FunctionCall;
import com.softcheck.expression.Identifier;
import com.softcheck.expression.Literal;
import com.softcheck.expression.RowIdExpression;
import com.softcheck.expression.SourcePosition;
import com.softcheck.expression.StarExpression;
import com.softcheck.test.TestBase;
import com.softcheck.test.TestCategories;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for ProhibitedExpressionChecker.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("ProhibitedExpressionChecker Tests")
public class ProhibitedExpressionCheckerTest extends TestBase {

    @Test
    @DisplayName("Plain expressions are allowed")
    void testAllowed() {
        Expression expr = FunctionCall.of("sum", BinaryExpression.add(Identifier.of("a"), Literal.ofInt(1)));

        assertThat(ProhibitedExpressionChecker.check(expr)).isEmpty();
    }

    @Test
    @DisplayName("Each query-only node is reported with its source and position")
    void testQueryOnlyNodes() {
        SourcePosition starPos = SourcePosition.of(1, 10);
        SourcePosition rowIdPos = SourcePosition.of(1, 20);
        Expression expr = FunctionCall.of("f",
            new StarExpression(starPos),
            BinaryExpression.add(new RowIdExpression(rowIdPos), ColumnAccess.of("t", "c")));

        List<AnalysisError> errors = ProhibitedExpressionChecker.check(expr);

        assertThat(errors).containsExactly(
            new IllegalExpression("*", starPos),
            new IllegalExpression("ROWID", rowIdPos),
            new IllegalExpression("t.c", SourcePosition.UNKNOWN));
        assertThat(errors.get(0).message()).isEqualTo("illegal expression in this context: *");
    }

    @Test
    @DisplayName("Wrapped query-only nodes are still found")
    void testNested() {
        Expression expr = new EachExpression(new StarExpression());

        assertThat(ProhibitedExpressionChecker.check(expr)).hasSize(1);
    }

    @Test
    @DisplayName("isQueryOnly classifies node types")
    void testIsQueryOnly() {
        assertThat(ProhibitedExpressionChecker.isQueryOnly(new StarExpression())).isTrue();
        assertThat(ProhibitedExpressionChecker.isQueryOnly(new RowIdExpression())).isTrue();
        assertThat(ProhibitedExpressionChecker.isQueryOnly(ColumnAccess.of("t", "c"))).isTrue();
        assertThat(ProhibitedExpressionChecker.isQueryOnly(Identifier.of("c"))).isFalse();
    }
}
