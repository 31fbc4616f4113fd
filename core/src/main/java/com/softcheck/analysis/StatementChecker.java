package com.softcheck.analysis;

import com.softcheck.expression.Expression;
import com.softcheck.expression.ExpressionUtils;
import com.softcheck.functions.FunctionEnvironment;
import com.softcheck.logical.Sort;
import com.softcheck.statement.Create;
import com.softcheck.statement.Delete;
import com.softcheck.statement.Insert;
import com.softcheck.statement.Query;
import com.softcheck.statement.Query.LocalQuery;
import com.softcheck.statement.Statement;
import com.softcheck.statement.Update;
import com.softcheck.statement.Update.ColumnAssignment;
import com.softcheck.statement.UserFunction;
import com.softcheck.statement.UserFunction.BodyStatement;
import com.softcheck.statement.VerbatimCode;
import com.softcheck.types.TypeLattice;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Routes each top-level statement to the matching checks.
 *
 * <ul>
 *   <li><b>Query:</b> local queries in order, then the main query</li>
 *   <li><b>Update / Delete:</b> clause constraints, then column accesses resolved
 *       against the single target table</li>
 *   <li><b>Create:</b> the source query, if any</li>
 *   <li><b>Insert:</b> the source query or the values; values may not use
 *       query-only expressions</li>
 *   <li><b>User function:</b> every body statement, which may not use query-only
 *       expressions</li>
 *   <li><b>Verbatim code:</b> never inspected</li>
 * </ul>
 *
 * <p>Instances are immutable and thread-safe.
 */
public final class StatementChecker {

    private final ExpressionChecker expressionChecker;
    private final RelationalChecker relationalChecker;

    public StatementChecker(FunctionEnvironment environment) {
        this.expressionChecker = new ExpressionChecker(environment);
        this.relationalChecker = new RelationalChecker(expressionChecker);
    }

    /**
     * Checks one top-level statement.
     *
     * @param statement the statement
     * @return its errors, in traversal order
     */
    public List<AnalysisError> check(Statement statement) {
        Objects.requireNonNull(statement, "statement must not be null");

        if (statement instanceof Query query) {
            return checkQuery(query);
        } else if (statement instanceof Update update) {
            return checkUpdate(update);
        } else if (statement instanceof Delete delete) {
            return checkDelete(delete);
        } else if (statement instanceof Create create) {
            // the schema form declares columns only
            return create.query().map(this::checkQuery).orElse(Collections.emptyList());
        } else if (statement instanceof Insert insert) {
            return checkInsert(insert);
        } else if (statement instanceof UserFunction function) {
            return checkUserFunction(function);
        } else if (statement instanceof VerbatimCode) {
            return Collections.emptyList();
        }
        throw new IllegalStateException("Unhandled statement type: " + statement.getClass().getSimpleName());
    }

    public List<AnalysisError> checkQuery(Query query) {
        List<AnalysisError> errors = new ArrayList<>();
        for (LocalQuery local : query.localQueries()) {
            errors.addAll(relationalChecker.check(local.plan()));
        }
        errors.addAll(relationalChecker.check(query.main()));
        return errors;
    }

    public List<AnalysisError> checkUpdate(Update update) {
        List<AnalysisError> errors = new ArrayList<>();
        for (ColumnAssignment assignment : update.assignments()) {
            errors.addAll(expressionChecker.check(assignment.value()).errors());
        }
        errors.addAll(RelationalChecker.checkSortKeys(Sort.keys(update.orderBy())));
        errors.addAll(expressionChecker.checkAll(TypeLattice.BOOL, update.where()));
        errors.addAll(expressionChecker.errorsOf(update.groupBy()));
        errors.addAll(expressionChecker.checkAll(TypeLattice.BOOL, update.having()));
        errors.addAll(resolveAgainst(update.tableName(), update.expressions()));
        return errors;
    }

    public List<AnalysisError> checkDelete(Delete delete) {
        List<AnalysisError> errors = new ArrayList<>();
        if (delete.isPredicate()) {
            errors.addAll(expressionChecker.checkAll(TypeLattice.BOOL, delete.where()));
        }
        errors.addAll(RelationalChecker.checkSortKeys(Sort.keys(delete.orderBy())));
        errors.addAll(expressionChecker.errorsOf(delete.groupBy()));
        errors.addAll(expressionChecker.checkAll(TypeLattice.BOOL, delete.having()));
        errors.addAll(resolveAgainst(delete.tableName(), delete.expressions()));
        return errors;
    }

    /**
     * Checks an INSERT. Column types of the target table are not known statically,
     * so values are not matched against them.
     */
    public List<AnalysisError> checkInsert(Insert insert) {
        List<AnalysisError> errors = new ArrayList<>();
        Optional<Query> query = insert.query();
        if (query.isPresent()) {
            errors.addAll(checkQuery(query.get()));
            errors.addAll(RelationalChecker.checkSortKeys(Sort.keys(insert.orderBy())));
            return errors;
        }

        errors.addAll(expressionChecker.errorsOf(insert.values()));
        errors.addAll(RelationalChecker.checkSortKeys(Sort.keys(insert.orderBy())));
        for (Expression value : insert.values()) {
            errors.addAll(ProhibitedExpressionChecker.check(value));
        }
        return errors;
    }

    public List<AnalysisError> checkUserFunction(UserFunction function) {
        List<AnalysisError> errors = new ArrayList<>();
        for (BodyStatement statement : function.body()) {
            errors.addAll(expressionChecker.check(statement.expression()).errors());
            errors.addAll(ProhibitedExpressionChecker.check(statement.expression()));
        }
        return errors;
    }

    private static List<AnalysisError> resolveAgainst(String tableName, List<Expression> exprs) {
        return TableScope.single(tableName).resolveAll(ExpressionUtils.columnAccesses(exprs));
    }
}
