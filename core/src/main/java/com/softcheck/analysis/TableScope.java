package com.softcheck.analysis;

import com.softcheck.analysis.AnalysisError.AmbiguousColumnAccess;
import com.softcheck.analysis.AnalysisError.UnresolvedCorrelationName;
import com.softcheck.expression.ColumnAccess;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The table names a qualified column access may resolve against.
 *
 * <p>A name may appear several times, in which case accesses through it are ambiguous.
 */
public final class TableScope {

    private final List<String> names;

    private TableScope(List<String> names) {
        this.names = Collections.unmodifiableList(new ArrayList<>(names));
    }

    /**
     * Builds the scope of a query from its table bindings.
     *
     * @param bindings the bindings, in collection order
     * @return the scope holding each binding's reference name
     */
    public static TableScope of(List<TableBinding> bindings) {
        List<String> names = new ArrayList<>(bindings.size());
        for (TableBinding binding : bindings) {
            names.add(binding.referenceName());
        }
        return new TableScope(names);
    }

    /**
     * Builds the scope of a single-table statement (UPDATE, DELETE).
     *
     * @param tableName the target table
     * @return a scope containing only {@code tableName}
     */
    public static TableScope single(String tableName) {
        return new TableScope(List.of(Objects.requireNonNull(tableName, "tableName must not be null")));
    }

    public List<String> names() {
        return names;
    }

    /**
     * Resolves one column access.
     *
     * @param access the access
     * @return an error if the qualifier is ambiguous or unknown, empty otherwise
     */
    public Optional<AnalysisError> resolve(ColumnAccess access) {
        int matches = Collections.frequency(names, access.qualifier());
        if (matches > 1) {
            return Optional.of(new AmbiguousColumnAccess(access.qualifiedName(), access.position()));
        }
        if (matches == 0) {
            return Optional.of(new UnresolvedCorrelationName(access.qualifiedName(), access.position()));
        }
        return Optional.empty();
    }

    /**
     * Resolves several column accesses.
     *
     * @param accesses the accesses, in order
     * @return the errors, in access order
     */
    public List<AnalysisError> resolveAll(Collection<ColumnAccess> accesses) {
        List<AnalysisError> errors = new ArrayList<>();
        for (ColumnAccess access : accesses) {
            resolve(access).ifPresent(errors::add);
        }
        return errors;
    }

    @Override
    public String toString() {
        return "TableScope" + names;
    }
}
