package com.softcheck.analysis;

import com.softcheck.types.TypeTag;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Inferred type of an expression together with the errors found inside it.
 *
 * @param type the inferred type
 * @param errors errors found while checking the expression, in traversal order
 */
public record TypedResult(TypeTag type, List<AnalysisError> errors) {

    public TypedResult {
        Objects.requireNonNull(type, "type must not be null");
        errors = List.copyOf(Objects.requireNonNull(errors, "errors must not be null"));
    }

    public static TypedResult of(TypeTag type) {
        return new TypedResult(type, Collections.emptyList());
    }

    public static TypedResult of(TypeTag type, List<AnalysisError> errors) {
        return new TypedResult(type, errors);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
