package com.softcheck.analysis;

import com.softcheck.exception.SemanticAnalysisException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of analyzing a program: every error found, in program order.
 */
public final class AnalysisResult {

    private final List<AnalysisError> errors;

    public AnalysisResult(List<AnalysisError> errors) {
        Objects.requireNonNull(errors, "errors must not be null");
        this.errors = Collections.unmodifiableList(new ArrayList<>(errors));
    }

    public List<AnalysisError> errors() {
        return errors;
    }

    public boolean isSuccessful() {
        return errors.isEmpty();
    }

    public int errorCount() {
        return errors.size();
    }

    /**
     * Returns the errors of one kind, preserving order.
     */
    public List<AnalysisError> errorsOfKind(ErrorKind kind) {
        Objects.requireNonNull(kind, "kind must not be null");
        List<AnalysisError> result = new ArrayList<>();
        for (AnalysisError error : errors) {
            if (error.kind() == kind) {
                result.add(error);
            }
        }
        return result;
    }

    /**
     * Throws if any error was found.
     *
     * @throws SemanticAnalysisException carrying all errors
     */
    public void throwIfFailed() {
        if (!errors.isEmpty()) {
            throw new SemanticAnalysisException(errors);
        }
    }

    /**
     * Renders one {@code line:column: message} line per error.
     */
    public List<String> report() {
        List<String> lines = new ArrayList<>(errors.size());
        for (AnalysisError error : errors) {
            lines.add(error.position() + ": " + error.message());
        }
        return lines;
    }

    @Override
    public String toString() {
        return "AnalysisResult(" + errors.size() + " errors)";
    }
}
