package com.softcheck.exception;

import com.softcheck.analysis.AnalysisError;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Exception thrown when a program fails semantic analysis, or when analysis itself
 * could not complete.
 *
 * <p>Carries the errors found, in program order, so callers that prefer exceptions
 * over inspecting an {@code AnalysisResult} still get every diagnostic.
 *
 * <p>Example usage:
 * <pre>
 *   try {
 *       analyzer.analyze(program).throwIfFailed();
 *   } catch (SemanticAnalysisException e) {
 *       System.err.println(e.getUserMessage());
 *   }
 * </pre>
 */
public class SemanticAnalysisException extends RuntimeException {

    private final List<AnalysisError> errors;

    /**
     * Creates an exception for a program that has semantic errors.
     *
     * @param errors the errors found, in program order
     */
    public SemanticAnalysisException(List<AnalysisError> errors) {
        super("Semantic analysis failed with " + errors.size() + " error(s)");
        this.errors = List.copyOf(errors);
    }

    /**
     * Creates an exception for an analysis run that could not complete.
     *
     * @param message the error message
     * @param cause the underlying cause
     */
    public SemanticAnalysisException(String message, Throwable cause) {
        super(message, cause);
        this.errors = Collections.emptyList();
    }

    /**
     * Returns the errors found, empty if analysis did not complete.
     */
    public List<AnalysisError> getErrors() {
        return errors;
    }

    /**
     * Returns a user-friendly error message listing each diagnostic on its own line.
     *
     * @return user-friendly error message
     */
    public String getUserMessage() {
        if (errors.isEmpty()) {
            return "Semantic analysis could not complete: " + getMessage();
        }
        return errors.stream()
            .map(e -> e.position() + ": " + e.message())
            .collect(Collectors.joining("\n", getMessage() + ":\n", ""));
    }

    /**
     * Returns the technical message including the error kinds.
     *
     * @return technical error message
     */
    public String getTechnicalMessage() {
        StringBuilder sb = new StringBuilder(getMessage());
        for (AnalysisError error : errors) {
            sb.append("\n  [").append(error.kind()).append("] ")
              .append(error.position()).append(": ").append(error.message());
        }
        if (getCause() != null) {
            sb.append("\nCaused by: ").append(getCause().getClass().getName())
              .append(": ").append(getCause().getMessage());
        }
        return sb.toString();
    }
}
