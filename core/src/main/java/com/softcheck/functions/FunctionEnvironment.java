package com.softcheck.functions;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable mapping from function names to call signatures.
 *
 * <p>The environment is assembled once through a {@link Builder} before any
 * expression is checked and is read-only afterwards, so it can be shared freely
 * between threads analyzing independent statements.
 *
 * <p>Names are case-sensitive.
 */
public final class FunctionEnvironment {

    private static final FunctionEnvironment EMPTY = new FunctionEnvironment(Collections.emptyMap());

    private final Map<String, CallSignature> signatures;

    private FunctionEnvironment(Map<String, CallSignature> signatures) {
        this.signatures = Collections.unmodifiableMap(new LinkedHashMap<>(signatures));
    }

    public static FunctionEnvironment empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Looks up the signature registered for a function name.
     *
     * @param functionName the function name
     * @return the signature, or empty if the name is unknown
     */
    public Optional<CallSignature> lookup(String functionName) {
        return Optional.ofNullable(signatures.get(functionName));
    }

    public boolean contains(String functionName) {
        return signatures.containsKey(functionName);
    }

    /**
     * Returns the registered names, in registration order.
     */
    public Set<String> functionNames() {
        return signatures.keySet();
    }

    public int size() {
        return signatures.size();
    }

    /**
     * Returns a builder pre-populated with this environment's signatures.
     */
    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.signatures.putAll(signatures);
        return builder;
    }

    @Override
    public String toString() {
        return "FunctionEnvironment(" + signatures.size() + " functions)";
    }

    /**
     * Mutable builder for {@link FunctionEnvironment}. Not thread-safe.
     */
    public static final class Builder {

        private final Map<String, CallSignature> signatures = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * Registers a signature, replacing any previous one for the same name.
         *
         * @param functionName the function name
         * @param signature the signature
         * @return this builder
         */
        public Builder register(String functionName, CallSignature signature) {
            Objects.requireNonNull(functionName, "functionName must not be null");
            Objects.requireNonNull(signature, "signature must not be null");
            signatures.put(functionName, signature);
            return this;
        }

        /**
         * Registers a signature under its own function name.
         */
        public Builder register(CallSignature signature) {
            return register(Objects.requireNonNull(signature, "signature must not be null").functionName(), signature);
        }

        public boolean contains(String functionName) {
            return signatures.containsKey(functionName);
        }

        public FunctionEnvironment build() {
            return new FunctionEnvironment(signatures);
        }
    }
}
