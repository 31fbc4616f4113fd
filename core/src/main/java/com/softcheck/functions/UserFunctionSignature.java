package com.softcheck.functions;

import com.softcheck.types.TypeTag;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Arity-only signature of a user-defined function.
 *
 * <p>Accepts any call with exactly {@code arity} arguments, whatever their types,
 * and always returns {@link TypeTag#UNKNOWN}: no return-type inference is
 * attempted for user-defined functions.
 */
public final class UserFunctionSignature implements CallSignature {

    private final String functionName;
    private final int arity;

    public UserFunctionSignature(String functionName, int arity) {
        this.functionName = Objects.requireNonNull(functionName, "functionName must not be null");
        if (arity < 0) {
            throw new IllegalArgumentException("arity must not be negative: " + arity);
        }
        this.arity = arity;
    }

    @Override
    public String functionName() {
        return functionName;
    }

    public int arity() {
        return arity;
    }

    @Override
    public Optional<TypeTag> apply(List<TypeTag> argumentTypes) {
        return argumentTypes.size() == arity ? Optional.of(TypeTag.UNKNOWN) : Optional.empty();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof UserFunctionSignature)) return false;
        UserFunctionSignature that = (UserFunctionSignature) obj;
        return arity == that.arity && functionName.equals(that.functionName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(functionName, arity);
    }

    @Override
    public String toString() {
        return "UserFunctionSignature(" + functionName + "/" + arity + ")";
    }
}
