package com.softcheck.functions;

import com.softcheck.types.TypeTag;
import java.util.List;
import java.util.Optional;

/**
 * Signature of a callable function: a partial mapping from argument types to a return type.
 *
 * <p>Signatures are immutable and registered once, before analysis starts.
 */
public sealed interface CallSignature permits BuiltinSignature, UserFunctionSignature {

    /**
     * Returns the function name this signature was registered for.
     */
    String functionName();

    /**
     * Applies the signature to the inferred argument types.
     *
     * @param argumentTypes the argument types, in call order
     * @return the return type, or empty if no variant accepts these arguments
     */
    Optional<TypeTag> apply(List<TypeTag> argumentTypes);
}
