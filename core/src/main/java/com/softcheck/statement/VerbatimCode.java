package com.softcheck.statement;

import java.util.Objects;

/**
 * Target-language code passed through verbatim. Never inspected.
 */
public final class VerbatimCode implements Statement {

    private final String code;

    public VerbatimCode(String code) {
        this.code = Objects.requireNonNull(code, "code must not be null");
    }

    public String code() {
        return code;
    }

    @Override
    public String toString() {
        return "VerbatimCode(" + code.length() + " chars)";
    }
}
