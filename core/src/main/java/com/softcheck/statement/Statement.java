package com.softcheck.statement;

/**
 * A top-level construct of a program.
 *
 * <p>Statements are analyzed independently of each other; only the function
 * environment is shared between them.
 */
public sealed interface Statement
    permits Query, Update, Delete, Create, Insert, UserFunction, VerbatimCode {
}
