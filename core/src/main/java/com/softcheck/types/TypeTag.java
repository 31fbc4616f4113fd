package com.softcheck.types;

/**
 * Type tags of the soft type system.
 *
 * <p>Most values only acquire a concrete type at runtime, so the analyzer works
 * with a small lattice:
 * <ul>
 *   <li>{@link #NUMERIC} - integers, floats, dates and timestamps</li>
 *   <li>{@link #BOOLEAN} - boolean values and predicates</li>
 *   <li>{@link #STRING} - string literals</li>
 *   <li>{@link #UNKNOWN} - anything whose type is only known at runtime</li>
 * </ul>
 *
 * <p>{@link #UNIT} is a placeholder reported only when a list that the parser
 * guarantees to be non-empty turns out to be empty.
 *
 * @see TypeLattice
 */
public enum TypeTag {
    NUMERIC("Numeric"),
    BOOLEAN("Boolean"),
    STRING("String"),
    UNKNOWN("Unknown"),
    UNIT("Unit");

    private final String displayName;

    TypeTag(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
