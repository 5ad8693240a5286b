package com.raditha.loopchain.analysis;

/**
 * What a variable's declared type says about null.
 */
public enum TypeNullability {
    /**
     * The type excludes null: primitives, {@code @NonNull}, or unannotated inside {@code @NullMarked} code.
     */
    NOT_NULL,

    /**
     * The type explicitly admits null.
     */
    NULLABLE,

    /**
     * Nothing is known; treated like {@link #NULLABLE} by the matchers.
     */
    FLEXIBLE
}
