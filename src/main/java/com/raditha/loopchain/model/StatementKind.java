package com.raditha.loopchain.model;

/**
 * Shape of a statement left in a loop body after the filter has been peeled off.
 * The matchers switch on this tag instead of testing node types themselves.
 */
public enum StatementKind {
    /**
     * An expression statement holding an assignment (any operator).
     */
    ASSIGNMENT,

    /**
     * A {@code break}, labeled or not.
     */
    BREAK,

    /**
     * A {@code return}, with or without a value.
     */
    RETURN,

    /**
     * Anything else.
     */
    OTHER
}
