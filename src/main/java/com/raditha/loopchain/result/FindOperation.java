package com.raditha.loopchain.result;

/**
 * The operations a find loop can be replaced with, named after the call chain they stand for.
 */
public enum FindOperation {
    FIRST_OR_NULL("firstOrNull"),
    LAST_OR_NULL("lastOrNull"),
    ANY("any"),
    NONE("none"),
    CONTAINS("contains"),
    INDEX_OF("indexOf"),
    LAST_INDEX_OF("lastIndexOf"),
    INDEX_OF_FIRST("indexOfFirst"),
    INDEX_OF_LAST("indexOfLast");

    private final String functionName;

    FindOperation(String functionName) {
        this.functionName = functionName;
    }

    public String functionName() {
        return functionName;
    }

    /**
     * Whether the rendered chain ends in {@code .orElse(null)} and may be extended by the
     * mapping and fallback decorators.
     */
    public boolean producesNullableElement() {
        return this == FIRST_OR_NULL || this == LAST_OR_NULL;
    }
}
