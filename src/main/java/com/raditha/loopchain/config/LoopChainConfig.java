package com.raditha.loopchain.config;

/**
 * Configuration for loop to call chain conversion.
 *
 * @param maxChainCallCount   conversions producing more chained calls than this are skipped
 * @param assumeNonNull       treat every declaration without a nullability annotation as non-null
 * @param useMethodReferences render {@code map(Type::getter)} instead of {@code map(e -> e.getter())}
 *                            where the element type is declared
 */
public record LoopChainConfig(
        int maxChainCallCount,
        boolean assumeNonNull,
        boolean useMethodReferences) {
    /**
     * Validate configuration.
     */
    public LoopChainConfig {
        if (maxChainCallCount < 1) {
            throw new IllegalArgumentException("maxChainCallCount must be >= 1");
        }
    }

    /**
     * Default preset: chains of up to three calls, nullability taken from annotations only.
     */
    public static LoopChainConfig defaults() {
        return new LoopChainConfig(
                3, // maxChainCallCount
                false, // assumeNonNull
                true); // useMethodReferences
    }

    /**
     * Strict preset: single call conversions only, lambdas everywhere.
     */
    public static LoopChainConfig strict() {
        return new LoopChainConfig(
                1, // maxChainCallCount
                false, // assumeNonNull
                false); // useMethodReferences
    }
}
