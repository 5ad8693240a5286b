package com.raditha.loopchain.result;

/**
 * Outcome of a successful match.
 */
public interface TransformationMatch {

    /**
     * The loop can be replaced as a whole by a call chain.
     *
     * @param resultTransformation how to replace it
     */
    record Result(ResultTransformation resultTransformation) implements TransformationMatch {
        public Result {
            if (resultTransformation == null) {
                throw new IllegalArgumentException("resultTransformation cannot be null");
            }
        }
    }
}
