package com.raditha.loopchain.result;

import com.raditha.loopchain.model.MatchingState;

import java.util.Optional;

/**
 * Recognizes one family of loop idioms.
 */
public interface TransformationMatcher {

    /**
     * @param state the normalized loop
     * @return the transformation for the loop, or empty when the loop is not an instance of the idiom
     */
    Optional<TransformationMatch.Result> match(MatchingState state);
}
