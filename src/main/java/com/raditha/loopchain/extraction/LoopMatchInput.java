package com.raditha.loopchain.extraction;

import com.raditha.loopchain.model.FilterCondition;
import com.raditha.loopchain.model.MatchingState;
import org.jspecify.annotations.Nullable;

/**
 * A normalized loop ready to be handed to a matcher.
 *
 * @param state  the loop with the statements left after filter peeling
 * @param filter the peeled filter, or null when the body is unconditional
 */
public record LoopMatchInput(MatchingState state, @Nullable FilterCondition filter) {
}
