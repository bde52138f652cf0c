package com.taleforge.engine.narrator;

import com.taleforge.core.model.RollResult;

import java.util.List;

/**
 * Transport to the narrator that writes the story.
 *
 * Responses are raw text in the {@code DM_TEXT:} / {@code DM_JSON:} format and
 * may be malformed; the engine parses and validates everything it receives.
 * Implementations own their own timeouts. The engine never retries a call.
 */
public interface NarratorClient {

    /**
     * Ask for the narrator's proposal for the player's action.
     */
    String propose(NarratorContext context);

    /**
     * Ask the narrator to narrate the outcome of the rolls it requested.
     *
     * @param context           The context the proposal was made in
     * @param proposalNarrative Narrative of the proposal
     * @param results           Roll results in request order
     */
    String narrateOutcome(NarratorContext context, String proposalNarrative, List<RollResult> results);
}
