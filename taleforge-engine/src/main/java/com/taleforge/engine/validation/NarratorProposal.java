package com.taleforge.engine.validation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.taleforge.core.model.LoreDelta;
import com.taleforge.core.model.RollRequest;
import com.taleforge.core.model.StatePatch;
import com.taleforge.core.model.ValidationResult;

import java.util.ArrayList;
import java.util.List;

/**
 * Typed view of a narrator payload.
 *
 * @param rollSpec       the roll_requests section as received, kept for the audit trail
 * @param decodeProblems shape errors found while decoding
 */
public record NarratorProposal(
    List<RollRequest> rollRequests,
    StatePatch patch,
    List<LoreDelta> loreDeltas,
    JsonNode rollSpec,
    ValidationResult decodeProblems
) {
    public static final NarratorProposal EMPTY = new NarratorProposal(
        List.of(), StatePatch.EMPTY, List.of(), null, ValidationResult.ok());

    public NarratorProposal {
        rollRequests = rollRequests == null ? List.of() : List.copyOf(rollRequests);
        patch = patch == null ? StatePatch.EMPTY : patch;
        loreDeltas = loreDeltas == null ? List.of() : List.copyOf(loreDeltas);
        rollSpec = rollSpec == null ? JsonNodeFactory.instance.arrayNode() : rollSpec.deepCopy();
        decodeProblems = decodeProblems == null ? ValidationResult.ok() : decodeProblems;
    }

    public boolean hasRolls() {
        return !rollRequests.isEmpty();
    }

    /**
     * Same proposal with the final narration's patches appended.
     */
    public NarratorProposal withAdditionalPatch(StatePatch extra, ValidationResult extraProblems) {
        return new NarratorProposal(rollRequests, patch.concat(extra), loreDeltas, rollSpec,
            decodeProblems.merge(extraProblems));
    }

    /**
     * Same proposal with more lore appended.
     */
    public NarratorProposal withAdditionalLore(List<LoreDelta> extra) {
        if (extra.isEmpty()) {
            return this;
        }
        List<LoreDelta> combined = new ArrayList<>(loreDeltas);
        combined.addAll(extra);
        return new NarratorProposal(rollRequests, patch, combined, rollSpec, decodeProblems);
    }
}
