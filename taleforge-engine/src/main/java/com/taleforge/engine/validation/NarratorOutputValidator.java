package com.taleforge.engine.validation;

import com.taleforge.core.model.CampaignState;
import com.taleforge.core.model.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the three sub-validators over a decoded proposal and merges their
 * findings. Every problem is collected; nothing short-circuits.
 */
public class NarratorOutputValidator {

    private static final Logger log = LoggerFactory.getLogger(NarratorOutputValidator.class);

    private final RollRequestValidator rollRequestValidator;
    private final PatchValidator patchValidator;
    private final LoreDeltaValidator loreDeltaValidator;

    public NarratorOutputValidator(RollRequestValidator rollRequestValidator,
                                   PatchValidator patchValidator,
                                   LoreDeltaValidator loreDeltaValidator) {
        this.rollRequestValidator = rollRequestValidator;
        this.patchValidator = patchValidator;
        this.loreDeltaValidator = loreDeltaValidator;
    }

    public ValidationResult validate(NarratorProposal proposal, CampaignState current) {
        ValidationResult result = proposal.decodeProblems()
            .merge(rollRequestValidator.validate(proposal.rollRequests()))
            .merge(patchValidator.validate(proposal.patch(), current))
            .merge(loreDeltaValidator.validate(proposal.loreDeltas()));
        log.debug("Validated proposal: rolls={}, patches={}, lore={}, errors={}, warnings={}",
            proposal.rollRequests().size(), proposal.patch().size(), proposal.loreDeltas().size(),
            result.errors().size(), result.warnings().size());
        return result;
    }
}
