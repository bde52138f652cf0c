package com.taleforge.engine.validation;

import com.fasterxml.jackson.databind.JsonNode;
import com.taleforge.core.model.CalendarConfig;
import com.taleforge.core.model.LoreDelta;
import com.taleforge.core.model.LoreType;
import com.taleforge.core.model.ValidationResult;

import java.util.List;
import java.util.Optional;

/**
 * Checks lore deltas. Hard canon is accepted but always flagged for review.
 */
public class LoreDeltaValidator {

    public static final String TYPE_REQUIRED = "TYPE_REQUIRED";
    public static final String UNKNOWN_LORE_TYPE = "UNKNOWN_LORE_TYPE";
    public static final String TEXT_REQUIRED = "TEXT_REQUIRED";
    public static final String TEXT_TOO_LONG = "TEXT_TOO_LONG";
    public static final String HARD_CANON = "HARD_CANON";

    private final ProposalDecoder decoder;
    private final ValidationLimits limits;
    private final CalendarConfig calendar;

    public LoreDeltaValidator(ProposalDecoder decoder, ValidationLimits limits, CalendarConfig calendar) {
        this.decoder = decoder;
        this.limits = limits;
        this.calendar = calendar;
    }

    /**
     * Decode and validate a raw lore_deltas section.
     */
    public ValidationResult validate(JsonNode section) {
        ValidationResult.Builder problems = ValidationResult.builder();
        List<LoreDelta> deltas = decoder.decodeLoreDeltas(section, ProposalDecoder.LORE_DELTAS, problems);
        return problems.build().merge(validate(deltas));
    }

    public ValidationResult validate(List<LoreDelta> deltas) {
        ValidationResult.Builder result = ValidationResult.builder();
        for (int i = 0; i < deltas.size(); i++) {
            LoreDelta delta = deltas.get(i);
            String path = ProposalDecoder.LORE_DELTAS + "[" + i + "]";

            if (delta.type() == null || delta.type().isBlank()) {
                result.error(path + ".type", TYPE_REQUIRED, "Lore delta needs a type");
            } else {
                Optional<LoreType> type = delta.loreType();
                if (type.isEmpty()) {
                    result.error(path + ".type", UNKNOWN_LORE_TYPE,
                        "type must be hard_canon or soft_lore, got " + delta.type());
                } else if (type.get() == LoreType.HARD_CANON) {
                    result.warning(path, HARD_CANON, "Hard canon bypasses lore compaction; review it");
                }
            }

            if (delta.text() == null || delta.text().isBlank()) {
                result.error(path + ".text", TEXT_REQUIRED, "Lore delta needs text");
            } else if (delta.text().length() > limits.maxLoreTextLength()) {
                result.error(path + ".text", TEXT_TOO_LONG, String.format(
                    "text is %d characters, limit is %d", delta.text().length(), limits.maxLoreTextLength()));
            }

            if (delta.timeRef() != null && !delta.timeRef().fitsCalendar(calendar)) {
                result.error(path + ".time_ref", ProposalDecoder.INVALID_TIME_REF,
                    "time_ref is not a valid calendar date");
            }
        }
        return result.build();
    }
}
