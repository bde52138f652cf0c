package com.taleforge.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Optional;

/**
 * A roll the narrator asked for, decoded into one variant per roll kind.
 * Enumerated fields keep the text the narrator sent so that validation
 * can report exactly what was wrong with it.
 */
public sealed interface RollRequest {

    String id();

    /**
     * Wire code of the roll type as received.
     */
    String typeCode();

    default Optional<RollKind> kind() {
        return RollKind.fromCode(typeCode());
    }

    record AbilityCheck(
        String id,
        String ability,
        String skill,
        Integer dc,
        String advantage,
        int bonus
    ) implements RollRequest {
        @Override
        public String typeCode() {
            return RollKind.ABILITY_CHECK.code();
        }
    }

    record SavingThrow(
        String id,
        String ability,
        Integer dc,
        String advantage,
        int bonus
    ) implements RollRequest {
        @Override
        public String typeCode() {
            return RollKind.SAVING_THROW.code();
        }
    }

    /**
     * Attack by the player character. targetArmorClass is optional;
     * without it the result carries no success flag.
     */
    record AttackRoll(
        String id,
        String attacker,
        String target,
        String ability,
        Integer targetArmorClass,
        String advantage,
        int bonus,
        boolean proficient
    ) implements RollRequest {
        @Override
        public String typeCode() {
            return RollKind.ATTACK_ROLL.code();
        }
    }

    record DamageRoll(
        String id,
        String dice,
        int modifier,
        boolean critical,
        Integer rerollThreshold,
        String attackRef
    ) implements RollRequest {
        @Override
        public String typeCode() {
            return RollKind.DAMAGE_ROLL.code();
        }
    }

    /**
     * A request whose type is missing or not one of the known kinds.
     */
    record Unrecognized(
        String id,
        String typeCode,
        JsonNode raw
    ) implements RollRequest {
    }
}
