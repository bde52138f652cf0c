package com.taleforge.engine.validation;

import com.fasterxml.jackson.databind.JsonNode;
import com.taleforge.core.exception.InvalidDiceExpressionException;
import com.taleforge.core.model.Ability;
import com.taleforge.core.model.AdvantageState;
import com.taleforge.core.model.RollRequest;
import com.taleforge.core.model.Skill;
import com.taleforge.core.model.ValidationResult;
import com.taleforge.mechanics.dice.DiceExpression;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Checks roll requests: unique ids, known kinds, abilities, skills and
 * advantage states, difficulty classes in range, and dice notation for damage.
 */
public class RollRequestValidator {

    public static final String ID_REQUIRED = "ID_REQUIRED";
    public static final String DUPLICATE_ROLL_ID = "DUPLICATE_ROLL_ID";
    public static final String TYPE_REQUIRED = "TYPE_REQUIRED";
    public static final String UNKNOWN_ROLL_TYPE = "UNKNOWN_ROLL_TYPE";
    public static final String ABILITY_REQUIRED = "ABILITY_REQUIRED";
    public static final String UNKNOWN_ABILITY = "UNKNOWN_ABILITY";
    public static final String UNKNOWN_SKILL = "UNKNOWN_SKILL";
    public static final String SKILL_ABILITY_MISMATCH = "SKILL_ABILITY_MISMATCH";
    public static final String UNKNOWN_ADVANTAGE = "UNKNOWN_ADVANTAGE";
    public static final String DC_REQUIRED = "DC_REQUIRED";
    public static final String INVALID_DC = "INVALID_DC";
    public static final String INVALID_ARMOR_CLASS = "INVALID_ARMOR_CLASS";
    public static final String ATTACKER_MISSING = "ATTACKER_MISSING";
    public static final String TARGET_MISSING = "TARGET_MISSING";
    public static final String DICE_REQUIRED = "DICE_REQUIRED";
    public static final String INVALID_DICE_EXPRESSION = "INVALID_DICE_EXPRESSION";
    public static final String INVALID_REROLL_THRESHOLD = "INVALID_REROLL_THRESHOLD";
    public static final String UNKNOWN_ATTACK_REF = "UNKNOWN_ATTACK_REF";
    public static final String INVALID_BONUS = "INVALID_BONUS";

    private final ProposalDecoder decoder;
    private final ValidationLimits limits;

    public RollRequestValidator(ProposalDecoder decoder, ValidationLimits limits) {
        this.decoder = decoder;
        this.limits = limits;
    }

    /**
     * Decode and validate a raw roll_requests section.
     */
    public ValidationResult validate(JsonNode section) {
        ValidationResult.Builder problems = ValidationResult.builder();
        List<RollRequest> requests = decoder.decodeRollRequests(section, ProposalDecoder.ROLL_REQUESTS, problems);
        return problems.build().merge(validate(requests));
    }

    public ValidationResult validate(List<RollRequest> requests) {
        ValidationResult.Builder result = ValidationResult.builder();
        Set<String> seenIds = new HashSet<>();
        Set<String> attackIds = new HashSet<>();
        for (RollRequest request : requests) {
            if (request instanceof RollRequest.AttackRoll && request.id() != null) {
                attackIds.add(request.id());
            }
        }

        for (int i = 0; i < requests.size(); i++) {
            RollRequest request = requests.get(i);
            String path = ProposalDecoder.ROLL_REQUESTS + "[" + i + "]";

            if (request.id() == null || request.id().isBlank()) {
                result.error(path + ".id", ID_REQUIRED, "Roll request needs an id");
            } else if (!seenIds.add(request.id())) {
                result.error(path + ".id", DUPLICATE_ROLL_ID, "Duplicate roll id: " + request.id());
            }

            if (request instanceof RollRequest.AbilityCheck check) {
                validateCheck(check, path, result);
            } else if (request instanceof RollRequest.SavingThrow save) {
                requireAbility(save.ability(), path, result);
                if (save.dc() == null) {
                    result.error(path + ".dc", DC_REQUIRED, "Saving throw needs a dc");
                } else {
                    checkDc(save.dc(), path, result);
                }
                checkAdvantage(save.advantage(), path, result);
                checkBonus(save.bonus(), path + ".bonus", result);
            } else if (request instanceof RollRequest.AttackRoll attack) {
                validateAttack(attack, path, result);
            } else if (request instanceof RollRequest.DamageRoll damage) {
                validateDamage(damage, path, attackIds, result);
            } else if (request instanceof RollRequest.Unrecognized unknown) {
                if (unknown.typeCode() == null) {
                    result.error(path + ".type", TYPE_REQUIRED, "Roll request needs a type");
                } else {
                    result.error(path + ".type", UNKNOWN_ROLL_TYPE, "Unknown roll type: " + unknown.typeCode());
                }
            }
        }
        return result.build();
    }

    private void validateCheck(RollRequest.AbilityCheck check, String path, ValidationResult.Builder result) {
        Optional<Ability> ability = requireAbility(check.ability(), path, result);
        if (check.skill() != null) {
            Optional<Skill> skill = Skill.fromCode(check.skill());
            if (skill.isEmpty()) {
                result.error(path + ".skill", UNKNOWN_SKILL, "Unknown skill: " + check.skill());
            } else if (ability.isPresent() && skill.get().ability() != ability.get()) {
                result.warning(path + ".skill", SKILL_ABILITY_MISMATCH, String.format(
                    "%s normally uses %s, not %s",
                    skill.get().code(), skill.get().ability().code(), ability.get().code()));
            }
        }
        if (check.dc() != null) {
            checkDc(check.dc(), path, result);
        }
        checkAdvantage(check.advantage(), path, result);
        checkBonus(check.bonus(), path + ".bonus", result);
    }

    private void validateAttack(RollRequest.AttackRoll attack, String path, ValidationResult.Builder result) {
        if (attack.attacker() == null || attack.attacker().isBlank()) {
            result.warning(path + ".attacker", ATTACKER_MISSING, "Attack roll has no attacker; assuming the player");
        }
        if (attack.target() == null || attack.target().isBlank()) {
            result.warning(path + ".target", TARGET_MISSING, "Attack roll has no target");
        }
        if (attack.ability() != null && Ability.fromCode(attack.ability()).isEmpty()) {
            result.error(path + ".ability", UNKNOWN_ABILITY, "Unknown ability: " + attack.ability());
        }
        if (attack.targetArmorClass() != null
            && (attack.targetArmorClass() < 1 || attack.targetArmorClass() > limits.maxDifficultyClass())) {
            result.error(path + ".target_ac", INVALID_ARMOR_CLASS, String.format(
                "target_ac must be between 1 and %d", limits.maxDifficultyClass()));
        }
        checkAdvantage(attack.advantage(), path, result);
        checkBonus(attack.bonus(), path + ".bonus", result);
    }

    private void validateDamage(RollRequest.DamageRoll damage, String path, Set<String> attackIds,
                                ValidationResult.Builder result) {
        if (damage.dice() == null || damage.dice().isBlank()) {
            result.error(path + ".dice", DICE_REQUIRED, "Damage roll needs a dice expression");
        } else {
            try {
                DiceExpression expression = DiceExpression.parse(damage.dice());
                int rolled = damage.critical() ? expression.count() * 2 : expression.count();
                if (rolled > limits.maxDiceCount()) {
                    result.error(path + ".dice", INVALID_DICE_EXPRESSION, String.format(
                        "%d dice exceeds the limit of %d", rolled, limits.maxDiceCount()));
                }
                checkBonus(expression.modifier(), path + ".dice", result);
            } catch (InvalidDiceExpressionException e) {
                result.error(path + ".dice", INVALID_DICE_EXPRESSION, e.getMessage());
            }
        }
        checkBonus(damage.modifier(), path + ".modifier", result);
        if (damage.rerollThreshold() != null && damage.rerollThreshold() < 1) {
            result.error(path + ".reroll_threshold", INVALID_REROLL_THRESHOLD, "reroll_threshold must be at least 1");
        }
        if (damage.attackRef() != null && !attackIds.contains(damage.attackRef())) {
            result.warning(path + ".attack_ref", UNKNOWN_ATTACK_REF,
                "attack_ref does not name an attack roll in this batch: " + damage.attackRef());
        }
    }

    private Optional<Ability> requireAbility(String code, String path, ValidationResult.Builder result) {
        if (code == null || code.isBlank()) {
            result.error(path + ".ability", ABILITY_REQUIRED, "Roll needs an ability");
            return Optional.empty();
        }
        Optional<Ability> ability = Ability.fromCode(code);
        if (ability.isEmpty()) {
            result.error(path + ".ability", UNKNOWN_ABILITY, "Unknown ability: " + code);
        }
        return ability;
    }

    private void checkDc(int dc, String path, ValidationResult.Builder result) {
        if (dc < limits.minDifficultyClass() || dc > limits.maxDifficultyClass()) {
            result.error(path + ".dc", INVALID_DC, String.format(
                "dc must be between %d and %d, got %d",
                limits.minDifficultyClass(), limits.maxDifficultyClass(), dc));
        }
    }

    private void checkBonus(int bonus, String path, ValidationResult.Builder result) {
        if (Math.abs((long) bonus) > limits.maxBonus()) {
            result.error(path, INVALID_BONUS, String.format(
                "Flat bonus must be between -%d and %d, got %d", limits.maxBonus(), limits.maxBonus(), bonus));
        }
    }

    private static void checkAdvantage(String advantage, String path, ValidationResult.Builder result) {
        if (AdvantageState.fromCode(advantage).isEmpty()) {
            result.error(path + ".advantage", UNKNOWN_ADVANTAGE,
                "advantage must be none, advantage or disadvantage");
        }
    }
}
