package com.taleforge.engine.mechanics;

import com.taleforge.core.exception.TaleforgeException;
import com.taleforge.core.model.Ability;
import com.taleforge.core.model.AdvantageState;
import com.taleforge.core.model.RollKind;
import com.taleforge.core.model.RollRequest;
import com.taleforge.core.model.RollResult;
import com.taleforge.core.model.Skill;
import com.taleforge.mechanics.check.AttackResolver;
import com.taleforge.mechanics.check.AttackResult;
import com.taleforge.mechanics.check.CharacterStats;
import com.taleforge.mechanics.check.CheckResolver;
import com.taleforge.mechanics.check.CheckResult;
import com.taleforge.mechanics.dice.D20Roll;
import com.taleforge.mechanics.dice.DiceExpression;
import com.taleforge.mechanics.dice.DiceRollResult;
import com.taleforge.mechanics.dice.DiceRoller;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Executes roll requests against the player's stats with one turn's dice.
 *
 * Results come back in request order. A request that cannot be executed
 * (unknown type, bad ability or skill, bad dice notation) yields a result
 * carrying an error; the rest of the batch still runs. Failed requests
 * consume no dice.
 */
public class MechanicsExecutor {

    private static final Logger log = LoggerFactory.getLogger(MechanicsExecutor.class);

    public static final String DICE_MODIFIER = "dice_modifier";
    public static final String MODIFIER = "modifier";
    public static final String MINIMUM_FLOOR = "minimum_floor";

    public List<RollResult> execute(List<RollRequest> requests, CharacterStats actor, DiceRoller dice) {
        CheckResolver checks = new CheckResolver(dice);
        AttackResolver attacks = new AttackResolver(dice);
        Map<String, RollResult> byId = new HashMap<>();
        List<RollResult> results = new ArrayList<>(requests.size());

        for (RollRequest request : requests) {
            RollResult result;
            try {
                result = executeOne(request, actor, dice, checks, attacks, byId);
            } catch (TaleforgeException | IllegalArgumentException e) {
                result = RollResult.failed(request.id(), request.kind().orElse(null), e.getMessage());
            } catch (ArithmeticException e) {
                result = RollResult.failed(request.id(), request.kind().orElse(null),
                    "Roll total out of range: " + e.getMessage());
            }
            if (result.hasError()) {
                log.debug("Roll {} failed: {}", request.id(), result.error());
            } else {
                log.debug("Roll {} ({}): dice={} modifier={} total={} success={}",
                    result.rollId(), result.kind().code(), result.dieValues(), result.modifier(),
                    result.total(), result.success());
            }
            if (request.id() != null) {
                byId.putIfAbsent(request.id(), result);
            }
            results.add(result);
        }
        return results;
    }

    private RollResult executeOne(RollRequest request, CharacterStats actor, DiceRoller dice,
                                  CheckResolver checks, AttackResolver attacks, Map<String, RollResult> earlier) {
        if (request instanceof RollRequest.AbilityCheck check) {
            Ability ability = ability(check.ability(), null);
            Skill skill = null;
            if (check.skill() != null) {
                skill = Skill.fromCode(check.skill())
                    .orElseThrow(() -> new IllegalArgumentException("Unknown skill: " + check.skill()));
            }
            AdvantageState advantage = advantage(check.advantage());
            CheckResult outcome = checks.resolveCheck(actor, ability, check.dc(), skill, check.bonus(), advantage);
            return fromD20(check.id(), RollKind.ABILITY_CHECK, outcome.roll(), outcome.modifierBreakdown(),
                outcome.difficultyClass(), outcome.success());
        }
        if (request instanceof RollRequest.SavingThrow save) {
            Ability ability = ability(save.ability(), null);
            AdvantageState advantage = advantage(save.advantage());
            CheckResult outcome = checks.resolveSavingThrow(actor, ability, save.dc(), save.bonus(), advantage);
            return fromD20(save.id(), RollKind.SAVING_THROW, outcome.roll(), outcome.modifierBreakdown(),
                outcome.difficultyClass(), outcome.success());
        }
        if (request instanceof RollRequest.AttackRoll attack) {
            Ability ability = ability(attack.ability(), Ability.STR);
            AdvantageState advantage = advantage(attack.advantage());
            AttackResult outcome = attacks.resolveAttack(actor, ability, attack.proficient(), attack.bonus(),
                attack.targetArmorClass(), advantage);
            return fromD20(attack.id(), RollKind.ATTACK_ROLL, outcome.roll(), outcome.modifierBreakdown(),
                outcome.targetArmorClass(), outcome.hit());
        }
        if (request instanceof RollRequest.DamageRoll damage) {
            return executeDamage(damage, dice, earlier);
        }
        String type = request.typeCode() == null ? "missing" : request.typeCode();
        return RollResult.failed(request.id(), null, "Unknown roll type: " + type);
    }

    private RollResult executeDamage(RollRequest.DamageRoll damage, DiceRoller dice,
                                     Map<String, RollResult> earlier) {
        DiceExpression expression = DiceExpression.parse(damage.dice() == null ? "" : damage.dice());
        boolean critical = damage.critical();
        if (!critical && damage.attackRef() != null) {
            RollResult attack = earlier.get(damage.attackRef());
            critical = attack != null && attack.kind() == RollKind.ATTACK_ROLL && attack.critical();
        }
        DiceRollResult rolled = dice.rollDamage(expression, damage.modifier(), critical, damage.rerollThreshold());

        Map<String, Integer> breakdown = new LinkedHashMap<>();
        if (rolled.expressionModifier() != 0) {
            breakdown.put(DICE_MODIFIER, rolled.expressionModifier());
        }
        if (rolled.extraModifier() != 0) {
            breakdown.put(MODIFIER, rolled.extraModifier());
        }
        if (rolled.floored()) {
            breakdown.put(MINIMUM_FLOOR, rolled.floorAdjustment());
        }
        return new RollResult(damage.id(), RollKind.DAMAGE_ROLL,
            rolled.dieValues(), rolled.discardedValues(), breakdown, rolled.modifier(), rolled.total(),
            null, null, AdvantageState.NONE, critical, false, null);
    }

    private static RollResult fromD20(String id, RollKind kind, D20Roll roll, Map<String, Integer> breakdown,
                                      Integer difficultyClass, Boolean success) {
        List<Integer> discarded = roll.discarded() != null ? List.of(roll.discarded()) : List.of();
        return new RollResult(id, kind, List.of(roll.natural()), discarded, breakdown, roll.modifier(),
            roll.total(), difficultyClass, success, roll.advantage(), roll.critical(), roll.fumble(), null);
    }

    private static Ability ability(String code, Ability fallback) {
        if (code == null && fallback != null) {
            return fallback;
        }
        Optional<Ability> ability = Ability.fromCode(code);
        return ability.orElseThrow(() -> new IllegalArgumentException(
            code == null ? "Ability is required" : "Unknown ability: " + code));
    }

    private static AdvantageState advantage(String code) {
        return AdvantageState.fromCode(code)
            .orElseThrow(() -> new IllegalArgumentException("Unknown advantage state: " + code));
    }
}
