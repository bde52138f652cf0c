package com.taleforge.mechanics.check;

import com.taleforge.core.model.Ability;
import com.taleforge.core.model.AdvantageState;
import com.taleforge.core.model.Skill;
import com.taleforge.mechanics.dice.D20Roll;
import com.taleforge.mechanics.dice.DiceRoller;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Resolves ability checks, saving throws and contested checks.
 *
 * Modifier = ability modifier + flat bonus
 *          + proficiency bonus if proficient in the skill or the save
 *          + proficiency bonus again for skill expertise (never on saves).
 * Success is total >= difficulty class.
 */
public class CheckResolver {

    private static final Logger log = LoggerFactory.getLogger(CheckResolver.class);

    public static final String ABILITY = "ability";
    public static final String PROFICIENCY = "proficiency";
    public static final String EXPERTISE = "expertise";
    public static final String BONUS = "bonus";

    private final DiceRoller dice;

    public CheckResolver(DiceRoller dice) {
        this.dice = dice;
    }

    /**
     * Resolve an ability check, optionally with a skill.
     *
     * @param difficultyClass may be null, in which case success is null
     */
    public CheckResult resolveCheck(CharacterStats actor, Ability ability, Integer difficultyClass,
                                    Skill skill, int bonus, AdvantageState advantage) {
        boolean proficient = skill != null && actor.isProficient(skill);
        boolean expertise = skill != null && actor.hasExpertise(skill);

        Map<String, Integer> breakdown = new LinkedHashMap<>();
        breakdown.put(ABILITY, actor.abilityModifier(ability));
        if (proficient) {
            breakdown.put(PROFICIENCY, actor.proficiencyBonus());
        }
        if (expertise) {
            breakdown.put(EXPERTISE, actor.proficiencyBonus());
        }
        if (bonus != 0) {
            breakdown.put(BONUS, bonus);
        }

        CheckResult result = roll(ability, skill, breakdown, difficultyClass, advantage, proficient, expertise);
        log.debug("Ability check {}{}: natural={} total={} dc={} success={}",
            ability.code(), skill != null ? "/" + skill.code() : "",
            result.natural(), result.total(), difficultyClass, result.success());
        return result;
    }

    public CheckResult resolveCheck(CharacterStats actor, Ability ability, Integer difficultyClass) {
        return resolveCheck(actor, ability, difficultyClass, null, 0, AdvantageState.NONE);
    }

    /**
     * Resolve a saving throw. Save proficiency applies; expertise never does.
     */
    public CheckResult resolveSavingThrow(CharacterStats actor, Ability ability, Integer difficultyClass,
                                          int bonus, AdvantageState advantage) {
        boolean proficient = actor.isSaveProficient(ability);

        Map<String, Integer> breakdown = new LinkedHashMap<>();
        breakdown.put(ABILITY, actor.abilityModifier(ability));
        if (proficient) {
            breakdown.put(PROFICIENCY, actor.proficiencyBonus());
        }
        if (bonus != 0) {
            breakdown.put(BONUS, bonus);
        }

        CheckResult result = roll(ability, null, breakdown, difficultyClass, advantage, proficient, false);
        log.debug("Saving throw {}: natural={} total={} dc={} success={}",
            ability.code(), result.natural(), result.total(), difficultyClass, result.success());
        return result;
    }

    /**
     * Resolve two opposed checks. The actor rolls first; ties go to the actor.
     */
    public ContestResult resolveContestedCheck(CharacterStats actor, Ability actorAbility, Skill actorSkill,
                                               AdvantageState actorAdvantage,
                                               CharacterStats target, Ability targetAbility, Skill targetSkill,
                                               AdvantageState targetAdvantage) {
        CheckResult actorResult = resolveCheck(actor, actorAbility, null, actorSkill, 0, actorAdvantage);
        CheckResult targetResult = resolveCheck(target, targetAbility, null, targetSkill, 0, targetAdvantage);
        return new ContestResult(actorResult, targetResult);
    }

    private CheckResult roll(Ability ability, Skill skill, Map<String, Integer> breakdown, Integer difficultyClass,
                             AdvantageState advantage, boolean proficient, boolean expertise) {
        int modifier = breakdown.values().stream().reduce(0, Math::addExact);
        // fail before drawing so an out-of-range request consumes no dice
        Math.addExact(modifier, D20Roll.CRITICAL_FACE);
        D20Roll roll = dice.rollD20(advantage, modifier);
        Boolean success = difficultyClass != null ? roll.total() >= difficultyClass : null;
        return new CheckResult(ability, skill, roll, Collections.unmodifiableMap(breakdown), difficultyClass, success,
            proficient, expertise);
    }
}
