package com.taleforge.mechanics.check;

import com.taleforge.core.model.Ability;
import com.taleforge.core.model.AdvantageState;
import com.taleforge.mechanics.dice.D20Roll;
import com.taleforge.mechanics.dice.DiceRoller;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Resolves attack rolls: d20 + ability modifier + proficiency (when
 * proficient) + bonus. A natural 20 always hits and a natural 1 always misses.
 */
public class AttackResolver {

    private static final Logger log = LoggerFactory.getLogger(AttackResolver.class);

    private final DiceRoller dice;

    public AttackResolver(DiceRoller dice) {
        this.dice = dice;
    }

    public AttackResult resolveAttack(CharacterStats attacker, Ability ability, boolean proficient, int bonus,
                                      Integer targetArmorClass, AdvantageState advantage) {
        Map<String, Integer> breakdown = new LinkedHashMap<>();
        breakdown.put(CheckResolver.ABILITY, attacker.abilityModifier(ability));
        if (proficient) {
            breakdown.put(CheckResolver.PROFICIENCY, attacker.proficiencyBonus());
        }
        if (bonus != 0) {
            breakdown.put(CheckResolver.BONUS, bonus);
        }
        int modifier = breakdown.values().stream().reduce(0, Math::addExact);
        // fail before drawing so an out-of-range request consumes no dice
        Math.addExact(modifier, D20Roll.CRITICAL_FACE);

        D20Roll roll = dice.rollD20(advantage, modifier);
        Boolean hit;
        if (roll.fumble()) {
            hit = false;
        } else if (roll.critical()) {
            hit = true;
        } else if (targetArmorClass != null) {
            hit = roll.total() >= targetArmorClass;
        } else {
            hit = null;
        }

        log.debug("Attack with {}: natural={} total={} ac={} hit={}",
            ability.code(), roll.natural(), roll.total(), targetArmorClass, hit);
        return new AttackResult(roll, Collections.unmodifiableMap(breakdown), targetArmorClass, hit);
    }
}
