package com.taleforge.mechanics.check;

import com.taleforge.core.model.Ability;
import com.taleforge.core.model.AdvantageState;
import com.taleforge.core.model.Skill;
import com.taleforge.mechanics.dice.D20Roll;

import java.util.Map;

/**
 * Outcome of an ability check or saving throw.
 * Natural 1 and 20 are flagged but do not decide success.
 *
 * @param success null when no difficulty class was given
 */
public record CheckResult(
    Ability ability,
    Skill skill,
    D20Roll roll,
    Map<String, Integer> modifierBreakdown,
    Integer difficultyClass,
    Boolean success,
    boolean proficient,
    boolean expertise
) {
    public int natural() {
        return roll.natural();
    }

    public int modifier() {
        return roll.modifier();
    }

    public int total() {
        return roll.total();
    }

    public AdvantageState advantage() {
        return roll.advantage();
    }

    public boolean critical() {
        return roll.critical();
    }

    public boolean fumble() {
        return roll.fumble();
    }
}
