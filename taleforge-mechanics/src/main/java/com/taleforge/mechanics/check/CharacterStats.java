package com.taleforge.mechanics.check;

import com.taleforge.core.model.Ability;
import com.taleforge.core.model.Skill;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Ability scores, level and proficiencies of one actor.
 *
 * Invariants:
 * - every ability has a score; missing ones default to 10
 * - level >= 1
 */
public record CharacterStats(
    Map<Ability, Integer> scores,
    int level,
    Set<Skill> skillProficiencies,
    Set<Skill> skillExpertises,
    Set<Ability> saveProficiencies
) {
    public static final int DEFAULT_SCORE = 10;

    public CharacterStats {
        EnumMap<Ability, Integer> filled = new EnumMap<>(Ability.class);
        for (Ability ability : Ability.values()) {
            Integer score = scores != null ? scores.get(ability) : null;
            filled.put(ability, score != null ? score : DEFAULT_SCORE);
        }
        scores = Collections.unmodifiableMap(filled);
        if (level < 1) {
            throw new IllegalArgumentException("level must be >= 1: " + level);
        }
        skillProficiencies = immutableSkills(skillProficiencies);
        skillExpertises = immutableSkills(skillExpertises);
        saveProficiencies = saveProficiencies == null || saveProficiencies.isEmpty()
            ? Set.of()
            : Collections.unmodifiableSet(EnumSet.copyOf(saveProficiencies));
    }

    public int score(Ability ability) {
        return scores.get(ability);
    }

    /**
     * floor((score - 10) / 2)
     */
    public int abilityModifier(Ability ability) {
        return Math.floorDiv(score(ability) - 10, 2);
    }

    public int proficiencyBonus() {
        return proficiencyBonus(level);
    }

    public static int proficiencyBonus(int level) {
        return 2 + (level - 1) / 4;
    }

    /**
     * Expertise implies proficiency.
     */
    public boolean isProficient(Skill skill) {
        return skillProficiencies.contains(skill) || skillExpertises.contains(skill);
    }

    public boolean hasExpertise(Skill skill) {
        return skillExpertises.contains(skill);
    }

    public boolean isSaveProficient(Ability ability) {
        return saveProficiencies.contains(ability);
    }

    public static Builder builder() {
        return new Builder();
    }

    private static Set<Skill> immutableSkills(Set<Skill> skills) {
        return skills == null || skills.isEmpty()
            ? Set.of()
            : Collections.unmodifiableSet(EnumSet.copyOf(skills));
    }

    public static class Builder {
        private final Map<Ability, Integer> scores = new EnumMap<>(Ability.class);
        private int level = 1;
        private final Set<Skill> proficiencies = EnumSet.noneOf(Skill.class);
        private final Set<Skill> expertises = EnumSet.noneOf(Skill.class);
        private final Set<Ability> saves = EnumSet.noneOf(Ability.class);

        public Builder score(Ability ability, int score) {
            scores.put(ability, score);
            return this;
        }

        public Builder level(int level) {
            this.level = level;
            return this;
        }

        public Builder proficient(Skill skill) {
            proficiencies.add(skill);
            return this;
        }

        public Builder expertise(Skill skill) {
            expertises.add(skill);
            return this;
        }

        public Builder saveProficient(Ability ability) {
            saves.add(ability);
            return this;
        }

        public CharacterStats build() {
            return new CharacterStats(scores, level, proficiencies, expertises, saves);
        }
    }
}
