package com.taleforge.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Skills and the ability each one keys off.
 */
public enum Skill {
    ACROBATICS("acrobatics", Ability.DEX),
    ANIMAL_HANDLING("animal_handling", Ability.WIS),
    ARCANA("arcana", Ability.INT),
    ATHLETICS("athletics", Ability.STR),
    DECEPTION("deception", Ability.CHA),
    HISTORY("history", Ability.INT),
    INSIGHT("insight", Ability.WIS),
    INTIMIDATION("intimidation", Ability.CHA),
    INVESTIGATION("investigation", Ability.INT),
    MEDICINE("medicine", Ability.WIS),
    NATURE("nature", Ability.INT),
    PERCEPTION("perception", Ability.WIS),
    PERFORMANCE("performance", Ability.CHA),
    PERSUASION("persuasion", Ability.CHA),
    RELIGION("religion", Ability.INT),
    SLEIGHT_OF_HAND("sleight_of_hand", Ability.DEX),
    STEALTH("stealth", Ability.DEX),
    SURVIVAL("survival", Ability.WIS);

    private final String code;
    private final Ability ability;

    Skill(String code, Ability ability) {
        this.code = code;
        this.ability = ability;
    }

    public String code() {
        return code;
    }

    public Ability ability() {
        return ability;
    }

    /**
     * Resolve a wire code. Accepts "sleight of hand" style spellings.
     */
    public static Optional<Skill> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT).replace(' ', '_');
        for (Skill skill : values()) {
            if (skill.code.equals(normalized)) {
                return Optional.of(skill);
            }
        }
        return Optional.empty();
    }
}
