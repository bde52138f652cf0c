package com.taleforge.engine.mechanics;

import com.fasterxml.jackson.databind.JsonNode;
import com.taleforge.core.model.Ability;
import com.taleforge.core.model.Skill;
import com.taleforge.mechanics.check.CharacterStats;

/**
 * Reads the player's mechanical profile out of the state document.
 * Missing scores default to 10 and a missing level to 1; unknown skill
 * and ability codes are ignored.
 */
public final class CharacterStatsMapper {

    public static final String ABILITY_SCORES = "ability_scores";
    public static final String LEVEL = "level";
    public static final String SKILL_PROFICIENCIES = "skill_proficiencies";
    public static final String SKILL_EXPERTISES = "skill_expertises";
    public static final String SAVE_PROFICIENCIES = "save_proficiencies";

    private CharacterStatsMapper() {
    }

    public static CharacterStats fromPlayer(JsonNode player) {
        CharacterStats.Builder builder = CharacterStats.builder();
        JsonNode scores = player.path(ABILITY_SCORES);
        for (Ability ability : Ability.values()) {
            JsonNode score = scores.get(ability.code());
            if (score != null && score.isIntegralNumber()) {
                builder.score(ability, score.asInt());
            }
        }
        JsonNode level = player.path(LEVEL);
        builder.level(level.isIntegralNumber() && level.asInt() >= 1 ? level.asInt() : 1);

        for (JsonNode code : player.path(SKILL_PROFICIENCIES)) {
            Skill.fromCode(code.asText()).ifPresent(builder::proficient);
        }
        for (JsonNode code : player.path(SKILL_EXPERTISES)) {
            Skill.fromCode(code.asText()).ifPresent(builder::expertise);
        }
        for (JsonNode code : player.path(SAVE_PROFICIENCIES)) {
            Ability.fromCode(code.asText()).ifPresent(builder::saveProficient);
        }
        return builder.build();
    }
}
