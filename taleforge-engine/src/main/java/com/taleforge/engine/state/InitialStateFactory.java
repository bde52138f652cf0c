package com.taleforge.engine.state;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.taleforge.core.model.Ability;
import com.taleforge.core.model.Campaign;
import com.taleforge.core.model.CampaignState;
import com.taleforge.engine.mechanics.CharacterStatsMapper;
import com.taleforge.mechanics.character.HitPointCalculator;
import com.taleforge.mechanics.check.CharacterStats;

/**
 * Builds the turn-0 state of a campaign from its configuration.
 *
 * The party and world documents are taken as given and completed with
 * empty containers for every allow-listed location. A player without
 * hit points gets average-roll hit points for their class and level.
 */
public class InitialStateFactory {

    public CampaignState create(Campaign campaign) {
        ObjectNode document = JsonNodeFactory.instance.objectNode();

        ObjectNode party = campaign.initialParty().deepCopy();
        ObjectNode player = party.has("player") && party.get("player").isObject()
            ? (ObjectNode) party.get("player")
            : party.putObject("player");
        completePlayer(player);
        document.set(CampaignState.PARTY, party);

        ObjectNode world = campaign.initialWorld().deepCopy();
        objectIfMissing(world, "zones");
        arrayIfMissing(world, "quests");
        objectIfMissing(world, "npcs");
        objectIfMissing(world, "factions");
        objectIfMissing(world, "global_flags");
        document.set(CampaignState.WORLD, world);

        ObjectNode rules = document.putObject(CampaignState.RULES);
        rules.put("failure_style", campaign.failureStyle().name());
        rules.put("content_rating", campaign.contentRating().name());

        return new CampaignState(campaign.campaignId(), 0, campaign.startUniverseTime(), document);
    }

    private static void completePlayer(ObjectNode player) {
        if (!player.path(CharacterStatsMapper.LEVEL).isIntegralNumber()) {
            player.put(CharacterStatsMapper.LEVEL, 1);
        }
        objectIfMissing(player, CharacterStatsMapper.ABILITY_SCORES);
        arrayIfMissing(player, CharacterStatsMapper.SKILL_PROFICIENCIES);
        arrayIfMissing(player, CharacterStatsMapper.SKILL_EXPERTISES);
        arrayIfMissing(player, CharacterStatsMapper.SAVE_PROFICIENCIES);
        arrayIfMissing(player, "conditions");
        arrayIfMissing(player, "inventory");
        objectIfMissing(player, "money");
        ObjectNode resources = objectIfMissing(player, "resources");
        objectIfMissing(resources, "hit_dice");
        objectIfMissing(resources, "spell_slots");

        ObjectNode hp = objectIfMissing(player, "hp");
        if (!hp.path("max").isIntegralNumber()) {
            CharacterStats stats = CharacterStatsMapper.fromPlayer(player);
            int hitDie = HitPointCalculator.hitDieFor(player.path("class").asText(null));
            int max = HitPointCalculator.maxHitPointsWithAverages(
                hitDie, stats.abilityModifier(Ability.CON), stats.level());
            hp.put("max", max);
        }
        if (!hp.path("current").isIntegralNumber()) {
            hp.put("current", hp.path("max").asInt());
        }
        if (!hp.path("temp").isIntegralNumber()) {
            hp.put("temp", 0);
        }
    }

    private static ObjectNode objectIfMissing(ObjectNode parent, String field) {
        JsonNode existing = parent.get(field);
        if (existing != null && existing.isObject()) {
            return (ObjectNode) existing;
        }
        return parent.putObject(field);
    }

    private static void arrayIfMissing(ObjectNode parent, String field) {
        JsonNode existing = parent.get(field);
        if (existing == null || !existing.isArray()) {
            parent.putArray(field);
        }
    }
}
