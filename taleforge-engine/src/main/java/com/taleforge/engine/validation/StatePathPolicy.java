package com.taleforge.engine.validation;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Allow-list of mutable state locations and the value domain of each.
 * Built once and shared; a path matching no rule may not be patched.
 *
 * Placeholders in templates: {@code {key}} matches one object key,
 * {@code {i}} matches a list index or "-" (append).
 */
public final class StatePathPolicy {

    private static final String KEY = "[A-Za-z0-9_.\\-]+";
    private static final String INDEX = "(?:\\d+|-)";

    public static final StatePathPolicy DEFAULT = builder()
        .allow("/party/player/hp/current", ValueDomain.NON_NEGATIVE_INTEGER)
        .allow("/party/player/hp/temp", ValueDomain.NON_NEGATIVE_INTEGER)
        .allow("/party/player/hp/max", ValueDomain.POSITIVE_INTEGER)
        .allow("/party/player/conditions", ValueDomain.STRING_LIST)
        .allow("/party/player/conditions/{i}", ValueDomain.STRING)
        .allow("/party/player/inventory", ValueDomain.LIST)
        .allow("/party/player/inventory/{i}", ValueDomain.ANY)
        .allow("/party/player/money/{key}", ValueDomain.NON_NEGATIVE_INTEGER)
        .allow("/party/player/resources/hit_dice/{key}/spent", ValueDomain.NON_NEGATIVE_INTEGER)
        .allow("/party/player/resources/spell_slots/{key}/used", ValueDomain.NON_NEGATIVE_INTEGER)
        .allow("/world/location_id", ValueDomain.STRING)
        .allow("/world/zones/{key}/flags/{key}", ValueDomain.SCALAR)
        .allow("/world/zones/{key}/npcs_present", ValueDomain.STRING_LIST)
        .allow("/world/quests", ValueDomain.LIST)
        .allow("/world/quests/{i}", ValueDomain.OBJECT)
        .allow("/world/quests/{i}/stage", ValueDomain.NON_NEGATIVE_INTEGER)
        .allow("/world/quests/{i}/flags/{key}", ValueDomain.SCALAR)
        .allow("/world/npcs/{key}/status", ValueDomain.NPC_STATUS)
        .allow("/world/npcs/{key}/attitude", ValueDomain.NPC_ATTITUDE)
        .allow("/world/npcs/{key}/location_id", ValueDomain.STRING)
        .allow("/world/npcs/{key}/knowledge_flags", ValueDomain.STRING_LIST)
        .allow("/world/npcs/{key}/knowledge_flags/{i}", ValueDomain.STRING)
        .allow("/world/factions/{key}/{key}", ValueDomain.SCALAR)
        .allow("/world/global_flags/{key}", ValueDomain.SCALAR)
        .build();

    private final List<Rule> rules;

    private StatePathPolicy(List<Rule> rules) {
        this.rules = List.copyOf(rules);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * The first rule whose template matches the path.
     */
    public Optional<Rule> ruleFor(String path) {
        if (path == null) {
            return Optional.empty();
        }
        return rules.stream().filter(r -> r.matches(path)).findFirst();
    }

    public boolean isAllowed(String path) {
        return ruleFor(path).isPresent();
    }

    public List<Rule> rules() {
        return rules;
    }

    /**
     * One allow-listed template and its domain.
     */
    public record Rule(String template, Pattern pattern, ValueDomain domain) {
        public boolean matches(String path) {
            return pattern.matcher(path).matches();
        }
    }

    public static class Builder {
        private final List<Rule> rules = new ArrayList<>();

        public Builder allow(String template, ValueDomain domain) {
            String regex = Pattern.quote(template)
                .replace("{key}", "\\E" + KEY + "\\Q")
                .replace("{i}", "\\E" + INDEX + "\\Q");
            rules.add(new Rule(template, Pattern.compile(regex), domain));
            return this;
        }

        public StatePathPolicy build() {
            return new StatePathPolicy(rules);
        }
    }
}
