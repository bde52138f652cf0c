package com.taleforge.engine.validation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.taleforge.core.model.LoreDelta;
import com.taleforge.core.model.PatchOperation;
import com.taleforge.core.model.RollKind;
import com.taleforge.core.model.RollRequest;
import com.taleforge.core.model.StatePatch;
import com.taleforge.core.model.TimeDelta;
import com.taleforge.core.model.UniverseTime;
import com.taleforge.core.model.ValidationResult;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Decodes the narrator's JSON payload into typed requests, operations and
 * lore. Only shape problems are reported here (wrong JSON types, unknown
 * time keys); domain rules belong to the validators.
 *
 * Absent sections decode to empty lists.
 */
public class ProposalDecoder {

    public static final String ROLL_REQUESTS = "roll_requests";
    public static final String PATCHES = "patches";
    public static final String LORE_DELTAS = "lore_deltas";

    public static final String NOT_A_LIST = "NOT_A_LIST";
    public static final String NOT_AN_OBJECT = "NOT_AN_OBJECT";
    public static final String NOT_A_STRING = "NOT_A_STRING";
    public static final String NOT_AN_INTEGER = "NOT_AN_INTEGER";
    public static final String NOT_A_BOOLEAN = "NOT_A_BOOLEAN";
    public static final String INVALID_TIME_DELTA = "INVALID_TIME_DELTA";
    public static final String INVALID_TIME_REF = "INVALID_TIME_REF";

    private static final Set<String> TIME_DELTA_KEYS = Set.of("years", "months", "days", "hours", "minutes");

    /**
     * Decode a whole payload. A null payload yields an empty proposal.
     */
    public NarratorProposal decode(ObjectNode payload) {
        return decode(payload, "");
    }

    /**
     * Decode a whole payload, prefixing every reported path.
     */
    public NarratorProposal decode(ObjectNode payload, String pathPrefix) {
        if (payload == null) {
            return NarratorProposal.EMPTY;
        }
        ValidationResult.Builder problems = ValidationResult.builder();
        List<RollRequest> rolls = decodeRollRequests(payload.get(ROLL_REQUESTS), pathPrefix + ROLL_REQUESTS, problems);
        StatePatch patch = decodePatch(payload.get(PATCHES), pathPrefix + PATCHES, problems);
        List<LoreDelta> lore = decodeLoreDeltas(payload.get(LORE_DELTAS), pathPrefix + LORE_DELTAS, problems);
        return new NarratorProposal(rolls, patch, lore, payload.get(ROLL_REQUESTS), problems.build());
    }

    // ========== Roll requests ==========

    public List<RollRequest> decodeRollRequests(JsonNode section, String path, ValidationResult.Builder problems) {
        List<RollRequest> requests = new ArrayList<>();
        for (Indexed item : items(section, path, problems)) {
            requests.add(decodeRollRequest(item.node(), item.path(), problems));
        }
        return requests;
    }

    private RollRequest decodeRollRequest(JsonNode node, String path, ValidationResult.Builder problems) {
        String id = identifier(node.get("id"), path + ".id", problems);
        String type = text(node, "type", path, problems);
        Optional<RollKind> kind = RollKind.fromCode(type);
        if (kind.isEmpty()) {
            return new RollRequest.Unrecognized(id, type, node.deepCopy());
        }
        String advantage = Optional.ofNullable(text(node, "advantage", path, problems)).orElse("none");
        return switch (kind.get()) {
            case ABILITY_CHECK -> new RollRequest.AbilityCheck(id,
                text(node, "ability", path, problems),
                text(node, "skill", path, problems),
                integer(node, "dc", path, problems),
                advantage,
                intOrZero(node, "bonus", path, problems));
            case SAVING_THROW -> new RollRequest.SavingThrow(id,
                text(node, "ability", path, problems),
                integer(node, "dc", path, problems),
                advantage,
                intOrZero(node, "bonus", path, problems));
            case ATTACK_ROLL -> new RollRequest.AttackRoll(id,
                text(node, "attacker", path, problems),
                text(node, "target", path, problems),
                text(node, "ability", path, problems),
                integer(node, "target_ac", path, problems),
                advantage,
                intOrZero(node, "bonus", path, problems),
                bool(node, "proficient", true, path, problems));
            case DAMAGE_ROLL -> new RollRequest.DamageRoll(id,
                text(node, "dice", path, problems),
                intOrZero(node, "modifier", path, problems),
                bool(node, "critical", false, path, problems),
                integer(node, "reroll_threshold", path, problems),
                text(node, "attack_ref", path, problems));
        };
    }

    // ========== Patches ==========

    public StatePatch decodePatch(JsonNode section, String path, ValidationResult.Builder problems) {
        List<PatchOperation> operations = new ArrayList<>();
        for (Indexed item : items(section, path, problems)) {
            PatchOperation operation = decodeOperation(item.node(), item.path(), problems);
            if (operation != null) {
                operations.add(operation);
            }
        }
        return new StatePatch(operations);
    }

    private PatchOperation decodeOperation(JsonNode node, String path, ValidationResult.Builder problems) {
        String op = text(node, "op", path, problems);
        String target = text(node, "path", path, problems);
        JsonNode value = node.get("value");
        if (op == null) {
            return new PatchOperation.Unrecognized(null, target, node.deepCopy());
        }
        return switch (op) {
            case PatchOperation.OP_REPLACE -> new PatchOperation.Replace(target, value != null ? value.deepCopy() : null);
            case PatchOperation.OP_ADD -> new PatchOperation.Add(target, value != null ? value.deepCopy() : null);
            case PatchOperation.OP_REMOVE -> new PatchOperation.Remove(target);
            case PatchOperation.OP_ADVANCE_TIME -> {
                TimeDelta delta = decodeTimeDelta(value, path + ".value", problems);
                yield delta != null ? new PatchOperation.AdvanceTime(delta) : null;
            }
            default -> new PatchOperation.Unrecognized(op, target, node.deepCopy());
        };
    }

    private TimeDelta decodeTimeDelta(JsonNode value, String path, ValidationResult.Builder problems) {
        if (value == null || !value.isObject()) {
            problems.error(path, INVALID_TIME_DELTA, "advance_time needs an object of years/months/days/hours/minutes");
            return null;
        }
        long[] parts = new long[5];
        boolean ok = true;
        Iterator<Map.Entry<String, JsonNode>> fields = value.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String key = field.getKey();
            if (!TIME_DELTA_KEYS.contains(key)) {
                problems.error(path + "." + key, INVALID_TIME_DELTA, "Unknown time unit: " + key);
                ok = false;
                continue;
            }
            JsonNode amount = field.getValue();
            if (!amount.isIntegralNumber() || !amount.canConvertToLong()) {
                problems.error(path + "." + key, NOT_AN_INTEGER, key + " must be an integer");
                ok = false;
                continue;
            }
            parts[unitIndex(key)] = amount.asLong();
        }
        return ok ? new TimeDelta(parts[0], parts[1], parts[2], parts[3], parts[4]) : null;
    }

    private static int unitIndex(String key) {
        return switch (key) {
            case "years" -> 0;
            case "months" -> 1;
            case "days" -> 2;
            case "hours" -> 3;
            default -> 4;
        };
    }

    // ========== Lore ==========

    public List<LoreDelta> decodeLoreDeltas(JsonNode section, String path, ValidationResult.Builder problems) {
        List<LoreDelta> deltas = new ArrayList<>();
        for (Indexed item : items(section, path, problems)) {
            JsonNode node = item.node();
            String itemPath = item.path();
            deltas.add(new LoreDelta(
                text(node, "type", itemPath, problems),
                text(node, "text", itemPath, problems),
                tags(node.get("tags"), itemPath + ".tags", problems),
                timeRef(node.get("time_ref"), itemPath + ".time_ref", problems)));
        }
        return deltas;
    }

    private List<String> tags(JsonNode node, String path, ValidationResult.Builder problems) {
        List<String> tags = new ArrayList<>();
        if (node == null || node.isNull()) {
            return tags;
        }
        if (!node.isArray()) {
            problems.error(path, NOT_A_LIST, "tags must be a list of strings");
            return tags;
        }
        for (int i = 0; i < node.size(); i++) {
            JsonNode tag = node.get(i);
            if (tag.isTextual()) {
                tags.add(tag.asText());
            } else {
                problems.error(path + "[" + i + "]", NOT_A_STRING, "tag must be a string");
            }
        }
        return tags;
    }

    private UniverseTime timeRef(JsonNode node, String path, ValidationResult.Builder problems) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isObject()) {
            problems.error(path, INVALID_TIME_REF, "time_ref must be an object with year, month and day");
            return null;
        }
        Integer year = integer(node, "year", path, problems);
        Integer month = integer(node, "month", path, problems);
        Integer day = integer(node, "day", path, problems);
        if (year == null || month == null || day == null) {
            problems.error(path, INVALID_TIME_REF, "time_ref needs integer year, month and day");
            return null;
        }
        Integer hour = integer(node, "hour", path, problems);
        Integer minute = integer(node, "minute", path, problems);
        try {
            return new UniverseTime(year, month, day, hour != null ? hour : 0, minute != null ? minute : 0);
        } catch (IllegalArgumentException e) {
            problems.error(path, INVALID_TIME_REF, e.getMessage());
            return null;
        }
    }

    // ========== Field helpers ==========

    private List<Indexed> items(JsonNode section, String path, ValidationResult.Builder problems) {
        List<Indexed> items = new ArrayList<>();
        if (section == null || section.isNull()) {
            return items;
        }
        if (!section.isArray()) {
            problems.error(path, NOT_A_LIST, path + " must be a list");
            return items;
        }
        for (int i = 0; i < section.size(); i++) {
            String itemPath = path + "[" + i + "]";
            JsonNode item = section.get(i);
            if (item.isObject()) {
                items.add(new Indexed(item, itemPath));
            } else {
                problems.error(itemPath, NOT_AN_OBJECT, "Entry must be an object");
            }
        }
        return items;
    }

    private static String identifier(JsonNode node, String path, ValidationResult.Builder problems) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isTextual() || node.isIntegralNumber()) {
            return node.asText();
        }
        problems.error(path, NOT_A_STRING, "id must be a string");
        return null;
    }

    private static String text(JsonNode node, String field, String path, ValidationResult.Builder problems) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isTextual()) {
            problems.error(path + "." + field, NOT_A_STRING, field + " must be a string");
            return null;
        }
        return value.asText();
    }

    private static Integer integer(JsonNode node, String field, String path, ValidationResult.Builder problems) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isIntegralNumber() || !value.canConvertToInt()) {
            problems.error(path + "." + field, NOT_AN_INTEGER, field + " must be an integer");
            return null;
        }
        return value.asInt();
    }

    private static int intOrZero(JsonNode node, String field, String path, ValidationResult.Builder problems) {
        Integer value = integer(node, field, path, problems);
        return value != null ? value : 0;
    }

    private static boolean bool(JsonNode node, String field, boolean defaultValue,
                                String path, ValidationResult.Builder problems) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return defaultValue;
        }
        if (!value.isBoolean()) {
            problems.error(path + "." + field, NOT_A_BOOLEAN, field + " must be true or false");
            return defaultValue;
        }
        return value.asBoolean();
    }

    private record Indexed(JsonNode node, String path) {
    }
}
