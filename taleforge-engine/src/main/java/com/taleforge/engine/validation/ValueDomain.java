package com.taleforge.engine.validation;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Set;

/**
 * Type and range a state location accepts.
 */
public enum ValueDomain {
    NON_NEGATIVE_INTEGER,
    POSITIVE_INTEGER,
    STRING,
    STRING_LIST,
    LIST,
    OBJECT,
    SCALAR,
    ANY,
    NPC_STATUS,
    NPC_ATTITUDE;

    public static final Set<String> NPC_STATUSES = Set.of("alive", "dead", "unconscious", "missing", "unknown");
    public static final Set<String> NPC_ATTITUDES = Set.of("hostile", "unfriendly", "neutral", "friendly", "helpful");

    /**
     * Whether the value has an acceptable type and range.
     */
    public boolean accepts(JsonNode value) {
        return switch (this) {
            case NON_NEGATIVE_INTEGER -> value.isIntegralNumber() && value.canConvertToInt() && value.asInt() >= 0;
            case POSITIVE_INTEGER -> value.isIntegralNumber() && value.canConvertToInt() && value.asInt() > 0;
            case STRING, NPC_STATUS, NPC_ATTITUDE -> value.isTextual();
            case STRING_LIST -> value.isArray() && allTextual(value);
            case LIST -> value.isArray();
            case OBJECT -> value.isObject();
            case SCALAR -> value.isValueNode() && !value.isNull();
            case ANY -> true;
        };
    }

    private static boolean allTextual(JsonNode array) {
        for (JsonNode item : array) {
            if (!item.isTextual()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Whether an accepted value is still unusual enough to flag.
     */
    public boolean isUnusual(JsonNode value) {
        return switch (this) {
            case NPC_STATUS -> !NPC_STATUSES.contains(value.asText());
            case NPC_ATTITUDE -> !NPC_ATTITUDES.contains(value.asText());
            default -> false;
        };
    }

    public String describe() {
        return switch (this) {
            case NON_NEGATIVE_INTEGER -> "a non-negative integer";
            case POSITIVE_INTEGER -> "a positive integer";
            case STRING, NPC_STATUS, NPC_ATTITUDE -> "a string";
            case STRING_LIST -> "a list of strings";
            case LIST -> "a list";
            case OBJECT -> "an object";
            case SCALAR -> "a string, number or boolean";
            case ANY -> "any value";
        };
    }
}
