package com.taleforge.engine.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.taleforge.core.exception.PersistenceException;
import com.taleforge.core.model.LoreDelta;
import com.taleforge.core.model.PatchOperation;
import com.taleforge.core.model.RollResult;
import com.taleforge.core.model.StatePatch;
import com.taleforge.core.model.TimeDelta;
import com.taleforge.core.model.UniverseTime;
import com.taleforge.core.model.ValidationResult;
import com.taleforge.engine.validation.ProposalDecoder;

import java.util.List;

/**
 * JSON form of the structured parts of turn records and snapshots.
 *
 * Patches are stored in the same wire format the narrator sends, so a
 * stored patch decodes through the same decoder as a fresh one.
 */
public class TurnRecordCodec {

    private static final TypeReference<List<RollResult>> ROLL_RESULTS = new TypeReference<>() { };
    private static final TypeReference<List<LoreDelta>> LORE_DELTAS = new TypeReference<>() { };

    private final ObjectMapper objectMapper;
    private final ProposalDecoder decoder;

    public TurnRecordCodec(ObjectMapper objectMapper, ProposalDecoder decoder) {
        this.objectMapper = objectMapper;
        this.decoder = decoder;
    }

    // ========== Patches ==========

    public ArrayNode encodePatch(StatePatch patch) {
        ArrayNode array = objectMapper.createArrayNode();
        for (PatchOperation operation : patch.operations()) {
            array.add(encodeOperation(operation));
        }
        return array;
    }

    private JsonNode encodeOperation(PatchOperation operation) {
        if (operation instanceof PatchOperation.Unrecognized unknown) {
            return unknown.raw();
        }
        ObjectNode node = objectMapper.createObjectNode();
        node.put("op", operation.op());
        if (operation instanceof PatchOperation.AdvanceTime advance) {
            TimeDelta delta = advance.delta();
            ObjectNode value = node.putObject("value");
            value.put("years", delta.years());
            value.put("months", delta.months());
            value.put("days", delta.days());
            value.put("hours", delta.hours());
            value.put("minutes", delta.minutes());
            return node;
        }
        node.put("path", operation.path());
        if (operation instanceof PatchOperation.Replace replace && replace.value() != null) {
            node.set("value", replace.value());
        } else if (operation instanceof PatchOperation.Add add && add.value() != null) {
            node.set("value", add.value());
        }
        return node;
    }

    public StatePatch decodePatch(JsonNode json) {
        ValidationResult.Builder problems = ValidationResult.builder();
        StatePatch patch = decoder.decodePatch(json, ProposalDecoder.PATCHES, problems);
        ValidationResult result = problems.build();
        if (!result.valid()) {
            throw new PersistenceException("Stored patch is unreadable: " + result.errors(), null);
        }
        return patch;
    }

    // ========== Roll results and lore ==========

    public JsonNode encodeRollResults(List<RollResult> results) {
        return objectMapper.valueToTree(results);
    }

    public List<RollResult> decodeRollResults(JsonNode json) {
        if (json == null || json.isNull()) {
            return List.of();
        }
        return objectMapper.convertValue(json, ROLL_RESULTS);
    }

    public JsonNode encodeLoreDeltas(List<LoreDelta> deltas) {
        return objectMapper.valueToTree(deltas);
    }

    public List<LoreDelta> decodeLoreDeltas(JsonNode json) {
        if (json == null || json.isNull()) {
            return List.of();
        }
        return objectMapper.convertValue(json, LORE_DELTAS);
    }

    // ========== Time ==========

    public JsonNode encodeTime(UniverseTime time) {
        return objectMapper.valueToTree(time);
    }

    public UniverseTime decodeTime(JsonNode json) {
        return objectMapper.convertValue(json, UniverseTime.class);
    }

    // ========== Text ==========

    public String write(JsonNode node) {
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Failed to serialize record", e);
        }
    }

    public JsonNode read(String json) {
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Stored JSON is unreadable", e);
        }
    }
}
