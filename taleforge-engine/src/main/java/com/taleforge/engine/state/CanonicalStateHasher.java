package com.taleforge.engine.state;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.taleforge.core.model.CampaignState;
import com.taleforge.core.model.UniverseTime;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * SHA-256 over a normalized serialization of the full state.
 *
 * Normalization: object keys sorted at every level, integral numbers
 * written without a fractional part, no whitespace. Two states with the
 * same content hash the same however they were built.
 */
public class CanonicalStateHasher {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private final ObjectMapper objectMapper;

    public CanonicalStateHasher(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Lower-case hex SHA-256 of {@link #canonicalJson(CampaignState)}.
     */
    public String hash(CampaignState state) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] bytes = digest.digest(canonicalJson(state).getBytes(StandardCharsets.UTF_8));
            StringBuilder hex = new StringBuilder(bytes.length * 2);
            for (byte b : bytes) {
                hex.append(String.format("%02x", b));
            }
            return hex.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public String canonicalJson(CampaignState state) {
        ObjectNode root = NODES.objectNode();
        root.put("campaign_id", state.campaignId().toString());
        root.put("turn_index", state.turnIndex());
        root.set("universe_time", timeNode(state.universeTime()));
        root.set("state", state.document());
        try {
            return objectMapper.writer().without(SerializationFeature.INDENT_OUTPUT)
                .writeValueAsString(normalize(root));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("State document is not serializable", e);
        }
    }

    public static ObjectNode timeNode(UniverseTime time) {
        ObjectNode node = NODES.objectNode();
        node.put("year", time.year());
        node.put("month", time.month());
        node.put("day", time.day());
        node.put("hour", time.hour());
        node.put("minute", time.minute());
        return node;
    }

    static JsonNode normalize(JsonNode node) {
        if (node.isObject()) {
            List<String> names = new ArrayList<>();
            Iterator<String> it = node.fieldNames();
            it.forEachRemaining(names::add);
            Collections.sort(names);
            ObjectNode sorted = NODES.objectNode();
            for (String name : names) {
                sorted.set(name, normalize(node.get(name)));
            }
            return sorted;
        }
        if (node.isArray()) {
            ArrayNode array = NODES.arrayNode();
            for (JsonNode item : node) {
                array.add(normalize(item));
            }
            return array;
        }
        if (node.isIntegralNumber()) {
            return NODES.numberNode(node.bigIntegerValue());
        }
        if (node.isFloatingPointNumber() && node.decimalValue().stripTrailingZeros().scale() <= 0) {
            return NODES.numberNode(node.decimalValue().toBigIntegerExact());
        }
        return node;
    }
}
