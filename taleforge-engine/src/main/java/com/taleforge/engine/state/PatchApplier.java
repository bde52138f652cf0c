package com.taleforge.engine.state;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.taleforge.core.exception.PatchApplicationException;
import com.taleforge.core.model.CampaignState;
import com.taleforge.core.model.PatchOperation;
import com.taleforge.core.model.StatePatch;
import com.taleforge.core.model.UniverseTime;
import com.taleforge.engine.time.CalendarService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Applies patch operations to a state document.
 *
 * Paths are JSON pointers. {@code replace} and {@code add} create missing
 * intermediate objects; list indices must already exist, except that
 * {@code add} may insert at the end or append with "-".
 * {@code remove} requires its target to exist.
 */
public class PatchApplier {

    private static final Logger log = LoggerFactory.getLogger(PatchApplier.class);

    private final CalendarService calendarService;

    public PatchApplier(CalendarService calendarService) {
        this.calendarService = calendarService;
    }

    /**
     * Apply a whole patch to a copy of the state, producing the state at a new index.
     * The input state is never modified.
     */
    public CampaignState apply(CampaignState state, StatePatch patch, int newTurnIndex) {
        ObjectNode document = state.mutableDocument();
        UniverseTime time = state.universeTime();
        for (PatchOperation operation : patch.operations()) {
            time = applyOperation(document, time, operation);
        }
        return state.advance(newTurnIndex, time, document);
    }

    /**
     * Apply one operation in place, returning the clock after it.
     */
    public UniverseTime applyOperation(ObjectNode document, UniverseTime time, PatchOperation operation) {
        if (operation instanceof PatchOperation.AdvanceTime advance) {
            try {
                return calendarService.advance(time, advance.delta());
            } catch (ArithmeticException e) {
                throw new PatchApplicationException(operation.path(), "time advance out of range: " + advance.delta());
            }
        }
        if (operation instanceof PatchOperation.Replace replace) {
            replace(document, replace.path(), requireValue(replace.path(), replace.value()));
        } else if (operation instanceof PatchOperation.Add add) {
            add(document, add.path(), requireValue(add.path(), add.value()));
        } else if (operation instanceof PatchOperation.Remove remove) {
            remove(document, remove.path());
        } else {
            throw new PatchApplicationException(operation.path(), "unsupported operation " + operation.op());
        }
        log.debug("Applied {} {}", operation.op(), operation.path());
        return time;
    }

    // ========== Operations ==========

    private void replace(ObjectNode document, String path, JsonNode value) {
        List<String> tokens = tokens(path);
        JsonNode parent = navigate(document, path, tokens, true);
        String last = tokens.get(tokens.size() - 1);
        if (parent.isObject()) {
            ((ObjectNode) parent).set(last, value.deepCopy());
        } else {
            ArrayNode array = (ArrayNode) parent;
            array.set(existingIndex(path, array, last), value.deepCopy());
        }
    }

    private void add(ObjectNode document, String path, JsonNode value) {
        List<String> tokens = tokens(path);
        JsonNode parent = navigate(document, path, tokens, true);
        String last = tokens.get(tokens.size() - 1);
        if (parent.isObject()) {
            ((ObjectNode) parent).set(last, value.deepCopy());
            return;
        }
        ArrayNode array = (ArrayNode) parent;
        if ("-".equals(last)) {
            array.add(value.deepCopy());
            return;
        }
        int index = parseIndex(path, last);
        if (index > array.size()) {
            throw new PatchApplicationException(path,
                String.format("index %d beyond list of size %d", index, array.size()));
        }
        array.insert(index, value.deepCopy());
    }

    private void remove(ObjectNode document, String path) {
        List<String> tokens = tokens(path);
        JsonNode parent = navigate(document, path, tokens, false);
        String last = tokens.get(tokens.size() - 1);
        if (parent.isObject()) {
            if (!parent.has(last)) {
                throw new PatchApplicationException(path, "no such key");
            }
            ((ObjectNode) parent).remove(last);
        } else {
            ArrayNode array = (ArrayNode) parent;
            array.remove(existingIndex(path, array, last));
        }
    }

    // ========== Pointer helpers ==========

    /**
     * Walk to the container that holds the final token.
     */
    private JsonNode navigate(ObjectNode document, String path, List<String> tokens, boolean create) {
        JsonNode current = document;
        for (int i = 0; i < tokens.size() - 1; i++) {
            String token = tokens.get(i);
            JsonNode next;
            if (current.isObject()) {
                next = current.get(token);
                if ((next == null || next.isNull()) && create) {
                    next = ((ObjectNode) current).putObject(token);
                }
            } else {
                ArrayNode array = (ArrayNode) current;
                next = array.get(existingIndex(path, array, token));
            }
            if (next == null || !next.isContainerNode()) {
                throw new PatchApplicationException(path, "no container at '" + token + "'");
            }
            current = next;
        }
        return current;
    }

    static List<String> tokens(String path) {
        if (path == null || !path.startsWith("/") || path.length() < 2) {
            throw new PatchApplicationException(path, "path must be a JSON pointer below the root");
        }
        List<String> tokens = new ArrayList<>();
        for (String raw : path.substring(1).split("/", -1)) {
            tokens.add(raw.replace("~1", "/").replace("~0", "~"));
        }
        return tokens;
    }

    private static int existingIndex(String path, ArrayNode array, String token) {
        int index = parseIndex(path, token);
        if (index >= array.size()) {
            throw new PatchApplicationException(path,
                String.format("index %d out of range for list of size %d", index, array.size()));
        }
        return index;
    }

    private static int parseIndex(String path, String token) {
        try {
            int index = Integer.parseInt(token);
            if (index < 0) {
                throw new PatchApplicationException(path, "negative list index " + token);
            }
            return index;
        } catch (NumberFormatException e) {
            throw new PatchApplicationException(path, "'" + token + "' is not a list index");
        }
    }

    private static JsonNode requireValue(String path, JsonNode value) {
        if (value == null) {
            throw new PatchApplicationException(path, "value is required");
        }
        return value;
    }
}
