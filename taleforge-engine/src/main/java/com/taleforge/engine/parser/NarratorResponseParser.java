package com.taleforge.engine.parser;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.taleforge.core.model.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.CharArrayReader;
import java.io.IOException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits raw narrator output into narrative text and a JSON payload.
 *
 * Recognized layout:
 * <pre>
 * DM_TEXT: The door creaks open...
 * DM_JSON: {"roll_requests": [], "patches": [], "lore_deltas": []}
 * </pre>
 * Without a narrative marker, everything before the payload marker is
 * narrative. Without any marker, the first top-level JSON object in the
 * text is the payload and the rest is narrative. A malformed payload is
 * reported but never costs the narrative.
 */
public class NarratorResponseParser {

    private static final Logger log = LoggerFactory.getLogger(NarratorResponseParser.class);

    public static final String TEXT_MARKER = "DM_TEXT:";
    public static final String JSON_MARKER = "DM_JSON:";

    public static final String PAYLOAD_MISSING = "PAYLOAD_MISSING";
    public static final String PAYLOAD_MALFORMED = "PAYLOAD_MALFORMED";
    public static final String NARRATIVE_MARKER_MISSING = "NARRATIVE_MARKER_MISSING";
    public static final String EMPTY_RESPONSE = "EMPTY_RESPONSE";

    private static final String PATH = "response";

    private static final Pattern TEXT_PATTERN = Pattern.compile("DM_TEXT:\\s*", Pattern.CASE_INSENSITIVE);
    private static final Pattern JSON_PATTERN = Pattern.compile("DM_JSON:\\s*", Pattern.CASE_INSENSITIVE);
    private static final Pattern JSON_LIKE_START = Pattern.compile("\\{\\s*\"");

    private final ObjectMapper objectMapper;

    public NarratorResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ParsedResponse parse(String rawText) {
        String raw = rawText == null ? "" : rawText;
        if (raw.isBlank()) {
            return new ParsedResponse("", null,
                ValidationResult.error(PATH, EMPTY_RESPONSE, "Narrator response is empty"));
        }

        ValidationResult.Builder problems = ValidationResult.builder();
        Matcher textMarker = TEXT_PATTERN.matcher(raw);
        Matcher jsonMarker = JSON_PATTERN.matcher(raw);
        boolean hasTextMarker = textMarker.find();
        boolean hasJsonMarker = jsonMarker.find();

        String narrative;
        ObjectNode payload = null;

        if (hasJsonMarker) {
            int narrativeStart = hasTextMarker && textMarker.start() < jsonMarker.start() ? textMarker.end() : 0;
            narrative = raw.substring(narrativeStart, jsonMarker.start());
            if (!hasTextMarker) {
                problems.warning(PATH, NARRATIVE_MARKER_MISSING,
                    "No " + TEXT_MARKER + " marker; using text before " + JSON_MARKER);
            } else if (textMarker.start() > jsonMarker.start()) {
                // narrative written after the payload
                narrative = narrative + raw.substring(textMarker.end());
            }
            payload = parseMarkedPayload(raw.substring(jsonMarker.end()), problems);
        } else {
            if (hasTextMarker) {
                raw = raw.substring(0, textMarker.start()) + raw.substring(textMarker.end());
            }
            JsonSpan span = findFirstObject(raw);
            if (span != null) {
                payload = span.node();
                narrative = raw.substring(0, span.start()) + raw.substring(span.end());
            } else {
                narrative = raw;
                if (JSON_LIKE_START.matcher(raw).find()) {
                    problems.error(PATH, PAYLOAD_MALFORMED,
                        "Response contains a JSON-like block that could not be parsed");
                } else {
                    problems.warning(PATH, PAYLOAD_MISSING, "Response has no structured payload");
                }
            }
            if (!hasTextMarker) {
                problems.warning(PATH, NARRATIVE_MARKER_MISSING, "No " + TEXT_MARKER + " marker in response");
            }
        }

        ParsedResponse parsed = new ParsedResponse(narrative.strip(), payload, problems.build());
        log.debug("Parsed narrator response: narrative={} chars, payload={}, errors={}, warnings={}",
            parsed.narrative().length(), parsed.hasPayload(),
            parsed.problems().errors().size(), parsed.problems().warnings().size());
        return parsed;
    }

    private ObjectNode parseMarkedPayload(String afterMarker, ValidationResult.Builder problems) {
        int brace = afterMarker.indexOf('{');
        if (brace < 0) {
            if (afterMarker.isBlank()) {
                problems.warning(PATH, PAYLOAD_MISSING, JSON_MARKER + " marker is not followed by a payload");
            } else {
                problems.error(PATH, PAYLOAD_MALFORMED, JSON_MARKER + " payload is not a JSON object");
            }
            return null;
        }
        try {
            JsonSpan span = readObjectAt(afterMarker.toCharArray(), brace);
            if (span == null) {
                problems.error(PATH, PAYLOAD_MALFORMED, JSON_MARKER + " payload is not a JSON object");
            }
            return span != null ? span.node() : null;
        } catch (IOException e) {
            log.debug("Failed to parse marked payload: {}", e.getMessage());
            problems.error(PATH, PAYLOAD_MALFORMED, "Failed to parse " + JSON_MARKER + " payload: "
                + firstLine(e.getMessage()));
            return null;
        }
    }

    /**
     * First '{' at which a complete JSON object can be read.
     */
    private JsonSpan findFirstObject(String text) {
        char[] chars = text.toCharArray();
        int from = text.indexOf('{');
        while (from >= 0) {
            try {
                JsonSpan span = readObjectAt(chars, from);
                if (span != null) {
                    return span;
                }
            } catch (IOException e) {
                log.trace("No JSON object at offset {}: {}", from, e.getMessage());
            }
            from = text.indexOf('{', from + 1);
        }
        return null;
    }

    // reads only as far as the object extends; offsets are relative to start
    private JsonSpan readObjectAt(char[] text, int start) throws IOException {
        CharArrayReader candidate = new CharArrayReader(text, start, text.length - start);
        try (JsonParser parser = objectMapper.getFactory().createParser(candidate)) {
            JsonNode node = objectMapper.readTree(parser);
            if (node == null || !node.isObject()) {
                return null;
            }
            int consumed = (int) parser.currentLocation().getCharOffset();
            return new JsonSpan((ObjectNode) node, start, start + consumed);
        }
    }

    private static String firstLine(String message) {
        if (message == null) {
            return "unknown error";
        }
        int newline = message.indexOf('\n');
        return newline >= 0 ? message.substring(0, newline) : message;
    }

    private record JsonSpan(ObjectNode node, int start, int end) {
    }
}
