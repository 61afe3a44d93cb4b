package com.conversions.realtime.service;

import com.conversions.realtime.model.ChangeOperation;
import com.conversions.realtime.model.ChangeRecord;
import com.conversions.realtime.model.RawNotificationEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Decodes the JSON payload of a notification:
 * {@code {"operation": "...", "table": "...", "data": {...}}}.
 *
 * <p>An empty payload decodes as an empty object. Anything that is not a JSON
 * object, or whose {@code data} is present but not an object, is rejected with
 * {@link PayloadDecodeException}.
 */
public class NotificationDecoder {

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() { };

    private final ObjectMapper objectMapper;
    private final ObjectReader payloadReader;

    public NotificationDecoder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        // a complete document followed by anything else is malformed
        this.payloadReader = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    public ChangeRecord decode(RawNotificationEvent event) {
        String channel = event.channelName();
        String payload = event.rawPayload();

        JsonNode root;
        try {
            root = payloadReader.readTree(payload == null || payload.isBlank() ? "{}" : payload);
        } catch (JsonProcessingException ex) {
            throw new PayloadDecodeException(channel, "Malformed JSON payload: " + ex.getOriginalMessage(), ex);
        }
        if (root == null || !root.isObject()) {
            throw new PayloadDecodeException(channel, "Payload is not a JSON object");
        }

        JsonNode data = root.path("data");
        if (!data.isMissingNode() && !data.isNull() && !data.isObject()) {
            throw new PayloadDecodeException(channel, "Payload field 'data' is not an object");
        }

        return new ChangeRecord(
                ChangeOperation.fromPayload(text(root, "operation")),
                text(root, "table"),
                data.isObject() ? toMap(data) : Collections.emptyMap(),
                channel,
                toMap(root));
    }

    private Map<String, Object> toMap(JsonNode node) {
        // values may be null, so no Map.copyOf
        return Collections.unmodifiableMap(objectMapper.convertValue(node, MAP_TYPE));
    }

    private static String text(JsonNode root, String field) {
        JsonNode value = root.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
