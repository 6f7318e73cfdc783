package com.logvault.query;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Decodes the {@code events} field of a Log Search result payload into event documents.
 *
 * Accepted shapes:
 * - an array of objects
 * - an array of JSON strings, each encoding one object
 * - a JSON string encoding either of the above
 * - a JSON string encoding an object with an {@code events} array
 *
 * Anything else fails with {@link ProtocolException}; events are never skipped silently.
 */
public class EventsDecoder {

    private final ObjectMapper objectMapper;

    public EventsDecoder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public List<ObjectNode> decode(JsonNode events, String logKey) {
        if (events == null || events.isNull()) {
            return Collections.emptyList();
        }
        if (events.isArray()) {
            return decodeArray(events, logKey);
        }
        if (events.isTextual()) {
            String text = events.textValue().strip();
            if (text.isEmpty()) {
                return Collections.emptyList();
            }
            JsonNode decoded = parse(text, logKey);
            if (decoded.isArray()) {
                return decodeArray(decoded, logKey);
            }
            if (decoded.isObject() && decoded.path("events").isArray()) {
                return decodeArray(decoded.get("events"), logKey);
            }
            throw new ProtocolException("String-encoded events field is neither an array nor an object with an events array", logKey);
        }
        throw new ProtocolException("Unsupported events field of type " + events.getNodeType(), logKey);
    }

    private List<ObjectNode> decodeArray(JsonNode array, String logKey) {
        List<ObjectNode> out = new ArrayList<>(array.size());
        int position = 0;
        for (JsonNode element : array) {
            if (element.isObject()) {
                out.add((ObjectNode) element);
            } else if (element.isTextual()) {
                JsonNode decoded = parse(element.textValue(), logKey);
                if (!decoded.isObject()) {
                    throw new ProtocolException("Event at position " + position + " decodes to " + decoded.getNodeType()
                        + ", expected an object", logKey);
                }
                out.add((ObjectNode) decoded);
            } else {
                throw new ProtocolException("Event at position " + position + " is " + element.getNodeType()
                    + ", expected an object", logKey);
            }
            position++;
        }
        return out;
    }

    private JsonNode parse(String text, String logKey) {
        try {
            JsonNode node = objectMapper.readTree(text);
            if (node == null || node.isMissingNode()) {
                throw new ProtocolException("Empty JSON document in events field", logKey);
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new ProtocolException("Events field holds malformed JSON: " + e.getOriginalMessage(), logKey, e);
        }
    }
}
