package com.logvault.ingestion;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Drops events already seen in the current run, keyed by {@code log_id} and sequence number.
 * Events lacking either key are always kept. Nothing is remembered across runs.
 */
public class EventDeduplicator {

    private final boolean enabled;
    private final Set<String> seen = new HashSet<>();
    private long duplicatesDropped;

    public EventDeduplicator(boolean enabled) {
        this.enabled = enabled;
    }

    /**
     * @return the events not seen before, in their original order
     */
    public List<ObjectNode> filter(List<ObjectNode> events) {
        if (!enabled) {
            return events;
        }
        List<ObjectNode> kept = new ArrayList<>(events.size());
        for (ObjectNode event : events) {
            String key = keyOf(event);
            if (key == null || seen.add(key)) {
                kept.add(event);
            } else {
                duplicatesDropped++;
            }
        }
        return kept;
    }

    /**
     * @return {@code log_id:sequence}, or null if the event does not carry both parts
     */
    static String keyOf(JsonNode event) {
        JsonNode logId = event.get("log_id");
        JsonNode sequence = event.get("sequence_number_str");
        if (sequence == null || sequence.isNull()) {
            sequence = event.get("sequence_number");
        }
        if (logId == null || logId.isNull() || sequence == null || sequence.isNull()) {
            return null;
        }
        return logId.asText() + ":" + sequence.asText();
    }

    public boolean isEnabled() {
        return enabled;
    }

    public long getDuplicatesDropped() {
        return duplicatesDropped;
    }
}
