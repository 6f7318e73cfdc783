package com.logvault.ingestion;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("EventDeduplicator")
class EventDeduplicatorTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private ObjectNode event(String json) throws Exception {
        return (ObjectNode) mapper.readTree(json);
    }

    @Test
    void keyPrefersStringSequence() throws Exception {
        assertThat(EventDeduplicator.keyOf(event("{\"log_id\":\"L\",\"sequence_number_str\":\"900719925474099312\",\"sequence_number\":1}")))
            .isEqualTo("L:900719925474099312");
        assertThat(EventDeduplicator.keyOf(event("{\"log_id\":\"L\",\"sequence_number\":7}"))).isEqualTo("L:7");
    }

    @Test
    void eventsWithoutKeyAreNeverDropped() throws Exception {
        EventDeduplicator deduplicator = new EventDeduplicator(true);
        ObjectNode anonymous = event("{\"message\":\"x\"}");

        List<ObjectNode> kept = deduplicator.filter(List.of(anonymous, anonymous, event("{\"log_id\":\"L\"}")));

        assertThat(kept).hasSize(3);
        assertThat(deduplicator.getDuplicatesDropped()).isZero();
    }

    @Test
    void dropsRepeatsAcrossCallsKeepingOrder() throws Exception {
        EventDeduplicator deduplicator = new EventDeduplicator(true);
        deduplicator.filter(List.of(event("{\"log_id\":\"L\",\"sequence_number\":1}")));

        List<ObjectNode> kept = deduplicator.filter(List.of(
            event("{\"log_id\":\"L\",\"sequence_number\":2}"),
            event("{\"log_id\":\"L\",\"sequence_number\":1}"),
            event("{\"log_id\":\"M\",\"sequence_number\":1}")));

        assertThat(kept).extracting(e -> EventDeduplicator.keyOf(e)).containsExactly("L:2", "M:1");
        assertThat(deduplicator.getDuplicatesDropped()).isEqualTo(1);
    }

    @Test
    void disabledPassesEverythingThrough() throws Exception {
        EventDeduplicator deduplicator = new EventDeduplicator(false);
        ObjectNode e = event("{\"log_id\":\"L\",\"sequence_number\":1}");

        assertThat(deduplicator.filter(List.of(e, e))).hasSize(2);
        assertThat(deduplicator.isEnabled()).isFalse();
    }
}
