package com.eventmirror.core.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link EventRecord}.
 */
class EventRecordTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Instant NOW = Instant.parse("2026-01-01T10:00:00Z");

    @Test
    @DisplayName("Payload should be isolated from the producer and from readers")
    void payloadShouldBeImmutable() {
        ObjectNode payload = MAPPER.createObjectNode().put("name", "view_item").put("id", 42);
        EventRecord record = EventRecord.builder().name("view_item").payload(payload).receivedAt(NOW).build();

        payload.put("id", 7);
        ((ObjectNode) record.getPayload()).put("id", 99);

        assertThat(record.getPayload().get("id").asInt()).isEqualTo(42);
    }

    @Test
    @DisplayName("Should require name and receivedAt")
    void shouldRequireMandatoryFields() {
        assertThatThrownBy(() -> EventRecord.builder().receivedAt(NOW).build())
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("name");
        assertThatThrownBy(() -> EventRecord.builder().name("x").build())
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("receivedAt");
    }

    @Test
    @DisplayName("Missing payload should become JSON null")
    void missingPayloadShouldBeNull() {
        EventRecord record = EventRecord.builder().name("x").receivedAt(NOW).build();

        assertThat(record.getPayload().isNull()).isTrue();
    }

    @Test
    @DisplayName("toBuilder should copy every field")
    void toBuilderShouldCopyFields() {
        EventRecord original = EventRecord.builder()
                .name("scroll")
                .payload(MAPPER.createObjectNode().put("depth", 3))
                .receivedAt(NOW)
                .sourceBatchId(5)
                .build();

        EventRecord stamped = original.toBuilder().sequence(11).build();

        assertThat(stamped.getName()).isEqualTo("scroll");
        assertThat(stamped.getPayload()).isEqualTo(original.getPayload());
        assertThat(stamped.getSourceBatchId()).isEqualTo(5);
        assertThat(stamped.getSequence()).isEqualTo(11);
        assertThat(stamped.summary()).isEqualTo("#11 scroll @2026-01-01T10:00:00Z (batch 5)");
    }
}
