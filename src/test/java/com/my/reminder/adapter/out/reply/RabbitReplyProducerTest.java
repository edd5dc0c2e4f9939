package com.my.reminder.adapter.out.reply;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.my.reminder.domain.model.EventRecord;
import com.my.reminder.domain.model.EventState;
import com.my.reminder.domain.model.Recurrence;
import com.my.reminder.domain.model.ReplyMessage;
import com.my.reminder.domain.model.ReplyStatus;
import org.eclipse.microprofile.reactive.messaging.Emitter;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Instant;
import java.time.LocalTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class RabbitReplyProducerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void send_serializes_reply_with_events_and_emits() throws Exception {
        @SuppressWarnings("unchecked")
        Emitter<String> emitter = (Emitter<String>) mock(Emitter.class);
        RabbitReplyProducer producer = new RabbitReplyProducer(emitter, objectMapper);
        Instant now = Instant.parse("2026-10-18T12:00:00Z");
        EventRecord event = new EventRecord("evt-1", "telegram:1", null, LocalTime.of(9, 0), "UTC", Recurrence.daily(),
                Instant.parse("2026-10-19T09:00:00Z"), "stretch \"now\"", 1, EventState.ACTIVE, now, now);

        producer.send(new ReplyMessage("cmd-1", "telegram:1", ReplyStatus.OK, "✅ 등록", List.of(event)));

        ArgumentCaptor<String> payloadCaptor = ArgumentCaptor.forClass(String.class);
        verify(emitter).send(payloadCaptor.capture());
        JsonNode json = objectMapper.readTree(payloadCaptor.getValue());
        assertThat(json.get("commandId").asText()).isEqualTo("cmd-1");
        assertThat(json.get("status").asText()).isEqualTo("OK");
        assertThat(json.get("events").get(0).get("nextFireUtc").asText()).isEqualTo("2026-10-19T09:00:00Z");
        assertThat(json.get("events").get(0).get("payload").asText()).isEqualTo("stretch \"now\"");
        assertThat(json.get("events").get(0).get("recurrence").asText()).isEqualTo("DAILY");
    }
}
