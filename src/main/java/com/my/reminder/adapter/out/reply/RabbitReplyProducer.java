package com.my.reminder.adapter.out.reply;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.my.reminder.domain.model.EventRecord;
import com.my.reminder.domain.model.ReplyMessage;
import com.my.reminder.domain.port.out.ReplyPort;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.reactive.messaging.Channel;
import org.eclipse.microprofile.reactive.messaging.Emitter;

import java.util.List;

/**
 * 왜: 명령 처리 결과를 RabbitMQ로 전달하는 기술적 구현을 분리하여 포트 계약을 지키기 위함.
 */
@ApplicationScoped
public class RabbitReplyProducer implements ReplyPort {

    private final Emitter<String> replyEmitter;
    private final ObjectMapper objectMapper;

    @Inject
    public RabbitReplyProducer(@Channel("reminder-replies") Emitter<String> replyEmitter, ObjectMapper objectMapper) {
        this.replyEmitter = replyEmitter;
        this.objectMapper = objectMapper;
    }

    @Override
    public void send(ReplyMessage replyMessage) {
        try {
            replyEmitter.send(objectMapper.writeValueAsString(ReplyPayload.from(replyMessage)));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("응답 직렬화 실패: " + replyMessage.commandId(), e);
        }
    }

    private record ReplyPayload(String commandId,
                                String ownerContext,
                                String status,
                                String content,
                                List<EventView> events) {

        static ReplyPayload from(ReplyMessage reply) {
            return new ReplyPayload(reply.commandId(), reply.ownerContext(), reply.status().name(), reply.content(),
                    reply.events().stream().map(EventView::from).toList());
        }
    }

    private record EventView(String id,
                             String state,
                             String nextFireUtc,
                             String localDate,
                             String localTime,
                             String timezone,
                             String recurrence,
                             String payload,
                             long version) {

        static EventView from(EventRecord record) {
            return new EventView(
                    record.id(),
                    record.state().name(),
                    record.nextFireUtc() == null ? null : record.nextFireUtc().toString(),
                    record.localDate() == null ? null : record.localDate().toString(),
                    record.localTime().toString(),
                    record.timezone(),
                    record.recurrence().toString(),
                    record.payload(),
                    record.version());
        }
    }
}
