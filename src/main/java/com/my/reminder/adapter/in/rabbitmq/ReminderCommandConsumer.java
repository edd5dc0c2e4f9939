package com.my.reminder.adapter.in.rabbitmq;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.my.reminder.adapter.in.idempotency.ProcessedCommandStore;
import com.my.reminder.domain.model.EventRecord;
import com.my.reminder.domain.model.ReplyMessage;
import com.my.reminder.domain.port.in.ManageEventsUseCase;
import com.my.reminder.domain.port.out.ReplyPort;
import io.smallrye.mutiny.Uni;
import io.smallrye.reactive.messaging.annotations.Blocking;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.reactive.messaging.Incoming;
import org.eclipse.microprofile.reactive.messaging.Message;
import org.jboss.logging.Logger;
import org.jboss.logging.MDC;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * 왜: RabbitMQ 명령을 도메인 유스케이스로 진입시키는 단일 경로를 두고, 재전달된 명령은 다시 실행하지 않고 저장된 응답을 돌려주기 위함.
 */
@ApplicationScoped
public class ReminderCommandConsumer {

    private static final Logger log = Logger.getLogger(ReminderCommandConsumer.class);

    private final ReminderCommandHandler commandHandler;
    private final ManageEventsUseCase manageEventsUseCase;
    private final ProcessedCommandStore processedCommandStore;
    private final ReplyPort replyPort;
    private final ObjectMapper objectMapper;

    @Inject
    public ReminderCommandConsumer(ReminderCommandHandler commandHandler,
                                   ManageEventsUseCase manageEventsUseCase,
                                   ProcessedCommandStore processedCommandStore,
                                   ReplyPort replyPort,
                                   ObjectMapper objectMapper) {
        this.commandHandler = commandHandler;
        this.manageEventsUseCase = manageEventsUseCase;
        this.processedCommandStore = processedCommandStore;
        this.replyPort = replyPort;
        this.objectMapper = objectMapper;
    }

    @Incoming("reminder-commands")
    @Blocking
    public Uni<Void> consume(Message<String> message) {
        return Uni.createFrom().item(() -> {
            process(message.getPayload());
            return null;
        }).replaceWithVoid();
    }

    /**
     * @return 보낸 응답. 해석할 수 없는 명령이면 비어 있다.
     */
    public Optional<ReplyMessage> process(String payload) {
        IncomingCommand command;
        try {
            command = objectMapper.readValue(payload, IncomingCommand.class);
        } catch (IOException e) {
            log.warnf("명령 파싱 실패로 처리 중단: %s", e.getMessage());
            return Optional.empty();
        }
        if (!command.isAddressable()) {
            log.warn("commandId 또는 ownerContext가 없어 응답할 수 없는 명령을 버립니다.");
            return Optional.empty();
        }
        MDC.put("commandId", command.commandId());
        if (command.eventId() != null) {
            MDC.put("eventId", command.eventId());
        }
        try {
            Optional<String> previous = processedCommandStore.findReply(command.commandId());
            ReplyMessage reply;
            if (previous.isPresent()) {
                log.infof("이미 처리한 명령이라 이전 응답을 다시 보냅니다: %s", command.commandId());
                reply = replay(command, previous.get());
            } else {
                reply = commandHandler.handle(command);
                processedCommandStore.remember(command.commandId(), objectMapper.writeValueAsString(StoredReply.from(reply)));
            }
            replyPort.send(reply);
            return Optional.of(reply);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("명령 응답 직렬화 실패: " + command.commandId(), e);
        } finally {
            MDC.remove("commandId");
            MDC.remove("eventId");
        }
    }

    private ReplyMessage replay(IncomingCommand command, String storedBody) throws JsonProcessingException {
        StoredReply stored = objectMapper.readValue(storedBody, StoredReply.class);
        List<EventRecord> events = stored.eventIds().stream()
                .map(manageEventsUseCase::find)
                .flatMap(Optional::stream)
                .toList();
        return stored.toReply(command.commandId(), command.ownerContext(), events);
    }
}
