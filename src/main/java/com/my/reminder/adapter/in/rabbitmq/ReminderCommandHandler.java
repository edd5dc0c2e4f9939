package com.my.reminder.adapter.in.rabbitmq;

import com.my.reminder.domain.exception.EventNotFoundException;
import com.my.reminder.domain.exception.ValidationException;
import com.my.reminder.domain.exception.VersionConflictException;
import com.my.reminder.domain.model.EventRecord;
import com.my.reminder.domain.model.ReplyMessage;
import com.my.reminder.domain.model.ReplyStatus;
import com.my.reminder.domain.port.in.ManageEventsUseCase;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 왜: 명령 하나를 유스케이스 호출 하나로 옮기고, 도메인 예외를 소비자 실패가 아닌 응답 상태로 바꾸기 위함.
 * <p>
 * 다른 사용자의 일정은 존재하지 않는 것처럼 다룬다.
 */
@ApplicationScoped
public class ReminderCommandHandler {

    private static final Logger log = Logger.getLogger(ReminderCommandHandler.class);

    private final ManageEventsUseCase manageEventsUseCase;

    @Inject
    public ReminderCommandHandler(ManageEventsUseCase manageEventsUseCase) {
        this.manageEventsUseCase = manageEventsUseCase;
    }

    public ReplyMessage handle(IncomingCommand command) {
        try {
            return switch (command.commandAction()) {
                case CREATE -> handleCreate(command);
                case MODIFY -> handleModify(command);
                case CANCEL -> handleCancel(command);
                case LIST -> handleList(command);
            };
        } catch (EventNotFoundException e) {
            return reply(command, ReplyStatus.NOT_FOUND, "🔍 해당 알림을 찾을 수 없습니다: " + e.eventId(), List.of());
        } catch (ValidationException | IllegalArgumentException e) {
            log.infof("명령 검증 실패: %s", e.getMessage());
            return reply(command, ReplyStatus.REJECTED, "⚠️ " + e.getMessage(), List.of());
        } catch (VersionConflictException e) {
            log.warnf("동시 변경 충돌로 명령을 거절합니다: %s", e.getMessage());
            return reply(command, ReplyStatus.REJECTED, "⚠️ 다른 변경과 겹쳤습니다. 다시 시도해주세요.", List.of());
        }
    }

    private ReplyMessage handleCreate(IncomingCommand command) {
        EventRecord created = manageEventsUseCase.create(command.toSpec());
        return reply(command, ReplyStatus.OK, "✅ 알림을 등록했습니다. (id: " + created.id() + ", 다음 알림: " + created.nextFireUtc() + ")",
                List.of(created));
    }

    private ReplyMessage handleModify(IncomingCommand command) {
        String eventId = requireOwned(command);
        EventRecord modified = manageEventsUseCase.modify(eventId, command.toMutation());
        return reply(command, ReplyStatus.OK, "✏️ 알림을 수정했습니다. (다음 알림: " + modified.nextFireUtc() + ")",
                List.of(modified));
    }

    private ReplyMessage handleCancel(IncomingCommand command) {
        String eventId = requireOwned(command);
        EventRecord cancelled = manageEventsUseCase.cancel(eventId);
        return reply(command, ReplyStatus.OK, "🗑️ 알림을 취소했습니다.", List.of(cancelled));
    }

    private ReplyMessage handleList(IncomingCommand command) {
        List<EventRecord> events = manageEventsUseCase.list(command.ownerContext());
        if (events.isEmpty()) {
            return reply(command, ReplyStatus.OK, "📭 등록된 알림이 없습니다.", events);
        }
        String lines = events.stream()
                .map(event -> "- " + event.nextFireUtc() + " " + event.recurrence() + " " + event.payload())
                .collect(Collectors.joining("\n"));
        return reply(command, ReplyStatus.OK, "📋 등록된 알림 " + events.size() + "건\n" + lines, events);
    }

    private String requireOwned(IncomingCommand command) {
        String eventId = command.requireEventId();
        EventRecord current = manageEventsUseCase.find(eventId)
                .orElseThrow(() -> new EventNotFoundException(eventId));
        if (!current.ownerContext().equals(command.ownerContext())) {
            throw new EventNotFoundException(eventId);
        }
        return eventId;
    }

    private static ReplyMessage reply(IncomingCommand command, ReplyStatus status, String content, List<EventRecord> events) {
        return new ReplyMessage(command.commandId(), command.ownerContext(), status, content, events);
    }
}
