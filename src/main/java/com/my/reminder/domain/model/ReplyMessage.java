package com.my.reminder.domain.model;

import java.util.List;
import java.util.Objects;

/**
 * 왜: 명령 처리 결과의 계약을 고정해 응답 어댑터가 일관된 포맷으로 전송하도록 하기 위함.
 */
public record ReplyMessage(String commandId,
                           String ownerContext,
                           ReplyStatus status,
                           String content,
                           List<EventRecord> events) {
    public ReplyMessage {
        Objects.requireNonNull(commandId, "commandId");
        Objects.requireNonNull(ownerContext, "ownerContext");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(content, "content");
        events = events == null ? List.of() : List.copyOf(events);
    }
}
