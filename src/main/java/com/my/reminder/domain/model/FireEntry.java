package com.my.reminder.domain.model;

import java.time.Instant;
import java.util.Objects;

/**
 * 왜: 큐에 들어간 시점의 레코드 버전을 함께 들고 있어 발송 직전에 낡은 결정을 걸러내기 위함.
 */
public record FireEntry(String eventId, Instant fireAt, long version) {

    public FireEntry {
        Objects.requireNonNull(eventId, "eventId");
        Objects.requireNonNull(fireAt, "fireAt");
    }

    public static FireEntry of(EventRecord record) {
        return new FireEntry(record.id(), record.nextFireUtc(), record.version());
    }

    public boolean isDue(Instant now) {
        return !fireAt.isAfter(now);
    }
}
