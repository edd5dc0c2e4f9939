package com.my.reminder.domain.model;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Objects;

/**
 * 왜: 예약 알림의 영속 단위를 하나의 불변 값으로 고정해 저장소, 레지스트리, 스케줄러가 같은 버전을 바라보게 하기 위함.
 * <p>
 * {@code localDate}가 없으면 매일 같은 시각을 의미하고, 있으면 단발 일정의 날짜 또는 반복의 시작일이다.
 * 종료 상태의 레코드는 {@code nextFireUtc}가 비어 있을 수 있다.
 */
public record EventRecord(
        String id,
        String ownerContext,
        LocalDate localDate,
        LocalTime localTime,
        String timezone,
        Recurrence recurrence,
        Instant nextFireUtc,
        String payload,
        long version,
        EventState state,
        Instant createdAt,
        Instant updatedAt
) {
    public EventRecord {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(ownerContext, "ownerContext");
        Objects.requireNonNull(localTime, "localTime");
        Objects.requireNonNull(timezone, "timezone");
        Objects.requireNonNull(recurrence, "recurrence");
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(createdAt, "createdAt");
        Objects.requireNonNull(updatedAt, "updatedAt");
        if (id.isBlank()) {
            throw new IllegalArgumentException("id는 비어 있을 수 없습니다.");
        }
        if (version < 1) {
            throw new IllegalArgumentException("version은 1 이상이어야 합니다: " + version);
        }
        if (state == EventState.ACTIVE && nextFireUtc == null) {
            throw new IllegalArgumentException("활성 일정에는 다음 발송 시각이 필요합니다: " + id);
        }
    }

    public boolean isActive() {
        return state == EventState.ACTIVE;
    }

    /**
     * 다음 버전을 만든다. 모든 변경은 이 메서드를 거쳐 버전을 정확히 1 올린다.
     */
    public EventRecord next(LocalDate localDate,
                            LocalTime localTime,
                            String timezone,
                            Recurrence recurrence,
                            Instant nextFireUtc,
                            String payload,
                            EventState state,
                            Instant now) {
        return new EventRecord(id, ownerContext, localDate, localTime, timezone, recurrence,
                nextFireUtc, payload, version + 1, state, createdAt, now);
    }

    public EventRecord rescheduled(Instant nextFireUtc, Instant now) {
        return next(localDate, localTime, timezone, recurrence, nextFireUtc, payload, state, now);
    }

    public EventRecord finished(EventState terminal, Instant now) {
        if (!terminal.isTerminal()) {
            throw new IllegalArgumentException("종료 상태가 아닙니다: " + terminal);
        }
        return next(localDate, localTime, timezone, recurrence, null, payload, terminal, now);
    }
}
