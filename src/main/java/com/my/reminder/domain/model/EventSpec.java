package com.my.reminder.domain.model;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Objects;

/**
 * 왜: 일정 생성 요청의 입력 계약을 고정해 게이트웨이가 어떤 형식에서 왔든 같은 검증을 거치게 하기 위함.
 */
public record EventSpec(
        String ownerContext,
        LocalDate localDate,
        LocalTime localTime,
        String timezone,
        Recurrence recurrence,
        String payload
) {
    public EventSpec {
        Objects.requireNonNull(ownerContext, "ownerContext");
        Objects.requireNonNull(localTime, "localTime");
        Objects.requireNonNull(payload, "payload");
        if (ownerContext.isBlank()) {
            throw new IllegalArgumentException("ownerContext는 비어 있을 수 없습니다.");
        }
        recurrence = recurrence == null ? Recurrence.none() : recurrence;
    }
}
