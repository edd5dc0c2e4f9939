package com.my.reminder.domain.model;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * 부분 수정 요청. null 필드는 기존 값을 유지한다.
 */
public record EventMutation(
        LocalDate localDate,
        LocalTime localTime,
        String timezone,
        Recurrence recurrence,
        String payload
) {
    public static EventMutation payload(String payload) {
        return new EventMutation(null, null, null, null, payload);
    }

    public static EventMutation time(LocalTime localTime) {
        return new EventMutation(null, localTime, null, null, null);
    }

    public boolean isEmpty() {
        return localDate == null && localTime == null && timezone == null && recurrence == null && payload == null;
    }

    public boolean touchesSchedule() {
        return localDate != null || localTime != null || timezone != null || recurrence != null;
    }
}
