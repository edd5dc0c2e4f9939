package com.my.reminder.domain.model;

import java.time.DayOfWeek;
import java.time.Duration;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * 왜: 반복 규칙을 닫힌 종류(NONE, DAILY, WEEKLY, CUSTOM)로 고정해 시각 계산이 모든 경우를 명시적으로 다루게 하기 위함.
 * <p>
 * {@code days}는 WEEKLY에서만, {@code interval}은 CUSTOM에서만 의미가 있다.
 */
public record Recurrence(RecurrenceKind kind, Set<DayOfWeek> days, Duration interval) {

    private static final Recurrence NONE = new Recurrence(RecurrenceKind.NONE, Set.of(), null);
    private static final Recurrence DAILY = new Recurrence(RecurrenceKind.DAILY, Set.of(), null);

    public Recurrence {
        Objects.requireNonNull(kind, "kind");
        days = days == null || days.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(days));
    }

    public static Recurrence none() {
        return NONE;
    }

    public static Recurrence daily() {
        return DAILY;
    }

    public static Recurrence weekly(Set<DayOfWeek> days) {
        return new Recurrence(RecurrenceKind.WEEKLY, days, null);
    }

    public static Recurrence custom(Duration interval) {
        return new Recurrence(RecurrenceKind.CUSTOM, Set.of(), interval);
    }

    public boolean repeats() {
        return kind != RecurrenceKind.NONE;
    }

    @Override
    public String toString() {
        return switch (kind) {
            case NONE -> "NONE";
            case DAILY -> "DAILY";
            case WEEKLY -> "WEEKLY" + new TreeSet<>(days);
            case CUSTOM -> "CUSTOM(" + interval + ")";
        };
    }
}
