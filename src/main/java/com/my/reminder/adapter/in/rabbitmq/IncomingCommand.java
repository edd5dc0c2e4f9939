package com.my.reminder.adapter.in.rabbitmq;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.my.reminder.domain.exception.InvalidRecurrenceException;
import com.my.reminder.domain.exception.ValidationException;
import com.my.reminder.domain.model.EventMutation;
import com.my.reminder.domain.model.EventSpec;
import com.my.reminder.domain.model.Recurrence;
import com.my.reminder.domain.model.RecurrenceKind;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.format.DateTimeParseException;
import java.time.format.TextStyle;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * 왜: 큐로 들어온 JSON 명령을 도메인 입력(EventSpec, EventMutation)으로 바꾸면서 형식 오류를 검증 예외로 모으기 위함.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record IncomingCommand(String commandId,
                              String action,
                              String ownerContext,
                              String eventId,
                              String date,
                              String time,
                              String timezone,
                              IncomingRecurrence recurrence,
                              String payload) {

    public boolean isAddressable() {
        return commandId != null && !commandId.isBlank() && ownerContext != null && !ownerContext.isBlank();
    }

    public CommandAction commandAction() {
        if (action == null || action.isBlank()) {
            throw new ValidationException("명령 종류가 비어 있습니다.");
        }
        try {
            return CommandAction.valueOf(action.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("알 수 없는 명령입니다: " + action, e);
        }
    }

    public String requireEventId() {
        if (eventId == null || eventId.isBlank()) {
            throw new ValidationException("eventId가 필요합니다.");
        }
        return eventId.trim();
    }

    public EventSpec toSpec() {
        if (time == null || time.isBlank()) {
            throw new ValidationException("알림 시각(time)이 필요합니다.");
        }
        if (payload == null || payload.isBlank()) {
            throw new ValidationException("알림 내용(payload)이 필요합니다.");
        }
        return new EventSpec(ownerContext, parseDate(), parseTime(), timezone,
                recurrence == null ? Recurrence.none() : recurrence.toDomain(), payload);
    }

    public EventMutation toMutation() {
        return new EventMutation(
                parseDate(),
                time == null || time.isBlank() ? null : parseTime(),
                timezone == null || timezone.isBlank() ? null : timezone,
                recurrence == null ? null : recurrence.toDomain(),
                payload == null || payload.isBlank() ? null : payload);
    }

    private LocalDate parseDate() {
        if (date == null || date.isBlank()) {
            return null;
        }
        try {
            return LocalDate.parse(date.trim());
        } catch (DateTimeParseException e) {
            throw new ValidationException("날짜 형식이 올바르지 않습니다(yyyy-MM-dd): " + date, e);
        }
    }

    private LocalTime parseTime() {
        try {
            return LocalTime.parse(time.trim());
        } catch (DateTimeParseException e) {
            throw new ValidationException("시각 형식이 올바르지 않습니다(HH:mm): " + time, e);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record IncomingRecurrence(String kind, List<String> days, Long intervalMinutes) {

        public Recurrence toDomain() {
            RecurrenceKind parsedKind = parseKind();
            return switch (parsedKind) {
                case NONE -> Recurrence.none();
                case DAILY -> Recurrence.daily();
                case WEEKLY -> Recurrence.weekly(parseDays());
                case CUSTOM -> {
                    if (intervalMinutes == null || intervalMinutes <= 0) {
                        throw new InvalidRecurrenceException("반복 간격(intervalMinutes)은 0보다 커야 합니다: " + intervalMinutes);
                    }
                    yield Recurrence.custom(Duration.ofMinutes(intervalMinutes));
                }
            };
        }

        private RecurrenceKind parseKind() {
            if (kind == null || kind.isBlank()) {
                return RecurrenceKind.NONE;
            }
            try {
                return RecurrenceKind.valueOf(kind.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new InvalidRecurrenceException("알 수 없는 반복 종류입니다: " + kind);
            }
        }

        private Set<DayOfWeek> parseDays() {
            Set<DayOfWeek> parsed = EnumSet.noneOf(DayOfWeek.class);
            if (days != null) {
                for (String day : days) {
                    parsed.add(parseDay(day));
                }
            }
            if (parsed.isEmpty()) {
                throw new InvalidRecurrenceException("주간 반복에는 요일이 하나 이상 필요합니다.");
            }
            return parsed;
        }

        private static DayOfWeek parseDay(String day) {
            String normalized = day == null ? "" : day.trim().toUpperCase(Locale.ROOT);
            for (DayOfWeek candidate : DayOfWeek.values()) {
                String shortName = candidate.getDisplayName(TextStyle.SHORT, Locale.ENGLISH).toUpperCase(Locale.ROOT);
                if (candidate.name().equals(normalized) || shortName.equals(normalized)) {
                    return candidate;
                }
            }
            throw new InvalidRecurrenceException("알 수 없는 요일입니다: " + day);
        }
    }
}
