package com.my.reminder.domain.service;

import com.my.reminder.domain.exception.InvalidRecurrenceException;
import com.my.reminder.domain.exception.InvalidTimezoneException;
import com.my.reminder.domain.exception.ValidationException;
import com.my.reminder.domain.model.EventRecord;
import com.my.reminder.domain.model.Recurrence;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.zone.ZoneOffsetTransition;
import java.time.zone.ZoneRules;
import java.util.Locale;
import java.util.Map;

/**
 * 왜: 시간대가 붙은 현지 시각과 반복 규칙을 절대 시각(UTC)으로 바꾸는 계산을 부작용 없는 한 곳에 모으기 위함.
 * <p>
 * DST로 존재하지 않는 현지 시각은 전환 직후의 첫 유효 시각으로, 두 번 존재하는 현지 시각은 앞선 시각으로 해석한다.
 * 반복 일정은 항상 {@code after}보다 엄격히 뒤의 시각을 돌려준다.
 */
public class TimeResolver {

    private static final int MAX_WEEKLY_SCAN_DAYS = 14;

    private static final Map<String, String> ALIASES = Map.ofEntries(
            Map.entry("ET", "America/New_York"),
            Map.entry("EST", "America/New_York"),
            Map.entry("EDT", "America/New_York"),
            Map.entry("CT", "America/Chicago"),
            Map.entry("CST", "America/Chicago"),
            Map.entry("CDT", "America/Chicago"),
            Map.entry("MT", "America/Denver"),
            Map.entry("MST", "America/Denver"),
            Map.entry("MDT", "America/Denver"),
            Map.entry("PT", "America/Los_Angeles"),
            Map.entry("PST", "America/Los_Angeles"),
            Map.entry("PDT", "America/Los_Angeles"),
            Map.entry("KST", "Asia/Seoul")
    );

    private final ZoneId defaultZone;

    public TimeResolver(String defaultTimezone) {
        this.defaultZone = parseZone(defaultTimezone);
    }

    /**
     * 시간대 이름(약어 포함)을 해석한다. 비어 있으면 기본 시간대를 쓴다.
     */
    public ZoneId zoneOf(String timezone) {
        if (timezone == null || timezone.isBlank()) {
            return defaultZone;
        }
        return parseZone(timezone);
    }

    public Instant resolve(EventRecord record, Instant after) {
        return resolve(record.localDate(), record.localTime(), record.timezone(), record.recurrence(), after);
    }

    /**
     * @param localDate 단발 일정의 날짜 또는 반복의 시작일. 없으면 {@code after} 이후 가장 가까운 날을 쓴다.
     * @throws InvalidTimezoneException 시간대를 알 수 없을 때
     * @throws InvalidRecurrenceException 반복 규칙이 잘못되었을 때
     * @throws ValidationException 날짜가 지정된 단발 일정이 이미 지났을 때
     */
    public Instant resolve(LocalDate localDate, LocalTime localTime, String timezone, Recurrence recurrence, Instant after) {
        ZoneId zone = zoneOf(timezone);
        validate(recurrence);
        return switch (recurrence.kind()) {
            case NONE -> resolveSingle(localDate, localTime, zone, after);
            case DAILY -> nextMatchingDay(localDate, localTime, zone, after, null);
            case WEEKLY -> nextMatchingDay(localDate, localTime, zone, after, recurrence);
            case CUSTOM -> nextInterval(localDate, localTime, zone, recurrence.interval(), after);
        };
    }

    public void validate(Recurrence recurrence) {
        if (recurrence == null) {
            throw new InvalidRecurrenceException("반복 규칙이 비어 있습니다.");
        }
        switch (recurrence.kind()) {
            case NONE, DAILY -> {
            }
            case WEEKLY -> {
                if (recurrence.days().isEmpty()) {
                    throw new InvalidRecurrenceException("주간 반복에는 요일이 하나 이상 필요합니다.");
                }
            }
            case CUSTOM -> {
                Duration interval = recurrence.interval();
                if (interval == null || interval.isZero() || interval.isNegative()) {
                    throw new InvalidRecurrenceException("반복 간격은 0보다 커야 합니다: " + interval);
                }
            }
        }
    }

    /**
     * 현지 날짜와 시각을 절대 시각으로 바꾼다. 공백 구간은 전환 시각으로, 중복 구간은 앞선 오프셋으로 정한다.
     */
    public Instant atLocal(LocalDate date, LocalTime time, ZoneId zone) {
        LocalDateTime local = LocalDateTime.of(date, time);
        ZoneRules rules = zone.getRules();
        if (rules.getValidOffsets(local).isEmpty()) {
            ZoneOffsetTransition gap = rules.getTransition(local);
            return gap.getInstant();
        }
        return ZonedDateTime.ofLocal(local, zone, null)
                .withEarlierOffsetAtOverlap()
                .toInstant();
    }

    public LocalDate localDateOf(Instant instant, String timezone) {
        return instant.atZone(zoneOf(timezone)).toLocalDate();
    }

    private Instant resolveSingle(LocalDate localDate, LocalTime localTime, ZoneId zone, Instant after) {
        if (localDate == null) {
            return nextMatchingDay(null, localTime, zone, after, null);
        }
        Instant instant = atLocal(localDate, localTime, zone);
        if (!instant.isAfter(after)) {
            throw new ValidationException("지정한 시각이 이미 지났습니다: " + localDate + " " + localTime + " " + zone);
        }
        return instant;
    }

    private Instant nextMatchingDay(LocalDate start, LocalTime localTime, ZoneId zone, Instant after, Recurrence weekly) {
        LocalDate day = after.atZone(zone).toLocalDate();
        if (start != null && start.isAfter(day)) {
            day = start;
        }
        for (int i = 0; i <= MAX_WEEKLY_SCAN_DAYS; i++) {
            if (weekly == null || weekly.days().contains(day.getDayOfWeek())) {
                Instant candidate = atLocal(day, localTime, zone);
                if (candidate.isAfter(after)) {
                    return candidate;
                }
            }
            day = day.plusDays(1);
        }
        throw new IllegalStateException("다음 발송 시각을 찾지 못했습니다: " + localTime + " " + zone);
    }

    private Instant nextInterval(LocalDate anchorDate, LocalTime localTime, ZoneId zone, Duration interval, Instant after) {
        LocalDate day = anchorDate != null ? anchorDate : after.atZone(zone).toLocalDate();
        Instant anchor = atLocal(day, localTime, zone);
        if (anchor.isAfter(after)) {
            return anchor;
        }
        long steps = Duration.between(anchor, after).dividedBy(interval) + 1;
        return anchor.plus(interval.multipliedBy(steps));
    }

    private static ZoneId parseZone(String timezone) {
        String trimmed = timezone == null ? "" : timezone.trim();
        String alias = ALIASES.get(trimmed.toUpperCase(Locale.ROOT));
        try {
            return ZoneId.of(alias != null ? alias : trimmed);
        } catch (DateTimeException e) {
            throw new InvalidTimezoneException(timezone, e);
        }
    }
}
