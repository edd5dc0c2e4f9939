package com.my.reminder.adapter.out.store;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.my.reminder.domain.exception.CorruptRecordException;
import com.my.reminder.domain.model.EventRecord;
import com.my.reminder.domain.model.EventState;
import com.my.reminder.domain.model.Recurrence;
import com.my.reminder.domain.model.RecurrenceKind;

import java.io.IOException;
import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * 왜: 저장소 종류와 무관하게 같은 JSON 본문 형식을 쓰고, 해석할 수 없는 본문을 손상 레코드로 구분하기 위함.
 */
public class EventRecordCodec {

    private final ObjectMapper objectMapper;

    public EventRecordCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public byte[] encode(EventRecord record) {
        try {
            return objectMapper.writeValueAsBytes(StoredEvent.from(record));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("일정 레코드 직렬화 실패: " + record.id(), e);
        }
    }

    public String encodeToString(EventRecord record) {
        try {
            return objectMapper.writeValueAsString(StoredEvent.from(record));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("일정 레코드 직렬화 실패: " + record.id(), e);
        }
    }

    /**
     * @throws CorruptRecordException 본문을 해석할 수 없거나, id가 맞지 않거나, 시간대와 반복 규칙이 유효하지 않을 때
     */
    public EventRecord decode(String id, byte[] body) {
        try {
            return verify(id, objectMapper.readValue(body, StoredEvent.class).toDomain());
        } catch (IOException | RuntimeException e) {
            throw corrupt(id, e);
        }
    }

    public EventRecord decode(String id, String body) {
        try {
            return verify(id, objectMapper.readValue(body, StoredEvent.class).toDomain());
        } catch (IOException | RuntimeException e) {
            throw corrupt(id, e);
        }
    }

    private static EventRecord verify(String id, EventRecord record) {
        if (!record.id().equals(id)) {
            throw new IllegalArgumentException("저장 키와 레코드 id가 다릅니다: " + record.id());
        }
        ZoneId.of(record.timezone());
        Recurrence recurrence = record.recurrence();
        if (recurrence.kind() == RecurrenceKind.WEEKLY && recurrence.days().isEmpty()) {
            throw new IllegalArgumentException("요일 없는 주간 반복입니다.");
        }
        if (recurrence.kind() == RecurrenceKind.CUSTOM
                && (recurrence.interval() == null || recurrence.interval().isZero() || recurrence.interval().isNegative())) {
            throw new IllegalArgumentException("반복 간격이 0보다 크지 않습니다: " + recurrence.interval());
        }
        return record;
    }

    private static CorruptRecordException corrupt(String id, Exception cause) {
        if (cause instanceof CorruptRecordException) {
            return (CorruptRecordException) cause;
        }
        return new CorruptRecordException(id, "일정 레코드를 해석할 수 없습니다: " + id + " (" + cause.getMessage() + ")", cause);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record StoredEvent(String id,
                       String ownerContext,
                       String localDate,
                       String localTime,
                       String timezone,
                       StoredRecurrence recurrence,
                       String nextFireUtc,
                       String payload,
                       long version,
                       String state,
                       String createdAt,
                       String updatedAt) {

        static StoredEvent from(EventRecord record) {
            return new StoredEvent(
                    record.id(),
                    record.ownerContext(),
                    record.localDate() == null ? null : record.localDate().toString(),
                    record.localTime().toString(),
                    record.timezone(),
                    StoredRecurrence.from(record.recurrence()),
                    record.nextFireUtc() == null ? null : record.nextFireUtc().toString(),
                    record.payload(),
                    record.version(),
                    record.state().name(),
                    record.createdAt().toString(),
                    record.updatedAt().toString());
        }

        EventRecord toDomain() throws DateTimeException {
            return new EventRecord(
                    id,
                    ownerContext,
                    localDate == null ? null : LocalDate.parse(localDate),
                    LocalTime.parse(localTime),
                    timezone,
                    recurrence == null ? Recurrence.none() : recurrence.toDomain(),
                    nextFireUtc == null ? null : Instant.parse(nextFireUtc),
                    payload,
                    version,
                    EventState.valueOf(state),
                    Instant.parse(createdAt),
                    Instant.parse(updatedAt));
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record StoredRecurrence(String kind, List<String> days, String interval) {

        static StoredRecurrence from(Recurrence recurrence) {
            List<String> days = recurrence.days().stream().sorted().map(DayOfWeek::name).toList();
            String interval = recurrence.interval() == null ? null : recurrence.interval().toString();
            return new StoredRecurrence(recurrence.kind().name(), days, interval);
        }

        Recurrence toDomain() {
            Set<DayOfWeek> parsedDays = EnumSet.noneOf(DayOfWeek.class);
            if (days != null) {
                days.forEach(day -> parsedDays.add(DayOfWeek.valueOf(day)));
            }
            return new Recurrence(RecurrenceKind.valueOf(kind), parsedDays,
                    interval == null ? null : Duration.parse(interval));
        }
    }
}
