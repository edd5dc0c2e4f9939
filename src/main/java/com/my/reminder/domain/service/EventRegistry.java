package com.my.reminder.domain.service;

import com.my.reminder.domain.exception.CorruptRecordException;
import com.my.reminder.domain.exception.EventNotFoundException;
import com.my.reminder.domain.exception.ValidationException;
import com.my.reminder.domain.exception.VersionConflictException;
import com.my.reminder.domain.model.EventMutation;
import com.my.reminder.domain.model.EventRecord;
import com.my.reminder.domain.model.EventSpec;
import com.my.reminder.domain.model.EventState;
import com.my.reminder.domain.model.FireEntry;
import com.my.reminder.domain.model.Recurrence;
import com.my.reminder.domain.model.RecurrenceKind;
import com.my.reminder.domain.port.in.ManageEventsUseCase;
import com.my.reminder.domain.port.out.ClockPort;
import com.my.reminder.domain.port.out.EventStorePort;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.BiFunction;
import java.util.function.Supplier;

/**
 * 왜: 일정 레코드의 유일한 읽기/쓰기 경로를 두어 영속 레코드와 메모리상의 스케줄링 결정이 어긋나지 않게 하기 위함.
 * <p>
 * 모든 변경은 버전을 올리고 다음 발송 시각을 다시 계산한 뒤 저장소에 먼저 기록하고, 그 다음에만 캐시와
 * {@link FireQueue}를 갱신한다. 같은 레코드에 대한 동시 변경은 저장소의 버전 비교로 선형화되며 충돌한 쪽이 다시 읽고 재시도한다.
 */
public class EventRegistry implements ManageEventsUseCase {

    private static final Logger log = Logger.getLogger(EventRegistry.class);

    private static final int MAX_CONFLICT_RETRIES = 32;

    private static final Comparator<EventRecord> BY_NEXT_FIRE = Comparator
            .comparing(EventRecord::nextFireUtc, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(EventRecord::id);

    private final EventStorePort store;
    private final FireQueue fireQueue;
    private final TimeResolver timeResolver;
    private final ClockPort clockPort;
    private final Supplier<String> idGenerator;
    private final Duration alertLead;
    private final ConcurrentMap<String, EventRecord> records = new ConcurrentHashMap<>();

    public EventRegistry(EventStorePort store, FireQueue fireQueue, TimeResolver timeResolver, ClockPort clockPort) {
        this(store, fireQueue, timeResolver, clockPort, Duration.ZERO);
    }

    /**
     * @param alertLead 일정 시각보다 이만큼 먼저 알린다. 0이면 일정 시각에 알린다.
     */
    public EventRegistry(EventStorePort store,
                         FireQueue fireQueue,
                         TimeResolver timeResolver,
                         ClockPort clockPort,
                         Duration alertLead) {
        this(store, fireQueue, timeResolver, clockPort, alertLead, () -> UUID.randomUUID().toString());
    }

    public EventRegistry(EventStorePort store,
                         FireQueue fireQueue,
                         TimeResolver timeResolver,
                         ClockPort clockPort,
                         Supplier<String> idGenerator) {
        this(store, fireQueue, timeResolver, clockPort, Duration.ZERO, idGenerator);
    }

    public EventRegistry(EventStorePort store,
                         FireQueue fireQueue,
                         TimeResolver timeResolver,
                         ClockPort clockPort,
                         Duration alertLead,
                         Supplier<String> idGenerator) {
        if (alertLead.isNegative()) {
            throw new IllegalArgumentException("알림 선행 시간은 음수일 수 없습니다: " + alertLead);
        }
        this.store = store;
        this.fireQueue = fireQueue;
        this.timeResolver = timeResolver;
        this.clockPort = clockPort;
        this.alertLead = alertLead;
        this.idGenerator = idGenerator;
    }

    @Override
    public EventRecord create(EventSpec spec) {
        Instant now = clockPort.now();
        String timezone = timeResolver.zoneOf(spec.timezone()).getId();
        Recurrence recurrence = spec.recurrence();
        Instant nextFire = fireTimeAfter(spec.localDate(), spec.localTime(), timezone, recurrence, now);
        LocalDate localDate = spec.localDate();
        if (localDate == null && recurrence.kind() == RecurrenceKind.CUSTOM) {
            // 간격 반복은 기준일이 있어야 이후 발송 시각이 고정된다.
            localDate = timeResolver.localDateOf(now, timezone);
        }
        EventRecord record = new EventRecord(idGenerator.get(), spec.ownerContext(), localDate, spec.localTime(),
                timezone, recurrence, nextFire, spec.payload(), 1, EventState.ACTIVE, now, now);
        store.put(record, 0);
        publish(record);
        log.infof("일정 생성: id=%s owner=%s next=%s recurrence=%s", record.id(), record.ownerContext(), nextFire, recurrence);
        return record;
    }

    @Override
    public EventRecord modify(String id, EventMutation mutation) {
        if (mutation == null || mutation.isEmpty()) {
            throw new ValidationException("변경할 항목이 없습니다.");
        }
        EventRecord updated = update(id, (current, now) -> {
            requireActive(current);
            LocalDate localDate = mutation.localDate() != null ? mutation.localDate() : current.localDate();
            LocalTime localTime = mutation.localTime() != null ? mutation.localTime() : current.localTime();
            String timezone = mutation.timezone() != null
                    ? timeResolver.zoneOf(mutation.timezone()).getId()
                    : current.timezone();
            Recurrence recurrence = mutation.recurrence() != null ? mutation.recurrence() : current.recurrence();
            String payload = mutation.payload() != null ? mutation.payload() : current.payload();
            if (localDate == null && recurrence.kind() == RecurrenceKind.CUSTOM) {
                localDate = timeResolver.localDateOf(now, timezone);
            }
            Instant nextFire = mutation.touchesSchedule()
                    ? fireTimeAfter(localDate, localTime, timezone, recurrence, now)
                    : current.nextFireUtc();
            return current.next(localDate, localTime, timezone, recurrence, nextFire, payload, EventState.ACTIVE, now);
        });
        log.infof("일정 수정: id=%s version=%d next=%s", id, updated.version(), updated.nextFireUtc());
        return updated;
    }

    @Override
    public EventRecord cancel(String id) {
        EventRecord cancelled = update(id, (current, now) -> {
            requireActive(current);
            return current.finished(EventState.CANCELLED, now);
        });
        log.infof("일정 취소: id=%s version=%d", id, cancelled.version());
        return cancelled;
    }

    @Override
    public Optional<EventRecord> find(String id) {
        EventRecord cached = records.get(id);
        if (cached != null) {
            return Optional.of(cached);
        }
        Optional<EventRecord> stored = store.get(id);
        stored.ifPresent(this::publish);
        return stored;
    }

    @Override
    public List<EventRecord> list(String ownerContext) {
        return records.values().stream()
                .filter(EventRecord::isActive)
                .filter(record -> record.ownerContext().equals(ownerContext))
                .sorted(BY_NEXT_FIRE)
                .toList();
    }

    /**
     * 활성 레코드 전체를 다음 발송 시각 순으로 돌려준다.
     */
    public List<EventRecord> snapshot() {
        return records.values().stream()
                .filter(EventRecord::isActive)
                .sorted(BY_NEXT_FIRE)
                .toList();
    }

    /**
     * 발송을 마친 일정을 다음 회차로 넘기거나 단발 일정이면 완료 처리한다.
     * 발송 도중 다른 변경이 이미 다음 시각을 정했다면 아무것도 하지 않는다.
     *
     * @param graceWindow 계산된 다음 회차가 이보다 더 과거이면 놓친 회차를 건너뛴다
     */
    public EventRecord completeFire(FireEntry fired, Duration graceWindow) {
        return update(fired.eventId(), (current, now) -> {
            if (!current.isActive() || current.nextFireUtc().isAfter(fired.fireAt())) {
                return null;
            }
            if (!current.recurrence().repeats()) {
                return current.finished(EventState.COMPLETED, now);
            }
            Instant next = fireTimeAfter(current, fired.fireAt());
            if (next.isBefore(now.minus(graceWindow))) {
                next = fireTimeAfter(current, now);
            }
            return current.rescheduled(next, now);
        });
    }

    /**
     * 유예 시간을 넘겨 놓친 회차를 발송 없이 건너뛴다. 반복 일정은 다음 미래 회차로, 단발 일정은 완료로 넘어간다.
     */
    public EventRecord skipMissed(String id) {
        return update(id, (current, now) -> {
            if (!current.isActive() || current.nextFireUtc().isAfter(now)) {
                return null;
            }
            if (!current.recurrence().repeats()) {
                return current.finished(EventState.COMPLETED, now);
            }
            return current.rescheduled(fireTimeAfter(current, now), now);
        });
    }

    /**
     * 복구 시 저장소에서 읽은 레코드를 메모리에 올린다. 활성 레코드는 큐에도 들어간다.
     *
     * @throws ValidationException 활성 레코드의 시간대나 반복 규칙을 더 이상 해석할 수 없을 때. 이때는 아무것도 올리지 않는다.
     */
    public void restore(EventRecord record) {
        if (record.isActive()) {
            timeResolver.zoneOf(record.timezone());
            timeResolver.validate(record.recurrence());
        }
        publish(record);
    }

    /**
     * 낡은 큐 항목을 현재 버전 기준으로 다시 넣는다.
     */
    public void requeue(EventRecord record) {
        if (record.isActive()) {
            fireQueue.offer(FireEntry.of(record));
        }
    }

    /**
     * 보존 기간이 지난 취소/완료 레코드를 저장소와 메모리에서 지운다.
     *
     * @return 삭제한 레코드 수
     */
    public int purgeTerminal(Instant cutoff) {
        int purged = 0;
        for (String id : store.listIds()) {
            EventRecord record;
            try {
                record = store.get(id).orElse(null);
            } catch (CorruptRecordException e) {
                log.warnf("손상된 레코드는 정리 대상에서 제외합니다: id=%s reason=%s", id, e.getMessage());
                continue;
            }
            if (record == null || !record.state().isTerminal() || !record.updatedAt().isBefore(cutoff)) {
                continue;
            }
            store.delete(id);
            records.remove(id, record);
            purged++;
        }
        if (purged > 0) {
            log.infof("보존 기간이 지난 일정 %d건을 정리했습니다.", purged);
        }
        return purged;
    }

    private Instant fireTimeAfter(EventRecord record, Instant after) {
        return fireTimeAfter(record.localDate(), record.localTime(), record.timezone(), record.recurrence(), after);
    }

    /**
     * 알림 시각은 일정 시각에서 선행 시간을 뺀 값이다. 알림 시각이 이미 지났지만 일정은 아직 남은 단발 일정은 곧바로 알린다.
     */
    private Instant fireTimeAfter(LocalDate localDate, LocalTime localTime, String timezone, Recurrence recurrence, Instant after) {
        if (alertLead.isZero()) {
            return timeResolver.resolve(localDate, localTime, timezone, recurrence, after);
        }
        if (recurrence.kind() == RecurrenceKind.NONE && localDate != null) {
            Instant alertAt = timeResolver.resolve(localDate, localTime, timezone, recurrence, after).minus(alertLead);
            return alertAt.isAfter(after) ? alertAt : after;
        }
        return timeResolver.resolve(localDate, localTime, timezone, recurrence, after.plus(alertLead)).minus(alertLead);
    }

    private EventRecord update(String id, BiFunction<EventRecord, Instant, EventRecord> change) {
        for (int attempt = 1; attempt <= MAX_CONFLICT_RETRIES; attempt++) {
            EventRecord current = currentRecord(id);
            EventRecord next = change.apply(current, clockPort.now());
            if (next == null) {
                return current;
            }
            try {
                store.put(next, current.version());
                publish(next);
                return next;
            } catch (VersionConflictException e) {
                log.debugf("버전 충돌로 재시도합니다: id=%s attempt=%d (%s)", id, attempt, e.getMessage());
                refresh(id);
            }
        }
        EventRecord latest = currentRecord(id);
        throw new VersionConflictException(id, latest.version(), latest.version());
    }

    private EventRecord currentRecord(String id) {
        EventRecord cached = records.get(id);
        if (cached != null) {
            return cached;
        }
        return store.get(id)
                .map(this::publish)
                .orElseThrow(() -> new EventNotFoundException(id));
    }

    private void refresh(String id) {
        Optional<EventRecord> stored = store.get(id);
        if (stored.isPresent()) {
            publish(stored.get());
        } else {
            records.remove(id);
            fireQueue.remove(id);
        }
    }

    /**
     * 더 높은 버전만 캐시와 큐에 반영한다. 키 단위 잠금 안에서 캐시와 큐를 함께 바꾼다.
     */
    private EventRecord publish(EventRecord record) {
        return records.compute(record.id(), (id, cached) -> {
            if (cached != null && cached.version() >= record.version()) {
                return cached;
            }
            if (record.isActive()) {
                fireQueue.offer(FireEntry.of(record));
            } else {
                fireQueue.remove(id);
            }
            return record;
        });
    }

    private static void requireActive(EventRecord current) {
        if (!current.isActive()) {
            throw new EventNotFoundException(current.id());
        }
    }
}
