package com.my.reminder.domain.service;

import com.my.reminder.adapter.out.store.InMemoryEventStore;
import com.my.reminder.domain.exception.EventNotFoundException;
import com.my.reminder.domain.exception.StoreUnavailableException;
import com.my.reminder.domain.exception.ValidationException;
import com.my.reminder.domain.model.EventMutation;
import com.my.reminder.domain.model.EventRecord;
import com.my.reminder.domain.model.EventSpec;
import com.my.reminder.domain.model.EventState;
import com.my.reminder.domain.model.FireEntry;
import com.my.reminder.domain.model.Recurrence;
import com.my.reminder.domain.port.out.EventStorePort;
import com.my.reminder.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;

class EventRegistryTest {

    private static final Instant NOW = Instant.parse("2026-10-18T12:00:00Z");

    private InMemoryEventStore store;
    private FireQueue fireQueue;
    private MutableClock clock;
    private EventRegistry registry;

    @BeforeEach
    void setUp() {
        store = new InMemoryEventStore();
        store.open();
        fireQueue = new FireQueue();
        clock = new MutableClock(NOW);
        AtomicInteger ids = new AtomicInteger();
        registry = new EventRegistry(store, fireQueue, new TimeResolver("UTC"), clock,
                () -> "evt-" + ids.incrementAndGet());
    }

    @Test
    void createPersistsFirstVersionAndSchedulesIt() {
        EventRecord created = registry.create(dailyAt(13, "stretch"));

        assertThat(created.version()).isEqualTo(1);
        assertThat(created.nextFireUtc()).isEqualTo(Instant.parse("2026-10-18T13:00:00Z"));
        assertThat(store.get(created.id())).contains(created);
        assertThat(fireQueue.get(created.id())).contains(FireEntry.of(created));
    }

    @Test
    void negativeAlertLeadIsRejected() {
        assertThatThrownBy(() -> new EventRegistry(store, fireQueue, new TimeResolver("UTC"), clock, Duration.ofMinutes(-5)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void createResolvesAbbreviatedTimezoneToCanonicalId() {
        EventRecord created = registry.create(new EventSpec("telegram:1", null, LocalTime.of(9, 0), "PT",
                Recurrence.daily(), "standup"));

        assertThat(created.timezone()).isEqualTo("America/Los_Angeles");
    }

    @Test
    void createInThePastStoresNothing() {
        EventSpec past = new EventSpec("telegram:1", LocalDate.of(2026, 10, 1), LocalTime.NOON, "UTC",
                Recurrence.none(), "too late");

        assertThatThrownBy(() -> registry.create(past)).isInstanceOf(ValidationException.class);

        assertThat(store.listIds()).isEmpty();
        assertThat(fireQueue.isEmpty()).isTrue();
    }

    @Test
    void customWithoutDateIsAnchoredToCreationDay() {
        EventRecord created = registry.create(new EventSpec("telegram:1", null, LocalTime.of(8, 0), "UTC",
                Recurrence.custom(Duration.ofHours(3)), "hydrate"));

        assertThat(created.localDate()).isEqualTo(LocalDate.of(2026, 10, 18));
        assertThat(created.nextFireUtc()).isEqualTo(Instant.parse("2026-10-18T14:00:00Z"));
    }

    @Test
    void modifyTimeBumpsVersionAndReschedules() {
        EventRecord created = registry.create(dailyAt(13, "stretch"));

        EventRecord modified = registry.modify(created.id(), EventMutation.time(LocalTime.of(15, 30)));

        assertThat(modified.version()).isEqualTo(2);
        assertThat(modified.nextFireUtc()).isEqualTo(Instant.parse("2026-10-18T15:30:00Z"));
        assertThat(fireQueue.get(created.id())).contains(FireEntry.of(modified));
        assertThat(store.get(created.id())).contains(modified);
    }

    @Test
    void modifyPayloadKeepsNextFire() {
        EventRecord created = registry.create(dailyAt(13, "stretch"));

        EventRecord modified = registry.modify(created.id(), EventMutation.payload("stretch harder"));

        assertThat(modified.payload()).isEqualTo("stretch harder");
        assertThat(modified.nextFireUtc()).isEqualTo(created.nextFireUtc());
    }

    @Test
    void emptyModificationIsRejected() {
        EventRecord created = registry.create(dailyAt(13, "stretch"));

        assertThatThrownBy(() -> registry.modify(created.id(), new EventMutation(null, null, null, null, null)))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void unknownIdIsNotFound() {
        assertThatThrownBy(() -> registry.modify("nope", EventMutation.payload("x")))
                .isInstanceOf(EventNotFoundException.class);
        assertThatThrownBy(() -> registry.cancel("nope"))
                .isInstanceOf(EventNotFoundException.class);
    }

    @Test
    void cancelRemovesFromQueueAndCannotBeRepeated() {
        EventRecord created = registry.create(dailyAt(13, "stretch"));

        EventRecord cancelled = registry.cancel(created.id());

        assertThat(cancelled.state()).isEqualTo(EventState.CANCELLED);
        assertThat(cancelled.nextFireUtc()).isNull();
        assertThat(fireQueue.contains(created.id())).isFalse();
        assertThat(store.get(created.id())).map(EventRecord::state).contains(EventState.CANCELLED);
        assertThatThrownBy(() -> registry.cancel(created.id())).isInstanceOf(EventNotFoundException.class);
    }

    @Test
    void failedStoreWriteLeavesMemoryUntouched() {
        EventStorePort failing = mock(EventStorePort.class);
        doThrow(new StoreUnavailableException("disk full")).when(failing).put(any(), anyLong());
        EventRegistry failingRegistry = new EventRegistry(failing, fireQueue, new TimeResolver("UTC"), clock);

        assertThatThrownBy(() -> failingRegistry.create(dailyAt(13, "stretch")))
                .isInstanceOf(StoreUnavailableException.class);

        assertThat(fireQueue.isEmpty()).isTrue();
        assertThat(failingRegistry.snapshot()).isEmpty();
    }

    @Test
    void concurrentModificationsAreAllApplied() throws Exception {
        EventRecord created = registry.create(dailyAt(13, "count"));
        int threads = 4;
        int perThread = 25;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        for (int t = 0; t < threads; t++) {
            int worker = t;
            futures.add(executor.submit(() -> {
                start.await();
                for (int i = 0; i < perThread; i++) {
                    registry.modify(created.id(), EventMutation.payload("w" + worker + "-" + i));
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(30, TimeUnit.SECONDS);
        }
        executor.shutdown();

        EventRecord stored = store.get(created.id()).orElseThrow();
        assertThat(stored.version()).isEqualTo(1 + threads * perThread);
        assertThat(registry.find(created.id())).contains(stored);
        assertThat(fireQueue.get(created.id())).map(FireEntry::version).contains(stored.version());
    }

    @Test
    void completeFireAdvancesRecurringAndCompletesSingleShot() {
        EventRecord daily = registry.create(dailyAt(13, "daily"));
        EventRecord once = registry.create(new EventSpec("telegram:1", LocalDate.of(2026, 10, 18), LocalTime.of(13, 0),
                "UTC", Recurrence.none(), "once"));
        clock.set(Instant.parse("2026-10-18T13:00:01Z"));

        EventRecord advanced = registry.completeFire(FireEntry.of(daily), Duration.ofMinutes(5));
        EventRecord completed = registry.completeFire(FireEntry.of(once), Duration.ofMinutes(5));

        assertThat(advanced.nextFireUtc()).isEqualTo(Instant.parse("2026-10-19T13:00:00Z"));
        assertThat(advanced.state()).isEqualTo(EventState.ACTIVE);
        assertThat(completed.state()).isEqualTo(EventState.COMPLETED);
        assertThat(fireQueue.contains(once.id())).isFalse();
    }

    @Test
    void completeFireIgnoresRecordRescheduledMeanwhile() {
        EventRecord created = registry.create(dailyAt(13, "daily"));
        FireEntry fired = FireEntry.of(created);
        EventRecord moved = registry.modify(created.id(), EventMutation.time(LocalTime.of(18, 0)));
        clock.set(Instant.parse("2026-10-18T13:00:01Z"));

        EventRecord after = registry.completeFire(fired, Duration.ofMinutes(5));

        assertThat(after).isEqualTo(moved);
    }

    @Test
    void listReturnsOnlyOwnersActiveEventsInFireOrder() {
        EventRecord late = registry.create(dailyAt(20, "late"));
        EventRecord early = registry.create(dailyAt(14, "early"));
        registry.create(new EventSpec("telegram:2", null, LocalTime.of(15, 0), "UTC", Recurrence.daily(), "other"));
        EventRecord cancelled = registry.create(dailyAt(16, "gone"));
        registry.cancel(cancelled.id());

        assertThat(registry.list("telegram:1")).extracting(EventRecord::id)
                .containsExactly(early.id(), late.id());
    }

    @Test
    void purgeDeletesOnlyOldTerminalRecords() {
        EventRecord old = registry.create(dailyAt(14, "old"));
        registry.cancel(old.id());
        clock.advance(Duration.ofDays(10));
        EventRecord recent = registry.create(dailyAt(14, "recent"));
        registry.cancel(recent.id());
        EventRecord active = registry.create(dailyAt(15, "active"));

        int purged = registry.purgeTerminal(clock.now().minus(Duration.ofDays(7)));

        assertThat(purged).isEqualTo(1);
        assertThat(store.listIds()).containsExactlyInAnyOrder(recent.id(), active.id());
    }

    private static EventSpec dailyAt(int hour, String payload) {
        return new EventSpec("telegram:1", null, LocalTime.of(hour, 0), "UTC", Recurrence.daily(), payload);
    }
}
