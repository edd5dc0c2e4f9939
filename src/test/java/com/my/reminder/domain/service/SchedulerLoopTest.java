package com.my.reminder.domain.service;

import com.my.reminder.adapter.out.store.InMemoryEventStore;
import com.my.reminder.domain.exception.DeliveryException;
import com.my.reminder.domain.model.EventMutation;
import com.my.reminder.domain.model.EventRecord;
import com.my.reminder.domain.model.EventSpec;
import com.my.reminder.domain.model.EventState;
import com.my.reminder.domain.model.FireEntry;
import com.my.reminder.domain.model.Recurrence;
import com.my.reminder.domain.model.SchedulerState;
import com.my.reminder.domain.port.out.NotificationPort;
import com.my.reminder.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class SchedulerLoopTest {

    private static final Instant NOW = Instant.parse("2026-10-18T12:00:00Z");
    private static final Duration GRACE = Duration.ofMinutes(5);

    private InMemoryEventStore store;
    private FireQueue fireQueue;
    private MutableClock clock;
    private EventRegistry registry;
    private NotificationPort port;
    private SchedulerLoop loop;

    @BeforeEach
    void setUp() {
        store = new InMemoryEventStore();
        store.open();
        fireQueue = new FireQueue();
        clock = new MutableClock(NOW);
        registry = new EventRegistry(store, fireQueue, new TimeResolver("UTC"), clock);
        port = mock(NotificationPort.class);
        loop = new SchedulerLoop(registry, fireQueue, new NotificationDispatcher(port), clock, GRACE);
    }

    @AfterEach
    void tearDown() {
        loop.drain(Duration.ofSeconds(2));
    }

    @Test
    void firesDueSingleShotOnceAndCompletesIt() {
        EventRecord once = registry.create(new EventSpec("telegram:1", LocalDate.of(2026, 10, 18), LocalTime.of(12, 30),
                "UTC", Recurrence.none(), "meeting"));
        clock.set(Instant.parse("2026-10-18T12:30:00Z"));

        assertThat(loop.fireDue()).isEqualTo(1);
        assertThat(loop.fireDue()).isZero();

        verify(port, times(1)).deliver("telegram:1", "meeting");
        assertThat(registry.find(once.id())).map(EventRecord::state).contains(EventState.COMPLETED);
        assertThat(fireQueue.isEmpty()).isTrue();
    }

    @Test
    void recurringEventIsAdvancedAfterFiring() {
        EventRecord daily = registry.create(daily(13, "stretch"));
        clock.set(Instant.parse("2026-10-18T13:00:00Z"));

        loop.fireDue();

        EventRecord after = registry.find(daily.id()).orElseThrow();
        assertThat(after.nextFireUtc()).isEqualTo(Instant.parse("2026-10-19T13:00:00Z"));
        assertThat(after.version()).isEqualTo(2);
        assertThat(fireQueue.get(daily.id())).contains(FireEntry.of(after));
    }

    @Test
    void nothingFiresBeforeDeadline() {
        registry.create(daily(13, "stretch"));
        clock.set(Instant.parse("2026-10-18T12:59:59Z"));

        assertThat(loop.fireDue()).isZero();
        verify(port, never()).deliver(anyString(), anyString());
    }

    @Test
    void staleQueueEntryIsDiscardedAndRequeued() {
        EventRecord created = registry.create(daily(13, "old text"));
        registry.modify(created.id(), EventMutation.payload("new text"));
        fireQueue.remove(created.id());
        fireQueue.offer(FireEntry.of(created));
        clock.set(Instant.parse("2026-10-18T13:00:00Z"));

        assertThat(loop.fireDue()).isZero();
        verify(port, never()).deliver(anyString(), anyString());
        assertThat(fireQueue.get(created.id())).map(FireEntry::version).contains(2L);

        assertThat(loop.fireDue()).isEqualTo(1);
        verify(port).deliver("telegram:1", "new text");
    }

    @Test
    void cancelledEventNeverFires() {
        EventRecord created = registry.create(daily(13, "stretch"));
        registry.cancel(created.id());
        clock.set(Instant.parse("2026-10-18T13:00:00Z"));

        assertThat(loop.fireDue()).isZero();
        verify(port, never()).deliver(anyString(), anyString());
    }

    @Test
    void failedDeliveryStillAdvancesSchedule() {
        doThrow(new DeliveryException("telegram down")).when(port).deliver(anyString(), anyString());
        EventRecord daily = registry.create(daily(13, "stretch"));
        clock.set(Instant.parse("2026-10-18T13:00:00Z"));

        loop.fireDue();

        verify(port, times(1)).deliver("telegram:1", "stretch");
        assertThat(registry.find(daily.id()).orElseThrow().nextFireUtc())
                .isEqualTo(Instant.parse("2026-10-19T13:00:00Z"));
    }

    @Test
    void lateFireBeyondGraceSkipsMissedOccurrences() {
        EventRecord custom = registry.create(new EventSpec("telegram:1", LocalDate.of(2026, 10, 18), LocalTime.of(12, 10),
                "UTC", Recurrence.custom(Duration.ofMinutes(10)), "ping"));
        clock.set(Instant.parse("2026-10-18T13:05:00Z"));

        loop.fireDue();

        verify(port, times(1)).deliver("telegram:1", "ping");
        assertThat(registry.find(custom.id()).orElseThrow().nextFireUtc())
                .isEqualTo(Instant.parse("2026-10-18T13:10:00Z"));
    }

    @Test
    void cancelLandingAfterPopStillWins() {
        EventRecord created = registry.create(daily(13, "stretch"));
        clock.set(Instant.parse("2026-10-18T13:00:00Z"));
        List<FireEntry> popped = fireQueue.pollDue(clock.now());

        registry.cancel(created.id());

        assertThat(popped).hasSize(1);
        assertThat(loop.fire(popped.get(0))).isFalse();
        verify(port, never()).deliver(anyString(), anyString());
        assertThat(registry.find(created.id())).map(EventRecord::state).contains(EventState.CANCELLED);
        assertThat(fireQueue.isEmpty()).isTrue();
    }

    @Test
    void payloadEditDuringDeliveryDoesNotRefireSameOccurrence() {
        EventRecord created = registry.create(daily(13, "old text"));
        doAnswer(invocation -> {
            registry.modify(created.id(), EventMutation.payload("new text"));
            return null;
        }).when(port).deliver("telegram:1", "old text");
        clock.set(Instant.parse("2026-10-18T13:00:00Z"));

        loop.fireDue();
        assertThat(loop.fireDue()).isZero();

        EventRecord after = registry.find(created.id()).orElseThrow();
        verify(port, times(1)).deliver(anyString(), anyString());
        assertThat(after.payload()).isEqualTo("new text");
        assertThat(after.nextFireUtc()).isEqualTo(Instant.parse("2026-10-19T13:00:00Z"));
        assertThat(after.version()).isEqualTo(3);
    }

    @Test
    void dailyEventKeepsLocalTimeAcrossSpringForward() {
        clock.set(Instant.parse("2026-03-06T12:00:00Z"));
        EventRecord created = registry.create(new EventSpec("telegram:1", null, LocalTime.of(9, 0),
                "America/Los_Angeles", Recurrence.daily(), "standup"));
        ZoneId zone = ZoneId.of("America/Los_Angeles");
        List<Instant> fires = new ArrayList<>();
        Instant next = created.nextFireUtc();

        for (int i = 0; i < 4; i++) {
            fires.add(next);
            clock.set(next);
            assertThat(loop.fireDue()).isEqualTo(1);
            next = registry.find(created.id()).orElseThrow().nextFireUtc();
        }

        verify(port, times(4)).deliver("telegram:1", "standup");
        for (int i = 0; i < fires.size(); i++) {
            ZonedDateTime local = fires.get(i).atZone(zone);
            assertThat(local.toLocalTime()).isEqualTo(LocalTime.of(9, 0));
            assertThat(local.toLocalDate()).isEqualTo(LocalDate.of(2026, 3, 6).plusDays(i));
        }
        assertThat(Duration.between(fires.get(0), fires.get(1))).isEqualTo(Duration.ofHours(24));
        assertThat(Duration.between(fires.get(1), fires.get(2))).isEqualTo(Duration.ofHours(23));
        assertThat(Duration.between(fires.get(2), fires.get(3))).isEqualTo(Duration.ofHours(24));
    }

    @Test
    void recordWithUnresolvableTimezoneDoesNotStopLoop() {
        Instant due = Instant.parse("2026-10-18T13:00:00Z");
        store.put(new EventRecord("a-bad", "telegram:1", null, LocalTime.of(13, 0), "Mars/Olympus", Recurrence.daily(),
                due, "a-bad", 1, EventState.ACTIVE, NOW, NOW), 0);
        registry.find("a-bad");
        registry.create(daily(13, "b-good"));
        clock.set(due);

        loop.start();

        verify(port, timeout(3_000)).deliver("telegram:1", "b-good");
        assertThat(loop.isRunning()).isTrue();
        assertThat(fireQueue.contains("a-bad")).isFalse();
        assertThat(registry.find("a-bad").orElseThrow().nextFireUtc()).isEqualTo(due);
    }

    @Test
    void alertLeadFiresBeforeEachOccurrence() {
        EventRegistry leadRegistry = new EventRegistry(store, fireQueue, new TimeResolver("UTC"), clock,
                Duration.ofMinutes(10));
        SchedulerLoop leadLoop = new SchedulerLoop(leadRegistry, fireQueue, new NotificationDispatcher(port), clock, GRACE);
        EventRecord created = leadRegistry.create(daily(13, "meeting soon"));

        assertThat(created.nextFireUtc()).isEqualTo(Instant.parse("2026-10-18T12:50:00Z"));
        clock.set(Instant.parse("2026-10-18T12:50:00Z"));
        assertThat(leadLoop.fireDue()).isEqualTo(1);

        verify(port).deliver("telegram:1", "meeting soon");
        assertThat(leadRegistry.find(created.id()).orElseThrow().nextFireUtc())
                .isEqualTo(Instant.parse("2026-10-19T12:50:00Z"));
        leadLoop.drain(Duration.ofSeconds(1));
    }

    @Test
    void alertLeadAlreadyPassedFiresSingleShotImmediately() {
        EventRegistry leadRegistry = new EventRegistry(store, fireQueue, new TimeResolver("UTC"), clock,
                Duration.ofMinutes(30));

        EventRecord created = leadRegistry.create(new EventSpec("telegram:1", LocalDate.of(2026, 10, 18),
                LocalTime.of(12, 10), "UTC", Recurrence.none(), "starting"));

        assertThat(created.nextFireUtc()).isEqualTo(NOW);
        assertThat(fireQueue.nextDeadline()).contains(NOW);
    }

    @Test
    void runningLoopWakesUpForNewlyDueEvent() {
        loop.start();
        registry.create(new EventSpec("telegram:1", null, LocalTime.of(12, 1), "UTC", Recurrence.daily(), "soon"));

        clock.set(Instant.parse("2026-10-18T12:01:00Z"));
        loop.wake();

        verify(port, timeout(3_000)).deliver("telegram:1", "soon");
    }

    @Test
    void drainStopsRunningLoop() {
        loop.start();

        boolean clean = loop.drain(Duration.ofSeconds(2));

        assertThat(clean).isTrue();
        assertThat(loop.state()).isEqualTo(SchedulerState.STOPPED);
        assertThat(loop.isRunning()).isFalse();
        assertThat(loop.fireDue()).isZero();
    }

    private static EventSpec daily(int hour, String payload) {
        return new EventSpec("telegram:1", null, LocalTime.of(hour, 0), "UTC", Recurrence.daily(), payload);
    }
}
