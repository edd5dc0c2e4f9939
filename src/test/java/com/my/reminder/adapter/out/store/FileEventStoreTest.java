package com.my.reminder.adapter.out.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.my.reminder.domain.exception.AlreadyRunningException;
import com.my.reminder.domain.exception.CorruptRecordException;
import com.my.reminder.domain.exception.StoreUnavailableException;
import com.my.reminder.domain.exception.VersionConflictException;
import com.my.reminder.domain.model.EventRecord;
import com.my.reminder.domain.model.EventState;
import com.my.reminder.domain.model.Recurrence;
import com.my.reminder.domain.model.RecurrenceKind;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Set;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileEventStoreTest {

    private static final Instant NOW = Instant.parse("2026-10-18T12:00:00Z");

    @TempDir
    Path tempDir;

    private FileEventStore store;

    @BeforeEach
    void setUp() {
        store = new FileEventStore(tempDir, new ObjectMapper());
        store.open();
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    @Test
    void storesAndReadsBackRecord() {
        EventRecord record = weekly("evt-1", 1);

        store.put(record, 0);

        assertThat(store.get("evt-1")).contains(record);
        assertThat(store.listIds()).containsExactly("evt-1");
        assertThat(store.get("missing")).isEmpty();
    }

    @Test
    void replacesOnlyWhenExpectedVersionMatches() {
        store.put(weekly("evt-1", 1), 0);
        store.put(weekly("evt-1", 2), 1);

        assertThatThrownBy(() -> store.put(weekly("evt-1", 3), 1))
                .isInstanceOfSatisfying(VersionConflictException.class,
                        e -> assertThat(e.actualVersion()).isEqualTo(2));
        assertThatThrownBy(() -> store.put(weekly("evt-1", 1), 0))
                .isInstanceOf(VersionConflictException.class);
        assertThat(store.get("evt-1")).map(EventRecord::version).contains(2L);
    }

    @Test
    void leavesNoTemporaryFilesBehind() throws Exception {
        store.put(weekly("evt-1", 1), 0);
        store.put(weekly("evt-1", 2), 1);

        try (Stream<Path> files = Files.list(tempDir.resolve("records"))) {
            assertThat(files.map(path -> path.getFileName().toString())).containsExactly("evt-1.json");
        }
    }

    @Test
    void secondInstanceOnSameDirectoryIsRejected() {
        FileEventStore other = new FileEventStore(tempDir, new ObjectMapper());

        assertThatThrownBy(other::open).isInstanceOf(AlreadyRunningException.class);
        assertThat(other.isOpen()).isFalse();

        store.close();
        other.open();
        assertThat(other.isOpen()).isTrue();
        other.close();
    }

    @Test
    void corruptRecordIsReportedAndSkippedInActiveListing() throws Exception {
        store.put(weekly("good", 1), 0);
        Files.writeString(tempDir.resolve("records").resolve("bad.json"), "{\"id\":\"bad\",");

        assertThatThrownBy(() -> store.get("bad"))
                .isInstanceOfSatisfying(CorruptRecordException.class, e -> assertThat(e.eventId()).isEqualTo("bad"));
        assertThat(store.listIds()).containsExactly("bad", "good");
        assertThat(store.listActive()).extracting(EventRecord::id).containsExactly("good");
    }

    @Test
    void recordWithUnresolvableRuleIsReportedAsCorrupt() {
        EventRecord good = weekly("tz", 1);
        store.put(new EventRecord("tz", good.ownerContext(), good.localDate(), good.localTime(), "Mars/Olympus",
                good.recurrence(), good.nextFireUtc(), good.payload(), 1, EventState.ACTIVE, NOW, NOW), 0);
        store.put(new EventRecord("days", good.ownerContext(), good.localDate(), good.localTime(), good.timezone(),
                new Recurrence(RecurrenceKind.WEEKLY, Set.of(), null), good.nextFireUtc(), good.payload(), 1,
                EventState.ACTIVE, NOW, NOW), 0);

        assertThatThrownBy(() -> store.get("tz")).isInstanceOf(CorruptRecordException.class);
        assertThatThrownBy(() -> store.get("days")).isInstanceOf(CorruptRecordException.class);
        assertThat(store.listActive()).isEmpty();
    }

    @Test
    void strayTemporaryFilesAreRemovedOnOpen() throws Exception {
        store.put(weekly("evt-1", 1), 0);
        store.close();
        Path stray = tempDir.resolve("records").resolve("evt-1.json.abc.tmp");
        Files.writeString(stray, "half written");

        store = new FileEventStore(tempDir, new ObjectMapper());
        store.open();

        assertThat(stray).doesNotExist();
        assertThat(store.get("evt-1")).map(EventRecord::version).contains(1L);
    }

    @Test
    void terminalRecordWithoutNextFireRoundTrips() {
        EventRecord cancelled = weekly("evt-1", 1).finished(EventState.CANCELLED, NOW.plusSeconds(5));
        store.put(cancelled, 0);

        assertThat(store.get("evt-1")).contains(cancelled);
        assertThat(store.listActive()).isEmpty();
    }

    @Test
    void deleteRemovesRecord() {
        store.put(weekly("evt-1", 1), 0);

        store.delete("evt-1");
        store.delete("evt-1");

        assertThat(store.get("evt-1")).isEmpty();
    }

    @Test
    void rejectsPathLikeIds() {
        assertThatThrownBy(() -> store.get("../escape")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void operationsRequireOpenStore() {
        store.close();

        assertThatThrownBy(() -> store.get("evt-1")).isInstanceOf(StoreUnavailableException.class);
    }

    static EventRecord weekly(String id, long version) {
        return new EventRecord(id, "telegram:42", LocalDate.of(2026, 10, 19), LocalTime.of(9, 30), "Asia/Seoul",
                Recurrence.weekly(Set.of(DayOfWeek.MONDAY, DayOfWeek.FRIDAY)), NOW.plus(Duration.ofHours(version)),
                "주간 회의", version, EventState.ACTIVE, NOW, NOW.plusSeconds(version));
    }
}
