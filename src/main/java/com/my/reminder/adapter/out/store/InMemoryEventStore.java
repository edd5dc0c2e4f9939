package com.my.reminder.adapter.out.store;

import com.my.reminder.domain.exception.StoreUnavailableException;
import com.my.reminder.domain.exception.VersionConflictException;
import com.my.reminder.domain.model.EventRecord;
import com.my.reminder.domain.port.out.EventStorePort;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 왜: 로컬 실행과 테스트에서 디스크 없이 같은 버전 비교 계약을 쓰기 위함. 재시작하면 내용이 사라진다.
 */
@IfBuildProperty(name = "app.store.backend", stringValue = "memory")
@ApplicationScoped
public class InMemoryEventStore implements EventStorePort {

    private final Map<String, EventRecord> records = new ConcurrentHashMap<>();
    private volatile boolean open;

    @Override
    public void open() {
        open = true;
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public void put(EventRecord record, long expectedVersion) {
        requireOpen();
        records.compute(record.id(), (id, current) -> {
            long actual = current == null ? 0L : current.version();
            if (actual != expectedVersion) {
                throw new VersionConflictException(id, expectedVersion, actual);
            }
            return record;
        });
    }

    @Override
    public Optional<EventRecord> get(String id) {
        requireOpen();
        return Optional.ofNullable(records.get(id));
    }

    @Override
    public List<String> listIds() {
        requireOpen();
        return records.keySet().stream().sorted().toList();
    }

    @Override
    public List<EventRecord> listActive() {
        requireOpen();
        return records.values().stream()
                .filter(EventRecord::isActive)
                .sorted((a, b) -> a.id().compareTo(b.id()))
                .toList();
    }

    @Override
    public void delete(String id) {
        requireOpen();
        records.remove(id);
    }

    @Override
    public void close() {
        open = false;
    }

    private void requireOpen() {
        if (!open) {
            throw new StoreUnavailableException("일정 저장소가 열려 있지 않습니다.");
        }
    }
}
