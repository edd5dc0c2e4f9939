package com.my.reminder.domain.port.out;

import com.my.reminder.domain.model.EventRecord;

import java.util.List;
import java.util.Optional;

/**
 * 왜: 일정 레코드의 영속화 방식(파일, SQLite 등)을 숨기고 원자적 단일 레코드 교체와 쓰기 잠금 계약만 도메인에 노출하기 위함.
 * <p>
 * 모든 쓰기는 {@link #open()}으로 배타 잠금을 얻은 뒤에만 허용된다.
 */
public interface EventStorePort extends AutoCloseable {

    /**
     * 쓰기 잠금을 얻고 저장소를 연다.
     *
     * @throws com.my.reminder.domain.exception.AlreadyRunningException 다른 프로세스가 잠금을 쥐고 있을 때
     * @throws com.my.reminder.domain.exception.StoreUnavailableException 저장소를 열 수 없을 때
     */
    void open();

    boolean isOpen();

    /**
     * 저장된 버전이 {@code expectedVersion}일 때만 레코드를 교체한다. 신규 레코드는 0을 기대한다.
     *
     * @throws com.my.reminder.domain.exception.VersionConflictException 저장된 버전이 다를 때
     */
    void put(EventRecord record, long expectedVersion);

    /**
     * @throws com.my.reminder.domain.exception.CorruptRecordException 레코드를 해석할 수 없을 때
     */
    Optional<EventRecord> get(String id);

    List<String> listIds();

    /**
     * 활성 레코드 전체. 손상된 레코드는 로그를 남기고 건너뛴다.
     */
    List<EventRecord> listActive();

    void delete(String id);

    @Override
    void close();
}
