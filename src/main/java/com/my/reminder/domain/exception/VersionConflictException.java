package com.my.reminder.domain.exception;

/**
 * 왜: 낙관적 동시성 검사에서 다른 기록자가 먼저 갱신했음을 알려 호출자가 다시 읽고 재시도하게 하기 위함.
 */
public class VersionConflictException extends RuntimeException {

    private final String eventId;
    private final long expectedVersion;
    private final long actualVersion;

    public VersionConflictException(String eventId, long expectedVersion, long actualVersion) {
        super("버전 충돌: id=" + eventId + " expected=" + expectedVersion + " actual=" + actualVersion);
        this.eventId = eventId;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public String eventId() {
        return eventId;
    }

    public long expectedVersion() {
        return expectedVersion;
    }

    public long actualVersion() {
        return actualVersion;
    }
}
