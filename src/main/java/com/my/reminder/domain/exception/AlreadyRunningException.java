package com.my.reminder.domain.exception;

/**
 * 왜: 다른 프로세스가 같은 저장소의 쓰기 잠금을 쥐고 있을 때 이중 스케줄링 대신 즉시 기동을 포기하기 위함.
 */
public class AlreadyRunningException extends StoreUnavailableException {
    public AlreadyRunningException(String message) {
        super(message);
    }
}
