package com.my.reminder.domain.exception;

/**
 * 왜: 저장소를 열거나 쓸 수 없는 구조적 장애를 스케줄러가 복구 불가능한 상황으로 취급하게 하기 위함.
 */
public class StoreUnavailableException extends RuntimeException {
    public StoreUnavailableException(String message) {
        super(message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
