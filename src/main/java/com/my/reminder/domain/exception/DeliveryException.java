package com.my.reminder.domain.exception;

/**
 * 왜: 알림 전송 실패를 재시도 정책이 처리할 수 있는 단일 유형으로 표현하기 위함.
 */
public class DeliveryException extends RuntimeException {
    public DeliveryException(String message) {
        super(message);
    }

    public DeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
