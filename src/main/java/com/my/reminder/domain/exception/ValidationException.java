package com.my.reminder.domain.exception;

/**
 * 왜: 사용자 입력(시각, 시간대, 반복 규칙)이 일정으로 해석될 수 없을 때 명령 단위 실패로 돌려주기 위함.
 */
public class ValidationException extends RuntimeException {
    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
