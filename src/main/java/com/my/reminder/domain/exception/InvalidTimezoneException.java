package com.my.reminder.domain.exception;

public class InvalidTimezoneException extends ValidationException {

    private final String timezone;

    public InvalidTimezoneException(String timezone, Throwable cause) {
        super("알 수 없는 시간대입니다: " + timezone, cause);
        this.timezone = timezone;
    }

    public String timezone() {
        return timezone;
    }
}
