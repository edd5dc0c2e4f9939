package com.my.reminder.domain.exception;

public class InvalidRecurrenceException extends ValidationException {
    public InvalidRecurrenceException(String message) {
        super(message);
    }
}
