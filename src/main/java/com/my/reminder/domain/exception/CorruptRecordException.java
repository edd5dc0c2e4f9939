package com.my.reminder.domain.exception;

public class CorruptRecordException extends RuntimeException {

    private final String eventId;

    public CorruptRecordException(String eventId, String message, Throwable cause) {
        super(message, cause);
        this.eventId = eventId;
    }

    public String eventId() {
        return eventId;
    }
}
