package com.my.reminder.domain.exception;

/**
 * 왜: 존재하지 않거나 이미 종료된 일정에 대한 요청을 명령 단위 실패로 구분하기 위함.
 */
public class EventNotFoundException extends RuntimeException {

    private final String eventId;

    public EventNotFoundException(String eventId) {
        super("활성 일정을 찾을 수 없습니다: " + eventId);
        this.eventId = eventId;
    }

    public String eventId() {
        return eventId;
    }
}
