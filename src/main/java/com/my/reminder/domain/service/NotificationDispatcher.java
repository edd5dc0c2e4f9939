package com.my.reminder.domain.service;

import com.my.reminder.domain.model.EventRecord;
import com.my.reminder.domain.port.out.NotificationPort;
import org.jboss.logging.Logger;

/**
 * 왜: 전송 실패가 발송 파이프라인 밖으로 새지 않게 막아, 알림 하나가 실패해도 일정이 다음 회차로 넘어가게 하기 위함.
 * <p>
 * 시도별 시간 제한, 재시도, 지수 백오프는 {@link NotificationPort} 구현의 Fault Tolerance 설정이 맡는다.
 * 여기까지 올라온 예외는 재시도를 모두 소진한 결과로 본다.
 */
public class NotificationDispatcher {

    private static final Logger log = Logger.getLogger(NotificationDispatcher.class);

    private final NotificationPort notificationPort;

    public NotificationDispatcher(NotificationPort notificationPort) {
        this.notificationPort = notificationPort;
    }

    /**
     * 전송을 시도한다. 실패해도 예외를 던지지 않는다.
     *
     * @return 전송에 성공했으면 true
     */
    public boolean dispatch(EventRecord record) {
        try {
            notificationPort.deliver(record.ownerContext(), record.payload());
            return true;
        } catch (RuntimeException e) {
            log.errorf("알림 전송을 포기하고 다음 회차로 넘깁니다: id=%s owner=%s reason=%s",
                    record.id(), record.ownerContext(), e.getMessage());
            return false;
        }
    }
}
