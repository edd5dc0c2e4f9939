package com.my.reminder.domain.port.out;

/**
 * 왜: 채팅 플랫폼 전송 구현을 도메인에서 분리해 스케줄러가 전송 방식과 무관하게 발송 결과만 다루게 하기 위함.
 */
public interface NotificationPort {

    /**
     * @throws com.my.reminder.domain.exception.DeliveryException 전송에 실패했을 때
     */
    void deliver(String ownerContext, String payload);
}
