package com.my.reminder.domain.port.out;

import com.my.reminder.domain.model.ReplyMessage;

/**
 * 왜: 명령 처리 결과를 돌려보내는 채널(RabbitMQ 등) 구현을 숨기기 위함.
 */
public interface ReplyPort {
    void send(ReplyMessage replyMessage);
}
