package com.my.reminder.adapter.in.rabbitmq;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.my.reminder.domain.model.EventRecord;
import com.my.reminder.domain.model.ReplyMessage;
import com.my.reminder.domain.model.ReplyStatus;

import java.util.List;

/**
 * 처리한 명령의 응답 기록. 재전달 시 같은 상태와 문구를 다시 보내고, 일정은 현재 상태로 다시 읽는다.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
record StoredReply(String status, String content, List<String> eventIds) {

    static StoredReply from(ReplyMessage reply) {
        return new StoredReply(reply.status().name(), reply.content(),
                reply.events().stream().map(EventRecord::id).toList());
    }

    ReplyMessage toReply(String commandId, String ownerContext, List<EventRecord> events) {
        return new ReplyMessage(commandId, ownerContext, ReplyStatus.valueOf(status), content, events);
    }
}
