package com.my.reminder.adapter.in.idempotency;

import java.util.Optional;

/**
 * 왜: 재전달된 명령이 일정을 두 번 만들지 않도록, 처리한 명령 id와 그때 보낸 응답을 함께 기억하기 위함.
 */
public interface ProcessedCommandStore {

    /**
     * 보존 기간 안에 처리한 명령이면 당시 응답 본문을 돌려준다.
     */
    Optional<String> findReply(String commandId);

    void remember(String commandId, String replyBody);
}
