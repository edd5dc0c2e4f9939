package com.my.reminder.domain.port.in;

import com.my.reminder.domain.model.EventMutation;
import com.my.reminder.domain.model.EventRecord;
import com.my.reminder.domain.model.EventSpec;

import java.util.List;
import java.util.Optional;

/**
 * 왜: 명령 게이트웨이가 일정 생성, 수정, 취소, 조회를 하나의 진입점으로만 수행하게 하기 위함.
 */
public interface ManageEventsUseCase {

    EventRecord create(EventSpec spec);

    EventRecord modify(String id, EventMutation mutation);

    EventRecord cancel(String id);

    Optional<EventRecord> find(String id);

    List<EventRecord> list(String ownerContext);
}
