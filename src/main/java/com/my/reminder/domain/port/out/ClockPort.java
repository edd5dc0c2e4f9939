package com.my.reminder.domain.port.out;

import java.time.Instant;

/**
 * 왜: 현재 시각을 주입형으로 분리해 발송 시각 판단과 복구 정책을 시간 조작 없이 테스트하기 위함.
 */
public interface ClockPort {
    Instant now();
}
