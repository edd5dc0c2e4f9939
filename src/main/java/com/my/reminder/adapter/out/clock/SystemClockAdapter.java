package com.my.reminder.adapter.out.clock;

import com.my.reminder.domain.port.out.ClockPort;

import java.time.Clock;
import java.time.Instant;

/**
 * 왜: 시스템 시간을 주입형으로 제공해 발송 판단을 UTC 기준으로 고정하고 테스트에서 시각을 바꿀 수 있게 하기 위함.
 */
public class SystemClockAdapter implements ClockPort {

    private final Clock clock;

    private SystemClockAdapter(Clock clock) {
        this.clock = clock;
    }

    public static SystemClockAdapter system() {
        return new SystemClockAdapter(Clock.systemUTC());
    }

    public static SystemClockAdapter of(Clock clock) {
        return new SystemClockAdapter(clock);
    }

    @Override
    public Instant now() {
        return clock.instant();
    }
}
