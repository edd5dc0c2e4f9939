package com.my.reminder.domain.service;

import com.my.reminder.domain.exception.CorruptRecordException;
import com.my.reminder.domain.exception.StoreUnavailableException;
import com.my.reminder.domain.exception.ValidationException;
import com.my.reminder.domain.model.EventRecord;
import com.my.reminder.domain.model.RecoveryReport;
import com.my.reminder.domain.port.out.ClockPort;
import com.my.reminder.domain.port.out.EventStorePort;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * 왜: 기동 시 저장소의 일정을 다시 읽어 놓친 발송을 유예 정책에 따라 보충하거나 건너뛰고, 발송 큐를 재구성하기 위함.
 * <p>
 * 유예 시간 안에 지난 일정은 즉시 발송 대상으로 두고, 그보다 오래 지난 일정은 발송 없이 다음 미래 회차로 넘긴다.
 * 손상된 레코드 하나가 전체 복구를 막지 않도록 로그만 남기고 건너뛴다.
 */
public class RecoveryManager {

    private static final Logger log = Logger.getLogger(RecoveryManager.class);

    private final EventStorePort store;
    private final EventRegistry registry;
    private final ClockPort clockPort;
    private final Duration graceWindow;

    public RecoveryManager(EventStorePort store, EventRegistry registry, ClockPort clockPort, Duration graceWindow) {
        this.store = store;
        this.registry = registry;
        this.clockPort = clockPort;
        this.graceWindow = graceWindow;
    }

    /**
     * @throws StoreUnavailableException 저장소가 열려 있지 않을 때
     */
    public RecoveryReport recover() {
        if (!store.isOpen()) {
            throw new StoreUnavailableException("저장소 잠금을 얻기 전에는 복구할 수 없습니다.");
        }
        Instant now = clockPort.now();
        int scheduled = 0;
        int caughtUp = 0;
        int skipped = 0;
        int corrupt = 0;

        for (String id : store.listIds()) {
            Optional<EventRecord> loaded;
            try {
                loaded = store.get(id);
            } catch (CorruptRecordException e) {
                log.warnf("손상된 레코드를 건너뜁니다: id=%s reason=%s", id, e.getMessage());
                corrupt++;
                continue;
            }
            if (loaded.isEmpty()) {
                continue;
            }
            EventRecord record = loaded.get();
            try {
                registry.restore(record);
            } catch (ValidationException e) {
                log.warnf("일정 규칙을 해석할 수 없는 레코드를 건너뜁니다: id=%s reason=%s", id, e.getMessage());
                corrupt++;
                continue;
            }
            if (!record.isActive()) {
                continue;
            }

            Duration overdue = Duration.between(record.nextFireUtc(), now);
            if (overdue.isNegative() || overdue.isZero()) {
                scheduled++;
            } else if (overdue.compareTo(graceWindow) <= 0) {
                log.infof("유예 시간 안에 놓친 일정을 즉시 발송합니다: id=%s overdue=%s", id, overdue);
                caughtUp++;
            } else {
                EventRecord advanced = registry.skipMissed(id);
                log.infof("오래 놓친 일정을 발송 없이 넘깁니다: id=%s overdue=%s state=%s next=%s",
                        id, overdue, advanced.state(), advanced.nextFireUtc());
                skipped++;
            }
        }

        RecoveryReport report = new RecoveryReport(scheduled, caughtUp, skipped, corrupt);
        log.infof("복구 완료: 예약 %d건, 즉시 발송 %d건, 건너뜀 %d건, 손상 %d건",
                report.scheduled(), report.caughtUp(), report.skipped(), report.corrupt());
        return report;
    }
}
