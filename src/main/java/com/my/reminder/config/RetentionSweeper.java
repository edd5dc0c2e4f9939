package com.my.reminder.config;

import com.my.reminder.domain.exception.StoreUnavailableException;
import com.my.reminder.domain.port.out.ClockPort;
import com.my.reminder.domain.port.out.EventStorePort;
import com.my.reminder.domain.service.EventRegistry;
import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.time.Duration;

/**
 * 왜: 취소/완료된 일정을 바로 지우지 않고 보존 기간이 지난 뒤에만 정리해, 저장소가 끝없이 커지지 않게 하기 위함.
 */
@ApplicationScoped
public class RetentionSweeper {

    private static final Logger log = Logger.getLogger(RetentionSweeper.class);

    private final EventRegistry eventRegistry;
    private final EventStorePort store;
    private final ClockPort clockPort;
    private final Duration retention;

    public RetentionSweeper(EventRegistry eventRegistry, EventStorePort store, ClockPort clockPort, AppConfig appConfig) {
        this.eventRegistry = eventRegistry;
        this.store = store;
        this.clockPort = clockPort;
        this.retention = appConfig.store().retention();
    }

    @Scheduled(every = "${app.store.retention-sweep-interval:1h}", delayed = "1m", identity = "retention-sweeper")
    void sweep() {
        if (!store.isOpen()) {
            return;
        }
        try {
            eventRegistry.purgeTerminal(clockPort.now().minus(retention));
        } catch (StoreUnavailableException e) {
            log.errorf(e, "보존 기간 정리 실패");
        }
    }
}
