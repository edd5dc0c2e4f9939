package com.my.reminder.config;

import com.my.reminder.domain.model.RecoveryReport;
import com.my.reminder.domain.port.out.EventStorePort;
import com.my.reminder.domain.service.RecoveryManager;
import com.my.reminder.domain.service.SchedulerLoop;
import io.quarkus.runtime.Quarkus;
import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import org.jboss.logging.Logger;

/**
 * 왜: 잠금 획득, 복구, 스케줄러 시작을 항상 이 순서로 수행하고, 종료 시에는 발송을 멈춘 뒤에만 잠금을 놓기 위함.
 */
@ApplicationScoped
public class ReminderEngineLifecycle {

    private static final Logger log = Logger.getLogger(ReminderEngineLifecycle.class);

    private final EventStorePort store;
    private final RecoveryManager recoveryManager;
    private final SchedulerLoop schedulerLoop;
    private final AppConfig appConfig;
    private volatile boolean started;

    public ReminderEngineLifecycle(EventStorePort store,
                                   RecoveryManager recoveryManager,
                                   SchedulerLoop schedulerLoop,
                                   AppConfig appConfig) {
        this.store = store;
        this.recoveryManager = recoveryManager;
        this.schedulerLoop = schedulerLoop;
        this.appConfig = appConfig;
    }

    void onStart(@Observes StartupEvent event) {
        start();
    }

    void onShutdown(@Observes ShutdownEvent event) {
        stop();
    }

    /**
     * @throws com.my.reminder.domain.exception.AlreadyRunningException 다른 인스턴스가 같은 저장소를 쓰고 있을 때
     */
    public void start() {
        store.open();
        RecoveryReport report = recoveryManager.recover();
        log.infof("알림 엔진 복구 결과: 총 %d건", report.total());
        if (!appConfig.scheduler().enabled()) {
            log.warn("스케줄러가 비활성화되어 있어 발송 루프를 시작하지 않습니다.");
            return;
        }
        schedulerLoop.onFatal(error -> {
            log.error("저장소 장애로 프로세스를 종료합니다.");
            Quarkus.asyncExit(1);
        });
        schedulerLoop.start();
        started = true;
    }

    public void stop() {
        if (started) {
            boolean clean = schedulerLoop.drain(appConfig.scheduler().drainTimeout());
            if (!clean) {
                log.warn("진행 중인 발송을 기다리지 못하고 종료합니다. 다음 기동 시 복구됩니다.");
            }
            started = false;
        }
        store.close();
    }
}
