package com.my.reminder.adapter.out.health;

import com.my.reminder.config.AppConfig;
import com.my.reminder.domain.model.SchedulerState;
import com.my.reminder.domain.port.out.EventStorePort;
import com.my.reminder.domain.service.FireQueue;
import com.my.reminder.domain.service.SchedulerLoop;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

@Readiness
@ApplicationScoped
public class SchedulerReadinessCheck implements HealthCheck {

    private final EventStorePort store;
    private final SchedulerLoop schedulerLoop;
    private final FireQueue fireQueue;
    private final AppConfig appConfig;

    public SchedulerReadinessCheck(EventStorePort store, SchedulerLoop schedulerLoop, FireQueue fireQueue, AppConfig appConfig) {
        this.store = store;
        this.schedulerLoop = schedulerLoop;
        this.fireQueue = fireQueue;
        this.appConfig = appConfig;
    }

    @Override
    public HealthCheckResponse call() {
        boolean storeOk = store.isOpen();
        boolean schedulerEnabled = appConfig.scheduler().enabled();
        SchedulerState state = schedulerLoop.state();
        boolean schedulerOk = !schedulerEnabled || schedulerLoop.isRunning();
        return HealthCheckResponse.named("scheduler-readiness")
                .withData("storeLockHeld", storeOk)
                .withData("schedulerEnabled", schedulerEnabled)
                .withData("schedulerState", state.name())
                .withData("queueSize", fireQueue.size())
                .withData("nextDeadline", fireQueue.nextDeadline().map(Object::toString).orElse("none"))
                .status(storeOk && schedulerOk)
                .build();
    }
}
