package com.my.reminder.adapter.out.health;

import com.my.reminder.domain.model.SchedulerState;
import com.my.reminder.domain.port.out.EventStorePort;
import com.my.reminder.domain.service.FireQueue;
import com.my.reminder.domain.service.SchedulerLoop;
import com.my.reminder.support.TestAppConfig;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SchedulerReadinessCheckTest {

    private final EventStorePort store = mock(EventStorePort.class);
    private final SchedulerLoop schedulerLoop = mock(SchedulerLoop.class);
    private final TestAppConfig config = new TestAppConfig();

    @Test
    void upWhenLockHeldAndLoopRunning() {
        when(store.isOpen()).thenReturn(true);
        when(schedulerLoop.isRunning()).thenReturn(true);
        when(schedulerLoop.state()).thenReturn(SchedulerState.WAITING);

        HealthCheckResponse response = check().call();

        assertThat(response.getStatus()).isEqualTo(HealthCheckResponse.Status.UP);
        assertThat(response.getData()).hasValueSatisfying(data -> {
            assertThat(data).containsEntry("schedulerState", "WAITING");
            assertThat(data).containsEntry("nextDeadline", "none");
        });
    }

    @Test
    void downWhenEnabledLoopIsNotRunning() {
        when(store.isOpen()).thenReturn(true);
        when(schedulerLoop.state()).thenReturn(SchedulerState.STOPPED);

        assertThat(check().call().getStatus()).isEqualTo(HealthCheckResponse.Status.DOWN);
    }

    @Test
    void disabledSchedulerOnlyNeedsStoreLock() {
        config.schedulerEnabled = false;
        when(store.isOpen()).thenReturn(true);
        when(schedulerLoop.state()).thenReturn(SchedulerState.IDLE);

        assertThat(check().call().getStatus()).isEqualTo(HealthCheckResponse.Status.UP);
    }

    private SchedulerReadinessCheck check() {
        return new SchedulerReadinessCheck(store, schedulerLoop, new FireQueue(), config);
    }
}
