package com.my.reminder.config;

import com.my.reminder.adapter.out.clock.SystemClockAdapter;
import com.my.reminder.domain.port.out.ClockPort;
import com.my.reminder.domain.port.out.EventStorePort;
import com.my.reminder.domain.port.out.NotificationPort;
import com.my.reminder.domain.service.EventRegistry;
import com.my.reminder.domain.service.FireQueue;
import com.my.reminder.domain.service.NotificationDispatcher;
import com.my.reminder.domain.service.RecoveryManager;
import com.my.reminder.domain.service.SchedulerLoop;
import com.my.reminder.domain.service.TimeResolver;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteDataSource;

import javax.sql.DataSource;
import java.nio.file.Path;

/**
 * 왜: 도메인 서비스와 포트 구현을 명시적으로 연결하여 헥사고날 구조를 보장하기 위함.
 * <p>
 * {@link EventRegistry}는 명령 유스케이스({@code ManageEventsUseCase})로도 주입된다.
 */
@ApplicationScoped
public class DomainConfig {

    private static final int SQLITE_BUSY_TIMEOUT_MILLIS = 5_000;

    @Produces
    @ApplicationScoped
    public ClockPort clockPort() {
        return SystemClockAdapter.system();
    }

    @Produces
    @ApplicationScoped
    public TimeResolver timeResolver(AppConfig appConfig) {
        return new TimeResolver(appConfig.time().defaultTimezone());
    }

    @Produces
    @ApplicationScoped
    public FireQueue fireQueue() {
        return new FireQueue();
    }

    @Produces
    @ApplicationScoped
    public EventRegistry eventRegistry(EventStorePort store,
                                       FireQueue fireQueue,
                                       TimeResolver timeResolver,
                                       ClockPort clockPort,
                                       AppConfig appConfig) {
        return new EventRegistry(store, fireQueue, timeResolver, clockPort, appConfig.scheduler().alertLead());
    }

    @Produces
    @ApplicationScoped
    public NotificationDispatcher notificationDispatcher(NotificationPort notificationPort) {
        return new NotificationDispatcher(notificationPort);
    }

    @Produces
    @ApplicationScoped
    public SchedulerLoop schedulerLoop(EventRegistry eventRegistry,
                                       FireQueue fireQueue,
                                       NotificationDispatcher notificationDispatcher,
                                       ClockPort clockPort,
                                       AppConfig appConfig) {
        return new SchedulerLoop(eventRegistry, fireQueue, notificationDispatcher, clockPort,
                appConfig.scheduler().graceWindow());
    }

    @Produces
    @ApplicationScoped
    public RecoveryManager recoveryManager(EventStorePort store,
                                           EventRegistry eventRegistry,
                                           ClockPort clockPort,
                                           AppConfig appConfig) {
        return new RecoveryManager(store, eventRegistry, clockPort, appConfig.scheduler().graceWindow());
    }

    @Produces
    @ApplicationScoped
    public DataSource dataSource(AppConfig appConfig) {
        SQLiteConfig config = new SQLiteConfig();
        config.setBusyTimeout(SQLITE_BUSY_TIMEOUT_MILLIS);
        SQLiteDataSource dataSource = new SQLiteDataSource(config);
        dataSource.setUrl("jdbc:sqlite:" + Path.of(appConfig.store().sqlitePath()).toAbsolutePath());
        return dataSource;
    }
}
