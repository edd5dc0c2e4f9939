package com.my.reminder.config;

import io.quarkus.runtime.annotations.StaticInitSafe;
import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.time.Duration;
import java.util.Optional;

@StaticInitSafe
@ConfigMapping(prefix = "app")
public interface AppConfig {

    StoreConfig store();

    SchedulerConfig scheduler();

    DeliveryConfig delivery();

    TimeConfig time();

    TelegramConfig telegram();

    IdempotencyConfig idempotency();

    interface StoreConfig {
        @WithName("backend")
        @WithDefault("file")
        String backend();

        @WithName("dir")
        @WithDefault("./data/events")
        String dir();

        @WithName("sqlite-path")
        @WithDefault("./data/reminder.db")
        String sqlitePath();

        @WithName("retention")
        @WithDefault("P7D")
        Duration retention();

        @WithName("retention-sweep-interval")
        @WithDefault("1h")
        String retentionSweepInterval();
    }

    interface SchedulerConfig {
        @WithName("enabled")
        @WithDefault("true")
        boolean enabled();

        @WithName("grace-window")
        @WithDefault("PT5M")
        Duration graceWindow();

        @WithName("drain-timeout")
        @WithDefault("PT30S")
        Duration drainTimeout();

        /**
         * 일정 시각보다 이만큼 먼저 알림을 보낸다.
         */
        @WithName("alert-lead")
        @WithDefault("PT0S")
        Duration alertLead();
    }

    interface DeliveryConfig {
        @WithName("channel")
        @WithDefault("telegram")
        String channel();

        @WithName("timeout")
        @WithDefault("PT10S")
        Duration timeout();
    }

    interface TimeConfig {
        @WithName("default-timezone")
        @WithDefault("America/Los_Angeles")
        String defaultTimezone();
    }

    interface TelegramConfig {
        @WithName("bot-token")
        Optional<String> botToken();

        @WithName("api-base")
        @WithDefault("https://api.telegram.org")
        String apiBase();
    }

    interface IdempotencyConfig {
        @WithName("backend")
        @WithDefault("sqlite")
        String backend();

        @WithName("ttl-hours")
        @WithDefault("24")
        int ttlHours();
    }
}
