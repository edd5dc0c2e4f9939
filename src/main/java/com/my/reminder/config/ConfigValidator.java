package com.my.reminder.config;

import com.my.reminder.domain.exception.InvalidTimezoneException;
import com.my.reminder.domain.service.TimeResolver;
import io.quarkus.runtime.Startup;
import io.quarkus.runtime.configuration.ProfileManager;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.Set;

@Startup
@ApplicationScoped
public class ConfigValidator {

    private static final Logger log = Logger.getLogger(ConfigValidator.class);

    private static final Set<String> STORE_BACKENDS = Set.of("file", "sqlite", "memory");
    private static final Set<String> DELIVERY_CHANNELS = Set.of("telegram", "rabbitmq");

    private final AppConfig appConfig;

    public ConfigValidator(AppConfig appConfig) {
        this.appConfig = appConfig;
    }

    @PostConstruct
    void validate() {
        validate("prod".equals(ProfileManager.getActiveProfile()));
    }

    void validate(boolean strict) {
        validateOneOf("APP_STORE_BACKEND", appConfig.store().backend(), STORE_BACKENDS, strict);
        validateOneOf("APP_DELIVERY_CHANNEL", appConfig.delivery().channel(), DELIVERY_CHANNELS, strict);
        if ("telegram".equals(appConfig.delivery().channel())) {
            validateRequired("APP_TELEGRAM_BOT_TOKEN", appConfig.telegram().botToken().orElse(null), strict);
        }
        validatePositive("APP_SCHEDULER_GRACE_WINDOW", appConfig.scheduler().graceWindow(), strict);
        validatePositive("APP_SCHEDULER_DRAIN_TIMEOUT", appConfig.scheduler().drainTimeout(), strict);
        validatePositive("APP_DELIVERY_TIMEOUT", appConfig.delivery().timeout(), strict);
        validatePositive("APP_STORE_RETENTION", appConfig.store().retention(), strict);
        try {
            new TimeResolver(appConfig.time().defaultTimezone());
        } catch (InvalidTimezoneException e) {
            // 기본 시간대가 틀리면 모든 생성 명령이 실패하므로 개발 모드에서도 멈춘다.
            throw new IllegalStateException("기본 시간대를 알 수 없습니다: APP_TIME_DEFAULT_TIMEZONE=" + e.timezone(), e);
        }
        if (!appConfig.scheduler().enabled()) {
            log.warn("스케줄러가 비활성화되어 알림이 발송되지 않습니다: APP_SCHEDULER_ENABLED=false");
        }
    }

    private void validateRequired(String name, String value, boolean strict) {
        if (value == null || value.isBlank()) {
            fail("필수 설정이 비어 있습니다: " + name, strict);
        }
    }

    private void validateOneOf(String name, String value, Set<String> allowed, boolean strict) {
        if (!allowed.contains(value)) {
            fail("지원하지 않는 설정값입니다: " + name + "=" + value + " (허용: " + allowed + ")", strict);
        }
    }

    private void validatePositive(String name, Duration value, boolean strict) {
        if (value == null || value.isZero() || value.isNegative()) {
            fail("0보다 큰 기간이어야 합니다: " + name + "=" + value, strict);
        }
    }

    private void fail(String message, boolean strict) {
        if (strict) {
            throw new IllegalStateException(message);
        }
        log.warn(message);
    }
}
