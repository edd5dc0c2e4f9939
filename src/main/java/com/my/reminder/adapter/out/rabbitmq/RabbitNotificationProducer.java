package com.my.reminder.adapter.out.rabbitmq;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.my.reminder.config.AppConfig;
import com.my.reminder.domain.exception.DeliveryException;
import com.my.reminder.domain.port.out.NotificationPort;
import io.quarkus.arc.properties.IfBuildProperty;
import io.smallrye.faulttolerance.api.ExponentialBackoff;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.faulttolerance.Retry;
import org.eclipse.microprofile.faulttolerance.Timeout;
import org.eclipse.microprofile.reactive.messaging.Channel;
import org.eclipse.microprofile.reactive.messaging.Emitter;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 왜: 알림을 직접 보내지 않고 큐로 넘겨 별도 전송 워커(예: 텔레그램 릴레이)가 처리하게 하기 위함.
 * 브로커 확인(ack)을 받아야 전송 성공으로 본다. 재시도 한도는 텔레그램 전송과 같은 Fault Tolerance 설정 키를 따른다.
 */
@IfBuildProperty(name = "app.delivery.channel", stringValue = "rabbitmq")
@ApplicationScoped
public class RabbitNotificationProducer implements NotificationPort {

    private final Emitter<String> notificationEmitter;
    private final ObjectMapper objectMapper;
    private final Duration ackTimeout;

    @Inject
    public RabbitNotificationProducer(@Channel("reminder-notifications") Emitter<String> notificationEmitter,
                                      ObjectMapper objectMapper,
                                      AppConfig appConfig) {
        this(notificationEmitter, objectMapper, appConfig.delivery().timeout());
    }

    RabbitNotificationProducer(Emitter<String> notificationEmitter, ObjectMapper objectMapper, Duration ackTimeout) {
        this.notificationEmitter = notificationEmitter;
        this.objectMapper = objectMapper;
        this.ackTimeout = ackTimeout;
    }

    @Override
    @Timeout(15_000)
    @Retry(maxRetries = 2, delay = 1_000, jitter = 0, retryOn = {DeliveryException.class,
            org.eclipse.microprofile.faulttolerance.exceptions.TimeoutException.class})
    @ExponentialBackoff(factor = 2, maxDelay = 30_000, maxDelayUnit = ChronoUnit.MILLIS)
    public void deliver(String ownerContext, String payload) {
        String body;
        try {
            body = objectMapper.writeValueAsString(new NotificationPayload(ownerContext, payload));
        } catch (JsonProcessingException e) {
            throw new DeliveryException("알림 직렬화 실패", e);
        }
        try {
            notificationEmitter.send(body).toCompletableFuture().get(ackTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new DeliveryException("브로커 확인 대기 시간 초과: " + ackTimeout, e);
        } catch (ExecutionException e) {
            throw new DeliveryException("브로커가 알림을 거부했습니다: " + e.getCause().getMessage(), e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DeliveryException("브로커 확인 대기 중 인터럽트", e);
        }
    }

    private record NotificationPayload(String ownerContext, String content) {
    }
}
