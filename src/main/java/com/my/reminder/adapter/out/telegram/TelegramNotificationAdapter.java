package com.my.reminder.adapter.out.telegram;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
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
import org.eclipse.microprofile.faulttolerance.exceptions.TimeoutException;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.temporal.ChronoUnit;

/**
 * 왜: 텔레그램 HTTP API 호출을 캡슐화하고 실패를 {@link DeliveryException}으로 올려 재시도 정책이 판단하게 하기 위함.
 * <p>
 * 시도별 제한 시간과 재시도 한도는 MicroProfile Fault Tolerance 설정 키({@code Timeout/value}, {@code Retry/maxRetries},
 * {@code Retry/delay}, {@code ExponentialBackoff/maxDelay})로 덮어쓴다.
 */
@IfBuildProperty(name = "app.delivery.channel", stringValue = "telegram", enableIfMissing = true)
@ApplicationScoped
public class TelegramNotificationAdapter implements NotificationPort {

    private static final Logger log = Logger.getLogger(TelegramNotificationAdapter.class);

    static final String OWNER_PREFIX = "telegram:";

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String apiBase;
    private final Duration requestTimeout;

    @Inject
    public TelegramNotificationAdapter(AppConfig appConfig, ObjectMapper objectMapper) {
        this(HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build(),
                objectMapper,
                appConfig.telegram().botToken()
                        .filter(token -> !token.isBlank())
                        .map(token -> appConfig.telegram().apiBase() + "/bot" + token)
                        .orElse(""),
                appConfig.delivery().timeout());
    }

    TelegramNotificationAdapter(HttpClient httpClient, ObjectMapper objectMapper, String apiBase, Duration requestTimeout) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.apiBase = apiBase;
        this.requestTimeout = requestTimeout;
    }

    @Override
    @Timeout(15_000)
    @Retry(maxRetries = 2, delay = 1_000, jitter = 0, retryOn = {DeliveryException.class, TimeoutException.class})
    @ExponentialBackoff(factor = 2, maxDelay = 30_000, maxDelayUnit = ChronoUnit.MILLIS)
    public void deliver(String ownerContext, String payload) {
        if (apiBase.isBlank()) {
            throw new DeliveryException("텔레그램 봇 토큰이 설정되지 않았습니다.");
        }
        long chatId = chatIdOf(ownerContext);
        HttpResponse<String> response;
        try {
            String body = objectMapper.writeValueAsString(new SendMessageRequest(chatId, payload));
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(apiBase + "/sendMessage"))
                    .header("Content-Type", "application/json")
                    .timeout(requestTimeout)
                    .POST(HttpRequest.BodyPublishers.ofString(body))
                    .build();
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (JsonProcessingException e) {
            throw new DeliveryException("텔레그램 요청 직렬화 실패", e);
        } catch (IOException e) {
            throw new DeliveryException("텔레그램 전송 중 입출력 오류: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DeliveryException("텔레그램 전송 중 인터럽트", e);
        }
        if (response.statusCode() >= 400) {
            throw new DeliveryException("텔레그램 전송 실패 status=" + response.statusCode() + " body=" + response.body());
        }
        log.debugf("텔레그램 전송 완료: chatId=%d", chatId);
    }

    /**
     * {@code telegram:<chatId>} 또는 숫자 chat id를 받는다.
     */
    static long chatIdOf(String ownerContext) {
        String raw = ownerContext.startsWith(OWNER_PREFIX)
                ? ownerContext.substring(OWNER_PREFIX.length())
                : ownerContext;
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new DeliveryException("텔레그램 chat id를 알 수 없습니다: " + ownerContext, e);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record SendMessageRequest(@JsonProperty("chat_id") long chatId,
                                      @JsonProperty("text") String text) {
    }
}
