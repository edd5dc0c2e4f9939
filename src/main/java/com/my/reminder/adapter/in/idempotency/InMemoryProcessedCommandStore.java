package com.my.reminder.adapter.in.idempotency;

import com.my.reminder.config.AppConfig;
import com.my.reminder.domain.port.out.ClockPort;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.enterprise.context.ApplicationScoped;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@IfBuildProperty(name = "app.idempotency.backend", stringValue = "memory")
@ApplicationScoped
public class InMemoryProcessedCommandStore implements ProcessedCommandStore {

    private final Duration ttl;
    private final ClockPort clockPort;
    private final Map<String, Entry> processed = new ConcurrentHashMap<>();

    public InMemoryProcessedCommandStore(AppConfig appConfig, ClockPort clockPort) {
        this.ttl = Duration.ofHours(appConfig.idempotency().ttlHours());
        this.clockPort = clockPort;
    }

    @Override
    public Optional<String> findReply(String commandId) {
        cleanup();
        return Optional.ofNullable(processed.get(commandId)).map(Entry::replyBody);
    }

    @Override
    public void remember(String commandId, String replyBody) {
        cleanup();
        processed.put(commandId, new Entry(replyBody, clockPort.now()));
    }

    private void cleanup() {
        Instant cutoff = clockPort.now().minus(ttl);
        processed.entrySet().removeIf(entry -> entry.getValue().processedAt().isBefore(cutoff));
    }

    private record Entry(String replyBody, Instant processedAt) {
    }
}
