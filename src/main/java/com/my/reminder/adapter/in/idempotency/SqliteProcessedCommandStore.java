package com.my.reminder.adapter.in.idempotency;

import com.my.reminder.config.AppConfig;
import com.my.reminder.domain.port.out.ClockPort;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;

import javax.sql.DataSource;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * 왜: 재시작 후에도 재전달된 명령을 알아보도록 처리 기록을 일정 저장소와 같은 SQLite 파일에 남긴다.
 */
@IfBuildProperty(name = "app.idempotency.backend", stringValue = "sqlite", enableIfMissing = true)
@ApplicationScoped
public class SqliteProcessedCommandStore implements ProcessedCommandStore {

    private static final String TABLE_DDL = """
            CREATE TABLE IF NOT EXISTS processed_command (
                command_id TEXT PRIMARY KEY,
                processed_at INTEGER NOT NULL,
                reply TEXT NOT NULL
            )
            """;

    private static final String INSERT_SQL = "INSERT OR REPLACE INTO processed_command(command_id, processed_at, reply) VALUES (?, ?, ?)";
    private static final String SELECT_SQL = "SELECT reply FROM processed_command WHERE command_id = ? AND processed_at >= ?";
    private static final String CLEANUP_SQL = "DELETE FROM processed_command WHERE processed_at < ?";
    private static final String ENABLE_WAL = "PRAGMA journal_mode=WAL";

    private final DataSource dataSource;
    private final Duration ttl;
    private final Path sqlitePath;
    private final ClockPort clockPort;

    public SqliteProcessedCommandStore(DataSource dataSource, AppConfig appConfig, ClockPort clockPort) {
        this.dataSource = dataSource;
        this.ttl = Duration.ofHours(appConfig.idempotency().ttlHours());
        this.sqlitePath = Path.of(appConfig.store().sqlitePath());
        this.clockPort = clockPort;
    }

    @PostConstruct
    void init() {
        try {
            Path parent = sqlitePath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (Exception e) {
            throw new IllegalStateException("SQLite 경로 생성 실패", e);
        }
        try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
            stmt.execute(ENABLE_WAL);
            stmt.execute(TABLE_DDL);
        } catch (SQLException e) {
            throw new IllegalStateException("명령 처리 기록 테이블 초기화 실패", e);
        }
    }

    @Override
    public Optional<String> findReply(String commandId) {
        cleanup();
        Instant cutoff = clockPort.now().minus(ttl);
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(SELECT_SQL)) {
            ps.setString(1, commandId);
            ps.setLong(2, cutoff.toEpochMilli());
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(rs.getString(1)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new IllegalStateException("명령 처리 기록 조회 실패", e);
        }
    }

    @Override
    public void remember(String commandId, String replyBody) {
        cleanup();
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(INSERT_SQL)) {
            ps.setString(1, commandId);
            ps.setLong(2, clockPort.now().toEpochMilli());
            ps.setString(3, replyBody);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new IllegalStateException("명령 처리 기록 저장 실패", e);
        }
    }

    private void cleanup() {
        Instant cutoff = clockPort.now().minus(ttl);
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(CLEANUP_SQL)) {
            ps.setLong(1, cutoff.toEpochMilli());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new IllegalStateException("명령 처리 기록 정리 실패", e);
        }
    }
}
