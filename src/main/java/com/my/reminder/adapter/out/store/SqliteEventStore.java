package com.my.reminder.adapter.out.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.my.reminder.config.AppConfig;
import com.my.reminder.domain.exception.CorruptRecordException;
import com.my.reminder.domain.exception.StoreUnavailableException;
import com.my.reminder.domain.exception.VersionConflictException;
import com.my.reminder.domain.model.EventRecord;
import com.my.reminder.domain.port.out.EventStorePort;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import javax.sql.DataSource;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 왜: 단일 프로세스에서도 레코드 교체를 트랜잭션 한 번으로 끝내고, 버전 비교를 UPDATE 조건에 넣어 원자적으로 처리하기 위함.
 */
@IfBuildProperty(name = "app.store.backend", stringValue = "sqlite")
@ApplicationScoped
public class SqliteEventStore implements EventStorePort {

    private static final Logger log = Logger.getLogger(SqliteEventStore.class);

    private static final String TABLE_DDL = """
            CREATE TABLE IF NOT EXISTS event_record (
                id TEXT PRIMARY KEY,
                version INTEGER NOT NULL,
                state TEXT NOT NULL,
                owner_context TEXT NOT NULL,
                next_fire_utc INTEGER,
                updated_at INTEGER NOT NULL,
                body TEXT NOT NULL
            )
            """;

    private static final String ENABLE_WAL = "PRAGMA journal_mode=WAL";
    private static final String INSERT_SQL = """
            INSERT OR IGNORE INTO event_record(id, version, state, owner_context, next_fire_utc, updated_at, body)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            """;
    private static final String UPDATE_SQL = """
            UPDATE event_record
               SET version = ?, state = ?, owner_context = ?, next_fire_utc = ?, updated_at = ?, body = ?
             WHERE id = ? AND version = ?
            """;
    private static final String SELECT_BODY_SQL = "SELECT body FROM event_record WHERE id = ?";
    private static final String SELECT_VERSION_SQL = "SELECT version FROM event_record WHERE id = ?";
    private static final String SELECT_IDS_SQL = "SELECT id FROM event_record ORDER BY id";
    private static final String SELECT_ACTIVE_SQL = "SELECT id, body FROM event_record WHERE state = 'ACTIVE' ORDER BY next_fire_utc, id";
    private static final String DELETE_SQL = "DELETE FROM event_record WHERE id = ?";

    private final DataSource dataSource;
    private final Path sqlitePath;
    private final StoreLock storeLock;
    private final EventRecordCodec codec;
    private volatile boolean open;

    @Inject
    public SqliteEventStore(DataSource dataSource, AppConfig appConfig, ObjectMapper objectMapper) {
        this(dataSource, Path.of(appConfig.store().sqlitePath()), objectMapper);
    }

    public SqliteEventStore(DataSource dataSource, Path sqlitePath, ObjectMapper objectMapper) {
        this.dataSource = dataSource;
        this.sqlitePath = sqlitePath;
        this.storeLock = new StoreLock(Path.of(sqlitePath + ".lock"));
        this.codec = new EventRecordCodec(objectMapper);
    }

    @Override
    public synchronized void open() {
        if (open) {
            return;
        }
        storeLock.acquire();
        try {
            Path parent = sqlitePath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            storeLock.release();
            throw new StoreUnavailableException("SQLite 경로 생성 실패: " + sqlitePath, e);
        }
        try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
            stmt.execute(ENABLE_WAL);
            stmt.execute(TABLE_DDL);
        } catch (SQLException e) {
            storeLock.release();
            throw new StoreUnavailableException("일정 테이블 초기화 실패", e);
        }
        open = true;
        log.infof("SQLite 일정 저장소 열림: %s", sqlitePath);
    }

    @Override
    public boolean isOpen() {
        return open && storeLock.isHeld();
    }

    @Override
    public void put(EventRecord record, long expectedVersion) {
        requireOpen();
        String body = codec.encodeToString(record);
        try (Connection conn = dataSource.getConnection()) {
            int changed = expectedVersion == 0
                    ? insert(conn, record, body)
                    : update(conn, record, body, expectedVersion);
            if (changed == 0) {
                throw new VersionConflictException(record.id(), expectedVersion, storedVersion(conn, record.id()));
            }
        } catch (SQLException e) {
            throw new StoreUnavailableException("일정 레코드 기록 실패: " + record.id(), e);
        }
    }

    @Override
    public Optional<EventRecord> get(String id) {
        requireOpen();
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(SELECT_BODY_SQL)) {
            ps.setString(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(codec.decode(id, rs.getString(1)));
            }
        } catch (SQLException e) {
            throw new StoreUnavailableException("일정 레코드 읽기 실패: " + id, e);
        }
    }

    @Override
    public List<String> listIds() {
        requireOpen();
        List<String> ids = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(SELECT_IDS_SQL);
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                ids.add(rs.getString(1));
            }
        } catch (SQLException e) {
            throw new StoreUnavailableException("일정 목록 조회 실패", e);
        }
        return ids;
    }

    @Override
    public List<EventRecord> listActive() {
        requireOpen();
        List<EventRecord> active = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(SELECT_ACTIVE_SQL);
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                String id = rs.getString(1);
                try {
                    active.add(codec.decode(id, rs.getString(2)));
                } catch (CorruptRecordException e) {
                    log.warnf("손상된 레코드를 건너뜁니다: id=%s reason=%s", id, e.getMessage());
                }
            }
        } catch (SQLException e) {
            throw new StoreUnavailableException("활성 일정 조회 실패", e);
        }
        return active;
    }

    @Override
    public void delete(String id) {
        requireOpen();
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(DELETE_SQL)) {
            ps.setString(1, id);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new StoreUnavailableException("일정 레코드 삭제 실패: " + id, e);
        }
    }

    @Override
    public synchronized void close() {
        open = false;
        storeLock.release();
    }

    private int insert(Connection conn, EventRecord record, String body) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(INSERT_SQL)) {
            ps.setString(1, record.id());
            ps.setLong(2, record.version());
            ps.setString(3, record.state().name());
            ps.setString(4, record.ownerContext());
            setNextFire(ps, 5, record);
            ps.setLong(6, record.updatedAt().toEpochMilli());
            ps.setString(7, body);
            return ps.executeUpdate();
        }
    }

    private int update(Connection conn, EventRecord record, String body, long expectedVersion) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(UPDATE_SQL)) {
            ps.setLong(1, record.version());
            ps.setString(2, record.state().name());
            ps.setString(3, record.ownerContext());
            setNextFire(ps, 4, record);
            ps.setLong(5, record.updatedAt().toEpochMilli());
            ps.setString(6, body);
            ps.setString(7, record.id());
            ps.setLong(8, expectedVersion);
            return ps.executeUpdate();
        }
    }

    private static void setNextFire(PreparedStatement ps, int index, EventRecord record) throws SQLException {
        if (record.nextFireUtc() == null) {
            ps.setNull(index, java.sql.Types.INTEGER);
        } else {
            ps.setLong(index, record.nextFireUtc().toEpochMilli());
        }
    }

    private static long storedVersion(Connection conn, String id) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SELECT_VERSION_SQL)) {
            ps.setString(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0L;
            }
        }
    }

    private void requireOpen() {
        if (!open) {
            throw new StoreUnavailableException("일정 저장소가 열려 있지 않습니다.");
        }
    }
}
