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

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * 왜: 외부 DB 없이도 레코드 하나를 파일 하나로 두고 임시 파일 + 원자적 rename으로 교체해, 쓰기 도중 죽어도
 * 이전 버전이나 새 버전 중 하나만 남게 하기 위함.
 * <p>
 * 같은 레코드에 대한 쓰기는 id별 잠금 줄(stripe)로 직렬화하고, 저장된 버전과 기대 버전을 비교한 뒤에만 교체한다.
 */
@IfBuildProperty(name = "app.store.backend", stringValue = "file", enableIfMissing = true)
@ApplicationScoped
public class FileEventStore implements EventStorePort {

    private static final Logger log = Logger.getLogger(FileEventStore.class);

    private static final String SUFFIX = ".json";
    private static final String TMP_SUFFIX = ".tmp";
    private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9_-]+");
    private static final int STRIPES = 64;

    private final Path recordsDir;
    private final StoreLock storeLock;
    private final EventRecordCodec codec;
    private final Object[] stripes = new Object[STRIPES];
    private volatile boolean open;

    @Inject
    public FileEventStore(AppConfig appConfig, ObjectMapper objectMapper) {
        this(Path.of(appConfig.store().dir()), objectMapper);
    }

    public FileEventStore(Path dir, ObjectMapper objectMapper) {
        this.recordsDir = dir.resolve("records");
        this.storeLock = new StoreLock(dir.resolve("store.lock"));
        this.codec = new EventRecordCodec(objectMapper);
        for (int i = 0; i < STRIPES; i++) {
            stripes[i] = new Object();
        }
    }

    @Override
    public synchronized void open() {
        if (open) {
            return;
        }
        storeLock.acquire();
        try {
            Files.createDirectories(recordsDir);
            removeStrayTempFiles();
        } catch (IOException e) {
            storeLock.release();
            throw new StoreUnavailableException("일정 저장 디렉터리 초기화 실패: " + recordsDir, e);
        }
        open = true;
        log.infof("파일 일정 저장소 열림: %s", recordsDir);
    }

    @Override
    public boolean isOpen() {
        return open && storeLock.isHeld();
    }

    @Override
    public void put(EventRecord record, long expectedVersion) {
        requireOpen();
        Path target = pathOf(record.id());
        synchronized (stripeOf(record.id())) {
            long actual = storedVersion(record.id(), target);
            if (actual != expectedVersion) {
                throw new VersionConflictException(record.id(), expectedVersion, actual);
            }
            writeAtomically(record.id(), target, codec.encode(record));
        }
    }

    @Override
    public Optional<EventRecord> get(String id) {
        requireOpen();
        return read(id, pathOf(id));
    }

    @Override
    public List<String> listIds() {
        requireOpen();
        List<String> ids = new ArrayList<>();
        try (DirectoryStream<Path> files = Files.newDirectoryStream(recordsDir, "*" + SUFFIX)) {
            for (Path file : files) {
                String name = file.getFileName().toString();
                ids.add(name.substring(0, name.length() - SUFFIX.length()));
            }
        } catch (IOException e) {
            throw new StoreUnavailableException("일정 목록 조회 실패: " + recordsDir, e);
        }
        ids.sort(String::compareTo);
        return ids;
    }

    @Override
    public List<EventRecord> listActive() {
        List<EventRecord> active = new ArrayList<>();
        for (String id : listIds()) {
            try {
                get(id).filter(EventRecord::isActive).ifPresent(active::add);
            } catch (CorruptRecordException e) {
                log.warnf("손상된 레코드를 건너뜁니다: id=%s reason=%s", id, e.getMessage());
            }
        }
        return active;
    }

    @Override
    public void delete(String id) {
        requireOpen();
        synchronized (stripeOf(id)) {
            try {
                Files.deleteIfExists(pathOf(id));
            } catch (IOException e) {
                throw new StoreUnavailableException("일정 레코드 삭제 실패: " + id, e);
            }
        }
    }

    @Override
    public synchronized void close() {
        open = false;
        storeLock.release();
    }

    private Optional<EventRecord> read(String id, Path file) {
        byte[] body;
        try {
            body = Files.readAllBytes(file);
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new StoreUnavailableException("일정 레코드 읽기 실패: " + id, e);
        }
        return Optional.of(codec.decode(id, body));
    }

    private long storedVersion(String id, Path target) {
        return read(id, target).map(EventRecord::version).orElse(0L);
    }

    private void writeAtomically(String id, Path target, byte[] body) {
        Path tmp = recordsDir.resolve(id + SUFFIX + "." + UUID.randomUUID() + TMP_SUFFIX);
        boolean moved = false;
        try {
            try (FileChannel channel = FileChannel.open(tmp, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
                ByteBuffer buffer = ByteBuffer.wrap(body);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
            Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            moved = true;
        } catch (IOException e) {
            throw new StoreUnavailableException("일정 레코드 기록 실패: " + id, e);
        } finally {
            if (!moved) {
                deleteQuietly(tmp);
            }
        }
    }

    private void removeStrayTempFiles() throws IOException {
        try (DirectoryStream<Path> files = Files.newDirectoryStream(recordsDir, "*" + TMP_SUFFIX)) {
            for (Path file : files) {
                Files.deleteIfExists(file);
                log.infof("중단된 쓰기의 임시 파일을 지웠습니다: %s", file.getFileName());
            }
        }
    }

    private Path pathOf(String id) {
        if (id == null || !SAFE_ID.matcher(id).matches()) {
            throw new IllegalArgumentException("허용되지 않는 일정 id입니다: " + id);
        }
        return recordsDir.resolve(id + SUFFIX);
    }

    private Object stripeOf(String id) {
        return stripes[Math.floorMod(id.hashCode(), STRIPES)];
    }

    private void requireOpen() {
        if (!open) {
            throw new StoreUnavailableException("일정 저장소가 열려 있지 않습니다.");
        }
    }

    private static void deleteQuietly(Path tmp) {
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.warnf("임시 파일 삭제 실패: %s (%s)", tmp, e.getMessage());
        }
    }
}
