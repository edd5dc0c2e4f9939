package com.my.reminder.adapter.out.store;

import com.my.reminder.domain.exception.AlreadyRunningException;
import com.my.reminder.domain.exception.StoreUnavailableException;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * 왜: 같은 저장소를 두 프로세스가 동시에 쓰지 못하도록 OS 수준의 배타 잠금을 잡아 스케줄링 권한을 하나로 제한하기 위함.
 */
public final class StoreLock implements AutoCloseable {

    private static final Logger log = Logger.getLogger(StoreLock.class);

    private final Path lockPath;
    private FileChannel channel;
    private FileLock lock;

    public StoreLock(Path lockPath) {
        this.lockPath = lockPath;
    }

    /**
     * @throws AlreadyRunningException 다른 인스턴스가 잠금을 쥐고 있을 때
     * @throws StoreUnavailableException 잠금 파일을 열 수 없을 때
     */
    public synchronized void acquire() {
        if (lock != null) {
            return;
        }
        FileChannel opened = null;
        try {
            Path parent = lockPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            opened = FileChannel.open(lockPath, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
            FileLock acquired;
            try {
                acquired = opened.tryLock();
            } catch (OverlappingFileLockException e) {
                acquired = null;
            }
            if (acquired == null) {
                opened.close();
                throw new AlreadyRunningException("다른 인스턴스가 저장소 잠금을 쥐고 있습니다: " + lockPath);
            }
            opened.truncate(0);
            opened.write(ByteBuffer.wrap(String.valueOf(ProcessHandle.current().pid()).getBytes(StandardCharsets.UTF_8)));
            opened.force(false);
            channel = opened;
            lock = acquired;
            log.infof("저장소 잠금 획득: %s", lockPath);
        } catch (IOException e) {
            closeQuietly(opened);
            throw new StoreUnavailableException("저장소 잠금 파일을 열 수 없습니다: " + lockPath, e);
        }
    }

    public synchronized boolean isHeld() {
        return lock != null && lock.isValid();
    }

    public synchronized void release() {
        if (lock == null) {
            return;
        }
        try {
            lock.release();
            channel.close();
            log.infof("저장소 잠금 해제: %s", lockPath);
        } catch (IOException e) {
            log.warnf("저장소 잠금 해제 실패: %s (%s)", lockPath, e.getMessage());
        } finally {
            lock = null;
            channel = null;
        }
    }

    @Override
    public void close() {
        release();
    }

    private static void closeQuietly(FileChannel opened) {
        if (opened == null || !opened.isOpen()) {
            return;
        }
        try {
            opened.close();
        } catch (IOException e) {
            log.debugf("잠금 채널 닫기 실패: %s", e.getMessage());
        }
    }
}
