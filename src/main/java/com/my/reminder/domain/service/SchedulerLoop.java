package com.my.reminder.domain.service;

import com.my.reminder.domain.exception.CorruptRecordException;
import com.my.reminder.domain.exception.EventNotFoundException;
import com.my.reminder.domain.exception.StoreUnavailableException;
import com.my.reminder.domain.exception.VersionConflictException;
import com.my.reminder.domain.model.EventRecord;
import com.my.reminder.domain.model.FireEntry;
import com.my.reminder.domain.model.SchedulerState;
import com.my.reminder.domain.port.out.ClockPort;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * 왜: 다음 발송 시각까지 잠들었다가 깨어나 도래한 일정을 발송하는 단일 조정 작업을 두어, 일정이 누락되거나 두 번 발송되지 않게 하기 위함.
 * <p>
 * 대기는 고정 sleep이 아니라 {@link FireQueue} 변경 알림으로 깨어날 수 있다. 종료 신호를 받으면 진행 중인 발송 하나를 마친 뒤
 * 더 이상 발송하지 않고 멈춘다. 놓친 회차는 다음 기동 시 {@link RecoveryManager}가 처리한다.
 */
public class SchedulerLoop {

    private static final Logger log = Logger.getLogger(SchedulerLoop.class);

    // 벽시계가 점프해도 최대 이 주기마다 시각을 다시 확인한다.
    private static final Duration MAX_WAIT = Duration.ofMinutes(1);

    private final EventRegistry registry;
    private final FireQueue fireQueue;
    private final NotificationDispatcher dispatcher;
    private final ClockPort clockPort;
    private final Duration graceWindow;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private boolean wakeRequested;

    private volatile SchedulerState state = SchedulerState.IDLE;
    private volatile boolean draining;
    private volatile Thread worker;
    private volatile Consumer<Throwable> fatalHandler = error -> { };

    public SchedulerLoop(EventRegistry registry,
                         FireQueue fireQueue,
                         NotificationDispatcher dispatcher,
                         ClockPort clockPort,
                         Duration graceWindow) {
        this.registry = registry;
        this.fireQueue = fireQueue;
        this.dispatcher = dispatcher;
        this.clockPort = clockPort;
        this.graceWindow = graceWindow;
        fireQueue.addListener(this::wake);
    }

    /**
     * 저장소 장애로 루프가 멈출 때 호출된다.
     */
    public void onFatal(Consumer<Throwable> handler) {
        this.fatalHandler = handler;
    }

    public synchronized void start() {
        if (worker != null) {
            throw new IllegalStateException("스케줄러가 이미 시작되었습니다.");
        }
        Thread thread = new Thread(this::run, "reminder-scheduler");
        thread.setUncaughtExceptionHandler((t, e) -> log.errorf(e, "스케줄러 스레드 비정상 종료"));
        worker = thread;
        thread.start();
        log.infof("스케줄러 시작: 대기 일정 %d건, 유예 시간 %s", fireQueue.size(), graceWindow);
    }

    /**
     * 새 발송을 멈추고 진행 중인 발송이 끝나기를 기다린다.
     *
     * @return 제한 시간 안에 정상적으로 멈췄으면 true
     */
    public boolean drain(Duration timeout) {
        draining = true;
        if (state != SchedulerState.STOPPED) {
            state = SchedulerState.DRAINING;
        }
        wake();
        Thread thread = worker;
        boolean clean = true;
        if (thread != null && thread != Thread.currentThread()) {
            try {
                thread.join(timeout.toMillis());
                if (thread.isAlive()) {
                    log.warnf("스케줄러가 %s 안에 멈추지 않아 인터럽트합니다.", timeout);
                    thread.interrupt();
                    thread.join(TimeUnit.SECONDS.toMillis(1));
                    clean = false;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                clean = false;
            }
        }
        state = SchedulerState.STOPPED;
        log.infof("스케줄러 정지: 남은 대기 일정 %d건", fireQueue.size());
        return clean;
    }

    public SchedulerState state() {
        return state;
    }

    public boolean isRunning() {
        Thread thread = worker;
        return thread != null && thread.isAlive() && !draining;
    }

    /**
     * 대기 중인 루프를 깨워 가장 이른 발송 시각을 다시 보게 한다.
     */
    public void wake() {
        lock.lock();
        try {
            wakeRequested = true;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * 현재 시각 기준으로 도래한 일정을 모두 발송한다.
     *
     * @return 발송을 시도한 일정 수
     * @throws StoreUnavailableException 발송 결과를 저장할 수 없을 때
     */
    public int fireDue() {
        if (draining) {
            return 0;
        }
        state = SchedulerState.FIRING;
        Instant now = clockPort.now();
        List<FireEntry> due = fireQueue.pollDue(now);
        int fired = 0;
        for (int i = 0; i < due.size(); i++) {
            if (draining) {
                // 꺼냈지만 발송하지 않은 항목은 큐에 되돌려 둔다.
                due.subList(i, due.size()).forEach(fireQueue::offer);
                log.infof("종료 중이라 %d건의 발송을 다음 기동으로 미룹니다.", due.size() - i);
                break;
            }
            if (fire(due.get(i))) {
                fired++;
            }
        }
        return fired;
    }

    private void run() {
        try {
            while (!draining) {
                fireDue();
                awaitNextDeadline();
            }
        } catch (StoreUnavailableException e) {
            log.errorf(e, "저장소 장애로 스케줄러를 중단합니다.");
            draining = true;
            fatalHandler.accept(e);
        } finally {
            state = SchedulerState.STOPPED;
        }
    }

    /**
     * 큐에서 꺼낸 항목 하나를 발송한다. 항목 하나의 실패가 루프를 멈추지 않게 하고 저장소 장애만 위로 올린다.
     *
     * @return 알림 전송을 시도했으면 true
     */
    boolean fire(FireEntry entry) {
        try {
            return fireChecked(entry);
        } catch (StoreUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            log.errorf(e, "발송 처리에 실패해 이 회차를 버립니다: id=%s fireAt=%s", entry.eventId(), entry.fireAt());
            // 같은 버전이 다시 큐에 올라와 있으면 곧바로 다시 실패하므로 함께 버린다.
            fireQueue.get(entry.eventId())
                    .filter(queued -> queued.version() == entry.version())
                    .ifPresent(queued -> fireQueue.remove(queued.eventId()));
            return false;
        }
    }

    private boolean fireChecked(FireEntry entry) {
        EventRecord record;
        try {
            Optional<EventRecord> current = registry.find(entry.eventId());
            if (current.isEmpty() || !current.get().isActive()) {
                log.debugf("비활성 일정의 발송을 건너뜁니다: id=%s", entry.eventId());
                return false;
            }
            record = current.get();
        } catch (CorruptRecordException e) {
            log.errorf("손상된 레코드의 발송을 건너뜁니다: id=%s reason=%s", entry.eventId(), e.getMessage());
            return false;
        }
        if (record.version() != entry.version()) {
            log.infof("낡은 발송 결정을 폐기하고 다시 예약합니다: id=%s queued=%d current=%d",
                    record.id(), entry.version(), record.version());
            registry.requeue(record);
            return false;
        }

        boolean delivered = dispatcher.dispatch(record);
        try {
            EventRecord after = registry.completeFire(entry, graceWindow);
            log.infof("발송 완료: id=%s delivered=%s state=%s next=%s",
                    record.id(), delivered, after.state(), after.nextFireUtc());
        } catch (EventNotFoundException e) {
            log.warnf("발송 후 일정이 사라졌습니다: id=%s", entry.eventId());
        } catch (VersionConflictException e) {
            log.errorf("발송 후 상태 갱신이 계속 충돌합니다: id=%s reason=%s", entry.eventId(), e.getMessage());
            registry.find(entry.eventId()).ifPresent(registry::requeue);
        }
        return true;
    }

    private void awaitNextDeadline() {
        lock.lock();
        try {
            while (!draining && !wakeRequested) {
                Optional<Instant> deadline = fireQueue.nextDeadline();
                if (deadline.isEmpty()) {
                    state = SchedulerState.IDLE;
                    changed.await(MAX_WAIT.toNanos(), TimeUnit.NANOSECONDS);
                    continue;
                }
                Duration remaining = Duration.between(clockPort.now(), deadline.get());
                if (remaining.isNegative() || remaining.isZero()) {
                    break;
                }
                state = SchedulerState.WAITING;
                Duration wait = remaining.compareTo(MAX_WAIT) < 0 ? remaining : MAX_WAIT;
                changed.awaitNanos(wait.toNanos());
            }
            wakeRequested = false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            draining = true;
        } finally {
            lock.unlock();
        }
    }
}
