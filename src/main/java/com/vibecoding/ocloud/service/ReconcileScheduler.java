package com.vibecoding.ocloud.service;

import com.vibecoding.ocloud.config.ControlPlaneProperties;
import com.vibecoding.ocloud.model.ocloud.ReconcileResult;
import com.vibecoding.ocloud.repository.OCloudRepository;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 재조정 트리거 큐
 * - O-Cloud 당 대기 트리거는 최대 하나
 * - 같은 O-Cloud 의 사이클은 이름별 락으로 직렬화, 서로 다른 O-Cloud 는 병렬
 */
@Component
public class ReconcileScheduler {

    private static final Logger log = LoggerFactory.getLogger(ReconcileScheduler.class);

    private final OCloudReconciler reconciler;
    private final OCloudRepository ocloudRepository;
    private final ThreadPoolTaskScheduler taskScheduler;
    private final ControlPlaneProperties properties;

    private final Map<String, ScheduledFuture<?>> pending = new ConcurrentHashMap<>();
    private final Map<String, NameLock> locks = new ConcurrentHashMap<>();        // 사용 중인 이름만 보관
    private final Set<String> rerunRequested = ConcurrentHashMap.newKeySet();   // 실행 중 들어온 트리거

    public ReconcileScheduler(OCloudReconciler reconciler,
                              OCloudRepository ocloudRepository,
                              @Qualifier("reconcileTaskScheduler") ThreadPoolTaskScheduler taskScheduler,
                              ControlPlaneProperties properties) {
        this.reconciler = reconciler;
        this.ocloudRepository = ocloudRepository;
        this.taskScheduler = taskScheduler;
        this.properties = properties;
    }

    /**
     * 시작 시 저장된 O-Cloud 전부 재조정 예약
     */
    @PostConstruct
    public void enqueueStoredOClouds() {
        if (!properties.getReconcile().isEnabled()) {
            log.info("Reconcile loop disabled, skipping startup enqueue");
            return;
        }

        List<String> names = ocloudRepository.findAllNames();
        log.info("Enqueueing {} stored O-Cloud(s) for reconciliation", names.size());
        names.forEach(this::enqueue);
    }

    /**
     * 즉시 재조정 예약 (지연된 트리거는 앞당기고, 실행 중이면 끝난 뒤 한 번 더)
     */
    public void enqueue(String name) {
        pending.compute(name, (key, existing) -> {
            if (existing == null || existing.isDone()) {
                return schedule(name, Duration.ZERO);
            }
            if (existing.getDelay(TimeUnit.MILLISECONDS) > 0) {
                existing.cancel(false);
                return schedule(name, Duration.ZERO);
            }
            rerunRequested.add(name);
            return existing;
        });
    }

    /**
     * 호출 스레드에서 바로 한 사이클 실행 후 결과에 따라 재예약
     */
    public ReconcileResult reconcileNow(String name) {
        ReconcileResult result = runLocked(name);
        pending.compute(name, (key, existing) -> {
            if (existing != null && !existing.isDone()) {
                if (existing.getDelay(TimeUnit.MILLISECONDS) <= 0) {
                    return existing;
                }
                existing.cancel(false);
            }
            return result.isRequeue() ? schedule(name, result.getRequeueAfter()) : null;
        });
        return result;
    }

    /**
     * 삭제된 O-Cloud 의 예약 취소 (이름별 락은 마지막 사이클이 끝날 때 제거됨)
     */
    public void forget(String name) {
        ScheduledFuture<?> future = pending.remove(name);
        if (future != null) {
            future.cancel(false);
        }
        rerunRequested.remove(name);
        log.info("Cancelled pending reconciliation for {}", name);
    }

    public boolean hasPending(String name) {
        ScheduledFuture<?> future = pending.get(name);
        return future != null && !future.isDone();
    }

    private ScheduledFuture<?> schedule(String name, Duration delay) {
        log.debug("Scheduling reconciliation for {} in {}", name, delay);
        return taskScheduler.schedule(() -> runAndRequeue(name), Instant.now().plus(delay));
    }

    private void runAndRequeue(String name) {
        ReconcileResult result = runLocked(name);

        pending.compute(name, (key, existing) -> {
            if (rerunRequested.remove(name)) {
                return schedule(name, Duration.ZERO);
            }
            if (!result.isRequeue()) {
                return null;
            }
            return schedule(name, result.getRequeueAfter());
        });
    }

    int lockCount() {
        return locks.size();
    }

    private ReconcileResult runLocked(String name) {
        NameLock nameLock = locks.compute(name, (key, existing) -> {
            NameLock holder = existing != null ? existing : new NameLock();
            holder.users++;
            return holder;
        });
        nameLock.lock.lock();
        try {
            return reconciler.reconcile(name);
        } finally {
            nameLock.lock.unlock();
            // 마지막 사용자가 나가면 제거
            locks.computeIfPresent(name, (key, holder) -> --holder.users == 0 ? null : holder);
        }
    }

    /**
     * 이름별 락 (users 는 locks.compute 안에서만 변경)
     */
    private static class NameLock {
        private final ReentrantLock lock = new ReentrantLock();
        private int users;
    }
}
