package com.vibecoding.ocloud.service;

import com.vibecoding.ocloud.config.ControlPlaneProperties;
import com.vibecoding.ocloud.model.ocloud.ReconcileResult;
import com.vibecoding.ocloud.repository.OCloudRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * 재조정 트리거 큐 테스트
 */
class ReconcileSchedulerTest {

    private OCloudReconciler reconciler;
    private OCloudRepository ocloudRepository;
    private ThreadPoolTaskScheduler taskScheduler;
    private ControlPlaneProperties properties;
    private ReconcileScheduler scheduler;

    @BeforeEach
    void setUp() {
        reconciler = mock(OCloudReconciler.class);
        ocloudRepository = mock(OCloudRepository.class);
        properties = new ControlPlaneProperties();

        taskScheduler = new ThreadPoolTaskScheduler();
        taskScheduler.setPoolSize(4);
        taskScheduler.setRemoveOnCancelPolicy(true);
        taskScheduler.initialize();

        scheduler = new ReconcileScheduler(reconciler, ocloudRepository, taskScheduler, properties);
    }

    @AfterEach
    void tearDown() {
        taskScheduler.shutdown();
    }

    @Test
    @DisplayName("enqueue 하면 재조정 후 결과의 지연만큼 재예약")
    void testEnqueueRunsAndRequeues() {
        when(reconciler.reconcile("oc-a")).thenReturn(ReconcileResult.requeueAfter(Duration.ofHours(1)));

        scheduler.enqueue("oc-a");

        verify(reconciler, timeout(2000).times(1)).reconcile("oc-a");
        assertTrue(waitUntil(() -> scheduler.hasPending("oc-a")));
    }

    @Test
    @DisplayName("재예약이 필요 없으면 대기 트리거 없음")
    void testNoRequeue() {
        when(reconciler.reconcile("oc-a")).thenReturn(ReconcileResult.noRequeue());

        scheduler.reconcileNow("oc-a");

        assertFalse(scheduler.hasPending("oc-a"));
    }

    @Test
    @DisplayName("지연된 트리거가 있을 때 enqueue 하면 즉시 실행")
    void testEnqueueBringsDelayedTriggerForward() {
        when(reconciler.reconcile("oc-a")).thenReturn(ReconcileResult.requeueAfter(Duration.ofHours(1)));

        scheduler.reconcileNow("oc-a");
        assertTrue(scheduler.hasPending("oc-a"));

        scheduler.enqueue("oc-a");

        verify(reconciler, timeout(2000).times(2)).reconcile("oc-a");
    }

    @Test
    @DisplayName("같은 O-Cloud 의 사이클은 겹치지 않음")
    void testSameOCloudSerialized() throws Exception {
        AtomicInteger running = new AtomicInteger();
        AtomicInteger maxRunning = new AtomicInteger();
        CountDownLatch done = new CountDownLatch(3);
        when(reconciler.reconcile("oc-a")).thenAnswer(inv -> {
            maxRunning.accumulateAndGet(running.incrementAndGet(), Math::max);
            Thread.sleep(50);
            running.decrementAndGet();
            done.countDown();
            return ReconcileResult.noRequeue();
        });

        Thread t1 = new Thread(() -> scheduler.reconcileNow("oc-a"));
        Thread t2 = new Thread(() -> scheduler.reconcileNow("oc-a"));
        t1.start();
        t2.start();
        scheduler.enqueue("oc-a");

        assertTrue(done.await(5, TimeUnit.SECONDS));
        t1.join();
        t2.join();
        assertEquals(1, maxRunning.get());
        assertTrue(waitUntil(() -> scheduler.lockCount() == 0));
    }

    @Test
    @DisplayName("forget 은 대기 트리거 취소, 이름별 락도 남기지 않음")
    void testForget() {
        when(reconciler.reconcile(anyString())).thenReturn(ReconcileResult.requeueAfter(Duration.ofHours(1)));
        for (int i = 0; i < 50; i++) {
            scheduler.reconcileNow("oc-" + i);
            scheduler.forget("oc-" + i);
        }

        assertFalse(scheduler.hasPending("oc-0"));
        assertEquals(0, scheduler.lockCount());
    }

    @Test
    @DisplayName("비활성화 상태면 시작 시 저장된 O-Cloud 를 예약하지 않음")
    void testStartupEnqueueDisabled() {
        properties.getReconcile().setEnabled(false);

        scheduler.enqueueStoredOClouds();

        verifyNoInteractions(ocloudRepository);
    }

    @Test
    @DisplayName("시작 시 저장된 O-Cloud 전부 재조정")
    void testStartupEnqueue() {
        when(ocloudRepository.findAllNames()).thenReturn(List.of("oc-a", "oc-b"));
        when(reconciler.reconcile(anyString())).thenReturn(ReconcileResult.noRequeue());

        scheduler.enqueueStoredOClouds();

        verify(reconciler, timeout(2000)).reconcile("oc-a");
        verify(reconciler, timeout(2000)).reconcile("oc-b");
    }

    private static boolean waitUntil(BooleanSupplier condition) {
        long deadline = System.currentTimeMillis() + 2000;
        while (System.currentTimeMillis() < deadline) {
            if (condition.getAsBoolean()) {
                return true;
            }
            try {
                Thread.sleep(10);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
        return false;
    }
}
