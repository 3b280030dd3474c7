package com.vibecoding.ocloud.orchestrator;

import com.vibecoding.ocloud.exception.WorkflowCancelledException;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * 워크플로우 한 건의 실행 컨텍스트 (취소 신호, 기한, 단계 간 공유 상태)
 */
public class WorkflowContext {

    private final String workflowId;
    private final String correlationId;
    private final Instant deadline;
    private final CountDownLatch cancelled = new CountDownLatch(1);

    private final List<String> allocationIds = Collections.synchronizedList(new ArrayList<>());
    private volatile String deploymentId;
    private volatile String subscriptionId;

    public WorkflowContext(String workflowId, String correlationId, Duration timeout) {
        this.workflowId = workflowId;
        this.correlationId = correlationId;
        this.deadline = Instant.now().plus(timeout);
    }

    public String getWorkflowId() {
        return workflowId;
    }

    public String getCorrelationId() {
        return correlationId;
    }

    public Instant getDeadline() {
        return deadline;
    }

    public void cancel() {
        cancelled.countDown();
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    public boolean isExpired() {
        return !Instant.now().isBefore(deadline);
    }

    /**
     * 취소되었거나 기한이 지났으면 WorkflowCancelledException
     */
    public void checkActive() {
        if (isCancelled()) {
            throw new WorkflowCancelledException("workflow " + workflowId + " was cancelled");
        }
        if (isExpired()) {
            throw new WorkflowCancelledException("workflow " + workflowId + " exceeded its deadline");
        }
    }

    /**
     * 최대 wait 동안 대기 (기한을 넘지 않음), 취소되면 즉시 true
     */
    public boolean awaitCancellation(Duration wait) throws InterruptedException {
        long remaining = Duration.between(Instant.now(), deadline).toMillis();
        long millis = Math.max(0, Math.min(wait.toMillis(), remaining));
        return cancelled.await(millis, TimeUnit.MILLISECONDS);
    }

    public List<String> getAllocationIds() {
        synchronized (allocationIds) {
            return new ArrayList<>(allocationIds);
        }
    }

    public void addAllocationIds(List<String> ids) {
        allocationIds.addAll(ids);
    }

    public String getDeploymentId() {
        return deploymentId;
    }

    public void setDeploymentId(String deploymentId) {
        this.deploymentId = deploymentId;
    }

    public String getSubscriptionId() {
        return subscriptionId;
    }

    public void setSubscriptionId(String subscriptionId) {
        this.subscriptionId = subscriptionId;
    }
}
