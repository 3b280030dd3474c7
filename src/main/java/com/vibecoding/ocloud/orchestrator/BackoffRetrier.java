package com.vibecoding.ocloud.orchestrator;

import com.vibecoding.ocloud.config.ControlPlaneProperties;
import com.vibecoding.ocloud.exception.InsufficientCapacityException;
import com.vibecoding.ocloud.exception.InvalidQuantityException;
import com.vibecoding.ocloud.exception.ResourceNotFoundException;
import com.vibecoding.ocloud.exception.WorkflowCancelledException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.backoff.BackOffExecution;
import org.springframework.util.backoff.ExponentialBackOff;

import java.time.Duration;
import java.time.Instant;

/**
 * 지수 백오프 재시도 (단계별 기한과 워크플로우 기한 중 이른 쪽까지)
 */
@Component
@RequiredArgsConstructor
public class BackoffRetrier {

    private static final Logger log = LoggerFactory.getLogger(BackoffRetrier.class);

    private final ControlPlaneProperties properties;

    /**
     * 성공하거나 영구 오류/기한 초과/취소가 날 때까지 operation 반복
     */
    public void retry(WorkflowContext context, String operationName, Runnable operation) {
        ControlPlaneProperties.Orchestrator config = properties.getOrchestrator();

        ExponentialBackOff backOff = new ExponentialBackOff(config.getInitialInterval().toMillis(), config.getMultiplier());
        backOff.setMaxInterval(config.getMaxInterval().toMillis());
        backOff.setMaxElapsedTime(config.getPhaseTimeout().toMillis());
        BackOffExecution execution = backOff.start();

        Instant phaseDeadline = Instant.now().plus(config.getPhaseTimeout());
        if (context.getDeadline().isBefore(phaseDeadline)) {
            phaseDeadline = context.getDeadline();
        }

        int attempt = 0;
        while (true) {
            context.checkActive();
            attempt++;
            if (attempt > 1) {
                log.debug("Retrying {} (attempt {})", operationName, attempt);
            }

            try {
                operation.run();
                return;
            } catch (RuntimeException e) {
                if (isPermanent(e)) {
                    log.warn("{} failed permanently: {}", operationName, e.getMessage());
                    throw e;
                }

                long waitMillis = execution.nextBackOff();
                if (waitMillis == BackOffExecution.STOP || Instant.now().plusMillis(waitMillis).isAfter(phaseDeadline)) {
                    log.warn("Giving up on {} after {} attempt(s): {}", operationName, attempt, e.getMessage());
                    throw e;
                }

                log.warn("{} failed (attempt {}), retrying in {}ms: {}", operationName, attempt, waitMillis, e.getMessage());
                sleep(context, Duration.ofMillis(waitMillis));
            }
        }
    }

    /**
     * 재시도해도 결과가 같은 오류
     */
    public static boolean isPermanent(Throwable e) {
        return e instanceof WorkflowCancelledException
            || e instanceof InvalidQuantityException
            || e instanceof InsufficientCapacityException
            || e instanceof ResourceNotFoundException
            || e instanceof IllegalArgumentException;
    }

    private void sleep(WorkflowContext context, Duration wait) {
        try {
            if (context.awaitCancellation(wait)) {
                throw new WorkflowCancelledException("workflow " + context.getWorkflowId() + " was cancelled");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WorkflowCancelledException("workflow " + context.getWorkflowId() + " was interrupted", e);
        }
    }
}
