package com.vibecoding.ocloud.orchestrator;

import com.vibecoding.ocloud.config.ControlPlaneProperties;
import com.vibecoding.ocloud.exception.OrchestrationException;
import com.vibecoding.ocloud.exception.ResourceNotFoundException;
import com.vibecoding.ocloud.exception.WorkflowCancelledException;
import com.vibecoding.ocloud.model.orchestration.AgentStatus;
import com.vibecoding.ocloud.model.orchestration.DeploymentIntent;
import com.vibecoding.ocloud.model.orchestration.ErrorSeverity;
import com.vibecoding.ocloud.model.orchestration.WorkflowRecord;
import com.vibecoding.ocloud.model.orchestration.WorkflowState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * 6단계 배포 오케스트레이터
 * - 단계는 순서대로 실행, 첫 실패에서 중단 (완료된 단계는 롤백하지 않음)
 * - 에이전트가 등록된 단계는 위임, 아니면 fallback 을 백오프 재시도
 */
@Service
public class DeploymentOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(DeploymentOrchestrator.class);

    static final String COMPONENT = "DeploymentOrchestrator";
    static final String RESOURCE = "ric-deployment";

    private final AgentRegistry agentRegistry;
    private final BackoffRetrier retrier;
    private final TaskExecutor taskExecutor;
    private final ControlPlaneProperties properties;
    private final Map<OrchestrationPhase, PhaseFallback> fallbacks = new EnumMap<>(OrchestrationPhase.class);

    private final Map<String, WorkflowRecord> workflows = new ConcurrentHashMap<>();
    private final Map<String, WorkflowContext> contexts = new ConcurrentHashMap<>();   // 실행이 끝나지 않은 워크플로우만
    private final Deque<String> finishedOrder = new ArrayDeque<>();

    public DeploymentOrchestrator(AgentRegistry agentRegistry,
                                  BackoffRetrier retrier,
                                  List<PhaseFallback> fallbacks,
                                  @Qualifier("workflowTaskExecutor") TaskExecutor taskExecutor,
                                  ControlPlaneProperties properties) {
        this.agentRegistry = agentRegistry;
        this.retrier = retrier;
        this.taskExecutor = taskExecutor;
        this.properties = properties;
        for (PhaseFallback fallback : fallbacks) {
            this.fallbacks.put(fallback.getPhase(), fallback);
        }
        log.info("Orchestrator initialized with {} phase fallback(s)", this.fallbacks.size());
    }

    /**
     * 워크플로우 동기 실행 (실패 시 OrchestrationException)
     */
    public WorkflowRecord execute(DeploymentIntent intent) {
        validate(intent);
        WorkflowContext context = newWorkflow(intent);
        run(context, intent);
        return getWorkflow(context.getWorkflowId());
    }

    /**
     * 워크플로우 비동기 제출
     */
    public WorkflowRecord submit(DeploymentIntent intent) {
        validate(intent);
        WorkflowContext context = newWorkflow(intent);

        taskExecutor.execute(() -> {
            try {
                run(context, intent);
            } catch (OrchestrationException e) {
                log.debug("Workflow {} finished with error {}", context.getWorkflowId(), e.getCode());
            }
        });
        return getWorkflow(context.getWorkflowId());
    }

    /**
     * 워크플로우 취소 (대기 중인 백오프는 즉시 깨어남)
     */
    public WorkflowRecord cancel(String workflowId) {
        WorkflowRecord record = workflows.get(workflowId);
        if (record == null) {
            throw new ResourceNotFoundException("workflow " + workflowId + " not found");
        }

        synchronized (record) {
            if (record.getState().isTerminal()) {
                throw new IllegalStateException("workflow " + workflowId + " already finished as " + record.getState());
            }
            // 종료 전까지 컨텍스트는 남아 있음
            contexts.get(workflowId).cancel();
            if (record.getState() == WorkflowState.PENDING) {
                record.setState(WorkflowState.CANCELLED);
                record.setFinishedAt(LocalDateTime.now());
            }
        }
        log.info("Cancellation requested for workflow {}", workflowId);
        return getWorkflow(workflowId);
    }

    public WorkflowRecord getWorkflow(String workflowId) {
        WorkflowRecord record = workflows.get(workflowId);
        if (record == null) {
            throw new ResourceNotFoundException("workflow " + workflowId + " not found");
        }
        return snapshot(record);
    }

    public List<WorkflowRecord> listWorkflows() {
        return workflows.values().stream()
            .map(this::snapshot)
            .sorted(Comparator.comparing(WorkflowRecord::getStartedAt))
            .collect(Collectors.toList());
    }

    public List<AgentStatus> getAgentStatuses() {
        return agentRegistry.statuses();
    }

    int activeContextCount() {
        return contexts.size();
    }

    private WorkflowContext newWorkflow(DeploymentIntent intent) {
        String workflowId = "wf-" + UUID.randomUUID();
        String correlationId = UUID.randomUUID().toString();
        WorkflowContext context = new WorkflowContext(workflowId, correlationId,
            properties.getOrchestrator().getWorkflowTimeout());

        WorkflowRecord record = WorkflowRecord.builder()
            .id(workflowId)
            .correlationId(correlationId)
            .intentName(intent.getMetadata().getName())
            .state(WorkflowState.PENDING)
            .startedAt(LocalDateTime.now())
            .build();

        workflows.put(workflowId, record);
        contexts.put(workflowId, context);
        return context;
    }

    private void run(WorkflowContext context, DeploymentIntent intent) {
        WorkflowRecord record = workflows.get(context.getWorkflowId());
        MDC.put("correlationId", context.getCorrelationId());
        try {
            synchronized (record) {
                if (record.getState() == WorkflowState.CANCELLED) {
                    log.info("Workflow {} cancelled before start", context.getWorkflowId());
                    throw wrap(OrchestrationPhase.SECURITY_BASELINE, intent, context,
                        new WorkflowCancelledException("workflow " + context.getWorkflowId() + " was cancelled"));
                }
                record.setState(WorkflowState.RUNNING);
            }

            log.info("Starting deployment orchestration: {} (ricType: {}, xApps: {})",
                intent.getMetadata().getName(), intent.getSpec().getRicType(),
                intent.getSpec().getXApps() != null ? intent.getSpec().getXApps().size() : 0);

            for (OrchestrationPhase phase : OrchestrationPhase.values()) {
                synchronized (record) {
                    record.setCurrentPhase(phase.name());
                }
                try {
                    runPhase(phase, context, intent);
                } catch (RuntimeException e) {
                    OrchestrationException error = wrap(phase, intent, context, e);
                    finishFailed(record, error, e);
                    throw error;
                }
                synchronized (record) {
                    record.getCompletedPhases().add(phase.name());
                }
            }

            synchronized (record) {
                record.setState(WorkflowState.SUCCEEDED);
                record.setCurrentPhase(null);
                record.setFinishedAt(LocalDateTime.now());
            }
            log.info("Deployment orchestration completed successfully: {}", intent.getMetadata().getName());
        } finally {
            retireWorkflow(context.getWorkflowId());
            MDC.remove("correlationId");
        }
    }

    /**
     * 종료 순서대로 기록하고 보관 한도를 넘는 오래된 워크플로우 제거
     */
    private void retireWorkflow(String workflowId) {
        contexts.remove(workflowId);
        synchronized (finishedOrder) {
            finishedOrder.addLast(workflowId);
            int retained = properties.getOrchestrator().getRetainedWorkflows();
            while (finishedOrder.size() > retained) {
                String evicted = finishedOrder.removeFirst();
                workflows.remove(evicted);
                log.debug("Evicted finished workflow {}", evicted);
            }
        }
    }

    private void runPhase(OrchestrationPhase phase, WorkflowContext context, DeploymentIntent intent) {
        context.checkActive();
        log.info("Phase {}: {}", phase.ordinal() + 1, phase.name());

        Optional<PhaseAgent> agent = agentRegistry.find(phase.getAgentName());
        if (agent.isPresent()) {
            log.debug("Delegating {} to agent {}", phase.name(), phase.getAgentName());
            agent.get().process(context, intent);
            return;
        }

        PhaseFallback fallback = fallbacks.get(phase);
        if (fallback == null) {
            throw new IllegalStateException("no agent or fallback registered for phase " + phase.name());
        }
        retrier.retry(context, phase.name(), () -> fallback.execute(context, intent));
    }

    private OrchestrationException wrap(OrchestrationPhase phase, DeploymentIntent intent,
                                        WorkflowContext context, Throwable cause) {
        // 취소는 어느 단계에서든 재시도 대상이 아님
        boolean retryable = phase.isRetryable() && !(cause instanceof WorkflowCancelledException);
        return OrchestrationException.builder()
            .code(phase.getErrorCode())
            .message(phase.getFailureMessage() + ": " + cause.getMessage())
            .component(COMPONENT)
            .intent(intent.getKind())
            .resource(RESOURCE)
            .severity(phase.isRetryable() ? ErrorSeverity.ERROR : ErrorSeverity.CRITICAL)
            .correlationId(context.getCorrelationId())
            .retryable(retryable)
            .cause(cause)
            .build();
    }

    private void finishFailed(WorkflowRecord record, OrchestrationException error, Throwable cause) {
        synchronized (record) {
            record.setState(cause instanceof WorkflowCancelledException ? WorkflowState.CANCELLED : WorkflowState.FAILED);
            record.setErrorCode(error.getCode());
            record.setErrorMessage(error.getMessage());
            record.setErrorSeverity(error.getSeverity());
            record.setRetryable(error.isRetryable());
            record.setFinishedAt(LocalDateTime.now());
        }
        log.error("Deployment orchestration failed: {}", error.toString());
    }

    private WorkflowRecord snapshot(WorkflowRecord record) {
        synchronized (record) {
            return record.toBuilder()
                .completedPhases(new ArrayList<>(record.getCompletedPhases()))
                .build();
        }
    }

    private void validate(DeploymentIntent intent) {
        if (intent == null || intent.getMetadata() == null
            || intent.getMetadata().getName() == null || intent.getMetadata().getName().isBlank()) {
            throw new IllegalArgumentException("metadata.name is required");
        }
        if (intent.getSpec() == null) {
            throw new IllegalArgumentException("spec is required");
        }
    }
}
