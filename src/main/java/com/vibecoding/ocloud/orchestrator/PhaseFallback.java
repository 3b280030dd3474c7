package com.vibecoding.ocloud.orchestrator;

import com.vibecoding.ocloud.model.orchestration.DeploymentIntent;

/**
 * 등록된 에이전트가 없을 때 실행되는 기본 단계 구현
 */
public interface PhaseFallback {

    /**
     * 담당 단계
     */
    OrchestrationPhase getPhase();

    /**
     * 단계 실행 (재시도 루프 안에서 호출되므로 한 번의 시도 단위)
     */
    void execute(WorkflowContext context, DeploymentIntent intent);
}
