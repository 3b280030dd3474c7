package com.vibecoding.ocloud.orchestrator;

import com.vibecoding.ocloud.model.orchestration.AgentStatus;
import com.vibecoding.ocloud.model.orchestration.DeploymentIntent;

import java.util.List;

/**
 * 단계를 위임받아 처리하는 전문 에이전트
 * - getName() 이 OrchestrationPhase 의 agentName 과 같으면 해당 단계를 대신 처리
 */
public interface PhaseAgent {

    /**
     * 에이전트 이름 (예: security-compliance-agent)
     */
    String getName();

    /**
     * 단계 처리 (실패 시 예외)
     */
    void process(WorkflowContext context, DeploymentIntent intent);

    /**
     * 현재 상태
     */
    AgentStatus getStatus();

    /**
     * 지원 기능 목록
     */
    List<String> getCapabilities();
}
