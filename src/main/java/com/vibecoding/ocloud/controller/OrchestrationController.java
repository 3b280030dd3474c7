package com.vibecoding.ocloud.controller;

import com.vibecoding.ocloud.model.orchestration.AgentStatus;
import com.vibecoding.ocloud.model.orchestration.DeploymentIntent;
import com.vibecoding.ocloud.model.orchestration.WorkflowRecord;
import com.vibecoding.ocloud.orchestrator.DeploymentOrchestrator;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * 배포 워크플로우 API
 */
@RestController
@RequestMapping("/api/v1/orchestrations")
@RequiredArgsConstructor
public class OrchestrationController {

    private static final Logger log = LoggerFactory.getLogger(OrchestrationController.class);

    private final DeploymentOrchestrator orchestrator;

    /**
     * 워크플로우 제출 (202, 비동기 실행)
     */
    @PostMapping
    public ResponseEntity<WorkflowRecord> submit(@RequestBody DeploymentIntent intent) {
        WorkflowRecord record = orchestrator.submit(intent);
        log.info("API: submitted workflow {} for intent {}", record.getId(), record.getIntentName());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(record);
    }

    @GetMapping
    public List<WorkflowRecord> listWorkflows() {
        return orchestrator.listWorkflows();
    }

    @GetMapping("/agents")
    public List<AgentStatus> listAgents() {
        return orchestrator.getAgentStatuses();
    }

    @GetMapping("/{id}")
    public WorkflowRecord getWorkflow(@PathVariable String id) {
        return orchestrator.getWorkflow(id);
    }

    @PostMapping("/{id}/cancel")
    public WorkflowRecord cancel(@PathVariable String id) {
        log.info("API: cancel workflow {}", id);
        return orchestrator.cancel(id);
    }
}
