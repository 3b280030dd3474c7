package com.vibecoding.ocloud.orchestrator.fallback;

import com.vibecoding.ocloud.exception.ResourceNotFoundException;
import com.vibecoding.ocloud.model.o2.O2Deployment;
import com.vibecoding.ocloud.model.orchestration.DeploymentIntent;
import com.vibecoding.ocloud.orchestrator.OrchestrationPhase;
import com.vibecoding.ocloud.orchestrator.PhaseFallback;
import com.vibecoding.ocloud.orchestrator.WorkflowContext;
import com.vibecoding.ocloud.service.CloudResourceManager;
import com.vibecoding.ocloud.service.O2InterfaceService;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * 배포 검증 (할당이 모두 살아 있고 배포가 running 인지)
 */
@Component
@RequiredArgsConstructor
public class ValidationFallback implements PhaseFallback {

    private static final Logger log = LoggerFactory.getLogger(ValidationFallback.class);

    private final CloudResourceManager resourceManager;
    private final O2InterfaceService o2InterfaceService;

    @Override
    public OrchestrationPhase getPhase() {
        return OrchestrationPhase.VALIDATION;
    }

    @Override
    public void execute(WorkflowContext context, DeploymentIntent intent) {
        for (String allocationId : context.getAllocationIds()) {
            if (resourceManager.getAllocation(allocationId).isEmpty()) {
                throw new ResourceNotFoundException("allocation " + allocationId + " no longer exists");
            }
        }

        String deploymentId = context.getDeploymentId();
        if (deploymentId == null) {
            throw new ResourceNotFoundException("no deployment was created for " + intent.getMetadata().getName());
        }
        O2Deployment deployment = o2InterfaceService.getDeployment(deploymentId)
            .orElseThrow(() -> new ResourceNotFoundException("deployment " + deploymentId + " not found"));
        if (!O2InterfaceService.STATUS_RUNNING.equals(deployment.getStatus())) {
            throw new IllegalStateException("deployment " + deploymentId + " is " + deployment.getStatus() + ", expected running");
        }

        log.info("Deployment {} validated ({} allocation(s))", deploymentId, context.getAllocationIds().size());
    }
}
