package com.vibecoding.ocloud.orchestrator.fallback;

import com.vibecoding.ocloud.model.orchestration.DeploymentIntent;
import com.vibecoding.ocloud.model.orchestration.PlatformSpec;
import com.vibecoding.ocloud.model.orchestration.ResourceRequests;
import com.vibecoding.ocloud.model.orchestration.XAppSpec;
import com.vibecoding.ocloud.model.resource.ResourceAllocation;
import com.vibecoding.ocloud.model.resource.ResourceRequest;
import com.vibecoding.ocloud.orchestrator.OrchestrationPhase;
import com.vibecoding.ocloud.orchestrator.PhaseFallback;
import com.vibecoding.ocloud.orchestrator.WorkflowContext;
import com.vibecoding.ocloud.service.CloudResourceManager;
import com.vibecoding.ocloud.service.ResourceQuantityParser;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 플랫폼과 xApp 리소스를 풀에서 할당 (시도 실패 시 이번 시도분은 해제)
 */
@Component
@RequiredArgsConstructor
public class InfrastructureProvisioningFallback implements PhaseFallback {

    private static final Logger log = LoggerFactory.getLogger(InfrastructureProvisioningFallback.class);

    private final CloudResourceManager resourceManager;

    @Override
    public OrchestrationPhase getPhase() {
        return OrchestrationPhase.INFRASTRUCTURE_PROVISIONING;
    }

    @Override
    public void execute(WorkflowContext context, DeploymentIntent intent) {
        PlatformSpec platform = intent.getSpec().getPlatform();
        if (platform == null || platform.getResourcePool() == null || platform.getResourcePool().isBlank()) {
            throw new IllegalArgumentException("platform.resourcePool is required for infrastructure provisioning");
        }

        String intentName = intent.getMetadata().getName();
        List<ResourceRequest> requests = new ArrayList<>();
        requests.add(toRequest(intentName + "-platform", platform.getResourcePool(), platform.getResources(), 10));
        if (intent.getSpec().getXApps() != null) {
            for (XAppSpec xApp : intent.getSpec().getXApps()) {
                requests.add(toRequest(intentName + "-xapp-" + xApp.getName(), platform.getResourcePool(), xApp.getResources(), 5));
            }
        }

        List<String> allocated = new ArrayList<>();
        try {
            for (ResourceRequest request : requests) {
                ResourceAllocation allocation = resourceManager.allocateResources(request);
                allocated.add(allocation.getId());
            }
        } catch (RuntimeException e) {
            releaseAll(allocated);
            throw e;
        }

        context.addAllocationIds(allocated);
        log.info("Provisioned {} allocation(s) from pool {} for {}", allocated.size(), platform.getResourcePool(), intentName);
    }

    private ResourceRequest toRequest(String id, String poolName, ResourceRequests resources, int priority) {
        ResourceRequests requested = resources != null ? resources : new ResourceRequests();
        return ResourceRequest.builder()
            .id(id)
            .poolName(poolName)
            .cpu(ResourceQuantityParser.parseOrZero(requested.getCpu()))
            .memory(ResourceQuantityParser.parseOrZero(requested.getMemory()))
            .priority(priority)
            .build();
    }

    private void releaseAll(List<String> allocationIds) {
        for (String id : allocationIds) {
            try {
                resourceManager.releaseResources(id);
            } catch (RuntimeException e) {
                log.error("Failed to release partial allocation {}: {}", id, e.getMessage());
            }
        }
        if (!allocationIds.isEmpty()) {
            log.info("Released {} partial allocation(s) after failed attempt", allocationIds.size());
        }
    }
}
