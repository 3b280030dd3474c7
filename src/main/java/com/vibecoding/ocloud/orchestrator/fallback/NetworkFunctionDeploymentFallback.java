package com.vibecoding.ocloud.orchestrator.fallback;

import com.vibecoding.ocloud.model.o2.O2Deployment;
import com.vibecoding.ocloud.model.orchestration.DeploymentIntent;
import com.vibecoding.ocloud.model.orchestration.XAppSpec;
import com.vibecoding.ocloud.orchestrator.OrchestrationPhase;
import com.vibecoding.ocloud.orchestrator.PhaseFallback;
import com.vibecoding.ocloud.orchestrator.WorkflowContext;
import com.vibecoding.ocloud.service.O2InterfaceService;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 할당 ID 를 담은 O2 배포 생성 후 running 으로 전환
 */
@Component
@RequiredArgsConstructor
public class NetworkFunctionDeploymentFallback implements PhaseFallback {

    private static final Logger log = LoggerFactory.getLogger(NetworkFunctionDeploymentFallback.class);

    private final O2InterfaceService o2InterfaceService;

    @Override
    public OrchestrationPhase getPhase() {
        return OrchestrationPhase.NETWORK_FUNCTION_DEPLOYMENT;
    }

    @Override
    public void execute(WorkflowContext context, DeploymentIntent intent) {
        // 이전 시도에서 만든 배포가 있으면 재사용
        String deploymentId = context.getDeploymentId();
        if (deploymentId == null || o2InterfaceService.getDeployment(deploymentId).isEmpty()) {
            O2Deployment deployment = o2InterfaceService.createDeployment(O2Deployment.builder()
                .name(intent.getMetadata().getName())
                .description(describe(intent))
                .resources(context.getAllocationIds())
                .parameters(parameters(intent, context))
                .build());
            deploymentId = deployment.getId();
            context.setDeploymentId(deploymentId);
        }

        o2InterfaceService.updateDeploymentStatus(deploymentId, O2InterfaceService.STATUS_RUNNING);
        log.info("Network functions deployed as {}", deploymentId);
    }

    private String describe(DeploymentIntent intent) {
        int xApps = intent.getSpec().getXApps() != null ? intent.getSpec().getXApps().size() : 0;
        String version = intent.getSpec().getPlatform() != null ? intent.getSpec().getPlatform().getVersion() : "unknown";
        return intent.getSpec().getRicType() + " RIC platform " + version + " with " + xApps + " xApp(s)";
    }

    private Map<String, Object> parameters(DeploymentIntent intent, WorkflowContext context) {
        List<String> xAppNames = new ArrayList<>();
        if (intent.getSpec().getXApps() != null) {
            for (XAppSpec xApp : intent.getSpec().getXApps()) {
                xAppNames.add(xApp.getName());
            }
        }

        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("ricType", intent.getSpec().getRicType());
        parameters.put("xapps", xAppNames);
        parameters.put("correlationId", context.getCorrelationId());
        if (intent.getSpec().getPlatform() != null) {
            parameters.put("platformVersion", intent.getSpec().getPlatform().getVersion());
            parameters.put("ha", intent.getSpec().getPlatform().isHa());
        }
        return parameters;
    }
}
