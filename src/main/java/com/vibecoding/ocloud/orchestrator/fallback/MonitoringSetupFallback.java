package com.vibecoding.ocloud.orchestrator.fallback;

import com.vibecoding.ocloud.model.o2.O2Subscription;
import com.vibecoding.ocloud.model.orchestration.DeploymentIntent;
import com.vibecoding.ocloud.model.orchestration.MonitoringSpec;
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
 * 모니터링 백엔드가 하나라도 있으면 배포 메트릭 구독 생성
 */
@Component
@RequiredArgsConstructor
public class MonitoringSetupFallback implements PhaseFallback {

    private static final Logger log = LoggerFactory.getLogger(MonitoringSetupFallback.class);

    static final String SUBSCRIPTION_TYPE = "deployment-metrics";

    private final O2InterfaceService o2InterfaceService;

    @Override
    public OrchestrationPhase getPhase() {
        return OrchestrationPhase.MONITORING_SETUP;
    }

    @Override
    public void execute(WorkflowContext context, DeploymentIntent intent) {
        MonitoringSpec monitoring = intent.getSpec().getMonitoring() != null
            ? intent.getSpec().getMonitoring() : new MonitoringSpec();

        List<String> backends = new ArrayList<>();
        if (monitoring.isPrometheus()) {
            backends.add("prometheus");
        }
        if (monitoring.isGrafana()) {
            backends.add("grafana");
        }
        if (monitoring.isJaeger()) {
            backends.add("jaeger");
        }
        if (monitoring.isVes()) {
            backends.add("ves");
        }

        if (backends.isEmpty()) {
            log.info("No monitoring backends requested, skipping");
            return;
        }
        if (context.getSubscriptionId() != null) {
            return;
        }

        Map<String, String> filter = new LinkedHashMap<>();
        filter.put("deploymentId", context.getDeploymentId());
        filter.put("backends", String.join(",", backends));

        O2Subscription subscription = o2InterfaceService.createSubscription(O2Subscription.builder()
            .type(SUBSCRIPTION_TYPE)
            .callback("internal://monitoring/" + intent.getMetadata().getName())
            .filter(filter)
            .build());
        context.setSubscriptionId(subscription.getId());
        log.info("Monitoring configured with {} ({})", backends, subscription.getId());
    }
}
