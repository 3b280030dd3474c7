package com.vibecoding.ocloud.orchestrator.fallback;

import com.vibecoding.ocloud.model.orchestration.DeploymentIntent;
import com.vibecoding.ocloud.model.orchestration.InterfaceConfig;
import com.vibecoding.ocloud.model.orchestration.InterfaceSpec;
import com.vibecoding.ocloud.orchestrator.OrchestrationPhase;
import com.vibecoding.ocloud.orchestrator.PhaseFallback;
import com.vibecoding.ocloud.orchestrator.WorkflowContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * E2/A1/O1/O2 인터페이스 설정 검사 (활성 인터페이스는 버전 필수)
 */
@Component
public class InterfaceConfigurationFallback implements PhaseFallback {

    private static final Logger log = LoggerFactory.getLogger(InterfaceConfigurationFallback.class);

    @Override
    public OrchestrationPhase getPhase() {
        return OrchestrationPhase.INTERFACE_CONFIGURATION;
    }

    @Override
    public void execute(WorkflowContext context, DeploymentIntent intent) {
        InterfaceSpec interfaces = intent.getSpec().getInterfaces() != null
            ? intent.getSpec().getInterfaces() : new InterfaceSpec();

        Map<String, InterfaceConfig> byName = new LinkedHashMap<>();
        byName.put("E2", interfaces.getE2());
        byName.put("A1", interfaces.getA1());
        byName.put("O1", interfaces.getO1());
        byName.put("O2", interfaces.getO2());

        int configured = 0;
        for (Map.Entry<String, InterfaceConfig> entry : byName.entrySet()) {
            InterfaceConfig config = entry.getValue();
            if (config == null || !config.isEnabled()) {
                continue;
            }
            if (config.getVersion() == null || config.getVersion().isBlank()) {
                throw new IllegalArgumentException("interface " + entry.getKey() + " is enabled but declares no version");
            }
            log.info("Configuring {} interface: version={}, security={}", entry.getKey(), config.getVersion(), config.getSecurity());
            configured++;
        }
        log.info("Configured {} O-RAN interface(s)", configured);
    }
}
