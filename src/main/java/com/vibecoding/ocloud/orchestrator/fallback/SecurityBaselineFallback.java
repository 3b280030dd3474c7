package com.vibecoding.ocloud.orchestrator.fallback;

import com.vibecoding.ocloud.model.orchestration.DeploymentIntent;
import com.vibecoding.ocloud.model.orchestration.SecuritySpec;
import com.vibecoding.ocloud.orchestrator.OrchestrationPhase;
import com.vibecoding.ocloud.orchestrator.PhaseFallback;
import com.vibecoding.ocloud.orchestrator.WorkflowContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * 보안 기준선 검사 (zero-trust 는 mTLS 필수)
 */
@Component
public class SecurityBaselineFallback implements PhaseFallback {

    private static final Logger log = LoggerFactory.getLogger(SecurityBaselineFallback.class);

    @Override
    public OrchestrationPhase getPhase() {
        return OrchestrationPhase.SECURITY_BASELINE;
    }

    @Override
    public void execute(WorkflowContext context, DeploymentIntent intent) {
        SecuritySpec security = intent.getSpec().getSecurity() != null
            ? intent.getSpec().getSecurity() : new SecuritySpec();

        log.info("Applying security policies: zeroTrust={}, mtls={}, imageSigning={}, runtimeScan={}",
            security.isZeroTrust(), security.isMtls(), security.isImageSigning(), security.isRuntimeScan());

        if (security.isZeroTrust() && !security.isMtls()) {
            throw new IllegalArgumentException("zero-trust security requires mTLS to be enabled");
        }

        if (security.getCompliance() != null && !security.getCompliance().isEmpty()) {
            log.info("Compliance profiles requested: {}", security.getCompliance());
        }
    }
}
