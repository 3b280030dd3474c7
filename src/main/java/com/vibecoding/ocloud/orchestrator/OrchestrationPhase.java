package com.vibecoding.ocloud.orchestrator;

/**
 * 배포 워크플로우 단계 (실행 순서대로)
 */
public enum OrchestrationPhase {
    SECURITY_BASELINE("security-compliance-agent", "SECURITY_BASELINE_FAILED",
        "Failed to establish security baseline", true),
    INFRASTRUCTURE_PROVISIONING("nephio-infrastructure-agent", "INFRASTRUCTURE_PROVISIONING_FAILED",
        "Failed to provision infrastructure", true),
    INTERFACE_CONFIGURATION("configuration-management-agent", "INTERFACE_CONFIG_FAILED",
        "Failed to configure O-RAN interfaces", true),
    NETWORK_FUNCTION_DEPLOYMENT("oran-network-functions-agent", "NF_DEPLOYMENT_FAILED",
        "Failed to deploy network functions", true),
    MONITORING_SETUP("monitoring-analytics-agent", "MONITORING_SETUP_FAILED",
        "Failed to setup monitoring", true),
    VALIDATION("testing-validation-agent", "DEPLOYMENT_VALIDATION_FAILED",
        "Failed to validate deployment", false);

    private final String agentName;
    private final String errorCode;
    private final String failureMessage;
    private final boolean retryable;

    OrchestrationPhase(String agentName, String errorCode, String failureMessage, boolean retryable) {
        this.agentName = agentName;
        this.errorCode = errorCode;
        this.failureMessage = failureMessage;
        this.retryable = retryable;
    }

    public String getAgentName() {
        return agentName;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public String getFailureMessage() {
        return failureMessage;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
