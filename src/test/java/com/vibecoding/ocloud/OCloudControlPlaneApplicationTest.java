package com.vibecoding.ocloud;

import com.vibecoding.ocloud.orchestrator.DeploymentOrchestrator;
import com.vibecoding.ocloud.service.CloudResourceManager;
import com.vibecoding.ocloud.service.PoolNamespaceProvisioner;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 애플리케이션 컨텍스트 로드 테스트 (Kubernetes 연동 비활성)
 */
@SpringBootTest
class OCloudControlPlaneApplicationTest {

    @Autowired
    private DeploymentOrchestrator orchestrator;

    @Autowired
    private CloudResourceManager resourceManager;

    @Autowired
    private PoolNamespaceProvisioner provisioner;

    @Test
    @DisplayName("컨텍스트 로드 및 폴백 등록")
    void contextLoads() {
        assertNotNull(resourceManager);
        assertNotNull(provisioner);
        assertTrue(orchestrator.listWorkflows().isEmpty());
        assertTrue(orchestrator.getAgentStatuses().isEmpty());
    }
}
