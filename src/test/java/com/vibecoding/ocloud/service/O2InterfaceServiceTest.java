package com.vibecoding.ocloud.service;

import com.vibecoding.ocloud.config.ControlPlaneProperties;
import com.vibecoding.ocloud.exception.ResourceNotFoundException;
import com.vibecoding.ocloud.model.o2.ComputeInventory;
import com.vibecoding.ocloud.model.o2.O2Alarm;
import com.vibecoding.ocloud.model.o2.O2Deployment;
import com.vibecoding.ocloud.model.o2.O2ResourceCapacity;
import com.vibecoding.ocloud.model.o2.O2ResourcePool;
import com.vibecoding.ocloud.model.o2.StorageInventory;
import com.vibecoding.ocloud.model.ocloud.O2InterfaceConfig;
import com.vibecoding.ocloud.model.ocloud.ResourceCapacity;
import com.vibecoding.ocloud.model.ocloud.ResourcePoolSpec;
import com.vibecoding.ocloud.model.resource.PoolStatus;
import com.vibecoding.ocloud.model.resource.ResourceRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * O2 인터페이스 게이트웨이 테스트
 */
class O2InterfaceServiceTest {

    private static final long GI = 1024L * 1024 * 1024;

    private CloudResourceManager resourceManager;
    private O2InterfaceService o2Service;

    @BeforeEach
    void setUp() {
        resourceManager = new CloudResourceManager(new ControlPlaneProperties());
        o2Service = new O2InterfaceService(resourceManager);
    }

    @Test
    @DisplayName("버전 없이 초기화 불가, 초기화 전 활성화 불가")
    void testLifecycle() {
        assertThrows(IllegalStateException.class, () -> o2Service.activate());
        assertThrows(IllegalArgumentException.class, () -> o2Service.initialize(new O2InterfaceConfig()));

        o2Service.initialize(O2InterfaceConfig.builder().enabled(true).version("v2").build());
        o2Service.activate();

        assertTrue(o2Service.isActive());
        assertEquals("healthy", o2Service.health().get("status"));
        assertEquals("v2", o2Service.info().get("version"));
    }

    @Test
    @DisplayName("O2 로 만든 풀은 리소스 관리자에 생성되고 가용량은 실시간 계산")
    void testCreatePoolTracksManager() {
        O2ResourcePool created = o2Service.createResourcePool(O2ResourcePool.builder()
            .name("o2-pool")
            .type("compute")
            .location("site-b")
            .capacity(O2ResourceCapacity.builder().computeUnits(16).memoryGB(32).storageGB(200).build())
            .build());

        assertTrue(created.getId().startsWith("pool-"));
        assertEquals(16L, resourceManager.getPoolStatus("o2-pool").orElseThrow().getTotalCpu());
        assertEquals(32 * GI, resourceManager.getPoolStatus("o2-pool").orElseThrow().getTotalMemory());

        resourceManager.allocateResources(ResourceRequest.builder().poolName("o2-pool").cpu(4).memory(8 * GI).build());

        O2ResourcePool fetched = o2Service.getResourcePool(created.getId()).orElseThrow();
        assertEquals(12L, fetched.getAvailable().getComputeUnits());
        assertEquals(24L, fetched.getAvailable().getMemoryGB());
        assertEquals(1, o2Service.listResourcePools().size());
        assertEquals(created.getId(), o2Service.listResourcePools().get(0).getId());
    }

    @Test
    @DisplayName("없는 풀 삭제는 무시, 할당이 남은 풀 삭제는 거부")
    void testDeletePool() {
        o2Service.deleteResourcePool("pool-missing");

        O2ResourcePool created = o2Service.createResourcePool(O2ResourcePool.builder()
            .name("busy").type("compute")
            .capacity(O2ResourceCapacity.builder().computeUnits(2).memoryGB(2).storageGB(2).build())
            .build());
        resourceManager.allocateResources(ResourceRequest.builder().poolName("busy").cpu(1).build());

        assertThrows(IllegalStateException.class, () -> o2Service.deleteResourcePool(created.getId()));
        assertTrue(o2Service.getResourcePool(created.getId()).isPresent());
    }

    @Test
    @DisplayName("배포 생성은 pending, 상태 변경, 없는 배포는 not found")
    void testDeployments() {
        O2Deployment deployment = o2Service.createDeployment(O2Deployment.builder().name("near-rt-ric").build());

        assertTrue(deployment.getId().startsWith("dep-"));
        assertEquals(O2InterfaceService.STATUS_PENDING, deployment.getStatus());
        assertNotNull(deployment.getCreatedAt());

        o2Service.updateDeploymentStatus(deployment.getId(), O2InterfaceService.STATUS_RUNNING);
        assertEquals(O2InterfaceService.STATUS_RUNNING, o2Service.getDeployment(deployment.getId()).orElseThrow().getStatus());

        assertThrows(ResourceNotFoundException.class,
            () -> o2Service.updateDeploymentStatus("dep-missing", O2InterfaceService.STATUS_RUNNING));
    }

    @Test
    @DisplayName("인벤토리는 풀 타입별로 집계")
    void testInventoryByType() {
        o2Service.createResourcePool(O2ResourcePool.builder().name("c1").type("compute")
            .capacity(O2ResourceCapacity.builder().computeUnits(8).memoryGB(16).storageGB(10).build()).build());
        o2Service.createResourcePool(O2ResourcePool.builder().name("s1").type("storage")
            .capacity(O2ResourceCapacity.builder().computeUnits(0).memoryGB(0).storageGB(500).build()).build());

        ComputeInventory compute = o2Service.getComputeInventory();
        assertEquals(1, compute.getPoolCount());
        assertEquals(8L, compute.getTotalCores());
        assertEquals(16L, compute.getTotalMemoryGB());

        StorageInventory storage = o2Service.getStorageInventory();
        assertEquals(1, storage.getPoolCount());
        assertEquals(500L, storage.getTotalCapacityGB());

        assertEquals(0, o2Service.getNetworkInventory().getPoolCount());
    }

    @Test
    @DisplayName("알람 확인 후에는 미확인 알람으로 조회되지 않음")
    void testAlarmAcknowledge() {
        O2Alarm alarm = o2Service.raiseAlarm("resource", "warning", "edge-1", "High utilization");
        assertTrue(o2Service.findActiveAlarm("resource", "edge-1").isPresent());

        o2Service.acknowledgeAlarm(alarm.getId());

        assertTrue(o2Service.findActiveAlarm("resource", "edge-1").isEmpty());
        assertTrue(o2Service.getAlarm(alarm.getId()).orElseThrow().isAcknowledged());
        assertThrows(ResourceNotFoundException.class, () -> o2Service.acknowledgeAlarm("alarm-missing"));
    }

    @Test
    @DisplayName("이미 있는 이름으로 풀 생성은 거부되고 기존 풀은 그대로")
    void testCreatePoolWithExistingName() {
        resourceManager.ensureResourcePool(ResourcePoolSpec.builder()
            .name("edge-1").type("compute").location("site-a")
            .capacity(ResourceCapacity.builder().cpu("8").memory("16Gi").storage("100Gi").build())
            .build());

        assertThrows(IllegalStateException.class, () -> o2Service.createResourcePool(O2ResourcePool.builder()
            .name("edge-1").type("network")
            .capacity(O2ResourceCapacity.builder().computeUnits(1).memoryGB(1).storageGB(1).build())
            .build()));

        PoolStatus pool = resourceManager.getPoolStatus("edge-1").orElseThrow();
        assertEquals(8L, pool.getTotalCpu());
        assertEquals("compute", pool.getType());
        assertEquals(1, o2Service.listResourcePools().size());
        assertEquals("edge-1", o2Service.listResourcePools().get(0).getId());
    }

    @Test
    @DisplayName("조회 결과나 생성 요청 객체를 바꿔도 저장된 배포는 변하지 않음")
    void testDeploymentsAreCopied() {
        List<String> resources = new ArrayList<>(List.of("alloc-1"));
        O2Deployment request = O2Deployment.builder().name("near-rt-ric").resources(resources).build();
        O2Deployment created = o2Service.createDeployment(request);

        assertNull(request.getId());
        request.setName("changed");
        resources.add("alloc-2");
        created.setStatus(O2InterfaceService.STATUS_RUNNING);
        o2Service.getDeployment(created.getId()).orElseThrow().setStatus(O2InterfaceService.STATUS_RUNNING);
        o2Service.listDeployments().get(0).getResources().clear();

        O2Deployment stored = o2Service.getDeployment(created.getId()).orElseThrow();
        assertEquals("near-rt-ric", stored.getName());
        assertEquals(O2InterfaceService.STATUS_PENDING, stored.getStatus());
        assertEquals(List.of("alloc-1"), stored.getResources());
    }

    @Test
    @DisplayName("조회한 알람을 바꿔도 확인 상태는 acknowledge 로만 변경")
    void testAlarmsAreCopied() {
        O2Alarm alarm = o2Service.raiseAlarm("resource", "warning", "edge-1", "High utilization");

        o2Service.getAlarm(alarm.getId()).orElseThrow().setAcknowledged(true);
        alarm.setAcknowledged(true);

        assertTrue(o2Service.findActiveAlarm("resource", "edge-1").isPresent());
    }
}
