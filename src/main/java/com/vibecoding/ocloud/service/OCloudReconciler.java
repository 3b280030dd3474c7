package com.vibecoding.ocloud.service;

import com.vibecoding.ocloud.config.ControlPlaneProperties;
import com.vibecoding.ocloud.model.o2.O2Alarm;
import com.vibecoding.ocloud.model.ocloud.Condition;
import com.vibecoding.ocloud.model.ocloud.O2InterfaceConfig;
import com.vibecoding.ocloud.model.ocloud.OCloud;
import com.vibecoding.ocloud.model.ocloud.OCloudPhase;
import com.vibecoding.ocloud.model.ocloud.OCloudStatus;
import com.vibecoding.ocloud.model.ocloud.ReconcileResult;
import com.vibecoding.ocloud.model.ocloud.ResourceInventory;
import com.vibecoding.ocloud.model.ocloud.ResourcePoolSpec;
import com.vibecoding.ocloud.model.ocloud.SmoConfig;
import com.vibecoding.ocloud.model.resource.UtilizationWarning;
import com.vibecoding.ocloud.model.smo.Alarm;
import com.vibecoding.ocloud.model.smo.ResourceUpdate;
import com.vibecoding.ocloud.model.telemetry.TelemetryMetrics;
import com.vibecoding.ocloud.repository.OCloudRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * O-Cloud 재조정 루프
 * - SMO -> O2 -> 리소스 풀 -> 인벤토리 -> 텔레메트리 순으로 수렴
 * - 첫 실패에서 중단하고 상태에 기록 (예외를 던지지 않음)
 */
@Service
@RequiredArgsConstructor
public class OCloudReconciler {

    private static final Logger log = LoggerFactory.getLogger(OCloudReconciler.class);

    public static final String MDC_CORRELATION_ID = "correlationId";

    public static final String SMO_DISABLED = "Disabled";
    public static final String SMO_DISCONNECTED = "Disconnected";
    public static final String SMO_REGISTRATION_FAILED = "Registration Failed";
    public static final String SMO_CONNECTED = "Connected";

    public static final String O2_DISABLED = "Disabled";
    public static final String O2_INITIALIZATION_FAILED = "Initialization Failed";
    public static final String O2_API_SERVER_FAILED = "API Server Failed";
    public static final String O2_ACTIVE = "Active";

    public static final String CONDITION_SMO = "SMOReconciled";
    public static final String CONDITION_O2 = "O2Reconciled";
    public static final String CONDITION_POOLS = "PoolsReconciled";
    public static final String CONDITION_INVENTORY = "InventoryUpdated";
    public static final String CONDITION_TELEMETRY = "TelemetryCollected";
    public static final String CONDITION_READY = "Ready";

    static final String READY_MESSAGE = "O-Cloud is operational";

    private final OCloudRepository ocloudRepository;
    private final CloudResourceManager resourceManager;
    private final TelemetryManager telemetryManager;
    private final SmoClient smoClient;
    private final O2InterfaceService o2InterfaceService;
    private final PoolNamespaceProvisioner namespaceProvisioner;
    private final ControlPlaneProperties properties;

    /**
     * 재조정 한 사이클 실행
     */
    public ReconcileResult reconcile(String name) {
        String correlationId = UUID.randomUUID().toString();
        MDC.put(MDC_CORRELATION_ID, correlationId);
        try {
            log.info("Starting O-Cloud reconciliation: {}", name);

            Optional<OCloud> ocloudOpt = ocloudRepository.findByName(name);
            if (ocloudOpt.isEmpty()) {
                log.debug("O-Cloud {} not found, likely deleted", name);
                return ReconcileResult.noRequeue();
            }

            OCloud ocloud = ocloudOpt.get();
            if (ocloud.getStatus() == null) {
                ocloud.setStatus(new OCloudStatus());
            }
            OCloudStatus status = ocloud.getStatus();
            if (status.getPhase() == null) {
                status.setPhase(OCloudPhase.INITIALIZING);
                status.setResourceInventory(new ResourceInventory());
            }

            for (ReconcileStep step : ReconcileStep.values()) {
                status.setPhase(step.getPhase());
                log.debug("Reconcile step {} for {}", step.getPhase().getDisplayName(), name);
                try {
                    Condition condition = runStep(step, ocloud);
                    status.upsertCondition(condition);
                } catch (Exception e) {
                    return fail(ocloud, step, e);
                }
            }

            status.setPhase(OCloudPhase.READY);
            status.setMessage(READY_MESSAGE);
            status.setLastReconciled(LocalDateTime.now());
            status.upsertCondition(condition(CONDITION_READY, Condition.TRUE, "Reconciled", READY_MESSAGE));
            ocloudRepository.saveStatus(name, status);

            log.info("O-Cloud reconciliation completed successfully: {}", name);
            return ReconcileResult.requeueAfter(properties.getReconcile().getSuccessRequeue());
        } catch (Exception e) {
            // 저장소 오류 등 단계 밖의 실패
            log.error("O-Cloud reconciliation aborted: {}", name, e);
            return ReconcileResult.failed(properties.getReconcile().getErrorRequeue(), e.getMessage());
        } finally {
            MDC.remove(MDC_CORRELATION_ID);
        }
    }

    private Condition runStep(ReconcileStep step, OCloud ocloud) {
        switch (step) {
            case SMO:
                return reconcileSmo(ocloud);
            case O2:
                return reconcileO2Interface(ocloud);
            case POOLS:
                return reconcileResourcePools(ocloud);
            case INVENTORY:
                return updateResourceInventory(ocloud);
            case TELEMETRY:
                return collectTelemetry(ocloud);
            default:
                throw new IllegalStateException("Unknown reconcile step: " + step);
        }
    }

    private ReconcileResult fail(OCloud ocloud, ReconcileStep step, Exception e) {
        String message = step.getLabel() + " reconciliation failed: " + e.getMessage();
        log.error("{} ({})", message, ocloud.getName());

        OCloudStatus status = ocloud.getStatus();
        status.setPhase(OCloudPhase.ERROR);
        status.setMessage(message);
        status.setLastReconciled(LocalDateTime.now());
        status.upsertCondition(condition(step.getConditionType(), Condition.FALSE, "ReconcileFailed", e.getMessage()));
        status.upsertCondition(condition(CONDITION_READY, Condition.FALSE, "ReconcileFailed", message));
        ocloudRepository.saveStatus(ocloud.getName(), status);

        return ReconcileResult.failed(properties.getReconcile().getErrorRequeue(), message);
    }

    /**
     * SMO 연결 및 등록
     */
    private Condition reconcileSmo(OCloud ocloud) {
        SmoConfig smo = ocloud.getSpec().getSmo();
        OCloudStatus status = ocloud.getStatus();

        if (smo == null || !smo.isEnabled()) {
            status.setSmoStatus(SMO_DISABLED);
            return condition(CONDITION_SMO, Condition.TRUE, "Disabled", "SMO integration disabled");
        }

        try {
            smoClient.connect(smo);
        } catch (RuntimeException e) {
            status.setSmoStatus(SMO_DISCONNECTED);
            throw e;
        }

        try {
            smoClient.registerOCloud(ocloud);
        } catch (RuntimeException e) {
            status.setSmoStatus(SMO_REGISTRATION_FAILED);
            throw e;
        }

        status.setSmoStatus(SMO_CONNECTED);
        log.info("SMO reconciled for {}: {}", ocloud.getName(), smo.getEndpoint());
        return condition(CONDITION_SMO, Condition.TRUE, "Connected", "Registered with SMO at " + smo.getEndpoint());
    }

    /**
     * O2 인터페이스 초기화 및 게이트웨이 활성화
     */
    private Condition reconcileO2Interface(OCloud ocloud) {
        O2InterfaceConfig o2 = ocloud.getSpec().getO2Interface();
        OCloudStatus status = ocloud.getStatus();

        if (o2 == null || !o2.isEnabled()) {
            status.setO2Status(O2_DISABLED);
            return condition(CONDITION_O2, Condition.TRUE, "Disabled", "O2 interface disabled");
        }

        try {
            o2InterfaceService.initialize(o2);
        } catch (RuntimeException e) {
            status.setO2Status(O2_INITIALIZATION_FAILED);
            throw e;
        }

        try {
            o2InterfaceService.activate();
        } catch (RuntimeException e) {
            status.setO2Status(O2_API_SERVER_FAILED);
            throw e;
        }

        status.setO2Status(O2_ACTIVE);
        return condition(CONDITION_O2, Condition.TRUE, "Active", "O2 interface " + o2.getVersion() + " active");
    }

    /**
     * 선언된 풀 보장 및 네임스페이스/쿼터 적용
     */
    private Condition reconcileResourcePools(OCloud ocloud) {
        List<ResourcePoolSpec> pools = ocloud.getSpec().getResourcePools();
        for (ResourcePoolSpec pool : pools) {
            resourceManager.ensureResourcePool(pool);
            namespaceProvisioner.provision(pool);
        }
        log.info("Reconciled {} resource pool(s) for {}", pools.size(), ocloud.getName());
        return condition(CONDITION_POOLS, Condition.TRUE, "PoolsEnsured", pools.size() + " resource pool(s) ensured");
    }

    /**
     * 인벤토리 갱신 (SMO 연결 시 변경 통지, 실패는 경고만)
     */
    private Condition updateResourceInventory(OCloud ocloud) {
        ResourceInventory inventory = resourceManager.getResourceInventory(ocloud.getSpec().getResourcePools());
        ocloud.getStatus().setResourceInventory(inventory);
        log.info("Resource inventory updated for {}: cpu {}/{}", ocloud.getName(),
            inventory.getAvailableCpu(), inventory.getTotalCpu());

        SmoConfig smo = ocloud.getSpec().getSmo();
        if (SMO_CONNECTED.equals(ocloud.getStatus().getSmoStatus())) {
            try {
                smoClient.reportResourceUpdate(smo, ResourceUpdate.builder()
                    .oCloudId(ocloud.getName())
                    .resourceType("inventory")
                    .resourceId(ocloud.getName())
                    .updateType("updated")
                    .newValue(inventoryValues(inventory))
                    .timestamp(LocalDateTime.now())
                    .build());
            } catch (RuntimeException e) {
                log.warn("Failed to report inventory to SMO for {}: {}", ocloud.getName(), e.getMessage());
            }
        }
        return condition(CONDITION_INVENTORY, Condition.TRUE, "InventoryUpdated", "Resource inventory updated");
    }

    /**
     * 텔레메트리 기록 및 사용률 경고 알람
     */
    private Condition collectTelemetry(OCloud ocloud) {
        List<ResourcePoolSpec> pools = ocloud.getSpec().getResourcePools();
        Set<String> poolNames = pools.stream().map(ResourcePoolSpec::getName).collect(Collectors.toSet());

        List<UtilizationWarning> warnings = resourceManager.optimizeResourceAllocation().stream()
            .filter(w -> poolNames.contains(w.getPoolName()))
            .collect(Collectors.toList());

        int errors = 0;
        for (UtilizationWarning warning : warnings) {
            if (!raiseUtilizationAlarm(ocloud, warning)) {
                errors++;
            }
        }

        int activeAllocations = 0;
        for (String poolName : poolNames) {
            if (resourceManager.getPoolStatus(poolName).isPresent()) {
                activeAllocations += resourceManager.listAllocations(poolName).size();
            }
        }

        ResourceInventory inventory = ocloud.getStatus().getResourceInventory();
        telemetryManager.recordMetrics(TelemetryMetrics.builder()
            .timestamp(LocalDateTime.now())
            .ocloudName(ocloud.getName())
            .resourcePools(pools.size())
            .totalCpu(inventory.getTotalCpu())
            .availableCpu(inventory.getAvailableCpu())
            .totalMemory(inventory.getTotalMemory())
            .availableMemory(inventory.getAvailableMemory())
            .totalStorage(inventory.getTotalStorage())
            .availableStorage(inventory.getAvailableStorage())
            .activeAllocations(activeAllocations)
            .errorCount(errors)
            .warningCount(warnings.size())
            .build());

        return condition(CONDITION_TELEMETRY, Condition.TRUE, "TelemetryRecorded", "Telemetry snapshot recorded");
    }

    /**
     * 풀당 미확인 알람은 하나만 유지, SMO 전송 실패 시 false
     */
    private boolean raiseUtilizationAlarm(OCloud ocloud, UtilizationWarning warning) {
        if (o2InterfaceService.findActiveAlarm("resource", warning.getPoolName()).isPresent()) {
            return true;
        }

        String description = String.format("High utilization in pool %s: CPU %.1f%%, memory %.1f%% (threshold %.0f%%)",
            warning.getPoolName(), warning.getCpuUtilization(), warning.getMemoryUtilization(), warning.getThreshold());
        O2Alarm alarm = o2InterfaceService.raiseAlarm("resource", "warning", warning.getPoolName(), description);

        if (!SMO_CONNECTED.equals(ocloud.getStatus().getSmoStatus())) {
            return true;
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("ocloud", ocloud.getName());
        details.put("cpuUtilization", warning.getCpuUtilization());
        details.put("memoryUtilization", warning.getMemoryUtilization());
        try {
            smoClient.sendAlarm(ocloud.getSpec().getSmo(), Alarm.builder()
                .id(alarm.getId())
                .type(alarm.getType())
                .severity(alarm.getSeverity())
                .source(alarm.getSource())
                .description(description)
                .details(details)
                .timestamp(alarm.getTimestamp())
                .build());
            return true;
        } catch (RuntimeException e) {
            log.warn("Failed to send alarm {} to SMO: {}", alarm.getId(), e.getMessage());
            return false;
        }
    }

    private static Map<String, Object> inventoryValues(ResourceInventory inventory) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("totalCpu", inventory.getTotalCpu());
        values.put("availableCpu", inventory.getAvailableCpu());
        values.put("totalMemory", inventory.getTotalMemory());
        values.put("availableMemory", inventory.getAvailableMemory());
        values.put("totalStorage", inventory.getTotalStorage());
        values.put("availableStorage", inventory.getAvailableStorage());
        values.put("resourceTypes", inventory.getResourceTypes());
        return values;
    }

    private static Condition condition(String type, String status, String reason, String message) {
        return Condition.builder()
            .type(type)
            .status(status)
            .lastTransitionTime(LocalDateTime.now())
            .reason(reason)
            .message(message)
            .build();
    }

    /**
     * 재조정 단계 (실행 순서)
     */
    private enum ReconcileStep {
        SMO(OCloudPhase.SMO_RECONCILING, "SMO", CONDITION_SMO),
        O2(OCloudPhase.O2_RECONCILING, "O2 interface", CONDITION_O2),
        POOLS(OCloudPhase.POOL_RECONCILING, "Resource pool", CONDITION_POOLS),
        INVENTORY(OCloudPhase.INVENTORY_UPDATING, "Inventory", CONDITION_INVENTORY),
        TELEMETRY(OCloudPhase.TELEMETRY_COLLECTING, "Telemetry", CONDITION_TELEMETRY);

        private final OCloudPhase phase;
        private final String label;
        private final String conditionType;

        ReconcileStep(OCloudPhase phase, String label, String conditionType) {
            this.phase = phase;
            this.label = label;
            this.conditionType = conditionType;
        }

        OCloudPhase getPhase() {
            return phase;
        }

        String getLabel() {
            return label;
        }

        String getConditionType() {
            return conditionType;
        }
    }
}
