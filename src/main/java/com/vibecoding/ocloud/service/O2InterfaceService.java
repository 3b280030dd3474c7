package com.vibecoding.ocloud.service;

import com.vibecoding.ocloud.exception.ResourceNotFoundException;
import com.vibecoding.ocloud.model.o2.ComputeInventory;
import com.vibecoding.ocloud.model.o2.NetworkInventory;
import com.vibecoding.ocloud.model.o2.O2Alarm;
import com.vibecoding.ocloud.model.o2.O2Deployment;
import com.vibecoding.ocloud.model.o2.O2Inventory;
import com.vibecoding.ocloud.model.o2.O2Resource;
import com.vibecoding.ocloud.model.o2.O2ResourceCapacity;
import com.vibecoding.ocloud.model.o2.O2ResourcePool;
import com.vibecoding.ocloud.model.o2.O2Subscription;
import com.vibecoding.ocloud.model.o2.StorageInventory;
import com.vibecoding.ocloud.model.ocloud.O2InterfaceConfig;
import com.vibecoding.ocloud.model.ocloud.ResourceCapacity;
import com.vibecoding.ocloud.model.ocloud.ResourcePoolSpec;
import com.vibecoding.ocloud.model.resource.PoolStatus;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Collectors;

/**
 * O2-IMS 게이트웨이 상태 관리 서비스
 * - 리소스/배포/알람/구독 저장소는 RW 락으로 보호
 * - 리소스 풀은 CloudResourceManager 를 기준으로 실시간 계산
 */
@Service
@RequiredArgsConstructor
public class O2InterfaceService {

    private static final Logger log = LoggerFactory.getLogger(O2InterfaceService.class);

    public static final String STATUS_ACTIVE = "active";
    public static final String STATUS_PENDING = "pending";
    public static final String STATUS_RUNNING = "running";

    private static final long GI = 1024L * 1024 * 1024;

    private static final List<String> CAPABILITIES = List.of(
        "resource-management",
        "deployment-management",
        "inventory-tracking",
        "alarm-management",
        "subscription-management"
    );

    private final CloudResourceManager resourceManager;

    private final Map<String, String> poolIds = new HashMap<>();                 // O2 풀 ID -> 풀 이름
    private final Map<String, O2Resource> resources = new LinkedHashMap<>();
    private final Map<String, O2Deployment> deployments = new LinkedHashMap<>();
    private final Map<String, O2Alarm> alarms = new LinkedHashMap<>();
    private final Map<String, O2Subscription> subscriptions = new LinkedHashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private volatile O2InterfaceConfig config = new O2InterfaceConfig();
    private volatile boolean initialized;
    private volatile boolean active;
    private volatile LocalDateTime startedAt;

    // ===== Lifecycle =====

    /**
     * O2 인터페이스 초기화 (버전 필수)
     */
    public void initialize(O2InterfaceConfig newConfig) {
        if (newConfig == null || newConfig.getVersion() == null || newConfig.getVersion().isBlank()) {
            throw new IllegalArgumentException("O2 interface version is required");
        }
        log.info("Initializing O2 interface: version={}, authEnabled={}", newConfig.getVersion(), newConfig.isAuthEnabled());

        this.config = newConfig;
        this.initialized = true;
        log.info("O2 interface initialized successfully");
    }

    /**
     * API 게이트웨이 활성화 (이미 활성 상태면 그대로 유지)
     */
    public void activate() {
        if (!initialized) {
            throw new IllegalStateException("O2 interface is not initialized");
        }
        if (!active) {
            startedAt = LocalDateTime.now();
            active = true;
            log.info("O2 API gateway activated at /o2ims/v1");
        }
    }

    public boolean isActive() {
        return active;
    }

    public O2InterfaceConfig getConfig() {
        return config;
    }

    // ===== Resource pools =====

    /**
     * 전체 리소스 풀 (O2 로 생성하지 않은 풀은 이름을 ID 로 사용)
     */
    public List<O2ResourcePool> listResourcePools() {
        Map<String, String> idsByName = new HashMap<>();
        lock.readLock().lock();
        try {
            poolIds.forEach((id, name) -> idsByName.put(name, id));
        } finally {
            lock.readLock().unlock();
        }

        List<O2ResourcePool> result = new ArrayList<>();
        for (PoolStatus status : resourceManager.getAllPoolStatus()) {
            result.add(toO2Pool(idsByName.getOrDefault(status.getName(), status.getName()), status));
        }
        return result;
    }

    public Optional<O2ResourcePool> getResourcePool(String poolId) {
        String name = resolvePoolName(poolId);
        return resourceManager.getPoolStatus(name).map(status -> toO2Pool(poolId, status));
    }

    /**
     * 리소스 풀 생성 (computeUnits -> cpu, memoryGB/storageGB -> Gi, 같은 이름이 있으면 409)
     */
    public O2ResourcePool createResourcePool(O2ResourcePool pool) {
        if (pool.getName() == null || pool.getName().isBlank()) {
            throw new IllegalArgumentException("resource pool name is required");
        }
        String id = "pool-" + UUID.randomUUID();
        resourceManager.createResourcePool(toSpec(pool));

        lock.writeLock().lock();
        try {
            poolIds.put(id, pool.getName());
        } finally {
            lock.writeLock().unlock();
        }

        log.info("Created resource pool: {} ({})", id, pool.getName());
        return getResourcePool(id).orElseThrow(() -> new IllegalStateException("pool vanished after creation: " + id));
    }

    /**
     * 리소스 풀 갱신 (기존 할당 유지)
     */
    public O2ResourcePool updateResourcePool(String poolId, O2ResourcePool pool) {
        String name = resolvePoolName(poolId);
        pool.setName(name);
        resourceManager.ensureResourcePool(toSpec(pool));

        log.info("Updated resource pool: {} ({})", poolId, name);
        return getResourcePool(poolId).orElseThrow(() -> new ResourceNotFoundException("resource pool " + poolId + " not found"));
    }

    /**
     * 리소스 풀 삭제 (없으면 무시, 할당이 남아 있으면 거부)
     */
    public void deleteResourcePool(String poolId) {
        String name = resolvePoolName(poolId);
        if (resourceManager.getPoolStatus(name).isPresent()) {
            resourceManager.removeResourcePool(name);
        }

        lock.writeLock().lock();
        try {
            poolIds.remove(poolId);
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Deleted resource pool: {}", poolId);
    }

    // ===== Resources =====

    public List<O2Resource> listResources() {
        lock.readLock().lock();
        try {
            return resources.values().stream().map(O2InterfaceService::copy).collect(Collectors.toList());
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<O2Resource> getResource(String resourceId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(resources.get(resourceId)).map(O2InterfaceService::copy);
        } finally {
            lock.readLock().unlock();
        }
    }

    public O2Resource createResource(O2Resource request) {
        O2Resource resource = copy(request);
        resource.setId("res-" + UUID.randomUUID());
        resource.setCreatedAt(LocalDateTime.now());
        resource.setStatus(STATUS_ACTIVE);

        lock.writeLock().lock();
        try {
            resources.put(resource.getId(), resource);
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Created resource: {}", resource.getId());
        return copy(resource);
    }

    /**
     * 경로 ID 위치의 값을 교체 (본문 ID 는 무시)
     */
    public O2Resource updateResource(String resourceId, O2Resource request) {
        O2Resource resource = copy(request);
        resource.setId(resourceId);
        resource.setUpdatedAt(LocalDateTime.now());

        lock.writeLock().lock();
        try {
            resources.put(resourceId, resource);
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Updated resource: {}", resourceId);
        return copy(resource);
    }

    public void deleteResource(String resourceId) {
        lock.writeLock().lock();
        try {
            resources.remove(resourceId);
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Deleted resource: {}", resourceId);
    }

    // ===== Deployments =====

    public List<O2Deployment> listDeployments() {
        lock.readLock().lock();
        try {
            return deployments.values().stream().map(O2InterfaceService::copy).collect(Collectors.toList());
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<O2Deployment> getDeployment(String deploymentId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(deployments.get(deploymentId)).map(O2InterfaceService::copy);
        } finally {
            lock.readLock().unlock();
        }
    }

    public O2Deployment createDeployment(O2Deployment request) {
        O2Deployment deployment = copy(request);
        deployment.setId("dep-" + UUID.randomUUID());
        deployment.setCreatedAt(LocalDateTime.now());
        deployment.setStatus(STATUS_PENDING);

        lock.writeLock().lock();
        try {
            deployments.put(deployment.getId(), deployment);
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Created deployment: {}", deployment.getId());
        return copy(deployment);
    }

    public O2Deployment updateDeployment(String deploymentId, O2Deployment request) {
        O2Deployment deployment = copy(request);
        deployment.setId(deploymentId);
        deployment.setUpdatedAt(LocalDateTime.now());

        lock.writeLock().lock();
        try {
            deployments.put(deploymentId, deployment);
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Updated deployment: {}", deploymentId);
        return copy(deployment);
    }

    /**
     * 배포 상태만 변경
     */
    public O2Deployment updateDeploymentStatus(String deploymentId, String status) {
        lock.writeLock().lock();
        try {
            O2Deployment deployment = deployments.get(deploymentId);
            if (deployment == null) {
                throw new ResourceNotFoundException("deployment " + deploymentId + " not found");
            }
            deployment.setStatus(status);
            deployment.setUpdatedAt(LocalDateTime.now());
            log.info("Deployment {} is now {}", deploymentId, status);
            return copy(deployment);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void deleteDeployment(String deploymentId) {
        lock.writeLock().lock();
        try {
            deployments.remove(deploymentId);
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Deleted deployment: {}", deploymentId);
    }

    // ===== Inventory =====

    /**
     * 풀 타입별 인벤토리 집계
     */
    public O2Inventory getInventory() {
        List<PoolStatus> pools = resourceManager.getAllPoolStatus();
        return O2Inventory.builder()
            .timestamp(LocalDateTime.now())
            .compute(computeInventory(pools))
            .network(networkInventory(pools))
            .storage(storageInventory(pools))
            .build();
    }

    public ComputeInventory getComputeInventory() {
        return computeInventory(resourceManager.getAllPoolStatus());
    }

    public NetworkInventory getNetworkInventory() {
        return networkInventory(resourceManager.getAllPoolStatus());
    }

    public StorageInventory getStorageInventory() {
        return storageInventory(resourceManager.getAllPoolStatus());
    }

    // ===== Alarms =====

    /**
     * 알람 발생
     */
    public O2Alarm raiseAlarm(String type, String severity, String source, String description) {
        O2Alarm alarm = O2Alarm.builder()
            .id("alarm-" + UUID.randomUUID())
            .type(type)
            .severity(severity)
            .source(source)
            .description(description)
            .timestamp(LocalDateTime.now())
            .acknowledged(false)
            .build();

        lock.writeLock().lock();
        try {
            alarms.put(alarm.getId(), alarm);
        } finally {
            lock.writeLock().unlock();
        }
        log.warn("Alarm raised: {} [{}] {} - {}", alarm.getId(), severity, source, description);
        return alarm.toBuilder().build();
    }

    /**
     * 같은 타입/소스의 미확인 알람 조회
     */
    public Optional<O2Alarm> findActiveAlarm(String type, String source) {
        lock.readLock().lock();
        try {
            return alarms.values().stream()
                .filter(alarm -> !alarm.isAcknowledged())
                .filter(alarm -> type.equals(alarm.getType()) && source.equals(alarm.getSource()))
                .findFirst()
                .map(alarm -> alarm.toBuilder().build());
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<O2Alarm> listAlarms() {
        lock.readLock().lock();
        try {
            return alarms.values().stream().map(alarm -> alarm.toBuilder().build()).collect(Collectors.toList());
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<O2Alarm> getAlarm(String alarmId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(alarms.get(alarmId)).map(alarm -> alarm.toBuilder().build());
        } finally {
            lock.readLock().unlock();
        }
    }

    public void acknowledgeAlarm(String alarmId) {
        lock.writeLock().lock();
        try {
            O2Alarm alarm = alarms.get(alarmId);
            if (alarm == null) {
                throw new ResourceNotFoundException("alarm " + alarmId + " not found");
            }
            alarm.setAcknowledged(true);
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Acknowledged alarm: {}", alarmId);
    }

    // ===== Subscriptions =====

    public List<O2Subscription> listSubscriptions() {
        lock.readLock().lock();
        try {
            return subscriptions.values().stream().map(O2InterfaceService::copy).collect(Collectors.toList());
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<O2Subscription> getSubscription(String subscriptionId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(subscriptions.get(subscriptionId)).map(O2InterfaceService::copy);
        } finally {
            lock.readLock().unlock();
        }
    }

    public O2Subscription createSubscription(O2Subscription request) {
        O2Subscription subscription = copy(request);
        subscription.setId("sub-" + UUID.randomUUID());
        subscription.setActive(true);

        lock.writeLock().lock();
        try {
            subscriptions.put(subscription.getId(), subscription);
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Created subscription: {} ({})", subscription.getId(), subscription.getType());
        return copy(subscription);
    }

    public void deleteSubscription(String subscriptionId) {
        lock.writeLock().lock();
        try {
            subscriptions.remove(subscriptionId);
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Deleted subscription: {}", subscriptionId);
    }

    // ===== Health / Info =====

    public Map<String, Object> health() {
        Map<String, Object> health = new LinkedHashMap<>();
        health.put("status", active ? "healthy" : "inactive");
        health.put("timestamp", LocalDateTime.now());
        health.put("version", config.getVersion());
        health.put("uptime", startedAt != null ? Duration.between(startedAt, LocalDateTime.now()).toString() : "PT0S");
        return health;
    }

    public Map<String, Object> info() {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("name", "O-Cloud O2 Interface");
        info.put("version", config.getVersion());
        info.put("description", "O-RAN O2 Interface for cloud infrastructure management");
        info.put("endpoints", config.getEndpoints());
        info.put("capabilities", CAPABILITIES);
        return info;
    }

    // ===== Helpers =====

    private String resolvePoolName(String poolId) {
        lock.readLock().lock();
        try {
            return poolIds.getOrDefault(poolId, poolId);
        } finally {
            lock.readLock().unlock();
        }
    }

    // 저장소 밖으로 나가거나 들어오는 값은 항상 복사본
    private static O2Resource copy(O2Resource resource) {
        return resource.toBuilder()
            .properties(resource.getProperties() != null ? new LinkedHashMap<>(resource.getProperties()) : null)
            .build();
    }

    private static O2Deployment copy(O2Deployment deployment) {
        return deployment.toBuilder()
            .resources(deployment.getResources() != null ? new ArrayList<>(deployment.getResources()) : null)
            .parameters(deployment.getParameters() != null ? new LinkedHashMap<>(deployment.getParameters()) : null)
            .build();
    }

    private static O2Subscription copy(O2Subscription subscription) {
        return subscription.toBuilder()
            .filter(subscription.getFilter() != null ? new LinkedHashMap<>(subscription.getFilter()) : null)
            .build();
    }

    private ResourcePoolSpec toSpec(O2ResourcePool pool) {
        O2ResourceCapacity capacity = pool.getCapacity() != null ? pool.getCapacity() : new O2ResourceCapacity();
        return ResourcePoolSpec.builder()
            .name(pool.getName())
            .type(pool.getType())
            .location(pool.getLocation())
            .capacity(ResourceCapacity.builder()
                .cpu(String.valueOf(capacity.getComputeUnits()))
                .memory(capacity.getMemoryGB() + "Gi")
                .storage(capacity.getStorageGB() + "Gi")
                .build())
            .build();
    }

    private O2ResourcePool toO2Pool(String id, PoolStatus status) {
        return O2ResourcePool.builder()
            .id(id)
            .name(status.getName())
            .description(status.getType() + " resource pool at " + status.getLocation())
            .type(status.getType())
            .location(status.getLocation())
            .capacity(O2ResourceCapacity.builder()
                .computeUnits(status.getTotalCpu())
                .memoryGB(status.getTotalMemory() / GI)
                .storageGB(status.getTotalStorage() / GI)
                .build())
            .available(O2ResourceCapacity.builder()
                .computeUnits(status.getAvailableCpu())
                .memoryGB(status.getAvailableMemory() / GI)
                .storageGB(status.getAvailableStorage() / GI)
                .build())
            .build();
    }

    private ComputeInventory computeInventory(List<PoolStatus> pools) {
        ComputeInventory inventory = new ComputeInventory();
        for (PoolStatus pool : pools) {
            if ("compute".equals(pool.getType())) {
                inventory.setPoolCount(inventory.getPoolCount() + 1);
                inventory.setTotalCores(inventory.getTotalCores() + pool.getTotalCpu());
                inventory.setAvailableCores(inventory.getAvailableCores() + pool.getAvailableCpu());
                inventory.setTotalMemoryGB(inventory.getTotalMemoryGB() + pool.getTotalMemory() / GI);
                inventory.setAvailableMemoryGB(inventory.getAvailableMemoryGB() + pool.getAvailableMemory() / GI);
            }
        }
        return inventory;
    }

    private NetworkInventory networkInventory(List<PoolStatus> pools) {
        NetworkInventory inventory = new NetworkInventory();
        for (PoolStatus pool : pools) {
            if ("network".equals(pool.getType())) {
                inventory.setPoolCount(inventory.getPoolCount() + 1);
                inventory.setTotalCores(inventory.getTotalCores() + pool.getTotalCpu());
                inventory.setAvailableCores(inventory.getAvailableCores() + pool.getAvailableCpu());
                inventory.setTotalMemoryGB(inventory.getTotalMemoryGB() + pool.getTotalMemory() / GI);
                inventory.setAvailableMemoryGB(inventory.getAvailableMemoryGB() + pool.getAvailableMemory() / GI);
            }
        }
        return inventory;
    }

    private StorageInventory storageInventory(List<PoolStatus> pools) {
        StorageInventory inventory = new StorageInventory();
        for (PoolStatus pool : pools) {
            if ("storage".equals(pool.getType())) {
                inventory.setPoolCount(inventory.getPoolCount() + 1);
                inventory.setTotalCapacityGB(inventory.getTotalCapacityGB() + pool.getTotalStorage() / GI);
                inventory.setAvailableCapacityGB(inventory.getAvailableCapacityGB() + pool.getAvailableStorage() / GI);
            }
        }
        return inventory;
    }
}
