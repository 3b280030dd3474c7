package com.vibecoding.ocloud.service;

import com.vibecoding.ocloud.config.ControlPlaneProperties;
import com.vibecoding.ocloud.exception.InsufficientCapacityException;
import com.vibecoding.ocloud.exception.InvalidQuantityException;
import com.vibecoding.ocloud.exception.ResourceNotFoundException;
import com.vibecoding.ocloud.model.ocloud.ResourceCapacity;
import com.vibecoding.ocloud.model.ocloud.ResourceInventory;
import com.vibecoding.ocloud.model.ocloud.ResourcePoolSpec;
import com.vibecoding.ocloud.model.resource.ManagedResourcePool;
import com.vibecoding.ocloud.model.resource.PoolStatus;
import com.vibecoding.ocloud.model.resource.PoolUtilization;
import com.vibecoding.ocloud.model.resource.ResourceAllocation;
import com.vibecoding.ocloud.model.resource.ResourceRequest;
import com.vibecoding.ocloud.model.resource.UtilizationWarning;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Collectors;

/**
 * 리소스 풀 용량 관리 서비스
 * - 풀 맵과 전역 할당 인덱스는 하나의 RW 락으로 보호
 */
@Service
@RequiredArgsConstructor
public class CloudResourceManager {

    private static final Logger log = LoggerFactory.getLogger(CloudResourceManager.class);

    private final ControlPlaneProperties properties;

    // 풀 이름 -> 관리 풀
    private final Map<String, ManagedResourcePool> resourcePools = new HashMap<>();

    // 할당 ID -> 할당 (전역 추적)
    private final Map<String, ResourceAllocation> resourceTracking = new HashMap<>();

    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    /**
     * 리소스 풀 생성 또는 갱신 (기존 할당은 유지, 상태 스냅샷 반환)
     */
    public PoolStatus ensureResourcePool(ResourcePoolSpec spec) {
        if (spec == null || spec.getName() == null || spec.getName().isBlank()) {
            throw new IllegalArgumentException("resource pool name is required");
        }
        log.info("Ensuring resource pool: {} (type: {})", spec.getName(), spec.getType());

        ResourceCapacity capacity = spec.getCapacity() != null ? spec.getCapacity() : new ResourceCapacity();
        long cpu = parseCapacity("CPU", capacity.getCpu());
        long memory = parseCapacity("memory", capacity.getMemory());
        long storage = parseCapacity("storage", capacity.getStorage());

        lock.writeLock().lock();
        try {
            ManagedResourcePool pool = resourcePools.get(spec.getName());
            if (pool == null) {
                pool = new ManagedResourcePool(spec, cpu, memory, storage);
                resourcePools.put(spec.getName(), pool);
                log.info("Resource pool created: {} (cpu: {}, memory: {}, storage: {})",
                    spec.getName(), cpu, memory, storage);
                return toStatus(spec.getName(), pool);
            }

            // 할당량 아래로 축소 불가
            if (cpu < pool.getAllocatedCpu()) {
                throw new InsufficientCapacityException("CPU", pool.getAllocatedCpu(), cpu);
            }
            if (memory < pool.getAllocatedMemory()) {
                throw new InsufficientCapacityException("memory", pool.getAllocatedMemory(), memory);
            }
            if (storage < pool.getAllocatedStorage()) {
                throw new InsufficientCapacityException("storage", pool.getAllocatedStorage(), storage);
            }

            pool.setPool(spec);
            pool.setTotalCpu(cpu);
            pool.setTotalMemory(memory);
            pool.setTotalStorage(storage);
            pool.setLastUpdated(LocalDateTime.now());
            log.info("Resource pool updated: {} (cpu: {}, memory: {}, storage: {}, allocations kept: {})",
                spec.getName(), cpu, memory, storage, pool.getAllocations().size());
            return toStatus(spec.getName(), pool);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * 새 리소스 풀 생성 (같은 이름이 있으면 거부)
     */
    public PoolStatus createResourcePool(ResourcePoolSpec spec) {
        if (spec == null || spec.getName() == null || spec.getName().isBlank()) {
            throw new IllegalArgumentException("resource pool name is required");
        }
        ResourceCapacity capacity = spec.getCapacity() != null ? spec.getCapacity() : new ResourceCapacity();
        long cpu = parseCapacity("CPU", capacity.getCpu());
        long memory = parseCapacity("memory", capacity.getMemory());
        long storage = parseCapacity("storage", capacity.getStorage());

        lock.writeLock().lock();
        try {
            if (resourcePools.containsKey(spec.getName())) {
                throw new IllegalStateException("resource pool " + spec.getName() + " already exists");
            }
            ManagedResourcePool pool = new ManagedResourcePool(spec, cpu, memory, storage);
            resourcePools.put(spec.getName(), pool);
            log.info("Resource pool created: {} (cpu: {}, memory: {}, storage: {})",
                spec.getName(), cpu, memory, storage);
            return toStatus(spec.getName(), pool);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * 리소스 할당 (CPU, memory, storage 순으로 가용량 검사)
     */
    public ResourceAllocation allocateResources(ResourceRequest request) {
        log.info("Allocating resources: request={}, pool={}", request.getId(), request.getPoolName());

        if (request.getCpu() < 0 || request.getMemory() < 0 || request.getStorage() < 0
            || request.getNetworkBandwidth() < 0) {
            throw new InvalidQuantityException("resource request quantities must not be negative");
        }

        lock.writeLock().lock();
        try {
            ManagedResourcePool pool = resourcePools.get(request.getPoolName());
            if (pool == null) {
                throw new ResourceNotFoundException("resource pool " + request.getPoolName() + " not found");
            }

            if (request.getCpu() > pool.getAvailableCpu()) {
                throw new InsufficientCapacityException("CPU", request.getCpu(), pool.getAvailableCpu());
            }
            if (request.getMemory() > pool.getAvailableMemory()) {
                throw new InsufficientCapacityException("memory", request.getMemory(), pool.getAvailableMemory());
            }
            if (request.getStorage() > pool.getAvailableStorage()) {
                throw new InsufficientCapacityException("storage", request.getStorage(), pool.getAvailableStorage());
            }

            ResourceAllocation allocation = ResourceAllocation.builder()
                .id("alloc-" + UUID.randomUUID())
                .requestId(request.getId())
                .poolName(request.getPoolName())
                .cpu(request.getCpu())
                .memory(request.getMemory())
                .storage(request.getStorage())
                .networkBandwidth(request.getNetworkBandwidth())
                .allocatedAt(LocalDateTime.now())
                .status(ResourceAllocation.STATUS_ALLOCATED)
                .build();

            pool.commit(allocation);
            resourceTracking.put(allocation.getId(), allocation);

            log.info("Resources allocated: {} (cpu: {}, memory: {}, storage: {})",
                allocation.getId(), allocation.getCpu(), allocation.getMemory(), allocation.getStorage());
            return allocation;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * 할당 해제
     */
    public void releaseResources(String allocationId) {
        log.info("Releasing resources: {}", allocationId);

        lock.writeLock().lock();
        try {
            ResourceAllocation allocation = resourceTracking.get(allocationId);
            if (allocation == null) {
                throw new ResourceNotFoundException("allocation " + allocationId + " not found");
            }

            ManagedResourcePool pool = resourcePools.get(allocation.getPoolName());
            if (pool == null) {
                throw new ResourceNotFoundException("resource pool " + allocation.getPoolName() + " not found");
            }

            pool.revoke(allocation);
            resourceTracking.remove(allocationId);

            log.info("Resources released: {} (cpu: {}, memory: {}, storage: {})",
                allocationId, allocation.getCpu(), allocation.getMemory(), allocation.getStorage());
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * 지정한 풀들의 인벤토리 합산 (존재하지 않는 풀은 무시)
     */
    public ResourceInventory getResourceInventory(List<ResourcePoolSpec> pools) {
        lock.readLock().lock();
        try {
            ResourceInventory inventory = new ResourceInventory();
            for (ResourcePoolSpec spec : pools) {
                ManagedResourcePool pool = resourcePools.get(spec.getName());
                if (pool == null) {
                    continue;
                }
                inventory.setTotalCpu(inventory.getTotalCpu() + pool.getTotalCpu());
                inventory.setAvailableCpu(inventory.getAvailableCpu() + pool.getAvailableCpu());
                inventory.setTotalMemory(inventory.getTotalMemory() + pool.getTotalMemory());
                inventory.setAvailableMemory(inventory.getAvailableMemory() + pool.getAvailableMemory());
                inventory.setTotalStorage(inventory.getTotalStorage() + pool.getTotalStorage());
                inventory.setAvailableStorage(inventory.getAvailableStorage() + pool.getAvailableStorage());
                inventory.getResourceTypes().merge(spec.getType(), 1, Integer::sum);
            }
            log.debug("Resource inventory calculated: cpu {}/{}", inventory.getAvailableCpu(), inventory.getTotalCpu());
            return inventory;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * 풀 사용률 조회
     */
    public PoolUtilization getPoolUtilization(String poolName) {
        lock.readLock().lock();
        try {
            ManagedResourcePool pool = resourcePools.get(poolName);
            if (pool == null) {
                throw new ResourceNotFoundException("resource pool " + poolName + " not found");
            }
            return PoolUtilization.builder()
                .poolName(poolName)
                .cpuUtilization(percent(pool.getAllocatedCpu(), pool.getTotalCpu()))
                .memoryUtilization(percent(pool.getAllocatedMemory(), pool.getTotalMemory()))
                .storageUtilization(percent(pool.getAllocatedStorage(), pool.getTotalStorage()))
                .allocationCount(pool.getAllocations().size())
                .timestamp(LocalDateTime.now())
                .build();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * 전체 풀 상태 (이름순)
     */
    public List<PoolStatus> getAllPoolStatus() {
        lock.readLock().lock();
        try {
            return resourcePools.entrySet().stream()
                .map(entry -> toStatus(entry.getKey(), entry.getValue()))
                .sorted(Comparator.comparing(PoolStatus::getName))
                .collect(Collectors.toList());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * 풀 상태 단건 조회
     */
    public Optional<PoolStatus> getPoolStatus(String poolName) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(resourcePools.get(poolName))
                .map(pool -> toStatus(poolName, pool));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * 할당 조회
     */
    public Optional<ResourceAllocation> getAllocation(String allocationId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(resourceTracking.get(allocationId));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * 풀의 할당 목록
     */
    public List<ResourceAllocation> listAllocations(String poolName) {
        lock.readLock().lock();
        try {
            ManagedResourcePool pool = resourcePools.get(poolName);
            if (pool == null) {
                throw new ResourceNotFoundException("resource pool " + poolName + " not found");
            }
            return new ArrayList<>(pool.getAllocations().values());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * 전체 활성 할당 수
     */
    public int countAllocations() {
        lock.readLock().lock();
        try {
            return resourceTracking.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * 사용률 임계치를 넘는 풀 탐지 (재배치는 하지 않음)
     */
    public List<UtilizationWarning> optimizeResourceAllocation() {
        log.info("Starting resource optimization");
        double threshold = properties.getResources().getUtilizationThreshold();

        List<UtilizationWarning> warnings = new ArrayList<>();
        lock.readLock().lock();
        try {
            List<String> names = new ArrayList<>(resourcePools.keySet());
            names.sort(Comparator.naturalOrder());
            for (String name : names) {
                ManagedResourcePool pool = resourcePools.get(name);
                double cpuUtil = percent(pool.getAllocatedCpu(), pool.getTotalCpu());
                double memUtil = percent(pool.getAllocatedMemory(), pool.getTotalMemory());
                if (cpuUtil > threshold || memUtil > threshold) {
                    log.warn("Pool utilization high, consider rebalancing: {} (cpu: {}%, memory: {}%)",
                        name, String.format("%.1f", cpuUtil), String.format("%.1f", memUtil));
                    warnings.add(UtilizationWarning.builder()
                        .poolName(name)
                        .cpuUtilization(cpuUtil)
                        .memoryUtilization(memUtil)
                        .threshold(threshold)
                        .build());
                }
            }
        } finally {
            lock.readLock().unlock();
        }

        log.info("Resource optimization completed: {} warning(s)", warnings.size());
        return warnings;
    }

    /**
     * 풀 제거 (할당이 남아 있으면 거부)
     */
    public void removeResourcePool(String poolName) {
        lock.writeLock().lock();
        try {
            ManagedResourcePool pool = resourcePools.get(poolName);
            if (pool == null) {
                throw new ResourceNotFoundException("resource pool " + poolName + " not found");
            }
            if (!pool.getAllocations().isEmpty()) {
                throw new IllegalStateException("resource pool " + poolName + " has "
                    + pool.getAllocations().size() + " outstanding allocation(s)");
            }
            resourcePools.remove(poolName);
            log.info("Resource pool removed: {}", poolName);
        } finally {
            lock.writeLock().unlock();
        }
    }

    private long parseCapacity(String dimension, String value) {
        try {
            return ResourceQuantityParser.parse(value);
        } catch (InvalidQuantityException e) {
            throw new InvalidQuantityException("failed to parse " + dimension + " capacity: " + e.getMessage(), e);
        }
    }

    private PoolStatus toStatus(String name, ManagedResourcePool pool) {
        return PoolStatus.builder()
            .name(name)
            .type(pool.getPool().getType())
            .location(pool.getPool().getLocation())
            .status(pool.getStatus())
            .totalCpu(pool.getTotalCpu())
            .availableCpu(pool.getAvailableCpu())
            .totalMemory(pool.getTotalMemory())
            .availableMemory(pool.getAvailableMemory())
            .totalStorage(pool.getTotalStorage())
            .availableStorage(pool.getAvailableStorage())
            .allocationCount(pool.getAllocations().size())
            .lastUpdated(pool.getLastUpdated())
            .build();
    }

    private static double percent(long used, long total) {
        if (total == 0) {
            return 0.0;
        }
        return (double) used / (double) total * 100.0;
    }
}
