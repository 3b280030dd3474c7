package com.vibecoding.ocloud.model.resource;

import com.vibecoding.ocloud.model.ocloud.ResourcePoolSpec;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 관리 중인 리소스 풀 (용량 및 할당 상태)
 * <p>
 * CloudResourceManager 의 락 안에서만 변경된다.
 */
@Getter
@Setter
public class ManagedResourcePool {
    public static final String STATUS_ACTIVE = "active";

    private ResourcePoolSpec pool;
    private long totalCpu;
    private long totalMemory;
    private long totalStorage;
    private long allocatedCpu;
    private long allocatedMemory;
    private long allocatedStorage;
    private final Map<String, ResourceAllocation> allocations = new LinkedHashMap<>();
    private LocalDateTime lastUpdated;
    private String status = STATUS_ACTIVE;

    public ManagedResourcePool(ResourcePoolSpec pool, long totalCpu, long totalMemory, long totalStorage) {
        this.pool = pool;
        this.totalCpu = totalCpu;
        this.totalMemory = totalMemory;
        this.totalStorage = totalStorage;
        this.lastUpdated = LocalDateTime.now();
    }

    public long getAvailableCpu() {
        return totalCpu - allocatedCpu;
    }

    public long getAvailableMemory() {
        return totalMemory - allocatedMemory;
    }

    public long getAvailableStorage() {
        return totalStorage - allocatedStorage;
    }

    public Map<String, ResourceAllocation> getAllocations() {
        return Collections.unmodifiableMap(allocations);
    }

    /**
     * 할당 반영
     */
    public void commit(ResourceAllocation allocation) {
        allocatedCpu += allocation.getCpu();
        allocatedMemory += allocation.getMemory();
        allocatedStorage += allocation.getStorage();
        allocations.put(allocation.getId(), allocation);
        lastUpdated = LocalDateTime.now();
    }

    /**
     * 할당 해제 반영
     */
    public void revoke(ResourceAllocation allocation) {
        allocatedCpu -= allocation.getCpu();
        allocatedMemory -= allocation.getMemory();
        allocatedStorage -= allocation.getStorage();
        allocations.remove(allocation.getId());
        lastUpdated = LocalDateTime.now();
    }
}
