package com.vibecoding.ocloud.model.ocloud;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;
import java.util.TreeMap;

/**
 * 리소스 인벤토리 스냅샷
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResourceInventory {
    private long totalCpu;
    private long availableCpu;
    private long totalMemory;
    private long availableMemory;
    private long totalStorage;
    private long availableStorage;

    @Builder.Default
    private Map<String, Integer> resourceTypes = new TreeMap<>(); // 풀 타입별 개수
}
