package com.vibecoding.ocloud.model.resource;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 풀 상태 스냅샷
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PoolStatus {
    private String name;
    private String type;
    private String location;
    private String status;
    private long totalCpu;
    private long availableCpu;
    private long totalMemory;
    private long availableMemory;
    private long totalStorage;
    private long availableStorage;
    private int allocationCount;
    private LocalDateTime lastUpdated;
}
