package com.vibecoding.ocloud.model.telemetry;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 텔레메트리 스냅샷
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TelemetryMetrics {
    private LocalDateTime timestamp;
    private String ocloudName;
    private int resourcePools;
    private long totalCpu;
    private long availableCpu;
    private long totalMemory;
    private long availableMemory;
    private long totalStorage;
    private long availableStorage;
    private int activeAllocations;
    private int errorCount;
    private int warningCount;
}
