package com.vibecoding.ocloud.model.resource;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 풀 사용률 (%)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PoolUtilization {
    private String poolName;
    private double cpuUtilization;
    private double memoryUtilization;
    private double storageUtilization;
    private int allocationCount;
    private LocalDateTime timestamp;
}
