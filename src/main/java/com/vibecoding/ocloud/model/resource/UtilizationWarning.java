package com.vibecoding.ocloud.model.resource;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 사용률 임계치 초과 경고
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UtilizationWarning {
    private String poolName;
    private double cpuUtilization;
    private double memoryUtilization;
    private double threshold;
}
