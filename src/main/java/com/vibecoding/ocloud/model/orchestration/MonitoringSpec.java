package com.vibecoding.ocloud.model.orchestration;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 모니터링 구성
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MonitoringSpec {
    private boolean prometheus;
    private boolean grafana;
    private boolean jaeger;
    private boolean ves;
}
