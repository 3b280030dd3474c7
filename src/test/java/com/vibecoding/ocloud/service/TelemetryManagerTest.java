package com.vibecoding.ocloud.service;

import com.vibecoding.ocloud.config.ControlPlaneProperties;
import com.vibecoding.ocloud.model.telemetry.TelemetryMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 텔레메트리 저장소 테스트
 */
class TelemetryManagerTest {

    private TelemetryManager telemetryManager;

    @BeforeEach
    void setUp() {
        ControlPlaneProperties properties = new ControlPlaneProperties();
        properties.getTelemetry().setMaxEntries(3);
        telemetryManager = new TelemetryManager(properties);
    }

    @Test
    @DisplayName("최대 개수를 넘으면 오래된 것부터 제거")
    void testEvictsOldest() {
        for (int i = 1; i <= 5; i++) {
            telemetryManager.recordMetrics(snapshot("oc-a", i));
        }

        assertEquals(3, telemetryManager.size());
        List<TelemetryMetrics> metrics = telemetryManager.getMetrics(10);
        assertEquals(3L, metrics.get(0).getTotalCpu());
        assertEquals(5L, metrics.get(2).getTotalCpu());
    }

    @Test
    @DisplayName("O-Cloud 별 최근 N 개를 시간순으로 반환")
    void testFilterByOCloud() {
        telemetryManager.recordMetrics(snapshot("oc-a", 1));
        telemetryManager.recordMetrics(snapshot("oc-b", 2));
        telemetryManager.recordMetrics(snapshot("oc-a", 3));

        List<TelemetryMetrics> metrics = telemetryManager.getMetrics("oc-a", 5);
        assertEquals(2, metrics.size());
        assertEquals(1L, metrics.get(0).getTotalCpu());
        assertEquals(3L, metrics.get(1).getTotalCpu());

        assertEquals(1, telemetryManager.getMetrics("oc-a", 1).size());
        assertTrue(telemetryManager.getMetrics("oc-a", 0).isEmpty());
    }

    private static TelemetryMetrics snapshot(String name, long cpu) {
        return TelemetryMetrics.builder().ocloudName(name).totalCpu(cpu).build();
    }
}
