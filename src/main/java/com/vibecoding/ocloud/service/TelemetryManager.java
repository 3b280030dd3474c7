package com.vibecoding.ocloud.service;

import com.vibecoding.ocloud.config.ControlPlaneProperties;
import com.vibecoding.ocloud.model.telemetry.TelemetryMetrics;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 텔레메트리 스냅샷 저장소 (최대 개수 초과 시 오래된 것부터 제거)
 */
@Service
@RequiredArgsConstructor
public class TelemetryManager {

    private static final Logger log = LoggerFactory.getLogger(TelemetryManager.class);

    private final ControlPlaneProperties properties;

    private final Deque<TelemetryMetrics> metrics = new ArrayDeque<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    /**
     * 스냅샷 기록
     */
    public void recordMetrics(TelemetryMetrics snapshot) {
        log.debug("Recording telemetry metrics: {}", snapshot.getOcloudName());

        int maxEntries = properties.getTelemetry().getMaxEntries();
        lock.writeLock().lock();
        try {
            metrics.addLast(snapshot);
            while (metrics.size() > maxEntries) {
                metrics.removeFirst();
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * 최근 스냅샷 (오래된 것 -> 최신 순)
     */
    public List<TelemetryMetrics> getMetrics(int limit) {
        return getMetrics(null, limit);
    }

    /**
     * O-Cloud 별 최근 스냅샷 (ocloudName 이 null 이면 전체)
     */
    public List<TelemetryMetrics> getMetrics(String ocloudName, int limit) {
        if (limit <= 0) {
            return Collections.emptyList();
        }

        lock.readLock().lock();
        try {
            List<TelemetryMetrics> result = new ArrayList<>();
            Iterator<TelemetryMetrics> it = metrics.descendingIterator();
            while (it.hasNext() && result.size() < limit) {
                TelemetryMetrics entry = it.next();
                if (ocloudName == null || ocloudName.equals(entry.getOcloudName())) {
                    result.add(entry);
                }
            }
            Collections.reverse(result);
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return metrics.size();
        } finally {
            lock.readLock().unlock();
        }
    }
}
