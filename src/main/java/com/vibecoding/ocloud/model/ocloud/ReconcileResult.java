package com.vibecoding.ocloud.model.ocloud;

import lombok.Getter;
import lombok.ToString;

import java.time.Duration;

/**
 * 재조정 사이클 결과 (재큐 여부와 지연)
 */
@Getter
@ToString
public class ReconcileResult {

    private final boolean requeue;
    private final Duration requeueAfter;
    private final String error;         // 실패 시 상태 메시지

    private ReconcileResult(boolean requeue, Duration requeueAfter, String error) {
        this.requeue = requeue;
        this.requeueAfter = requeueAfter;
        this.error = error;
    }

    public static ReconcileResult noRequeue() {
        return new ReconcileResult(false, Duration.ZERO, null);
    }

    public static ReconcileResult requeueAfter(Duration delay) {
        return new ReconcileResult(true, delay, null);
    }

    public static ReconcileResult failed(Duration delay, String error) {
        return new ReconcileResult(true, delay, error);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
