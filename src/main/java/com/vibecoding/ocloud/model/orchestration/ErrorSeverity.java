package com.vibecoding.ocloud.model.orchestration;

/**
 * 오케스트레이션 오류 심각도
 */
public enum ErrorSeverity {
    INFO,
    WARNING,
    ERROR,
    CRITICAL
}
