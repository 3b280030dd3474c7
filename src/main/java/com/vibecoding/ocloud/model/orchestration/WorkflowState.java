package com.vibecoding.ocloud.model.orchestration;

/**
 * 워크플로우 상태
 */
public enum WorkflowState {
    PENDING,
    RUNNING,
    SUCCEEDED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == CANCELLED;
    }
}
