package com.vibecoding.ocloud.exception;

/**
 * 워크플로우가 취소되었거나 기한을 넘겼을 때 발생하는 예외
 */
public class WorkflowCancelledException extends RuntimeException {

    public WorkflowCancelledException(String message) {
        super(message);
    }

    public WorkflowCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
