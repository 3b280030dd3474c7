package com.vibecoding.ocloud.exception;

/**
 * Kubernetes API 호출 중 발생하는 예외
 */
public class ClusterApiException extends RuntimeException {

    public ClusterApiException(String message) {
        super(message);
    }

    public ClusterApiException(String message, Throwable cause) {
        super(message, cause);
    }
}
