package com.vibecoding.ocloud.exception;

import lombok.Getter;

/**
 * SMO 호출 실패 (비 2xx 응답 또는 I/O 오류)
 */
@Getter
public class SmoClientException extends RuntimeException {

    private final int statusCode;       // I/O 오류는 0

    public SmoClientException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public SmoClientException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 0;
    }
}
