package com.vibecoding.ocloud.exception;

/**
 * 리소스 수량 문자열을 해석할 수 없을 때 발생하는 예외
 */
public class InvalidQuantityException extends RuntimeException {

    public InvalidQuantityException(String message) {
        super(message);
    }

    public InvalidQuantityException(String message, Throwable cause) {
        super(message, cause);
    }
}
