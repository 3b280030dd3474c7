package com.vibecoding.ocloud.exception;

import lombok.Getter;

/**
 * 풀의 가용 용량이 요청보다 작을 때 발생하는 예외
 */
@Getter
public class InsufficientCapacityException extends RuntimeException {

    private final String dimension;     // CPU, memory, storage
    private final long requested;
    private final long available;

    public InsufficientCapacityException(String dimension, long requested, long available) {
        super(String.format("insufficient %s: requested %d, available %d", dimension, requested, available));
        this.dimension = dimension;
        this.requested = requested;
        this.available = available;
    }
}
