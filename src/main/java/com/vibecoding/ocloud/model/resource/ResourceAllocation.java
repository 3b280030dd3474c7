package com.vibecoding.ocloud.model.resource;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * 승인된 리소스 할당 (불변)
 */
@Value
@Builder
public class ResourceAllocation {
    public static final String STATUS_ALLOCATED = "allocated";

    String id;
    String requestId;
    String poolName;
    long cpu;
    long memory;
    long storage;
    long networkBandwidth;
    LocalDateTime allocatedAt;
    String status;
}
