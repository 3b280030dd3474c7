package com.vibecoding.ocloud.model.resource;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

/**
 * 리소스 할당 요청
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResourceRequest {
    private String id;                  // 요청 ID
    private String poolName;            // 대상 풀
    private long cpu;
    private long memory;                // bytes
    private long storage;               // bytes
    private long networkBandwidth;
    private int priority;

    @Builder.Default
    private Map<String, String> constraints = new HashMap<>();
}
