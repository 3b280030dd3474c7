package com.vibecoding.ocloud.model.orchestration;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 플랫폼 명세
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlatformSpec {
    private String version;
    private List<String> components;
    private ResourceRequests resources;
    private boolean ha;
    private String resourcePool;        // 인프라 할당 대상 풀
}
