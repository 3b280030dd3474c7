package com.vibecoding.ocloud.model.ocloud;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

/**
 * 리소스 풀 선언 (이름, 타입, 위치, 용량)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResourcePoolSpec {
    private String name;
    private String type;                // compute, network, storage
    private String location;

    @Builder.Default
    private ResourceCapacity capacity = new ResourceCapacity();

    @Builder.Default
    private Map<String, String> labels = new HashMap<>();
}
