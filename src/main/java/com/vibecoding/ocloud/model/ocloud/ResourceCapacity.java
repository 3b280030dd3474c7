package com.vibecoding.ocloud.model.ocloud;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 리소스 용량 (단위 접미사가 붙은 수량 문자열, 예: "8", "16Gi", "500m")
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResourceCapacity {
    private String cpu;
    private String memory;
    private String storage;
    private String network;
}
