package com.vibecoding.ocloud.model.orchestration;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * CPU/메모리 요청량
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResourceRequests {
    private String cpu;
    private String memory;
}
