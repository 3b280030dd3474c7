package com.vibecoding.ocloud.model.smo;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * SMO 형식의 리소스 용량
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SmoResourceCapacity {
    private String cpu;
    private String memory;
    private String storage;
    private String network;
}
