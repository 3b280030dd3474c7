package com.vibecoding.ocloud.model.orchestration;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * O-RAN 인터페이스 설정
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InterfaceConfig {
    private boolean enabled;
    private String version;
    private String security;
}
