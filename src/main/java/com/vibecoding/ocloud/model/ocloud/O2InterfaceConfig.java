package com.vibecoding.ocloud.model.ocloud;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * O2 인터페이스 설정
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class O2InterfaceConfig {
    private boolean enabled;
    private String version;

    @Builder.Default
    private List<String> endpoints = new ArrayList<>();

    private boolean authEnabled;
}
