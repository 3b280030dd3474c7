package com.vibecoding.ocloud.model.ocloud;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * SMO (Service Management and Orchestration) 연결 설정
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SmoConfig {
    private boolean enabled;
    private String endpoint;            // SMO API 기본 URL
    private String authType;            // 설정 시 Bearer 토큰 인증

    @Builder.Default
    private List<String> capabilities = new ArrayList<>();

    private boolean aimlEnabled;
}
