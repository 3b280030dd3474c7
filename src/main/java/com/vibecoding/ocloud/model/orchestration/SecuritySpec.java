package com.vibecoding.ocloud.model.orchestration;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 보안 요구사항
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SecuritySpec {
    private boolean zeroTrust;
    private boolean mtls;
    private boolean imageSigning;
    private boolean runtimeScan;
    private List<String> compliance;
}
