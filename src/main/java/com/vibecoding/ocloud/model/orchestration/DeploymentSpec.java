package com.vibecoding.ocloud.model.orchestration;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 배포 명세
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeploymentSpec {
    private String ricType;             // near-rt, non-rt
    private PlatformSpec platform;
    @JsonProperty("xapps")
    private List<XAppSpec> xApps;
    private InterfaceSpec interfaces;
    private SecuritySpec security;
    private MonitoringSpec monitoring;
}
