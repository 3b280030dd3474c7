package com.vibecoding.ocloud.model.orchestration;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 배포 인텐트
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeploymentIntent {
    private String apiVersion;
    private String kind;
    private IntentMetadata metadata;
    private DeploymentSpec spec;
}
