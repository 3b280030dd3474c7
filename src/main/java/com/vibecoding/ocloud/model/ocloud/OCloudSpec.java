package com.vibecoding.ocloud.model.ocloud;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * O-Cloud 원하는 상태
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OCloudSpec {
    @Builder.Default
    private SmoConfig smo = new SmoConfig();

    @Builder.Default
    private List<ResourcePoolSpec> resourcePools = new ArrayList<>();

    @Builder.Default
    private O2InterfaceConfig o2Interface = new O2InterfaceConfig();

    private String infrastructureType;  // kubernetes, openstack 등

    @Builder.Default
    private List<String> regions = new ArrayList<>();
}
