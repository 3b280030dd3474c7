package com.vibecoding.ocloud.model.orchestration;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * xApp 배포 명세
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class XAppSpec {
    private String name;
    private String version;
    private String framework;
    private String image;
    private ResourceRequests resources;
}
