package com.vibecoding.ocloud.model.smo;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

/**
 * SMO 등록용 O-Cloud 정보
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OCloudRegistration {
    private String id;
    private String name;
    private String description;
    private String infrastructureType;
    private List<String> regions;
    private List<SmoResourcePool> resourcePools;
    private String o2InterfaceVersion;
    private List<String> capabilities;
    private LocalDateTime registeredAt;
}
