package com.vibecoding.ocloud.model.ocloud;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * O-Cloud 리소스 (선언된 spec + 관측된 status)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OCloud {
    private String name;                // O-Cloud 이름 (식별자)
    private String namespace;           // 소속 네임스페이스 (선택적)
    private OCloudSpec spec;            // 원하는 상태
    private OCloudStatus status;        // 관측된 상태
}
