package com.vibecoding.ocloud.model.smo;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * 리소스 변경 통지
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResourceUpdate {
    @JsonProperty("oCloudId")
    private String oCloudId;
    private String resourceType;
    private String resourceId;
    private String updateType;          // created, updated, deleted
    private Map<String, Object> oldValue;
    private Map<String, Object> newValue;
    private LocalDateTime timestamp;
}
