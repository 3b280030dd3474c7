package com.vibecoding.ocloud.model.orchestration;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * 인텐트 메타데이터
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IntentMetadata {
    private String name;
    private String namespace;
    private Map<String, String> labels;
}
