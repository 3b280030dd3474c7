package com.vibecoding.ocloud.model.smo;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * 정책 액션
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PolicyAction {
    private String type;
    private String target;
    private Map<String, Object> parameters;
}
