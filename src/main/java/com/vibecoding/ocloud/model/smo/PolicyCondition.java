package com.vibecoding.ocloud.model.smo;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 정책 조건
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PolicyCondition {
    private String type;
    private String operator;
    private String value;
}
