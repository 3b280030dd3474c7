package com.vibecoding.ocloud.model.smo;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * SMO 정책
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Policy {
    private String id;
    private String name;
    private String type;
    private int priority;
    private List<PolicyCondition> conditions;
    private List<PolicyAction> actions;
    private Map<String, Object> parameters;
    private LocalDateTime validFrom;
    private LocalDateTime validUntil;
}
