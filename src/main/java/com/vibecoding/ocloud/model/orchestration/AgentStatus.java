package com.vibecoding.ocloud.model.orchestration;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 서브 에이전트 상태
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentStatus {
    private String name;
    private boolean healthy;
    private LocalDateTime lastSeen;
}
