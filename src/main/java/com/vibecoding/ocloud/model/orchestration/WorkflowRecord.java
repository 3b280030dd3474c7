package com.vibecoding.ocloud.model.orchestration;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 배포 워크플로우 실행 기록
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class WorkflowRecord {
    private String id;
    private String correlationId;
    private String intentName;
    private WorkflowState state;
    private String currentPhase;

    @Builder.Default
    private List<String> completedPhases = new ArrayList<>();

    private String errorCode;
    private String errorMessage;
    private ErrorSeverity errorSeverity;
    private Boolean retryable;
    private LocalDateTime startedAt;
    private LocalDateTime finishedAt;
}
