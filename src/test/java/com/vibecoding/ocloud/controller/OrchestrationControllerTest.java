package com.vibecoding.ocloud.controller;

import com.vibecoding.ocloud.exception.OrchestrationException;
import com.vibecoding.ocloud.model.orchestration.DeploymentIntent;
import com.vibecoding.ocloud.model.orchestration.ErrorSeverity;
import com.vibecoding.ocloud.model.orchestration.WorkflowRecord;
import com.vibecoding.ocloud.model.orchestration.WorkflowState;
import com.vibecoding.ocloud.orchestrator.DeploymentOrchestrator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * 배포 워크플로우 API 테스트
 */
@WebMvcTest(OrchestrationController.class)
class OrchestrationControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private DeploymentOrchestrator orchestrator;

    @Test
    @DisplayName("제출은 202 와 PENDING 기록, xapps 필드 역직렬화")
    void testSubmit() throws Exception {
        when(orchestrator.submit(any(DeploymentIntent.class))).thenReturn(WorkflowRecord.builder()
            .id("wf-1").intentName("ric-a").state(WorkflowState.PENDING).build());

        mockMvc.perform(post("/api/v1/orchestrations")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"kind\":\"DeploymentIntent\",\"metadata\":{\"name\":\"ric-a\"},"
                    + "\"spec\":{\"ricType\":\"near-rt\",\"xapps\":[{\"name\":\"kpimon\"}]}}"))
            .andExpect(status().isAccepted())
            .andExpect(jsonPath("$.id").value("wf-1"))
            .andExpect(jsonPath("$.state").value("PENDING"));

        ArgumentCaptor<DeploymentIntent> captor = ArgumentCaptor.forClass(DeploymentIntent.class);
        verify(orchestrator).submit(captor.capture());
        assertEquals("kpimon", captor.getValue().getSpec().getXApps().get(0).getName());
    }

    @Test
    @DisplayName("이름 없는 인텐트는 400")
    void testSubmitWithoutName() throws Exception {
        when(orchestrator.submit(any(DeploymentIntent.class)))
            .thenThrow(new IllegalArgumentException("metadata.name is required"));

        mockMvc.perform(post("/api/v1/orchestrations")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"spec\":{}}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value("metadata.name is required"));
    }

    @Test
    @DisplayName("오케스트레이션 오류는 500 과 코드/재시도 여부")
    void testOrchestrationErrorBody() throws Exception {
        when(orchestrator.cancel("wf-1")).thenThrow(OrchestrationException.builder()
            .code("NF_DEPLOYMENT_FAILED")
            .message("Failed to deploy network functions: timeout")
            .severity(ErrorSeverity.ERROR)
            .retryable(true)
            .correlationId("corr-1")
            .build());

        mockMvc.perform(post("/api/v1/orchestrations/wf-1/cancel"))
            .andExpect(status().isInternalServerError())
            .andExpect(jsonPath("$.details.code").value("NF_DEPLOYMENT_FAILED"))
            .andExpect(jsonPath("$.details.retryable").value(true))
            .andExpect(jsonPath("$.details.correlationId").value("corr-1"));
    }

    @Test
    @DisplayName("이미 끝난 워크플로우 취소는 409")
    void testCancelFinished() throws Exception {
        when(orchestrator.cancel("wf-2")).thenThrow(new IllegalStateException("workflow wf-2 already finished as SUCCEEDED"));

        mockMvc.perform(post("/api/v1/orchestrations/wf-2/cancel"))
            .andExpect(status().isConflict());
    }
}
