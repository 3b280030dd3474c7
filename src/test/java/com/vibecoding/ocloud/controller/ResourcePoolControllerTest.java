package com.vibecoding.ocloud.controller;

import com.vibecoding.ocloud.exception.InsufficientCapacityException;
import com.vibecoding.ocloud.exception.ResourceNotFoundException;
import com.vibecoding.ocloud.model.resource.ResourceAllocation;
import com.vibecoding.ocloud.model.resource.ResourceRequest;
import com.vibecoding.ocloud.service.CloudResourceManager;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * 리소스 풀 / 할당 API 테스트
 */
@WebMvcTest(ResourcePoolController.class)
class ResourcePoolControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private CloudResourceManager resourceManager;

    @Test
    @DisplayName("할당 성공은 201, 경로의 풀 이름 사용")
    void testAllocate() throws Exception {
        when(resourceManager.allocateResources(any(ResourceRequest.class))).thenReturn(ResourceAllocation.builder()
            .id("alloc-1").poolName("edge-1").cpu(4).status(ResourceAllocation.STATUS_ALLOCATED).build());

        mockMvc.perform(post("/api/v1/pools/edge-1/allocations")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"id\":\"req-1\",\"poolName\":\"other\",\"cpu\":4}"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.id").value("alloc-1"));

        ArgumentCaptor<ResourceRequest> captor = ArgumentCaptor.forClass(ResourceRequest.class);
        verify(resourceManager).allocateResources(captor.capture());
        assertEquals("edge-1", captor.getValue().getPoolName());
    }

    @Test
    @DisplayName("용량 부족은 409 와 상세 정보")
    void testAllocateInsufficient() throws Exception {
        when(resourceManager.allocateResources(any(ResourceRequest.class)))
            .thenThrow(new InsufficientCapacityException("CPU", 6, 4));

        mockMvc.perform(post("/api/v1/pools/edge-1/allocations")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"cpu\":6}"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.message").value("insufficient CPU: requested 6, available 4"))
            .andExpect(jsonPath("$.details.dimension").value("CPU"))
            .andExpect(jsonPath("$.details.available").value(4));
    }

    @Test
    @DisplayName("할당 조회와 중복 해제")
    void testGetAndRelease() throws Exception {
        when(resourceManager.getAllocation("alloc-1")).thenReturn(Optional.empty());
        mockMvc.perform(get("/api/v1/allocations/alloc-1"))
            .andExpect(status().isNotFound());

        doThrow(new ResourceNotFoundException("allocation alloc-1 not found"))
            .when(resourceManager).releaseResources("alloc-1");
        mockMvc.perform(delete("/api/v1/allocations/alloc-1"))
            .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("잘못된 JSON 본문은 400")
    void testMalformedBody() throws Exception {
        mockMvc.perform(post("/api/v1/pools/edge-1/allocations")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"cpu\":"))
            .andExpect(status().isBadRequest());
    }
}
