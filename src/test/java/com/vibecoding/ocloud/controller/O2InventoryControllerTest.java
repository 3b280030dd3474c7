package com.vibecoding.ocloud.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vibecoding.ocloud.exception.ResourceNotFoundException;
import com.vibecoding.ocloud.model.o2.O2Deployment;
import com.vibecoding.ocloud.model.o2.O2ResourceCapacity;
import com.vibecoding.ocloud.model.o2.O2ResourcePool;
import com.vibecoding.ocloud.model.o2.O2Subscription;
import com.vibecoding.ocloud.service.O2InterfaceService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * O2 IMS API 테스트
 */
@WebMvcTest({O2InventoryController.class, O2AlarmController.class})
class O2InventoryControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private O2InterfaceService o2Service;

    @Test
    @DisplayName("리소스 풀 목록")
    void testListResourcePools() throws Exception {
        when(o2Service.listResourcePools()).thenReturn(List.of(O2ResourcePool.builder()
            .id("pool-1")
            .name("edge-1")
            .type("compute")
            .capacity(O2ResourceCapacity.builder().computeUnits(8).memoryGB(16).storageGB(100).build())
            .available(O2ResourceCapacity.builder().computeUnits(4).memoryGB(8).storageGB(100).build())
            .build()));

        mockMvc.perform(get("/o2ims/v1/resourcePools"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].id").value("pool-1"))
            .andExpect(jsonPath("$[0].available.computeUnits").value(4));
    }

    @Test
    @DisplayName("리소스 풀 생성은 201")
    void testCreateResourcePool() throws Exception {
        O2ResourcePool request = O2ResourcePool.builder()
            .name("edge-2")
            .type("compute")
            .capacity(O2ResourceCapacity.builder().computeUnits(4).memoryGB(8).storageGB(50).build())
            .build();
        when(o2Service.createResourcePool(any(O2ResourcePool.class))).thenAnswer(inv -> {
            O2ResourcePool pool = inv.getArgument(0);
            pool.setId("pool-new");
            return pool;
        });

        mockMvc.perform(post("/o2ims/v1/resourcePools")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.id").value("pool-new"))
            .andExpect(jsonPath("$.name").value("edge-2"));
    }

    @Test
    @DisplayName("없는 배포 조회는 404, 삭제는 항상 204")
    void testDeploymentNotFoundAndDelete() throws Exception {
        when(o2Service.getDeployment("dep-missing")).thenReturn(Optional.empty());

        mockMvc.perform(get("/o2ims/v1/deployments/dep-missing"))
            .andExpect(status().isNotFound());

        mockMvc.perform(delete("/o2ims/v1/deployments/dep-missing"))
            .andExpect(status().isNoContent());
        verify(o2Service).deleteDeployment("dep-missing");
    }

    @Test
    @DisplayName("배포 조회")
    void testGetDeployment() throws Exception {
        when(o2Service.getDeployment("dep-1")).thenReturn(Optional.of(O2Deployment.builder()
            .id("dep-1").name("ric-a").status(O2InterfaceService.STATUS_RUNNING).build()));

        mockMvc.perform(get("/o2ims/v1/deployments/dep-1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("running"));
    }

    @Test
    @DisplayName("알람 확인 응답과 없는 알람 404")
    void testAcknowledgeAlarm() throws Exception {
        mockMvc.perform(post("/o2ims/v1/alarms/alarm-1/acknowledge"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("acknowledged"));

        doThrow(new ResourceNotFoundException("alarm alarm-2 not found")).when(o2Service).acknowledgeAlarm("alarm-2");
        mockMvc.perform(post("/o2ims/v1/alarms/alarm-2/acknowledge"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.status").value(404))
            .andExpect(jsonPath("$.message").value("alarm alarm-2 not found"));
    }

    @Test
    @DisplayName("구독 생성 201, 삭제 204")
    void testSubscriptions() throws Exception {
        when(o2Service.createSubscription(any(O2Subscription.class))).thenAnswer(inv -> {
            O2Subscription subscription = inv.getArgument(0);
            subscription.setId("sub-1");
            subscription.setActive(true);
            return subscription;
        });

        mockMvc.perform(post("/o2ims/v1/subscriptions")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"type\":\"alarms\",\"callback\":\"http://listener/cb\"}"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.id").value("sub-1"))
            .andExpect(jsonPath("$.active").value(true));

        mockMvc.perform(delete("/o2ims/v1/subscriptions/sub-1"))
            .andExpect(status().isNoContent());
    }

    @Test
    @DisplayName("health 응답")
    void testHealth() throws Exception {
        when(o2Service.health()).thenReturn(Map.of("status", "healthy", "version", "v1"));

        mockMvc.perform(get("/o2ims/v1/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("healthy"));
    }
}
