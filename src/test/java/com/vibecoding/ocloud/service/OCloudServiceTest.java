package com.vibecoding.ocloud.service;

import com.vibecoding.ocloud.exception.InvalidQuantityException;
import com.vibecoding.ocloud.exception.ResourceNotFoundException;
import com.vibecoding.ocloud.model.ocloud.OCloud;
import com.vibecoding.ocloud.model.ocloud.OCloudSpec;
import com.vibecoding.ocloud.model.ocloud.ResourceCapacity;
import com.vibecoding.ocloud.model.ocloud.ResourcePoolSpec;
import com.vibecoding.ocloud.model.ocloud.SmoConfig;
import com.vibecoding.ocloud.repository.OCloudRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * O-Cloud 선언 서비스 테스트
 */
@ExtendWith(MockitoExtension.class)
class OCloudServiceTest {

    @Mock
    private OCloudRepository ocloudRepository;

    @Mock
    private ReconcileScheduler reconcileScheduler;

    @Mock
    private TelemetryManager telemetryManager;

    @Mock
    private SmoClient smoClient;

    private OCloudService ocloudService;

    @BeforeEach
    void setUp() {
        ocloudService = new OCloudService(ocloudRepository, reconcileScheduler, telemetryManager, smoClient);
    }

    @Test
    @DisplayName("spec 저장 후 재조정 예약")
    void testApplyEnqueues() {
        OCloudSpec spec = spec(pool("edge-1", "8"));
        when(ocloudRepository.saveSpec("oc-a", "default", spec))
            .thenReturn(OCloud.builder().name("oc-a").spec(spec).build());

        OCloud saved = ocloudService.apply("oc-a", "default", spec);

        assertEquals("oc-a", saved.getName());
        verify(reconcileScheduler).enqueue("oc-a");
    }

    @Test
    @DisplayName("중복 풀 이름, 잘못된 용량, endpoint 없는 SMO 는 거부")
    void testApplyValidation() {
        assertThrows(IllegalArgumentException.class,
            () -> ocloudService.apply("oc-a", "default", spec(pool("p", "1"), pool("p", "2"))));
        assertThrows(InvalidQuantityException.class,
            () -> ocloudService.apply("oc-a", "default", spec(pool("p", "many"))));

        OCloudSpec smoWithoutEndpoint = spec(pool("p", "1"));
        smoWithoutEndpoint.setSmo(SmoConfig.builder().enabled(true).build());
        assertThrows(IllegalArgumentException.class,
            () -> ocloudService.apply("oc-a", "default", smoWithoutEndpoint));

        verify(ocloudRepository, never()).saveSpec(anyString(), anyString(), any());
        verifyNoInteractions(reconcileScheduler);
    }

    @Test
    @DisplayName("없는 O-Cloud 삭제/조회는 not found")
    void testNotFound() {
        when(ocloudRepository.existsByName("missing")).thenReturn(false);
        when(ocloudRepository.findByName("missing")).thenReturn(Optional.empty());

        assertThrows(ResourceNotFoundException.class, () -> ocloudService.delete("missing"));
        assertThrows(ResourceNotFoundException.class, () -> ocloudService.get("missing"));
        verify(reconcileScheduler, never()).forget(anyString());
    }

    @Test
    @DisplayName("삭제 시 대기 중인 재조정도 취소")
    void testDeleteForgets() {
        when(ocloudRepository.existsByName("oc-a")).thenReturn(true);

        ocloudService.delete("oc-a");

        verify(ocloudRepository).deleteByName("oc-a");
        verify(reconcileScheduler).forget("oc-a");
    }

    @Test
    @DisplayName("SMO 비활성 O-Cloud 의 정책 조회는 거부")
    void testPoliciesRequireSmo() {
        when(ocloudRepository.findByName("oc-a"))
            .thenReturn(Optional.of(OCloud.builder().name("oc-a").spec(spec()).build()));

        assertThrows(IllegalStateException.class, () -> ocloudService.policies("oc-a"));
        verify(smoClient, never()).getPolicies(any(), eq("oc-a"));
    }

    private static OCloudSpec spec(ResourcePoolSpec... pools) {
        return OCloudSpec.builder().resourcePools(new ArrayList<>(List.of(pools))).build();
    }

    private static ResourcePoolSpec pool(String name, String cpu) {
        return ResourcePoolSpec.builder()
            .name(name)
            .type("compute")
            .capacity(ResourceCapacity.builder().cpu(cpu).memory("1Gi").storage("1Gi").build())
            .build();
    }
}
