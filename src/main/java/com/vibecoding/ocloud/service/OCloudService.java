package com.vibecoding.ocloud.service;

import com.vibecoding.ocloud.exception.ResourceNotFoundException;
import com.vibecoding.ocloud.model.ocloud.O2InterfaceConfig;
import com.vibecoding.ocloud.model.ocloud.OCloud;
import com.vibecoding.ocloud.model.ocloud.OCloudSpec;
import com.vibecoding.ocloud.model.ocloud.ReconcileResult;
import com.vibecoding.ocloud.model.ocloud.ResourcePoolSpec;
import com.vibecoding.ocloud.model.ocloud.SmoConfig;
import com.vibecoding.ocloud.model.smo.Policy;
import com.vibecoding.ocloud.model.telemetry.TelemetryMetrics;
import com.vibecoding.ocloud.repository.OCloudRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * O-Cloud 선언/조회 서비스
 */
@Service
@RequiredArgsConstructor
public class OCloudService {

    private static final Logger log = LoggerFactory.getLogger(OCloudService.class);

    private final OCloudRepository ocloudRepository;
    private final ReconcileScheduler reconcileScheduler;
    private final TelemetryManager telemetryManager;
    private final SmoClient smoClient;

    /**
     * O-Cloud 선언 또는 spec 갱신 후 재조정 예약
     */
    public OCloud apply(String name, String namespace, OCloudSpec spec) {
        log.info("Applying O-Cloud spec: {}", name);
        validate(spec);

        OCloud saved = ocloudRepository.saveSpec(name, namespace, spec);
        reconcileScheduler.enqueue(name);
        return saved;
    }

    public OCloud get(String name) {
        return ocloudRepository.findByName(name)
            .orElseThrow(() -> new ResourceNotFoundException("O-Cloud " + name + " not found"));
    }

    public List<OCloud> list() {
        return ocloudRepository.findAll();
    }

    /**
     * O-Cloud 삭제 (관리 중인 풀과 할당은 그대로 둠)
     */
    public void delete(String name) {
        if (!ocloudRepository.existsByName(name)) {
            throw new ResourceNotFoundException("O-Cloud " + name + " not found");
        }
        ocloudRepository.deleteByName(name);
        reconcileScheduler.forget(name);
    }

    /**
     * 즉시 재조정 후 최신 상태 반환
     */
    public OCloud reconcile(String name) {
        if (!ocloudRepository.existsByName(name)) {
            throw new ResourceNotFoundException("O-Cloud " + name + " not found");
        }
        ReconcileResult result = reconcileScheduler.reconcileNow(name);
        log.info("Manual reconciliation of {} finished: {}", name, result.isSuccess() ? "success" : result.getError());
        return get(name);
    }

    public List<TelemetryMetrics> telemetry(String name, int limit) {
        get(name);
        return telemetryManager.getMetrics(name, limit);
    }

    /**
     * SMO 에서 O-Cloud 정책 조회
     */
    public List<Policy> policies(String name) {
        OCloud ocloud = get(name);
        SmoConfig smo = ocloud.getSpec().getSmo();
        if (smo == null || !smo.isEnabled()) {
            throw new IllegalStateException("SMO integration is disabled for O-Cloud " + name);
        }
        return smoClient.getPolicies(smo, name);
    }

    private void validate(OCloudSpec spec) {
        if (spec == null) {
            throw new IllegalArgumentException("spec is required");
        }
        if (spec.getResourcePools() == null) {
            spec.setResourcePools(new ArrayList<>());
        }
        if (spec.getRegions() == null) {
            spec.setRegions(new ArrayList<>());
        }
        if (spec.getO2Interface() == null) {
            spec.setO2Interface(new O2InterfaceConfig());
        }
        if (spec.getSmo() == null) {
            spec.setSmo(new SmoConfig());
        }
        if (spec.getSmo().isEnabled() && (spec.getSmo().getEndpoint() == null || spec.getSmo().getEndpoint().isBlank())) {
            throw new IllegalArgumentException("smo.endpoint is required when SMO is enabled");
        }

        Set<String> names = new HashSet<>();
        for (ResourcePoolSpec pool : spec.getResourcePools()) {
            if (pool.getName() == null || pool.getName().isBlank()) {
                throw new IllegalArgumentException("resource pool name is required");
            }
            if (!names.add(pool.getName())) {
                throw new IllegalArgumentException("duplicate resource pool name: " + pool.getName());
            }
            if (pool.getCapacity() == null) {
                throw new IllegalArgumentException("capacity is required for pool " + pool.getName());
            }
            ResourceQuantityParser.parse(pool.getCapacity().getCpu());
            ResourceQuantityParser.parse(pool.getCapacity().getMemory());
            ResourceQuantityParser.parse(pool.getCapacity().getStorage());
        }
    }
}
