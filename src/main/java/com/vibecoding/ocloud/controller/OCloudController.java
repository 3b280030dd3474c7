package com.vibecoding.ocloud.controller;

import com.vibecoding.ocloud.model.ocloud.OCloud;
import com.vibecoding.ocloud.model.ocloud.OCloudSpec;
import com.vibecoding.ocloud.model.smo.Policy;
import com.vibecoding.ocloud.model.telemetry.TelemetryMetrics;
import com.vibecoding.ocloud.service.OCloudService;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * O-Cloud 선언/조회 API
 */
@RestController
@RequestMapping("/api/v1/oclouds")
@RequiredArgsConstructor
public class OCloudController {

    private static final Logger log = LoggerFactory.getLogger(OCloudController.class);

    private final OCloudService ocloudService;

    @GetMapping
    public List<OCloud> listOClouds() {
        return ocloudService.list();
    }

    @GetMapping("/{name}")
    public OCloud getOCloud(@PathVariable String name) {
        return ocloudService.get(name);
    }

    /**
     * O-Cloud 선언 또는 spec 갱신 (재조정은 비동기로 예약됨)
     */
    @PutMapping("/{name}")
    public OCloud applyOCloud(
        @PathVariable String name,
        @RequestParam(defaultValue = "default") String namespace,
        @RequestBody OCloudSpec spec
    ) {
        log.info("API: apply O-Cloud {} in namespace {}", name, namespace);
        return ocloudService.apply(name, namespace, spec);
    }

    @DeleteMapping("/{name}")
    public ResponseEntity<Void> deleteOCloud(@PathVariable String name) {
        log.info("API: delete O-Cloud {}", name);
        ocloudService.delete(name);
        return ResponseEntity.noContent().build();
    }

    /**
     * 재조정 한 사이클 즉시 실행
     */
    @PostMapping("/{name}/reconcile")
    public OCloud reconcileOCloud(@PathVariable String name) {
        log.info("API: reconcile O-Cloud {}", name);
        return ocloudService.reconcile(name);
    }

    @GetMapping("/{name}/telemetry")
    public List<TelemetryMetrics> getTelemetry(
        @PathVariable String name,
        @RequestParam(defaultValue = "20") int limit
    ) {
        return ocloudService.telemetry(name, limit);
    }

    @GetMapping("/{name}/policies")
    public List<Policy> getPolicies(@PathVariable String name) {
        return ocloudService.policies(name);
    }
}
