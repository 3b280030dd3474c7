package com.vibecoding.ocloud.controller;

import com.vibecoding.ocloud.exception.ResourceNotFoundException;
import com.vibecoding.ocloud.model.resource.PoolStatus;
import com.vibecoding.ocloud.model.resource.PoolUtilization;
import com.vibecoding.ocloud.model.resource.ResourceAllocation;
import com.vibecoding.ocloud.model.resource.ResourceRequest;
import com.vibecoding.ocloud.model.resource.UtilizationWarning;
import com.vibecoding.ocloud.service.CloudResourceManager;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * 리소스 풀 / 할당 API
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class ResourcePoolController {

    private static final Logger log = LoggerFactory.getLogger(ResourcePoolController.class);

    private final CloudResourceManager resourceManager;

    @GetMapping("/pools")
    public List<PoolStatus> listPools() {
        return resourceManager.getAllPoolStatus();
    }

    @GetMapping("/pools/{name}/utilization")
    public PoolUtilization getUtilization(@PathVariable String name) {
        return resourceManager.getPoolUtilization(name);
    }

    /**
     * 풀에 리소스 할당 (경로의 풀 이름이 우선)
     */
    @PostMapping("/pools/{name}/allocations")
    public ResponseEntity<ResourceAllocation> allocate(
        @PathVariable String name,
        @RequestBody ResourceRequest request
    ) {
        log.info("API: allocate in pool {} (cpu={}, memory={}, storage={})",
            name, request.getCpu(), request.getMemory(), request.getStorage());
        request.setPoolName(name);
        return ResponseEntity.status(HttpStatus.CREATED).body(resourceManager.allocateResources(request));
    }

    @GetMapping("/allocations/{id}")
    public ResourceAllocation getAllocation(@PathVariable String id) {
        return resourceManager.getAllocation(id)
            .orElseThrow(() -> new ResourceNotFoundException("allocation " + id + " not found"));
    }

    @DeleteMapping("/allocations/{id}")
    public ResponseEntity<Void> release(@PathVariable String id) {
        log.info("API: release allocation {}", id);
        resourceManager.releaseResources(id);
        return ResponseEntity.noContent().build();
    }

    /**
     * 사용률 임계값 초과 풀 점검
     */
    @PostMapping("/pools/optimize")
    public List<UtilizationWarning> optimize() {
        return resourceManager.optimizeResourceAllocation();
    }
}
