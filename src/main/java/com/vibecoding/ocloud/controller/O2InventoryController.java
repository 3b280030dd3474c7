package com.vibecoding.ocloud.controller;

import com.vibecoding.ocloud.model.o2.ComputeInventory;
import com.vibecoding.ocloud.model.o2.NetworkInventory;
import com.vibecoding.ocloud.model.o2.O2Deployment;
import com.vibecoding.ocloud.model.o2.O2Inventory;
import com.vibecoding.ocloud.model.o2.O2Resource;
import com.vibecoding.ocloud.model.o2.O2ResourcePool;
import com.vibecoding.ocloud.model.o2.StorageInventory;
import com.vibecoding.ocloud.service.O2InterfaceService;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * O2 IMS 인벤토리 API (리소스 풀, 리소스, 배포, 인벤토리 집계)
 */
@RestController
@RequestMapping("/o2ims/v1")
@RequiredArgsConstructor
public class O2InventoryController {

    private static final Logger log = LoggerFactory.getLogger(O2InventoryController.class);

    private final O2InterfaceService o2Service;

    // ===== Resource pools =====

    @GetMapping("/resourcePools")
    public List<O2ResourcePool> listResourcePools() {
        return o2Service.listResourcePools();
    }

    @GetMapping("/resourcePools/{id}")
    public ResponseEntity<O2ResourcePool> getResourcePool(@PathVariable String id) {
        return ResponseEntity.of(o2Service.getResourcePool(id));
    }

    @PostMapping("/resourcePools")
    public ResponseEntity<O2ResourcePool> createResourcePool(@RequestBody O2ResourcePool pool) {
        log.info("O2: create resource pool {}", pool.getName());
        return ResponseEntity.status(HttpStatus.CREATED).body(o2Service.createResourcePool(pool));
    }

    @PutMapping("/resourcePools/{id}")
    public O2ResourcePool updateResourcePool(@PathVariable String id, @RequestBody O2ResourcePool pool) {
        return o2Service.updateResourcePool(id, pool);
    }

    @DeleteMapping("/resourcePools/{id}")
    public ResponseEntity<Void> deleteResourcePool(@PathVariable String id) {
        o2Service.deleteResourcePool(id);
        return ResponseEntity.noContent().build();
    }

    // ===== Resources =====

    @GetMapping("/resources")
    public List<O2Resource> listResources() {
        return o2Service.listResources();
    }

    @GetMapping("/resources/{id}")
    public ResponseEntity<O2Resource> getResource(@PathVariable String id) {
        return ResponseEntity.of(o2Service.getResource(id));
    }

    @PostMapping("/resources")
    public ResponseEntity<O2Resource> createResource(@RequestBody O2Resource resource) {
        return ResponseEntity.status(HttpStatus.CREATED).body(o2Service.createResource(resource));
    }

    @PutMapping("/resources/{id}")
    public O2Resource updateResource(@PathVariable String id, @RequestBody O2Resource resource) {
        return o2Service.updateResource(id, resource);
    }

    @DeleteMapping("/resources/{id}")
    public ResponseEntity<Void> deleteResource(@PathVariable String id) {
        o2Service.deleteResource(id);
        return ResponseEntity.noContent().build();
    }

    // ===== Deployments =====

    @GetMapping("/deployments")
    public List<O2Deployment> listDeployments() {
        return o2Service.listDeployments();
    }

    @GetMapping("/deployments/{id}")
    public ResponseEntity<O2Deployment> getDeployment(@PathVariable String id) {
        return ResponseEntity.of(o2Service.getDeployment(id));
    }

    @PostMapping("/deployments")
    public ResponseEntity<O2Deployment> createDeployment(@RequestBody O2Deployment deployment) {
        return ResponseEntity.status(HttpStatus.CREATED).body(o2Service.createDeployment(deployment));
    }

    @PutMapping("/deployments/{id}")
    public O2Deployment updateDeployment(@PathVariable String id, @RequestBody O2Deployment deployment) {
        return o2Service.updateDeployment(id, deployment);
    }

    @DeleteMapping("/deployments/{id}")
    public ResponseEntity<Void> deleteDeployment(@PathVariable String id) {
        o2Service.deleteDeployment(id);
        return ResponseEntity.noContent().build();
    }

    // ===== Inventory =====

    @GetMapping("/inventory")
    public O2Inventory getInventory() {
        return o2Service.getInventory();
    }

    @GetMapping("/inventory/compute")
    public ComputeInventory getComputeInventory() {
        return o2Service.getComputeInventory();
    }

    @GetMapping("/inventory/network")
    public NetworkInventory getNetworkInventory() {
        return o2Service.getNetworkInventory();
    }

    @GetMapping("/inventory/storage")
    public StorageInventory getStorageInventory() {
        return o2Service.getStorageInventory();
    }

    // ===== Health / Info =====

    @GetMapping("/health")
    public Map<String, Object> health() {
        return o2Service.health();
    }

    @GetMapping("/info")
    public Map<String, Object> info() {
        return o2Service.info();
    }
}
