package com.vibecoding.ocloud.service;

import com.vibecoding.ocloud.config.ControlPlaneProperties;
import com.vibecoding.ocloud.exception.SmoClientException;
import com.vibecoding.ocloud.model.ocloud.OCloud;
import com.vibecoding.ocloud.model.ocloud.ResourceCapacity;
import com.vibecoding.ocloud.model.ocloud.ResourcePoolSpec;
import com.vibecoding.ocloud.model.ocloud.SmoConfig;
import com.vibecoding.ocloud.model.smo.Alarm;
import com.vibecoding.ocloud.model.smo.OCloudRegistration;
import com.vibecoding.ocloud.model.smo.Policy;
import com.vibecoding.ocloud.model.smo.ResourceUpdate;
import com.vibecoding.ocloud.model.smo.SmoResourceCapacity;
import com.vibecoding.ocloud.model.smo.SmoResourcePool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * SMO REST API 클라이언트
 */
@Service
public class SmoClient {

    private static final Logger log = LoggerFactory.getLogger(SmoClient.class);

    private final RestTemplate restTemplate;
    private final ControlPlaneProperties properties;

    // health check 에 성공한 SMO endpoint
    private final Set<String> connectedEndpoints = ConcurrentHashMap.newKeySet();

    public SmoClient(@Qualifier("smoRestTemplate") RestTemplate restTemplate, ControlPlaneProperties properties) {
        this.restTemplate = restTemplate;
        this.properties = properties;
    }

    /**
     * SMO 연결 확인 (GET /api/v1/health, 200 필요)
     */
    public void connect(SmoConfig config) {
        log.info("Connecting to SMO: {} (AI/ML enabled: {})", config.getEndpoint(), config.isAimlEnabled());

        ResponseEntity<String> response;
        try {
            response = call(config, "/api/v1/health", HttpMethod.GET, null, String.class, "SMO health check");
        } catch (SmoClientException e) {
            connectedEndpoints.remove(config.getEndpoint());
            throw e;
        }
        if (response.getStatusCode().value() != 200) {
            connectedEndpoints.remove(config.getEndpoint());
            throw new SmoClientException("SMO health check returned status " + response.getStatusCode().value(),
                response.getStatusCode().value());
        }

        connectedEndpoints.add(config.getEndpoint());
        log.info("Connected to SMO: {}", config.getEndpoint());
    }

    /**
     * O-Cloud 등록 (POST /api/v1/oclouds, 200/201)
     */
    public void registerOCloud(OCloud ocloud) {
        log.info("Registering O-Cloud with SMO: {}", ocloud.getName());

        OCloudRegistration registration = OCloudRegistration.builder()
            .id(ocloud.getName())
            .name(ocloud.getName())
            .description("O-Cloud instance " + ocloud.getName())
            .infrastructureType(ocloud.getSpec().getInfrastructureType())
            .regions(ocloud.getSpec().getRegions())
            .resourcePools(convertResourcePools(ocloud.getSpec().getResourcePools()))
            .o2InterfaceVersion(ocloud.getSpec().getO2Interface() != null
                ? ocloud.getSpec().getO2Interface().getVersion() : null)
            .capabilities(ocloud.getSpec().getSmo().getCapabilities())
            .registeredAt(LocalDateTime.now())
            .build();

        ResponseEntity<String> response = call(ocloud.getSpec().getSmo(), "/api/v1/oclouds", HttpMethod.POST,
            registration, String.class, "O-Cloud registration");
        expectStatus(response, "O-Cloud registration", 200, 201);

        log.info("O-Cloud registered with SMO: {}", ocloud.getName());
    }

    /**
     * 리소스 변경 통지 (POST /api/v1/resource-updates, 200)
     */
    public void reportResourceUpdate(SmoConfig config, ResourceUpdate update) {
        log.debug("Reporting resource update to SMO: {} {}", update.getResourceType(), update.getResourceId());

        ResponseEntity<String> response = call(config, "/api/v1/resource-updates", HttpMethod.POST,
            update, String.class, "resource update");
        expectStatus(response, "resource update", 200);
    }

    /**
     * O-Cloud 정책 조회 (GET /api/v1/oclouds/{id}/policies, 200)
     */
    public List<Policy> getPolicies(SmoConfig config, String ocloudId) {
        log.debug("Fetching policies from SMO: {}", ocloudId);

        ResponseEntity<List<Policy>> response;
        HttpEntity<Object> request = new HttpEntity<>(headers(config));
        try {
            response = restTemplate.exchange(config.getEndpoint() + "/api/v1/oclouds/{id}/policies",
                HttpMethod.GET, request, new ParameterizedTypeReference<List<Policy>>() {}, ocloudId);
        } catch (RestClientResponseException e) {
            throw new SmoClientException("policies fetch returned status " + e.getStatusCode().value(),
                e.getStatusCode().value());
        } catch (RestClientException e) {
            throw new SmoClientException("failed to fetch policies: " + e.getMessage(), e);
        }
        expectStatus(response, "policies fetch", 200);

        List<Policy> policies = response.getBody() != null ? response.getBody() : Collections.emptyList();
        log.info("Retrieved {} policies from SMO for {}", policies.size(), ocloudId);
        return policies;
    }

    /**
     * 알람 전송 (POST /api/v1/alarms, 200/201)
     */
    public void sendAlarm(SmoConfig config, Alarm alarm) {
        log.info("Sending alarm to SMO: {} ({})", alarm.getId(), alarm.getSeverity());

        ResponseEntity<String> response = call(config, "/api/v1/alarms", HttpMethod.POST,
            alarm, String.class, "alarm send");
        expectStatus(response, "alarm send", 200, 201);
    }

    /**
     * 마지막 health check 성공 여부
     */
    public boolean isConnected(SmoConfig config) {
        return config != null && config.getEndpoint() != null && connectedEndpoints.contains(config.getEndpoint());
    }

    private <T> ResponseEntity<T> call(SmoConfig config, String path, HttpMethod method, Object body,
                                       Class<T> responseType, String operation) {
        if (config == null || config.getEndpoint() == null || config.getEndpoint().isBlank()) {
            throw new SmoClientException(operation + " failed: SMO endpoint is not configured", 0);
        }

        HttpHeaders headers = headers(config);
        if (body != null) {
            headers.setContentType(MediaType.APPLICATION_JSON);
        }
        HttpEntity<Object> request = new HttpEntity<>(body, headers);

        try {
            return restTemplate.exchange(config.getEndpoint() + path, method, request, responseType);
        } catch (RestClientResponseException e) {
            log.error("{} returned status {}", operation, e.getStatusCode().value());
            throw new SmoClientException(operation + " returned status " + e.getStatusCode().value(),
                e.getStatusCode().value());
        } catch (RestClientException e) {
            log.error("{} failed: {}", operation, e.getMessage());
            throw new SmoClientException(operation + " failed: " + e.getMessage(), e);
        }
    }

    private HttpHeaders headers(SmoConfig config) {
        HttpHeaders headers = new HttpHeaders();
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        String token = properties.getSmo().getToken();
        if (config.getAuthType() != null && !config.getAuthType().isBlank() && token != null && !token.isBlank()) {
            headers.setBearerAuth(token);
        }
        return headers;
    }

    private void expectStatus(ResponseEntity<?> response, String operation, int... accepted) {
        int status = response.getStatusCode().value();
        for (int code : accepted) {
            if (code == status) {
                return;
            }
        }
        throw new SmoClientException(operation + " returned status " + status, status);
    }

    private List<SmoResourcePool> convertResourcePools(List<ResourcePoolSpec> pools) {
        List<SmoResourcePool> result = new ArrayList<>();
        for (ResourcePoolSpec pool : pools) {
            ResourceCapacity capacity = pool.getCapacity() != null ? pool.getCapacity() : new ResourceCapacity();
            result.add(SmoResourcePool.builder()
                .name(pool.getName())
                .type(pool.getType())
                .location(pool.getLocation())
                .capacity(SmoResourceCapacity.builder()
                    .cpu(capacity.getCpu())
                    .memory(capacity.getMemory())
                    .storage(capacity.getStorage())
                    .network(capacity.getNetwork())
                    .build())
                .build());
        }
        return result;
    }
}
