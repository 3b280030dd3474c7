package com.vibecoding.ocloud.service;

import com.vibecoding.ocloud.config.ControlPlaneProperties;
import com.vibecoding.ocloud.exception.ClusterApiException;
import com.vibecoding.ocloud.model.ocloud.ResourceCapacity;
import com.vibecoding.ocloud.model.ocloud.ResourcePoolSpec;
import io.fabric8.kubernetes.api.model.Namespace;
import io.fabric8.kubernetes.api.model.NamespaceBuilder;
import io.fabric8.kubernetes.api.model.Quantity;
import io.fabric8.kubernetes.api.model.ResourceQuota;
import io.fabric8.kubernetes.api.model.ResourceQuotaBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.dsl.NonDeletingOperation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 리소스 풀마다 네임스페이스와 ResourceQuota 를 생성/갱신
 */
@Service
public class PoolNamespaceProvisioner {

    private static final Logger log = LoggerFactory.getLogger(PoolNamespaceProvisioner.class);

    static final String LABEL_POOL = "ocloud.oran.io/pool";
    static final String LABEL_TYPE = "ocloud.oran.io/type";
    static final String LABEL_LOCATION = "ocloud.oran.io/location";

    private final ControlPlaneProperties properties;
    private final ObjectProvider<KubernetesClient> clientProvider;

    public PoolNamespaceProvisioner(ControlPlaneProperties properties, ObjectProvider<KubernetesClient> clientProvider) {
        this.properties = properties;
        this.clientProvider = clientProvider;
    }

    /**
     * 네임스페이스 ocloud-&lt;pool&gt; 과 쿼터 &lt;pool&gt;-quota 적용 (비활성화 시 건너뜀)
     */
    public void provision(ResourcePoolSpec pool) {
        if (!properties.getKubernetes().isEnabled()) {
            log.debug("Kubernetes provisioning disabled, skipping pool: {}", pool.getName());
            return;
        }
        KubernetesClient client = clientProvider.getIfAvailable();
        if (client == null) {
            throw new ClusterApiException("Kubernetes client is not configured");
        }

        Namespace namespace = buildNamespace(pool);
        ResourceQuota quota = buildQuota(pool);
        try {
            client.resource(namespace).createOr(NonDeletingOperation::update);
            client.resource(quota).inNamespace(namespaceName(pool)).createOr(NonDeletingOperation::update);
            log.info("Provisioned namespace {} with quota {}", namespaceName(pool), quota.getMetadata().getName());
        } catch (KubernetesClientException e) {
            log.error("Failed to provision pool {}: {}", pool.getName(), e.getMessage());
            throw new ClusterApiException("failed to provision namespace for pool " + pool.getName()
                + ": " + e.getMessage(), e);
        }
    }

    static String namespaceName(ResourcePoolSpec pool) {
        return "ocloud-" + pool.getName();
    }

    Namespace buildNamespace(ResourcePoolSpec pool) {
        Map<String, String> labels = new LinkedHashMap<>();
        labels.put(LABEL_POOL, pool.getName());
        if (pool.getType() != null) {
            labels.put(LABEL_TYPE, pool.getType());
        }
        if (pool.getLocation() != null) {
            labels.put(LABEL_LOCATION, pool.getLocation());
        }

        return new NamespaceBuilder()
            .withNewMetadata()
                .withName(namespaceName(pool))
                .withLabels(labels)
            .endMetadata()
            .build();
    }

    ResourceQuota buildQuota(ResourcePoolSpec pool) {
        ResourceCapacity capacity = pool.getCapacity() != null ? pool.getCapacity() : new ResourceCapacity();
        Map<String, Quantity> hard = new LinkedHashMap<>();
        putIfPresent(hard, "cpu", capacity.getCpu());
        putIfPresent(hard, "memory", capacity.getMemory());
        putIfPresent(hard, "requests.storage", capacity.getStorage());

        return new ResourceQuotaBuilder()
            .withNewMetadata()
                .withName(pool.getName() + "-quota")
                .withNamespace(namespaceName(pool))
                .addToLabels(LABEL_POOL, pool.getName())
            .endMetadata()
            .withNewSpec()
                .withHard(hard)
            .endSpec()
            .build();
    }

    private static void putIfPresent(Map<String, Quantity> hard, String key, String value) {
        if (value != null && !value.isBlank()) {
            hard.put(key, new Quantity(value));
        }
    }
}
