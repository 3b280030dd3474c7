package com.vibecoding.ocloud.config;

import io.fabric8.kubernetes.client.Config;
import io.fabric8.kubernetes.client.ConfigBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 풀 프로비저닝용 Kubernetes 클라이언트
 */
@Configuration
@ConditionalOnProperty(prefix = "ocloud.kubernetes", name = "enabled", havingValue = "true")
public class KubernetesClientConfig {

    private static final Logger log = LoggerFactory.getLogger(KubernetesClientConfig.class);

    @Bean(destroyMethod = "close")
    public KubernetesClient kubernetesClient(ControlPlaneProperties properties) {
        ControlPlaneProperties.Kubernetes k8s = properties.getKubernetes();

        if (k8s.getMasterUrl() == null || k8s.getMasterUrl().isBlank()) {
            log.info("Creating Kubernetes client from auto-configuration (kubeconfig / in-cluster)");
            return new KubernetesClientBuilder().build();
        }

        // autoConfigure(false)로 ~/.kube/config 자동 로드 방지
        Config config = new ConfigBuilder()
            .withAutoConfigure(false)
            .withMasterUrl(k8s.getMasterUrl())
            .withOauthToken(k8s.getToken())
            .withTrustCerts(k8s.isTrustCerts())
            .withRequestTimeout(k8s.getRequestTimeout())
            .withConnectionTimeout(k8s.getConnectionTimeout())
            .build();

        log.info("Creating Kubernetes client for {}", k8s.getMasterUrl());
        return new KubernetesClientBuilder()
            .withConfig(config)
            .build();
    }
}
