package com.vibecoding.ocloud.config;

import jakarta.annotation.PostConstruct;
import lombok.Data;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;


@Configuration
@ConfigurationProperties(prefix = "ocloud")
@Data
public class ControlPlaneProperties {

    private static final Logger log = LoggerFactory.getLogger(ControlPlaneProperties.class);

    private Smo smo = new Smo();
    private Kubernetes kubernetes = new Kubernetes();
    private Reconcile reconcile = new Reconcile();
    private Telemetry telemetry = new Telemetry();
    private Resources resources = new Resources();
    private Orchestrator orchestrator = new Orchestrator();
    private O2 o2 = new O2();

    @PostConstruct
    public void init() {
        // SMO 토큰 (설정값 우선, 시스템 프로퍼티, 환경변수 순)
        if (smo.getToken() == null || smo.getToken().isBlank()) {
            smo.setToken(System.getProperty("SMO_TOKEN"));
        }
        if (smo.getToken() == null || smo.getToken().isBlank()) {
            smo.setToken(System.getenv("SMO_TOKEN"));
        }

        log.info("Control plane configuration loaded");
        log.info("  - Reconcile enabled: {} (workers: {})", reconcile.isEnabled(), reconcile.getWorkerThreads());
        log.info("  - Kubernetes provisioning: {}", kubernetes.isEnabled() ? "enabled" : "disabled");
        log.info("  - SMO timeout: {}ms, token configured: {}", smo.getTimeout(),
            smo.getToken() != null && !smo.getToken().isBlank());
    }

    @Data
    public static class Smo {
        private String token;
        private Integer timeout = 30000;        // connect/read ms
    }

    @Data
    public static class Kubernetes {
        private boolean enabled = false;        // 네임스페이스/쿼터 프로비저닝 여부
        private String masterUrl;               // 비어 있으면 auto-configure
        private String token;
        private boolean trustCerts = false;
        private Integer requestTimeout = 30000;
        private Integer connectionTimeout = 10000;
    }

    @Data
    public static class Reconcile {
        private boolean enabled = true;
        private int workerThreads = 4;
        private Duration successRequeue = Duration.ofMinutes(5);
        private Duration errorRequeue = Duration.ofMinutes(1);
    }

    @Data
    public static class Telemetry {
        private int maxEntries = 1000;
    }

    @Data
    public static class Resources {
        private double utilizationThreshold = 80.0;   // %
    }

    @Data
    public static class Orchestrator {
        private Duration initialInterval = Duration.ofSeconds(2);
        private double multiplier = 2.0;
        private Duration maxInterval = Duration.ofSeconds(30);
        private Duration phaseTimeout = Duration.ofMinutes(2);
        private Duration workflowTimeout = Duration.ofMinutes(10);
        private int executorThreads = 4;
        private int retainedWorkflows = 100;    // 보관할 종료 워크플로우 수
    }

    @Data
    public static class O2 {
        private String apiVersion = "v1";
    }
}
