package com.vibecoding.ocloud;

import io.github.cdimascio.dotenv.Dotenv;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;


@SpringBootApplication
public class OCloudControlPlaneApplication {

    private static final Logger log = LoggerFactory.getLogger(OCloudControlPlaneApplication.class);

    public static void main(String[] args) {
        log.info("==============================================");
        log.info("  O-Cloud Control Plane - Resource Orchestration");
        log.info("==============================================");

        // .env 파일을 시스템 프로퍼티로 로드
        try {
            Dotenv dotenv = Dotenv.configure()
                .ignoreIfMissing()
                .load();

            dotenv.entries().forEach(entry -> {
                System.setProperty(entry.getKey(), entry.getValue());
                log.debug("Loaded environment variable: {}", entry.getKey());
            });

            log.info("Environment variables loaded from .env file");
        } catch (Exception e) {
            log.warn("Failed to load .env file: {}", e.getMessage());
            log.info("Continuing with system environment variables...");
        }

        SpringApplication.run(OCloudControlPlaneApplication.class, args);

        log.info("Control plane started successfully!");
    }
}
