package com.vibecoding.ocloud.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * SMO 연동용 RestTemplate
 */
@Configuration
public class HttpClientConfig {

    @Bean
    public RestTemplate smoRestTemplate(RestTemplateBuilder builder, ControlPlaneProperties properties) {
        Duration timeout = Duration.ofMillis(properties.getSmo().getTimeout());
        return builder
            .setConnectTimeout(timeout)
            .setReadTimeout(timeout)
            .build();
    }
}
