package com.psl.orchestrator.service;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(OrchestrationProperties.class)
public class OrchestrationConfig {

    @Bean
    public OrchestrationSettings orchestrationSettings(OrchestrationProperties properties) {
        return OrchestrationSettings.from(properties);
    }
}
