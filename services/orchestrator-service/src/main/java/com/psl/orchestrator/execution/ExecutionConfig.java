package com.psl.orchestrator.execution;

import com.psl.orchestrator.service.OrchestrationProperties;
import com.psl.orchestrator.service.OrchestrationSettings;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ExecutionConfig {

    @Bean(destroyMethod = "shutdown")
    public ExecutorService backendExecutor(OrchestrationProperties properties) {
        return Executors.newFixedThreadPool(Math.max(2, properties.getBackendPoolSize()));
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService subQueryExecutor(OrchestrationProperties properties) {
        int size = Math.min(OrchestrationSettings.MAX_SUB_QUERY_WORKERS, Math.max(1, properties.getSubQueryPoolSize()));
        return Executors.newFixedThreadPool(size);
    }
}
