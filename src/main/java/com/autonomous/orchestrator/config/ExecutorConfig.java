package com.autonomous.orchestrator.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class ExecutorConfig {

    @Bean(destroyMethod = "shutdown")
    public ExecutorService taskExecutionPool(@Value("${orchestrator.executor.thread-pool-size:8}") int poolSize) {
        return Executors.newFixedThreadPool(Math.max(1, poolSize));
    }
}
