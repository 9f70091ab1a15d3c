package com.delta.resumeextractor.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

@Configuration
public class ExtractorConfig {

    @Bean(name = "claimExecutor", destroyMethod = "shutdown")
    public ExecutorService claimExecutor(ExtractorProperties properties) {
        return Executors.newFixedThreadPool(properties.getWorkers().getCount());
    }

    @Bean(name = "promptExecutor", destroyMethod = "shutdown")
    public ExecutorService promptExecutor(ExtractorProperties properties) {
        return Executors.newFixedThreadPool(properties.getWorkers().getCount());
    }

    @Bean(name = "llmHttpExecutor", destroyMethod = "shutdown")
    public ExecutorService llmHttpExecutor() {
        return Executors.newFixedThreadPool(2);
    }

    @Bean(name = "pollerScheduler", destroyMethod = "shutdown")
    public ScheduledExecutorService pollerScheduler() {
        return Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("batch-poller");
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean(name = "submissionScheduler", destroyMethod = "shutdown")
    public ScheduledExecutorService submissionScheduler() {
        return Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("batch-submitter");
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
