package com.openaasx.harvester.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.openaasx.harvester.harvest.persistence.CatalogCodec;
import com.openaasx.harvester.harvest.persistence.CatalogStore;
import com.openaasx.harvester.harvest.persistence.StateStore;
import com.openaasx.harvester.harvest.ratelimit.RateLimiter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class HarvestConfig {

    @Bean(name = "httpExecutor", destroyMethod = "shutdown")
    public ExecutorService httpExecutor(HarvesterProperties properties) {
        int size = Math.max(4, properties.getRun().getProcessingConcurrency() * 2);
        return Executors.newFixedThreadPool(size);
    }

    @Bean(name = "discoveryExecutor", destroyMethod = "shutdown")
    public ExecutorService discoveryExecutor(HarvesterProperties properties) {
        return Executors.newFixedThreadPool(properties.getRun().getDiscoveryConcurrency());
    }

    @Bean(name = "processingExecutor", destroyMethod = "shutdown")
    public ExecutorService processingExecutor(HarvesterProperties properties) {
        return Executors.newFixedThreadPool(properties.getRun().getProcessingConcurrency());
    }

    @Bean
    public RateLimiter rateLimiter(HarvesterProperties properties) {
        return new RateLimiter(properties.getRateLimits());
    }

    @Bean
    public CatalogStore catalogStore(HarvesterProperties properties, CatalogCodec codec) {
        return new CatalogStore(properties.getStorage().catalogPath(), codec);
    }

    @Bean
    public StateStore stateStore(HarvesterProperties properties, CatalogCodec codec) {
        return new StateStore(properties.getStorage().statePath(), codec);
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }
}
