package com.delta.cnpjresolver.config;

import com.delta.cnpjresolver.resolve.http.ProxyPool;
import com.delta.cnpjresolver.resolve.http.Sleeper;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class ResolverConfig {

    @Bean(name = "resolverExecutor", destroyMethod = "shutdown")
    public ExecutorService resolverExecutor(ResolverProperties properties) {
        return Executors.newFixedThreadPool(properties.getBatch().getWorkers());
    }

    @Bean(name = "httpExecutor", destroyMethod = "shutdown")
    public ExecutorService httpExecutor(ResolverProperties properties) {
        int size = Math.max(4, properties.getBatch().getWorkers() * 2);
        return Executors.newFixedThreadPool(size);
    }

    @Bean
    public ProxyPool proxyPool(ResolverProperties properties) {
        return ProxyPool.fromStrings(properties.getProxies());
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.threadSleeper();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
