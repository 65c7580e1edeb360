package com.demo.fit.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Worker pools for the engine. Evaluator calls, batch fan-out and query fan-out run on separate pools
 * so a batch waiting on its computations can never starve the threads those computations need.
 */
@Configuration
@EnableConfigurationProperties(FitEngineProperties.class)
public class FitEngineConfig {

    @Bean(destroyMethod = "shutdown")
    public ExecutorService fitComputeExecutor(FitEngineProperties properties) {
        return Executors.newFixedThreadPool(properties.compute().poolSize(), named("fit-compute"));
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService fitBatchExecutor(FitEngineProperties properties) {
        return Executors.newFixedThreadPool(properties.compute().batchPoolSize(), named("fit-batch"));
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService fitQueryExecutor() {
        return Executors.newFixedThreadPool(3, named("fit-query"));
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    private static ThreadFactory named(String prefix) {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
