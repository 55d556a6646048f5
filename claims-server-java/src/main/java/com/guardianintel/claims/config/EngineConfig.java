package com.guardianintel.claims.config;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import com.guardianintel.claims.integration.carrier.CarrierCapabilities;
import com.guardianintel.claims.integration.carrier.CarrierCapabilityRegistry;

@Configuration
@EnableScheduling
public class EngineConfig {

    @Value("${claims.carrier-executor.threads:16}") private int carrierThreads;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /** Runs adapter calls so callers can bound them with a timeout. */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService carrierCallExecutor() {
        return Executors.newFixedThreadPool(carrierThreads, namedThreads("carrier-call-"));
    }

    /** One task per carrier during a sweep, so every sync-capable carrier gets its own thread. */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService carrierSweepExecutor(CarrierCapabilityRegistry registry) {
        return Executors.newFixedThreadPool(sweepThreads(registry), namedThreads("carrier-sweep-"));
    }

    static int sweepThreads(CarrierCapabilityRegistry registry) {
        long syncable = registry.carriers().stream().filter(CarrierCapabilities::supportsStatusSync).count();
        return (int) Math.max(1, syncable);
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
