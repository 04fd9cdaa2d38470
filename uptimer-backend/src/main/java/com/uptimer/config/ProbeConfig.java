package com.uptimer.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class ProbeConfig {

    @Bean
    public HttpClient probeHttpClient(UptimerProperties properties) {
        return HttpClient.newBuilder()
                .connectTimeout(properties.getProbe().getConnectTimeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    /**
     * Worker pool for outbound probes. Shut down with the application context.
     */
    @Bean(name = "probeExecutor", destroyMethod = "shutdown")
    public ExecutorService probeExecutor(UptimerProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "probe-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(properties.getProbe().getPoolSize(), threadFactory);
    }
}
