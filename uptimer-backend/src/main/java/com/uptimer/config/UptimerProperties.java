package com.uptimer.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Settings bound from the {@code uptimer.*} namespace.
 *
 * <p>The API key and store DSN are secrets; they are excluded from {@code toString()} so they never
 * end up in logs.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "uptimer")
public class UptimerProperties {

    /**
     * Hard upper bound of targets accepted in one batch.
     */
    public static final int BATCH_SIZE_LIMIT = 5;

    @ToString.Exclude
    private String apiKey = "";

    @Min(1)
    @Max(BATCH_SIZE_LIMIT)
    private int maxBatchSize = BATCH_SIZE_LIMIT;

    @Valid
    @NotNull
    private Probe probe = new Probe();

    @Valid
    @NotNull
    private Store store = new Store();

    @Data
    public static class Probe {
        @NotNull
        private Duration timeout = Duration.ofSeconds(10);

        @NotNull
        private Duration connectTimeout = Duration.ofSeconds(5);

        @NotNull
        private Duration degradedThreshold = Duration.ofMillis(1000);

        @Min(1)
        private int poolSize = 16;

        private String userAgent = "uptimer/0.1";
    }

    @Data
    public static class Store {
        @ToString.Exclude
        private String dsn = "";

        @Min(1)
        private int maximumPoolSize = 5;

        @NotNull
        private Duration connectionTimeout = Duration.ofSeconds(5);
    }
}
