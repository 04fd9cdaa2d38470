package com.uptimer.probe;

import com.uptimer.config.UptimerProperties;
import com.uptimer.model.CheckResult;
import com.uptimer.model.CheckStatus;
import com.uptimer.model.CheckTarget;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Probes a URL with an HTTP GET and classifies the outcome by latency.
 *
 * <p>Latency is measured up to the arrival of the response headers; the body is closed unread, so a
 * slow or endless body neither inflates the latency nor outlives the request timeout. Redirects are followed by the client, and the
 * status of the final response is reported.
 */
@Component
public class UrlProber implements Prober {

    private static final Logger log = LoggerFactory.getLogger(UrlProber.class);

    private final HttpClient httpClient;
    private final Duration timeout;
    private final long degradedThresholdMs;
    private final String userAgent;

    /**
     * Create a prober.
     *
     * @param probeHttpClient shared HTTP client
     * @param properties probe timeout, degraded threshold and user agent
     */
    public UrlProber(HttpClient probeHttpClient, UptimerProperties properties) {
        this.httpClient = probeHttpClient;
        this.timeout = properties.getProbe().getTimeout();
        this.degradedThresholdMs = properties.getProbe().getDegradedThreshold().toMillis();
        this.userAgent = properties.getProbe().getUserAgent();
    }

    @Override
    public CheckResult probe(CheckTarget target) {
        long start = System.nanoTime();
        long elapsedMs = -1;
        int statusCode = 0;
        try {
            HttpRequest.Builder builder = HttpRequest.newBuilder()
                    .uri(URI.create(target.getUrl()))
                    .timeout(timeout)
                    .GET();
            if (userAgent != null && !userAgent.isBlank()) {
                builder.header("User-Agent", userAgent);
            }
            HttpResponse<InputStream> response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofInputStream());
            // headers received: the clock stops here and the body is never read
            elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
            statusCode = response.statusCode();
            response.body().close();
        } catch (IOException | IllegalArgumentException e) {
            // malformed URLs surface as IllegalArgumentException
            log.debug("Probe failed: website_id={}, url={}, error={}", target.getWebsiteId(), target.getUrl(), e.toString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Probe interrupted: website_id={}, url={}", target.getWebsiteId(), target.getUrl());
        }
        if (elapsedMs < 0) {
            elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        }

        return CheckResult.builder()
                .websiteId(target.getWebsiteId())
                .url(target.getUrl())
                .status(classify(statusCode, elapsedMs))
                .statusCode(statusCode)
                .responseTimeMs(elapsedMs)
                .build();
    }

    /**
     * Classify a probe outcome.
     *
     * @param statusCode HTTP status received, or 0 when no response arrived
     * @param elapsedMs elapsed wall-clock time
     * @return {@code DOWN} without a response, {@code DEGRADED} above the threshold, else {@code UP}
     */
    public CheckStatus classify(int statusCode, long elapsedMs) {
        if (statusCode <= 0) {
            return CheckStatus.DOWN;
        }
        return elapsedMs > degradedThresholdMs ? CheckStatus.DEGRADED : CheckStatus.UP;
    }
}
