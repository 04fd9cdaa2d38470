package com.uptimer.probe;

import com.uptimer.config.UptimerProperties;
import com.uptimer.model.CheckResult;
import com.uptimer.model.CheckTarget;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs one probe per target concurrently and waits for all of them.
 *
 * <p>Probes are independent: a failing probe never cancels its siblings, and there is no batch-level
 * cancellation. Each probe is bounded only by the HTTP client's own timeouts.
 */
@Component
public class ProbeCoordinator {

    private static final Logger log = LoggerFactory.getLogger(ProbeCoordinator.class);

    private final Prober prober;
    private final ExecutorService probeExecutor;
    private final int maxBatchSize;

    public ProbeCoordinator(
            Prober prober,
            @Qualifier("probeExecutor") ExecutorService probeExecutor,
            UptimerProperties properties
    ) {
        this.prober = prober;
        this.probeExecutor = probeExecutor;
        this.maxBatchSize = properties.getMaxBatchSize();
    }

    /**
     * Probe every target and return one result per target, in completion order.
     *
     * @param targets targets to probe, at most the configured batch size
     * @return results after every probe has finished
     * @throws IllegalArgumentException if the batch exceeds the configured size
     * @throws IllegalStateException if the calling thread is interrupted while waiting
     */
    public List<CheckResult> probeAll(List<CheckTarget> targets) {
        Objects.requireNonNull(targets, "targets");
        if (targets.size() > maxBatchSize) {
            throw new IllegalArgumentException("Too many targets: " + targets.size() + " (max " + maxBatchSize + ")");
        }
        if (targets.isEmpty()) {
            return List.of();
        }

        ResultCollector collector = new ResultCollector(targets.size());
        CountDownLatch barrier = new CountDownLatch(targets.size());
        Map<String, String> mdc = MDC.getCopyOfContextMap();

        for (CheckTarget target : targets) {
            try {
                probeExecutor.execute(() -> runProbe(target, collector, barrier, mdc));
            } catch (RejectedExecutionException e) {
                log.error("Probe rejected by executor: website_id={}, url={}", target.getWebsiteId(), target.getUrl(), e);
                collector.add(CheckResult.down(target, 0));
                barrier.countDown();
            }
        }

        try {
            barrier.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for probes to finish", e);
        }
        return collector.drain();
    }

    private void runProbe(CheckTarget target, ResultCollector collector, CountDownLatch barrier, Map<String, String> mdc) {
        if (mdc != null) {
            MDC.setContextMap(mdc);
        }
        try {
            CheckResult result;
            try {
                result = prober.probe(target);
            } catch (RuntimeException e) {
                log.error("Prober failed unexpectedly: website_id={}, url={}", target.getWebsiteId(), target.getUrl(), e);
                result = null;
            }
            collector.add(result != null ? result : CheckResult.down(target, 0));
        } finally {
            barrier.countDown();
            MDC.clear();
        }
    }
}
