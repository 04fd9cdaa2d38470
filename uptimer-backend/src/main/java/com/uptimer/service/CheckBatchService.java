package com.uptimer.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.uptimer.api.CheckBatchRequest;
import com.uptimer.config.UptimerProperties;
import com.uptimer.model.CheckResult;
import com.uptimer.model.CheckTarget;
import com.uptimer.probe.ProbeCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs one batch end to end: validate, probe, persist, report.
 *
 * <p>Probe and persistence failures are turned into data ({@code down} results, log entries).
 * Only an oversized batch or a serialization failure fails the request.
 */
@Service
public class CheckBatchService {

    private static final Logger log = LoggerFactory.getLogger(CheckBatchService.class);

    private final ProbeCoordinator probeCoordinator;
    private final PersistenceSink persistenceSink;
    private final ObjectMapper objectMapper;
    private final int maxBatchSize;

    public CheckBatchService(
            ProbeCoordinator probeCoordinator,
            PersistenceSink persistenceSink,
            ObjectMapper objectMapper,
            UptimerProperties properties
    ) {
        this.probeCoordinator = probeCoordinator;
        this.persistenceSink = persistenceSink;
        this.objectMapper = objectMapper;
        this.maxBatchSize = properties.getMaxBatchSize();
    }

    /**
     * Probe and persist every URL of the request.
     *
     * @param request batch request
     * @return one result per URL, in completion order
     * @throws BatchTooLargeException if the request carries more URLs than allowed
     */
    public List<CheckResult> runBatch(CheckBatchRequest request) {
        List<CheckBatchRequest.UrlEntry> entries = request.getUrls() != null ? request.getUrls() : List.of();
        if (entries.size() > maxBatchSize) {
            throw new BatchTooLargeException(entries.size(), maxBatchSize);
        }

        List<CheckTarget> targets = entries.stream()
                .map(entry -> new CheckTarget(entry.getWebsiteId(), entry.getUrl()))
                .toList();

        long start = System.nanoTime();
        List<CheckResult> drained = probeCoordinator.probeAll(targets);

        List<CheckResult> results = new ArrayList<>(drained.size());
        int persistFailures = 0;
        for (CheckResult result : drained) {
            log.info(
                    "Uptime check: website_id={}, url={}, status={}, status_code={}, response_time_ms={}",
                    result.getWebsiteId(),
                    result.getUrl(),
                    result.getStatus().value(),
                    result.getStatusCode(),
                    result.getResponseTimeMs()
            );
            if (!persistenceSink.persist(result)) {
                persistFailures++;
            }
            results.add(result);
        }

        log.info(
                "Batch completed: region={}, targets={}, persist_failures={}, duration_ms={}",
                request.getRegion(),
                targets.size(),
                persistFailures,
                TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start)
        );
        return results;
    }

    /**
     * Serialize results as the JSON response payload.
     *
     * @param results batch results
     * @return JSON array
     * @throws ReportSerializationException if serialization fails
     */
    public String renderReport(List<CheckResult> results) {
        try {
            return objectMapper.writeValueAsString(results);
        } catch (JsonProcessingException e) {
            throw new ReportSerializationException("Error generating response", e);
        }
    }
}
