package com.uptimer.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.uptimer.api.CheckBatchRequest;
import com.uptimer.config.UptimerProperties;
import com.uptimer.model.CheckResult;
import com.uptimer.model.CheckStatus;
import com.uptimer.probe.ProbeCoordinator;
import com.uptimer.probe.Prober;
import com.uptimer.store.UptimeCheckStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CheckBatchServiceTest {

    @Mock
    private UptimeCheckStore store;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final AtomicInteger probes = new AtomicInteger();
    private ExecutorService executor;
    private UptimerProperties properties;
    private CheckBatchService service;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(5);
        properties = new UptimerProperties();
        Prober prober = target -> {
            probes.incrementAndGet();
            return CheckResult.builder()
                    .websiteId(target.getWebsiteId())
                    .url(target.getUrl())
                    .status(CheckStatus.UP)
                    .statusCode(200)
                    .responseTimeMs(42)
                    .build();
        };
        service = new CheckBatchService(
                new ProbeCoordinator(prober, executor, properties),
                new PersistenceSink(store),
                objectMapper,
                properties
        );
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 1, 2, 3, 4, 5})
    void runBatch_returnsOneResultPerUrl(int size) throws SQLException {
        CheckBatchRequest request = request(size);

        List<CheckResult> results = service.runBatch(request);

        assertEquals(size, results.size());
        assertEquals(size, probes.get());
        assertEquals(
                request.getUrls().stream().map(CheckBatchRequest.UrlEntry::getWebsiteId).collect(Collectors.toSet()),
                results.stream().map(CheckResult::getWebsiteId).collect(Collectors.toSet())
        );
        verify(store, times(size)).insert(any(CheckResult.class));
    }

    @Test
    void runBatch_sixUrls_rejectedWithoutProbingOrPersisting() {
        CheckBatchRequest request = request(6);

        BatchTooLargeException ex = assertThrows(BatchTooLargeException.class, () -> service.runBatch(request));

        assertEquals(6, ex.getSize());
        assertEquals(5, ex.getMax());
        assertEquals(0, probes.get());
        verifyNoInteractions(store);
    }

    @Test
    void runBatch_persistenceFailure_keepsResultAndContinues() throws SQLException {
        CheckBatchRequest request = request(3);
        UUID failingId = request.getUrls().get(1).getWebsiteId();
        doAnswer(invocation -> {
            CheckResult written = invocation.getArgument(0);
            if (failingId.equals(written.getWebsiteId())) {
                throw new SQLException("insert failed");
            }
            return null;
        }).when(store).insert(any(CheckResult.class));

        List<CheckResult> results = service.runBatch(request);

        assertEquals(3, results.size());
        CheckResult failing = results.stream().filter(r -> r.getWebsiteId().equals(failingId)).findFirst().orElseThrow();
        assertEquals(CheckStatus.UP, failing.getStatus());
        assertEquals(200, failing.getStatusCode());
        assertEquals(42, failing.getResponseTimeMs());
        verify(store, times(3)).insert(any(CheckResult.class));
    }

    @Test
    void runBatch_nullUrls_treatedAsEmpty() {
        CheckBatchRequest request = new CheckBatchRequest("eu-west", null);

        assertTrue(service.runBatch(request).isEmpty());
        verifyNoInteractions(store);
    }

    @Test
    void renderReport_usesWireFieldNames() throws Exception {
        UUID id = UUID.randomUUID();
        CheckResult result = CheckResult.builder()
                .websiteId(id)
                .url("https://example.com")
                .status(CheckStatus.DEGRADED)
                .statusCode(200)
                .responseTimeMs(1500)
                .build();

        JsonNode json = objectMapper.readTree(service.renderReport(List.of(result)));

        assertTrue(json.isArray());
        JsonNode first = json.get(0);
        assertEquals(id.toString(), first.get("websiteId").asText());
        assertEquals("https://example.com", first.get("url").asText());
        assertEquals("degraded", first.get("status").asText());
        assertEquals(200, first.get("statusCode").asInt());
        assertEquals(1500, first.get("responseTime").asLong());
        assertFalse(first.has("responseTimeMs"));
    }

    @Test
    void renderReport_emptyBatch_isEmptyArray() {
        assertEquals("[]", service.renderReport(List.of()));
    }

    @Test
    void renderReport_serializationFailure_isFatal() throws Exception {
        ObjectMapper failingMapper = mock(ObjectMapper.class);
        when(failingMapper.writeValueAsString(any())).thenThrow(new JsonProcessingException("boom") {
        });
        CheckBatchService failingService = new CheckBatchService(
                new ProbeCoordinator(target -> CheckResult.down(target, 0), executor, properties),
                new PersistenceSink(store),
                failingMapper,
                properties
        );

        assertThrows(ReportSerializationException.class, () -> failingService.renderReport(List.of()));
    }

    private static CheckBatchRequest request(int size) {
        List<CheckBatchRequest.UrlEntry> urls = new ArrayList<>();
        for (int i = 0; i < size; i++) {
            urls.add(new CheckBatchRequest.UrlEntry(UUID.randomUUID(), "https://site" + i + ".example.com"));
        }
        return new CheckBatchRequest("us-east", urls);
    }
}
