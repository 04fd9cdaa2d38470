package com.uptimer.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

/**
 * Outcome of probing one {@link CheckTarget}.
 *
 * <p>{@code statusCode} is 0 when no HTTP response was received.
 */
@Value
@Builder
@JsonPropertyOrder({"websiteId", "url", "status", "statusCode", "responseTime"})
public class CheckResult {
    UUID websiteId;
    String url;
    CheckStatus status;
    int statusCode;

    @JsonProperty("responseTime")
    long responseTimeMs;

    /**
     * Result for a target that produced no HTTP response.
     *
     * @param target probed target
     * @param elapsedMs time spent before the failure
     * @return a {@link CheckStatus#DOWN} result
     */
    public static CheckResult down(CheckTarget target, long elapsedMs) {
        return CheckResult.builder()
                .websiteId(target.getWebsiteId())
                .url(target.getUrl())
                .status(CheckStatus.DOWN)
                .statusCode(0)
                .responseTimeMs(Math.max(0, elapsedMs))
                .build();
    }
}
