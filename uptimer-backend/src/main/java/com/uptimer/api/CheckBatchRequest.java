package com.uptimer.api;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.UUID;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CheckBatchRequest {
    private String region;

    @NotNull(message = "urls is required")
    private List<@NotNull(message = "url entry must not be null") @Valid UrlEntry> urls;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class UrlEntry {
        @NotNull(message = "websiteId is required")
        private UUID websiteId;

        @NotBlank(message = "url is required")
        private String url;
    }
}
