package com.uptimer.controller;

import com.uptimer.api.CheckBatchRequest;
import com.uptimer.model.CheckResult;
import com.uptimer.service.CheckBatchService;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api")
public class CheckController {

    private final CheckBatchService checkBatchService;

    public CheckController(CheckBatchService checkBatchService) {
        this.checkBatchService = checkBatchService;
    }

    /**
     * Probe a batch of URLs and return one result per URL.
     *
     * POST /api/check
     *
     * @param request region and up to five website URLs
     * @return JSON array of check results
     */
    @PostMapping(value = "/check", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<String> check(@Valid @RequestBody CheckBatchRequest request) {
        List<CheckResult> results = checkBatchService.runBatch(request);
        String body = checkBatchService.renderReport(results);
        return ResponseEntity.ok()
                .contentType(MediaType.APPLICATION_JSON)
                .body(body);
    }
}
