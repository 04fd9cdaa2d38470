package com.uptimer.service;

import com.uptimer.model.CheckResult;
import com.uptimer.store.UptimeCheckStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.sql.SQLException;

/**
 * Writes check results to the store one at a time. A failed write is logged and never retried,
 * and never affects other results of the batch.
 */
@Slf4j
@Service
public class PersistenceSink {

    private final UptimeCheckStore store;

    public PersistenceSink(UptimeCheckStore store) {
        this.store = store;
    }

    /**
     * Persist one result.
     *
     * @param result check result
     * @return {@code true} if the record was written
     */
    public boolean persist(CheckResult result) {
        try {
            store.insert(result);
            return true;
        } catch (SQLException | RuntimeException e) {
            log.error("Error inserting uptime check: website_id={}, status={}", result.getWebsiteId(), result.getStatus().value(), e);
            return false;
        }
    }
}
