package com.uptimer.store;

import com.uptimer.model.CheckResult;

import java.sql.SQLException;

/**
 * Durable append-only store for uptime check records.
 */
public interface UptimeCheckStore {

    /**
     * Append one record. Each call is its own unit of work.
     *
     * @param result check result to record
     * @throws SQLException if the write fails
     */
    void insert(CheckResult result) throws SQLException;
}
