package com.uptimer.probe;

import com.uptimer.model.CheckResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;

/**
 * Gathers the results of one batch from concurrent probe threads.
 *
 * <p>Capacity equals the number of targets, so a producer never waits for the consumer. The
 * collector is drained once, after every producer finished.
 */
public class ResultCollector {

    private final int expected;
    private final BlockingQueue<CheckResult> queue;

    public ResultCollector(int expected) {
        if (expected < 0) {
            throw new IllegalArgumentException("expected must be >= 0");
        }
        this.expected = expected;
        this.queue = new ArrayBlockingQueue<>(Math.max(1, expected));
    }

    /**
     * Add one result. Safe to call from any thread.
     *
     * @param result probe result
     * @throws IllegalStateException if the collector already holds {@code expected} results
     */
    public void add(CheckResult result) {
        Objects.requireNonNull(result, "result");
        if (expected == 0 || !queue.offer(result)) {
            throw new IllegalStateException("Collector is full: expected=" + expected);
        }
    }

    int size() {
        return queue.size();
    }

    /**
     * Remove and return all results in arrival order.
     *
     * @return exactly {@code expected} results
     * @throws IllegalStateException if results are missing
     */
    public List<CheckResult> drain() {
        List<CheckResult> out = new ArrayList<>(expected);
        queue.drainTo(out);
        if (out.size() != expected) {
            throw new IllegalStateException("Expected " + expected + " results but collected " + out.size());
        }
        return out;
    }
}
