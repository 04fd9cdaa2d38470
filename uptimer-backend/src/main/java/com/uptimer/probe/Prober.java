package com.uptimer.probe;

import com.uptimer.model.CheckResult;
import com.uptimer.model.CheckTarget;

/**
 * Checks a single target.
 *
 * <p>Implementations must not throw: every failure is reported as a
 * {@link com.uptimer.model.CheckStatus#DOWN} result.
 */
@FunctionalInterface
public interface Prober {

    /**
     * Probes one target.
     *
     * @param target target to check
     * @return exactly one result for the target
     */
    CheckResult probe(CheckTarget target);
}
