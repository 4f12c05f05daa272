package com.qqsuccubus.pacer.core.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Outcome of one worker pool sizing step.
 * <p>
 * Computed from a {@link ResourceSnapshot}; when the action is not {@link Action#NONE}
 * the pool is rebuilt with {@code targetWorkers} workers.
 * </p>
 */
@Value
@Builder(toBuilder = true)
@With
public class SizingDecision {
    Action action;

    /**
     * Worker count before the decision.
     */
    int previousWorkers;

    /**
     * Worker count after the decision (equal to previous for {@link Action#NONE}).
     */
    int targetWorkers;

    /**
     * Human-readable reason for this decision.
     */
    String reason;

    long timestampMs;

    /**
     * Sizing action enumeration.
     */
    public enum Action {
        /**
         * Keep the current worker count.
         */
        NONE,

        /**
         * Add workers (host has headroom and work is queueing).
         */
        GROW,

        /**
         * Remove workers (host CPU or memory above threshold).
         */
        SHRINK
    }
}
