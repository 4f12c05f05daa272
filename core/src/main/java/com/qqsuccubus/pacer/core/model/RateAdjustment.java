package com.qqsuccubus.pacer.core.model;

import lombok.Builder;
import lombok.Value;

/**
 * Result of one adaptive rate window rollover.
 */
@Value
@Builder
public class RateAdjustment {
    Action action;
    int previousRate;
    int currentRate;
    long successes;
    long failures;

    /**
     * Successes over total outcomes in the closed window; 1.0 for an empty window.
     */
    double successRate;

    public enum Action {
        INCREASE,
        DECREASE,
        HOLD
    }
}
