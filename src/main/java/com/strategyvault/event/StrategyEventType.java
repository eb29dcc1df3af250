package com.strategyvault.event;

/**
 * Classifies the lifecycle transition that triggered a {@link StrategyEvent}.
 * Lifecycle: CREATED -> ACTIVATED -> PAUSED/RESUMED, and EMERGENCY_STOPPED from any state.
 */
public enum StrategyEventType {

    /** Strategy record allocated in INACTIVE state. */
    CREATED,

    /** Strategy moved INACTIVE -> ACTIVE (grid ladder seeded where applicable). */
    ACTIVATED,

    /** Strategy paused manually, by the risk guard, or by DCA budget exhaustion. */
    PAUSED,

    /** Strategy resumed from PAUSED. */
    RESUMED,

    /** Tuning parameters replaced. */
    PARAMS_UPDATED,

    /** Strategy forced into the terminal EMERGENCY_STOP state. */
    EMERGENCY_STOPPED
}
