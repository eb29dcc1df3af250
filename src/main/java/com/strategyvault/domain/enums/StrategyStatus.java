package com.strategyvault.domain.enums;

/**
 * Lifecycle status of a vault strategy.
 * Transitions: INACTIVE → ACTIVE → PAUSED ↔ ACTIVE. Any state may move to
 * EMERGENCY_STOP, which is terminal.
 */
public enum StrategyStatus {
    INACTIVE,
    ACTIVE,
    PAUSED,
    EMERGENCY_STOP;

    public boolean isTerminal() {
        return this == EMERGENCY_STOP;
    }
}
