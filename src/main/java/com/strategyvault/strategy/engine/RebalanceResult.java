package com.strategyvault.strategy.engine;

/** What a rebalance pass did for one strategy. */
public enum RebalanceResult {
    EXECUTED,
    NO_ACTION,
    NOT_DUE,
    BUDGET_EXHAUSTED,
    PAUSED_BY_RISK,
    SKIPPED_BUSY;

    /** True when the pass changed nothing because the strategy section was held. */
    public boolean isSkipped() {
        return this == SKIPPED_BUSY;
    }
}
