package com.strategyvault.event;

import com.strategyvault.strategy.engine.RebalanceOutcome;
import org.springframework.context.ApplicationEvent;

/**
 * Published once per rebalance attempt, whatever the engine decided. Passes skipped
 * because the strategy was busy are published too.
 */
public class RebalanceEvent extends ApplicationEvent {

    private final RebalanceOutcome outcome;

    public RebalanceEvent(Object source, RebalanceOutcome outcome) {
        super(source);
        this.outcome = outcome;
    }

    public RebalanceOutcome getOutcome() {
        return outcome;
    }

    public String getStrategyId() {
        return outcome.getStrategyId();
    }
}
