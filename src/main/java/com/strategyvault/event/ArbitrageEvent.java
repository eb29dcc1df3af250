package com.strategyvault.event;

import com.strategyvault.domain.model.ArbitrageOpportunity;
import org.springframework.context.ApplicationEvent;

/**
 * Published when an arbitrage opportunity is consumed. The opportunity is gone
 * from the ledger in all three outcomes.
 */
public class ArbitrageEvent extends ApplicationEvent {

    private final String strategyId;
    private final ArbitrageOpportunity opportunity;
    private final ArbitrageEventType eventType;
    private final String message;

    public ArbitrageEvent(
            Object source,
            String strategyId,
            ArbitrageOpportunity opportunity,
            ArbitrageEventType eventType,
            String message) {
        super(source);
        this.strategyId = strategyId;
        this.opportunity = opportunity;
        this.eventType = eventType;
        this.message = message;
    }

    public String getStrategyId() {
        return strategyId;
    }

    public ArbitrageOpportunity getOpportunity() {
        return opportunity;
    }

    public ArbitrageEventType getEventType() {
        return eventType;
    }

    public String getMessage() {
        return message;
    }
}
