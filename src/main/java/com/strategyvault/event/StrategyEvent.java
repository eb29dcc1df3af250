package com.strategyvault.event;

import com.strategyvault.domain.enums.StrategyStatus;
import com.strategyvault.domain.model.Strategy;
import org.springframework.context.ApplicationEvent;

/**
 * Published after a strategy lifecycle transition has committed to the ledger.
 * Consumed by notification/webhook collaborators outside this service.
 */
public class StrategyEvent extends ApplicationEvent {

    private final Strategy strategy;
    private final StrategyEventType eventType;
    private final StrategyStatus previousStatus;
    private final String reason;

    public StrategyEvent(
            Object source, Strategy strategy, StrategyEventType eventType, StrategyStatus previousStatus, String reason) {
        super(source);
        this.strategy = strategy;
        this.eventType = eventType;
        this.previousStatus = previousStatus;
        this.reason = reason;
    }

    public StrategyEvent(Object source, Strategy strategy, StrategyEventType eventType) {
        this(source, strategy, eventType, null, null);
    }

    public Strategy getStrategy() {
        return strategy;
    }

    public StrategyEventType getEventType() {
        return eventType;
    }

    /**
     * The strategy's status before this event. Null for CREATED events.
     */
    public StrategyStatus getPreviousStatus() {
        return previousStatus;
    }

    public String getReason() {
        return reason;
    }
}
