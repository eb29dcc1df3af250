package com.strategyvault.event;

import com.strategyvault.domain.enums.StrategyStatus;
import com.strategyvault.domain.model.ArbitrageOpportunity;
import com.strategyvault.domain.model.GridOrder;
import com.strategyvault.domain.model.Strategy;
import com.strategyvault.strategy.engine.RebalanceOutcome;
import java.math.BigDecimal;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Convenience wrapper around Spring's {@link ApplicationEventPublisher} with typed
 * factory methods for every vault event.
 *
 * <p>Callers publish only after the ledger mutation the event describes has
 * committed, so listeners never observe an event for state that was discarded.
 * Delivery is synchronous unless a listener is declared {@code @Async}.
 */
@Component
public class EventPublisherHelper {

    private final ApplicationEventPublisher applicationEventPublisher;

    public EventPublisherHelper(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    // ---- Strategy ----

    public void publishStrategyCreated(Object source, Strategy strategy) {
        applicationEventPublisher.publishEvent(new StrategyEvent(source, strategy, StrategyEventType.CREATED));
    }

    public void publishStrategyEvent(
            Object source,
            Strategy strategy,
            StrategyEventType eventType,
            StrategyStatus previousStatus,
            String reason) {
        applicationEventPublisher.publishEvent(new StrategyEvent(source, strategy, eventType, previousStatus, reason));
    }

    // ---- Investment ----

    public void publishInvested(
            Object source, String strategyId, String investorId, BigDecimal amount, BigDecimal shares) {
        applicationEventPublisher.publishEvent(new InvestmentEvent(
                source, strategyId, investorId, InvestmentEventType.INVESTED, amount, shares, BigDecimal.ZERO));
    }

    public void publishWithdrawn(
            Object source,
            String strategyId,
            String investorId,
            BigDecimal grossAmount,
            BigDecimal shares,
            BigDecimal fee) {
        applicationEventPublisher.publishEvent(new InvestmentEvent(
                source, strategyId, investorId, InvestmentEventType.WITHDRAWN, grossAmount, shares, fee));
    }

    // ---- Rebalance ----

    public void publishRebalanced(Object source, RebalanceOutcome outcome) {
        applicationEventPublisher.publishEvent(new RebalanceEvent(source, outcome));
    }

    public void publishGridOrderFilled(
            Object source, GridOrder filledOrder, GridOrder replacementOrder, BigDecimal marketPrice) {
        applicationEventPublisher.publishEvent(new GridOrderEvent(source, filledOrder, replacementOrder, marketPrice));
    }

    public void publishDcaExecuted(
            Object source, String strategyId, BigDecimal amount, BigDecimal spent, BigDecimal totalBudget) {
        applicationEventPublisher.publishEvent(new DcaExecutedEvent(source, strategyId, amount, spent, totalBudget));
    }

    // ---- Arbitrage ----

    public void publishArbitrage(
            Object source,
            String strategyId,
            ArbitrageOpportunity opportunity,
            ArbitrageEventType eventType,
            String message) {
        applicationEventPublisher.publishEvent(
                new ArbitrageEvent(source, strategyId, opportunity, eventType, message));
    }

    // ---- Settlement ----

    public void publishSettlementFailed(
            Object source,
            String strategyId,
            String operation,
            String asset,
            String from,
            String to,
            BigDecimal amount,
            String reason) {
        applicationEventPublisher.publishEvent(
                new SettlementFailedEvent(source, strategyId, operation, asset, from, to, amount, reason));
    }
}
