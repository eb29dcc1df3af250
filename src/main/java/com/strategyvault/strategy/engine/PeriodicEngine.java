package com.strategyvault.strategy.engine;

import com.strategyvault.domain.enums.StrategyStatus;
import com.strategyvault.domain.enums.StrategyType;
import com.strategyvault.domain.enums.TradeDirection;
import com.strategyvault.domain.model.Strategy;
import com.strategyvault.domain.model.StrategyParams;
import com.strategyvault.execution.TradeExecutionPort;
import com.strategyvault.ledger.StrategyBook;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Dollar-cost averaging: buys a fixed {@code dcaAmount} every {@code dcaIntervalSeconds}
 * until {@code dcaTotalBudget} is spent, then pauses the strategy.
 *
 * <p>The budget is checked before the interval, so the tick after the last affordable
 * leg pauses the strategy even if the interval has not elapsed yet. The first leg is
 * due on the first tick after activation.
 */
@Component
public class PeriodicEngine implements RebalanceEngine {

    private static final Logger log = LoggerFactory.getLogger(PeriodicEngine.class);

    private final TradeExecutionPort tradeExecutionPort;

    public PeriodicEngine(TradeExecutionPort tradeExecutionPort) {
        this.tradeExecutionPort = tradeExecutionPort;
    }

    @Override
    public boolean supports(StrategyType type) {
        return type == StrategyType.DCA;
    }

    @Override
    public RebalanceOutcome rebalance(StrategyBook book, Instant now) {
        return tick(book.getStrategy(), now);
    }

    RebalanceOutcome tick(Strategy strategy, Instant now) {
        StrategyParams params = strategy.getParams();
        BigDecimal spent = strategy.getDcaSpent() != null ? strategy.getDcaSpent() : BigDecimal.ZERO;
        BigDecimal amount = params.getDcaAmount();
        BigDecimal budget = params.getDcaTotalBudget();

        RebalanceOutcome.RebalanceOutcomeBuilder outcome = RebalanceOutcome.builder()
                .strategyId(strategy.getId())
                .type(strategy.getType())
                .dcaSpent(spent)
                .dcaTotalBudget(budget)
                .at(now);

        if (spent.compareTo(budget) >= 0 || spent.add(amount).compareTo(budget) > 0) {
            strategy.setStatus(StrategyStatus.PAUSED);
            log.info(
                    "DCA budget exhausted: strategy={}, spent={}, budget={}; strategy paused",
                    strategy.getId(),
                    spent.toPlainString(),
                    budget.toPlainString());
            return outcome.result(RebalanceResult.BUDGET_EXHAUSTED)
                    .detail("spent " + spent.toPlainString() + " of " + budget.toPlainString())
                    .build();
        }

        Instant last = strategy.getLastRebalance();
        if (last != null && Duration.between(last, now).getSeconds() < params.getDcaIntervalSeconds()) {
            return outcome.result(RebalanceResult.NOT_DUE)
                    .detail("next leg due at " + last.plusSeconds(params.getDcaIntervalSeconds()))
                    .build();
        }

        tradeExecutionPort.executeTrade(strategy.copy(), TradeDirection.BUY, amount);
        BigDecimal newSpent = spent.add(amount);
        strategy.setDcaSpent(newSpent);
        strategy.setLastRebalance(now);
        strategy.getMetrics().recordTrade(false, now);

        log.info(
                "DCA leg executed: strategy={}, amount={}, spent={}/{}",
                strategy.getId(),
                amount.toPlainString(),
                newSpent.toPlainString(),
                budget.toPlainString());

        return outcome.result(RebalanceResult.EXECUTED)
                .tradesExecuted(1)
                .dcaAmount(amount)
                .dcaSpent(newSpent)
                .detail("spent " + newSpent.toPlainString() + " of " + budget.toPlainString())
                .build();
    }
}
