package com.strategyvault.strategy.engine;

import com.strategyvault.domain.enums.StrategyType;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/** Typed summary of one rebalance pass, returned to callers and carried by {@code RebalanceEvent}. */
@Value
@Builder(toBuilder = true)
public class RebalanceOutcome {

    String strategyId;
    StrategyType type;
    RebalanceResult result;

    @Builder.Default
    int tradesExecuted = 0;

    @Builder.Default
    List<GridFill> gridFills = List.of();

    /** Present only when the trend engine traded. */
    TrendSignal trendSignal;

    /** Present only when a DCA leg executed. */
    BigDecimal dcaAmount;

    /** DCA progress after the pass, for DCA strategies. */
    BigDecimal dcaSpent;

    BigDecimal dcaTotalBudget;

    String detail;
    Instant at;

    public static RebalanceOutcome skipped(String strategyId, StrategyType type, Instant at) {
        return RebalanceOutcome.builder()
                .strategyId(strategyId)
                .type(type)
                .result(RebalanceResult.SKIPPED_BUSY)
                .detail("strategy section busy")
                .at(at)
                .build();
    }

    public boolean isExecuted() {
        return result == RebalanceResult.EXECUTED;
    }
}
