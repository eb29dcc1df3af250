package com.strategyvault.domain.model;

import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Data;

/**
 * Cumulative performance snapshot for a strategy.
 *
 * <p>Trade counts and win rate are maintained by the rebalance path. Return,
 * Sharpe ratio, drawdown and volatility are computed outside this service and
 * recorded as reported.
 */
@Data
@Builder(toBuilder = true)
public class StrategyMetrics {

    @Builder.Default
    private long totalReturnBps = 0;

    @Builder.Default
    private BigDecimal sharpeRatio = BigDecimal.ZERO;

    @Builder.Default
    private long maxDrawdownBps = 0;

    @Builder.Default
    private int winRateBps = 0;

    @Builder.Default
    private long totalTrades = 0;

    @Builder.Default
    private long profitableTrades = 0;

    @Builder.Default
    private long averageReturnBps = 0;

    @Builder.Default
    private long volatilityBps = 0;

    private Instant lastUpdated;

    public static StrategyMetrics empty() {
        return StrategyMetrics.builder().build();
    }

    /** Counts one executed trade and recomputes the win rate. */
    public void recordTrade(boolean profitable, Instant at) {
        totalTrades++;
        if (profitable) {
            profitableTrades++;
        }
        winRateBps = (int) (profitableTrades * 10_000 / totalTrades);
        lastUpdated = at;
    }
}
