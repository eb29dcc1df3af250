package com.strategyvault.domain.model;

import com.strategyvault.domain.enums.StrategyStatus;
import com.strategyvault.domain.enums.StrategyType;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Data;

/**
 * A capital-pooling strategy: one algorithm type, one asset pair, a share ledger
 * denominated in the quote asset, and its tuning parameters and recorded metrics.
 *
 * <p>Instances are owned by {@link com.strategyvault.ledger.LedgerStore}. Anything
 * handed out by the ledger is a copy; mutating it has no effect on the ledger.
 *
 * <p>Capital invariants (checked by the ledger before every commit):
 * <ul>
 *   <li>totalCapital equals the sum of capitalContributed over the strategy's positions</li>
 *   <li>totalShares equals the sum of shares over the strategy's positions</li>
 * </ul>
 */
@Data
@Builder(toBuilder = true)
public class Strategy {

    private String id;
    private StrategyType type;
    private StrategyStatus status;

    /** Caller id of the strategy manager who created the strategy. */
    private String creator;

    private String baseAsset;
    private String quoteAsset;

    private BigDecimal totalCapital;
    private BigDecimal activeCapital;

    /** Shares outstanding across all investor positions. Tracked separately from capital. */
    private BigDecimal totalShares;

    private BigDecimal minInvestment;

    /** Upper bound per investment. Zero means unlimited. */
    private BigDecimal maxInvestment;

    private int performanceFeeBps;
    private int managementFeeBpsPerYear;

    private Instant createdAt;

    /** Time of the last rebalance or DCA leg. Null until the first one. */
    private Instant lastRebalance;

    /** Quote-asset amount spent by DCA legs so far. Always zero for other types. */
    private BigDecimal dcaSpent;

    private StrategyParams params;
    private StrategyMetrics metrics;

    public boolean isActive() {
        return status == StrategyStatus.ACTIVE;
    }

    public boolean hasMaxInvestment() {
        return maxInvestment != null && maxInvestment.signum() > 0;
    }

    /** Deep copy: params and metrics are copied as well. */
    public Strategy copy() {
        return toBuilder()
                .params(params != null ? params.copy() : null)
                .metrics(metrics != null ? metrics.toBuilder().build() : null)
                .build();
    }
}
