package com.strategyvault.strategy.engine;

import com.strategyvault.domain.model.ArbitrageOpportunity;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * Result of consuming one arbitrage opportunity. The opportunity has been removed
 * from the ledger whatever the status.
 */
@Value
@Builder
public class ArbitrageResult {

    String strategyId;
    ArbitrageOpportunity opportunity;
    ArbitrageStatus status;

    /** Quote-asset size of each leg. Zero unless executed. */
    @Builder.Default
    BigDecimal tradeSize = BigDecimal.ZERO;

    /** Venue failure behind a FAILED result. */
    RuntimeException failure;

    String message;
    Instant at;

    public boolean isExecuted() {
        return status == ArbitrageStatus.EXECUTED;
    }
}
