package com.strategyvault.domain.model;

import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * One investor's stake in one strategy. Immutable: the ledger replaces the
 * position on every invest/withdraw and drops it once shares reach zero.
 */
@Value
@Builder(toBuilder = true)
public class InvestorPosition {

    String strategyId;
    String investorId;
    BigDecimal shares;
    BigDecimal capitalContributed;

    /** First investment into this strategy (since the position was last emptied). */
    Instant openedAt;

    /** Start of the current management-fee accrual period. */
    Instant lastFeeAccrualAt;
}
