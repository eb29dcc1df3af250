package com.strategyvault.ledger;

import com.strategyvault.domain.vo.FeeBreakdown;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Outcome of a committed withdrawal: what the investor is owed and what the fee
 * recipient keeps. The transfers themselves happen after the commit.
 */
@Value
@Builder(toBuilder = true)
public class WithdrawalReceipt {

    String strategyId;
    String investorId;
    String asset;
    BigDecimal sharesBurned;

    /** shares × totalCapital / totalShares, before fees. */
    BigDecimal grossAmount;

    BigDecimal capitalReleased;
    FeeBreakdown fees;

    /** grossAmount minus fees; transferred to the investor. */
    BigDecimal netAmount;

    /** Investor's share balance after this withdrawal. Zero means the position was closed. */
    BigDecimal sharesRemaining;

    String settlementRef;
    String feeSettlementRef;
}
