package com.strategyvault.ledger;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/** Outcome of a committed investment. {@code settlementRef} is filled in once custody confirms. */
@Value
@Builder(toBuilder = true)
public class InvestmentReceipt {

    String strategyId;
    String investorId;
    String asset;
    BigDecimal amount;
    BigDecimal sharesMinted;

    /** Investor's share balance after this investment. */
    BigDecimal sharesHeld;

    String settlementRef;
}
