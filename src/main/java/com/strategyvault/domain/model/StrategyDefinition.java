package com.strategyvault.domain.model;

import com.strategyvault.domain.enums.StrategyType;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/** Creation request for a strategy. Validated by the ledger before anything is allocated. */
@Value
@Builder
public class StrategyDefinition {

    StrategyType type;
    String baseAsset;
    String quoteAsset;

    @Builder.Default
    BigDecimal minInvestment = BigDecimal.ZERO;

    /** Zero means unlimited. */
    @Builder.Default
    BigDecimal maxInvestment = BigDecimal.ZERO;

    int performanceFeeBps;
    int managementFeeBpsPerYear;

    @Builder.Default
    StrategyParams params = StrategyParams.builder().build();
}
