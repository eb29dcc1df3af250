package com.strategyvault.domain.vo;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Immutable breakdown of the fees charged on a withdrawal.
 * <ul>
 *   <li>managementFee -- annual management rate prorated over the accrual period</li>
 *   <li>performanceFee -- performance rate applied to positive profit only</li>
 * </ul>
 */
@Value
@Builder
public class FeeBreakdown {

    BigDecimal managementFee;
    BigDecimal performanceFee;

    public BigDecimal getTotal() {
        return managementFee.add(performanceFee);
    }

    public static FeeBreakdown zero() {
        return FeeBreakdown.builder()
                .managementFee(BigDecimal.ZERO)
                .performanceFee(BigDecimal.ZERO)
                .build();
    }
}
