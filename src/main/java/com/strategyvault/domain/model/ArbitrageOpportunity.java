package com.strategyvault.domain.model;

import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * A cross-venue price gap found by an external scanner. Executable once, within
 * the validity window counted from {@code timestamp}.
 */
@Value
@Builder
public class ArbitrageOpportunity {

    String id;
    String tokenA;
    String tokenB;
    String venueA;
    String venueB;
    BigDecimal priceA;
    BigDecimal priceB;
    BigDecimal profit;
    Instant timestamp;

    public boolean isExpired(Instant now, long validityWindowSeconds) {
        return now.isAfter(timestamp.plusSeconds(validityWindowSeconds));
    }
}
