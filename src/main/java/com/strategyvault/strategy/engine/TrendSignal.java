package com.strategyvault.strategy.engine;

import com.strategyvault.domain.enums.TradeDirection;
import java.math.BigDecimal;
import lombok.Value;

/**
 * Decision produced by the trend engine: trade {@code direction} because spot
 * deviated from the TWAP by at least the strategy's threshold.
 */
@Value
public class TrendSignal {

    TradeDirection direction;
    BigDecimal price;
    BigDecimal twap;
    BigDecimal deviationBps;
    long twapWindowSeconds;
}
