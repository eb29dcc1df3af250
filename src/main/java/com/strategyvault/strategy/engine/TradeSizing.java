package com.strategyvault.strategy.engine;

import com.strategyvault.domain.model.Strategy;
import java.math.BigDecimal;
import java.math.RoundingMode;

/** Quote-asset trade sizes derived from a strategy's active capital. */
public final class TradeSizing {

    private static final BigDecimal BPS_DIVISOR = BigDecimal.valueOf(10_000);
    private static final int SCALE = 18;

    private TradeSizing() {}

    /** {@code activeCapital × tradeSizeBps / 10000}, rounded down. */
    public static BigDecimal tradeSize(Strategy strategy) {
        return strategy.getActiveCapital()
                .multiply(BigDecimal.valueOf(strategy.getParams().getTradeSizeBps()))
                .divide(BPS_DIVISOR, SCALE, RoundingMode.DOWN)
                .stripTrailingZeros();
    }

    /** Size of one grid order: {@code activeCapital / (2 × gridLevels)}, rounded down. */
    public static BigDecimal gridOrderSize(Strategy strategy) {
        int levels = strategy.getParams().getGridLevels();
        if (levels < 1) {
            return BigDecimal.ZERO;
        }
        return strategy.getActiveCapital()
                .divide(BigDecimal.valueOf(2L * levels), SCALE, RoundingMode.DOWN)
                .stripTrailingZeros();
    }
}
