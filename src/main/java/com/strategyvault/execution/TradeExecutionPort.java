package com.strategyvault.execution;

import com.strategyvault.domain.enums.TradeDirection;
import com.strategyvault.domain.model.Strategy;
import java.math.BigDecimal;

/**
 * Venue-facing execution seam. Engines decide when and how much to trade; placing
 * the order on a venue is the implementation's job. The strategy's params carry
 * {@code maxSlippageBps} for implementations that enforce it.
 */
public interface TradeExecutionPort {

    /**
     * Executes one trade for a strategy.
     *
     * @param strategy  snapshot of the strategy the trade belongs to
     * @param direction buy or sell of the base asset
     * @param amount    trade size in quote-asset units
     */
    void executeTrade(Strategy strategy, TradeDirection direction, BigDecimal amount);
}
