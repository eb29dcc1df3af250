package com.strategyvault.domain.enums;

/**
 * Algorithm family a vault strategy runs. GRID_TRADING, DCA, MOMENTUM, MEAN_REVERSION
 * and ARBITRAGE have engines in this service. LIQUIDITY_PROVIDING, DELTA_NEUTRAL and
 * YIELD_FARMING pool capital but rebalance as a recorded no-op.
 */
public enum StrategyType {
    GRID_TRADING,
    DCA,
    MOMENTUM,
    MEAN_REVERSION,
    ARBITRAGE,
    LIQUIDITY_PROVIDING,
    DELTA_NEUTRAL,
    YIELD_FARMING
}
