package com.strategyvault.domain.enums;

/** Buy or sell side of a trade handed to the execution port. */
public enum TradeDirection {
    BUY,
    SELL;

    /** Returns the opposite side: BUY -> SELL, SELL -> BUY. Used for grid replacement orders. */
    public TradeDirection opposite() {
        return this == BUY ? SELL : BUY;
    }
}
