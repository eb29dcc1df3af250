package com.strategyvault.market;

import java.math.BigDecimal;

/**
 * Read-only price oracle consumed by the rebalancing engines.
 *
 * <p>Prices are quoted in the strategy's quote asset per unit of the base asset.
 * This service enforces no staleness bound; freshness is the oracle's concern.
 */
public interface PriceFeed {

    /**
     * Returns the current spot price for an asset.
     *
     * @throws com.strategyvault.exception.ResourceNotFoundException if the feed has no price for the asset
     */
    BigDecimal getPrice(String asset);

    /**
     * Returns the time-weighted average price over the trailing window.
     *
     * @param asset         the asset symbol
     * @param windowSeconds trailing window length, e.g. 3600 for one hour
     */
    BigDecimal getTwap(String asset, long windowSeconds);
}
