package com.strategyvault.simulator;

import com.strategyvault.exception.ResourceNotFoundException;
import com.strategyvault.market.PriceFeed;
import java.math.BigDecimal;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory {@link PriceFeed} for local runs and tests. Spot prices are seeded from
 * {@code vault.simulation.prices.*} and can be moved at runtime. A TWAP that was never
 * set falls back to the current spot price, i.e. a flat market.
 */
public class SimulatedPriceFeed implements PriceFeed {

    private static final Logger log = LoggerFactory.getLogger(SimulatedPriceFeed.class);

    private final Map<String, BigDecimal> prices = new ConcurrentHashMap<>();

    /** TWAPs keyed by {@code ASSET:windowSeconds}. */
    private final Map<String, BigDecimal> twaps = new ConcurrentHashMap<>();

    public SimulatedPriceFeed(Map<String, BigDecimal> seedPrices) {
        if (seedPrices != null) {
            seedPrices.forEach(this::setPrice);
        }
        log.info("Simulated price feed started with {} seeded assets", prices.size());
    }

    @Override
    public BigDecimal getPrice(String asset) {
        BigDecimal price = prices.get(key(asset));
        if (price == null) {
            throw new ResourceNotFoundException("Price", asset);
        }
        return price;
    }

    @Override
    public BigDecimal getTwap(String asset, long windowSeconds) {
        BigDecimal twap = twaps.get(twapKey(asset, windowSeconds));
        return twap != null ? twap : getPrice(asset);
    }

    public void setPrice(String asset, BigDecimal price) {
        if (price == null || price.signum() <= 0) {
            throw new IllegalArgumentException("Simulated price must be positive: " + asset + "=" + price);
        }
        prices.put(key(asset), price);
        log.debug("Simulated price {} = {}", asset, price.toPlainString());
    }

    public void setTwap(String asset, long windowSeconds, BigDecimal twap) {
        twaps.put(twapKey(asset, windowSeconds), twap);
    }

    public void clearTwaps() {
        twaps.clear();
    }

    private static String key(String asset) {
        return asset.toUpperCase(Locale.ROOT);
    }

    private static String twapKey(String asset, long windowSeconds) {
        return key(asset) + ":" + windowSeconds;
    }
}
