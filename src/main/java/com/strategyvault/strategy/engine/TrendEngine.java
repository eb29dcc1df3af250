package com.strategyvault.strategy.engine;

import com.strategyvault.domain.enums.StrategyType;
import com.strategyvault.domain.enums.TradeDirection;
import com.strategyvault.domain.model.Strategy;
import com.strategyvault.execution.TradeExecutionPort;
import com.strategyvault.ledger.StrategyBook;
import com.strategyvault.market.PriceFeed;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Momentum and mean-reversion. Both compare spot with a TWAP and act once the
 * deviation reaches {@code rebalanceThresholdBps}:
 * <ul>
 *   <li>Momentum uses a 1h TWAP and trades with the move (buy above, sell below).</li>
 *   <li>Mean reversion uses a 4h TWAP and fades it (sell above, buy below).</li>
 * </ul>
 * The signal functions are pure; {@link #rebalance} sizes the trade from active capital
 * and hands it to the execution port.
 */
@Component
public class TrendEngine implements RebalanceEngine {

    private static final Logger log = LoggerFactory.getLogger(TrendEngine.class);

    public static final long MOMENTUM_TWAP_WINDOW_SECONDS = 3_600;
    public static final long MEAN_REVERSION_TWAP_WINDOW_SECONDS = 14_400;

    private static final BigDecimal BPS_MULTIPLIER = BigDecimal.valueOf(10_000);
    private static final int DEVIATION_SCALE = 4;

    private final PriceFeed priceFeed;
    private final TradeExecutionPort tradeExecutionPort;

    public TrendEngine(PriceFeed priceFeed, TradeExecutionPort tradeExecutionPort) {
        this.priceFeed = priceFeed;
        this.tradeExecutionPort = tradeExecutionPort;
    }

    @Override
    public boolean supports(StrategyType type) {
        return type == StrategyType.MOMENTUM || type == StrategyType.MEAN_REVERSION;
    }

    /** Trend-following signal against the 1h TWAP. */
    public Optional<TrendSignal> momentum(Strategy strategy) {
        return signal(strategy, MOMENTUM_TWAP_WINDOW_SECONDS, false);
    }

    /** Fade signal against the 4h TWAP. */
    public Optional<TrendSignal> meanReversion(Strategy strategy) {
        return signal(strategy, MEAN_REVERSION_TWAP_WINDOW_SECONDS, true);
    }

    @Override
    public RebalanceOutcome rebalance(StrategyBook book, Instant now) {
        Strategy strategy = book.getStrategy();
        Optional<TrendSignal> signal =
                strategy.getType() == StrategyType.MOMENTUM ? momentum(strategy) : meanReversion(strategy);
        strategy.setLastRebalance(now);

        RebalanceOutcome.RebalanceOutcomeBuilder outcome = RebalanceOutcome.builder()
                .strategyId(strategy.getId())
                .type(strategy.getType())
                .at(now);
        if (signal.isEmpty()) {
            return outcome.result(RebalanceResult.NO_ACTION)
                    .detail("deviation below threshold")
                    .build();
        }

        TrendSignal trendSignal = signal.get();
        BigDecimal size = TradeSizing.tradeSize(strategy);
        if (size.signum() <= 0) {
            log.debug("Trend signal on {} ignored: no active capital", strategy.getId());
            return outcome.result(RebalanceResult.NO_ACTION)
                    .trendSignal(trendSignal)
                    .detail("no active capital to trade")
                    .build();
        }

        tradeExecutionPort.executeTrade(strategy.copy(), trendSignal.getDirection(), size);
        strategy.getMetrics().recordTrade(false, now);

        log.info(
                "Trend trade: strategy={}, {} {} (price={}, twap={}, deviation={} bps)",
                strategy.getId(),
                trendSignal.getDirection(),
                size.toPlainString(),
                trendSignal.getPrice().toPlainString(),
                trendSignal.getTwap().toPlainString(),
                trendSignal.getDeviationBps().toPlainString());

        return outcome.result(RebalanceResult.EXECUTED)
                .tradesExecuted(1)
                .trendSignal(trendSignal)
                .detail(trendSignal.getDirection() + " " + size.toPlainString())
                .build();
    }

    private Optional<TrendSignal> signal(Strategy strategy, long windowSeconds, boolean fade) {
        BigDecimal price = priceFeed.getPrice(strategy.getBaseAsset());
        BigDecimal twap = priceFeed.getTwap(strategy.getBaseAsset(), windowSeconds);
        if (twap == null || twap.signum() <= 0) {
            log.warn("No usable {}s TWAP for {}, skipping signal", windowSeconds, strategy.getBaseAsset());
            return Optional.empty();
        }

        BigDecimal deviationBps = deviationBps(price, twap);
        if (deviationBps.signum() == 0
                || deviationBps.compareTo(BigDecimal.valueOf(strategy.getParams().getRebalanceThresholdBps())) < 0) {
            return Optional.empty();
        }

        TradeDirection withTheMove = price.compareTo(twap) > 0 ? TradeDirection.BUY : TradeDirection.SELL;
        TradeDirection direction = fade ? withTheMove.opposite() : withTheMove;
        return Optional.of(new TrendSignal(direction, price, twap, deviationBps, windowSeconds));
    }

    /** {@code |price − twap| × 10000 / twap}. */
    static BigDecimal deviationBps(BigDecimal price, BigDecimal twap) {
        return price.subtract(twap).abs().multiply(BPS_MULTIPLIER).divide(twap, DEVIATION_SCALE, RoundingMode.DOWN);
    }
}
