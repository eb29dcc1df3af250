package com.strategyvault.strategy.engine;

import com.strategyvault.domain.enums.StrategyType;
import com.strategyvault.domain.enums.TradeDirection;
import com.strategyvault.domain.model.GridOrder;
import com.strategyvault.domain.model.Strategy;
import com.strategyvault.exception.ErrorCode;
import com.strategyvault.exception.ValidationException;
import com.strategyvault.execution.TradeExecutionPort;
import com.strategyvault.ledger.StrategyBook;
import com.strategyvault.market.PriceFeed;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Grid trading: a symmetric ladder of resting buy and sell orders around a reference
 * price that walks with the market as orders fill.
 *
 * <p>Seeding places {@code gridLevels} buys at {@code base − i·spacing} and as many sells
 * at {@code base + i·spacing}. On each rebalance, a buy at or above the market price
 * and a sell at or below it are crossed: the order is marked filled and one order is
 * appended on the opposite side, two spacings away. The number of active orders is
 * therefore always {@code 2 × gridLevels} while the strategy runs.
 *
 * <p>Orders seeded before any capital arrived carry a zero amount and are sized from
 * active capital at fill time. A replacement keeps the amount that was traded.
 */
@Component
public class GridEngine implements RebalanceEngine {

    private static final Logger log = LoggerFactory.getLogger(GridEngine.class);

    private static final BigDecimal TWO = BigDecimal.valueOf(2);

    private final PriceFeed priceFeed;
    private final TradeExecutionPort tradeExecutionPort;

    public GridEngine(PriceFeed priceFeed, TradeExecutionPort tradeExecutionPort) {
        this.priceFeed = priceFeed;
        this.tradeExecutionPort = tradeExecutionPort;
    }

    @Override
    public boolean supports(StrategyType type) {
        return type == StrategyType.GRID_TRADING;
    }

    /**
     * Places the initial ladder around the current base-asset price.
     *
     * @throws ValidationException INVALID_PARAMS if the geometry is unusable at this price
     */
    public List<GridOrder> seedLadder(StrategyBook book, Instant now) {
        Strategy strategy = book.getStrategy();
        int levels = strategy.getParams().getGridLevels();
        BigDecimal spacing = strategy.getParams().getGridSpacing();
        if (levels < 1 || spacing == null || spacing.signum() <= 0) {
            throw new ValidationException(
                    ErrorCode.INVALID_PARAMS, "Grid needs gridLevels >= 1 and gridSpacing > 0");
        }

        BigDecimal basePrice = priceFeed.getPrice(strategy.getBaseAsset());
        BigDecimal lowestBuy = basePrice.subtract(spacing.multiply(BigDecimal.valueOf(levels)));
        if (lowestBuy.signum() <= 0) {
            throw new ValidationException(
                    ErrorCode.INVALID_PARAMS,
                    "Lowest grid level " + lowestBuy.toPlainString() + " is not a positive price",
                    Map.of("basePrice", basePrice, "gridLevels", levels, "gridSpacing", spacing));
        }

        BigDecimal orderSize = TradeSizing.gridOrderSize(strategy);
        List<GridOrder> placed = new ArrayList<>(2 * levels);
        for (int i = 1; i <= levels; i++) {
            BigDecimal offset = spacing.multiply(BigDecimal.valueOf(i));
            placed.add(book.placeGridOrder(TradeDirection.BUY, basePrice.subtract(offset), orderSize, now));
            placed.add(book.placeGridOrder(TradeDirection.SELL, basePrice.add(offset), orderSize, now));
        }
        log.info(
                "Grid ladder seeded: strategy={}, base={}, levels={}, spacing={}",
                strategy.getId(),
                basePrice.toPlainString(),
                levels,
                spacing.toPlainString());
        return placed;
    }

    @Override
    public RebalanceOutcome rebalance(StrategyBook book, Instant now) {
        Strategy strategy = book.getStrategy();
        BigDecimal price = priceFeed.getPrice(strategy.getBaseAsset());
        BigDecimal spacing = strategy.getParams().getGridSpacing();

        List<GridFill> fills = new ArrayList<>();
        // Replacements appended below are not evaluated until the next pass
        for (GridOrder order : book.activeGridOrders()) {
            if (!isCrossed(order, price)) {
                continue;
            }
            BigDecimal amount = order.getAmount().signum() > 0 ? order.getAmount() : TradeSizing.gridOrderSize(strategy);
            if (amount.signum() > 0) {
                tradeExecutionPort.executeTrade(strategy.copy(), order.getSide(), amount);
                strategy.getMetrics().recordTrade(false, now);
            }

            order.setActive(false);
            order.setFilledAt(now);
            order.setAmount(amount);

            GridOrder replacement = book.placeGridOrder(
                    order.getSide().opposite(), replacementPrice(order, spacing), amount, now);
            fills.add(new GridFill(order.copy(), replacement.copy(), price));

            log.debug(
                    "Grid fill: strategy={}, order={} {} @ {}, market={}, replacement={} {} @ {}",
                    strategy.getId(),
                    order.getOrderId(),
                    order.getSide(),
                    order.getPrice().toPlainString(),
                    price.toPlainString(),
                    replacement.getOrderId(),
                    replacement.getSide(),
                    replacement.getPrice().toPlainString());
        }

        strategy.setLastRebalance(now);
        return RebalanceOutcome.builder()
                .strategyId(strategy.getId())
                .type(strategy.getType())
                .result(fills.isEmpty() ? RebalanceResult.NO_ACTION : RebalanceResult.EXECUTED)
                .tradesExecuted(fills.size())
                .gridFills(List.copyOf(fills))
                .detail(fills.size() + " grid orders filled at " + price.toPlainString())
                .at(now)
                .build();
    }

    /** A buy fills once the market trades down to it, a sell once the market trades up to it. */
    static boolean isCrossed(GridOrder order, BigDecimal price) {
        return order.isBuy() ? price.compareTo(order.getPrice()) <= 0 : price.compareTo(order.getPrice()) >= 0;
    }

    static BigDecimal replacementPrice(GridOrder filled, BigDecimal spacing) {
        BigDecimal step = spacing.multiply(TWO);
        return filled.isBuy() ? filled.getPrice().add(step) : filled.getPrice().subtract(step);
    }
}
