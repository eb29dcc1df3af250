package com.strategyvault.ledger;

import com.strategyvault.domain.enums.TradeDirection;
import com.strategyvault.domain.model.GridOrder;
import com.strategyvault.domain.model.InvestorPosition;
import com.strategyvault.domain.model.Strategy;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything the ledger holds for one strategy: the strategy record, its investor
 * positions and its grid ladder.
 *
 * <p>A published book is never modified. Mutations run against a
 * {@link #workingCopy()} inside the strategy's exclusive section; the ledger
 * publishes the working copy only after it passes the invariant check.
 */
public final class StrategyBook {

    private final Strategy strategy;
    private final Map<String, InvestorPosition> positions;
    private final List<GridOrder> gridOrders;

    StrategyBook(Strategy strategy, Map<String, InvestorPosition> positions, List<GridOrder> gridOrders) {
        this.strategy = strategy;
        this.positions = positions;
        this.gridOrders = gridOrders;
    }

    public static StrategyBook of(Strategy strategy) {
        return new StrategyBook(strategy, new LinkedHashMap<>(), new ArrayList<>());
    }

    StrategyBook workingCopy() {
        List<GridOrder> orders = new ArrayList<>(gridOrders.size());
        for (GridOrder order : gridOrders) {
            orders.add(order.copy());
        }
        return new StrategyBook(strategy.copy(), new LinkedHashMap<>(positions), orders);
    }

    public Strategy getStrategy() {
        return strategy;
    }

    // ---- Positions ----

    public InvestorPosition getPosition(String investorId) {
        return positions.get(investorId);
    }

    public Map<String, InvestorPosition> getPositions() {
        return Collections.unmodifiableMap(positions);
    }

    void putPosition(InvestorPosition position) {
        positions.put(position.getInvestorId(), position);
    }

    void removePosition(String investorId) {
        positions.remove(investorId);
    }

    // ---- Grid ladder ----

    public List<GridOrder> getGridOrders() {
        return Collections.unmodifiableList(gridOrders);
    }

    /** Active orders in ladder order. The returned list is a snapshot; the orders are live. */
    public List<GridOrder> activeGridOrders() {
        List<GridOrder> active = new ArrayList<>();
        for (GridOrder order : gridOrders) {
            if (order.isActive()) {
                active.add(order);
            }
        }
        return active;
    }

    public long activeGridOrderCount() {
        return gridOrders.stream().filter(GridOrder::isActive).count();
    }

    /** Appends a new active order to the ladder and returns it. */
    public GridOrder placeGridOrder(TradeDirection side, BigDecimal price, BigDecimal amount, Instant now) {
        GridOrder order = GridOrder.builder()
                .orderId(gridOrders.size() + 1L)
                .strategyId(strategy.getId())
                .side(side)
                .price(price)
                .amount(amount)
                .active(true)
                .createdAt(now)
                .build();
        gridOrders.add(order);
        return order;
    }

    /** Deactivates every resting order without a fill. Returns how many were cancelled. */
    int cancelGridOrders() {
        int cancelled = 0;
        for (GridOrder order : gridOrders) {
            if (order.isActive()) {
                order.setActive(false);
                cancelled++;
            }
        }
        return cancelled;
    }
}
