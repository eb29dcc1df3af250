package com.strategyvault.domain.model;

import com.strategyvault.domain.enums.TradeDirection;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Data;

/**
 * A resting order on a grid ladder. Orders are never removed: a fill marks the
 * order inactive and the grid engine appends one replacement on the opposite side.
 */
@Data
@Builder(toBuilder = true)
public class GridOrder {

    /** Sequence number within the strategy's ladder, starting at 1. */
    private long orderId;

    private String strategyId;
    private BigDecimal price;
    private BigDecimal amount;
    private TradeDirection side;
    private boolean active;
    private Instant createdAt;
    private Instant filledAt;

    public boolean isBuy() {
        return side == TradeDirection.BUY;
    }

    public GridOrder copy() {
        return toBuilder().build();
    }
}
