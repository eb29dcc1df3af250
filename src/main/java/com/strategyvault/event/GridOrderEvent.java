package com.strategyvault.event;

import com.strategyvault.domain.model.GridOrder;
import java.math.BigDecimal;
import org.springframework.context.ApplicationEvent;

/**
 * Published for every grid order filled during a rebalance, together with the
 * opposite-side order appended to keep the ladder size constant.
 */
public class GridOrderEvent extends ApplicationEvent {

    private final GridOrder filledOrder;
    private final GridOrder replacementOrder;
    private final BigDecimal marketPrice;

    public GridOrderEvent(Object source, GridOrder filledOrder, GridOrder replacementOrder, BigDecimal marketPrice) {
        super(source);
        this.filledOrder = filledOrder;
        this.replacementOrder = replacementOrder;
        this.marketPrice = marketPrice;
    }

    public GridOrder getFilledOrder() {
        return filledOrder;
    }

    public GridOrder getReplacementOrder() {
        return replacementOrder;
    }

    public BigDecimal getMarketPrice() {
        return marketPrice;
    }

    public String getStrategyId() {
        return filledOrder.getStrategyId();
    }
}
