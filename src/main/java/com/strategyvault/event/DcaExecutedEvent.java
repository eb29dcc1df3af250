package com.strategyvault.event;

import java.math.BigDecimal;
import org.springframework.context.ApplicationEvent;

/** Published after a DCA leg has been executed and recorded. */
public class DcaExecutedEvent extends ApplicationEvent {

    private final String strategyId;
    private final BigDecimal amount;
    private final BigDecimal spent;
    private final BigDecimal totalBudget;

    public DcaExecutedEvent(
            Object source, String strategyId, BigDecimal amount, BigDecimal spent, BigDecimal totalBudget) {
        super(source);
        this.strategyId = strategyId;
        this.amount = amount;
        this.spent = spent;
        this.totalBudget = totalBudget;
    }

    public String getStrategyId() {
        return strategyId;
    }

    public BigDecimal getAmount() {
        return amount;
    }

    /** Cumulative spend including this leg. */
    public BigDecimal getSpent() {
        return spent;
    }

    public BigDecimal getTotalBudget() {
        return totalBudget;
    }
}
