package com.strategyvault.event;

import java.math.BigDecimal;
import org.springframework.context.ApplicationEvent;

/**
 * Published when an investor's position changes. For INVESTED, {@code amount} is the
 * deposit and {@code shares} the minted shares. For WITHDRAWN, {@code amount} is the
 * gross withdrawal, {@code shares} the burned shares and {@code fee} the fees retained.
 */
public class InvestmentEvent extends ApplicationEvent {

    private final String strategyId;
    private final String investorId;
    private final InvestmentEventType eventType;
    private final BigDecimal amount;
    private final BigDecimal shares;
    private final BigDecimal fee;

    public InvestmentEvent(
            Object source,
            String strategyId,
            String investorId,
            InvestmentEventType eventType,
            BigDecimal amount,
            BigDecimal shares,
            BigDecimal fee) {
        super(source);
        this.strategyId = strategyId;
        this.investorId = investorId;
        this.eventType = eventType;
        this.amount = amount;
        this.shares = shares;
        this.fee = fee != null ? fee : BigDecimal.ZERO;
    }

    public String getStrategyId() {
        return strategyId;
    }

    public String getInvestorId() {
        return investorId;
    }

    public InvestmentEventType getEventType() {
        return eventType;
    }

    public BigDecimal getAmount() {
        return amount;
    }

    public BigDecimal getShares() {
        return shares;
    }

    public BigDecimal getFee() {
        return fee;
    }
}
