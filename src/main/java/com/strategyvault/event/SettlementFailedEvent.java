package com.strategyvault.event;

import java.math.BigDecimal;
import org.springframework.context.ApplicationEvent;

/**
 * Published when a transfer fails after its ledger mutation has already committed.
 * The ledger and custody now disagree until an operator reconciles them.
 */
public class SettlementFailedEvent extends ApplicationEvent {

    private final String strategyId;
    private final String operation;
    private final String asset;
    private final String from;
    private final String to;
    private final BigDecimal amount;
    private final String reason;

    public SettlementFailedEvent(
            Object source,
            String strategyId,
            String operation,
            String asset,
            String from,
            String to,
            BigDecimal amount,
            String reason) {
        super(source);
        this.strategyId = strategyId;
        this.operation = operation;
        this.asset = asset;
        this.from = from;
        this.to = to;
        this.amount = amount;
        this.reason = reason;
    }

    public String getStrategyId() {
        return strategyId;
    }

    /** Ledger operation the transfer belonged to, e.g. "INVEST", "WITHDRAW", "WITHDRAW_FEE". */
    public String getOperation() {
        return operation;
    }

    public String getAsset() {
        return asset;
    }

    public String getFrom() {
        return from;
    }

    public String getTo() {
        return to;
    }

    public BigDecimal getAmount() {
        return amount;
    }

    public String getReason() {
        return reason;
    }
}
