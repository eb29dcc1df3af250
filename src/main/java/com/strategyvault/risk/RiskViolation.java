package com.strategyvault.risk;

import lombok.Builder;
import lombok.Getter;

/**
 * One risk threshold a strategy has breached. The code is machine-readable
 * (DRAWDOWN_LIMIT_REACHED, STOP_LOSS_HIT, TAKE_PROFIT_HIT); the message is for logs
 * and the pause reason.
 */
@Getter
@Builder
public class RiskViolation {

    private final String code;
    private final String message;

    public static RiskViolation of(String code, String message) {
        return RiskViolation.builder().code(code).message(message).build();
    }

    @Override
    public String toString() {
        return code + ": " + message;
    }
}
