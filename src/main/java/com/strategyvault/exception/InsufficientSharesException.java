package com.strategyvault.exception;

import java.math.BigDecimal;
import java.util.Map;

public class InsufficientSharesException extends BaseException {

    public InsufficientSharesException(String strategyId, String investorId, BigDecimal owned, BigDecimal requested) {
        super(
                ErrorCode.INSUFFICIENT_SHARES,
                String.format(
                        "Investor %s owns %s shares of %s, cannot withdraw %s",
                        investorId, owned.toPlainString(), strategyId, requested.toPlainString()),
                Map.of("owned", owned, "requested", requested));
    }
}
