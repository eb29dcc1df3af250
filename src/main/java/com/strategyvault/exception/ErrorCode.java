package com.strategyvault.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    INVALID_ASSET_PAIR("INVALID_ASSET_PAIR", ErrorCategory.VALIDATION, false),
    FEE_TOO_HIGH("FEE_TOO_HIGH", ErrorCategory.VALIDATION, false),
    INVALID_PARAMS("INVALID_PARAMS", ErrorCategory.VALIDATION, false),
    BELOW_MINIMUM("BELOW_MINIMUM", ErrorCategory.VALIDATION, false),
    ABOVE_MAXIMUM("ABOVE_MAXIMUM", ErrorCategory.VALIDATION, false),
    NOT_ACTIVE("NOT_ACTIVE", ErrorCategory.STATE, false),
    ALREADY_ACTIVE("ALREADY_ACTIVE", ErrorCategory.STATE, false),
    INVALID_TRANSITION("INVALID_TRANSITION", ErrorCategory.STATE, false),
    OPPORTUNITY_EXPIRED("OPPORTUNITY_EXPIRED", ErrorCategory.STATE, false),
    OPPORTUNITY_NOT_FOUND("OPPORTUNITY_NOT_FOUND", ErrorCategory.STATE, false),
    NOT_FOUND("NOT_FOUND", ErrorCategory.STATE, false),
    INSUFFICIENT_SHARES("INSUFFICIENT_SHARES", ErrorCategory.CONSISTENCY, false),
    LEDGER_INCONSISTENT("LEDGER_INCONSISTENT", ErrorCategory.CONSISTENCY, false),
    BUSY("BUSY", ErrorCategory.CONCURRENCY, true),
    SETTLEMENT_FAILED("SETTLEMENT_FAILED", ErrorCategory.SETTLEMENT, false),
    FORBIDDEN("FORBIDDEN", ErrorCategory.ACCESS, false);

    private final String code;
    private final ErrorCategory category;
    private final boolean retryable;
}
