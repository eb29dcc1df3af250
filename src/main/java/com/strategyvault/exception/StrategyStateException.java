package com.strategyvault.exception;

import java.util.Map;

/**
 * The strategy or opportunity is not in a state that allows the operation
 * (not active, already active, illegal transition, expired or consumed opportunity).
 */
public class StrategyStateException extends BaseException {

    public StrategyStateException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public StrategyStateException(ErrorCode errorCode, String message, Map<String, Object> details) {
        super(errorCode, message, details);
    }
}
