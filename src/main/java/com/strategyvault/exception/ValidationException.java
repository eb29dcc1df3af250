package com.strategyvault.exception;

import java.util.Map;

/** Request rejected before any ledger mutation: bad asset pair, fee cap, bounds or params. */
public class ValidationException extends BaseException {

    public ValidationException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public ValidationException(ErrorCode errorCode, String message, Map<String, Object> details) {
        super(errorCode, message, details);
    }
}
