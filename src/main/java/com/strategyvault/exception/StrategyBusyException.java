package com.strategyvault.exception;

/**
 * The strategy's exclusive section could not be acquired within the configured wait.
 * Retryable: nothing was mutated.
 */
public class StrategyBusyException extends BaseException {

    public StrategyBusyException(String strategyId, long waitedMillis) {
        super(ErrorCode.BUSY, "Strategy " + strategyId + " is busy (waited " + waitedMillis + " ms)");
    }
}
