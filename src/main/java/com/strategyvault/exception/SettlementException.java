package com.strategyvault.exception;

/**
 * A transfer through the settlement gateway failed. When thrown after a ledger
 * commit the ledger is not rolled back; the failure is handed to reconciliation.
 */
public class SettlementException extends BaseException {

    public SettlementException(String message) {
        super(ErrorCode.SETTLEMENT_FAILED, message);
    }

    public SettlementException(String message, Throwable cause) {
        super(ErrorCode.SETTLEMENT_FAILED, message, cause);
    }
}
