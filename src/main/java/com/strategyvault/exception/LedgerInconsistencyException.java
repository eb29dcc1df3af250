package com.strategyvault.exception;

import java.util.Map;

/** A working book failed the capital/share invariants and was discarded instead of committed. */
public class LedgerInconsistencyException extends BaseException {

    public LedgerInconsistencyException(String message, Map<String, Object> details) {
        super(ErrorCode.LEDGER_INCONSISTENT, message, details);
    }
}
