package com.strategyvault.exception;

/**
 * How a caller should react to a rejected operation.
 * <ul>
 *   <li>VALIDATION -- rejected before any mutation, fix the request</li>
 *   <li>STATE -- rejected, re-query the strategy or opportunity</li>
 *   <li>CONSISTENCY -- rejected, the request exceeds what the ledger holds</li>
 *   <li>CONCURRENCY -- retry later</li>
 *   <li>SETTLEMENT -- ledger committed but the transfer failed, needs reconciliation</li>
 *   <li>ACCESS -- caller lacks the capability</li>
 * </ul>
 */
public enum ErrorCategory {
    VALIDATION,
    STATE,
    CONSISTENCY,
    CONCURRENCY,
    SETTLEMENT,
    ACCESS
}
