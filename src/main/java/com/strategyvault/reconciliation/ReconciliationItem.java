package com.strategyvault.reconciliation;

import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * A transfer that failed after its ledger commit. Stays open until an operator has
 * settled the difference by hand and resolved it.
 */
@Value
@Builder(toBuilder = true)
public class ReconciliationItem {

    String id;
    String strategyId;
    String operation;
    String asset;
    String from;
    String to;
    BigDecimal amount;
    String reason;
    Instant raisedAt;

    boolean resolved;
    Instant resolvedAt;
    String resolutionNote;
}
