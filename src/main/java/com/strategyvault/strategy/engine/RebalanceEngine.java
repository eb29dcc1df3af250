package com.strategyvault.strategy.engine;

import com.strategyvault.domain.enums.StrategyType;
import com.strategyvault.ledger.StrategyBook;
import java.time.Instant;

/**
 * Periodic algorithm behind one or more strategy types.
 *
 * <p>{@link #rebalance} is always called inside the strategy's exclusive section with a
 * working copy of its book, on a strategy that is ACTIVE and passed the risk guard.
 * Whatever the engine changes on the book is committed only if it returns normally.
 */
public interface RebalanceEngine {

    boolean supports(StrategyType type);

    RebalanceOutcome rebalance(StrategyBook book, Instant now);
}
