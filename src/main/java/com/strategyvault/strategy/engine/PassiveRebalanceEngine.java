package com.strategyvault.strategy.engine;

import com.strategyvault.domain.enums.StrategyType;
import com.strategyvault.domain.model.Strategy;
import com.strategyvault.ledger.StrategyBook;
import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Types with no periodic algorithm. Arbitrage runs on demand per opportunity; liquidity
 * providing, delta-neutral and yield farming carry capital without an engine. A pass
 * only stamps {@code lastRebalance}.
 */
@Component
public class PassiveRebalanceEngine implements RebalanceEngine {

    private static final Set<StrategyType> SUPPORTED = EnumSet.of(
            StrategyType.ARBITRAGE,
            StrategyType.LIQUIDITY_PROVIDING,
            StrategyType.DELTA_NEUTRAL,
            StrategyType.YIELD_FARMING);

    @Override
    public boolean supports(StrategyType type) {
        return SUPPORTED.contains(type);
    }

    @Override
    public RebalanceOutcome rebalance(StrategyBook book, Instant now) {
        Strategy strategy = book.getStrategy();
        strategy.setLastRebalance(now);
        return RebalanceOutcome.builder()
                .strategyId(strategy.getId())
                .type(strategy.getType())
                .result(RebalanceResult.NO_ACTION)
                .detail(strategy.getType() == StrategyType.ARBITRAGE
                        ? "arbitrage executes per opportunity"
                        : "no periodic algorithm")
                .at(now)
                .build();
    }
}
