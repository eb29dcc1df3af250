package com.strategyvault.strategy.engine;

import com.strategyvault.config.VaultProperties;
import com.strategyvault.domain.enums.StrategyStatus;
import com.strategyvault.domain.enums.StrategyType;
import com.strategyvault.domain.enums.TradeDirection;
import com.strategyvault.domain.model.ArbitrageOpportunity;
import com.strategyvault.domain.model.Strategy;
import com.strategyvault.exception.ErrorCode;
import com.strategyvault.exception.StrategyStateException;
import com.strategyvault.exception.ValidationException;
import com.strategyvault.execution.TradeExecutionPort;
import com.strategyvault.ledger.LedgerStore;
import com.strategyvault.ledger.StrategyBook;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Executes registered cross-venue opportunities for ARBITRAGE strategies.
 *
 * <p>An opportunity is taken out of the ledger before anything else happens with it, so
 * it is consumed exactly once: executed, expired and failed attempts all remove it and
 * a stale quote can never be retried. Expiry uses {@code vault.arbitrage.validity-window-seconds}
 * counted from the opportunity's timestamp; an opportunity exactly at the boundary is
 * still valid.
 *
 * <p>Execution buys on the cheaper venue and sells on the dearer one, each leg sized
 * {@code activeCapital × tradeSizeBps / 10000}.
 */
@Component
public class ArbitrageExecutor {

    private static final Logger log = LoggerFactory.getLogger(ArbitrageExecutor.class);

    private final LedgerStore ledgerStore;
    private final TradeExecutionPort tradeExecutionPort;
    private final VaultProperties vaultProperties;

    public ArbitrageExecutor(
            LedgerStore ledgerStore, TradeExecutionPort tradeExecutionPort, VaultProperties vaultProperties) {
        this.ledgerStore = ledgerStore;
        this.tradeExecutionPort = tradeExecutionPort;
        this.vaultProperties = vaultProperties;
    }

    /**
     * Consumes and executes one opportunity against the strategy's working book.
     *
     * @throws ValidationException     INVALID_PARAMS if the strategy is not an arbitrage strategy
     * @throws StrategyStateException  NOT_ACTIVE if the strategy is not ACTIVE,
     *                                 OPPORTUNITY_NOT_FOUND if no such opportunity is registered
     */
    public ArbitrageResult execute(StrategyBook book, String opportunityId, Instant now) {
        Strategy strategy = book.getStrategy();
        if (strategy.getType() != StrategyType.ARBITRAGE) {
            throw new ValidationException(
                    ErrorCode.INVALID_PARAMS,
                    "Strategy " + strategy.getId() + " is " + strategy.getType() + ", not ARBITRAGE");
        }
        if (strategy.getStatus() != StrategyStatus.ACTIVE) {
            throw new StrategyStateException(
                    ErrorCode.NOT_ACTIVE, "Strategy " + strategy.getId() + " is " + strategy.getStatus());
        }

        ArbitrageOpportunity opportunity = ledgerStore
                .takeOpportunity(opportunityId)
                .orElseThrow(() -> new StrategyStateException(
                        ErrorCode.OPPORTUNITY_NOT_FOUND,
                        "Arbitrage opportunity not found: " + opportunityId,
                        Map.of("opportunityId", opportunityId)));

        ArbitrageResult.ArbitrageResultBuilder result = ArbitrageResult.builder()
                .strategyId(strategy.getId())
                .opportunity(opportunity)
                .at(now);

        long windowSeconds = vaultProperties.getArbitrage().getValidityWindowSeconds();
        if (opportunity.isExpired(now, windowSeconds)) {
            log.warn(
                    "Arbitrage opportunity {} expired: found at {}, now {}, window {}s",
                    opportunityId,
                    opportunity.getTimestamp(),
                    now,
                    windowSeconds);
            return result.status(ArbitrageStatus.EXPIRED)
                    .message("expired at " + opportunity.getTimestamp().plusSeconds(windowSeconds))
                    .build();
        }

        BigDecimal size = TradeSizing.tradeSize(strategy);
        if (size.signum() <= 0) {
            return result.status(ArbitrageStatus.FAILED)
                    .failure(new ValidationException(
                            ErrorCode.INVALID_PARAMS, "Strategy " + strategy.getId() + " has no active capital"))
                    .message("no active capital")
                    .build();
        }

        try {
            tradeExecutionPort.executeTrade(strategy.copy(), TradeDirection.BUY, size);
            tradeExecutionPort.executeTrade(strategy.copy(), TradeDirection.SELL, size);
        } catch (RuntimeException e) {
            log.error(
                    "Arbitrage execution failed: strategy={}, opportunity={}: {}",
                    strategy.getId(),
                    opportunityId,
                    e.getMessage(),
                    e);
            return result.status(ArbitrageStatus.FAILED)
                    .failure(e)
                    .message(e.getMessage())
                    .build();
        }

        boolean profitable = opportunity.getProfit() != null && opportunity.getProfit().signum() > 0;
        strategy.getMetrics().recordTrade(profitable, now);
        strategy.setLastRebalance(now);

        log.info(
                "Arbitrage executed: strategy={}, opportunity={}, {}@{} -> {}@{}, size={}",
                strategy.getId(),
                opportunityId,
                opportunity.getVenueA(),
                opportunity.getPriceA(),
                opportunity.getVenueB(),
                opportunity.getPriceB(),
                size.toPlainString());

        return result.status(ArbitrageStatus.EXECUTED)
                .tradeSize(size)
                .message(profitable ? "expected profit " + opportunity.getProfit().toPlainString() : "no expected profit")
                .build();
    }
}
