package com.strategyvault.core.engine;

import com.strategyvault.auth.AuthorizationService;
import com.strategyvault.config.VaultProperties;
import com.strategyvault.domain.enums.StrategyStatus;
import com.strategyvault.domain.enums.StrategyType;
import com.strategyvault.domain.enums.VaultRole;
import com.strategyvault.domain.model.ArbitrageOpportunity;
import com.strategyvault.domain.model.GridOrder;
import com.strategyvault.domain.model.InvestorPosition;
import com.strategyvault.domain.model.PerformanceReport;
import com.strategyvault.domain.model.Strategy;
import com.strategyvault.domain.model.StrategyDefinition;
import com.strategyvault.domain.model.StrategyMetrics;
import com.strategyvault.domain.model.StrategyParams;
import com.strategyvault.domain.model.TxRef;
import com.strategyvault.event.ArbitrageEventType;
import com.strategyvault.event.EventPublisherHelper;
import com.strategyvault.event.StrategyEventType;
import com.strategyvault.exception.BaseException;
import com.strategyvault.exception.ErrorCode;
import com.strategyvault.exception.SettlementException;
import com.strategyvault.exception.StrategyStateException;
import com.strategyvault.exception.UnauthorizedException;
import com.strategyvault.ledger.EmergencyStopResult;
import com.strategyvault.ledger.InvestmentReceipt;
import com.strategyvault.ledger.LedgerStore;
import com.strategyvault.ledger.StrategyBook;
import com.strategyvault.ledger.WithdrawalReceipt;
import com.strategyvault.risk.RiskViolation;
import com.strategyvault.risk.StrategyRiskGuard;
import com.strategyvault.settlement.SettlementGateway;
import com.strategyvault.strategy.engine.ArbitrageExecutor;
import com.strategyvault.strategy.engine.ArbitrageResult;
import com.strategyvault.strategy.engine.GridFill;
import com.strategyvault.strategy.engine.RebalanceEngine;
import com.strategyvault.strategy.engine.RebalanceOutcome;
import com.strategyvault.strategy.engine.RebalanceResult;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point for every vault operation.
 *
 * <p>Responsibilities:
 * <ul>
 *   <li><b>Authorization:</b> strategy managers create and configure, operators rebalance
 *       and run arbitrage, admins force emergency stops. Investing and withdrawing need no
 *       role; queries are open.</li>
 *   <li><b>Dispatch:</b> picks the {@link RebalanceEngine} for the strategy's type and runs
 *       it inside the strategy's exclusive section, after the risk guard.</li>
 *   <li><b>Events:</b> publishes only after the ledger commit the event describes.</li>
 *   <li><b>Settlement:</b> moves funds after invest and withdraw commits. A failed transfer
 *       is not rolled back; it is logged, published as a {@code SettlementFailedEvent} for
 *       reconciliation and rethrown.</li>
 * </ul>
 *
 * <p>Rebalancing never waits for a busy strategy: the pass is skipped and the next
 * scheduler tick retries. Every other mutation waits up to {@code vault.lock-timeout-ms}
 * and then fails with a retryable BUSY error.
 */
@Service
public class StrategyController {

    private static final Logger log = LoggerFactory.getLogger(StrategyController.class);

    static final String OPERATION_INVEST = "INVEST";
    static final String OPERATION_WITHDRAW = "WITHDRAW";
    static final String OPERATION_WITHDRAW_FEE = "WITHDRAW_FEE";

    private final LedgerStore ledgerStore;
    private final List<RebalanceEngine> rebalanceEngines;
    private final ArbitrageExecutor arbitrageExecutor;
    private final StrategyRiskGuard strategyRiskGuard;
    private final AuthorizationService authorizationService;
    private final SettlementGateway settlementGateway;
    private final EventPublisherHelper eventPublisherHelper;
    private final VaultProperties vaultProperties;
    private final Clock clock;

    public StrategyController(
            LedgerStore ledgerStore,
            List<RebalanceEngine> rebalanceEngines,
            ArbitrageExecutor arbitrageExecutor,
            StrategyRiskGuard strategyRiskGuard,
            AuthorizationService authorizationService,
            SettlementGateway settlementGateway,
            EventPublisherHelper eventPublisherHelper,
            VaultProperties vaultProperties,
            Clock clock) {
        this.ledgerStore = ledgerStore;
        this.rebalanceEngines = rebalanceEngines;
        this.arbitrageExecutor = arbitrageExecutor;
        this.strategyRiskGuard = strategyRiskGuard;
        this.authorizationService = authorizationService;
        this.settlementGateway = settlementGateway;
        this.eventPublisherHelper = eventPublisherHelper;
        this.vaultProperties = vaultProperties;
        this.clock = clock;
    }

    // ========================
    // STRATEGY MANAGEMENT
    // ========================

    public Strategy createStrategy(String caller, StrategyDefinition definition) {
        requireRole(caller, VaultRole.STRATEGY_MANAGER);
        Strategy strategy = ledgerStore.createStrategy(caller, definition);
        eventPublisherHelper.publishStrategyCreated(this, strategy);
        return strategy;
    }

    public Strategy activate(String caller, String strategyId) {
        requireRole(caller, VaultRole.STRATEGY_MANAGER);
        Strategy strategy = ledgerStore.activate(strategyId);
        eventPublisherHelper.publishStrategyEvent(
                this, strategy, StrategyEventType.ACTIVATED, StrategyStatus.INACTIVE, null);
        return strategy;
    }

    public Strategy pause(String caller, String strategyId) {
        requireRole(caller, VaultRole.STRATEGY_MANAGER);
        Strategy strategy = ledgerStore.pause(strategyId);
        eventPublisherHelper.publishStrategyEvent(
                this, strategy, StrategyEventType.PAUSED, StrategyStatus.ACTIVE, "paused by " + caller);
        return strategy;
    }

    public Strategy resume(String caller, String strategyId) {
        requireRole(caller, VaultRole.STRATEGY_MANAGER);
        Strategy strategy = ledgerStore.resume(strategyId);
        eventPublisherHelper.publishStrategyEvent(
                this, strategy, StrategyEventType.RESUMED, StrategyStatus.PAUSED, "resumed by " + caller);
        return strategy;
    }

    public Strategy updateParams(String caller, String strategyId, StrategyParams params) {
        requireRole(caller, VaultRole.STRATEGY_MANAGER);
        Strategy strategy = ledgerStore.updateParams(strategyId, params);
        eventPublisherHelper.publishStrategyEvent(
                this, strategy, StrategyEventType.PARAMS_UPDATED, strategy.getStatus(), "updated by " + caller);
        return strategy;
    }

    public StrategyMetrics recordPerformance(String caller, String strategyId, PerformanceReport report) {
        requireRole(caller, VaultRole.OPERATOR);
        return ledgerStore.recordPerformance(strategyId, report);
    }

    /**
     * Forces EMERGENCY_STOP. Idempotent: stopping an already stopped strategy returns it
     * without publishing another event.
     */
    public Strategy emergencyStop(String caller, String strategyId, String reason) {
        requireRole(caller, VaultRole.ADMIN);
        EmergencyStopResult result = ledgerStore.emergencyStop(strategyId);
        if (!result.isAlreadyStopped()) {
            log.error("Emergency stop on {} by {}: {}", strategyId, caller, reason);
            eventPublisherHelper.publishStrategyEvent(
                    this,
                    result.getStrategy(),
                    StrategyEventType.EMERGENCY_STOPPED,
                    result.getPreviousStatus(),
                    reason);
        }
        return result.getStrategy();
    }

    // ========================
    // INVEST / WITHDRAW
    // ========================

    /**
     * Mints shares for the investor, then pulls the funds into the vault account.
     *
     * @throws SettlementException if the transfer fails; the shares stay minted
     */
    public InvestmentReceipt invest(String investorId, String strategyId, BigDecimal amount) {
        InvestmentReceipt receipt = ledgerStore.invest(strategyId, investorId, amount);
        eventPublisherHelper.publishInvested(this, strategyId, investorId, amount, receipt.getSharesMinted());

        TxRef txRef = settle(
                strategyId,
                OPERATION_INVEST,
                receipt.getAsset(),
                investorId,
                vaultProperties.getSettlement().getVaultAccount(),
                amount);
        return receipt.toBuilder().settlementRef(txRef.getReference()).build();
    }

    /**
     * Burns shares, then pays the net amount to the investor and the fee to the fee
     * recipient. Both transfers are attempted even if the first one fails.
     *
     * @throws SettlementException for the first failed transfer; the shares stay burned
     */
    public WithdrawalReceipt withdraw(String investorId, String strategyId, BigDecimal shares) {
        WithdrawalReceipt receipt = ledgerStore.withdraw(strategyId, investorId, shares);
        eventPublisherHelper.publishWithdrawn(
                this,
                strategyId,
                investorId,
                receipt.getGrossAmount(),
                receipt.getSharesBurned(),
                receipt.getFees().getTotal());

        String vaultAccount = vaultProperties.getSettlement().getVaultAccount();
        SettlementException firstFailure = null;
        String payoutRef = null;
        String feeRef = null;

        if (receipt.getNetAmount().signum() > 0) {
            try {
                payoutRef = settle(
                                strategyId,
                                OPERATION_WITHDRAW,
                                receipt.getAsset(),
                                vaultAccount,
                                investorId,
                                receipt.getNetAmount())
                        .getReference();
            } catch (SettlementException e) {
                firstFailure = e;
            }
        }
        if (receipt.getFees().getTotal().signum() > 0) {
            try {
                feeRef = settle(
                                strategyId,
                                OPERATION_WITHDRAW_FEE,
                                receipt.getAsset(),
                                vaultAccount,
                                vaultProperties.getSettlement().getFeeRecipient(),
                                receipt.getFees().getTotal())
                        .getReference();
            } catch (SettlementException e) {
                if (firstFailure == null) {
                    firstFailure = e;
                }
            }
        }
        if (firstFailure != null) {
            throw firstFailure;
        }
        return receipt.toBuilder().settlementRef(payoutRef).feeSettlementRef(feeRef).build();
    }

    // ========================
    // REBALANCE
    // ========================

    /**
     * Runs one rebalance pass on a strategy, or skips it if the strategy section is held.
     *
     * @throws StrategyStateException NOT_ACTIVE unless the strategy is ACTIVE
     */
    public RebalanceOutcome rebalance(String caller, String strategyId) {
        requireRole(caller, VaultRole.OPERATOR);
        return rebalanceStrategy(strategyId);
    }

    /** Rebalances every ACTIVE strategy. A strategy that fails is logged and left for the next pass. */
    public List<RebalanceOutcome> rebalanceAll(String caller) {
        requireRole(caller, VaultRole.OPERATOR);
        List<RebalanceOutcome> outcomes = new ArrayList<>();
        for (Strategy strategy : ledgerStore.getActiveStrategies()) {
            try {
                outcomes.add(rebalanceStrategy(strategy.getId()));
            } catch (BaseException e) {
                log.warn("Rebalance of {} rejected: [{}] {}", strategy.getId(), e.getErrorCode(), e.getMessage());
            } catch (RuntimeException e) {
                log.error("Rebalance of {} failed: {}", strategy.getId(), e.getMessage(), e);
            }
        }
        log.debug("Rebalance pass complete: {} strategies processed", outcomes.size());
        return outcomes;
    }

    private RebalanceOutcome rebalanceStrategy(String strategyId) {
        Instant now = clock.instant();
        StrategyType type = ledgerStore.getStrategy(strategyId).getType();

        Optional<RebalanceOutcome> committed = ledgerStore.tryMutate(strategyId, book -> runEngine(book, now));
        if (committed.isEmpty()) {
            log.warn("Rebalance of {} skipped: strategy busy", strategyId);
            RebalanceOutcome skipped = RebalanceOutcome.skipped(strategyId, type, now);
            eventPublisherHelper.publishRebalanced(this, skipped);
            return skipped;
        }

        RebalanceOutcome outcome = committed.get();
        publishRebalanceEvents(outcome);
        return outcome;
    }

    private RebalanceOutcome runEngine(StrategyBook book, Instant now) {
        Strategy strategy = book.getStrategy();
        if (strategy.getStatus() != StrategyStatus.ACTIVE) {
            throw new StrategyStateException(
                    ErrorCode.NOT_ACTIVE, "Strategy " + strategy.getId() + " is " + strategy.getStatus());
        }

        List<RiskViolation> violations = strategyRiskGuard.check(strategy);
        if (!violations.isEmpty()) {
            strategy.setStatus(StrategyStatus.PAUSED);
            String reason = StrategyRiskGuard.describe(violations);
            log.warn("Strategy {} paused by risk guard: {}", strategy.getId(), reason);
            return RebalanceOutcome.builder()
                    .strategyId(strategy.getId())
                    .type(strategy.getType())
                    .result(RebalanceResult.PAUSED_BY_RISK)
                    .detail(reason)
                    .at(now)
                    .build();
        }

        return engineFor(strategy.getType()).rebalance(book, now);
    }

    private void publishRebalanceEvents(RebalanceOutcome outcome) {
        eventPublisherHelper.publishRebalanced(this, outcome);

        for (GridFill fill : outcome.getGridFills()) {
            eventPublisherHelper.publishGridOrderFilled(
                    this, fill.getFilledOrder(), fill.getReplacementOrder(), fill.getMarketPrice());
        }
        if (outcome.getType() == StrategyType.DCA && outcome.isExecuted()) {
            eventPublisherHelper.publishDcaExecuted(
                    this,
                    outcome.getStrategyId(),
                    outcome.getDcaAmount(),
                    outcome.getDcaSpent(),
                    outcome.getDcaTotalBudget());
        }
        if (outcome.getResult() == RebalanceResult.BUDGET_EXHAUSTED
                || outcome.getResult() == RebalanceResult.PAUSED_BY_RISK) {
            eventPublisherHelper.publishStrategyEvent(
                    this,
                    ledgerStore.getStrategy(outcome.getStrategyId()),
                    StrategyEventType.PAUSED,
                    StrategyStatus.ACTIVE,
                    outcome.getDetail());
        }
    }

    private RebalanceEngine engineFor(StrategyType type) {
        for (RebalanceEngine engine : rebalanceEngines) {
            if (engine.supports(type)) {
                return engine;
            }
        }
        throw new IllegalStateException("No rebalance engine registered for " + type);
    }

    // ========================
    // ARBITRAGE
    // ========================

    public void registerOpportunity(String caller, ArbitrageOpportunity opportunity) {
        requireRole(caller, VaultRole.OPERATOR);
        ledgerStore.registerOpportunity(opportunity);
    }

    /**
     * Consumes one opportunity for an ARBITRAGE strategy. The opportunity is gone afterwards
     * whether it executed, had expired or failed at the venue.
     *
     * @throws StrategyStateException OPPORTUNITY_NOT_FOUND or OPPORTUNITY_EXPIRED
     */
    public ArbitrageResult executeArbitrage(String caller, String strategyId, String opportunityId) {
        requireRole(caller, VaultRole.OPERATOR);
        Instant now = clock.instant();
        ArbitrageResult result =
                ledgerStore.mutate(strategyId, book -> arbitrageExecutor.execute(book, opportunityId, now));

        switch (result.getStatus()) {
            case EXECUTED -> eventPublisherHelper.publishArbitrage(
                    this, strategyId, result.getOpportunity(), ArbitrageEventType.EXECUTED, result.getMessage());
            case EXPIRED -> {
                eventPublisherHelper.publishArbitrage(
                        this, strategyId, result.getOpportunity(), ArbitrageEventType.EXPIRED, result.getMessage());
                throw new StrategyStateException(
                        ErrorCode.OPPORTUNITY_EXPIRED,
                        "Arbitrage opportunity " + opportunityId + " " + result.getMessage(),
                        Map.of("opportunityId", opportunityId));
            }
            case FAILED -> {
                eventPublisherHelper.publishArbitrage(
                        this, strategyId, result.getOpportunity(), ArbitrageEventType.FAILED, result.getMessage());
                throw result.getFailure();
            }
        }
        return result;
    }

    // ========================
    // QUERIES
    // ========================

    public Strategy getStrategy(String strategyId) {
        return ledgerStore.getStrategy(strategyId);
    }

    public StrategyMetrics getMetrics(String strategyId) {
        return ledgerStore.getMetrics(strategyId);
    }

    public List<InvestorPosition> getPositions(String strategyId) {
        return ledgerStore.getPositions(strategyId);
    }

    public Optional<InvestorPosition> getPosition(String strategyId, String investorId) {
        return ledgerStore.getPosition(strategyId, investorId);
    }

    public List<GridOrder> getGridOrders(String strategyId) {
        return ledgerStore.getGridOrders(strategyId);
    }

    public List<Strategy> getActiveStrategies() {
        return ledgerStore.getActiveStrategies();
    }

    public List<Strategy> getAllStrategies() {
        return ledgerStore.getAllStrategies();
    }

    // ========================
    // INTERNALS
    // ========================

    private TxRef settle(String strategyId, String operation, String asset, String from, String to, BigDecimal amount) {
        try {
            return settlementGateway.transfer(asset, from, to, amount);
        } catch (RuntimeException e) {
            log.error(
                    "SETTLEMENT FAILURE: {} on {} committed but transfer of {} {} {} -> {} failed: {}",
                    operation,
                    strategyId,
                    amount.toPlainString(),
                    asset,
                    from,
                    to,
                    e.getMessage(),
                    e);
            eventPublisherHelper.publishSettlementFailed(
                    this, strategyId, operation, asset, from, to, amount, e.getMessage());
            if (e instanceof SettlementException settlementException) {
                throw settlementException;
            }
            throw new SettlementException(operation + " transfer failed for " + strategyId, e);
        }
    }

    private void requireRole(String caller, VaultRole role) {
        if (!authorizationService.hasRole(caller, role)) {
            log.warn("Caller {} lacks role {}", caller, role);
            throw new UnauthorizedException(caller, role);
        }
    }
}
