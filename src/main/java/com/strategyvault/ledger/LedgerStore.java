package com.strategyvault.ledger;

import com.strategyvault.config.VaultProperties;
import com.strategyvault.domain.enums.StrategyStatus;
import com.strategyvault.domain.enums.StrategyType;
import com.strategyvault.domain.model.ArbitrageOpportunity;
import com.strategyvault.domain.model.GridOrder;
import com.strategyvault.domain.model.InvestorPosition;
import com.strategyvault.domain.model.PerformanceReport;
import com.strategyvault.domain.model.Strategy;
import com.strategyvault.domain.model.StrategyDefinition;
import com.strategyvault.domain.model.StrategyMetrics;
import com.strategyvault.domain.model.StrategyParams;
import com.strategyvault.domain.vo.FeeBreakdown;
import com.strategyvault.exception.ErrorCode;
import com.strategyvault.exception.InsufficientSharesException;
import com.strategyvault.exception.LedgerInconsistencyException;
import com.strategyvault.exception.ResourceNotFoundException;
import com.strategyvault.exception.StrategyBusyException;
import com.strategyvault.exception.StrategyStateException;
import com.strategyvault.exception.ValidationException;
import com.strategyvault.fee.FeeCalculator;
import com.strategyvault.strategy.engine.GridEngine;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Ledger of record for every strategy, investor position, grid order and pending
 * arbitrage opportunity. The only component that changes capital or share numbers.
 *
 * <p><b>Concurrency model:</b> one {@link ReentrantLock} per strategy id. Mutations on
 * the same strategy are serialized; different strategies proceed in parallel. Acquiring
 * a strategy's section waits at most {@code vault.lock-timeout-ms} and then fails with
 * a retryable {@link StrategyBusyException}. {@link #tryMutate} does not wait at all and
 * is used by rebalancing, which simply skips a busy strategy until the next tick.
 *
 * <p><b>Copy-on-write books:</b> a mutation runs against a deep working copy of the
 * strategy's {@link StrategyBook}. The copy is checked against the ledger invariants and
 * then published with a single map put. If the mutation or the check throws, the copy
 * is dropped and the published book is untouched. Reads never lock and always see a
 * committed book.
 *
 * <p><b>Invariants checked before each commit:</b>
 * <ul>
 *   <li>totalCapital == Σ capitalContributed over positions</li>
 *   <li>totalShares == Σ shares over positions</li>
 *   <li>shares &gt; 0 ⇔ capitalContributed &gt; 0 for every position</li>
 *   <li>an ACTIVE grid strategy holds exactly 2 × gridLevels active orders</li>
 * </ul>
 */
@Service
public class LedgerStore {

    private static final Logger log = LoggerFactory.getLogger(LedgerStore.class);

    public static final int MAX_PERFORMANCE_FEE_BPS = 2000;
    public static final int MAX_MANAGEMENT_FEE_BPS_PER_YEAR = 500;
    public static final int SHARE_SCALE = 18;

    private static final int MAX_BPS = 10_000;

    /** Published books keyed by strategy id. */
    private final ConcurrentHashMap<String, StrategyBook> books = new ConcurrentHashMap<>();

    /** Per-strategy exclusive sections. */
    private final ConcurrentHashMap<String, ReentrantLock> strategyLocks = new ConcurrentHashMap<>();

    /** Opportunities waiting to be executed, keyed by opportunity id. */
    private final ConcurrentHashMap<String, ArbitrageOpportunity> opportunities = new ConcurrentHashMap<>();

    private final AtomicLong strategySequence = new AtomicLong();

    private final GridEngine gridEngine;
    private final FeeCalculator feeCalculator;
    private final VaultProperties vaultProperties;
    private final Clock clock;

    public LedgerStore(
            GridEngine gridEngine, FeeCalculator feeCalculator, VaultProperties vaultProperties, Clock clock) {
        this.gridEngine = gridEngine;
        this.feeCalculator = feeCalculator;
        this.vaultProperties = vaultProperties;
        this.clock = clock;
    }

    // ========================
    // CREATE / LIFECYCLE
    // ========================

    /**
     * Validates the definition and allocates a new INACTIVE strategy.
     *
     * @param creator    caller id recorded as the strategy's creator
     * @param definition type, asset pair, investment bounds, fee rates and params
     * @return snapshot of the created strategy
     * @throws ValidationException with INVALID_ASSET_PAIR, FEE_TOO_HIGH or INVALID_PARAMS
     */
    public Strategy createStrategy(String creator, StrategyDefinition definition) {
        validateDefinition(definition);

        String strategyId = String.format("STR-%06d", strategySequence.incrementAndGet());
        Strategy strategy = Strategy.builder()
                .id(strategyId)
                .type(definition.getType())
                .status(StrategyStatus.INACTIVE)
                .creator(creator)
                .baseAsset(definition.getBaseAsset())
                .quoteAsset(definition.getQuoteAsset())
                .totalCapital(BigDecimal.ZERO)
                .activeCapital(BigDecimal.ZERO)
                .totalShares(BigDecimal.ZERO)
                .minInvestment(definition.getMinInvestment())
                .maxInvestment(definition.getMaxInvestment())
                .performanceFeeBps(definition.getPerformanceFeeBps())
                .managementFeeBpsPerYear(definition.getManagementFeeBpsPerYear())
                .createdAt(clock.instant())
                .dcaSpent(BigDecimal.ZERO)
                .params(definition.getParams().copy())
                .metrics(StrategyMetrics.empty())
                .build();

        strategyLocks.put(strategyId, new ReentrantLock());
        books.put(strategyId, StrategyBook.of(strategy));

        log.info(
                "Strategy created: id={}, type={}, pair={}/{}, creator={}",
                strategyId,
                strategy.getType(),
                strategy.getBaseAsset(),
                strategy.getQuoteAsset(),
                creator);
        return strategy.copy();
    }

    /**
     * INACTIVE -> ACTIVE. Grid strategies get their ladder seeded in the same commit.
     *
     * @throws StrategyStateException ALREADY_ACTIVE if the strategy is not INACTIVE
     */
    public Strategy activate(String strategyId) {
        return mutate(strategyId, book -> {
            Strategy strategy = book.getStrategy();
            if (strategy.getStatus() != StrategyStatus.INACTIVE) {
                throw new StrategyStateException(
                        ErrorCode.ALREADY_ACTIVE,
                        "Strategy " + strategyId + " cannot be activated from " + strategy.getStatus());
            }
            strategy.setStatus(StrategyStatus.ACTIVE);
            if (strategy.getType() == StrategyType.GRID_TRADING) {
                gridEngine.seedLadder(book, clock.instant());
            }
            log.info("Strategy activated: {}", strategyId);
            return strategy.copy();
        });
    }

    /** ACTIVE -> PAUSED. */
    public Strategy pause(String strategyId) {
        return transition(strategyId, StrategyStatus.ACTIVE, StrategyStatus.PAUSED);
    }

    /** PAUSED -> ACTIVE. */
    public Strategy resume(String strategyId) {
        return transition(strategyId, StrategyStatus.PAUSED, StrategyStatus.ACTIVE);
    }

    /**
     * Forces EMERGENCY_STOP from any state and cancels resting grid orders.
     * Idempotent: stopping a stopped strategy returns it unchanged. The result carries
     * the status read under the strategy lock, so exactly one concurrent caller sees a
     * non-stopped previous status.
     */
    public EmergencyStopResult emergencyStop(String strategyId) {
        return mutate(strategyId, book -> {
            Strategy strategy = book.getStrategy();
            StrategyStatus previous = strategy.getStatus();
            if (previous != StrategyStatus.EMERGENCY_STOP) {
                strategy.setStatus(StrategyStatus.EMERGENCY_STOP);
                int cancelled = book.cancelGridOrders();
                log.error(
                        "EMERGENCY STOP: strategy {} (was {}), {} grid orders cancelled",
                        strategyId,
                        previous,
                        cancelled);
            }
            return EmergencyStopResult.builder()
                    .strategy(strategy.copy())
                    .previousStatus(previous)
                    .build();
        });
    }

    /**
     * Replaces the strategy's params. Grid geometry (levels, spacing) is frozen once
     * the strategy has left INACTIVE, since the seeded ladder depends on it.
     */
    public Strategy updateParams(String strategyId, StrategyParams params) {
        return mutate(strategyId, book -> {
            Strategy strategy = book.getStrategy();
            requireNotStopped(strategy);
            validateParams(strategy.getType(), params);

            if (strategy.getType() == StrategyType.GRID_TRADING
                    && strategy.getStatus() != StrategyStatus.INACTIVE
                    && gridGeometryChanged(strategy.getParams(), params)) {
                throw new ValidationException(
                        ErrorCode.INVALID_PARAMS, "Grid levels and spacing cannot change after activation");
            }
            strategy.setParams(params.copy());
            return strategy.copy();
        });
    }

    /** Records externally computed performance figures onto the strategy's metrics. */
    public StrategyMetrics recordPerformance(String strategyId, PerformanceReport report) {
        return mutate(strategyId, book -> {
            StrategyMetrics metrics = book.getStrategy().getMetrics();
            metrics.setTotalReturnBps(report.getTotalReturnBps());
            metrics.setSharpeRatio(report.getSharpeRatio() != null ? report.getSharpeRatio() : BigDecimal.ZERO);
            metrics.setMaxDrawdownBps(report.getMaxDrawdownBps());
            metrics.setAverageReturnBps(report.getAverageReturnBps());
            metrics.setVolatilityBps(report.getVolatilityBps());
            metrics.setLastUpdated(clock.instant());
            return metrics.toBuilder().build();
        });
    }

    // ========================
    // INVEST / WITHDRAW
    // ========================

    /**
     * Adds capital to an ACTIVE strategy and mints shares.
     *
     * <p>Shares minted are {@code amount} when the pool is empty, otherwise
     * {@code amount × totalShares / totalCapital}, so every investor buys in at the
     * current share price.
     *
     * @throws StrategyStateException NOT_ACTIVE unless the strategy is ACTIVE
     * @throws ValidationException    BELOW_MINIMUM / ABOVE_MAXIMUM against the strategy's bounds
     */
    public InvestmentReceipt invest(String strategyId, String investorId, BigDecimal amount) {
        return mutate(strategyId, book -> {
            Strategy strategy = book.getStrategy();
            requireActive(strategy);

            if (amount == null || amount.signum() <= 0) {
                throw new ValidationException(ErrorCode.BELOW_MINIMUM, "Investment amount must be positive");
            }
            if (amount.compareTo(strategy.getMinInvestment()) < 0) {
                throw new ValidationException(
                        ErrorCode.BELOW_MINIMUM,
                        "Investment " + amount.toPlainString() + " below minimum "
                                + strategy.getMinInvestment().toPlainString(),
                        Map.of("amount", amount, "minInvestment", strategy.getMinInvestment()));
            }
            if (strategy.hasMaxInvestment() && amount.compareTo(strategy.getMaxInvestment()) > 0) {
                throw new ValidationException(
                        ErrorCode.ABOVE_MAXIMUM,
                        "Investment " + amount.toPlainString() + " above maximum "
                                + strategy.getMaxInvestment().toPlainString(),
                        Map.of("amount", amount, "maxInvestment", strategy.getMaxInvestment()));
            }

            BigDecimal shares = strategy.getTotalCapital().signum() == 0
                    ? amount
                    : amount.multiply(strategy.getTotalShares())
                            .divide(strategy.getTotalCapital(), SHARE_SCALE, RoundingMode.DOWN);
            if (shares.signum() <= 0) {
                throw new ValidationException(ErrorCode.BELOW_MINIMUM, "Investment too small to mint shares");
            }

            Instant now = clock.instant();
            InvestorPosition existing = book.getPosition(investorId);
            InvestorPosition updated = existing == null
                    ? InvestorPosition.builder()
                            .strategyId(strategyId)
                            .investorId(investorId)
                            .shares(shares)
                            .capitalContributed(amount)
                            .openedAt(now)
                            .lastFeeAccrualAt(now)
                            .build()
                    : existing.toBuilder()
                            .shares(existing.getShares().add(shares))
                            .capitalContributed(existing.getCapitalContributed().add(amount))
                            .lastFeeAccrualAt(weightedAccrualStart(existing, amount, now))
                            .build();
            book.putPosition(updated);

            strategy.setTotalCapital(strategy.getTotalCapital().add(amount));
            strategy.setActiveCapital(strategy.getActiveCapital().add(amount));
            strategy.setTotalShares(strategy.getTotalShares().add(shares));

            log.info(
                    "Invested: strategy={}, investor={}, amount={}, shares={}",
                    strategyId,
                    investorId,
                    amount.toPlainString(),
                    shares.toPlainString());

            return InvestmentReceipt.builder()
                    .strategyId(strategyId)
                    .investorId(investorId)
                    .asset(strategy.getQuoteAsset())
                    .amount(amount)
                    .sharesMinted(shares)
                    .sharesHeld(updated.getShares())
                    .build();
        });
    }

    /**
     * Burns shares and releases the investor's capital.
     *
     * <p>Gross amount is {@code shares × totalCapital / totalShares}. The investor's
     * contributed capital is released pro rata to the shares burned (all of it when
     * every share is burned) and subtracted from totalCapital, which keeps the capital
     * invariant exact. Management and performance fees come out of the gross amount.
     * Nothing is transferred here; the receipt tells the caller what to settle.
     *
     * @throws StrategyStateException       NOT_ACTIVE once the strategy is emergency-stopped
     * @throws InsufficientSharesException if the investor owns fewer shares than requested
     */
    public WithdrawalReceipt withdraw(String strategyId, String investorId, BigDecimal shares) {
        return mutate(strategyId, book -> {
            Strategy strategy = book.getStrategy();
            requireNotStopped(strategy);

            if (shares == null || shares.signum() <= 0) {
                throw new ValidationException(ErrorCode.INVALID_PARAMS, "Shares to withdraw must be positive");
            }
            InvestorPosition position = book.getPosition(investorId);
            BigDecimal owned = position != null ? position.getShares() : BigDecimal.ZERO;
            if (owned.compareTo(shares) < 0) {
                throw new InsufficientSharesException(strategyId, investorId, owned, shares);
            }

            boolean fullExit = owned.compareTo(shares) == 0;
            boolean lastShares = shares.compareTo(strategy.getTotalShares()) == 0;

            BigDecimal grossAmount = lastShares
                    ? strategy.getTotalCapital()
                    : shares.multiply(strategy.getTotalCapital())
                            .divide(strategy.getTotalShares(), SHARE_SCALE, RoundingMode.DOWN);
            BigDecimal capitalReleased = fullExit
                    ? position.getCapitalContributed()
                    : position.getCapitalContributed()
                            .multiply(shares)
                            .divide(owned, SHARE_SCALE, RoundingMode.DOWN);

            Instant now = clock.instant();
            FeeBreakdown fees =
                    feeCalculator.withdrawalFees(strategy, grossAmount, capitalReleased, position.getLastFeeAccrualAt(), now);
            BigDecimal netAmount = grossAmount.subtract(fees.getTotal());

            strategy.setTotalCapital(strategy.getTotalCapital().subtract(capitalReleased));
            strategy.setTotalShares(strategy.getTotalShares().subtract(shares));
            strategy.setActiveCapital(
                    strategy.getActiveCapital().subtract(capitalReleased.min(strategy.getActiveCapital())));

            BigDecimal remaining = owned.subtract(shares);
            if (fullExit) {
                book.removePosition(investorId);
            } else {
                book.putPosition(position.toBuilder()
                        .shares(remaining)
                        .capitalContributed(position.getCapitalContributed().subtract(capitalReleased))
                        .build());
            }

            log.info(
                    "Withdrawn: strategy={}, investor={}, shares={}, gross={}, fee={}",
                    strategyId,
                    investorId,
                    shares.toPlainString(),
                    grossAmount.toPlainString(),
                    fees.getTotal().toPlainString());

            return WithdrawalReceipt.builder()
                    .strategyId(strategyId)
                    .investorId(investorId)
                    .asset(strategy.getQuoteAsset())
                    .sharesBurned(shares)
                    .grossAmount(grossAmount)
                    .capitalReleased(capitalReleased)
                    .fees(fees)
                    .netAmount(netAmount)
                    .sharesRemaining(remaining)
                    .build();
        });
    }

    /**
     * Accrual start after a top-up: the capital-weighted mean of the current start and
     * {@code now}, truncated to the second. Existing capital keeps its accrued period and
     * the new capital starts accruing from {@code now}.
     */
    static Instant weightedAccrualStart(InvestorPosition existing, BigDecimal added, Instant now) {
        Instant start = existing.getLastFeeAccrualAt();
        BigDecimal held = existing.getCapitalContributed();
        if (start == null || !start.isBefore(now) || held.signum() <= 0) {
            return now;
        }
        BigDecimal elapsed = BigDecimal.valueOf(now.getEpochSecond() - start.getEpochSecond());
        long shift = elapsed.multiply(added)
                .divide(held.add(added), 0, RoundingMode.DOWN)
                .longValueExact();
        return Instant.ofEpochSecond(start.getEpochSecond() + shift);
    }

    // ========================
    // ARBITRAGE OPPORTUNITIES
    // ========================

    /** Stores an opportunity found by the external scanner. Ids must be unique. */
    public void registerOpportunity(ArbitrageOpportunity opportunity) {
        if (opportunity.getId() == null || opportunity.getTimestamp() == null) {
            throw new ValidationException(ErrorCode.INVALID_PARAMS, "Opportunity requires an id and a timestamp");
        }
        if (opportunities.putIfAbsent(opportunity.getId(), opportunity) != null) {
            throw new ValidationException(
                    ErrorCode.INVALID_PARAMS, "Opportunity already registered: " + opportunity.getId());
        }
        log.debug("Opportunity registered: {} ({} vs {})", opportunity.getId(), opportunity.getVenueA(), opportunity.getVenueB());
    }

    /**
     * Removes and returns an opportunity. At most one caller ever receives a given
     * opportunity, which is what makes execution exactly-once.
     */
    public Optional<ArbitrageOpportunity> takeOpportunity(String opportunityId) {
        return Optional.ofNullable(opportunities.remove(opportunityId));
    }

    public Optional<ArbitrageOpportunity> findOpportunity(String opportunityId) {
        return Optional.ofNullable(opportunities.get(opportunityId));
    }

    public int getOpportunityCount() {
        return opportunities.size();
    }

    // ========================
    // EXCLUSIVE SECTIONS
    // ========================

    /**
     * Runs a mutation in the strategy's exclusive section, waiting at most
     * {@code vault.lock-timeout-ms} for it.
     *
     * @throws ResourceNotFoundException if the strategy does not exist
     * @throws StrategyBusyException     if the section could not be acquired in time
     */
    public <T> T mutate(String strategyId, Function<StrategyBook, T> mutation) {
        ReentrantLock lock = lockFor(strategyId);
        long timeoutMs = vaultProperties.getLockTimeoutMs();
        boolean acquired;
        try {
            acquired = lock.tryLock(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StrategyBusyException(strategyId, timeoutMs);
        }
        if (!acquired) {
            throw new StrategyBusyException(strategyId, timeoutMs);
        }
        try {
            return applyAndCommit(strategyId, mutation);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Runs a mutation only if the strategy's section is free right now.
     *
     * @return the mutation's result, or empty if the section was held
     */
    public <T> Optional<T> tryMutate(String strategyId, Function<StrategyBook, T> mutation) {
        ReentrantLock lock = lockFor(strategyId);
        if (!lock.tryLock()) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(applyAndCommit(strategyId, mutation));
        } finally {
            lock.unlock();
        }
    }

    // ========================
    // QUERIES (lock-free)
    // ========================

    public Strategy getStrategy(String strategyId) {
        return bookOrThrow(strategyId).getStrategy().copy();
    }

    public boolean exists(String strategyId) {
        return books.containsKey(strategyId);
    }

    public StrategyMetrics getMetrics(String strategyId) {
        return bookOrThrow(strategyId).getStrategy().getMetrics().toBuilder().build();
    }

    public List<InvestorPosition> getPositions(String strategyId) {
        return List.copyOf(bookOrThrow(strategyId).getPositions().values());
    }

    public Optional<InvestorPosition> getPosition(String strategyId, String investorId) {
        return Optional.ofNullable(bookOrThrow(strategyId).getPosition(investorId));
    }

    public List<GridOrder> getGridOrders(String strategyId) {
        List<GridOrder> orders = new ArrayList<>();
        for (GridOrder order : bookOrThrow(strategyId).getGridOrders()) {
            orders.add(order.copy());
        }
        return orders;
    }

    public List<Strategy> getAllStrategies() {
        return books.values().stream()
                .map(book -> book.getStrategy().copy())
                .sorted(Comparator.comparing(Strategy::getId))
                .toList();
    }

    public List<Strategy> getActiveStrategies() {
        return getAllStrategies().stream().filter(Strategy::isActive).toList();
    }

    public int getActiveStrategyCount() {
        int count = 0;
        for (StrategyBook book : books.values()) {
            if (book.getStrategy().isActive()) {
                count++;
            }
        }
        return count;
    }

    // ========================
    // INTERNALS
    // ========================

    private <T> T applyAndCommit(String strategyId, Function<StrategyBook, T> mutation) {
        StrategyBook working = bookOrThrow(strategyId).workingCopy();
        T result = mutation.apply(working);
        verifyInvariants(working);
        books.put(strategyId, working);
        return result;
    }

    private Strategy transition(String strategyId, StrategyStatus from, StrategyStatus to) {
        return mutate(strategyId, book -> {
            Strategy strategy = book.getStrategy();
            if (strategy.getStatus() != from) {
                throw new StrategyStateException(
                        ErrorCode.INVALID_TRANSITION,
                        "Strategy " + strategyId + " cannot move from " + strategy.getStatus() + " to " + to);
            }
            strategy.setStatus(to);
            log.info("Strategy {} {} -> {}", strategyId, from, to);
            return strategy.copy();
        });
    }

    void verifyInvariants(StrategyBook book) {
        Strategy strategy = book.getStrategy();
        BigDecimal capital = BigDecimal.ZERO;
        BigDecimal shares = BigDecimal.ZERO;
        for (InvestorPosition position : book.getPositions().values()) {
            if (position.getShares().signum() <= 0 || position.getCapitalContributed().signum() <= 0) {
                throw inconsistency(strategy, "Position " + position.getInvestorId() + " has shares "
                        + position.getShares().toPlainString() + " and capital "
                        + position.getCapitalContributed().toPlainString());
            }
            capital = capital.add(position.getCapitalContributed());
            shares = shares.add(position.getShares());
        }
        if (capital.compareTo(strategy.getTotalCapital()) != 0) {
            throw inconsistency(strategy, "totalCapital " + strategy.getTotalCapital().toPlainString()
                    + " != Σ contributed " + capital.toPlainString());
        }
        if (shares.compareTo(strategy.getTotalShares()) != 0) {
            throw inconsistency(strategy, "totalShares " + strategy.getTotalShares().toPlainString()
                    + " != Σ shares " + shares.toPlainString());
        }
        if (strategy.getType() == StrategyType.GRID_TRADING && strategy.getStatus() == StrategyStatus.ACTIVE) {
            long expected = 2L * strategy.getParams().getGridLevels();
            long active = book.activeGridOrderCount();
            if (active != expected) {
                throw inconsistency(strategy, "Grid holds " + active + " active orders, expected " + expected);
            }
        }
    }

    private LedgerInconsistencyException inconsistency(Strategy strategy, String message) {
        log.error("Ledger invariant violated for {}: {}", strategy.getId(), message);
        return new LedgerInconsistencyException(message, Map.of("strategyId", strategy.getId()));
    }

    private void validateDefinition(StrategyDefinition definition) {
        if (definition.getType() == null) {
            throw new ValidationException(ErrorCode.INVALID_PARAMS, "Strategy type is required");
        }
        String base = definition.getBaseAsset();
        String quote = definition.getQuoteAsset();
        if (base == null || base.isBlank() || quote == null || quote.isBlank() || base.equalsIgnoreCase(quote)) {
            throw new ValidationException(
                    ErrorCode.INVALID_ASSET_PAIR, "Invalid asset pair: " + base + "/" + quote);
        }
        if (definition.getPerformanceFeeBps() > MAX_PERFORMANCE_FEE_BPS) {
            throw new ValidationException(
                    ErrorCode.FEE_TOO_HIGH,
                    "Performance fee " + definition.getPerformanceFeeBps() + " bps exceeds cap "
                            + MAX_PERFORMANCE_FEE_BPS,
                    Map.of("performanceFeeBps", definition.getPerformanceFeeBps()));
        }
        if (definition.getManagementFeeBpsPerYear() > MAX_MANAGEMENT_FEE_BPS_PER_YEAR) {
            throw new ValidationException(
                    ErrorCode.FEE_TOO_HIGH,
                    "Management fee " + definition.getManagementFeeBpsPerYear() + " bps/year exceeds cap "
                            + MAX_MANAGEMENT_FEE_BPS_PER_YEAR,
                    Map.of("managementFeeBpsPerYear", definition.getManagementFeeBpsPerYear()));
        }
        if (definition.getPerformanceFeeBps() < 0 || definition.getManagementFeeBpsPerYear() < 0) {
            throw new ValidationException(ErrorCode.INVALID_PARAMS, "Fee rates cannot be negative");
        }
        BigDecimal min = definition.getMinInvestment();
        BigDecimal max = definition.getMaxInvestment();
        if (min == null || min.signum() < 0 || max == null || max.signum() < 0) {
            throw new ValidationException(ErrorCode.INVALID_PARAMS, "Investment bounds cannot be negative");
        }
        if (max.signum() > 0 && max.compareTo(min) < 0) {
            throw new ValidationException(ErrorCode.INVALID_PARAMS, "maxInvestment is below minInvestment");
        }
        validateParams(definition.getType(), definition.getParams());
    }

    private void validateParams(StrategyType type, StrategyParams params) {
        if (params == null) {
            throw new ValidationException(ErrorCode.INVALID_PARAMS, "Strategy params are required");
        }
        if (params.getTradeSizeBps() < 0 || params.getTradeSizeBps() > MAX_BPS) {
            throw new ValidationException(ErrorCode.INVALID_PARAMS, "tradeSizeBps must be within 0..10000");
        }
        if (params.getRebalanceThresholdBps() < 0
                || params.getStopLossBps() < 0
                || params.getTakeProfitBps() < 0
                || params.getMaxDrawdownBps() < 0
                || params.getMaxSlippageBps() < 0) {
            throw new ValidationException(ErrorCode.INVALID_PARAMS, "Thresholds cannot be negative");
        }
        switch (type) {
            case GRID_TRADING -> {
                if (params.getGridLevels() < 1 || params.getGridSpacing() == null
                        || params.getGridSpacing().signum() <= 0) {
                    throw new ValidationException(
                            ErrorCode.INVALID_PARAMS, "Grid strategies need gridLevels >= 1 and gridSpacing > 0");
                }
            }
            case DCA -> {
                if (params.getDcaIntervalSeconds() <= 0
                        || params.getDcaAmount() == null
                        || params.getDcaAmount().signum() <= 0
                        || params.getDcaTotalBudget() == null
                        || params.getDcaTotalBudget().compareTo(params.getDcaAmount()) < 0) {
                    throw new ValidationException(
                            ErrorCode.INVALID_PARAMS,
                            "DCA strategies need an interval, a positive amount and a budget of at least one leg");
                }
            }
            default -> {
                // no type-specific params
            }
        }
    }

    private boolean gridGeometryChanged(StrategyParams current, StrategyParams next) {
        return current.getGridLevels() != next.getGridLevels()
                || current.getGridSpacing().compareTo(next.getGridSpacing()) != 0;
    }

    private void requireActive(Strategy strategy) {
        if (strategy.getStatus() != StrategyStatus.ACTIVE) {
            throw new StrategyStateException(
                    ErrorCode.NOT_ACTIVE, "Strategy " + strategy.getId() + " is " + strategy.getStatus());
        }
    }

    private void requireNotStopped(Strategy strategy) {
        if (strategy.getStatus() == StrategyStatus.EMERGENCY_STOP) {
            throw new StrategyStateException(
                    ErrorCode.NOT_ACTIVE, "Strategy " + strategy.getId() + " is emergency-stopped");
        }
    }

    private ReentrantLock lockFor(String strategyId) {
        ReentrantLock lock = strategyLocks.get(strategyId);
        if (lock == null) {
            throw new ResourceNotFoundException("Strategy", strategyId);
        }
        return lock;
    }

    private StrategyBook bookOrThrow(String strategyId) {
        StrategyBook book = books.get(strategyId);
        if (book == null) {
            throw new ResourceNotFoundException("Strategy", strategyId);
        }
        return book;
    }
}
