package com.strategyvault.unit.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.strategyvault.auth.ConfiguredAuthorizationService;
import com.strategyvault.config.VaultProperties;
import com.strategyvault.core.engine.StrategyController;
import com.strategyvault.domain.enums.StrategyStatus;
import com.strategyvault.domain.enums.StrategyType;
import com.strategyvault.domain.model.ArbitrageOpportunity;
import com.strategyvault.domain.model.PerformanceReport;
import com.strategyvault.domain.model.StrategyDefinition;
import com.strategyvault.domain.model.StrategyParams;
import com.strategyvault.event.ArbitrageEvent;
import com.strategyvault.event.ArbitrageEventType;
import com.strategyvault.event.DcaExecutedEvent;
import com.strategyvault.event.EventPublisherHelper;
import com.strategyvault.event.GridOrderEvent;
import com.strategyvault.event.InvestmentEvent;
import com.strategyvault.event.RebalanceEvent;
import com.strategyvault.event.SettlementFailedEvent;
import com.strategyvault.event.StrategyEvent;
import com.strategyvault.event.StrategyEventType;
import com.strategyvault.exception.BaseException;
import com.strategyvault.exception.ErrorCode;
import com.strategyvault.fee.FeeCalculator;
import com.strategyvault.ledger.InvestmentReceipt;
import com.strategyvault.ledger.LedgerStore;
import com.strategyvault.ledger.WithdrawalReceipt;
import com.strategyvault.risk.StrategyRiskGuard;
import com.strategyvault.simulator.LoggingTradeExecutor;
import com.strategyvault.simulator.SimulatedPriceFeed;
import com.strategyvault.simulator.SimulatedSettlementGateway;
import com.strategyvault.strategy.engine.ArbitrageExecutor;
import com.strategyvault.strategy.engine.GridEngine;
import com.strategyvault.strategy.engine.PassiveRebalanceEngine;
import com.strategyvault.strategy.engine.PeriodicEngine;
import com.strategyvault.strategy.engine.RebalanceOutcome;
import com.strategyvault.strategy.engine.RebalanceResult;
import com.strategyvault.strategy.engine.TrendEngine;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for StrategyController wired to a real ledger, real engines and the simulators.
 * Events are captured from a recording ApplicationEventPublisher.
 */
class StrategyControllerTest {

    private static final Instant START = Instant.parse("2025-03-01T00:00:00Z");

    private static final String MANAGER = "manager";
    private static final String OPERATOR = "operator";
    private static final String ADMIN = "admin";
    private static final String ALICE = "alice";

    private Instant now;
    private final List<Object> events = new CopyOnWriteArrayList<>();
    private SimulatedPriceFeed priceFeed;
    private SimulatedSettlementGateway settlementGateway;
    private LoggingTradeExecutor tradeExecutor;
    private LedgerStore ledgerStore;
    private StrategyController controller;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        now = START;
        Clock clock = mock(Clock.class);
        when(clock.instant()).thenAnswer(inv -> now);

        VaultProperties vaultProperties = new VaultProperties();
        vaultProperties.setLockTimeoutMs(50);
        vaultProperties.getAuth().setManagers(List.of(MANAGER));
        vaultProperties.getAuth().setOperators(List.of(OPERATOR));
        vaultProperties.getAuth().setAdmins(List.of(ADMIN));

        priceFeed = new SimulatedPriceFeed(Map.of("ETH", new BigDecimal("2000")));
        settlementGateway = new SimulatedSettlementGateway();
        tradeExecutor = new LoggingTradeExecutor();

        GridEngine gridEngine = new GridEngine(priceFeed, tradeExecutor);
        ledgerStore = new LedgerStore(gridEngine, new FeeCalculator(), vaultProperties, clock);
        controller = new StrategyController(
                ledgerStore,
                List.of(
                        gridEngine,
                        new TrendEngine(priceFeed, tradeExecutor),
                        new PeriodicEngine(tradeExecutor),
                        new PassiveRebalanceEngine()),
                new ArbitrageExecutor(ledgerStore, tradeExecutor, vaultProperties),
                new StrategyRiskGuard(),
                new ConfiguredAuthorizationService(vaultProperties.getAuth()),
                settlementGateway,
                new EventPublisherHelper(events::add),
                vaultProperties,
                clock);
        executor = Executors.newSingleThreadExecutor();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    // ========================
    // AUTHORIZATION
    // ========================

    @Nested
    @DisplayName("Authorization")
    class Authorization {

        @Test
        @DisplayName("Only strategy managers and admins can create strategies")
        void createRequiresManager() {
            assertForbidden(() -> controller.createStrategy("mallory", definition(StrategyType.MOMENTUM)));
            assertForbidden(() -> controller.createStrategy(OPERATOR, definition(StrategyType.MOMENTUM)));

            assertThat(controller.createStrategy(ADMIN, definition(StrategyType.MOMENTUM)).getCreator())
                    .isEqualTo(ADMIN);
        }

        @Test
        @DisplayName("Rebalance and arbitrage need OPERATOR, emergency stop needs ADMIN")
        void operatorAndAdminRoles() {
            String id = activeStrategy(StrategyType.MOMENTUM);

            assertForbidden(() -> controller.rebalance(MANAGER, id));
            assertForbidden(() -> controller.rebalanceAll(ALICE));
            assertForbidden(() -> controller.executeArbitrage(MANAGER, id, "OPP-1"));
            assertForbidden(() -> controller.emergencyStop(OPERATOR, id, "panic"));
            assertForbidden(() -> controller.recordPerformance(MANAGER, id, PerformanceReport.builder().build()));
        }

        @Test
        @DisplayName("A rejected caller leaves no trace in the ledger and publishes nothing")
        void rejectedCallerHasNoEffect() {
            String id = activeStrategy(StrategyType.MOMENTUM);
            events.clear();

            assertForbidden(() -> controller.pause(OPERATOR, id));

            assertThat(ledgerStore.getStrategy(id).getStatus()).isEqualTo(StrategyStatus.ACTIVE);
            assertThat(events).isEmpty();
        }
    }

    // ========================
    // LIFECYCLE EVENTS
    // ========================

    @Nested
    @DisplayName("Lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("Create, activate, pause and resume each publish one strategy event")
        void lifecycleEvents() {
            String id = controller.createStrategy(MANAGER, definition(StrategyType.MOMENTUM)).getId();
            controller.activate(MANAGER, id);
            controller.pause(MANAGER, id);
            controller.resume(MANAGER, id);

            assertThat(eventsOf(StrategyEvent.class))
                    .extracting(StrategyEvent::getEventType)
                    .containsExactly(
                            StrategyEventType.CREATED,
                            StrategyEventType.ACTIVATED,
                            StrategyEventType.PAUSED,
                            StrategyEventType.RESUMED);
        }

        @Test
        @DisplayName("Emergency stop is idempotent and published once")
        void emergencyStopOnce() {
            String id = activeStrategy(StrategyType.MOMENTUM);

            controller.emergencyStop(ADMIN, id, "oracle compromised");
            controller.emergencyStop(ADMIN, id, "again");

            assertThat(ledgerStore.getStrategy(id).getStatus()).isEqualTo(StrategyStatus.EMERGENCY_STOP);
            assertThat(eventsOf(StrategyEvent.class))
                    .filteredOn(e -> e.getEventType() == StrategyEventType.EMERGENCY_STOPPED)
                    .singleElement()
                    .satisfies(e -> {
                        assertThat(e.getPreviousStatus()).isEqualTo(StrategyStatus.ACTIVE);
                        assertThat(e.getReason()).isEqualTo("oracle compromised");
                    });
        }

        @Test
        @DisplayName("A failed transition publishes nothing")
        void failedTransitionSilent() {
            String id = activeStrategy(StrategyType.MOMENTUM);
            events.clear();

            assertThatThrownBy(() -> controller.activate(MANAGER, id))
                    .extracting(e -> ((BaseException) e).getErrorCode())
                    .isEqualTo(ErrorCode.ALREADY_ACTIVE);
            assertThat(events).isEmpty();
        }
    }

    // ========================
    // INVEST / WITHDRAW SETTLEMENT
    // ========================

    @Nested
    @DisplayName("Invest and withdraw settlement")
    class Settlement {

        @Test
        @DisplayName("Investing settles investor -> vault and returns the transfer reference")
        void investSettles() {
            String id = activeStrategy(StrategyType.MOMENTUM);

            InvestmentReceipt receipt = controller.invest(ALICE, id, new BigDecimal("1000"));

            assertThat(receipt.getSettlementRef()).isEqualTo("SIM-TX-1");
            assertThat(settlementGateway.getTransfers()).singleElement().satisfies(tx -> {
                assertThat(tx.getFrom()).isEqualTo(ALICE);
                assertThat(tx.getTo()).isEqualTo("vault");
                assertThat(tx.getAsset()).isEqualTo("USDC");
                assertThat(tx.getAmount()).isEqualByComparingTo("1000");
            });
            assertThat(eventsOf(InvestmentEvent.class)).hasSize(1);
        }

        @Test
        @DisplayName("A zero fee withdrawal settles the payout only")
        void zeroFeeNotSettled() {
            String id = activeStrategy(StrategyType.MOMENTUM);
            controller.invest(ALICE, id, new BigDecimal("1000"));

            WithdrawalReceipt receipt = controller.withdraw(ALICE, id, new BigDecimal("400"));

            assertThat(receipt.getNetAmount()).isEqualByComparingTo("400");
            assertThat(receipt.getSettlementRef()).isEqualTo("SIM-TX-2");
            assertThat(receipt.getFeeSettlementRef()).isNull();
            assertThat(settlementGateway.getTransfers()).hasSize(2);
        }

        @Test
        @DisplayName("Management fee is settled to the fee recipient")
        void feeSettled() {
            String id = controller.createStrategy(MANAGER, StrategyDefinition.builder()
                            .type(StrategyType.MOMENTUM)
                            .baseAsset("ETH")
                            .quoteAsset("USDC")
                            .managementFeeBpsPerYear(100)
                            .build())
                    .getId();
            controller.activate(MANAGER, id);
            controller.invest(ALICE, id, new BigDecimal("1000"));
            now = START.plus(Duration.ofDays(365));

            WithdrawalReceipt receipt = controller.withdraw(ALICE, id, new BigDecimal("1000"));

            assertThat(receipt.getNetAmount()).isEqualByComparingTo("990");
            assertThat(settlementGateway.getTransfers())
                    .extracting(tx -> tx.getTo())
                    .containsExactly("vault", ALICE, "fee-recipient");
            assertThat(receipt.getFeeSettlementRef()).isEqualTo("SIM-TX-3");
        }

        @Test
        @DisplayName("A failed investment transfer keeps the shares, publishes for reconciliation and rethrows")
        void investSettlementFailure() {
            String id = activeStrategy(StrategyType.MOMENTUM);
            settlementGateway.setFailing(true);

            assertThatThrownBy(() -> controller.invest(ALICE, id, new BigDecimal("1000")))
                    .extracting(e -> ((BaseException) e).getErrorCode())
                    .isEqualTo(ErrorCode.SETTLEMENT_FAILED);

            assertThat(ledgerStore.getPosition(id, ALICE)).isPresent();
            assertThat(ledgerStore.getStrategy(id).getTotalCapital()).isEqualByComparingTo("1000");
            assertThat(eventsOf(SettlementFailedEvent.class)).singleElement().satisfies(e -> {
                assertThat(e.getOperation()).isEqualTo("INVEST");
                assertThat(e.getAmount()).isEqualByComparingTo("1000");
            });
        }

        @Test
        @DisplayName("Both withdrawal transfers are attempted when custody fails")
        void withdrawBothAttempted() {
            String id = controller.createStrategy(MANAGER, StrategyDefinition.builder()
                            .type(StrategyType.MOMENTUM)
                            .baseAsset("ETH")
                            .quoteAsset("USDC")
                            .managementFeeBpsPerYear(100)
                            .build())
                    .getId();
            controller.activate(MANAGER, id);
            controller.invest(ALICE, id, new BigDecimal("1000"));
            now = START.plus(Duration.ofDays(365));
            settlementGateway.setFailing(true);

            assertThatThrownBy(() -> controller.withdraw(ALICE, id, new BigDecimal("1000")))
                    .extracting(e -> ((BaseException) e).getErrorCode())
                    .isEqualTo(ErrorCode.SETTLEMENT_FAILED);

            assertThat(ledgerStore.getPosition(id, ALICE)).isEmpty();
            assertThat(eventsOf(SettlementFailedEvent.class))
                    .extracting(SettlementFailedEvent::getOperation)
                    .containsExactly("WITHDRAW", "WITHDRAW_FEE");
        }
    }

    // ========================
    // REBALANCE
    // ========================

    @Nested
    @DisplayName("Rebalance dispatch")
    class Rebalance {

        @Test
        @DisplayName("Grid fills publish a rebalance event and one grid order event per fill")
        void gridDispatch() {
            String id = controller.createStrategy(MANAGER, StrategyDefinition.builder()
                            .type(StrategyType.GRID_TRADING)
                            .baseAsset("ETH")
                            .quoteAsset("USDC")
                            .params(StrategyParams.builder()
                                    .gridLevels(5)
                                    .gridSpacing(new BigDecimal("10"))
                                    .build())
                            .build())
                    .getId();
            controller.activate(MANAGER, id);
            controller.invest(ALICE, id, new BigDecimal("1000"));
            priceFeed.setPrice("ETH", new BigDecimal("1985"));

            RebalanceOutcome outcome = controller.rebalance(OPERATOR, id);

            assertThat(outcome.getResult()).isEqualTo(RebalanceResult.EXECUTED);
            assertThat(eventsOf(RebalanceEvent.class)).hasSize(1);
            assertThat(eventsOf(GridOrderEvent.class)).singleElement().satisfies(e -> {
                assertThat(e.getFilledOrder().getPrice()).isEqualByComparingTo("1990");
                assertThat(e.getReplacementOrder().getPrice()).isEqualByComparingTo("2010");
            });
            assertThat(tradeExecutor.getTrades()).hasSize(1);
        }

        @Test
        @DisplayName("A DCA leg publishes a DCA event")
        void dcaDispatch() {
            String id = controller.createStrategy(MANAGER, StrategyDefinition.builder()
                            .type(StrategyType.DCA)
                            .baseAsset("ETH")
                            .quoteAsset("USDC")
                            .params(StrategyParams.builder()
                                    .dcaIntervalSeconds(3600)
                                    .dcaAmount(new BigDecimal("100"))
                                    .dcaTotalBudget(new BigDecimal("300"))
                                    .build())
                            .build())
                    .getId();
            controller.activate(MANAGER, id);

            controller.rebalance(OPERATOR, id);

            assertThat(eventsOf(DcaExecutedEvent.class)).singleElement().satisfies(e -> {
                assertThat(e.getSpent()).isEqualByComparingTo("100");
                assertThat(e.getTotalBudget()).isEqualByComparingTo("300");
            });
        }

        @Test
        @DisplayName("Types without an algorithm rebalance as a recorded no-op")
        void passiveDispatch() {
            String id = activeStrategy(StrategyType.YIELD_FARMING);

            RebalanceOutcome outcome = controller.rebalance(OPERATOR, id);

            assertThat(outcome.getResult()).isEqualTo(RebalanceResult.NO_ACTION);
            assertThat(ledgerStore.getStrategy(id).getLastRebalance()).isEqualTo(START);
        }

        @Test
        @DisplayName("A breached drawdown limit pauses the strategy before the engine runs")
        void riskPause() {
            String id = controller.createStrategy(MANAGER, StrategyDefinition.builder()
                            .type(StrategyType.MOMENTUM)
                            .baseAsset("ETH")
                            .quoteAsset("USDC")
                            .params(StrategyParams.builder().maxDrawdownBps(1000).build())
                            .build())
                    .getId();
            controller.activate(MANAGER, id);
            controller.invest(ALICE, id, new BigDecimal("1000"));
            controller.recordPerformance(
                    OPERATOR, id, PerformanceReport.builder().maxDrawdownBps(1200).build());
            priceFeed.setTwap("ETH", TrendEngine.MOMENTUM_TWAP_WINDOW_SECONDS, new BigDecimal("1900"));
            events.clear();

            RebalanceOutcome outcome = controller.rebalance(OPERATOR, id);

            assertThat(outcome.getResult()).isEqualTo(RebalanceResult.PAUSED_BY_RISK);
            assertThat(ledgerStore.getStrategy(id).getStatus()).isEqualTo(StrategyStatus.PAUSED);
            assertThat(tradeExecutor.getTrades()).isEmpty();
            assertThat(eventsOf(StrategyEvent.class))
                    .singleElement()
                    .extracting(StrategyEvent::getEventType)
                    .isEqualTo(StrategyEventType.PAUSED);
        }

        @Test
        @DisplayName("Rebalancing a paused strategy is rejected with NOT_ACTIVE")
        void pausedRejected() {
            String id = activeStrategy(StrategyType.MOMENTUM);
            controller.pause(MANAGER, id);

            assertThatThrownBy(() -> controller.rebalance(OPERATOR, id))
                    .extracting(e -> ((BaseException) e).getErrorCode())
                    .isEqualTo(ErrorCode.NOT_ACTIVE);
        }

        @Test
        @DisplayName("A busy strategy is skipped without waiting, and the skip is published")
        void busySkipped() throws Exception {
            String id = activeStrategy(StrategyType.MOMENTUM);
            CountDownLatch held = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            Future<?> holder = executor.submit(() -> ledgerStore.mutate(id, book -> {
                held.countDown();
                awaitQuietly(release);
                return null;
            }));
            assertThat(held.await(5, TimeUnit.SECONDS)).isTrue();

            RebalanceOutcome outcome;
            try {
                outcome = controller.rebalance(OPERATOR, id);
            } finally {
                release.countDown();
            }
            holder.get(5, TimeUnit.SECONDS);

            assertThat(outcome.getResult()).isEqualTo(RebalanceResult.SKIPPED_BUSY);
            assertThat(ledgerStore.getStrategy(id).getLastRebalance()).isNull();
            assertThat(eventsOf(RebalanceEvent.class))
                    .singleElement()
                    .satisfies(e -> assertThat(e.getOutcome().getResult()).isEqualTo(RebalanceResult.SKIPPED_BUSY));
        }

        @Test
        @DisplayName("rebalanceAll covers only ACTIVE strategies")
        void rebalanceAllActiveOnly() {
            String active = activeStrategy(StrategyType.MOMENTUM);
            String paused = activeStrategy(StrategyType.MEAN_REVERSION);
            controller.pause(MANAGER, paused);
            controller.createStrategy(MANAGER, definition(StrategyType.LIQUIDITY_PROVIDING));

            List<RebalanceOutcome> outcomes = controller.rebalanceAll(OPERATOR);

            assertThat(outcomes).extracting(RebalanceOutcome::getStrategyId).containsExactly(active);
        }
    }

    // ========================
    // ARBITRAGE
    // ========================

    @Nested
    @DisplayName("Arbitrage")
    class Arbitrage {

        @Test
        @DisplayName("An executed opportunity publishes an EXECUTED event")
        void executed() {
            String id = activeStrategy(StrategyType.ARBITRAGE);
            controller.invest(ALICE, id, new BigDecimal("1000"));
            controller.registerOpportunity(OPERATOR, opportunity("OPP-1"));
            now = START.plusSeconds(60);

            controller.executeArbitrage(OPERATOR, id, "OPP-1");

            assertThat(eventsOf(ArbitrageEvent.class))
                    .singleElement()
                    .extracting(ArbitrageEvent::getEventType)
                    .isEqualTo(ArbitrageEventType.EXECUTED);
            assertThat(ledgerStore.getMetrics(id).getTotalTrades()).isEqualTo(1);
        }

        @Test
        @DisplayName("An expired opportunity is removed, published and reported as OPPORTUNITY_EXPIRED")
        void expired() {
            String id = activeStrategy(StrategyType.ARBITRAGE);
            controller.invest(ALICE, id, new BigDecimal("1000"));
            controller.registerOpportunity(OPERATOR, opportunity("OPP-1"));
            now = START.plusSeconds(301);

            assertThatThrownBy(() -> controller.executeArbitrage(OPERATOR, id, "OPP-1"))
                    .extracting(e -> ((BaseException) e).getErrorCode())
                    .isEqualTo(ErrorCode.OPPORTUNITY_EXPIRED);

            assertThat(ledgerStore.findOpportunity("OPP-1")).isEmpty();
            assertThat(eventsOf(ArbitrageEvent.class))
                    .singleElement()
                    .extracting(ArbitrageEvent::getEventType)
                    .isEqualTo(ArbitrageEventType.EXPIRED);
            assertThat(tradeExecutor.getTrades()).isEmpty();
        }
    }

    // ========================
    // HELPERS
    // ========================

    private String activeStrategy(StrategyType type) {
        String id = controller.createStrategy(MANAGER, definition(type)).getId();
        controller.activate(MANAGER, id);
        return id;
    }

    private static StrategyDefinition definition(StrategyType type) {
        return StrategyDefinition.builder()
                .type(type)
                .baseAsset("ETH")
                .quoteAsset("USDC")
                .build();
    }

    private static ArbitrageOpportunity opportunity(String id) {
        return ArbitrageOpportunity.builder()
                .id(id)
                .tokenA("ETH")
                .tokenB("USDC")
                .venueA("venue-a")
                .venueB("venue-b")
                .priceA(new BigDecimal("2000"))
                .priceB(new BigDecimal("2030"))
                .profit(new BigDecimal("30"))
                .timestamp(START)
                .build();
    }

    private <T> List<T> eventsOf(Class<T> type) {
        return events.stream().filter(type::isInstance).map(type::cast).toList();
    }

    private static void assertForbidden(Runnable call) {
        assertThatThrownBy(call::run)
                .extracting(e -> ((BaseException) e).getErrorCode())
                .isEqualTo(ErrorCode.FORBIDDEN);
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
