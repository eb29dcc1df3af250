package com.strategyvault.integration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.strategyvault.auth.ConfiguredAuthorizationService;
import com.strategyvault.config.VaultProperties;
import com.strategyvault.core.engine.StrategyController;
import com.strategyvault.domain.enums.StrategyStatus;
import com.strategyvault.domain.enums.StrategyType;
import com.strategyvault.domain.model.InvestorPosition;
import com.strategyvault.domain.model.StrategyDefinition;
import com.strategyvault.domain.model.StrategyParams;
import com.strategyvault.event.ArbitrageEvent;
import com.strategyvault.event.DcaExecutedEvent;
import com.strategyvault.event.EventPublisherHelper;
import com.strategyvault.event.GridOrderEvent;
import com.strategyvault.event.InvestmentEvent;
import com.strategyvault.event.RebalanceEvent;
import com.strategyvault.event.SettlementFailedEvent;
import com.strategyvault.exception.BaseException;
import com.strategyvault.exception.ErrorCode;
import com.strategyvault.exception.SettlementException;
import com.strategyvault.fee.FeeCalculator;
import com.strategyvault.ledger.LedgerStore;
import com.strategyvault.ledger.WithdrawalReceipt;
import com.strategyvault.observability.VaultMetricsService;
import com.strategyvault.reconciliation.SettlementReconciliationService;
import com.strategyvault.risk.StrategyRiskGuard;
import com.strategyvault.simulator.LoggingTradeExecutor;
import com.strategyvault.simulator.SimulatedPriceFeed;
import com.strategyvault.simulator.SimulatedSettlementGateway;
import com.strategyvault.strategy.engine.ArbitrageExecutor;
import com.strategyvault.strategy.engine.GridEngine;
import com.strategyvault.strategy.engine.PassiveRebalanceEngine;
import com.strategyvault.strategy.engine.PeriodicEngine;
import com.strategyvault.strategy.engine.TrendEngine;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.context.ApplicationEventPublisher;

/**
 * Cross-service integration test for the vault: controller, ledger, engines and
 * simulators wired for real, with events routed by hand to the reconciliation and
 * metrics listeners in their listener order.
 */
class VaultFlowIntegrationTest {

    private static final Instant START = Instant.parse("2025-03-01T00:00:00Z");

    private Instant now;
    private SimulatedPriceFeed priceFeed;
    private SimulatedSettlementGateway settlementGateway;
    private LoggingTradeExecutor tradeExecutor;
    private LedgerStore ledgerStore;
    private SettlementReconciliationService reconciliationService;
    private SimpleMeterRegistry meterRegistry;
    private StrategyController controller;

    @BeforeEach
    void setUp() {
        now = START;
        Clock clock = mock(Clock.class);
        when(clock.instant()).thenAnswer(inv -> now);

        VaultProperties vaultProperties = new VaultProperties();
        vaultProperties.getAuth().setManagers(List.of("manager"));
        vaultProperties.getAuth().setOperators(List.of("scheduler"));
        vaultProperties.getAuth().setAdmins(List.of("admin"));

        priceFeed = new SimulatedPriceFeed(Map.of("ETH", new BigDecimal("2000")));
        settlementGateway = new SimulatedSettlementGateway();
        tradeExecutor = new LoggingTradeExecutor();
        GridEngine gridEngine = new GridEngine(priceFeed, tradeExecutor);
        ledgerStore = new LedgerStore(gridEngine, new FeeCalculator(), vaultProperties, clock);

        reconciliationService = new SettlementReconciliationService(clock);
        meterRegistry = new SimpleMeterRegistry();
        VaultMetricsService metricsService = new VaultMetricsService(meterRegistry, ledgerStore);

        // Route events the way the listeners are ordered: reconciliation (15) before metrics (20)
        ApplicationEventPublisher eventPublisher = event -> {
            if (event instanceof SettlementFailedEvent failed) {
                reconciliationService.onSettlementFailed(failed);
                metricsService.onSettlementFailedEvent(failed);
            } else if (event instanceof InvestmentEvent investment) {
                metricsService.onInvestmentEvent(investment);
            } else if (event instanceof GridOrderEvent gridOrder) {
                metricsService.onGridOrderEvent(gridOrder);
            } else if (event instanceof DcaExecutedEvent dca) {
                metricsService.onDcaExecutedEvent(dca);
            } else if (event instanceof ArbitrageEvent arbitrage) {
                metricsService.onArbitrageEvent(arbitrage);
            } else if (event instanceof RebalanceEvent rebalance) {
                metricsService.onRebalanceEvent(rebalance);
            }
        };

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
                new EventPublisherHelper(eventPublisher),
                vaultProperties,
                clock);
    }

    @Test
    @DisplayName("Two investors share a grid strategy, the market moves, both exit with fees settled")
    void gridInvestRebalanceWithdraw() {
        String id = controller.createStrategy("manager", StrategyDefinition.builder()
                        .type(StrategyType.GRID_TRADING)
                        .baseAsset("ETH")
                        .quoteAsset("USDC")
                        .minInvestment(new BigDecimal("100"))
                        .managementFeeBpsPerYear(200)
                        .performanceFeeBps(1000)
                        .params(StrategyParams.builder()
                                .gridLevels(5)
                                .gridSpacing(new BigDecimal("10"))
                                .build())
                        .build())
                .getId();
        controller.activate("manager", id);
        controller.invest("alice", id, new BigDecimal("3000"));
        controller.invest("bob", id, new BigDecimal("1000"));

        assertThat(controller.getGridOrders(id)).filteredOn(o -> o.isActive()).hasSize(10);

        // Price drops through two buy levels, then recovers through two sell levels
        priceFeed.setPrice("ETH", new BigDecimal("1979"));
        assertThat(controller.rebalance("scheduler", id).getGridFills()).hasSize(2);
        priceFeed.setPrice("ETH", new BigDecimal("2021"));
        assertThat(controller.rebalance("scheduler", id).getGridFills()).hasSize(4);

        assertThat(controller.getGridOrders(id)).filteredOn(o -> o.isActive()).hasSize(10);
        assertThat(tradeExecutor.getTrades()).hasSize(6);
        assertThat(meterRegistry.get("vault.grid.fills").counter().count()).isEqualTo(6.0);

        // Half a year later both investors leave
        now = START.plus(Duration.ofDays(182));
        WithdrawalReceipt alice = controller.withdraw("alice", id, new BigDecimal("3000"));
        WithdrawalReceipt bob = controller.withdraw("bob", id, new BigDecimal("1000"));

        assertThat(alice.getFees().getManagementFee()).isPositive();
        assertThat(alice.getNetAmount().add(alice.getFees().getTotal())).isEqualByComparingTo("3000");
        assertThat(bob.getGrossAmount()).isEqualByComparingTo("1000");
        assertThat(controller.getPositions(id)).isEmpty();
        assertThat(controller.getStrategy(id).getTotalCapital()).isEqualByComparingTo("0");
        assertThat(controller.getStrategy(id).getTotalShares()).isEqualByComparingTo("0");

        // 2 deposits, 2 payouts, 2 fee transfers
        assertThat(settlementGateway.getTransfers()).hasSize(6);
        assertThat(meterRegistry.get("vault.invested.amount").counter().count()).isEqualTo(4000.0);
        assertThat(meterRegistry.get("vault.withdrawn.amount").counter().count()).isEqualTo(4000.0);
    }

    @Test
    @DisplayName("DCA runs its legs on schedule and pauses itself when the budget is spent")
    void dcaRunsToBudget() {
        String id = controller.createStrategy("manager", StrategyDefinition.builder()
                        .type(StrategyType.DCA)
                        .baseAsset("ETH")
                        .quoteAsset("USDC")
                        .params(StrategyParams.builder()
                                .dcaIntervalSeconds(3600)
                                .dcaAmount(new BigDecimal("100"))
                                .dcaTotalBudget(new BigDecimal("250"))
                                .build())
                        .build())
                .getId();
        controller.activate("manager", id);

        for (int hour = 0; hour < 4; hour++) {
            now = START.plus(Duration.ofHours(hour));
            controller.rebalanceAll("scheduler");
        }

        assertThat(controller.getStrategy(id).getDcaSpent()).isEqualByComparingTo("200");
        assertThat(controller.getStrategy(id).getStatus()).isEqualTo(StrategyStatus.PAUSED);
        assertThat(meterRegistry.get("vault.dca.legs").counter().count()).isEqualTo(2.0);

        // A paused strategy is no longer part of the scheduled pass
        now = START.plus(Duration.ofHours(5));
        assertThat(controller.rebalanceAll("scheduler")).isEmpty();
    }

    @Test
    @DisplayName("A custody outage after a withdrawal opens reconciliation items and keeps the ledger committed")
    void settlementOutageReconciled() {
        String id = controller.createStrategy("manager", StrategyDefinition.builder()
                        .type(StrategyType.YIELD_FARMING)
                        .baseAsset("ETH")
                        .quoteAsset("USDC")
                        .build())
                .getId();
        controller.activate("manager", id);
        controller.invest("alice", id, new BigDecimal("1000"));
        settlementGateway.setFailing(true);

        assertThatThrownBy(() -> controller.withdraw("alice", id, new BigDecimal("250")))
                .isInstanceOf(SettlementException.class);

        InvestorPosition position = controller.getPosition(id, "alice").orElseThrow();
        assertThat(position.getShares()).isEqualByComparingTo("750");
        assertThat(reconciliationService.getOpenItems()).singleElement().satisfies(item -> {
            assertThat(item.getOperation()).isEqualTo("WITHDRAW");
            assertThat(item.getTo()).isEqualTo("alice");
            assertThat(item.getAmount()).isEqualByComparingTo("250");
        });
        assertThat(meterRegistry.get("vault.settlement.failures").counter().count()).isEqualTo(1.0);

        settlementGateway.setFailing(false);
        reconciliationService.resolve(reconciliationService.getOpenItems().get(0).getId(), "paid out manually");
        assertThat(reconciliationService.getOpenItems()).isEmpty();
    }

    @Test
    @DisplayName("Emergency stop freezes a strategy: no rebalance, no invest, no withdraw")
    void emergencyStopFreezes() {
        String id = controller.createStrategy("manager", StrategyDefinition.builder()
                        .type(StrategyType.MOMENTUM)
                        .baseAsset("ETH")
                        .quoteAsset("USDC")
                        .build())
                .getId();
        controller.activate("manager", id);
        controller.invest("alice", id, new BigDecimal("1000"));

        controller.emergencyStop("admin", id, "venue incident");

        assertThat(controller.rebalanceAll("scheduler")).isEmpty();
        assertThatThrownBy(() -> controller.invest("bob", id, new BigDecimal("500")))
                .extracting(e -> ((BaseException) e).getErrorCode())
                .isEqualTo(ErrorCode.NOT_ACTIVE);
        assertThatThrownBy(() -> controller.withdraw("alice", id, new BigDecimal("1000")))
                .extracting(e -> ((BaseException) e).getErrorCode())
                .isEqualTo(ErrorCode.NOT_ACTIVE);
        assertThat(controller.getPosition(id, "alice")).isPresent();
        assertThat(controller.getStrategy(id).getStatus()).isEqualTo(StrategyStatus.EMERGENCY_STOP);
        assertThat(meterRegistry.get("vault.rebalance.skipped").counter().count()).isZero();
        assertThat(controller.getStrategy(id).getLastRebalance()).isNull();
    }
}
