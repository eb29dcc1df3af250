package com.strategyvault.observability;

import com.strategyvault.event.ArbitrageEvent;
import com.strategyvault.event.ArbitrageEventType;
import com.strategyvault.event.DcaExecutedEvent;
import com.strategyvault.event.GridOrderEvent;
import com.strategyvault.event.InvestmentEvent;
import com.strategyvault.event.InvestmentEventType;
import com.strategyvault.event.RebalanceEvent;
import com.strategyvault.event.SettlementFailedEvent;
import com.strategyvault.ledger.LedgerStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Micrometer metrics for the vault:
 * <ul>
 *   <li><b>vault.invested.amount</b> / <b>vault.withdrawn.amount</b> (counters, quote-asset units)</li>
 *   <li><b>vault.fees.collected</b> (counter): management plus performance fees on withdrawals</li>
 *   <li><b>vault.grid.fills</b>, <b>vault.dca.legs</b> (counters)</li>
 *   <li><b>vault.arbitrage.executed</b>, <b>vault.arbitrage.expired</b> (counters)</li>
 *   <li><b>vault.rebalance.skipped</b> (counter): passes skipped on a busy strategy</li>
 *   <li><b>vault.settlement.failures</b> (counter): transfers that failed after commit</li>
 *   <li><b>vault.strategies.active</b> (gauge)</li>
 * </ul>
 *
 * <p>Counters are fed by event listeners running after the core listeners; the gauge
 * is polled from the ledger on scrape.
 */
@Service
public class VaultMetricsService {

    private final Counter investedAmountCounter;
    private final Counter withdrawnAmountCounter;
    private final Counter feesCollectedCounter;
    private final Counter gridFillsCounter;
    private final Counter dcaLegsCounter;
    private final Counter arbitrageExecutedCounter;
    private final Counter arbitrageExpiredCounter;
    private final Counter rebalanceSkippedCounter;
    private final Counter settlementFailuresCounter;

    public VaultMetricsService(MeterRegistry meterRegistry, LedgerStore ledgerStore) {
        this.investedAmountCounter = Counter.builder("vault.invested.amount")
                .description("Capital invested into strategies")
                .register(meterRegistry);
        this.withdrawnAmountCounter = Counter.builder("vault.withdrawn.amount")
                .description("Gross capital withdrawn from strategies")
                .register(meterRegistry);
        this.feesCollectedCounter = Counter.builder("vault.fees.collected")
                .description("Management and performance fees charged on withdrawals")
                .register(meterRegistry);
        this.gridFillsCounter = Counter.builder("vault.grid.fills")
                .description("Grid orders filled")
                .register(meterRegistry);
        this.dcaLegsCounter = Counter.builder("vault.dca.legs")
                .description("DCA legs executed")
                .register(meterRegistry);
        this.arbitrageExecutedCounter = Counter.builder("vault.arbitrage.executed")
                .description("Arbitrage opportunities executed")
                .register(meterRegistry);
        this.arbitrageExpiredCounter = Counter.builder("vault.arbitrage.expired")
                .description("Arbitrage opportunities consumed after expiry")
                .register(meterRegistry);
        this.rebalanceSkippedCounter = Counter.builder("vault.rebalance.skipped")
                .description("Rebalance passes skipped because the strategy was busy")
                .register(meterRegistry);
        this.settlementFailuresCounter = Counter.builder("vault.settlement.failures")
                .description("Transfers that failed after the ledger committed")
                .register(meterRegistry);

        meterRegistry.gauge("vault.strategies.active", ledgerStore, LedgerStore::getActiveStrategyCount);
    }

    @EventListener
    @Order(20)
    public void onInvestmentEvent(InvestmentEvent event) {
        if (event.getEventType() == InvestmentEventType.INVESTED) {
            investedAmountCounter.increment(event.getAmount().doubleValue());
        } else {
            withdrawnAmountCounter.increment(event.getAmount().doubleValue());
            if (event.getFee() != null && event.getFee().signum() > 0) {
                feesCollectedCounter.increment(event.getFee().doubleValue());
            }
        }
    }

    @EventListener
    @Order(20)
    public void onGridOrderEvent(GridOrderEvent event) {
        gridFillsCounter.increment();
    }

    @EventListener
    @Order(20)
    public void onDcaExecutedEvent(DcaExecutedEvent event) {
        dcaLegsCounter.increment();
    }

    @EventListener
    @Order(20)
    public void onArbitrageEvent(ArbitrageEvent event) {
        if (event.getEventType() == ArbitrageEventType.EXECUTED) {
            arbitrageExecutedCounter.increment();
        } else if (event.getEventType() == ArbitrageEventType.EXPIRED) {
            arbitrageExpiredCounter.increment();
        }
    }

    @EventListener
    @Order(20)
    public void onRebalanceEvent(RebalanceEvent event) {
        if (event.getOutcome().getResult().isSkipped()) {
            rebalanceSkippedCounter.increment();
        }
    }

    @EventListener
    @Order(20)
    public void onSettlementFailedEvent(SettlementFailedEvent event) {
        settlementFailuresCounter.increment();
    }
}
