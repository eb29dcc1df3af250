package com.strategyvault.core.engine;

import com.strategyvault.config.VaultProperties;
import com.strategyvault.exception.UnauthorizedException;
import com.strategyvault.strategy.engine.RebalanceOutcome;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic driver for {@link StrategyController#rebalanceAll}. Runs as the configured
 * scheduler caller, which must hold the OPERATOR role. Busy strategies are skipped
 * and picked up on the next tick.
 */
@Component
public class RebalanceScheduler {

    private static final Logger log = LoggerFactory.getLogger(RebalanceScheduler.class);

    private final StrategyController strategyController;
    private final VaultProperties vaultProperties;

    public RebalanceScheduler(StrategyController strategyController, VaultProperties vaultProperties) {
        this.strategyController = strategyController;
        this.vaultProperties = vaultProperties;
    }

    @Scheduled(
            fixedDelayString = "${vault.rebalance.interval-ms:60000}",
            initialDelayString = "${vault.rebalance.interval-ms:60000}")
    public void rebalanceActiveStrategies() {
        if (!vaultProperties.getRebalance().isSchedulerEnabled()) {
            return;
        }
        String caller = vaultProperties.getRebalance().getSchedulerCaller();
        List<RebalanceOutcome> outcomes;
        try {
            outcomes = strategyController.rebalanceAll(caller);
        } catch (UnauthorizedException e) {
            log.error("Scheduled rebalance not run: {} (add it to vault.auth.operators)", e.getMessage());
            return;
        }
        long executed = outcomes.stream().filter(RebalanceOutcome::isExecuted).count();
        long skipped = outcomes.stream().filter(o -> o.getResult().isSkipped()).count();
        if (executed > 0 || skipped > 0) {
            log.info("Scheduled rebalance: {} strategies, {} executed, {} skipped", outcomes.size(), executed, skipped);
        }
    }
}
