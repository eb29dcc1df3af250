package com.strategyvault.config;

import com.strategyvault.auth.AuthorizationService;
import com.strategyvault.auth.ConfiguredAuthorizationService;
import com.strategyvault.execution.TradeExecutionPort;
import com.strategyvault.market.PriceFeed;
import com.strategyvault.settlement.SettlementGateway;
import com.strategyvault.simulator.LoggingTradeExecutor;
import com.strategyvault.simulator.SimulatedPriceFeed;
import com.strategyvault.simulator.SimulatedSettlementGateway;
import java.time.Clock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the vault's time source and its external collaborators.
 *
 * <p>Each collaborator falls back to a simulated implementation when no other
 * bean of the port type is present, so the service starts self-contained and a
 * deployment replaces only the ports it has real adapters for.
 */
@Configuration
public class VaultConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean(PriceFeed.class)
    public SimulatedPriceFeed simulatedPriceFeed(VaultProperties vaultProperties) {
        return new SimulatedPriceFeed(vaultProperties.getSimulation().getPrices());
    }

    @Bean
    @ConditionalOnMissingBean(SettlementGateway.class)
    public SimulatedSettlementGateway simulatedSettlementGateway() {
        return new SimulatedSettlementGateway();
    }

    @Bean
    @ConditionalOnMissingBean(TradeExecutionPort.class)
    public LoggingTradeExecutor loggingTradeExecutor() {
        return new LoggingTradeExecutor();
    }

    @Bean
    @ConditionalOnMissingBean(AuthorizationService.class)
    public ConfiguredAuthorizationService configuredAuthorizationService(VaultProperties vaultProperties) {
        return new ConfiguredAuthorizationService(vaultProperties.getAuth());
    }
}
