package com.strategyvault.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Vault configuration loaded from application.properties.
 *
 * <p>Properties prefix: {@code vault.*}. Defaults:
 * <ul>
 *   <li>lockTimeoutMs: 250 (bounded wait for a strategy's exclusive section)</li>
 *   <li>arbitrage.validityWindowSeconds: 300</li>
 *   <li>rebalance.intervalMs: 60000, schedulerEnabled: true</li>
 * </ul>
 */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "vault")
public class VaultProperties {

    @Min(1)
    private long lockTimeoutMs = 250;

    @Valid
    private Arbitrage arbitrage = new Arbitrage();
    private Rebalance rebalance = new Rebalance();
    private Settlement settlement = new Settlement();
    private Auth auth = new Auth();
    private Simulation simulation = new Simulation();

    @Data
    public static class Arbitrage {

        @Min(1)
        private long validityWindowSeconds = 300;
    }

    @Data
    public static class Rebalance {

        private long intervalMs = 60_000;
        private boolean schedulerEnabled = true;

        /** Caller id the scheduler uses; must hold OPERATOR. */
        private String schedulerCaller = "scheduler";
    }

    @Data
    public static class Settlement {

        private String vaultAccount = "vault";
        private String feeRecipient = "fee-recipient";
    }

    @Data
    public static class Auth {

        private List<String> managers = new ArrayList<>();
        private List<String> operators = new ArrayList<>();
        private List<String> admins = new ArrayList<>();
    }

    @Data
    public static class Simulation {

        /** Seed spot prices for the simulated price feed, keyed by asset symbol. */
        private Map<String, BigDecimal> prices = new LinkedHashMap<>();
    }
}
