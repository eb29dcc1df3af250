package com.strategyvault.domain.model;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import lombok.Builder;
import lombok.Data;

/**
 * Algorithm tuning for a strategy. Each engine reads only the fields it needs;
 * thresholds expressed in basis points are disabled when zero.
 */
@Data
@Builder(toBuilder = true)
public class StrategyParams {

    // ---- Grid ----

    /** Number of buy levels (and sell levels) around the reference price. */
    @Builder.Default
    private int gridLevels = 0;

    /** Absolute price distance between adjacent grid levels. */
    @Builder.Default
    private BigDecimal gridSpacing = BigDecimal.ZERO;

    // ---- DCA ----

    @Builder.Default
    private long dcaIntervalSeconds = 0;

    @Builder.Default
    private BigDecimal dcaAmount = BigDecimal.ZERO;

    @Builder.Default
    private BigDecimal dcaTotalBudget = BigDecimal.ZERO;

    // ---- Risk ----

    @Builder.Default
    private int stopLossBps = 0;

    @Builder.Default
    private int takeProfitBps = 0;

    @Builder.Default
    private int maxDrawdownBps = 0;

    @Builder.Default
    private int maxSlippageBps = 50;

    // ---- Trend / sizing ----

    /** TWAP deviation (bps) at which momentum and mean-reversion trade. */
    @Builder.Default
    private int rebalanceThresholdBps = 100;

    /** Fraction of active capital (bps) committed per trend or arbitrage trade. */
    @Builder.Default
    private int tradeSizeBps = 1000;

    @Builder.Default
    private boolean useOracle = true;

    @Builder.Default
    private boolean compounding = false;

    /** Free-form numeric extension values for strategy types without dedicated fields. */
    @Builder.Default
    private List<BigDecimal> extraParams = new ArrayList<>();

    /** Copy that does not share the extra-params list. */
    public StrategyParams copy() {
        return toBuilder()
                .extraParams(extraParams != null ? new ArrayList<>(extraParams) : new ArrayList<>())
                .build();
    }
}
