package com.strategyvault.risk;

import com.strategyvault.domain.model.Strategy;
import com.strategyvault.domain.model.StrategyMetrics;
import com.strategyvault.domain.model.StrategyParams;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Checks a strategy's recorded metrics against its risk params before an engine runs.
 *
 * <p>Each check is disabled when its threshold is 0:
 * <ul>
 *   <li>{@code maxDrawdownBps}: recorded max drawdown has reached the limit</li>
 *   <li>{@code stopLossBps}: recorded total return has fallen to {@code -stopLossBps}</li>
 *   <li>{@code takeProfitBps}: recorded total return has reached {@code takeProfitBps}</li>
 * </ul>
 * The metrics are whatever was last recorded through {@code recordPerformance}; the guard
 * does not mark positions to market itself.
 */
@Component
public class StrategyRiskGuard {

    public static final String DRAWDOWN_LIMIT_REACHED = "DRAWDOWN_LIMIT_REACHED";
    public static final String STOP_LOSS_HIT = "STOP_LOSS_HIT";
    public static final String TAKE_PROFIT_HIT = "TAKE_PROFIT_HIT";

    /** Returns every breached threshold, empty if the strategy may keep trading. */
    public List<RiskViolation> check(Strategy strategy) {
        StrategyParams params = strategy.getParams();
        StrategyMetrics metrics = strategy.getMetrics();
        List<RiskViolation> violations = new ArrayList<>();

        if (params.getMaxDrawdownBps() > 0 && metrics.getMaxDrawdownBps() >= params.getMaxDrawdownBps()) {
            violations.add(RiskViolation.of(
                    DRAWDOWN_LIMIT_REACHED,
                    "Drawdown " + metrics.getMaxDrawdownBps() + " bps reached limit " + params.getMaxDrawdownBps()));
        }
        if (params.getStopLossBps() > 0 && metrics.getTotalReturnBps() <= -params.getStopLossBps()) {
            violations.add(RiskViolation.of(
                    STOP_LOSS_HIT,
                    "Return " + metrics.getTotalReturnBps() + " bps hit stop loss -" + params.getStopLossBps()));
        }
        if (params.getTakeProfitBps() > 0 && metrics.getTotalReturnBps() >= params.getTakeProfitBps()) {
            violations.add(RiskViolation.of(
                    TAKE_PROFIT_HIT,
                    "Return " + metrics.getTotalReturnBps() + " bps hit take profit " + params.getTakeProfitBps()));
        }
        return violations;
    }

    public static String describe(List<RiskViolation> violations) {
        return violations.stream().map(RiskViolation::toString).collect(Collectors.joining("; "));
    }
}
