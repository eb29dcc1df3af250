package com.strategyvault.fee;

import com.strategyvault.domain.model.Strategy;
import com.strategyvault.domain.vo.FeeBreakdown;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import org.springframework.stereotype.Service;

/**
 * Computes the fees retained on a withdrawal.
 *
 * <ul>
 *   <li><b>Management fee:</b> annual rate in bps, prorated by the seconds elapsed since
 *       the position's accrual start over a 365-day year</li>
 *   <li><b>Performance fee:</b> rate in bps applied to the profit on the released capital;
 *       zero when the withdrawal is at or below cost</li>
 * </ul>
 *
 * <p>The combined fee never exceeds the gross withdrawal amount.
 */
@Service
public class FeeCalculator {

    static final BigDecimal BPS_DIVISOR = new BigDecimal("10000");
    static final BigDecimal SECONDS_PER_YEAR = new BigDecimal("31536000");

    private static final int SCALE = 18;

    /**
     * Management fee on {@code amount} for the accrual period.
     *
     * @param amount                  the gross amount being withdrawn
     * @param managementFeeBpsPerYear annual management rate
     * @param elapsed                 accrual period; negative periods accrue nothing
     */
    public BigDecimal managementFee(BigDecimal amount, int managementFeeBpsPerYear, Duration elapsed) {
        if (amount.signum() <= 0 || managementFeeBpsPerYear <= 0 || elapsed.isNegative() || elapsed.isZero()) {
            return BigDecimal.ZERO;
        }
        BigDecimal fee = amount.multiply(BigDecimal.valueOf(managementFeeBpsPerYear))
                .multiply(BigDecimal.valueOf(elapsed.getSeconds()))
                .divide(BPS_DIVISOR.multiply(SECONDS_PER_YEAR), SCALE, RoundingMode.DOWN);
        return fee.min(amount);
    }

    /**
     * Performance fee on a realised profit. Losses and break-even carry no fee.
     */
    public BigDecimal performanceFee(BigDecimal profit, int performanceFeeBps) {
        if (profit.signum() <= 0 || performanceFeeBps <= 0) {
            return BigDecimal.ZERO;
        }
        return profit.multiply(BigDecimal.valueOf(performanceFeeBps)).divide(BPS_DIVISOR, SCALE, RoundingMode.DOWN);
    }

    /**
     * Full fee breakdown for one withdrawal.
     *
     * @param strategy        the strategy being withdrawn from (fee rates)
     * @param grossAmount     shares × totalCapital / totalShares
     * @param capitalReleased the investor's contributed capital released by this withdrawal
     * @param accrualStart    start of the position's management-fee period
     * @param now             withdrawal time
     */
    public FeeBreakdown withdrawalFees(
            Strategy strategy, BigDecimal grossAmount, BigDecimal capitalReleased, Instant accrualStart, Instant now) {
        Duration elapsed = accrualStart != null ? Duration.between(accrualStart, now) : Duration.ZERO;
        BigDecimal management = managementFee(grossAmount, strategy.getManagementFeeBpsPerYear(), elapsed);
        BigDecimal performance =
                performanceFee(grossAmount.subtract(capitalReleased), strategy.getPerformanceFeeBps());

        BigDecimal room = grossAmount.subtract(management).max(BigDecimal.ZERO);
        return FeeBreakdown.builder()
                .managementFee(management)
                .performanceFee(performance.min(room))
                .build();
    }
}
