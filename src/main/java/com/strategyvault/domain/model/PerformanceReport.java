package com.strategyvault.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Performance figures computed outside the vault (by the analytics collaborator)
 * and recorded onto a strategy's metrics as reported.
 */
@Value
@Builder
public class PerformanceReport {

    long totalReturnBps;
    BigDecimal sharpeRatio;
    long maxDrawdownBps;
    long averageReturnBps;
    long volatilityBps;
}
