package com.strategyvault.ledger;

import com.strategyvault.domain.enums.StrategyStatus;
import com.strategyvault.domain.model.Strategy;
import lombok.Builder;
import lombok.Value;

/** Outcome of an emergency stop, with the status the strategy held when the lock was taken. */
@Value
@Builder
public class EmergencyStopResult {

    Strategy strategy;
    StrategyStatus previousStatus;

    public boolean isAlreadyStopped() {
        return previousStatus == StrategyStatus.EMERGENCY_STOP;
    }
}
