package com.strategyvault.strategy.engine;

public enum ArbitrageStatus {
    EXECUTED,
    EXPIRED,
    FAILED
}
