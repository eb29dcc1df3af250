package com.strategyvault.event;

public enum ArbitrageEventType {
    EXECUTED,
    FAILED,
    EXPIRED
}
