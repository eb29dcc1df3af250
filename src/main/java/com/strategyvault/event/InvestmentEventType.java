package com.strategyvault.event;

public enum InvestmentEventType {
    INVESTED,
    WITHDRAWN
}
