package com.strategyvault.domain.enums;

/**
 * Capability levels checked by the strategy controller.
 * <ul>
 *   <li>STRATEGY_MANAGER -- create, activate, pause, resume and configure strategies</li>
 *   <li>OPERATOR -- trigger rebalances, record performance, register and execute arbitrage</li>
 *   <li>ADMIN -- force emergency stop</li>
 * </ul>
 */
public enum VaultRole {
    STRATEGY_MANAGER,
    OPERATOR,
    ADMIN
}
