package com.strategyvault.settlement;

import com.strategyvault.domain.model.TxRef;
import java.math.BigDecimal;

/**
 * Custody boundary. The vault only keeps the internal share ledger; moving funds
 * is delegated here, always after the corresponding ledger mutation has committed.
 *
 * <p>Two implementations are expected: a custody/chain adapter in production and
 * {@code SimulatedSettlementGateway} for local runs and tests.
 */
public interface SettlementGateway {

    /**
     * Moves {@code amount} of {@code asset} between two accounts.
     *
     * @return reference of the completed transfer
     * @throws com.strategyvault.exception.SettlementException if the transfer is rejected or the custodian is unavailable
     */
    TxRef transfer(String asset, String from, String to, BigDecimal amount);
}
