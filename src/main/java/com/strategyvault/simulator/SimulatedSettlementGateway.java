package com.strategyvault.simulator;

import com.strategyvault.domain.model.TxRef;
import com.strategyvault.exception.SettlementException;
import com.strategyvault.settlement.SettlementGateway;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Custody stand-in that accepts every transfer and keeps a journal of them.
 * {@link #setFailing(boolean)} makes every transfer fail, for exercising the
 * post-commit settlement failure path.
 */
public class SimulatedSettlementGateway implements SettlementGateway {

    private static final Logger log = LoggerFactory.getLogger(SimulatedSettlementGateway.class);

    private final AtomicLong txSequence = new AtomicLong();
    private final List<TxRef> transfers = Collections.synchronizedList(new ArrayList<>());
    private volatile boolean failing;

    @Override
    public TxRef transfer(String asset, String from, String to, BigDecimal amount) {
        if (failing) {
            throw new SettlementException(
                    "Simulated custody rejected transfer of " + amount.toPlainString() + " " + asset + " to " + to);
        }
        TxRef txRef = TxRef.builder()
                .reference("SIM-TX-" + txSequence.incrementAndGet())
                .asset(asset)
                .from(from)
                .to(to)
                .amount(amount)
                .build();
        transfers.add(txRef);
        log.debug("Simulated transfer {}: {} {} {} -> {}", txRef.getReference(), amount.toPlainString(), asset, from, to);
        return txRef;
    }

    public List<TxRef> getTransfers() {
        synchronized (transfers) {
            return List.copyOf(transfers);
        }
    }

    public void setFailing(boolean failing) {
        this.failing = failing;
    }
}
