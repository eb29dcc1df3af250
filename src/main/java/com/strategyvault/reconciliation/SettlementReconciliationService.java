package com.strategyvault.reconciliation;

import com.strategyvault.event.SettlementFailedEvent;
import com.strategyvault.exception.ResourceNotFoundException;
import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Reconciliation hook for settlement failures. Every {@link SettlementFailedEvent} opens
 * an item; the ledger and custody disagree by that item's amount until an operator
 * resolves it.
 */
@Service
public class SettlementReconciliationService {

    private static final Logger log = LoggerFactory.getLogger(SettlementReconciliationService.class);

    private final Map<String, ReconciliationItem> items = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final Clock clock;

    public SettlementReconciliationService(Clock clock) {
        this.clock = clock;
    }

    @EventListener
    @Order(15)
    public void onSettlementFailed(SettlementFailedEvent event) {
        ReconciliationItem item = ReconciliationItem.builder()
                .id(String.format("RECON-%06d", sequence.incrementAndGet()))
                .strategyId(event.getStrategyId())
                .operation(event.getOperation())
                .asset(event.getAsset())
                .from(event.getFrom())
                .to(event.getTo())
                .amount(event.getAmount())
                .reason(event.getReason())
                .raisedAt(clock.instant())
                .build();
        items.put(item.getId(), item);
        log.error(
                "Reconciliation item {} opened: {} on {} for {} {} ({} -> {})",
                item.getId(),
                item.getOperation(),
                item.getStrategyId(),
                item.getAmount().toPlainString(),
                item.getAsset(),
                item.getFrom(),
                item.getTo());
    }

    /** Open items, oldest first. */
    public List<ReconciliationItem> getOpenItems() {
        return items.values().stream()
                .filter(item -> !item.isResolved())
                .sorted(Comparator.comparing(ReconciliationItem::getId))
                .toList();
    }

    public List<ReconciliationItem> getAllItems() {
        return items.values().stream()
                .sorted(Comparator.comparing(ReconciliationItem::getId))
                .toList();
    }

    /**
     * Marks an item resolved. Resolving twice keeps the first resolution.
     *
     * @throws ResourceNotFoundException if no item has this id
     */
    public ReconciliationItem resolve(String itemId, String note) {
        ReconciliationItem resolved = items.computeIfPresent(itemId, (id, item) -> item.isResolved()
                ? item
                : item.toBuilder()
                        .resolved(true)
                        .resolvedAt(clock.instant())
                        .resolutionNote(note)
                        .build());
        if (resolved == null) {
            throw new ResourceNotFoundException("ReconciliationItem", itemId);
        }
        log.info("Reconciliation item {} resolved: {}", itemId, resolved.getResolutionNote());
        return resolved;
    }
}
