package com.ledgerlift.migrator.integration.models.ledger;

import com.ledgerlift.migrator.integration.contract.ledger.IEventFilter;
import lombok.Data;

/**
 * Inclusive block range query for one event kind.
 */
@Data
public class EventFilter implements IEventFilter {

    private final String eventKind;
    private final long startBlock;
    private final long endBlock;

    public EventFilter(String eventKind, long startBlock, long endBlock) {
        if (eventKind == null || eventKind.isBlank()) {
            throw new IllegalArgumentException("Event kind must not be blank");
        }
        if (startBlock < 0) {
            throw new IllegalArgumentException("Start block must be >= 0, got [" + startBlock + "]");
        }
        if (endBlock < startBlock) {
            throw new IllegalArgumentException(
                    "End block [" + endBlock + "] must not precede start block [" + startBlock + "]");
        }
        this.eventKind = eventKind;
        this.startBlock = startBlock;
        this.endBlock = endBlock;
    }

    public static EventFilter of(String eventKind, long startBlock, long endBlock) {
        return new EventFilter(eventKind, startBlock, endBlock);
    }
}
