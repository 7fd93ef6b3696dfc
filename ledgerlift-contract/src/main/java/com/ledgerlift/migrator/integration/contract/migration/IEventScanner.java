package com.ledgerlift.migrator.integration.contract.migration;

import com.ledgerlift.migrator.integration.contract.participant.IParticipantSet;
import reactor.core.publisher.Mono;

/**
 * Discovers participants by scanning historical ledger events, without any external index.
 *
 * <p>Discovery is best effort. A failing query is recorded and treated as zero results;
 * it never aborts the scan. Callers must not read an empty result as proof that no
 * participant exists: check {@link IDiscoveryResult#getStatus()}.</p>
 *
 * <p>Usage:</p>
 * <pre>{@code
 * IEventScanner scanner = new EventScannerImpl(ledgerClient, config);
 * IDiscoveryResult result = scanner.discover().block();
 * if (result.getStatus() == DiscoveryStatus.FAILED) {
 *     // the ledger could not be read at all
 * }
 * }</pre>
 */
public interface IEventScanner {

    /**
     * Scans progressively wider windows anchored at the current height and stops at the
     * first window that yields participants. Falls back to the operator list when every
     * window is empty and a fallback is configured.
     *
     * @return discovery result, never an error signal
     */
    Mono<IDiscoveryResult> discover();

    /**
     * Scans one fixed inclusive block range for every tracked event kind.
     * Scanning the same range twice yields an equal set.
     *
     * @param startBlock first block, at least 0
     * @param endBlock last block, at least {@code startBlock}
     * @return participants found in the range
     */
    Mono<IParticipantSet> scanRange(long startBlock, long endBlock);
}
