package com.ledgerlift.migrator.integration.contract.migration;

import com.ledgerlift.migrator.integration.contract.participant.IParticipantSet;
import com.ledgerlift.migrator.integration.enumerations.DiscoveryStatus;

import java.util.List;
import java.util.Optional;

/**
 * Best-effort result of scanning the ledger for participants.
 *
 * <p>Completeness is never guaranteed: queries may have failed, and only the
 * cheapest window that produced participants was scanned.</p>
 */
public interface IDiscoveryResult {

    IParticipantSet getParticipants();

    DiscoveryStatus getStatus();

    /**
     * Size in blocks of the window that produced the participants, empty when no
     * window produced any.
     *
     * @return window size
     */
    Optional<Long> getWindowUsed();

    List<QueryFailure> getQueryFailures();

    /**
     * Number of events dropped because the participant field was missing or malformed.
     *
     * @return skipped event count
     */
    int getSkippedEvents();

    default boolean hasQueryFailures() {
        return !getQueryFailures().isEmpty();
    }

    /**
     * A single event-kind query that failed within one window.
     */
    record QueryFailure(String eventKind, long startBlock, long endBlock, String reason) {
    }
}
