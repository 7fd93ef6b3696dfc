package com.ledgerlift.migrator.integration.enumerations;

/**
 * How participant discovery ended. Reports use it to tell an empty ledger apart
 * from a ledger that could not be read.
 */
public enum DiscoveryStatus {

    /**
     * Participants found and every query succeeded.
     */
    DISCOVERED,

    /**
     * Participants found, but at least one event query failed.
     */
    DISCOVERED_PARTIAL,

    /**
     * All queries succeeded and no window contained a tracked event.
     */
    NOTHING_FOUND,

    /**
     * Nothing found on the ledger; the operator fallback list was used instead.
     */
    FALLBACK,

    /**
     * Nothing found and every query (or the height lookup) failed.
     */
    FAILED
}
