package com.ledgerlift.migrator.integration.enumerations;

/**
 * Lifecycle of a single privileged-call attempt.
 * CREATED -> SIGNED -> SUBMITTED -> ACCEPTED | REJECTED.
 */
public enum AuthorizationState {
    CREATED,
    SIGNED,
    SUBMITTED,
    ACCEPTED,
    REJECTED;

    public boolean isTerminal() {
        return this == ACCEPTED || this == REJECTED;
    }
}
