package com.ledgerlift.migrator.integration.enumerations;

public enum VerificationStatus {
    CONSISTENT,
    INCONSISTENT,
    UNAVAILABLE
}
