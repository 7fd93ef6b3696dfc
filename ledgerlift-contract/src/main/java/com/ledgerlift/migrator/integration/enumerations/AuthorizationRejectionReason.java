package com.ledgerlift.migrator.integration.enumerations;

public enum AuthorizationRejectionReason {
    /** Deadline passed before verification. */
    EXPIRED_AUTHORIZATION,
    /** Nonce already consumed or out of sequence. */
    STALE_NONCE,
    /** Signature does not verify against domain, message and authority key. */
    SIGNATURE_MISMATCH,
    /** The call never reached verification (signing or transport failure). */
    SUBMISSION_FAILED
}
