package com.ledgerlift.migrator.core.exception.codes;

import com.ledgerlift.migrator.integration.contract.ILedgerLiftErrorInfo;
import lombok.AllArgsConstructor;
import lombok.Getter;

@AllArgsConstructor
@Getter
public enum LedgerLiftErrorCodes implements ILedgerLiftErrorInfo {

    DISCOVERY_PARTIAL(
            "LEDGERLIFT_ERR_0001",
            "Discovery query for event kind {eventKind} over blocks [{startBlock}, {endBlock}] failed: {reason}",
            "Re-run discovery or widen the scan windows; the participant set may be incomplete"
    ),

    BATCH_SUBMISSION_FAILED(
            "LEDGERLIFT_ERR_0002",
            "Batch {batchIndex} with {batchSize} participants failed: {reason}",
            "Re-run the migration; already migrated participants are skipped by the service"
    ),

    VERIFICATION_INCONSISTENT(
            "LEDGERLIFT_ERR_0003",
            "Participant {participant} differs after migration: {differences}",
            "Inspect the participant and use the single-participant repair path if needed"
    ),

    EXPIRED_AUTHORIZATION(
            "LEDGERLIFT_ERR_0004",
            "Authorization for caller {caller} expired at {deadline}",
            "Request a new authorization; signatures are never reused"
    ),

    STALE_NONCE(
            "LEDGERLIFT_ERR_0005",
            "Authorization nonce {nonce} for caller {caller} was already consumed",
            "Fetch the current nonce and sign a new authorization"
    ),

    SIGNATURE_MISMATCH(
            "LEDGERLIFT_ERR_0006",
            "Authorization signature for caller {caller} does not match the expected authority",
            "Check the signing key, domain name, version, chain id and verifying contract"
    ),

    INVALID_CONFIGURATION(
            "LEDGERLIFT_ERR_0007",
            "Invalid configuration: {reason}",
            "Fix the configuration before starting a run"
    ),

    LEDGER_QUERY_FAILED(
            "LEDGERLIFT_ERR_0008",
            "Ledger query failed: {reason}",
            "Check ledger connectivity and the call timeout"
    ),

    PRIVILEGED_CALL_FAILED(
            "LEDGERLIFT_ERR_0009",
            "Privileged call {operation} for caller {caller} could not be submitted: {reason}",
            "Retry the call; a fresh nonce and signature are produced for each attempt"
    )

    ;

    private final String errorCode;
    private final String errorTemplate;
    private final String resolutionTemplate;
}
