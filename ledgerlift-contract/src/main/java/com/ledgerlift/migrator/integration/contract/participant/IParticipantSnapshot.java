package com.ledgerlift.migrator.integration.contract.participant;

import java.math.BigInteger;
import java.time.Instant;
import java.util.Map;

/**
 * Observable state of one participant as reported by the service at a point in time.
 */
public interface IParticipantSnapshot {

    IParticipantAddress getParticipant();

    int getStakeCount();

    boolean isPremium();

    BigInteger getPendingStepsRewards();

    BigInteger getPendingMetsRewards();

    long getReferralCount();

    /**
     * Additional activity fields reported by the service (daily steps, last update, ...).
     * Informational; not compared during verification.
     *
     * @return activity fields keyed by name
     */
    Map<String, String> getActivityFields();

    Instant getCapturedAt();
}
