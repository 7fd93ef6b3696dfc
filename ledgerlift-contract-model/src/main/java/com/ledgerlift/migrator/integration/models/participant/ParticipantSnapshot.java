package com.ledgerlift.migrator.integration.models.participant;

import com.ledgerlift.migrator.integration.contract.participant.IParticipantAddress;
import com.ledgerlift.migrator.integration.contract.participant.IParticipantSnapshot;
import lombok.Builder;
import lombok.Data;

import java.math.BigInteger;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder(toBuilder = true)
public class ParticipantSnapshot implements IParticipantSnapshot {

    private final IParticipantAddress participant;
    private final int stakeCount;
    private final boolean premium;
    @Builder.Default
    private final BigInteger pendingStepsRewards = BigInteger.ZERO;
    @Builder.Default
    private final BigInteger pendingMetsRewards = BigInteger.ZERO;
    private final long referralCount;
    @Builder.Default
    private final Map<String, String> activityFields = new LinkedHashMap<>();
    @Builder.Default
    private final Instant capturedAt = Instant.now();

    @Override
    public Map<String, String> getActivityFields() {
        return Collections.unmodifiableMap(activityFields);
    }
}
