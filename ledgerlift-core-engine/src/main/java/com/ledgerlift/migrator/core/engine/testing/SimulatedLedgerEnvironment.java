package com.ledgerlift.migrator.core.engine.testing;

import com.ledgerlift.migrator.core.engine.authorization.Eip712SignatureVerifier;
import com.ledgerlift.migrator.core.engine.authorization.FunctionSelector;
import com.ledgerlift.migrator.core.exception.LedgerQueryException;
import com.ledgerlift.migrator.integration.contract.authorization.IAuthorizationMessage;
import com.ledgerlift.migrator.integration.contract.authorization.IDomainSeparator;
import com.ledgerlift.migrator.integration.contract.authorization.IPrivilegedCallReceipt;
import com.ledgerlift.migrator.integration.contract.authorization.IPrivilegedCallRequest;
import com.ledgerlift.migrator.integration.contract.ledger.IEventFilter;
import com.ledgerlift.migrator.integration.contract.ledger.ILedgerClient;
import com.ledgerlift.migrator.integration.contract.ledger.ILedgerEvent;
import com.ledgerlift.migrator.integration.contract.migration.IBulkMigrationReceipt;
import com.ledgerlift.migrator.integration.contract.participant.IParticipantAddress;
import com.ledgerlift.migrator.integration.contract.participant.IParticipantSnapshot;
import com.ledgerlift.migrator.integration.contract.service.IMigrationServiceClient;
import com.ledgerlift.migrator.integration.enumerations.AuthorizationRejectionReason;
import com.ledgerlift.migrator.integration.models.authorization.AuthorizationMessage;
import com.ledgerlift.migrator.integration.models.authorization.PrivilegedCallReceipt;
import com.ledgerlift.migrator.integration.models.ledger.LedgerEvent;
import com.ledgerlift.migrator.integration.models.migration.BulkMigrationReceipt;
import com.ledgerlift.migrator.integration.models.participant.ParticipantAddress;
import com.ledgerlift.migrator.integration.models.participant.ParticipantSnapshot;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory ledger plus migration service for exercising discovery, migration and
 * privileged calls end to end.
 *
 * <p>The simulated service behaves like the real one where it matters: bulk migration is
 * idempotent per participant and emits a completion event, privileged calls are checked
 * for expiry, signer and nonce in that order, and an accepted call consumes the nonce.
 * Failures can be scripted per event kind, per bulk call and per participant.</p>
 *
 * Usage:
 * <pre>
 * SimulatedLedgerEnvironment env = SimulatedLedgerEnvironment.builder()
 *     .domain(domain)
 *     .authorityAddress(authority.getAuthorityAddress())
 *     .build();
 *
 * env.recordEvent("Staked", participant);
 * env.failBulkMigrationCall(1, SimulatedLedgerEnvironment.FailureMode.REVERT);
 *
 * MigrationOrchestratorImpl.create(env.ledgerClient(), env.serviceClient(), config).run(new RunControl());
 * </pre>
 */
@Slf4j
public class SimulatedLedgerEnvironment {

    public static final String COMPLETION_EVENT = "BulkMigrationCompleted";

    /**
     * How a scripted bulk migration call fails.
     */
    public enum FailureMode {
        /** Transaction is mined but reverts. */
        REVERT,
        /** Submission fails before reaching the ledger. */
        SUBMISSION_ERROR,
        /** No confirmation ever arrives. */
        TIMEOUT
    }

    @Getter private final IDomainSeparator domain;
    @Getter private final IParticipantAddress authorityAddress;

    private final List<LedgerEvent> events = new CopyOnWriteArrayList<>();
    private final AtomicLong height;
    private final AtomicLong txCounter = new AtomicLong();

    private final Map<ParticipantAddress, ParticipantSnapshot> legacyState = new ConcurrentHashMap<>();
    private final Map<ParticipantAddress, ParticipantSnapshot> migratedState = new ConcurrentHashMap<>();
    private final Map<ParticipantAddress, BigInteger> nonces = new ConcurrentHashMap<>();

    private final Set<String> failingEventKinds = ConcurrentHashMap.newKeySet();
    private final Map<String, AtomicInteger> eventKindFailureBudgets = new ConcurrentHashMap<>();
    private final Map<Integer, FailureMode> bulkCallFailures = new ConcurrentHashMap<>();
    private final Set<ParticipantAddress> rejectedParticipants = ConcurrentHashMap.newKeySet();
    private final Set<ParticipantAddress> corruptedParticipants = ConcurrentHashMap.newKeySet();
    private final Set<ParticipantAddress> failingSnapshots = ConcurrentHashMap.newKeySet();
    private final List<List<IParticipantAddress>> bulkSubmissions = new CopyOnWriteArrayList<>();
    private final List<IPrivilegedCallRequest> acceptedCalls = new CopyOnWriteArrayList<>();
    private final AtomicInteger bulkCalls = new AtomicInteger();

    private volatile boolean heightLookupFailing;
    private volatile boolean completionEventsEmitted = true;
    private volatile boolean privilegedTransportFailing;
    private volatile Instant simulatedTime;

    private final ILedgerClient ledgerClient = new SimulatedLedgerClient();
    private final IMigrationServiceClient serviceClient = new SimulatedServiceClient();

    private SimulatedLedgerEnvironment(Builder builder) {
        this.domain = builder.domain;
        this.authorityAddress = builder.authorityAddress;
        this.height = new AtomicLong(builder.startHeight);
        this.simulatedTime = builder.startTime;
    }

    public static Builder builder() {
        return new Builder();
    }

    public ILedgerClient ledgerClient() {
        return ledgerClient;
    }

    public IMigrationServiceClient serviceClient() {
        return serviceClient;
    }

    // ========== Ledger ==========

    public long currentHeight() {
        return height.get();
    }

    /**
     * Advances the chain head by {@code blocks}.
     */
    public long mineBlocks(long blocks) {
        return height.addAndGet(blocks);
    }

    /**
     * Records an event naming {@code participant} in its {@code user} field at the current height.
     */
    public LedgerEvent recordEvent(String eventKind, IParticipantAddress participant) {
        return recordEvent(eventKind, height.get(), Map.of("user", participant.toHex()));
    }

    public LedgerEvent recordEvent(String eventKind, long blockNumber, Map<String, String> fields) {
        if (blockNumber > height.get()) {
            height.set(blockNumber);
        }
        LedgerEvent event = LedgerEvent.builder()
                .eventKind(eventKind)
                .blockNumber(blockNumber)
                .transactionReference(nextTxReference())
                .fields(fields)
                .build();
        events.add(event);
        return event;
    }

    /**
     * Gives a participant state in the prior service version.
     */
    public void registerParticipant(IParticipantSnapshot state) {
        ParticipantAddress address = ParticipantAddress.from(state.getParticipant());
        legacyState.put(address, ParticipantSnapshot.builder()
                .participant(address)
                .stakeCount(state.getStakeCount())
                .premium(state.isPremium())
                .pendingStepsRewards(state.getPendingStepsRewards())
                .pendingMetsRewards(state.getPendingMetsRewards())
                .referralCount(state.getReferralCount())
                .activityFields(state.getActivityFields())
                .build());
    }

    // ========== Scripted failures ==========

    public void failQueriesFor(String eventKind) {
        failingEventKinds.add(eventKind);
    }

    /**
     * Fails only the next {@code times} queries for the event kind; later queries succeed.
     */
    public void failQueriesFor(String eventKind, int times) {
        eventKindFailureBudgets.put(eventKind, new AtomicInteger(times));
    }

    public void failHeightLookups(boolean failing) {
        this.heightLookupFailing = failing;
    }

    /**
     * Fails the bulk migration call with the given zero-based call number.
     */
    public void failBulkMigrationCall(int callNumber, FailureMode mode) {
        bulkCallFailures.put(callNumber, Objects.requireNonNull(mode));
    }

    public void omitCompletionEvents() {
        this.completionEventsEmitted = false;
    }

    /**
     * The service skips this participant in bulk calls, lowering the reported success count.
     */
    public void rejectParticipant(IParticipantAddress participant) {
        rejectedParticipants.add(ParticipantAddress.from(participant));
    }

    /**
     * Migrating this participant loses one stake.
     */
    public void corruptMigrationOf(IParticipantAddress participant) {
        corruptedParticipants.add(ParticipantAddress.from(participant));
    }

    public void failSnapshotsFor(IParticipantAddress participant) {
        failingSnapshots.add(ParticipantAddress.from(participant));
    }

    public void failPrivilegedTransport(boolean failing) {
        this.privilegedTransportFailing = failing;
    }

    // ========== Time Simulation ==========

    public void setSimulatedTime(Instant time) {
        this.simulatedTime = time;
    }

    public void advanceTime(Duration duration) {
        simulatedTime = now().plus(duration);
        log.debug("[LEDGER] Advanced time by {} to {}", duration, simulatedTime);
    }

    public Instant now() {
        return simulatedTime != null ? simulatedTime : Instant.now();
    }

    /**
     * Clock view over the simulated time, for components that read the time themselves.
     */
    public Clock clock() {
        return new SimulatedClock();
    }

    // ========== Inspection ==========

    public boolean isMigrated(IParticipantAddress participant) {
        return migratedState.containsKey(ParticipantAddress.from(participant));
    }

    public int getMigratedCount() {
        return migratedState.size();
    }

    public int getBulkCallCount() {
        return bulkCalls.get();
    }

    public List<List<IParticipantAddress>> getBulkSubmissions() {
        return List.copyOf(bulkSubmissions);
    }

    public List<IPrivilegedCallRequest> getAcceptedCalls() {
        return List.copyOf(acceptedCalls);
    }

    public BigInteger nonceOf(IParticipantAddress caller) {
        return nonces.getOrDefault(ParticipantAddress.from(caller), BigInteger.ZERO);
    }

    public void setNonce(IParticipantAddress caller, BigInteger nonce) {
        nonces.put(ParticipantAddress.from(caller), nonce);
    }

    // ========== Helper Methods ==========

    private String nextTxReference() {
        return String.format("0x%064x", txCounter.incrementAndGet());
    }

    private ParticipantSnapshot stateOf(ParticipantAddress participant) {
        ParticipantSnapshot migrated = migratedState.get(participant);
        if (migrated != null) {
            return migrated;
        }
        return legacyState.getOrDefault(participant, ParticipantSnapshot.builder().participant(participant).build());
    }

    private boolean migrate(ParticipantAddress participant) {
        if (rejectedParticipants.contains(participant)) {
            return false;
        }
        if (migratedState.containsKey(participant)) {
            return true;
        }
        ParticipantSnapshot legacy = legacyState.getOrDefault(participant,
                ParticipantSnapshot.builder().participant(participant).build());
        ParticipantSnapshot migrated = corruptedParticipants.contains(participant)
                ? legacy.toBuilder().stakeCount(Math.max(0, legacy.getStakeCount() - 1)).build()
                : legacy;
        migratedState.put(participant, migrated);
        return true;
    }

    private IPrivilegedCallReceipt verifyPrivileged(IPrivilegedCallRequest request) {
        IAuthorizationMessage message = request.getMessage();
        ParticipantAddress caller = ParticipantAddress.from(message.getCaller());

        if (now().getEpochSecond() > message.getDeadline()) {
            return PrivilegedCallReceipt.rejected(AuthorizationRejectionReason.EXPIRED_AUTHORIZATION,
                    "deadline " + message.getDeadline() + " has passed");
        }

        // the selector is derived from the invoked operation, never taken from the request
        IAuthorizationMessage expected = AuthorizationMessage.builder()
                .caller(caller)
                .operationSelector(FunctionSelector.of(request.getOperationSignature()))
                .nonce(message.getNonce())
                .deadline(message.getDeadline())
                .build();
        if (!Eip712SignatureVerifier.verify(domain, expected, request.getSignature(), authorityAddress)) {
            return PrivilegedCallReceipt.rejected(AuthorizationRejectionReason.SIGNATURE_MISMATCH,
                    "signature does not recover to the authority");
        }

        synchronized (nonces) {
            BigInteger current = nonceOf(caller);
            if (!current.equals(message.getNonce())) {
                return PrivilegedCallReceipt.rejected(AuthorizationRejectionReason.STALE_NONCE,
                        "expected nonce " + current + ", got " + message.getNonce());
            }
            nonces.put(caller, current.add(BigInteger.ONE));
        }
        acceptedCalls.add(request);
        return PrivilegedCallReceipt.accepted(nextTxReference());
    }

    private final class SimulatedLedgerClient implements ILedgerClient {

        @Override
        public Mono<Long> currentHeight() {
            return Mono.defer(() -> heightLookupFailing
                    ? Mono.error(new LedgerQueryException("simulated height lookup failure"))
                    : Mono.just(height.get()));
        }

        @Override
        public Flux<ILedgerEvent> query(IEventFilter filter) {
            return Flux.defer(() -> {
                AtomicInteger budget = eventKindFailureBudgets.get(filter.getEventKind());
                boolean budgetedFailure = budget != null && budget.getAndDecrement() > 0;
                if (budgetedFailure || failingEventKinds.contains(filter.getEventKind())) {
                    return Flux.error(new LedgerQueryException(filter, "simulated query outage", null));
                }
                List<ILedgerEvent> matching = new ArrayList<>();
                events.stream()
                        .filter(event -> event.getEventKind().equals(filter.getEventKind()))
                        .filter(event -> event.getBlockNumber() >= filter.getStartBlock()
                                && event.getBlockNumber() <= filter.getEndBlock())
                        .sorted(Comparator.comparingLong(LedgerEvent::getBlockNumber))
                        .forEach(matching::add);
                return Flux.fromIterable(matching);
            });
        }
    }

    private final class SimulatedServiceClient implements IMigrationServiceClient {

        @Override
        public Mono<IBulkMigrationReceipt> bulkMigrate(List<IParticipantAddress> participants) {
            return Mono.defer(() -> {
                int callNumber = bulkCalls.getAndIncrement();
                bulkSubmissions.add(List.copyOf(participants));
                FailureMode failure = bulkCallFailures.get(callNumber);
                if (failure == FailureMode.SUBMISSION_ERROR) {
                    return Mono.error(new IllegalStateException("simulated submission failure"));
                }
                if (failure == FailureMode.TIMEOUT) {
                    return Mono.never();
                }
                String tx = nextTxReference();
                height.incrementAndGet();
                if (failure == FailureMode.REVERT) {
                    return Mono.just(BulkMigrationReceipt.reverted(tx, "simulated revert"));
                }
                int successes = 0;
                for (IParticipantAddress participant : participants) {
                    if (migrate(ParticipantAddress.from(participant))) {
                        successes++;
                    }
                }
                if (!completionEventsEmitted) {
                    return Mono.just(BulkMigrationReceipt.confirmedWithoutEvent(tx));
                }
                recordEvent(COMPLETION_EVENT, height.get(), Map.of(
                        "successCount", String.valueOf(successes),
                        "totalUsers", String.valueOf(participants.size())));
                return Mono.just(BulkMigrationReceipt.confirmed(tx, successes, participants.size()));
            });
        }

        @Override
        public Mono<IBulkMigrationReceipt> migrateParticipant(IParticipantAddress participant) {
            return Mono.fromSupplier(() -> {
                String tx = nextTxReference();
                height.incrementAndGet();
                if (!migrate(ParticipantAddress.from(participant))) {
                    return BulkMigrationReceipt.reverted(tx, "participant rejected by service");
                }
                return BulkMigrationReceipt.confirmedWithoutEvent(tx);
            });
        }

        @Override
        public Mono<IParticipantSnapshot> getParticipantSnapshot(IParticipantAddress participant) {
            return Mono.defer(() -> {
                ParticipantAddress address = ParticipantAddress.from(participant);
                if (failingSnapshots.contains(address)) {
                    return Mono.error(new IllegalStateException("simulated snapshot failure"));
                }
                return Mono.just(stateOf(address).toBuilder().capturedAt(now()).build());
            });
        }

        @Override
        public Mono<BigInteger> getNonce(IParticipantAddress caller) {
            return Mono.fromSupplier(() -> nonceOf(caller));
        }

        @Override
        public Mono<IPrivilegedCallReceipt> submitPrivileged(IPrivilegedCallRequest request) {
            return Mono.defer(() -> privilegedTransportFailing
                    ? Mono.error(new IllegalStateException("simulated transport failure"))
                    : Mono.just(verifyPrivileged(request)));
        }
    }

    private final class SimulatedClock extends Clock {

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now();
        }
    }

    // ========== Builder ==========

    public static class Builder {
        private IDomainSeparator domain;
        private IParticipantAddress authorityAddress;
        private long startHeight = 0L;
        private Instant startTime;

        public Builder domain(IDomainSeparator domain) {
            this.domain = Objects.requireNonNull(domain);
            return this;
        }

        public Builder authorityAddress(IParticipantAddress authorityAddress) {
            this.authorityAddress = Objects.requireNonNull(authorityAddress);
            return this;
        }

        public Builder startHeight(long startHeight) {
            if (startHeight < 0) {
                throw new IllegalArgumentException("startHeight must not be negative");
            }
            this.startHeight = startHeight;
            return this;
        }

        public Builder startTime(Instant startTime) {
            this.startTime = startTime;
            return this;
        }

        public SimulatedLedgerEnvironment build() {
            if (domain == null || authorityAddress == null) {
                throw new IllegalStateException("domain and authorityAddress are required");
            }
            return new SimulatedLedgerEnvironment(this);
        }
    }
}
