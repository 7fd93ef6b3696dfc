package com.ledgerlift.migrator.core.engine.discovery;

import com.ledgerlift.migrator.core.engine.config.MigrationConfig;
import com.ledgerlift.migrator.core.exception.codes.LedgerLiftErrorCodes;
import com.ledgerlift.migrator.integration.contract.ledger.IEventFilter;
import com.ledgerlift.migrator.integration.contract.ledger.ILedgerClient;
import com.ledgerlift.migrator.integration.contract.ledger.ILedgerEvent;
import com.ledgerlift.migrator.integration.contract.migration.IDiscoveryResult;
import com.ledgerlift.migrator.integration.contract.migration.IDiscoveryResult.QueryFailure;
import com.ledgerlift.migrator.integration.contract.migration.IEventScanner;
import com.ledgerlift.migrator.integration.contract.participant.IParticipantSet;
import com.ledgerlift.migrator.integration.enumerations.DiscoveryStatus;
import com.ledgerlift.migrator.integration.exception.LedgerLiftRuntimeException;
import com.ledgerlift.migrator.integration.models.ledger.EventFilter;
import com.ledgerlift.migrator.integration.models.migration.DiscoveryResult;
import com.ledgerlift.migrator.integration.models.participant.ParticipantAddress;
import com.ledgerlift.migrator.integration.models.participant.ParticipantSet;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.exception.ExceptionUtils;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Scans progressively wider block windows for tracked events and collects the
 * participant named in each event.
 *
 * <p>Windows are anchored at the current height and scanned from narrowest to widest;
 * the scan stops at the first window that yields at least one participant. Each event
 * kind is queried separately so that one failing kind does not hide the others.</p>
 */
@Slf4j
public class EventScannerImpl implements IEventScanner {

    private static final String HEIGHT_LOOKUP = "currentHeight";

    private final ILedgerClient ledger;
    private final List<Long> windows;
    private final List<String> eventKinds;
    private final String participantField;
    private final List<ParticipantAddress> fallbackParticipants;
    private final Duration callTimeout;

    public EventScannerImpl(ILedgerClient ledger, MigrationConfig config) {
        config.validate();
        this.ledger = ledger;
        this.windows = List.copyOf(config.getScanWindows());
        this.eventKinds = List.copyOf(config.getTrackedEventKinds());
        this.participantField = config.getParticipantField();
        this.fallbackParticipants = config.getFallbackParticipants().stream()
                .map(ParticipantAddress::from)
                .toList();
        this.callTimeout = config.getCallTimeout();
    }

    @Override
    public Mono<IDiscoveryResult> discover() {
        return Mono.defer(() -> {
            ScanState state = new ScanState();
            return Flux.fromIterable(windows)
                    .concatMap(window -> Mono.defer(() -> {
                        int failuresBefore = state.failures.size();
                        return scanWindow(window, state)
                                .map(found -> new WindowResult(window, found, state.failures.size() - failuresBefore));
                    }))
                    .filter(result -> !result.participants().isEmpty())
                    .next()
                    .map(result -> found(result, state))
                    .switchIfEmpty(Mono.fromSupplier(() -> nothingFound(state)));
        });
    }

    @Override
    public Mono<IParticipantSet> scanRange(long startBlock, long endBlock) {
        return Mono.defer(() -> {
            // validates the range before any query is issued
            EventFilter.of(eventKinds.get(0), startBlock, endBlock);
            return scanBlocks(startBlock, endBlock, new ScanState());
        });
    }

    private Mono<ParticipantSet> scanWindow(long window, ScanState state) {
        return ledger.currentHeight()
                .timeout(callTimeout)
                .flatMap(height -> {
                    long start = Math.max(0L, height - window);
                    log.debug("Scanning window [{}] blocks: [{}, {}]", window, start, height);
                    return scanBlocks(start, height, state);
                })
                .onErrorResume(error -> {
                    String reason = ExceptionUtils.getRootCauseMessage(error);
                    log.warn("Height lookup for window [{}] failed, treating window as empty: {}", window, reason);
                    state.failures.add(new QueryFailure(HEIGHT_LOOKUP, 0L, 0L, reason));
                    return Mono.just(ParticipantSet.empty());
                });
    }

    private Mono<ParticipantSet> scanBlocks(long startBlock, long endBlock, ScanState state) {
        return Flux.fromIterable(eventKinds)
                .concatMap(kind -> queryKind(EventFilter.of(kind, startBlock, endBlock), state))
                .collect(ParticipantSet::empty, (set, event) -> extract(event, set, state));
    }

    private Flux<ILedgerEvent> queryKind(IEventFilter filter, ScanState state) {
        return ledger.query(filter)
                .timeout(callTimeout)
                .collectList()
                .doOnNext(events -> {
                    state.successfulQueries++;
                    log.debug("Query [{}] over [{}, {}] returned [{}] events",
                            filter.getEventKind(), filter.getStartBlock(), filter.getEndBlock(), events.size());
                })
                .flatMapMany(Flux::fromIterable)
                .onErrorResume(error -> {
                    String reason = ExceptionUtils.getRootCauseMessage(error);
                    log.warn("{}; counted as zero results", LedgerLiftRuntimeException.render(
                            LedgerLiftErrorCodes.DISCOVERY_PARTIAL, Map.of(
                                    "eventKind", filter.getEventKind(),
                                    "startBlock", String.valueOf(filter.getStartBlock()),
                                    "endBlock", String.valueOf(filter.getEndBlock()),
                                    "reason", reason)));
                    state.failures.add(new QueryFailure(filter.getEventKind(), filter.getStartBlock(),
                            filter.getEndBlock(), reason));
                    return Flux.empty();
                });
    }

    private void extract(ILedgerEvent event, ParticipantSet set, ScanState state) {
        Optional<String> field = event.getField(participantField);
        if (field.isPresent() && ParticipantAddress.isValid(field.get())) {
            set.add(ParticipantAddress.of(field.get()));
        } else {
            state.skippedEvents++;
            log.debug("Skipping [{}] event in block [{}] without a valid [{}] field",
                    event.getEventKind(), event.getBlockNumber(), participantField);
        }
    }

    private IDiscoveryResult found(WindowResult result, ScanState state) {
        // failures of narrower, empty windows stay in the result as diagnostics only
        DiscoveryStatus status = result.failures() == 0 ? DiscoveryStatus.DISCOVERED : DiscoveryStatus.DISCOVERED_PARTIAL;
        log.info("Discovered [{}] participants in a [{}] block window, status [{}], [{}] failed queries in that window",
                result.participants().size(), result.window(), status, result.failures());
        return DiscoveryResult.builder()
                .participants(result.participants())
                .status(status)
                .windowUsed(result.window())
                .queryFailures(List.copyOf(state.failures))
                .skippedEvents(state.skippedEvents)
                .build();
    }

    private IDiscoveryResult nothingFound(ScanState state) {
        if (!fallbackParticipants.isEmpty()) {
            log.warn("No participants found in any window ([{}] failed queries); "
                            + "using the operator fallback list of [{}] participants. Discovery is degraded.",
                    state.failures.size(), fallbackParticipants.size());
            return DiscoveryResult.builder()
                    .participants(ParticipantSet.of(fallbackParticipants))
                    .status(DiscoveryStatus.FALLBACK)
                    .queryFailures(List.copyOf(state.failures))
                    .skippedEvents(state.skippedEvents)
                    .build();
        }
        DiscoveryStatus status = state.successfulQueries == 0 && !state.failures.isEmpty()
                ? DiscoveryStatus.FAILED
                : DiscoveryStatus.NOTHING_FOUND;
        if (status == DiscoveryStatus.FAILED) {
            log.warn("Discovery failed: every ledger query failed ([{}] failures)", state.failures.size());
        } else {
            log.info("No participants found in windows [{}]", windows);
        }
        return DiscoveryResult.builder()
                .participants(ParticipantSet.empty())
                .status(status)
                .queryFailures(List.copyOf(state.failures))
                .skippedEvents(state.skippedEvents)
                .build();
    }

    private record WindowResult(long window, ParticipantSet participants, int failures) {
    }

    // Mutated only from the sequential scan of one discover() call
    private static final class ScanState {
        private final List<QueryFailure> failures = new ArrayList<>();
        private int successfulQueries;
        private int skippedEvents;
    }
}
