package com.ledgerlift.migrator.core.engine.config;

import com.ledgerlift.migrator.core.exception.InvalidConfigurationException;
import com.ledgerlift.migrator.integration.contract.authorization.IDomainSeparator;
import com.ledgerlift.migrator.integration.contract.participant.IParticipantAddress;
import com.ledgerlift.migrator.integration.models.authorization.DomainSeparator;
import com.ledgerlift.migrator.integration.models.participant.ParticipantAddress;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Tunable parameters of a migration run and of the privileged-call protocol.
 *
 * Passed explicitly to every component at construction; nothing is read from
 * process-wide state.
 */
@Getter
@Builder(toBuilder = true)
@ToString
public final class MigrationConfig {

    public static final List<String> DEFAULT_EVENT_KINDS = List.of(
            "Staked", "Unstaked", "ActivityRecorded", "RewardsClaimed", "StakingRewardsClaimed");

    public static final List<Long> DEFAULT_SCAN_WINDOWS = List.of(1_000L, 10_000L, 100_000L);

    // Migration
    @Builder.Default
    private final int batchSize = 50;

    @Builder.Default
    private final int sampleSize = 3;

    // Discovery
    @Builder.Default
    private final List<Long> scanWindows = DEFAULT_SCAN_WINDOWS;

    @Builder.Default
    private final List<String> trackedEventKinds = DEFAULT_EVENT_KINDS;

    @Builder.Default
    private final String participantField = "user";

    @Builder.Default
    private final List<IParticipantAddress> fallbackParticipants = List.of();

    // Timing
    @Builder.Default
    private final Duration callTimeout = Duration.ofSeconds(30);

    @Builder.Default
    private final Duration authorizationTtl = Duration.ofHours(24);

    // Authorization
    private final IDomainSeparator domain;

    // Reporting
    private final Path auditDirectory;

    public Optional<Path> getAuditDirectory() {
        return Optional.ofNullable(auditDirectory);
    }

    /**
     * Creates a default configuration bound to the given domain.
     */
    public static MigrationConfig defaultConfig(IDomainSeparator domain) {
        return MigrationConfig.builder()
                .domain(domain)
                .build();
    }

    /**
     * Configuration for a local development ledger (chain id 31337).
     */
    public static MigrationConfig localDevelopment(String serviceName, String serviceVersion, String verifyingContract) {
        return MigrationConfig.builder()
                .domain(DomainSeparator.builder()
                        .name(serviceName)
                        .version(serviceVersion)
                        .chainId(31337L)
                        .verifyingContract(ParticipantAddress.of(verifyingContract))
                        .build())
                .build();
    }

    /**
     * Validates the configuration.
     *
     * @throws InvalidConfigurationException listing every violation found
     */
    public void validate() {
        List<String> violations = new ArrayList<>();
        if (batchSize <= 0) {
            violations.add("batchSize must be positive, got [" + batchSize + "]");
        }
        if (sampleSize < 0) {
            violations.add("sampleSize must not be negative, got [" + sampleSize + "]");
        }
        if (scanWindows == null || scanWindows.isEmpty()) {
            violations.add("scanWindows must not be empty");
        } else {
            long previous = 0;
            for (Long window : scanWindows) {
                if (window == null || window <= 0) {
                    violations.add("scanWindows must be positive, got [" + window + "]");
                    break;
                }
                if (window <= previous) {
                    violations.add("scanWindows must be strictly ascending");
                    break;
                }
                previous = window;
            }
        }
        if (trackedEventKinds == null || trackedEventKinds.isEmpty()
                || trackedEventKinds.stream().anyMatch(kind -> kind == null || kind.isBlank())) {
            violations.add("trackedEventKinds must contain at least one non-blank event kind");
        }
        if (participantField == null || participantField.isBlank()) {
            violations.add("participantField must not be blank");
        }
        if (fallbackParticipants == null) {
            violations.add("fallbackParticipants must not be null");
        }
        if (callTimeout == null || callTimeout.isNegative() || callTimeout.isZero()) {
            violations.add("callTimeout must be positive");
        }
        if (authorizationTtl == null || authorizationTtl.isNegative() || authorizationTtl.isZero()) {
            violations.add("authorizationTtl must be positive");
        }
        if (domain == null) {
            violations.add("domain must be set");
        } else {
            if (domain.getName() == null || domain.getName().isBlank()) {
                violations.add("domain.name must not be blank");
            }
            if (domain.getVersion() == null || domain.getVersion().isBlank()) {
                violations.add("domain.version must not be blank");
            }
            if (domain.getChainId() <= 0) {
                violations.add("domain.chainId must be positive");
            }
            if (domain.getVerifyingContract() == null) {
                violations.add("domain.verifyingContract must be set");
            }
        }
        if (!violations.isEmpty()) {
            throw new InvalidConfigurationException(violations, null);
        }
    }
}
