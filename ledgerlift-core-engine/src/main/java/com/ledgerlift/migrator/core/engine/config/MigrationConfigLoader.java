package com.ledgerlift.migrator.core.engine.config;

import com.ledgerlift.migrator.core.engine.misc.LedgerLiftObjectMapper;
import com.ledgerlift.migrator.core.exception.InvalidConfigurationException;
import com.ledgerlift.migrator.integration.contract.participant.IParticipantAddress;
import com.ledgerlift.migrator.integration.models.authorization.DomainSeparator;
import com.ledgerlift.migrator.integration.models.participant.ParticipantAddress;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.ValidatorFactory;
import lombok.extern.slf4j.Slf4j;
import org.hibernate.validator.messageinterpolation.ParameterMessageInterpolator;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * Reads a {@link MigrationConfig} from JSON, checks the document's constraints and
 * then the semantic rules of {@link MigrationConfig#validate()}.
 */
@Slf4j
public final class MigrationConfigLoader {

    private static final ValidatorFactory VALIDATOR_FACTORY = Validation.byDefaultProvider()
            .configure()
            .messageInterpolator(new ParameterMessageInterpolator())
            .buildValidatorFactory();

    private MigrationConfigLoader() {
    }

    public static MigrationConfig load(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return load(in);
        } catch (IOException e) {
            throw new InvalidConfigurationException(List.of("cannot read [" + path + "]: " + e.getMessage()), e);
        }
    }

    public static MigrationConfig load(InputStream in) {
        MigrationConfigDocument document;
        try {
            document = LedgerLiftObjectMapper.getInstance().readValue(in, MigrationConfigDocument.class);
        } catch (RuntimeException e) {
            throw new InvalidConfigurationException(List.of("malformed configuration document: " + e.getMessage()), e);
        }
        MigrationConfig config = toConfig(document);
        log.info("Loaded migration configuration [{}]", config);
        return config;
    }

    /**
     * Converts a validated document into a configuration, applying defaults for absent fields.
     */
    public static MigrationConfig toConfig(MigrationConfigDocument document) {
        if (document == null) {
            throw new InvalidConfigurationException("configuration document is empty");
        }
        Set<ConstraintViolation<MigrationConfigDocument>> violations = VALIDATOR_FACTORY.getValidator().validate(document);
        if (!violations.isEmpty()) {
            List<String> messages = violations.stream()
                    .sorted(Comparator.comparing(violation -> violation.getPropertyPath().toString()))
                    .map(violation -> violation.getPropertyPath() + " " + violation.getMessage())
                    .toList();
            throw new InvalidConfigurationException(messages, null);
        }

        MigrationConfig.MigrationConfigBuilder builder = MigrationConfig.builder()
                .domain(DomainSeparator.builder()
                        .name(document.getDomain().getName())
                        .version(document.getDomain().getVersion())
                        .chainId(document.getDomain().getChainId())
                        .verifyingContract(ParticipantAddress.of(document.getDomain().getVerifyingContract()))
                        .build());

        if (document.getBatchSize() != null) {
            builder.batchSize(document.getBatchSize());
        }
        if (document.getSampleSize() != null) {
            builder.sampleSize(document.getSampleSize());
        }
        if (document.getScanWindows() != null) {
            builder.scanWindows(List.copyOf(document.getScanWindows()));
        }
        if (document.getTrackedEventKinds() != null) {
            builder.trackedEventKinds(List.copyOf(document.getTrackedEventKinds()));
        }
        if (document.getParticipantField() != null) {
            builder.participantField(document.getParticipantField());
        }
        if (document.getFallbackParticipants() != null) {
            List<IParticipantAddress> fallback = document.getFallbackParticipants().stream()
                    .<IParticipantAddress>map(ParticipantAddress::of)
                    .toList();
            builder.fallbackParticipants(fallback);
        }
        if (document.getCallTimeout() != null) {
            builder.callTimeout(parseDuration("callTimeout", document.getCallTimeout()));
        }
        if (document.getAuthorizationTtl() != null) {
            builder.authorizationTtl(parseDuration("authorizationTtl", document.getAuthorizationTtl()));
        }
        if (document.getAuditDirectory() != null && !document.getAuditDirectory().isBlank()) {
            builder.auditDirectory(Path.of(document.getAuditDirectory()));
        }

        MigrationConfig config = builder.build();
        config.validate();
        return config;
    }

    private static Duration parseDuration(String field, String text) {
        try {
            return Duration.parse(text);
        } catch (DateTimeParseException e) {
            throw new InvalidConfigurationException(List.of(field + " is not an ISO-8601 duration [" + text + "]"), e);
        }
    }
}
