package com.ledgerlift.migrator.core.engine.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * JSON shape of a migration configuration file. Durations use ISO-8601 text
 * ({@code PT30S}); absent fields keep the {@link MigrationConfig} defaults.
 */
@Data
@NoArgsConstructor
public class MigrationConfigDocument {

    private static final String ADDRESS_PATTERN = "^(0[xX])?[0-9a-fA-F]{40}$";

    @Positive
    private Integer batchSize;

    @Min(0)
    private Integer sampleSize;

    private List<@NotNull @Positive Long> scanWindows;

    private List<@NotBlank String> trackedEventKinds;

    private String participantField;

    private List<@NotNull @Pattern(regexp = ADDRESS_PATTERN) String> fallbackParticipants = new ArrayList<>();

    private String callTimeout;

    private String authorizationTtl;

    private String auditDirectory;

    @NotNull
    @Valid
    private Domain domain;

    @Data
    @NoArgsConstructor
    public static class Domain {

        @NotBlank
        private String name;

        @NotBlank
        private String version;

        @NotNull
        @Positive
        private Long chainId;

        @NotNull
        @Pattern(regexp = ADDRESS_PATTERN)
        private String verifyingContract;
    }
}
