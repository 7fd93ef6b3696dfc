package com.ledgerlift.migrator.core.exception;

import com.ledgerlift.migrator.core.exception.codes.LedgerLiftErrorCodes;
import com.ledgerlift.migrator.integration.exception.LedgerLiftRuntimeException;
import lombok.Getter;

import java.util.List;
import java.util.Map;

/**
 * Fatal to a run. Raised before any external call is made.
 */
@Getter
public class InvalidConfigurationException extends LedgerLiftRuntimeException {

    private final List<String> violations;

    public InvalidConfigurationException(String reason) {
        this(List.of(reason), null);
    }

    public InvalidConfigurationException(List<String> violations, Throwable cause) {
        super(LedgerLiftErrorCodes.INVALID_CONFIGURATION, Map.of("reason", String.join("; ", violations)), cause);
        this.violations = List.copyOf(violations);
    }
}
