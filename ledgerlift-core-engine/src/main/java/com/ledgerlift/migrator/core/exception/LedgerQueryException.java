package com.ledgerlift.migrator.core.exception;

import com.ledgerlift.migrator.core.exception.codes.LedgerLiftErrorCodes;
import com.ledgerlift.migrator.integration.contract.ledger.IEventFilter;
import com.ledgerlift.migrator.integration.exception.LedgerLiftRuntimeException;

import java.util.Map;

/**
 * Raised by ledger clients for a failed query. The scanner contains it per query.
 */
public class LedgerQueryException extends LedgerLiftRuntimeException {

    public LedgerQueryException(String reason) {
        super(LedgerLiftErrorCodes.LEDGER_QUERY_FAILED, Map.of("reason", reason));
    }

    public LedgerQueryException(IEventFilter filter, String reason, Throwable cause) {
        super(LedgerLiftErrorCodes.LEDGER_QUERY_FAILED, Map.of("reason",
                filter.getEventKind() + " over [" + filter.getStartBlock() + ", " + filter.getEndBlock() + "]: " + reason),
                cause);
    }
}
