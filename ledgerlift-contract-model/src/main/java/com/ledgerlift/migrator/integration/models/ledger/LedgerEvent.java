package com.ledgerlift.migrator.integration.models.ledger;

import com.ledgerlift.migrator.integration.contract.ledger.ILedgerEvent;
import lombok.Builder;
import lombok.Data;
import lombok.Singular;

import java.util.Map;

@Data
@Builder
public class LedgerEvent implements ILedgerEvent {

    private final String eventKind;
    private final long blockNumber;
    private final String transactionReference;
    @Singular
    private final Map<String, String> fields;
}
