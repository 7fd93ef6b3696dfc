package com.ledgerlift.migrator.integration.contract;

public interface ILedgerLiftErrorInfo {
    String getErrorCode();
    String getErrorTemplate();
    String getResolutionTemplate();
}
