package com.ledgerlift.migrator.integration.exception;

import com.ledgerlift.migrator.integration.contract.ILedgerLiftErrorInfo;

import java.util.Map;

public interface ILedgerLiftException {
    ILedgerLiftErrorInfo getErrorInfo();
    Map<String, String> getTemplateVariables();
    Throwable getRootCause();
}
