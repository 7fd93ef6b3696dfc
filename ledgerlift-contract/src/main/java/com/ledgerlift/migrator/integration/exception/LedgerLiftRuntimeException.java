package com.ledgerlift.migrator.integration.exception;

import com.ledgerlift.migrator.integration.contract.ILedgerLiftErrorInfo;
import lombok.Getter;

import java.util.Map;

/**
 * Base unchecked exception carrying an error code and the variables needed to
 * render its message template.
 */
@Getter
public class LedgerLiftRuntimeException extends RuntimeException implements ILedgerLiftException {
    protected final ILedgerLiftErrorInfo errorInfo;
    protected final Map<String, String> templateVariables;
    protected final Throwable rootCause;

    public LedgerLiftRuntimeException(ILedgerLiftErrorInfo errorInfo, Map<String, String> templateVariables, Throwable rootCause) {
        super(render(errorInfo, templateVariables), rootCause);
        this.errorInfo = errorInfo;
        this.templateVariables = templateVariables == null ? Map.of() : Map.copyOf(templateVariables);
        this.rootCause = rootCause;
    }

    public LedgerLiftRuntimeException(ILedgerLiftErrorInfo errorInfo) {
        this(errorInfo, Map.of(), null);
    }

    public LedgerLiftRuntimeException(ILedgerLiftErrorInfo errorInfo, Map<String, String> templateVariables) {
        this(errorInfo, templateVariables, null);
    }

    public LedgerLiftRuntimeException(ILedgerLiftErrorInfo errorInfo, Throwable rootCause) {
        this(errorInfo, Map.of(), rootCause);
    }

    /**
     * Replaces {@code {name}} placeholders in the error template with template variables.
     */
    public static String render(ILedgerLiftErrorInfo errorInfo, Map<String, String> templateVariables) {
        String message = errorInfo.getErrorTemplate();
        if (templateVariables != null) {
            for (Map.Entry<String, String> entry : templateVariables.entrySet()) {
                message = message.replace("{" + entry.getKey() + "}", String.valueOf(entry.getValue()));
            }
        }
        return "[" + errorInfo.getErrorCode() + "] " + message;
    }
}
