package com.ledgerlift.migrator.integration.models.authorization;

import com.ledgerlift.migrator.integration.contract.authorization.IAuthorizationMessage;
import com.ledgerlift.migrator.integration.contract.authorization.IAuthorizationOutcome;
import com.ledgerlift.migrator.integration.contract.authorization.IAuthorizationSignature;
import com.ledgerlift.migrator.integration.enumerations.AuthorizationRejectionReason;
import com.ledgerlift.migrator.integration.enumerations.AuthorizationState;
import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Optional;

@Data
@Builder
public class AuthorizationOutcome implements IAuthorizationOutcome {

    private final AuthorizationState state;
    private final AuthorizationRejectionReason reason;
    private final IAuthorizationMessage message;
    private final IAuthorizationSignature signature;
    private final String txReference;
    private final String detail;
    @Builder.Default
    private final List<AuthorizationState> stateHistory = List.of();

    @Override
    public Optional<AuthorizationRejectionReason> getReason() {
        return Optional.ofNullable(reason);
    }

    @Override
    public Optional<IAuthorizationMessage> getMessage() {
        return Optional.ofNullable(message);
    }

    @Override
    public Optional<IAuthorizationSignature> getSignature() {
        return Optional.ofNullable(signature);
    }

    @Override
    public Optional<String> getTxReference() {
        return Optional.ofNullable(txReference);
    }

    @Override
    public Optional<String> getDetail() {
        return Optional.ofNullable(detail);
    }
}
