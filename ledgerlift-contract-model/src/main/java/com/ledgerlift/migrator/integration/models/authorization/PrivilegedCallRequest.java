package com.ledgerlift.migrator.integration.models.authorization;

import com.ledgerlift.migrator.integration.contract.authorization.IAuthorizationMessage;
import com.ledgerlift.migrator.integration.contract.authorization.IAuthorizationSignature;
import com.ledgerlift.migrator.integration.contract.authorization.IPrivilegedCallRequest;
import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder(toBuilder = true)
public class PrivilegedCallRequest implements IPrivilegedCallRequest {

    private final IAuthorizationMessage message;
    private final IAuthorizationSignature signature;
    private final String operationSignature;
    @Builder.Default
    private final List<Object> arguments = List.of();
}
