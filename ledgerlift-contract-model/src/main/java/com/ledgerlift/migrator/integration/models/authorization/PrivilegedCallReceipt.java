package com.ledgerlift.migrator.integration.models.authorization;

import com.ledgerlift.migrator.integration.contract.authorization.IPrivilegedCallReceipt;
import com.ledgerlift.migrator.integration.enumerations.AuthorizationRejectionReason;
import lombok.Builder;
import lombok.Data;

import java.util.Optional;

@Data
@Builder
public class PrivilegedCallReceipt implements IPrivilegedCallReceipt {

    private final boolean accepted;
    private final AuthorizationRejectionReason rejectionReason;
    private final String txReference;
    private final String detail;

    @Override
    public Optional<AuthorizationRejectionReason> getRejectionReason() {
        return Optional.ofNullable(rejectionReason);
    }

    @Override
    public Optional<String> getTxReference() {
        return Optional.ofNullable(txReference);
    }

    @Override
    public Optional<String> getDetail() {
        return Optional.ofNullable(detail);
    }

    public static PrivilegedCallReceipt accepted(String txReference) {
        return PrivilegedCallReceipt.builder()
                .accepted(true)
                .txReference(txReference)
                .build();
    }

    public static PrivilegedCallReceipt rejected(AuthorizationRejectionReason reason, String detail) {
        return PrivilegedCallReceipt.builder()
                .accepted(false)
                .rejectionReason(reason)
                .detail(detail)
                .build();
    }
}
