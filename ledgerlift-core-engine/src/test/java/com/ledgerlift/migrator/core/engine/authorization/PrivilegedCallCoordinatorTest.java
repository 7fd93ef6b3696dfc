package com.ledgerlift.migrator.core.engine.authorization;

import com.ledgerlift.migrator.core.engine.config.MigrationConfig;
import com.ledgerlift.migrator.core.engine.testing.SimulatedLedgerEnvironment;
import com.ledgerlift.migrator.core.exception.AuthorizationException;
import com.ledgerlift.migrator.integration.contract.authorization.IAuthorizationMessage;
import com.ledgerlift.migrator.integration.contract.authorization.IAuthorizationOutcome;
import com.ledgerlift.migrator.integration.contract.authorization.IPrivilegedCallRequest;
import com.ledgerlift.migrator.integration.enumerations.AuthorizationRejectionReason;
import com.ledgerlift.migrator.integration.enumerations.AuthorizationState;
import com.ledgerlift.migrator.integration.models.authorization.AuthorizationMessage;
import com.ledgerlift.migrator.integration.models.authorization.DomainSeparator;
import com.ledgerlift.migrator.integration.models.authorization.PrivilegedCallRequest;
import com.ledgerlift.migrator.integration.models.participant.ParticipantAddress;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests the co-signed privileged call protocol against the simulated service.
 */
class PrivilegedCallCoordinatorTest {

    private static final String DEPOSIT = "deposit(uint256,uint256,uint256,bytes)";
    private static final String SET_PREMIUM = "setPremiumStatus(address,bool)";
    private static final Instant START = Instant.parse("2026-01-01T00:00:00Z");

    private final ParticipantAddress caller = ParticipantAddress.of("0x00000000000000000000000000000000000000c1");
    private final DomainSeparator domain = DomainSeparator.builder()
            .name("StepStaking")
            .version("2")
            .chainId(31337L)
            .verifyingContract(ParticipantAddress.of("0xfB6916095ca1df60bB79Ce92cE3Ea74c37c5d359"))
            .build();

    private SimulatedLedgerEnvironment env;
    private Eip712AuthorizationSigner signer;
    private PrivilegedCallCoordinator coordinator;

    @BeforeEach
    void setUp() {
        LocalKeySigningAuthority authority = LocalKeySigningAuthority.fromHex(
                "4c0883a69102937d6231471b5dbb6204fe5129617082792ae468d01a3f362318");
        env = SimulatedLedgerEnvironment.builder()
                .domain(domain)
                .authorityAddress(authority.getAuthorityAddress())
                .startTime(START)
                .build();
        signer = new Eip712AuthorizationSigner(domain, authority);
        MigrationConfig config = MigrationConfig.builder()
                .domain(domain)
                .authorizationTtl(Duration.ofHours(1))
                .build();
        coordinator = new PrivilegedCallCoordinator(signer, env.serviceClient(), config, env.clock());
    }

    private IPrivilegedCallRequest acceptedRequest() {
        return env.getAcceptedCalls().get(0);
    }

    @Nested
    @DisplayName("Accepted Calls")
    class AcceptedTests {

        @Test
        @DisplayName("should accept a fresh co-signed call and consume the nonce")
        void shouldAcceptAndConsumeNonce() {
            // Given
            env.setNonce(caller, BigInteger.valueOf(5));

            // When / Then
            StepVerifier.create(coordinator.execute(caller, DEPOSIT, List.of(1, 2, 3)))
                    .assertNext(outcome -> {
                        assertTrue(outcome.isAccepted());
                        assertEquals(List.of(AuthorizationState.CREATED, AuthorizationState.SIGNED,
                                AuthorizationState.SUBMITTED, AuthorizationState.ACCEPTED), outcome.getStateHistory());
                        assertTrue(outcome.getTxReference().isPresent());
                        assertEquals(BigInteger.valueOf(5), outcome.getMessage().orElseThrow().getNonce());
                    })
                    .verifyComplete();
            assertEquals(BigInteger.valueOf(6), env.nonceOf(caller));
        }

        @Test
        @DisplayName("should sign a deadline one TTL after the current time")
        void shouldSetDeadlineFromTtl() {
            IAuthorizationOutcome outcome = coordinator.execute(caller, DEPOSIT, List.of()).block();

            assertNotNull(outcome);
            assertEquals(START.plus(Duration.ofHours(1)).getEpochSecond(),
                    outcome.getMessage().orElseThrow().getDeadline());
        }

        @Test
        @DisplayName("should read a new nonce for every attempt")
        void shouldUseFreshNonceEachAttempt() {
            coordinator.execute(caller, DEPOSIT, List.of()).block();
            IAuthorizationOutcome second = coordinator.execute(caller, DEPOSIT, List.of()).block();

            assertNotNull(second);
            assertTrue(second.isAccepted());
            assertEquals(BigInteger.ONE, second.getMessage().orElseThrow().getNonce());
            assertEquals(BigInteger.TWO, env.nonceOf(caller));
        }
    }

    @Nested
    @DisplayName("Resubscription")
    class ResubscriptionTests {

        @Test
        @DisplayName("should start every subscription of execute as a fresh attempt")
        void shouldStartFreshAttemptPerSubscription() {
            // Given
            Mono<IAuthorizationOutcome> call = coordinator.execute(caller, DEPOSIT, List.of());

            // When
            IAuthorizationOutcome first = call.block();
            IAuthorizationOutcome second = call.block();

            // Then
            List<AuthorizationState> lifecycle = List.of(AuthorizationState.CREATED, AuthorizationState.SIGNED,
                    AuthorizationState.SUBMITTED, AuthorizationState.ACCEPTED);
            assertNotNull(first);
            assertNotNull(second);
            assertEquals(lifecycle, first.getStateHistory());
            assertEquals(lifecycle, second.getStateHistory());
            assertEquals(BigInteger.ZERO, first.getMessage().orElseThrow().getNonce());
            assertEquals(BigInteger.ONE, second.getMessage().orElseThrow().getNonce());
        }

        @Test
        @DisplayName("should keep the history of each submit subscription separate")
        void shouldSeparateSubmitHistories() {
            // Given
            coordinator.execute(caller, DEPOSIT, List.of()).block();
            Mono<IAuthorizationOutcome> replay = coordinator.submit(acceptedRequest());

            // When
            IAuthorizationOutcome first = replay.block();
            IAuthorizationOutcome second = replay.block();

            // Then
            List<AuthorizationState> lifecycle = List.of(AuthorizationState.SIGNED,
                    AuthorizationState.SUBMITTED, AuthorizationState.REJECTED);
            assertNotNull(first);
            assertNotNull(second);
            assertEquals(lifecycle, first.getStateHistory());
            assertEquals(lifecycle, second.getStateHistory());
        }
    }

    @Nested
    @DisplayName("Rejected Calls")
    class RejectedTests {

        @Test
        @DisplayName("should reject a replayed request with STALE_NONCE")
        void shouldRejectReplay() {
            // Given
            env.setNonce(caller, BigInteger.valueOf(5));
            coordinator.execute(caller, DEPOSIT, List.of()).block();

            // When / Then
            StepVerifier.create(coordinator.submit(acceptedRequest()))
                    .assertNext(outcome -> {
                        assertEquals(AuthorizationState.REJECTED, outcome.getState());
                        assertEquals(AuthorizationRejectionReason.STALE_NONCE, outcome.getReason().orElseThrow());
                    })
                    .verifyComplete();
            assertEquals(BigInteger.valueOf(6), env.nonceOf(caller));
        }

        @Test
        @DisplayName("should reject a signature reused for another operation")
        void shouldRejectCrossOperationReuse() {
            // Given
            coordinator.execute(caller, DEPOSIT, List.of()).block();
            env.setNonce(caller, BigInteger.ZERO);

            // When
            IPrivilegedCallRequest forged = PrivilegedCallRequest.builder()
                    .message(acceptedRequest().getMessage())
                    .signature(acceptedRequest().getSignature())
                    .operationSignature(SET_PREMIUM)
                    .build();
            IAuthorizationOutcome outcome = coordinator.submit(forged).block();

            // Then
            assertNotNull(outcome);
            assertEquals(AuthorizationRejectionReason.SIGNATURE_MISMATCH, outcome.getReason().orElseThrow());
        }

        @Test
        @DisplayName("should reject a request whose signed fields were altered")
        void shouldRejectAlteredField() {
            // Given
            IAuthorizationMessage message = signer.createMessage(caller, DEPOSIT, BigInteger.ZERO,
                    START.plus(Duration.ofHours(1)).getEpochSecond());
            IAuthorizationMessage extended = AuthorizationMessage.builder()
                    .caller(caller)
                    .operationSelector(message.getOperationSelector())
                    .nonce(message.getNonce())
                    .deadline(message.getDeadline() + 3600)
                    .build();
            IPrivilegedCallRequest request = PrivilegedCallRequest.builder()
                    .message(extended)
                    .signature(signer.sign(message).block())
                    .operationSignature(DEPOSIT)
                    .build();

            // When
            IAuthorizationOutcome outcome = coordinator.submit(request).block();

            // Then
            assertNotNull(outcome);
            assertEquals(AuthorizationRejectionReason.SIGNATURE_MISMATCH, outcome.getReason().orElseThrow());
            assertEquals(BigInteger.ZERO, env.nonceOf(caller));
        }

        @Test
        @DisplayName("should reject an authorization past its deadline")
        void shouldRejectExpired() {
            // Given
            IAuthorizationMessage message = signer.createMessage(caller, DEPOSIT, BigInteger.ZERO,
                    START.plus(Duration.ofMinutes(10)).getEpochSecond());
            IPrivilegedCallRequest request = PrivilegedCallRequest.builder()
                    .message(message)
                    .signature(signer.sign(message).block())
                    .operationSignature(DEPOSIT)
                    .build();

            // When
            env.advanceTime(Duration.ofMinutes(11));
            IAuthorizationOutcome outcome = coordinator.submit(request).block();

            // Then
            assertNotNull(outcome);
            assertEquals(AuthorizationRejectionReason.EXPIRED_AUTHORIZATION, outcome.getReason().orElseThrow());
        }

        @Test
        @DisplayName("should reject a call signed by a key other than the authority")
        void shouldRejectWrongAuthority() {
            // Given
            Eip712AuthorizationSigner impostor = new Eip712AuthorizationSigner(domain, new LocalKeySigningAuthority(BigInteger.TWO));
            PrivilegedCallCoordinator impostorCoordinator = new PrivilegedCallCoordinator(impostor, env.serviceClient(),
                    MigrationConfig.defaultConfig(domain), env.clock());

            // When
            IAuthorizationOutcome outcome = impostorCoordinator.execute(caller, DEPOSIT, List.of()).block();

            // Then
            assertNotNull(outcome);
            assertEquals(AuthorizationRejectionReason.SIGNATURE_MISMATCH, outcome.getReason().orElseThrow());
            assertEquals(BigInteger.ZERO, env.nonceOf(caller));
        }

        @Test
        @DisplayName("should report SUBMISSION_FAILED when the service cannot be reached")
        void shouldReportSubmissionFailure() {
            env.failPrivilegedTransport(true);

            IAuthorizationOutcome outcome = coordinator.execute(caller, DEPOSIT, List.of()).block();

            assertNotNull(outcome);
            assertEquals(AuthorizationRejectionReason.SUBMISSION_FAILED, outcome.getReason().orElseThrow());
            assertEquals(List.of(AuthorizationState.CREATED, AuthorizationState.SIGNED,
                    AuthorizationState.SUBMITTED, AuthorizationState.REJECTED), outcome.getStateHistory());
        }
    }

    @Nested
    @DisplayName("Fail-fast Variant")
    class ExecuteOrThrowTests {

        @Test
        @DisplayName("should raise AuthorizationException carrying the rejection reason")
        void shouldRaiseOnRejection() {
            // Given
            Eip712AuthorizationSigner impostor = new Eip712AuthorizationSigner(domain, new LocalKeySigningAuthority(BigInteger.TEN));
            PrivilegedCallCoordinator impostorCoordinator = new PrivilegedCallCoordinator(impostor, env.serviceClient(),
                    MigrationConfig.defaultConfig(domain), env.clock());

            // When / Then
            StepVerifier.create(impostorCoordinator.executeOrThrow(caller, DEPOSIT, List.of()))
                    .expectErrorSatisfies(error -> {
                        AuthorizationException exception = assertInstanceOf(AuthorizationException.class, error);
                        assertEquals(AuthorizationRejectionReason.SIGNATURE_MISMATCH, exception.getReason());
                        assertTrue(exception.getMessage().contains(caller.toHex()));
                    })
                    .verify();
        }

        @Test
        @DisplayName("should pass accepted outcomes through")
        void shouldPassAccepted() {
            StepVerifier.create(coordinator.executeOrThrow(caller, DEPOSIT, List.of()))
                    .assertNext(outcome -> assertTrue(outcome.isAccepted()))
                    .verifyComplete();
        }
    }
}
