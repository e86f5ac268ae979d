package com.givebridge.payment.saga;

import com.givebridge.payment.config.PaymentSagaProperties;
import com.givebridge.payment.entity.PaymentMethod;
import com.givebridge.payment.entity.PaymentStatus;
import com.givebridge.payment.entity.PaymentTransaction;
import com.givebridge.payment.gateway.ChargeRequest;
import com.givebridge.payment.gateway.ChargeResult;
import com.givebridge.payment.gateway.PaymentDetails;
import com.givebridge.payment.gateway.PaymentGatewayClient;
import com.givebridge.payment.gateway.RefundResult;
import com.givebridge.payment.lock.InMemoryLockStore;
import com.givebridge.payment.lock.MutableClock;
import com.givebridge.payment.lock.SagaLockService;
import com.givebridge.payment.service.DonationConfirmationService;
import com.givebridge.payment.service.TransactionReferenceGenerator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.willAnswer;
import static org.mockito.BDDMockito.willThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class PaymentSagaOrchestratorTest {

    private static final String REF = "TXN-PAY-20240301-1A2B3C4D";
    private static final String GATEWAY_REF = "pi_0123456789abcdef01234567";
    private static final Long DONATION_ID = 42L;
    private static final BigDecimal AMOUNT = new BigDecimal("25.00");
    private static final BigDecimal FEE = new BigDecimal("1.03");
    private static final String LOCK_KEY = SagaLockService.lockKey(DONATION_ID, PaymentMethod.CREDIT_CARD, AMOUNT);

    @Mock
    private PaymentGatewayClient gatewayClient;

    @Mock
    private PaymentSagaRecorder recorder;

    @Mock
    private DonationConfirmationService confirmationService;

    @Mock
    private TransactionReferenceGenerator referenceGenerator;

    private MutableClock clock;
    private InMemoryLockStore lockStore;
    private SagaLockService lockService;
    private PaymentSagaProperties properties;
    private PaymentSagaOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-03-01T12:00:00Z"));
        lockStore = new InMemoryLockStore(clock);
        lockService = new SagaLockService(lockStore, clock);
        properties = new PaymentSagaProperties();
        properties.setLockWait(Duration.ZERO);
        orchestrator = orchestratorWith(new SyncTaskExecutor());
    }

    private PaymentSagaOrchestrator orchestratorWith(TaskExecutor executor) {
        return new PaymentSagaOrchestrator(lockService, gatewayClient, recorder, confirmationService,
                referenceGenerator, properties, executor);
    }

    private static PaymentRequest request() {
        return new PaymentRequest(DONATION_ID, 7L, AMOUNT, "USD", "Jamie Doe", "jamie@example.org",
                PaymentMethod.CREDIT_CARD, PaymentDetails.empty());
    }

    private static ChargeResult captured() {
        return ChargeResult.succeeded("Stripe", GATEWAY_REF, FEE, Map.of("gateway", "Stripe", "last4", "4242"));
    }

    private void givenCharged() {
        given(referenceGenerator.nextTransactionRef()).willReturn(REF);
        given(gatewayClient.charge(any())).willReturn(captured());
    }

    @Test
    @DisplayName("confirmed payment completes with ledger entries and releases the lock")
    void execute_success() {
        givenCharged();
        given(confirmationService.confirm(DONATION_ID, REF, "Completed")).willReturn(true);

        PaymentSagaResult result = orchestrator.execute(request());

        assertThat(result.status()).isEqualTo(PaymentStatus.COMPLETED);
        assertThat(result.transactionRef()).isEqualTo(REF);
        InOrder order = inOrder(recorder, gatewayClient, confirmationService);
        order.verify(recorder).createPending(any(), eq(REF), anyString());
        order.verify(gatewayClient).charge(any());
        order.verify(recorder).recordCharge(REF, captured());
        order.verify(recorder).writeLedgerEntries(REF, captured().metadata());
        order.verify(confirmationService).confirm(DONATION_ID, REF, "Completed");
        order.verify(recorder).complete(REF);
        verify(gatewayClient, never()).refund(anyString(), any(), anyString());
        assertThat(lockStore.isLocked(LOCK_KEY)).isFalse();
    }

    @Test
    @DisplayName("charge uses the transaction reference as idempotency key")
    void execute_idempotencyKey() {
        givenCharged();
        given(confirmationService.confirm(DONATION_ID, REF, "Completed")).willReturn(true);

        orchestrator.execute(request());

        ArgumentCaptor<ChargeRequest> captor = ArgumentCaptor.forClass(ChargeRequest.class);
        verify(gatewayClient).charge(captor.capture());
        assertThat(captor.getValue().idempotencyKey()).isEqualTo(REF);
        assertThat(captor.getValue().amount()).isEqualByComparingTo(AMOUNT);
    }

    @Test
    @DisplayName("declined charge fails the payment without confirming the donation")
    void execute_declined() {
        given(referenceGenerator.nextTransactionRef()).willReturn(REF);
        ChargeResult declined = ChargeResult.declined("Stripe", GATEWAY_REF, "Insufficient funds");
        given(gatewayClient.charge(any())).willReturn(declined);

        PaymentSagaResult result = orchestrator.execute(request());

        assertThat(result.status()).isEqualTo(PaymentStatus.FAILED);
        assertThat(result.failureReason()).isEqualTo("Insufficient funds");
        verify(recorder).recordGatewayDecline(REF, declined);
        verifyNoInteractions(confirmationService);
        verify(recorder, never()).writeLedgerEntries(anyString(), any());
        assertThat(lockStore.isLocked(LOCK_KEY)).isFalse();
    }

    @Test
    @DisplayName("gateway exception is recorded as a decline")
    void execute_gatewayThrows() {
        given(referenceGenerator.nextTransactionRef()).willReturn(REF);
        given(gatewayClient.charge(any())).willThrow(new IllegalStateException("connect timed out"));
        given(gatewayClient.gatewayName(PaymentMethod.CREDIT_CARD)).willReturn("Stripe");

        PaymentSagaResult result = orchestrator.execute(request());

        assertThat(result.status()).isEqualTo(PaymentStatus.FAILED);
        assertThat(result.failureReason()).isEqualTo("Gateway error: connect timed out");
        verify(recorder).recordGatewayDecline(eq(REF), any());
        assertThat(lockStore.isLocked(LOCK_KEY)).isFalse();
    }

    @Nested
    @DisplayName("compensation")
    class Compensation {

        @Test
        @DisplayName("unconfirmed donation is refunded in full and never completed")
        void confirmationRejected_refunds() {
            givenCharged();
            given(confirmationService.confirm(DONATION_ID, REF, "Completed")).willReturn(false);
            RefundResult refund = RefundResult.succeeded("rf_abc", AMOUNT);
            given(gatewayClient.refund(GATEWAY_REF, AMOUNT, PaymentSagaOrchestrator.CONFIRMATION_REFUND_REASON))
                    .willReturn(refund);

            PaymentSagaResult result = orchestrator.execute(request());

            assertThat(result.status()).isEqualTo(PaymentStatus.REFUNDED);
            assertThat(result.failureReason()).isEqualTo(PaymentSagaOrchestrator.CONFIRMATION_FAILED_REASON);
            verify(recorder).recordCompensation(REF, captured(), refund,
                    PaymentSagaOrchestrator.CONFIRMATION_REFUND_REASON,
                    PaymentSagaOrchestrator.CONFIRMATION_FAILED_REASON);
            verify(recorder, never()).complete(anyString());
            assertThat(lockStore.isLocked(LOCK_KEY)).isFalse();
        }

        @Test
        @DisplayName("confirmation error counts as not confirmed")
        void confirmationThrows_refunds() {
            givenCharged();
            given(confirmationService.confirm(DONATION_ID, REF, "Completed"))
                    .willThrow(new IllegalStateException("503"));
            given(gatewayClient.refund(anyString(), any(), anyString()))
                    .willReturn(RefundResult.succeeded("rf_abc", AMOUNT));

            PaymentSagaResult result = orchestrator.execute(request());

            assertThat(result.status()).isEqualTo(PaymentStatus.REFUNDED);
            verify(recorder, never()).complete(anyString());
        }

        @Test
        @DisplayName("rejected refund fails the payment with the refund error")
        void refundRejected_fails() {
            givenCharged();
            given(confirmationService.confirm(DONATION_ID, REF, "Completed")).willReturn(false);
            given(gatewayClient.refund(anyString(), any(), anyString()))
                    .willReturn(RefundResult.failed("already refunded"));

            PaymentSagaResult result = orchestrator.execute(request());

            assertThat(result.status()).isEqualTo(PaymentStatus.FAILED);
            assertThat(result.failureReason()).isEqualTo("Compensation refund failed: already refunded");
            verify(recorder).markFailed(REF, "Compensation refund failed: already refunded");
            verify(recorder, never()).recordCompensation(anyString(), any(), any(), anyString(), anyString());
            assertThat(lockStore.isLocked(LOCK_KEY)).isFalse();
        }

        @Test
        @DisplayName("ledger write failure after the charge refunds without asking for confirmation")
        void ledgerFailure_refunds() {
            givenCharged();
            willThrow(new IllegalStateException("db down")).given(recorder).writeLedgerEntries(eq(REF), any());
            given(gatewayClient.refund(GATEWAY_REF, AMOUNT, PaymentSagaOrchestrator.POST_CHARGE_REFUND_REASON))
                    .willReturn(RefundResult.succeeded("rf_abc", AMOUNT));

            PaymentSagaResult result = orchestrator.execute(request());

            assertThat(result.status()).isEqualTo(PaymentStatus.REFUNDED);
            assertThat(result.failureReason()).isEqualTo("Ledger write failed: db down");
            verifyNoInteractions(confirmationService);
        }

        @Test
        @DisplayName("unexpected error after the charge still refunds once")
        void completeThrows_refunds() {
            givenCharged();
            given(confirmationService.confirm(DONATION_ID, REF, "Completed")).willReturn(true);
            willThrow(new IllegalStateException("optimistic lock")).given(recorder).complete(REF);
            given(gatewayClient.refund(GATEWAY_REF, AMOUNT, PaymentSagaOrchestrator.POST_CHARGE_REFUND_REASON))
                    .willReturn(RefundResult.succeeded("rf_abc", AMOUNT));

            PaymentSagaResult result = orchestrator.execute(request());

            assertThat(result.status()).isEqualTo(PaymentStatus.REFUNDED);
            assertThat(result.failureReason()).isEqualTo("Saga execution failed: optimistic lock");
            verify(gatewayClient).refund(anyString(), any(), anyString());
            assertThat(lockStore.isLocked(LOCK_KEY)).isFalse();
        }
    }

    @Nested
    @DisplayName("locking")
    class Locking {

        @Test
        @DisplayName("contended lock is reported as duplicate and writes nothing")
        void duplicate_writesNothing() {
            lockStore.tryAcquire(LOCK_KEY, "saga:other:token:x", Duration.ofMinutes(15));

            PaymentSagaResult result = orchestrator.execute(request());

            assertThat(result.duplicate()).isTrue();
            assertThat(result.transactionRef()).isNull();
            assertThat(result.failureReason()).isEqualTo(PaymentSagaOrchestrator.DUPLICATE_REASON);
            verifyNoInteractions(recorder, gatewayClient, referenceGenerator);
            assertThat(lockStore.isHeldBy(LOCK_KEY, "saga:other:token:x")).isTrue();
        }

        @Test
        @DisplayName("lock lost before the charge fails the payment without calling the gateway")
        void lockExpired_beforeCharge() {
            given(referenceGenerator.nextTransactionRef()).willReturn(REF);
            willAnswer(invocation -> {
                clock.advance(properties.getLockTtl().plusSeconds(1));
                return null;
            }).given(recorder).createPending(any(), eq(REF), anyString());

            PaymentSagaResult result = orchestrator.execute(request());

            assertThat(result.status()).isEqualTo(PaymentStatus.FAILED);
            assertThat(result.failureReason()).isEqualTo(PaymentSagaOrchestrator.LOCK_EXPIRED_REASON);
            verify(recorder).markFailed(REF, PaymentSagaOrchestrator.LOCK_EXPIRED_REASON);
            verifyNoInteractions(gatewayClient);
        }

        @Test
        @DisplayName("failure to create the row releases the lock")
        void createPendingFails_releases() {
            given(referenceGenerator.nextTransactionRef()).willReturn(REF);
            willThrow(new IllegalStateException("db down")).given(recorder).createPending(any(), eq(REF), anyString());

            PaymentSagaResult result = orchestrator.execute(request());

            assertThat(result.status()).isEqualTo(PaymentStatus.FAILED);
            assertThat(result.transactionRef()).isNull();
            assertThat(lockStore.isLocked(LOCK_KEY)).isFalse();
        }

        @Test
        @DisplayName("unexpected error before the charge fails the payment and releases the lock")
        void errorBeforeCharge_releases() {
            given(referenceGenerator.nextTransactionRef()).willReturn(REF);
            given(gatewayClient.charge(any())).willReturn(ChargeResult.declined("Stripe", null, "Card declined"));
            willThrow(new IllegalStateException("db down")).given(recorder).recordGatewayDecline(eq(REF), any());

            PaymentSagaResult result = orchestrator.execute(request());

            assertThat(result.status()).isEqualTo(PaymentStatus.FAILED);
            assertThat(result.failureReason()).isEqualTo("Saga execution failed: db down");
            verify(recorder).markFailed(REF, "Saga execution failed: db down");
            verify(gatewayClient, never()).refund(anyString(), any(), anyString());
            assertThat(lockStore.isLocked(LOCK_KEY)).isFalse();
        }

        @Test
        @DisplayName("two identical payments in flight at once: one completes, the other is a duplicate")
        void concurrentIdenticalRequests_oneWins() throws Exception {
            CountDownLatch charging = new CountDownLatch(1);
            CountDownLatch gatewayReply = new CountDownLatch(1);
            given(referenceGenerator.nextTransactionRef()).willReturn(REF);
            given(gatewayClient.charge(any())).willAnswer(invocation -> {
                charging.countDown();
                gatewayReply.await(5, TimeUnit.SECONDS);
                return captured();
            });
            given(confirmationService.confirm(DONATION_ID, REF, "Completed")).willReturn(true);
            ExecutorService callers = Executors.newFixedThreadPool(2);
            try {
                Future<PaymentSagaResult> first = callers.submit(() -> orchestrator.execute(request()));
                assertThat(charging.await(5, TimeUnit.SECONDS)).isTrue();

                Future<PaymentSagaResult> second = callers.submit(() -> orchestrator.execute(request()));
                PaymentSagaResult rejected = second.get(5, TimeUnit.SECONDS);
                gatewayReply.countDown();
                PaymentSagaResult completed = first.get(5, TimeUnit.SECONDS);

                assertThat(rejected.duplicate()).isTrue();
                assertThat(rejected.failureReason()).isEqualTo(PaymentSagaOrchestrator.DUPLICATE_REASON);
                assertThat(completed.status()).isEqualTo(PaymentStatus.COMPLETED);
                assertThat(completed.transactionRef()).isEqualTo(REF);
                verify(recorder, times(1)).createPending(any(), anyString(), anyString());
                verify(gatewayClient, times(1)).charge(any());
                verify(referenceGenerator, times(1)).nextTransactionRef();
                assertThat(lockStore.isLocked(LOCK_KEY)).isFalse();
            } finally {
                gatewayReply.countDown();
                callers.shutdownNow();
            }
        }

        @Test
        @DisplayName("a second identical request after completion gets its own saga")
        void sequentialRequests_bothRun() {
            given(referenceGenerator.nextTransactionRef()).willReturn(REF, "TXN-PAY-20240301-5E6F7A8B");
            given(gatewayClient.charge(any())).willReturn(captured());
            given(confirmationService.confirm(eq(DONATION_ID), anyString(), eq("Completed"))).willReturn(true);

            assertThat(orchestrator.execute(request()).status()).isEqualTo(PaymentStatus.COMPLETED);
            assertThat(orchestrator.execute(request()).status()).isEqualTo(PaymentStatus.COMPLETED);
        }
    }

    @Nested
    @DisplayName("asynchronous start")
    class Start {

        @Test
        @DisplayName("start reports PROCESSING and the saga runs on the executor")
        void start_accepted() {
            givenCharged();
            given(confirmationService.confirm(DONATION_ID, REF, "Completed")).willReturn(true);

            PaymentSagaResult result = orchestrator.start(request());

            assertThat(result.isAccepted()).isTrue();
            assertThat(result.transactionRef()).isEqualTo(REF);
            verify(recorder).complete(REF);
            assertThat(lockStore.isLocked(LOCK_KEY)).isFalse();
        }

        @Test
        @DisplayName("saturated executor fails the payment and releases the lock")
        void start_rejected() {
            given(referenceGenerator.nextTransactionRef()).willReturn(REF);
            TaskExecutor saturated = task -> {
                throw new TaskRejectedException("queue full");
            };

            PaymentSagaResult result = orchestratorWith(saturated).start(request());

            assertThat(result.status()).isEqualTo(PaymentStatus.FAILED);
            assertThat(result.failureReason()).isEqualTo(PaymentSagaOrchestrator.CAPACITY_REASON);
            verify(recorder).markFailed(REF, PaymentSagaOrchestrator.CAPACITY_REASON);
            verifyNoInteractions(gatewayClient);
            assertThat(lockStore.isLocked(LOCK_KEY)).isFalse();
        }
    }

    @Nested
    @DisplayName("recovery")
    class Recovery {

        private PaymentTransaction pending() {
            return PaymentTransaction.builder()
                    .transactionRef(REF)
                    .donationId(DONATION_ID)
                    .campaignId(7L)
                    .amount(AMOUNT)
                    .currency("USD")
                    .donorName("Jamie Doe")
                    .donorEmail("jamie@example.org")
                    .paymentMethod(PaymentMethod.CREDIT_CARD)
                    .sagaId("saga-crashed")
                    .build();
        }

        private PaymentTransaction charged() {
            PaymentTransaction transaction = pending();
            transaction.recordCharge("Stripe", GATEWAY_REF, FEE, LocalDateTime.of(2024, 3, 1, 11, 0));
            return transaction;
        }

        @Test
        @DisplayName("charged saga resumes with the ledger and confirmation")
        void recover_charged() {
            PaymentTransaction stale = charged();
            given(recorder.load(REF)).willReturn(stale);
            given(confirmationService.confirm(DONATION_ID, REF, "Completed")).willReturn(true);

            Optional<PaymentSagaResult> result = orchestrator.recover(stale);

            assertThat(result).hasValueSatisfying(r -> assertThat(r.status()).isEqualTo(PaymentStatus.COMPLETED));
            verify(recorder).writeLedgerEntries(REF, Map.of());
            verify(recorder).complete(REF);
            verify(gatewayClient, never()).charge(any());
            assertThat(lockStore.isLocked(LOCK_KEY)).isFalse();
        }

        @Test
        @DisplayName("charged saga that cannot be confirmed is refunded")
        void recover_chargedUnconfirmed() {
            PaymentTransaction stale = charged();
            given(recorder.load(REF)).willReturn(stale);
            given(confirmationService.confirm(DONATION_ID, REF, "Completed")).willReturn(false);
            given(gatewayClient.refund(GATEWAY_REF, AMOUNT, PaymentSagaOrchestrator.CONFIRMATION_REFUND_REASON))
                    .willReturn(RefundResult.succeeded("rf_abc", AMOUNT));

            Optional<PaymentSagaResult> result = orchestrator.recover(stale);

            assertThat(result).hasValueSatisfying(r -> assertThat(r.status()).isEqualTo(PaymentStatus.REFUNDED));
        }

        @Test
        @DisplayName("saga interrupted before the gateway outcome is failed")
        void recover_uncharged() {
            PaymentTransaction stale = pending();
            given(recorder.load(REF)).willReturn(stale);

            Optional<PaymentSagaResult> result = orchestrator.recover(stale);

            assertThat(result).hasValueSatisfying(r -> {
                assertThat(r.status()).isEqualTo(PaymentStatus.FAILED);
                assertThat(r.failureReason()).isEqualTo(PaymentSagaOrchestrator.INTERRUPTED_REASON);
            });
            verify(recorder).markFailed(REF, PaymentSagaOrchestrator.INTERRUPTED_REASON);
            verifyNoInteractions(gatewayClient);
        }

        @Test
        @DisplayName("saga whose lock is still held is left alone")
        void recover_stillLocked() {
            lockStore.tryAcquire(LOCK_KEY, "saga:live:token:x", Duration.ofMinutes(15));

            Optional<PaymentSagaResult> result = orchestrator.recover(pending());

            assertThat(result).isEmpty();
            verifyNoInteractions(recorder);
        }

        @Test
        @DisplayName("row finished in the meantime is not touched")
        void recover_alreadyTerminal() {
            PaymentTransaction finished = charged();
            finished.complete(LocalDateTime.of(2024, 3, 1, 11, 1));
            given(recorder.load(REF)).willReturn(finished);

            Optional<PaymentSagaResult> result = orchestrator.recover(pending());

            assertThat(result).isEmpty();
            verify(recorder, never()).markFailed(anyString(), anyString());
            assertThat(lockStore.isLocked(LOCK_KEY)).isFalse();
        }
    }
}
