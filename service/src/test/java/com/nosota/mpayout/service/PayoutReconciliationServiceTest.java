package com.nosota.mpayout.service;

import com.nosota.mpayout.api.dto.ReconciliationItemDTO;
import com.nosota.mpayout.api.model.PayoutStatus;
import com.nosota.mpayout.api.request.ProviderCallbackRequest;
import com.nosota.mpayout.dto.ReconciliationScope;
import com.nosota.mpayout.dto.ReconciliationSummary;
import com.nosota.mpayout.error.PayoutTransactionNotFoundException;
import com.nosota.mpayout.model.PayoutTransaction;
import com.nosota.mpayout.provider.PayoutProvider;
import com.nosota.mpayout.provider.ProviderStatus;
import com.nosota.mpayout.provider.StatusCheckResult;
import com.nosota.mpayout.repository.PayoutTransactionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.PageRequest;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("PayoutReconciliationService")
class PayoutReconciliationServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);
    private static final LocalDateTime NOW = LocalDateTime.now(CLOCK);
    private static final LocalDateTime CUTOFF = NOW.minusMinutes(5);
    private static final PageRequest BATCH = PageRequest.of(0, 50);

    @Mock
    private PayoutTransactionRepository payoutTransactionRepository;
    @Mock
    private PayoutTransactionService payoutTransactionService;
    @Mock
    private PayoutProvider payoutProvider;

    private PayoutReconciliationService service;

    @BeforeEach
    void setUp() {
        service = new PayoutReconciliationService(payoutTransactionRepository, payoutTransactionService,
                payoutProvider, CLOCK);
        ReflectionTestUtils.setField(service, "staleMinutes", 5L);
        ReflectionTestUtils.setField(service, "autoRefundHours", 48L);
        ReflectionTestUtils.setField(service, "batchSize", 50);
    }

    private static PayoutTransaction stale(String providerTransactionId, long ageHours) {
        PayoutTransaction tx = new PayoutTransaction();
        tx.setId(UUID.randomUUID());
        tx.setMerchantId(42L);
        tx.setClientRefId("PAY-42-" + ageHours);
        tx.setStatus(PayoutStatus.PROCESSING);
        tx.setProviderTransactionId(providerTransactionId);
        tx.setWalletDebited(true);
        tx.setCreatedAt(NOW.minusHours(ageHours).minusMinutes(10));
        return tx;
    }

    private static PayoutTransaction withStatus(PayoutTransaction tx, PayoutStatus status) {
        PayoutTransaction copy = new PayoutTransaction();
        copy.setId(tx.getId());
        copy.setStatus(status);
        return copy;
    }

    private void selectAll(PayoutTransaction... candidates) {
        when(payoutTransactionRepository.findByStatusInAndCreatedAtBeforeOrderByCreatedAtAsc(
                PayoutTransactionService.UNRESOLVED, CUTOFF, BATCH)).thenReturn(List.of(candidates));
    }

    @Nested
    @DisplayName("with a provider transaction id")
    class WithProviderId {

        @Test
        @DisplayName("provider success resolves the transaction")
        void success() throws Exception {
            PayoutTransaction tx = stale("EP1", 1);
            selectAll(tx);
            when(payoutProvider.getStatus("EP1")).thenReturn(StatusCheckResult.of(ProviderStatus.SUCCESS, "RRN1", "ok"));
            when(payoutTransactionService.applyProviderStatus(tx.getId(), ProviderStatus.SUCCESS, "RRN1", "ok", null))
                    .thenReturn(Resolution.UPDATED);
            when(payoutTransactionService.getById(tx.getId())).thenReturn(withStatus(tx, PayoutStatus.SUCCESS));

            ReconciliationSummary summary = service.reconcile(ReconciliationScope.all());

            assertThat(summary.checked()).isEqualTo(1);
            assertThat(summary.resolved()).isEqualTo(1);
            assertThat(summary.results()).containsExactly(new ReconciliationItemDTO(tx.getId(),
                    PayoutStatus.PROCESSING, PayoutStatus.SUCCESS, "status_updated"));
        }

        @Test
        @DisplayName("provider failure refunds")
        void failure() throws Exception {
            PayoutTransaction tx = stale("EP2", 1);
            selectAll(tx);
            when(payoutProvider.getStatus("EP2")).thenReturn(StatusCheckResult.of(ProviderStatus.FAILED, null, "bank down"));
            when(payoutTransactionService.applyProviderStatus(tx.getId(), ProviderStatus.FAILED, null, "bank down", null))
                    .thenReturn(Resolution.REFUNDED);
            when(payoutTransactionService.getById(tx.getId())).thenReturn(withStatus(tx, PayoutStatus.FAILED));

            ReconciliationSummary summary = service.reconcile(ReconciliationScope.all());

            assertThat(summary.refunded()).isEqualTo(1);
            assertThat(summary.results().get(0).action()).isEqualTo("refunded");
            assertThat(summary.results().get(0).newStatus()).isEqualTo(PayoutStatus.FAILED);
        }

        @Test
        @DisplayName("provider still pending")
        void pending() throws Exception {
            PayoutTransaction tx = stale("EP3", 1);
            selectAll(tx);
            when(payoutProvider.getStatus("EP3")).thenReturn(StatusCheckResult.of(ProviderStatus.PENDING, null, null));
            when(payoutTransactionService.applyProviderStatus(tx.getId(), ProviderStatus.PENDING, null, null, null))
                    .thenReturn(Resolution.UNCHANGED);

            ReconciliationSummary summary = service.reconcile(ReconciliationScope.all());

            assertThat(summary.stillPending()).isEqualTo(1);
            assertThat(summary.results().get(0).action()).isEqualTo("still_pending");
            verify(payoutTransactionService, never()).getById(any());
        }

        @Test
        @DisplayName("status check failure leaves the transaction alone")
        void checkFailed() throws Exception {
            PayoutTransaction tx = stale("EP4", 1);
            selectAll(tx);
            when(payoutProvider.getStatus("EP4")).thenReturn(StatusCheckResult.error("HTTP 502"));

            ReconciliationSummary summary = service.reconcile(ReconciliationScope.all());

            assertThat(summary.stillPending()).isEqualTo(1);
            assertThat(summary.results().get(0).action()).isEqualTo("provider_check_failed");
            verify(payoutTransactionService, never()).applyProviderStatus(any(), any(), any(), any(), any());
        }

        @Test
        @DisplayName("transaction finalized concurrently is skipped and not counted")
        void skipped() throws Exception {
            PayoutTransaction tx = stale("EP5", 1);
            selectAll(tx);
            when(payoutProvider.getStatus("EP5")).thenReturn(StatusCheckResult.of(ProviderStatus.FAILED, null, null));
            when(payoutTransactionService.applyProviderStatus(tx.getId(), ProviderStatus.FAILED, null, null, null))
                    .thenReturn(Resolution.SKIPPED);
            when(payoutTransactionService.getById(tx.getId())).thenReturn(withStatus(tx, PayoutStatus.FAILED));

            ReconciliationSummary summary = service.reconcile(ReconciliationScope.all());

            assertThat(summary.checked()).isEqualTo(1);
            assertThat(summary.resolved() + summary.refunded() + summary.stillPending()).isZero();
            assertThat(summary.results().get(0).action()).isEqualTo("skipped");
        }
    }

    @Nested
    @DisplayName("without a provider transaction id")
    class WithoutProviderId {

        @Test
        @DisplayName("older than the auto-refund threshold is refunded")
        void autoRefund() throws Exception {
            PayoutTransaction tx = stale(null, 50);
            selectAll(tx);
            when(payoutTransactionService.autoRefund(tx.getId(), 50)).thenReturn(Resolution.REFUNDED);
            when(payoutTransactionService.getById(tx.getId())).thenReturn(withStatus(tx, PayoutStatus.REFUNDED));

            ReconciliationSummary summary = service.reconcile(ReconciliationScope.all());

            assertThat(summary.refunded()).isEqualTo(1);
            assertThat(summary.results()).containsExactly(new ReconciliationItemDTO(tx.getId(),
                    PayoutStatus.PROCESSING, PayoutStatus.REFUNDED, "auto_refunded"));
            verifyNoInteractions(payoutProvider);
        }

        @Test
        @DisplayName("younger than the threshold waits")
        void tooYoung() throws Exception {
            PayoutTransaction tx = stale(null, 10);
            selectAll(tx);

            ReconciliationSummary summary = service.reconcile(ReconciliationScope.all());

            assertThat(summary.stillPending()).isEqualTo(1);
            assertThat(summary.results().get(0).action()).isEqualTo("still_pending");
            verify(payoutTransactionService, never()).autoRefund(any(), anyLong());
        }
    }

    @Test
    @DisplayName("an error on one transaction does not stop the run")
    void errorIsolation() throws Exception {
        PayoutTransaction broken = stale("EP6", 1);
        PayoutTransaction healthy = stale(null, 60);
        selectAll(broken, healthy);
        when(payoutProvider.getStatus("EP6")).thenReturn(StatusCheckResult.of(ProviderStatus.SUCCESS, null, null));
        when(payoutTransactionService.applyProviderStatus(broken.getId(), ProviderStatus.SUCCESS, null, null, null))
                .thenThrow(new IllegalStateException("lock timeout"));
        when(payoutTransactionService.autoRefund(healthy.getId(), 60)).thenReturn(Resolution.REFUNDED);
        when(payoutTransactionService.getById(healthy.getId())).thenReturn(withStatus(healthy, PayoutStatus.REFUNDED));

        ReconciliationSummary summary = service.reconcile(ReconciliationScope.all());

        assertThat(summary.checked()).isEqualTo(2);
        assertThat(summary.refunded()).isEqualTo(1);
        assertThat(summary.results()).extracting(ReconciliationItemDTO::action)
                .containsExactly("error", "auto_refunded");
    }

    @Test
    @DisplayName("nothing stale yields an empty summary")
    void nothingToDo() {
        selectAll();

        ReconciliationSummary summary = service.reconcile(ReconciliationScope.all());

        assertThat(summary.checked()).isZero();
        assertThat(summary.results()).isEmpty();
    }

    @Test
    @DisplayName("merchant scope only selects that merchant's transactions")
    void merchantScope() {
        when(payoutTransactionRepository.findByMerchantIdAndStatusInAndCreatedAtBeforeOrderByCreatedAtAsc(
                42L, PayoutTransactionService.UNRESOLVED, CUTOFF, BATCH)).thenReturn(List.of());

        service.reconcile(new ReconciliationScope(42L, null));

        verify(payoutTransactionRepository, never()).findByStatusInAndCreatedAtBeforeOrderByCreatedAtAsc(
                any(), any(), any());
    }

    @Nested
    @DisplayName("provider callback")
    class Callback {

        @Test
        @DisplayName("applies the mapped status to the referenced transaction")
        void applied() throws Exception {
            PayoutTransaction tx = stale("EP7", 0);
            when(payoutTransactionService.findByClientRefId("ORDER-1")).thenReturn(Optional.of(tx));
            when(payoutTransactionService.applyProviderStatus(tx.getId(), ProviderStatus.SUCCESS, "RRN9", "done", "EP7"))
                    .thenReturn(Resolution.UPDATED);

            Resolution resolution = service.applyCallback(
                    new ProviderCallbackRequest("ORDER-1", "EP7", "2", "RRN9", "done"));

            assertThat(resolution).isEqualTo(Resolution.UPDATED);
        }

        @Test
        @DisplayName("a failure is applied once the provider confirms it")
        void confirmedFailure() throws Exception {
            PayoutTransaction tx = stale("EP5", 0);
            when(payoutTransactionService.findByClientRefId("ORDER-2")).thenReturn(Optional.of(tx));
            when(payoutProvider.getStatus("EP5")).thenReturn(StatusCheckResult.of(ProviderStatus.FAILED, null, "closed"));
            when(payoutTransactionService.applyProviderStatus(tx.getId(), ProviderStatus.FAILED, null,
                    "Account closed", "EP5")).thenReturn(Resolution.REFUNDED);

            Resolution resolution = service.applyCallback(
                    new ProviderCallbackRequest("ORDER-2", "EP5", "failed", null, "Account closed"));

            assertThat(resolution).isEqualTo(Resolution.REFUNDED);
        }

        @Test
        @DisplayName("a failure the provider reports as settled applies the settled status")
        void contradictedFailure() throws Exception {
            PayoutTransaction tx = stale("EP1001", 0);
            when(payoutTransactionService.findByClientRefId("PAY-42")).thenReturn(Optional.of(tx));
            when(payoutProvider.getStatus("EP1001")).thenReturn(StatusCheckResult.of(ProviderStatus.SUCCESS, "RRN1", "ok"));
            when(payoutTransactionService.applyProviderStatus(tx.getId(), ProviderStatus.SUCCESS, "RRN1", "ok", "EP1001"))
                    .thenReturn(Resolution.UPDATED);

            Resolution resolution = service.applyCallback(
                    new ProviderCallbackRequest("PAY-42", "EP1001", "failed", null, "forged"));

            assertThat(resolution).isEqualTo(Resolution.UPDATED);
            verify(payoutTransactionService, never()).applyProviderStatus(any(), eq(ProviderStatus.FAILED),
                    any(), any(), any());
        }

        @Test
        @DisplayName("a failure that cannot be confirmed is left for reconciliation")
        void unconfirmedFailure() throws Exception {
            PayoutTransaction tx = stale("EP6", 0);
            when(payoutTransactionService.findByClientRefId("ORDER-3")).thenReturn(Optional.of(tx));
            when(payoutProvider.getStatus("EP6")).thenReturn(StatusCheckResult.error("HTTP 502"));

            Resolution resolution = service.applyCallback(
                    new ProviderCallbackRequest("ORDER-3", "EP6", "0", null, "failed"));

            assertThat(resolution).isEqualTo(Resolution.UNCHANGED);
            verify(payoutTransactionService, never()).applyProviderStatus(any(), any(), any(), any(), any());
        }

        @Test
        @DisplayName("a failure without any provider id is not applied")
        void failureWithoutProviderId() throws Exception {
            PayoutTransaction tx = stale(null, 0);
            when(payoutTransactionService.findByClientRefId("ORDER-4")).thenReturn(Optional.of(tx));

            Resolution resolution = service.applyCallback(
                    new ProviderCallbackRequest("ORDER-4", null, "failed", null, null));

            assertThat(resolution).isEqualTo(Resolution.UNCHANGED);
            verifyNoInteractions(payoutProvider);
            verify(payoutTransactionService, never()).applyProviderStatus(any(), any(), any(), any(), any());
        }

        @Test
        @DisplayName("unknown reference")
        void unknown() {
            when(payoutTransactionService.findByClientRefId("ORDER-X")).thenReturn(Optional.empty());

            assertThatThrownBy(() -> service.applyCallback(
                    new ProviderCallbackRequest("ORDER-X", null, "0", null, null)))
                    .isInstanceOf(PayoutTransactionNotFoundException.class);
        }
    }

    @Nested
    @DisplayName("status refresh")
    class Refresh {

        @Test
        @DisplayName("without a provider id returns the stored transaction")
        void noProviderId() {
            PayoutTransaction tx = stale(null, 0);

            assertThat(service.refreshStatus(tx)).isSameAs(tx);
            verifyNoInteractions(payoutProvider, payoutTransactionService);
        }

        @Test
        @DisplayName("adopts a final provider status")
        void adopts() throws Exception {
            PayoutTransaction tx = stale("EP8", 0);
            PayoutTransaction refreshed = withStatus(tx, PayoutStatus.SUCCESS);
            when(payoutProvider.getStatus("EP8")).thenReturn(StatusCheckResult.of(ProviderStatus.SUCCESS, "RRN8", null));
            when(payoutTransactionService.applyProviderStatus(eq(tx.getId()), eq(ProviderStatus.SUCCESS), eq("RRN8"),
                    any(), any())).thenReturn(Resolution.UPDATED);
            when(payoutTransactionService.getById(tx.getId())).thenReturn(refreshed);

            assertThat(service.refreshStatus(tx).getStatus()).isEqualTo(PayoutStatus.SUCCESS);
        }

        @Test
        @DisplayName("provider exception keeps the stored state")
        void providerThrows() {
            PayoutTransaction tx = stale("EP9", 0);
            when(payoutProvider.getStatus("EP9")).thenThrow(new IllegalStateException("boom"));

            assertThat(service.refreshStatus(tx)).isSameAs(tx);
        }
    }
}
