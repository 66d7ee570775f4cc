package com.nosota.mpayout.service;

import com.nosota.mpayout.api.model.PayoutStatus;
import com.nosota.mpayout.api.model.TransferMode;
import com.nosota.mpayout.api.request.PayoutTransferRequest;
import com.nosota.mpayout.error.InsufficientFundsException;
import com.nosota.mpayout.error.PayoutTransactionNotFoundException;
import com.nosota.mpayout.model.MerchantHierarchy;
import com.nosota.mpayout.model.PayoutTransaction;
import com.nosota.mpayout.pricing.ChargeQuote;
import com.nosota.mpayout.provider.ProviderStatus;
import com.nosota.mpayout.repository.MerchantHierarchyRepository;
import com.nosota.mpayout.repository.PayoutTransactionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.PageRequest;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.AdditionalAnswers.returnsFirstArg;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("PayoutTransactionService")
class PayoutTransactionServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);
    private static final Long MERCHANT = 42L;

    @Mock
    private PayoutTransactionRepository payoutTransactionRepository;
    @Mock
    private MerchantHierarchyRepository merchantHierarchyRepository;
    @Mock
    private WalletLedgerGateway walletLedgerGateway;

    private PayoutTransactionService service;

    @BeforeEach
    void setUp() {
        service = new PayoutTransactionService(payoutTransactionRepository, merchantHierarchyRepository,
                walletLedgerGateway, new PayoutStatusStateMachine(), CLOCK);
    }

    static PayoutTransaction processing() {
        PayoutTransaction tx = new PayoutTransaction();
        tx.setId(UUID.randomUUID());
        tx.setMerchantId(MERCHANT);
        tx.setClientRefId("PAY-42-1-ABCDEF");
        tx.setAccountNumber("123456789012");
        tx.setAmount(new BigDecimal("500.00"));
        tx.setCharge(new BigDecimal("5.00"));
        tx.setTotalDebited(new BigDecimal("505.00"));
        tx.setStatus(PayoutStatus.PROCESSING);
        tx.setWalletDebited(true);
        tx.setWalletDebitEntryId(77L);
        tx.setCreatedAt(LocalDateTime.now(CLOCK).minusMinutes(10));
        return tx;
    }

    private void locked(PayoutTransaction tx) {
        when(payoutTransactionRepository.getOneForUpdate(tx.getId())).thenReturn(Optional.of(tx));
    }

    private void saves() {
        when(payoutTransactionRepository.save(any(PayoutTransaction.class))).then(returnsFirstArg());
    }

    @Nested
    @DisplayName("openAndReserve")
    class OpenAndReserve {

        private final PayoutTransferRequest request = new PayoutTransferRequest("123456789012", "SBIN0001234",
                "Asha Rao", 7, "State Bank of India", "9123456780", "Kiran Stores", "9876543210", null,
                new BigDecimal("500.00"), TransferMode.IMPS, null, null);
        private final ChargeQuote quote = new ChargeQuote(new BigDecimal("5.00"), UUID.randomUUID(), "Gold", "test");

        @Test
        @DisplayName("persists, reserves amount + charge and moves to PROCESSING")
        void reservesAndMovesToProcessing() throws Exception {
            UUID id = UUID.randomUUID();
            when(merchantHierarchyRepository.findById(MERCHANT))
                    .thenReturn(Optional.of(new MerchantHierarchy(MERCHANT, 5L, 3L)));
            when(payoutTransactionRepository.saveAndFlush(any(PayoutTransaction.class))).thenAnswer(inv -> {
                PayoutTransaction tx = inv.getArgument(0);
                assertThat(tx.getStatus()).isEqualTo(PayoutStatus.PENDING);
                tx.setId(id);
                return tx;
            });
            when(walletLedgerGateway.reserve(eq(MERCHANT), eq(id), eq(new BigDecimal("505.00")), anyString(),
                    eq("PAY-42-1-ABCDEF"))).thenReturn(99L);
            saves();

            PayoutTransaction tx = service.openAndReserve(MERCHANT, request, quote, "PAY-42-1-ABCDEF");

            assertThat(tx.getStatus()).isEqualTo(PayoutStatus.PROCESSING);
            assertThat(tx.getTotalDebited()).isEqualByComparingTo("505.00");
            assertThat(tx.isWalletDebited()).isTrue();
            assertThat(tx.getWalletDebitEntryId()).isEqualTo(99L);
            assertThat(tx.getDistributorId()).isEqualTo(5L);
            assertThat(tx.getMasterDistributorId()).isEqualTo(3L);
            assertThat(tx.getSchemeName()).isEqualTo("Gold");
        }

        @Test
        @DisplayName("insufficient funds propagate without moving the transaction")
        void insufficientFunds() throws Exception {
            when(merchantHierarchyRepository.findById(MERCHANT)).thenReturn(Optional.empty());
            when(payoutTransactionRepository.saveAndFlush(any(PayoutTransaction.class))).then(returnsFirstArg());
            when(walletLedgerGateway.reserve(any(), any(), any(), anyString(), anyString()))
                    .thenThrow(new InsufficientFundsException("low", new BigDecimal("10"), new BigDecimal("505")));

            assertThatThrownBy(() -> service.openAndReserve(MERCHANT, request, quote, "PAY-42-1-ABCDEF"))
                    .isInstanceOf(InsufficientFundsException.class);
            verify(payoutTransactionRepository, never()).save(any());
        }
    }

    @Nested
    @DisplayName("markAccepted")
    class MarkAccepted {

        @Test
        void successCompletesEntryAndTransaction() {
            PayoutTransaction tx = processing();
            locked(tx);
            saves();

            PayoutTransaction result = service.markAccepted(tx.getId(), "EP123", ProviderStatus.SUCCESS, "RRN1");

            assertThat(result.getStatus()).isEqualTo(PayoutStatus.SUCCESS);
            assertThat(result.getProviderTransactionId()).isEqualTo("EP123");
            assertThat(result.getReferenceNumber()).isEqualTo("RRN1");
            assertThat(result.getCompletedAt()).isNotNull();
            verify(walletLedgerGateway).completeEntry(77L);
        }

        @Test
        @DisplayName("pending provider status keeps PROCESSING with the provider id")
        void pendingStaysProcessing() {
            PayoutTransaction tx = processing();
            locked(tx);
            saves();

            PayoutTransaction result = service.markAccepted(tx.getId(), "EP123", ProviderStatus.PENDING, null);

            assertThat(result.getStatus()).isEqualTo(PayoutStatus.PROCESSING);
            assertThat(result.getProviderTransactionId()).isEqualTo("EP123");
            assertThat(result.getCompletedAt()).isNull();
        }
    }

    @Test
    @DisplayName("timeout completes the debit and refunds nothing")
    void awaitingConfirmation() throws Exception {
        PayoutTransaction tx = processing();
        locked(tx);
        saves();

        PayoutTransaction result = service.markAwaitingConfirmation(tx.getId(), "Request timeout");

        assertThat(result.getStatus()).isEqualTo(PayoutStatus.PROCESSING);
        verify(walletLedgerGateway).completeEntry(77L);
        verify(walletLedgerGateway, never()).refund(any(), any(), any(), any(), any());
    }

    @Nested
    @DisplayName("failAndRefund")
    class FailAndRefund {

        @Test
        void refundsFullTotalAndFails() throws Exception {
            PayoutTransaction tx = processing();
            locked(tx);
            saves();

            PayoutTransaction result = service.failAndRefund(tx.getId(), "Invalid account");

            assertThat(result.getStatus()).isEqualTo(PayoutStatus.FAILED);
            assertThat(result.getFailureReason()).isEqualTo("Invalid account");
            verify(walletLedgerGateway).refund(eq(MERCHANT), eq(tx.getId()), eq(new BigDecimal("505.00")),
                    anyString(), eq("REFUND_PAY-42-1-ABCDEF"));
            verify(walletLedgerGateway).failEntry(77L);
        }

        @Test
        @DisplayName("a final transaction is left alone")
        void finalTransactionSkipped() throws Exception {
            PayoutTransaction tx = processing();
            tx.setStatus(PayoutStatus.SUCCESS);
            locked(tx);

            PayoutTransaction result = service.failAndRefund(tx.getId(), "late rejection");

            assertThat(result.getStatus()).isEqualTo(PayoutStatus.SUCCESS);
            verifyNoInteractions(walletLedgerGateway);
        }
    }

    @Nested
    @DisplayName("applyProviderStatus")
    class ApplyProviderStatus {

        @Test
        void successUpdatesWithoutRefund() throws Exception {
            PayoutTransaction tx = processing();
            tx.setProviderTransactionId("EP123");
            locked(tx);
            saves();

            Resolution resolution = service.applyProviderStatus(tx.getId(), ProviderStatus.SUCCESS, "RRN9", "ok", null);

            assertThat(resolution).isEqualTo(Resolution.UPDATED);
            assertThat(tx.getStatus()).isEqualTo(PayoutStatus.SUCCESS);
            assertThat(tx.getReferenceNumber()).isEqualTo("RRN9");
            verify(walletLedgerGateway, never()).refund(any(), any(), any(), any(), any());
        }

        @Test
        void failedRefunds() throws Exception {
            PayoutTransaction tx = processing();
            tx.setProviderTransactionId("EP123");
            locked(tx);
            saves();

            Resolution resolution = service.applyProviderStatus(tx.getId(), ProviderStatus.FAILED, null,
                    "Beneficiary bank offline", null);

            assertThat(resolution).isEqualTo(Resolution.REFUNDED);
            assertThat(tx.getStatus()).isEqualTo(PayoutStatus.FAILED);
            assertThat(tx.getFailureReason()).isEqualTo("Beneficiary bank offline");
            verify(walletLedgerGateway).refund(eq(MERCHANT), eq(tx.getId()), eq(new BigDecimal("505.00")),
                    anyString(), eq("REFUND_PAY-42-1-ABCDEF"));
        }

        @Test
        void pendingLeavesStatus() throws Exception {
            PayoutTransaction tx = processing();
            locked(tx);
            saves();

            Resolution resolution = service.applyProviderStatus(tx.getId(), ProviderStatus.PENDING, null, null, "EP9");

            assertThat(resolution).isEqualTo(Resolution.UNCHANGED);
            assertThat(tx.getStatus()).isEqualTo(PayoutStatus.PROCESSING);
            assertThat(tx.getProviderTransactionId()).isEqualTo("EP9");
        }

        @Test
        @DisplayName("already final: skipped, no second refund")
        void finalSkipped() throws Exception {
            PayoutTransaction tx = processing();
            tx.setStatus(PayoutStatus.FAILED);
            locked(tx);

            Resolution resolution = service.applyProviderStatus(tx.getId(), ProviderStatus.FAILED, null, null, null);

            assertThat(resolution).isEqualTo(Resolution.SKIPPED);
            verifyNoInteractions(walletLedgerGateway);
        }
    }

    @Nested
    @DisplayName("autoRefund")
    class AutoRefund {

        @Test
        void refundsAndMarksRefunded() throws Exception {
            PayoutTransaction tx = processing();
            locked(tx);
            saves();

            Resolution resolution = service.autoRefund(tx.getId(), 50);

            assertThat(resolution).isEqualTo(Resolution.REFUNDED);
            assertThat(tx.getStatus()).isEqualTo(PayoutStatus.REFUNDED);
            assertThat(tx.getFailureReason()).isEqualTo("Auto-refunded: No provider response after 50 hours");
            verify(walletLedgerGateway).refund(eq(MERCHANT), eq(tx.getId()), eq(new BigDecimal("505.00")),
                    anyString(), eq("REFUND_TIMEOUT_PAY-42-1-ABCDEF"));
        }

        @Test
        @DisplayName("acknowledged transactions are never auto-refunded")
        void acknowledgedSkipped() throws Exception {
            PayoutTransaction tx = processing();
            tx.setProviderTransactionId("EP123");
            locked(tx);

            assertThat(service.autoRefund(tx.getId(), 50)).isEqualTo(Resolution.SKIPPED);
            verify(walletLedgerGateway, never()).refund(any(), any(), any(), any(), any());
        }

        @Test
        @DisplayName("never debited: FAILED without refund")
        void neverDebited() throws Exception {
            PayoutTransaction tx = processing();
            tx.setStatus(PayoutStatus.PENDING);
            tx.setWalletDebited(false);
            tx.setWalletDebitEntryId(null);
            locked(tx);
            saves();

            assertThat(service.autoRefund(tx.getId(), 50)).isEqualTo(Resolution.UPDATED);
            assertThat(tx.getStatus()).isEqualTo(PayoutStatus.FAILED);
            verifyNoInteractions(walletLedgerGateway);
        }
    }

    @Test
    void listLimitIsCapped() {
        service.listRecent(MERCHANT, 500);
        verify(payoutTransactionRepository).findByMerchantIdOrderByCreatedAtDesc(eq(MERCHANT),
                eq(PageRequest.of(0, 100)));
    }

    @Test
    void transactionOfAnotherMerchantIsNotFound() {
        PayoutTransaction tx = processing();
        when(payoutTransactionRepository.findById(tx.getId())).thenReturn(Optional.of(tx));

        assertThatThrownBy(() -> service.getForMerchant(99L, tx.getId()))
                .isInstanceOf(PayoutTransactionNotFoundException.class);
    }
}
