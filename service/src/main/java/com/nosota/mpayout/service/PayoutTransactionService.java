package com.nosota.mpayout.service;

import com.nosota.mpayout.api.model.PayoutStatus;
import com.nosota.mpayout.api.request.PayoutTransferRequest;
import com.nosota.mpayout.error.InsufficientFundsException;
import com.nosota.mpayout.error.PayoutTransactionNotFoundException;
import com.nosota.mpayout.error.WalletNotFoundException;
import com.nosota.mpayout.model.MerchantHierarchy;
import com.nosota.mpayout.model.PayoutTransaction;
import com.nosota.mpayout.pricing.ChargeQuote;
import com.nosota.mpayout.provider.ProviderStatus;
import com.nosota.mpayout.repository.MerchantHierarchyRepository;
import com.nosota.mpayout.repository.PayoutTransactionRepository;
import jakarta.persistence.EntityNotFoundException;
import jakarta.transaction.Transactional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Owns PayoutTransaction rows: creation together with the wallet reservation, and every status transition.
 *
 * <p>Each transition runs in its own database transaction on a row locked with PESSIMISTIC_WRITE and
 * re-checks the current status first, so the live request, reconciliation and provider callbacks can
 * race on the same transaction and still apply exactly one terminal transition and at most one refund.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PayoutTransactionService {

    static final Set<PayoutStatus> UNRESOLVED = EnumSet.of(PayoutStatus.PENDING, PayoutStatus.PROCESSING);

    private static final int MAX_LIST_LIMIT = 100;

    private final PayoutTransactionRepository payoutTransactionRepository;
    private final MerchantHierarchyRepository merchantHierarchyRepository;
    private final WalletLedgerGateway walletLedgerGateway;
    private final PayoutStatusStateMachine stateMachine;
    private final Clock clock;

    /**
     * Creates the transaction as PENDING, reserves amount + charge on the wallet and marks it PROCESSING,
     * all in one database transaction. Nothing is persisted when the reservation fails.
     *
     * @param request validated and normalized request
     * @return the committed PROCESSING transaction
     */
    @Transactional(rollbackOn = {InsufficientFundsException.class, WalletNotFoundException.class})
    public PayoutTransaction openAndReserve(Long merchantId, PayoutTransferRequest request, ChargeQuote quote,
                                            String clientRefId)
            throws InsufficientFundsException, WalletNotFoundException {

        LocalDateTime now = LocalDateTime.now(clock);
        Optional<MerchantHierarchy> hierarchy = merchantHierarchyRepository.findById(merchantId);

        PayoutTransaction tx = new PayoutTransaction();
        tx.setMerchantId(merchantId);
        tx.setDistributorId(hierarchy.map(MerchantHierarchy::getDistributorId).orElse(null));
        tx.setMasterDistributorId(hierarchy.map(MerchantHierarchy::getMasterDistributorId).orElse(null));
        tx.setAccountNumber(request.accountNumber());
        tx.setIfscCode(request.ifscCode());
        tx.setAccountHolderName(request.accountHolderName());
        tx.setBankId(request.bankId());
        tx.setBankName(request.bankName());
        tx.setBeneficiaryMobile(request.beneficiaryMobile());
        tx.setSenderName(request.senderName());
        tx.setSenderMobile(request.senderMobile());
        tx.setSenderEmail(request.senderEmail());
        tx.setTransferMode(request.transferMode());
        tx.setAmount(request.amount());
        tx.setCharge(quote.charge());
        tx.setTotalDebited(request.amount().add(quote.charge()).setScale(2, RoundingMode.HALF_UP));
        tx.setClientRefId(clientRefId);
        tx.setSchemeId(quote.schemeId());
        tx.setSchemeName(quote.schemeName());
        tx.setRemarks(request.remarks());
        tx.setStatus(PayoutStatus.PENDING);
        tx.setWalletDebited(false);
        tx.setCreatedAt(now);
        tx.setUpdatedAt(now);
        tx = payoutTransactionRepository.saveAndFlush(tx);

        Long debitEntryId = walletLedgerGateway.reserve(
                merchantId,
                tx.getId(),
                tx.getTotalDebited(),
                "Payout to " + AccountMasking.mask(tx.getAccountNumber()) + " via " + tx.getTransferMode(),
                clientRefId);

        stateMachine.validateTransition(tx.getStatus(), PayoutStatus.PROCESSING);
        tx.setWalletDebited(true);
        tx.setWalletDebitEntryId(debitEntryId);
        tx.setStatus(PayoutStatus.PROCESSING);
        tx.setUpdatedAt(LocalDateTime.now(clock));
        PayoutTransaction saved = payoutTransactionRepository.save(tx);

        log.info("Opened payout {}: merchantId={}, clientRefId={}, amount={}, charge={}, totalDebited={}, debitEntryId={}",
                saved.getId(), merchantId, clientRefId, saved.getAmount(), saved.getCharge(),
                saved.getTotalDebited(), debitEntryId);
        return saved;
    }

    /**
     * Provider accepted the transfer. The debit is committed; SUCCESS when the provider already reports it,
     * otherwise the transaction stays PROCESSING with the provider id stored for reconciliation.
     */
    @Transactional
    public PayoutTransaction markAccepted(UUID transactionId, String providerTransactionId,
                                          ProviderStatus providerStatus, String referenceNumber) {
        PayoutTransaction tx = lock(transactionId);
        if (tx.getStatus() != PayoutStatus.PROCESSING) {
            log.warn("Payout {} already {}, ignoring provider acceptance", transactionId, tx.getStatus());
            return tx;
        }

        tx.setProviderTransactionId(providerTransactionId);
        if (referenceNumber != null) {
            tx.setReferenceNumber(referenceNumber);
        }
        walletLedgerGateway.completeEntry(tx.getWalletDebitEntryId());

        if (providerStatus == ProviderStatus.SUCCESS) {
            transition(tx, PayoutStatus.SUCCESS, null);
        } else {
            tx.setUpdatedAt(LocalDateTime.now(clock));
        }
        PayoutTransaction saved = payoutTransactionRepository.save(tx);

        log.info("Payout {} accepted by provider: providerTransactionId={}, providerStatus={}, status={}",
                transactionId, providerTransactionId, providerStatus, saved.getStatus());
        return saved;
    }

    /**
     * Provider did not answer within the time budget. Funds are presumed committed: the debit entry is
     * completed, the transaction stays PROCESSING and nothing is refunded.
     */
    @Transactional
    public PayoutTransaction markAwaitingConfirmation(UUID transactionId, String message) {
        PayoutTransaction tx = lock(transactionId);
        if (tx.getStatus() != PayoutStatus.PROCESSING) {
            return tx;
        }

        walletLedgerGateway.completeEntry(tx.getWalletDebitEntryId());
        tx.setUpdatedAt(LocalDateTime.now(clock));
        PayoutTransaction saved = payoutTransactionRepository.save(tx);

        log.warn("Payout {} outcome unknown ({}), left PROCESSING for reconciliation", transactionId, message);
        return saved;
    }

    /**
     * Provider explicitly rejected the transfer: refund the full total, fail the debit entry and
     * mark the transaction FAILED with the reason.
     */
    @Transactional(rollbackOn = WalletNotFoundException.class)
    public PayoutTransaction failAndRefund(UUID transactionId, String reason) throws WalletNotFoundException {
        PayoutTransaction tx = lock(transactionId);
        if (stateMachine.isFinalState(tx.getStatus())) {
            log.warn("Payout {} already {}, not failing it", transactionId, tx.getStatus());
            return tx;
        }

        refundIfDebited(tx, "REFUND_" + tx.getClientRefId(), "Refund for failed payout: " + reason);
        transition(tx, PayoutStatus.FAILED, reason);
        PayoutTransaction saved = payoutTransactionRepository.save(tx);

        log.warn("Payout {} failed and refunded: reason={}, refunded={}", transactionId, reason, saved.getTotalDebited());
        return saved;
    }

    /**
     * Applies a status reported by the provider (status query or callback).
     *
     * @param providerTransactionId provider id to record when the transaction has none yet (callback), may be null
     */
    @Transactional(rollbackOn = WalletNotFoundException.class)
    public Resolution applyProviderStatus(UUID transactionId, ProviderStatus providerStatus, String operatorReference,
                                          String message, String providerTransactionId)
            throws WalletNotFoundException {
        PayoutTransaction tx = lock(transactionId);
        if (stateMachine.isFinalState(tx.getStatus())) {
            return Resolution.SKIPPED;
        }

        if (tx.getProviderTransactionId() == null && providerTransactionId != null) {
            tx.setProviderTransactionId(providerTransactionId);
        }
        if (operatorReference != null && !operatorReference.isBlank()) {
            tx.setReferenceNumber(operatorReference);
        }

        Resolution resolution;
        switch (providerStatus) {
            case SUCCESS -> {
                if (tx.getWalletDebitEntryId() != null) {
                    walletLedgerGateway.completeEntry(tx.getWalletDebitEntryId());
                }
                transition(tx, PayoutStatus.SUCCESS, null);
                resolution = Resolution.UPDATED;
            }
            case FAILED -> {
                String reason = message != null && !message.isBlank() ? message : "Transfer failed at provider";
                boolean refunded = refundIfDebited(tx, "REFUND_" + tx.getClientRefId(),
                        "Refund for failed payout: " + reason);
                transition(tx, PayoutStatus.FAILED, reason);
                resolution = refunded ? Resolution.REFUNDED : Resolution.UPDATED;
            }
            default -> {
                tx.setUpdatedAt(LocalDateTime.now(clock));
                resolution = Resolution.UNCHANGED;
            }
        }
        payoutTransactionRepository.save(tx);

        log.info("Applied provider status to payout {}: providerStatus={}, status={}, resolution={}",
                transactionId, providerStatus, tx.getStatus(), resolution);
        return resolution;
    }

    /**
     * Refunds a transaction the provider never acknowledged (no provider id) and marks it REFUNDED.
     * A transaction that was never debited is marked FAILED instead.
     */
    @Transactional(rollbackOn = WalletNotFoundException.class)
    public Resolution autoRefund(UUID transactionId, long ageHours) throws WalletNotFoundException {
        PayoutTransaction tx = lock(transactionId);
        if (stateMachine.isFinalState(tx.getStatus()) || tx.getProviderTransactionId() != null) {
            return Resolution.SKIPPED;
        }

        if (!tx.isWalletDebited()) {
            transition(tx, PayoutStatus.FAILED, "Wallet was never debited");
            payoutTransactionRepository.save(tx);
            log.warn("Payout {} was never debited, marked FAILED", transactionId);
            return Resolution.UPDATED;
        }

        String reason = "Auto-refunded: No provider response after " + ageHours + " hours";
        refundIfDebited(tx, "REFUND_TIMEOUT_" + tx.getClientRefId(), reason);
        transition(tx, PayoutStatus.REFUNDED, reason);
        payoutTransactionRepository.save(tx);

        log.warn("Payout {} auto-refunded after {} hours without provider acknowledgement: amount={}",
                transactionId, ageHours, tx.getTotalDebited());
        return Resolution.REFUNDED;
    }

    // ==================== Queries ====================

    public PayoutTransaction getForMerchant(Long merchantId, UUID transactionId)
            throws PayoutTransactionNotFoundException {
        return payoutTransactionRepository.findById(transactionId)
                .filter(tx -> tx.getMerchantId().equals(merchantId))
                .orElseThrow(() -> new PayoutTransactionNotFoundException(
                        "Payout transaction " + transactionId + " not found"));
    }

    public PayoutTransaction getForMerchantByClientRef(Long merchantId, String clientRefId)
            throws PayoutTransactionNotFoundException {
        return payoutTransactionRepository.findByClientRefId(clientRefId)
                .filter(tx -> tx.getMerchantId().equals(merchantId))
                .orElseThrow(() -> new PayoutTransactionNotFoundException(
                        "Payout transaction with client reference " + clientRefId + " not found"));
    }

    public Optional<PayoutTransaction> findByClientRefId(String clientRefId) {
        return payoutTransactionRepository.findByClientRefId(clientRefId);
    }

    public PayoutTransaction getById(UUID transactionId) {
        return payoutTransactionRepository.findById(transactionId)
                .orElseThrow(() -> new EntityNotFoundException("Payout transaction " + transactionId + " not found"));
    }

    /**
     * Most recent transactions of a merchant, newest first. Limit is clamped to 1..100.
     */
    public List<PayoutTransaction> listRecent(Long merchantId, int limit) {
        int size = Math.max(1, Math.min(limit, MAX_LIST_LIMIT));
        return payoutTransactionRepository.findByMerchantIdOrderByCreatedAtDesc(merchantId, PageRequest.of(0, size));
    }

    public long countPending(Long merchantId) {
        return payoutTransactionRepository.countByMerchantIdAndStatusIn(merchantId, UNRESOLVED);
    }

    // ==================== Internals ====================

    private PayoutTransaction lock(UUID transactionId) {
        return payoutTransactionRepository.getOneForUpdate(transactionId)
                .orElseThrow(() -> new EntityNotFoundException("Payout transaction " + transactionId + " not found"));
    }

    private boolean refundIfDebited(PayoutTransaction tx, String reference, String description)
            throws WalletNotFoundException {
        if (!tx.isWalletDebited()) {
            return false;
        }
        walletLedgerGateway.refund(tx.getMerchantId(), tx.getId(), tx.getTotalDebited(), description, reference);
        if (tx.getWalletDebitEntryId() != null) {
            walletLedgerGateway.failEntry(tx.getWalletDebitEntryId());
        }
        return true;
    }

    private void transition(PayoutTransaction tx, PayoutStatus target, String failureReason) {
        stateMachine.validateTransition(tx.getStatus(), target);
        LocalDateTime now = LocalDateTime.now(clock);
        tx.setStatus(target);
        if (failureReason != null) {
            tx.setFailureReason(failureReason);
        }
        tx.setUpdatedAt(now);
        if (target.isFinal()) {
            tx.setCompletedAt(now);
        }
    }
}
